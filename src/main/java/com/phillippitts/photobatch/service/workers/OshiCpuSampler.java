package com.phillippitts.photobatch.service.workers;

import com.phillippitts.photobatch.exception.CpuSampleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;

import java.time.Duration;

/**
 * {@link CpuSampler} backed by OSHI tick counters.
 */
@Component
public class OshiCpuSampler implements CpuSampler {

    private static final Logger LOG = LogManager.getLogger(OshiCpuSampler.class);

    private final CentralProcessor processor;

    public OshiCpuSampler() {
        this(new SystemInfo().getHardware().getProcessor());
    }

    OshiCpuSampler(CentralProcessor processor) {
        this.processor = processor;
    }

    @Override
    public double samplePercent(Duration window) {
        try {
            long[] before = processor.getSystemCpuLoadTicks();
            Thread.sleep(Math.max(1, window.toMillis()));
            double load = processor.getSystemCpuLoadBetweenTicks(before);
            if (Double.isNaN(load) || load < 0) {
                throw new CpuSampleException("Invalid CPU load sample: " + load);
            }
            return Math.min(100.0, load * 100.0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CpuSampleException("Interrupted while sampling CPU load", e);
        } catch (CpuSampleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CpuSampleException("CPU load unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public int physicalCores() {
        try {
            int cores = processor.getPhysicalProcessorCount();
            if (cores > 0) {
                return cores;
            }
        } catch (RuntimeException e) {
            LOG.debug("Physical core count unavailable: {}", e.getMessage());
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
