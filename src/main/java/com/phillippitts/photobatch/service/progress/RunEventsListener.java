package com.phillippitts.photobatch.service.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Default consumer of the run channels: writes them to the application log.
 */
@Component
class RunEventsListener {
    private static final Logger LOG = LogManager.getLogger(RunEventsListener.class);

    @EventListener
    void onLog(RunLogEvent e) {
        if (e.warning()) {
            LOG.warn(e.message());
        } else {
            LOG.info(e.message());
        }
    }

    @EventListener
    void onProgress(RunProgressEvent e) {
        LOG.debug("Progress {}/{}", e.processed(), e.total());
    }
}
