package com.phillippitts.photobatch;

import com.phillippitts.photobatch.config.raw.RawDecoderConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RawDecoderConfig.class)
public class PhotoBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoBatchApplication.class, args);
    }

}
