package com.phillippitts.capturesync;

import com.phillippitts.capturesync.config.capture.FfmpegCaptureProperties;
import com.phillippitts.capturesync.config.session.SessionProperties;
import com.phillippitts.capturesync.config.upload.S3UploadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SessionProperties.class,
        FfmpegCaptureProperties.class,
        S3UploadProperties.class
})
@EnableScheduling
public class CaptureSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaptureSyncApplication.class, args);
    }

}
