package com.phillippitts.capturesync.config.session;

import com.phillippitts.capturesync.service.capture.CaptureEngine;
import com.phillippitts.capturesync.service.ledger.DirectoryPreparer;
import com.phillippitts.capturesync.service.orchestration.DefaultSessionCoordinator;
import com.phillippitts.capturesync.service.orchestration.SessionCoordinator;
import com.phillippitts.capturesync.service.upload.UploadDispatcherFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the session coordinator explicitly so the dispatcher executor is selected by name.
 */
@Configuration
public class SessionConfig {

    @Bean
    public SessionCoordinator sessionCoordinator(SessionProperties sessionProperties,
                                                 DirectoryPreparer directoryPreparer,
                                                 CaptureEngine captureEngine,
                                                 UploadDispatcherFactory dispatcherFactory,
                                                 @Qualifier("dispatcherExecutor") Executor dispatcherExecutor) {
        return new DefaultSessionCoordinator(sessionProperties, directoryPreparer, captureEngine,
                dispatcherFactory, dispatcherExecutor);
    }
}
