package com.phillippitts.capturesync.logging;

import com.phillippitts.capturesync.config.IntegrationTestConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.util.ReadOnlyStringMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Validates that request-scoped MDC values reach log events emitted while handling
 * {@code POST /api/recording/stop}.
 */
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "capture.session.data-dir=${java.io.tmpdir}/capturesync-logging-it"
)
class LoggingFormatIntegrationTest {

    private static final String CONTROLLER_LOGGER =
            "com.phillippitts.capturesync.presentation.controller.RecordingController";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(CONTROLLER_LOGGER);
        appender = new InMemoryAppender("test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void shouldIncludeRequestIdAndUserIdInStructuredLogs() {
        String requestId = "abc123";
        String userId = "demo";

        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", requestId);
        headers.add("X-User-ID", userId);

        ResponseEntity<Void> response = restTemplate.exchange(
                "http://localhost:" + port + "/api/recording/stop",
                HttpMethod.POST,
                new HttpEntity<>(headers),
                Void.class
        );

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);

        await().atMost(3, SECONDS).until(() -> findStopEvent() != null);

        LogEvent event = findStopEvent();
        ReadOnlyStringMap contextData = event.getContextData();
        assertThat(contextData).isNotNull();
        assertEquals(requestId, contextData.getValue("requestId"));
        assertEquals(userId, contextData.getValue("userId"));
        assertEquals("POST", contextData.getValue("method"));
        assertThat(event.getLoggerName()).isEqualTo(CONTROLLER_LOGGER);
    }

    private LogEvent findStopEvent() {
        return appender.getEvents().stream()
                .filter(e -> e.getMessage() != null
                        && String.valueOf(e.getMessage().getFormattedMessage()).contains("Stop requested"))
                .findFirst()
                .orElse(null);
    }

    /**
     * Simple in-memory Log4j2 appender that captures LogEvents for assertions.
     */
    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return Collections.unmodifiableList(events);
        }
    }
}
