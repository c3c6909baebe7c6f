package com.sailfish.servicekit.log;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Slf4jLogTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger("servicekit.test.log");
        logger.setLevel(ch.qos.logback.classic.Level.TRACE);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private List<String> messages() {
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    @Test
    void rendersMessageWithKeyValues() {
        Log log = LogBuilder.builder().withLogger(logger).build();

        log.info("Order accepted", "orderId", 42, "region", "eu");

        assertThat(messages()).containsExactly("Order accepted orderId=42 region=eu");
        assertThat(appender.list.get(0).getLevel()).isEqualTo(ch.qos.logback.classic.Level.INFO);
    }

    @Test
    void boundFieldsComeFirstAndAccumulate() {
        Log log = LogBuilder.builder()
                .withConfiguration(new LogConfiguration().addFields("service", "orders"))
                .withLogger(logger)
                .build();

        Log child = log.with("request", "r-1").with("user", "u-7");
        child.warn("Slow request", "ms", 1200);
        log.warn("Unrelated");

        assertThat(messages()).containsExactly(
                "Slow request service=orders request=r-1 user=u-7 ms=1200",
                "Unrelated service=orders");
    }

    @Test
    void oddTrailingKeyIsMarkedMissing() {
        Log log = LogBuilder.builder().withLogger(logger).build();

        log.error("Dangling", "orphan");

        assertThat(messages()).containsExactly("Dangling orphan=<missing>");
    }

    @Test
    void oddBoundFieldsDoNotShiftLaterPairs() {
        Log log = LogBuilder.builder()
                .withConfiguration(new LogConfiguration().addFields("service"))
                .withLogger(logger)
                .build();

        log.with("orphan").with("request", "r-1").info("m");

        assertThat(messages()).containsExactly("m service=<missing> orphan=<missing> request=r-1");
    }

    @Test
    void levelThresholdFiltersEntries() {
        Log log = LogBuilder.builder().withLogger(logger).withLevel(Level.WARN).build();

        log.debug("hidden");
        log.info("hidden too");
        log.warn("shown");

        assertThat(messages()).containsExactly("shown");
        assertThat(log.isEnabled(Level.INFO)).isFalse();
        assertThat(log.isEnabled(Level.ERROR)).isTrue();
    }

    @Test
    void configuredNameSelectsLogger() {
        Log log = LogBuilder.builder()
                .withConfiguration(new LogConfiguration().setName("servicekit.test.log").setLevel(Level.DEBUG))
                .build();

        log.debug("via name");

        assertThat(messages()).containsExactly("via name");
    }

    @Test
    void errorKeepsThrowable() {
        Log log = LogBuilder.builder().withLogger(logger).build();

        log.error("Publish failed", new IllegalStateException("boom"), "task", "t-1");

        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getFormattedMessage()).isEqualTo("Publish failed task=t-1");
        assertThat(event.getThrowableProxy().getMessage()).isEqualTo("boom");
    }

    @Test
    void placeholdersInMessagesAreNotInterpreted() {
        Log log = LogBuilder.builder().withLogger(logger).build();

        log.info("literal {} braces", "k", "v");

        assertThat(messages()).containsExactly("literal {} braces k=v");
    }

    @Test
    void configurationRejectsBlankName() {
        assertThatThrownBy(() -> new LogConfiguration().setName(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
