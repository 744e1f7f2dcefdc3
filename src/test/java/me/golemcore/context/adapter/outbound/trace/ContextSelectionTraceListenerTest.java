package me.golemcore.context.adapter.outbound.trace;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextMetrics;
import me.golemcore.context.domain.model.ContextSelectedEvent;
import me.golemcore.context.domain.model.ExclusionReasonType;
import me.golemcore.context.domain.service.ContextMetricsBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextSelectionTraceListenerTest {

    private ContextSelectionTraceListener listener;
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        listener = new ContextSelectionTraceListener();
        logger = (Logger) LoggerFactory.getLogger(ContextSelectionTraceListener.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void shouldEmitMetricLinesPerSelectionAndReason() {
        ContextMetrics metrics = new ContextMetricsBuilder().build(List.of(), List.of(),
                ContextBudgetConfig.defaults(), 1.0, 0L);
        Map<ExclusionReasonType, Integer> summary = Map.of(ExclusionReasonType.REDUNDANT_CONTENT, 2);

        listener.onContextSelected(new ContextSelectedEvent("turn-1", "user-1", "tenant-1", metrics, summary));

        List<String> lines = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertEquals(5, lines.size());
        assertTrue(lines.stream().allMatch(line -> line.startsWith("[ContextMetrics] metric=")));
        assertTrue(lines.contains(
                "[ContextMetrics] metric=context.exclusions.count value=2 reason=redundant_content turn=turn-1"));
        assertTrue(lines.contains("[ContextMetrics] metric=context.diversity.score value=1.000 turn=turn-1"));
    }

    @Test
    void shouldIgnoreEventWithoutMetrics() {
        assertDoesNotThrow(() -> listener.onContextSelected(
                new ContextSelectedEvent("turn-1", "user-1", "tenant-1", null, null)));
        assertTrue(appender.list.isEmpty());
    }
}
