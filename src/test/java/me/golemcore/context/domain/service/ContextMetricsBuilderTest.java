package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.BudgetScope;
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.ContextItem;
import me.golemcore.context.domain.model.ContextMetrics;
import me.golemcore.context.domain.model.DomainBudget;
import me.golemcore.context.domain.model.DomainMetrics;
import me.golemcore.context.domain.model.ExclusionReason;
import me.golemcore.context.domain.model.ExclusionReasonType;
import me.golemcore.context.domain.model.MemoryCandidate;
import me.golemcore.context.domain.model.MemorySource;
import me.golemcore.context.domain.model.MemoryType;
import me.golemcore.context.domain.model.PriorityTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextMetricsBuilderTest {

    private ContextMetricsBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ContextMetricsBuilder();
    }

    @Test
    void shouldAggregateGlobalAndPerDomainMetrics() {
        List<ContextItem> included = List.of(
                item("p1", ContextDomain.PERSONAL, 80, 70, 500),
                item("p2", ContextDomain.PERSONAL, 61, 61, 250),
                item("h1", ContextDomain.HEALTH, 50, 60, 250));
        List<ExclusionReason> excluded = List.of(
                exclusion("h2", ContextDomain.HEALTH, ExclusionReasonType.SENSITIVE_DOMAIN_PROTECTION),
                exclusion("n1", ContextDomain.NOTES, ExclusionReasonType.BELOW_RELEVANCE_THRESHOLD),
                exclusion("n2", ContextDomain.NOTES, ExclusionReasonType.BELOW_RELEVANCE_THRESHOLD));

        ContextMetrics metrics = builder.build(included, excluded, ContextBudgetConfig.defaults(), 0.75, 3L);

        assertEquals(1000, metrics.totalChars());
        assertEquals(3, metrics.totalItems());
        assertEquals(0.1, metrics.budgetUtilization(), 1e-9);
        assertEquals(0.75, metrics.diversityScore());
        assertEquals(3, metrics.excludedCount());
        assertEquals(63.67, metrics.avgRelevanceScore());
        assertEquals(63.67, metrics.avgConfidenceScore());
        assertEquals(3L, metrics.processingTimeMs());

        DomainMetrics personal = metrics.domainUsage().get(ContextDomain.PERSONAL);
        assertEquals(2, personal.itemCount());
        assertEquals(750, personal.charCount());
        assertEquals(2.0 / 15.0, personal.budgetUtilization(), 1e-9);
        assertEquals(0, personal.excludedCount());

        DomainMetrics notes = metrics.domainUsage().get(ContextDomain.NOTES);
        assertEquals(0, notes.itemCount());
        assertEquals(2, notes.excludedCount());
    }

    @Test
    void shouldReportEveryDomain() {
        ContextMetrics metrics = builder.build(List.of(), List.of(), ContextBudgetConfig.defaults(), 1.0, 0L);

        assertEquals(ContextDomain.values().length, metrics.domainUsage().size());
        assertEquals(0.0, metrics.avgRelevanceScore());
        assertEquals(0.0, metrics.avgConfidenceScore());
        assertTrue(metrics.exclusionSummary().isEmpty());
    }

    @Test
    void shouldReportZeroUtilizationForZeroCaps() {
        ContextBudgetConfig config = ContextBudgetConfig.defaults().toBuilder()
                .totalBudgetChars(0)
                .domainBudgets(Map.of(ContextDomain.CONVERSATION, new DomainBudget(0, 0, 0, 0)))
                .build();

        ContextMetrics metrics = builder.build(List.of(item("c1", ContextDomain.CONVERSATION, 10, 10, 5)), List.of(),
                config, 1.0, 0L);

        assertEquals(0.0, metrics.budgetUtilization());
        assertEquals(0.0, metrics.domainUsage().get(ContextDomain.CONVERSATION).budgetUtilization());
    }

    @Test
    void shouldSummarizeExclusionsInDeclarationOrder() {
        Map<ExclusionReasonType, Integer> summary = builder.summarizeExclusions(List.of(
                exclusion("a", ContextDomain.NOTES, ExclusionReasonType.REDUNDANT_CONTENT),
                exclusion("b", ContextDomain.NOTES, ExclusionReasonType.DOMAIN_CAP_EXCEEDED),
                exclusion("c", ContextDomain.NOTES, ExclusionReasonType.REDUNDANT_CONTENT)));

        assertEquals(List.of(ExclusionReasonType.DOMAIN_CAP_EXCEEDED, ExclusionReasonType.REDUNDANT_CONTENT),
                List.copyOf(summary.keySet()));
        assertEquals(2, summary.get(ExclusionReasonType.REDUNDANT_CONTENT));
        assertEquals(1, summary.get(ExclusionReasonType.DOMAIN_CAP_EXCEEDED));
    }

    private ContextItem item(String id, ContextDomain domain, int relevance, int confidence, int chars) {
        MemoryCandidate candidate = MemoryCandidate.builder()
                .id(id)
                .domain(domain)
                .content("x".repeat(chars))
                .importance(relevance)
                .occurredAt(Instant.parse("2026-03-01T12:00:00Z"))
                .source(MemorySource.TEXT)
                .build();
        return ContextItem.builder()
                .candidate(candidate)
                .relevanceScore(relevance)
                .confidenceScore(confidence)
                .priorityTier(PriorityTier.RELEVANT)
                .memoryType(MemoryType.LONG_TERM)
                .charCount(chars)
                .build();
    }

    private ExclusionReason exclusion(String id, ContextDomain domain, ExclusionReasonType type) {
        return ExclusionReason.builder()
                .itemId(id)
                .domain(domain)
                .reason(type)
                .explanation("test")
                .scope(BudgetScope.DOMAIN)
                .build();
    }
}
