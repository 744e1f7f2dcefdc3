package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.DomainBudget;
import me.golemcore.context.domain.model.MemoryType;
import me.golemcore.context.domain.model.RelevanceDecay;
import me.golemcore.context.domain.model.SaturationThresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextBudgetConfigValidatorTest {

    private ContextBudgetConfigValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ContextBudgetConfigValidator();
    }

    @Test
    void shouldAcceptDefaults() {
        assertDoesNotThrow(() -> validator.validate(ContextBudgetConfig.defaults()));
    }

    @Test
    void shouldRejectNegativeGlobalBudgets() {
        ContextBudgetConfig config = ContextBudgetConfig.defaults().toBuilder()
                .totalBudgetChars(-1)
                .totalItemLimit(-5)
                .build();

        InvalidContextConfigException ex = assertThrows(InvalidContextConfigException.class,
                () -> validator.validate(config));

        assertTrue(ex.getViolations().contains("totalBudgetChars must be >= 0"));
        assertTrue(ex.getViolations().contains("totalItemLimit must be >= 0"));
    }

    @Test
    void shouldRejectEmptyDomainTable() {
        ContextBudgetConfig config = ContextBudgetConfig.defaults().toBuilder()
                .domainBudgets(Map.of())
                .build();

        InvalidContextConfigException ex = assertThrows(InvalidContextConfigException.class,
                () -> validator.validate(config));

        assertTrue(ex.getViolations().contains("domainBudgets must not be empty"));
    }

    @Test
    void shouldRejectFallbackDomainWithoutBudget() {
        ContextBudgetConfig config = ContextBudgetConfig.defaults().toBuilder()
                .domainBudgets(Map.of(ContextDomain.PERSONAL, new DomainBudget(1, 100, 0, 0)))
                .build();

        InvalidContextConfigException ex = assertThrows(InvalidContextConfigException.class,
                () -> validator.validate(config));

        assertTrue(ex.getViolations().contains("fallbackDomain 'conversation' has no budget"));
    }

    @Test
    void shouldRejectInvalidDomainBudgetValues() {
        ContextBudgetConfig config = ContextBudgetConfig.defaults().toBuilder()
                .domainBudgets(Map.of(ContextDomain.CONVERSATION, new DomainBudget(-1, -1, 101, -1)))
                .build();

        InvalidContextConfigException ex = assertThrows(InvalidContextConfigException.class,
                () -> validator.validate(config));

        assertTrue(ex.getViolations().contains("domainBudgets.conversation.maxItems must be >= 0"));
        assertTrue(ex.getViolations().contains("domainBudgets.conversation.maxChars must be >= 0"));
        assertTrue(ex.getViolations().contains("domainBudgets.conversation.minRelevanceScore must be within 0-100"));
        assertTrue(ex.getViolations()
                .contains("domainBudgets.conversation.minConfidenceThreshold must be within 0-100"));
    }

    @Test
    void shouldRejectThresholdsOutsideUnitInterval() {
        ContextBudgetConfig config = ContextBudgetConfig.defaults().toBuilder()
                .saturationThresholds(new SaturationThresholds(1.5, 8, -0.1, 0.7))
                .build();

        InvalidContextConfigException ex = assertThrows(InvalidContextConfigException.class,
                () -> validator.validate(config));

        assertTrue(ex.getViolations().contains("saturationThresholds.redundancySimilarity must be within 0-1"));
        assertTrue(ex.getViolations().contains("saturationThresholds.minDiversityScore must be within 0-1"));
    }

    @Test
    void shouldRejectNegativeWeightsAndInvalidDecay() {
        ContextBudgetConfig config = ContextBudgetConfig.defaults().toBuilder()
                .memoryTypeWeights(Map.of(MemoryType.RECENT, -0.5))
                .relevanceDecay(new RelevanceDecay(0.0, 2.0))
                .build();

        InvalidContextConfigException ex = assertThrows(InvalidContextConfigException.class,
                () -> validator.validate(config));

        assertTrue(ex.getViolations().contains("memoryTypeWeights.recent must be >= 0"));
        assertTrue(ex.getViolations().contains("relevanceDecay.halfLifeHours must be > 0"));
        assertTrue(ex.getViolations().contains("relevanceDecay.floor must be within 0-1"));
    }

    @Test
    void shouldBeIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> validator.validate(null));
    }
}
