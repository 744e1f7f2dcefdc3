package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextBudgetConfigUpdate;
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.DomainBudget;
import me.golemcore.context.domain.model.SaturationThresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContextBudgetConfigServiceTest {

    private ContextBudgetConfigService service;

    @BeforeEach
    void setUp() {
        service = new ContextBudgetConfigService(new ContextBudgetConfigValidator());
    }

    @Test
    void shouldStartWithDefaults() {
        assertEquals(ContextBudgetConfig.defaults(), service.getConfig());
    }

    @Test
    void shouldMergeOnlyProvidedFields() {
        ContextBudgetConfig updated = service.updateConfig(ContextBudgetConfigUpdate.builder()
                .totalBudgetChars(5000)
                .saturationThresholds(new SaturationThresholds(0.9, 4, 0.2, 0.5))
                .build());

        assertEquals(5000, updated.totalBudgetChars());
        assertEquals(50, updated.totalItemLimit());
        assertEquals(4, updated.saturationThresholds().topicRepetitionLimit());
        assertEquals(ContextBudgetConfig.defaults().domainBudgets(), updated.domainBudgets());
        assertSame(updated, service.getConfig());
    }

    @Test
    void shouldReplaceDomainTableWholesale() {
        Map<ContextDomain, DomainBudget> budgets = new EnumMap<>(ContextDomain.class);
        budgets.put(ContextDomain.CONVERSATION, new DomainBudget(2, 200, 0, 0));

        ContextBudgetConfig updated = service.updateConfig(ContextBudgetConfigUpdate.builder()
                .domainBudgets(budgets)
                .build());

        assertEquals(1, updated.domainBudgets().size());
        assertEquals(new DomainBudget(2, 200, 0, 0), updated.budgetFor(ContextDomain.HEALTH));
    }

    @Test
    void shouldKeepPreviousConfigWhenUpdateInvalid() {
        ContextBudgetConfig before = service.getConfig();

        assertThrows(InvalidContextConfigException.class, () -> service.updateConfig(
                ContextBudgetConfigUpdate.builder().totalItemLimit(-1).build()));

        assertSame(before, service.getConfig());
    }

    @Test
    void shouldRejectFallbackSwitchToDomainWithoutBudget() {
        Map<ContextDomain, DomainBudget> budgets = new EnumMap<>(ContextDomain.class);
        budgets.put(ContextDomain.CONVERSATION, new DomainBudget(2, 200, 0, 0));
        service.updateConfig(ContextBudgetConfigUpdate.builder().domainBudgets(budgets).build());

        assertThrows(InvalidContextConfigException.class, () -> service.updateConfig(
                ContextBudgetConfigUpdate.builder().fallbackDomain(ContextDomain.NOTES).build()));
    }

    @Test
    void shouldRejectNullUpdate() {
        assertThrows(InvalidContextConfigException.class, () -> service.updateConfig(null));
    }

    @Test
    void shouldResetToDefaults() {
        service.updateConfig(ContextBudgetConfigUpdate.builder().totalItemLimit(3).build());

        ContextBudgetConfig reset = service.resetConfig();

        assertEquals(ContextBudgetConfig.defaults(), reset);
        assertEquals(50, service.getConfig().totalItemLimit());
    }

    @Test
    void shouldNotExposeMutableCollections() {
        Map<ContextDomain, DomainBudget> budgets = new EnumMap<>(ContextDomain.class);
        budgets.put(ContextDomain.CONVERSATION, new DomainBudget(2, 200, 0, 0));
        ContextBudgetConfig updated = service.updateConfig(ContextBudgetConfigUpdate.builder()
                .domainBudgets(budgets)
                .build());

        budgets.put(ContextDomain.NOTES, new DomainBudget(1, 1, 0, 0));

        assertEquals(1, updated.domainBudgets().size());
        assertThrows(UnsupportedOperationException.class,
                () -> updated.domainBudgets().put(ContextDomain.NOTES, new DomainBudget(1, 1, 0, 0)));
    }
}
