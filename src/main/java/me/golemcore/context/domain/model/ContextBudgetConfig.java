package me.golemcore.context.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable budget table for context window selection.
 *
 * <p>
 * Instances are snapshots: collections are copied into unmodifiable enum maps
 * and sets on construction, so a selection holding a reference is unaffected by
 * later configuration updates.
 *
 * <p>
 * Memory type weights are informational ratios and are not enforced. A domain
 * without a budget is served with the budget of {@code fallbackDomain}.
 */
@Builder(toBuilder = true)
public record ContextBudgetConfig(
        int totalBudgetChars,
        int totalItemLimit,
        Map<ContextDomain, DomainBudget> domainBudgets,
        Map<MemoryType, Double> memoryTypeWeights,
        SaturationThresholds saturationThresholds,
        ContextDomain fallbackDomain,
        SensitiveDomainPolicy sensitiveDomainPolicy,
        Set<ContextDomain> topicExemptDomains,
        RelevanceDecay relevanceDecay) {

    public ContextBudgetConfig {
        domainBudgets = immutableEnumMap(ContextDomain.class, domainBudgets);
        memoryTypeWeights = immutableEnumMap(MemoryType.class, memoryTypeWeights);
        topicExemptDomains = SensitiveDomainPolicy.immutableDomainSet(topicExemptDomains);
    }

    public boolean hasBudgetFor(ContextDomain domain) {
        return domainBudgets.containsKey(domain);
    }

    /**
     * Budget for a domain, falling back to the fallback domain's budget when the
     * table has no entry.
     */
    public DomainBudget budgetFor(ContextDomain domain) {
        DomainBudget budget = domainBudgets.get(domain);
        if (budget != null) {
            return budget;
        }
        return domainBudgets.get(fallbackDomain);
    }

    public boolean isTopicExempt(ContextDomain domain) {
        return topicExemptDomains.contains(domain);
    }

    public static ContextBudgetConfig defaults() {
        Map<ContextDomain, DomainBudget> budgets = new EnumMap<>(ContextDomain.class);
        // identity and relationships have many facets, keep them generous
        budgets.put(ContextDomain.PERSONAL, new DomainBudget(15, 2500, 10, 0));
        budgets.put(ContextDomain.RELATIONSHIPS, new DomainBudget(10, 1500, 15, 0));
        budgets.put(ContextDomain.HEALTH, new DomainBudget(4, 800, 40, 40));
        budgets.put(ContextDomain.GOALS, new DomainBudget(3, 600, 40, 30));
        budgets.put(ContextDomain.PREFERENCES, new DomainBudget(4, 600, 35, 30));
        budgets.put(ContextDomain.CONVERSATION, new DomainBudget(5, 1000, 30, 20));
        budgets.put(ContextDomain.TASKS, new DomainBudget(3, 400, 50, 40));
        budgets.put(ContextDomain.COMMUNITY, new DomainBudget(2, 300, 50, 50));
        budgets.put(ContextDomain.EVENTS_MEETUPS, new DomainBudget(2, 300, 50, 50));
        budgets.put(ContextDomain.PRODUCTS_SERVICES, new DomainBudget(2, 200, 60, 50));
        budgets.put(ContextDomain.NOTES, new DomainBudget(2, 200, 50, 40));

        Map<MemoryType, Double> weights = new EnumMap<>(MemoryType.class);
        weights.put(MemoryType.RECENT, 0.5);
        weights.put(MemoryType.LONG_TERM, 0.35);
        weights.put(MemoryType.PATTERN, 0.15);

        return ContextBudgetConfig.builder()
                .totalBudgetChars(10000)
                .totalItemLimit(50)
                .domainBudgets(budgets)
                .memoryTypeWeights(weights)
                .saturationThresholds(new SaturationThresholds(0.85, 8, 0.3, 0.7))
                .fallbackDomain(ContextDomain.CONVERSATION)
                .sensitiveDomainPolicy(new SensitiveDomainPolicy(Set.of(ContextDomain.HEALTH), 3))
                .topicExemptDomains(Set.of(ContextDomain.PERSONAL, ContextDomain.RELATIONSHIPS))
                .relevanceDecay(new RelevanceDecay(168.0, 0.5))
                .build();
    }

    private static <K extends Enum<K>, V> Map<K, V> immutableEnumMap(Class<K> keyType, Map<K, V> source) {
        EnumMap<K, V> copy = new EnumMap<>(keyType);
        if (source != null) {
            for (Map.Entry<K, V> entry : source.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return Collections.unmodifiableMap(copy);
    }
}
