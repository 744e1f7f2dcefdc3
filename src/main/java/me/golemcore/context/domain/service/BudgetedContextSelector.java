package me.golemcore.context.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.model.BudgetScope;
import me.golemcore.context.domain.model.ConfidenceBand;
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.ContextItem;
import me.golemcore.context.domain.model.DomainBudget;
import me.golemcore.context.domain.model.ExclusionReason;
import me.golemcore.context.domain.model.ExclusionReasonType;
import me.golemcore.context.domain.model.PriorityTier;
import me.golemcore.context.domain.model.SensitiveDomainPolicy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Admission control: a single greedy pass that admits items against domain and
 * global budgets and records a typed reason for every rejection.
 *
 * <p>
 * Items are ordered by priority tier (critical first), then by relevance
 * descending. The sort is stable, so equal items keep their input order.
 * Checks run in a fixed sequence and the first failing check decides the
 * reason:
 * <ol>
 * <li>relevance below the domain threshold</li>
 * <li>confidence below the domain threshold</li>
 * <li>domain item cap reached</li>
 * <li>domain character cap would be exceeded</li>
 * <li>global item cap reached</li>
 * <li>global character cap would be exceeded</li>
 * <li>sensitive domain flood protection for non-critical items</li>
 * </ol>
 * There is no backtracking: a rejected item is never reconsidered.
 */
@Service
@Slf4j
public class BudgetedContextSelector {

    static final Comparator<ContextItem> ADMISSION_ORDER = Comparator
            .comparing(ContextItem::priorityTier)
            .thenComparing(Comparator.comparingInt(ContextItem::relevanceScore).reversed());

    public Admission select(List<ContextItem> items, ContextBudgetConfig config) {
        List<ContextItem> sorted = new ArrayList<>(items);
        sorted.sort(ADMISSION_ORDER);

        List<ContextItem> included = new ArrayList<>();
        List<ExclusionReason> excluded = new ArrayList<>();
        Map<ContextDomain, Usage> domainUsage = new EnumMap<>(ContextDomain.class);
        Map<ContextDomain, DomainBudget> budgets = new EnumMap<>(ContextDomain.class);
        Usage total = new Usage();

        for (ContextItem item : sorted) {
            ContextDomain domain = item.domain();
            DomainBudget budget = budgets.computeIfAbsent(domain, d -> resolveBudget(d, config));
            Usage usage = domainUsage.computeIfAbsent(domain, d -> new Usage());

            ExclusionReason rejection = check(item, budget, usage, total, config);
            if (rejection != null) {
                log.debug("[ContextWindow] Excluded {} ({}): {}", item.id(), rejection.reason(),
                        rejection.explanation());
                excluded.add(rejection);
                continue;
            }

            included.add(item);
            usage.admit(item.charCount());
            total.admit(item.charCount());
        }

        return new Admission(included, excluded);
    }

    private ExclusionReason check(ContextItem item, DomainBudget budget, Usage usage, Usage total,
            ContextBudgetConfig config) {
        ContextDomain domain = item.domain();

        if (item.relevanceScore() < budget.minRelevanceScore()) {
            return reason(item, ExclusionReasonType.BELOW_RELEVANCE_THRESHOLD)
                    .explanation("Relevance " + item.relevanceScore() + " < threshold "
                            + budget.minRelevanceScore())
                    .build();
        }

        if (item.confidenceScore() < budget.minConfidenceThreshold()) {
            return ExclusionReason.builder()
                    .itemId(item.id())
                    .domain(domain)
                    .reason(ExclusionReasonType.BELOW_CONFIDENCE_THRESHOLD)
                    .confidenceScore(item.confidenceScore())
                    .explanation("Confidence " + item.confidenceScore() + " ("
                            + ConfidenceBand.of(item.confidenceScore()).name().toLowerCase(Locale.ROOT)
                            + ") < threshold " + budget.minConfidenceThreshold())
                    .build();
        }

        if (usage.items >= budget.maxItems()) {
            return reason(item, ExclusionReasonType.DOMAIN_CAP_EXCEEDED)
                    .scope(BudgetScope.DOMAIN)
                    .explanation("Domain '" + domain + "' item cap (" + budget.maxItems() + ") reached")
                    .build();
        }

        if (usage.chars + item.charCount() > budget.maxChars()) {
            return reason(item, ExclusionReasonType.CHAR_LIMIT_EXCEEDED)
                    .scope(BudgetScope.DOMAIN)
                    .explanation("Domain '" + domain + "' char limit (" + budget.maxChars()
                            + ") would be exceeded")
                    .build();
        }

        if (total.items >= config.totalItemLimit()) {
            return reason(item, ExclusionReasonType.TOTAL_CAP_EXCEEDED)
                    .scope(BudgetScope.GLOBAL)
                    .explanation("Total item limit (" + config.totalItemLimit() + ") reached")
                    .build();
        }

        if (total.chars + item.charCount() > config.totalBudgetChars()) {
            return reason(item, ExclusionReasonType.CHAR_LIMIT_EXCEEDED)
                    .scope(BudgetScope.GLOBAL)
                    .explanation("Total char limit (" + config.totalBudgetChars() + ") would be exceeded")
                    .build();
        }

        SensitiveDomainPolicy policy = config.sensitiveDomainPolicy();
        if (policy != null
                && policy.isSensitive(domain)
                && usage.items >= policy.maxNonCriticalItems()
                && item.priorityTier() != PriorityTier.CRITICAL) {
            return reason(item, ExclusionReasonType.SENSITIVE_DOMAIN_PROTECTION)
                    .scope(BudgetScope.DOMAIN)
                    .explanation("Domain '" + domain + "' protected from flooding (non-critical item after "
                            + policy.maxNonCriticalItems() + " items)")
                    .build();
        }

        return null;
    }

    private DomainBudget resolveBudget(ContextDomain domain, ContextBudgetConfig config) {
        if (!config.hasBudgetFor(domain)) {
            log.warn("[ContextWindow] No budget for domain '{}', using '{}' budget", domain,
                    config.fallbackDomain());
        }
        return config.budgetFor(domain);
    }

    private ExclusionReason.ExclusionReasonBuilder reason(ContextItem item, ExclusionReasonType type) {
        return ExclusionReason.builder()
                .itemId(item.id())
                .domain(item.domain())
                .reason(type)
                .relevanceScore(item.relevanceScore());
    }

    /**
     * Result of admission control.
     *
     * @param included
     *            admitted items in admission order
     * @param excluded
     *            rejection reasons in evaluation order
     */
    public record Admission(List<ContextItem> included, List<ExclusionReason> excluded) {
    }

    private static final class Usage {
        private int items;
        private int chars;

        private void admit(int charCount) {
            items++;
            chars += charCount;
        }
    }
}
