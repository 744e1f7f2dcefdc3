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

import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.ContextItem;
import me.golemcore.context.domain.model.ContextMetrics;
import me.golemcore.context.domain.model.DomainBudget;
import me.golemcore.context.domain.model.DomainMetrics;
import me.golemcore.context.domain.model.ExclusionReason;
import me.golemcore.context.domain.model.ExclusionReasonType;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates per-domain and global statistics for a selection.
 */
@Service
public class ContextMetricsBuilder {

    public ContextMetrics build(
            List<ContextItem> included,
            List<ExclusionReason> excluded,
            ContextBudgetConfig config,
            double diversityScore,
            long processingTimeMs) {
        int totalChars = 0;
        long relevanceSum = 0;
        long confidenceSum = 0;
        for (ContextItem item : included) {
            totalChars += item.charCount();
            relevanceSum += item.relevanceScore();
            confidenceSum += item.confidenceScore();
        }

        Map<ContextDomain, DomainMetrics> domainUsage = new EnumMap<>(ContextDomain.class);
        for (ContextDomain domain : ContextDomain.values()) {
            domainUsage.put(domain, buildDomainMetrics(domain, included, excluded, config.budgetFor(domain)));
        }

        int itemCount = included.size();
        return ContextMetrics.builder()
                .totalChars(totalChars)
                .totalItems(itemCount)
                .domainUsage(Collections.unmodifiableMap(domainUsage))
                .budgetUtilization(ratio(totalChars, config.totalBudgetChars()))
                .diversityScore(diversityScore)
                .excludedCount(excluded.size())
                .avgRelevanceScore(itemCount > 0 ? roundTwoDecimals((double) relevanceSum / itemCount) : 0.0)
                .avgConfidenceScore(itemCount > 0 ? roundTwoDecimals((double) confidenceSum / itemCount) : 0.0)
                .processingTimeMs(processingTimeMs)
                .exclusionSummary(summarizeExclusions(excluded))
                .build();
    }

    /**
     * Histogram of exclusion reasons in declaration order. Reasons that did not
     * occur are omitted.
     */
    public Map<ExclusionReasonType, Integer> summarizeExclusions(List<ExclusionReason> excluded) {
        Map<ExclusionReasonType, Integer> summary = new EnumMap<>(ExclusionReasonType.class);
        for (ExclusionReason exclusion : excluded) {
            summary.merge(exclusion.reason(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(summary);
    }

    private DomainMetrics buildDomainMetrics(
            ContextDomain domain,
            List<ContextItem> included,
            List<ExclusionReason> excluded,
            DomainBudget budget) {
        int itemCount = 0;
        int charCount = 0;
        for (ContextItem item : included) {
            if (item.domain() == domain) {
                itemCount++;
                charCount += item.charCount();
            }
        }
        int excludedCount = 0;
        for (ExclusionReason exclusion : excluded) {
            if (exclusion.domain() == domain) {
                excludedCount++;
            }
        }
        int maxItems = budget != null ? budget.maxItems() : 0;
        return DomainMetrics.builder()
                .itemCount(itemCount)
                .charCount(charCount)
                .budgetUtilization(ratio(itemCount, maxItems))
                .excludedCount(excludedCount)
                .build();
    }

    private double ratio(int used, int max) {
        return max > 0 ? (double) used / max : 0.0;
    }

    private double roundTwoDecimals(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
