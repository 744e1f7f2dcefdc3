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

import me.golemcore.context.domain.model.ConfidenceBand;
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.ContextMetrics;
import me.golemcore.context.domain.model.ContextSelectionResult;
import me.golemcore.context.domain.model.DomainMetrics;
import me.golemcore.context.domain.model.ExclusionReasonType;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Plain-text report of a selection for operators.
 */
@Service
public class SelectionDebugFormatter {

    public String format(ContextSelectionResult result) {
        ContextMetrics metrics = result.metrics();
        StringBuilder sb = new StringBuilder();
        sb.append("=== Context Window Selection Result ===\n");
        sb.append("Included: ").append(metrics.totalItems()).append(" items, ")
                .append(metrics.totalChars()).append(" chars\n");
        sb.append("Excluded: ").append(metrics.excludedCount()).append(" items\n");
        sb.append("Diversity: ").append(percent(metrics.diversityScore())).append("%\n");
        sb.append("Budget Usage: ").append(percent(metrics.budgetUtilization())).append("%\n");
        if (metrics.totalItems() > 0) {
            int avgConfidence = (int) Math.round(metrics.avgConfidenceScore());
            sb.append("Avg Confidence: ").append(metrics.avgConfidenceScore()).append(" (")
                    .append(ConfidenceBand.of(avgConfidence).name().toLowerCase(Locale.ROOT)).append(")\n");
        }
        sb.append("\nPer-Domain Breakdown:\n");

        for (Map.Entry<ContextDomain, DomainMetrics> entry : metrics.domainUsage().entrySet()) {
            DomainMetrics domainMetrics = entry.getValue();
            if (domainMetrics.itemCount() > 0 || domainMetrics.excludedCount() > 0) {
                sb.append("  ").append(entry.getKey()).append(": ")
                        .append(domainMetrics.itemCount()).append(" items, ")
                        .append(domainMetrics.charCount()).append(" chars (")
                        .append(domainMetrics.excludedCount()).append(" excluded)\n");
            }
        }

        if (!result.excludedItems().isEmpty()) {
            sb.append("\nExclusion Summary:\n");
            for (Map.Entry<ExclusionReasonType, Integer> entry : metrics.exclusionSummary().entrySet()) {
                sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append("\n");
            }
        }

        return sb.toString().stripTrailing();
    }

    private String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f", ratio * 100);
    }
}
