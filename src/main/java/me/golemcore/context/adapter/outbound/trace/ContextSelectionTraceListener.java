package me.golemcore.context.adapter.outbound.trace;

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
import me.golemcore.context.domain.model.ContextMetrics;
import me.golemcore.context.domain.model.ContextSelectedEvent;
import me.golemcore.context.domain.model.ExclusionReasonType;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Emits metric-style log lines for every selection so that log-based
 * dashboards can chart budget usage and exclusion causes.
 */
@Component
@Slf4j
public class ContextSelectionTraceListener {

    @EventListener
    public void onContextSelected(ContextSelectedEvent event) {
        ContextMetrics metrics = event.metrics();
        if (metrics == null) {
            return;
        }
        log.info("[ContextMetrics] metric=context.items.included.count value={} turn={} user={}",
                metrics.totalItems(), event.turnId(), event.userId());
        log.info("[ContextMetrics] metric=context.items.excluded.count value={} turn={}",
                metrics.excludedCount(), event.turnId());
        log.info("[ContextMetrics] metric=context.chars.used value={} utilization={} turn={}",
                metrics.totalChars(), format(metrics.budgetUtilization()), event.turnId());
        log.info("[ContextMetrics] metric=context.diversity.score value={} turn={}",
                format(metrics.diversityScore()), event.turnId());

        Map<ExclusionReasonType, Integer> summary = event.exclusionSummary();
        if (summary == null) {
            return;
        }
        for (Map.Entry<ExclusionReasonType, Integer> entry : summary.entrySet()) {
            log.info("[ContextMetrics] metric=context.exclusions.count value={} reason={} turn={}",
                    entry.getValue(), entry.getKey().getCode(), event.turnId());
        }
    }

    private String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
