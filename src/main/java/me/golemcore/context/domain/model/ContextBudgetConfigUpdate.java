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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * Partial override for {@link ContextBudgetConfig}. Non-null fields replace the
 * corresponding top-level field of the live configuration; nested values are
 * not merged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextBudgetConfigUpdate {
    private Integer totalBudgetChars;
    private Integer totalItemLimit;
    private Map<ContextDomain, DomainBudget> domainBudgets;
    private Map<MemoryType, Double> memoryTypeWeights;
    private SaturationThresholds saturationThresholds;
    private ContextDomain fallbackDomain;
    private SensitiveDomainPolicy sensitiveDomainPolicy;
    private Set<ContextDomain> topicExemptDomains;
    private RelevanceDecay relevanceDecay;
}
