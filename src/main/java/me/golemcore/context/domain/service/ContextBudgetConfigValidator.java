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
import me.golemcore.context.domain.model.DomainBudget;
import me.golemcore.context.domain.model.MemoryType;
import me.golemcore.context.domain.model.RelevanceDecay;
import me.golemcore.context.domain.model.SaturationThresholds;
import me.golemcore.context.domain.model.SensitiveDomainPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rejects configurations that would corrupt a selection: negative budgets,
 * thresholds outside their ranges, an empty domain table or a fallback domain
 * without a budget.
 */
@Component
public class ContextBudgetConfigValidator {

    private static final int MAX_SCORE = 100;

    public void validate(ContextBudgetConfig config) {
        List<String> violations = new ArrayList<>();
        if (config == null) {
            throw new InvalidContextConfigException(List.of("config is required"));
        }

        if (config.totalBudgetChars() < 0) {
            violations.add("totalBudgetChars must be >= 0");
        }
        if (config.totalItemLimit() < 0) {
            violations.add("totalItemLimit must be >= 0");
        }

        validateDomainBudgets(config, violations);
        validateWeights(config.memoryTypeWeights(), violations);
        validateSaturation(config.saturationThresholds(), violations);
        validateSensitivePolicy(config.sensitiveDomainPolicy(), violations);
        validateDecay(config.relevanceDecay(), violations);

        if (!violations.isEmpty()) {
            throw new InvalidContextConfigException(violations);
        }
    }

    private void validateDomainBudgets(ContextBudgetConfig config, List<String> violations) {
        Map<ContextDomain, DomainBudget> budgets = config.domainBudgets();
        if (budgets.isEmpty()) {
            violations.add("domainBudgets must not be empty");
            return;
        }
        if (config.fallbackDomain() == null) {
            violations.add("fallbackDomain is required");
        } else if (!config.hasBudgetFor(config.fallbackDomain())) {
            violations.add("fallbackDomain '" + config.fallbackDomain() + "' has no budget");
        }
        for (Map.Entry<ContextDomain, DomainBudget> entry : budgets.entrySet()) {
            DomainBudget budget = entry.getValue();
            String prefix = "domainBudgets." + entry.getKey() + ".";
            if (budget.maxItems() < 0) {
                violations.add(prefix + "maxItems must be >= 0");
            }
            if (budget.maxChars() < 0) {
                violations.add(prefix + "maxChars must be >= 0");
            }
            if (!isScore(budget.minRelevanceScore())) {
                violations.add(prefix + "minRelevanceScore must be within 0-100");
            }
            if (!isScore(budget.minConfidenceThreshold())) {
                violations.add(prefix + "minConfidenceThreshold must be within 0-100");
            }
        }
    }

    private void validateWeights(Map<MemoryType, Double> weights, List<String> violations) {
        for (Map.Entry<MemoryType, Double> entry : weights.entrySet()) {
            if (entry.getValue() < 0.0) {
                violations.add("memoryTypeWeights." + entry.getKey().getCode() + " must be >= 0");
            }
        }
    }

    private void validateSaturation(SaturationThresholds thresholds, List<String> violations) {
        if (thresholds == null) {
            violations.add("saturationThresholds is required");
            return;
        }
        if (!isUnitInterval(thresholds.redundancySimilarity())) {
            violations.add("saturationThresholds.redundancySimilarity must be within 0-1");
        }
        if (thresholds.topicRepetitionLimit() < 0) {
            violations.add("saturationThresholds.topicRepetitionLimit must be >= 0");
        }
        if (!isUnitInterval(thresholds.minDiversityScore())) {
            violations.add("saturationThresholds.minDiversityScore must be within 0-1");
        }
        if (!isUnitInterval(thresholds.similarityDownWeight())) {
            violations.add("saturationThresholds.similarityDownWeight must be within 0-1");
        }
    }

    private void validateSensitivePolicy(SensitiveDomainPolicy policy, List<String> violations) {
        if (policy != null && policy.maxNonCriticalItems() < 0) {
            violations.add("sensitiveDomainPolicy.maxNonCriticalItems must be >= 0");
        }
    }

    private void validateDecay(RelevanceDecay decay, List<String> violations) {
        if (decay == null) {
            violations.add("relevanceDecay is required");
            return;
        }
        if (!(decay.halfLifeHours() > 0.0)) {
            violations.add("relevanceDecay.halfLifeHours must be > 0");
        }
        if (!isUnitInterval(decay.floor())) {
            violations.add("relevanceDecay.floor must be within 0-1");
        }
    }

    private boolean isScore(int value) {
        return value >= 0 && value <= MAX_SCORE;
    }

    private boolean isUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
