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
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextBudgetConfigUpdate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the live context budget configuration.
 *
 * <p>
 * The configuration is an immutable snapshot behind an
 * {@link AtomicReference}: readers take the current snapshot without locking,
 * and an update builds, validates and swaps in a new snapshot. A selection
 * that captured a snapshot at entry never observes a concurrent update.
 */
@Service
@Slf4j
public class ContextBudgetConfigService {

    private final ContextBudgetConfigValidator validator;
    private final AtomicReference<ContextBudgetConfig> configRef;

    @Autowired
    public ContextBudgetConfigService(ContextBudgetConfigValidator validator) {
        this(validator, ContextBudgetConfig.defaults());
    }

    public ContextBudgetConfigService(ContextBudgetConfigValidator validator, ContextBudgetConfig initial) {
        this.validator = validator;
        validator.validate(initial);
        this.configRef = new AtomicReference<>(initial);
    }

    /**
     * Current configuration snapshot.
     */
    public ContextBudgetConfig getConfig() {
        return configRef.get();
    }

    /**
     * Shallow-merges the non-null fields of {@code update} into the live
     * configuration.
     *
     * @return the configuration now in effect
     * @throws InvalidContextConfigException
     *             if the merged configuration is malformed
     */
    public ContextBudgetConfig updateConfig(ContextBudgetConfigUpdate update) {
        if (update == null) {
            throw new InvalidContextConfigException(List.of("update is required"));
        }
        ContextBudgetConfig updated;
        try {
            updated = configRef.updateAndGet(current -> {
                ContextBudgetConfig merged = merge(current, update);
                validator.validate(merged);
                return merged;
            });
        } catch (InvalidContextConfigException e) {
            log.warn("[ContextConfig] Rejected config update: {}", e.getViolations());
            throw e;
        }
        log.info("[ContextConfig] Context window config updated: totalBudgetChars={}, totalItemLimit={}, domains={}",
                updated.totalBudgetChars(), updated.totalItemLimit(), updated.domainBudgets().size());
        return updated;
    }

    /**
     * Replaces the live configuration with the built-in defaults.
     */
    public ContextBudgetConfig resetConfig() {
        ContextBudgetConfig defaults = ContextBudgetConfig.defaults();
        configRef.set(defaults);
        log.info("[ContextConfig] Context window config reset to defaults");
        return defaults;
    }

    private ContextBudgetConfig merge(ContextBudgetConfig current, ContextBudgetConfigUpdate update) {
        ContextBudgetConfig.ContextBudgetConfigBuilder builder = current.toBuilder();
        if (update.getTotalBudgetChars() != null) {
            builder.totalBudgetChars(update.getTotalBudgetChars());
        }
        if (update.getTotalItemLimit() != null) {
            builder.totalItemLimit(update.getTotalItemLimit());
        }
        if (update.getDomainBudgets() != null) {
            builder.domainBudgets(update.getDomainBudgets());
        }
        if (update.getMemoryTypeWeights() != null) {
            builder.memoryTypeWeights(update.getMemoryTypeWeights());
        }
        if (update.getSaturationThresholds() != null) {
            builder.saturationThresholds(update.getSaturationThresholds());
        }
        if (update.getFallbackDomain() != null) {
            builder.fallbackDomain(update.getFallbackDomain());
        }
        if (update.getSensitiveDomainPolicy() != null) {
            builder.sensitiveDomainPolicy(update.getSensitiveDomainPolicy());
        }
        if (update.getTopicExemptDomains() != null) {
            builder.topicExemptDomains(update.getTopicExemptDomains());
        }
        if (update.getRelevanceDecay() != null) {
            builder.relevanceDecay(update.getRelevanceDecay());
        }
        return builder.build();
    }
}
