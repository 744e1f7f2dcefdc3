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
import me.golemcore.context.domain.model.ContextItem;
import me.golemcore.context.domain.model.ContextMetrics;
import me.golemcore.context.domain.model.ContextSelectedEvent;
import me.golemcore.context.domain.model.ContextSelectionResult;
import me.golemcore.context.domain.model.ContextWindowLog;
import me.golemcore.context.domain.model.ExclusionReason;
import me.golemcore.context.domain.model.ItemClassification;
import me.golemcore.context.domain.model.MemoryCandidate;
import me.golemcore.context.domain.model.SelectionMetadata;
import me.golemcore.context.infrastructure.config.ContextWindowProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Selects the memory facts that go into the prompt for one conversation turn.
 *
 * <p>
 * Pipeline:
 * <ol>
 * <li>Enrich - classify and score every candidate against a single reference
 * instant</li>
 * <li>Admission - greedy budgeted selection
 * ({@link BudgetedContextSelector})</li>
 * <li>Saturation - redundancy and topic caps
 * ({@link ContextSaturationController})</li>
 * <li>Metrics - per-domain and global statistics
 * ({@link ContextMetricsBuilder})</li>
 * </ol>
 *
 * <p>
 * The configuration snapshot is read once per call, so a concurrent update
 * never affects a selection in progress. Every candidate ends up either in the
 * included list or with exactly one exclusion reason. Given the same
 * candidates, quality score, configuration and clock, the result is identical
 * apart from {@code processingTimeMs}.
 *
 * <p>
 * After each selection a {@link ContextSelectedEvent} is published and, when
 * the debug log is enabled, an entry is appended to
 * {@link ContextWindowLogBuffer}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ContextWindowService {

    private final ContextBudgetConfigService configService;
    private final ContextItemClassifier classifier;
    private final ContextItemScorer scorer;
    private final BudgetedContextSelector selector;
    private final ContextSaturationController saturationController;
    private final ContextMetricsBuilder metricsBuilder;
    private final ContextWindowProperties properties;
    private final ObjectProvider<ContextWindowLogBuffer> logBufferProvider;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ContextWindowService(
            ContextBudgetConfigService configService,
            ContextItemClassifier classifier,
            ContextItemScorer scorer,
            BudgetedContextSelector selector,
            ContextSaturationController saturationController,
            ContextMetricsBuilder metricsBuilder,
            ContextWindowProperties properties,
            ObjectProvider<ContextWindowLogBuffer> logBufferProvider,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.configService = configService;
        this.classifier = classifier;
        this.scorer = scorer;
        this.selector = selector;
        this.saturationController = saturationController;
        this.metricsBuilder = metricsBuilder;
        this.properties = properties;
        this.logBufferProvider = logBufferProvider;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Select with the default quality score and anonymous metadata.
     */
    public ContextSelectionResult selectContext(List<MemoryCandidate> candidates) {
        return selectContext(candidates, null, null);
    }

    /**
     * Select using the current configuration snapshot.
     *
     * @param candidates
     *            memory facts offered for this turn
     * @param qualityScore
     *            overall memory quality 0-100, or null for the configured
     *            default
     * @param metadata
     *            caller identifiers for the debug log, may be null
     */
    public ContextSelectionResult selectContext(List<MemoryCandidate> candidates, Integer qualityScore,
            SelectionMetadata metadata) {
        ContextBudgetConfig config = configService.getConfig();
        SelectionMetadata resolvedMetadata = resolveMetadata(metadata);
        ContextSelectionResult result = selectContext(candidates, resolveQuality(qualityScore), config);

        record(result, resolvedMetadata, config);
        return result;
    }

    /**
     * Pure selection against an explicit configuration. Does not publish events
     * or write the debug log.
     */
    public ContextSelectionResult selectContext(List<MemoryCandidate> candidates, int qualityScore,
            ContextBudgetConfig config) {
        if (candidates == null) {
            throw new IllegalArgumentException("Candidate list is required");
        }
        long startMillis = clock.millis();
        Instant now = clock.instant();

        List<ContextItem> enriched = new ArrayList<>(candidates.size());
        for (MemoryCandidate candidate : candidates) {
            enriched.add(enrich(candidate, qualityScore, now, config));
        }

        BudgetedContextSelector.Admission admission = selector.select(enriched, config);
        ContextSaturationController.Saturation saturation = saturationController.desaturate(admission.included(),
                config);

        List<ExclusionReason> excluded = new ArrayList<>(admission.excluded().size()
                + saturation.excluded().size());
        excluded.addAll(admission.excluded());
        excluded.addAll(saturation.excluded());

        long processingTimeMs = Math.max(0L, clock.millis() - startMillis);
        ContextMetrics metrics = metricsBuilder.build(saturation.included(), excluded, config,
                saturation.diversityScore(), processingTimeMs);

        log.info("[ContextWindow] Context window selected: {} items, {} chars, {} excluded, diversity={}%, {}ms",
                metrics.totalItems(), metrics.totalChars(), metrics.excludedCount(),
                Math.round(metrics.diversityScore() * 100), processingTimeMs);
        if (!saturation.included().isEmpty()
                && saturation.diversityScore() < config.saturationThresholds().minDiversityScore()) {
            log.warn("[ContextWindow] Low context diversity: {} < {}", saturation.diversityScore(),
                    config.saturationThresholds().minDiversityScore());
        }

        return ContextSelectionResult.builder()
                .includedItems(List.copyOf(saturation.included()))
                .excludedItems(List.copyOf(excluded))
                .metrics(metrics)
                .selectedAt(now)
                .deterministic(true)
                .build();
    }

    private ContextItem enrich(MemoryCandidate candidate, int qualityScore, Instant now,
            ContextBudgetConfig config) {
        if (candidate == null) {
            throw new IllegalArgumentException("Candidate list must not contain null entries");
        }
        if (candidate.domain() == null) {
            throw new IllegalArgumentException("Candidate '" + candidate.id() + "' has no domain");
        }
        ItemClassification classification = classifier.classify(candidate, now);
        return ContextItem.builder()
                .candidate(candidate)
                .relevanceScore(scorer.relevance(candidate, now, config.relevanceDecay()))
                .confidenceScore(scorer.confidence(candidate, qualityScore))
                .priorityTier(classification.priorityTier())
                .memoryType(classification.memoryType())
                .charCount(candidate.content().length())
                .build();
    }

    private void record(ContextSelectionResult result, SelectionMetadata metadata, ContextBudgetConfig config) {
        ContextWindowLogBuffer logBuffer = logBufferProvider.getIfAvailable();
        if (logBuffer != null) {
            logBuffer.append(ContextWindowLog.builder()
                    .logId(UUID.randomUUID().toString())
                    .userId(metadata.userId())
                    .tenantId(metadata.tenantId())
                    .turnId(metadata.turnId())
                    .result(result)
                    .timestamp(result.selectedAt())
                    .configSnapshot(config)
                    .build());
        }

        eventPublisher.publishEvent(new ContextSelectedEvent(metadata.turnId(), metadata.userId(),
                metadata.tenantId(), result.metrics(), result.metrics().exclusionSummary()));
    }

    private int resolveQuality(Integer qualityScore) {
        int quality = qualityScore != null ? qualityScore : properties.getDefaultQualityScore();
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("Quality score must be within 0-100: " + quality);
        }
        return quality;
    }

    private SelectionMetadata resolveMetadata(SelectionMetadata metadata) {
        SelectionMetadata source = metadata != null ? metadata : SelectionMetadata.unknown();
        if (!"unknown".equals(source.turnId())) {
            return source;
        }
        return new SelectionMetadata("turn-" + clock.millis(), source.userId(), source.tenantId());
    }
}
