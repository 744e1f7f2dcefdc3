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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.component.SimilarityComponent;
import me.golemcore.context.domain.component.TopicComponent;
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextItem;
import me.golemcore.context.domain.model.ExclusionReason;
import me.golemcore.context.domain.model.ExclusionReasonType;
import me.golemcore.context.domain.model.SaturationThresholds;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Second pass over admitted items: drops near-duplicates and caps topic
 * repetition, then scores the diversity of what remains.
 *
 * <p>
 * Items are processed in admission order. Topic-exempt domains (identity facts)
 * are never topic-capped, but they are still checked for redundancy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextSaturationController {

    private final SimilarityComponent similarityComponent;
    private final TopicComponent topicComponent;

    public Saturation desaturate(List<ContextItem> admitted, ContextBudgetConfig config) {
        SaturationThresholds thresholds = config.saturationThresholds();
        List<ContextItem> finalIncluded = new ArrayList<>();
        List<ExclusionReason> excluded = new ArrayList<>();
        Map<String, Integer> topicCounts = new HashMap<>();

        for (ContextItem item : admitted) {
            ExclusionReason redundancy = findRedundancy(item, finalIncluded, thresholds);
            if (redundancy != null) {
                excluded.add(redundancy);
                continue;
            }

            if (!config.isTopicExempt(item.domain())) {
                String topic = topicComponent.extractTopic(item.content());
                int count = topicCounts.merge(topic, 1, Integer::sum);
                if (count > thresholds.topicRepetitionLimit()) {
                    excluded.add(ExclusionReason.builder()
                            .itemId(item.id())
                            .domain(item.domain())
                            .reason(ExclusionReasonType.TOPIC_SATURATION)
                            .relevanceScore(item.relevanceScore())
                            .explanation("Topic '" + topic + "' already has " + thresholds.topicRepetitionLimit()
                                    + " items (diminishing returns)")
                            .build());
                    continue;
                }
            }

            finalIncluded.add(item);
        }

        double diversity = diversityScore(finalIncluded);
        List<ContextItem> scored = new ArrayList<>(finalIncluded.size());
        for (ContextItem item : finalIncluded) {
            scored.add(item.toBuilder().diversityScore(diversity).build());
        }
        log.debug("[ContextWindow] Saturation control kept {} of {} items, diversity={}", scored.size(),
                admitted.size(), diversity);
        return new Saturation(scored, excluded, diversity);
    }

    /**
     * Mean pairwise dissimilarity of the items. Sets of zero or one item score
     * 1.0.
     */
    public double diversityScore(List<ContextItem> items) {
        if (items.size() <= 1) {
            return 1.0;
        }
        double totalDissimilarity = 0.0;
        int comparisons = 0;
        for (int i = 0; i < items.size(); i++) {
            for (int j = i + 1; j < items.size(); j++) {
                totalDissimilarity += 1.0 - similarityComponent.similarity(items.get(i).content(),
                        items.get(j).content());
                comparisons++;
            }
        }
        return totalDissimilarity / comparisons;
    }

    private ExclusionReason findRedundancy(ContextItem item, List<ContextItem> finalIncluded,
            SaturationThresholds thresholds) {
        for (ContextItem kept : finalIncluded) {
            double similarity = similarityComponent.similarity(item.content(), kept.content());
            if (similarity >= thresholds.redundancySimilarity()) {
                return ExclusionReason.builder()
                        .itemId(item.id())
                        .domain(item.domain())
                        .reason(ExclusionReasonType.REDUNDANT_CONTENT)
                        .relevanceScore(item.relevanceScore())
                        .similarityTo(kept.id())
                        .explanation("Content " + Math.round(similarity * 100) + "% similar to included item '"
                                + kept.id() + "'")
                        .build();
            }
        }
        return null;
    }

    /**
     * Result of saturation control.
     *
     * @param included
     *            surviving items, each carrying the set diversity score
     * @param excluded
     *            redundancy and topic saturation exclusions
     * @param diversityScore
     *            mean pairwise dissimilarity of the surviving items
     */
    public record Saturation(List<ContextItem> included, List<ExclusionReason> excluded, double diversityScore) {
    }
}
