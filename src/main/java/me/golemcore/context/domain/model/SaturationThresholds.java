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

/**
 * Thresholds for redundancy and topic saturation.
 *
 * @param redundancySimilarity
 *            similarity (0-1) at or above which an item counts as a duplicate
 * @param topicRepetitionLimit
 *            items allowed per topic before further items are dropped
 * @param minDiversityScore
 *            diversity (0-1) the final context is expected to reach; a lower
 *            value is reported, not enforced
 * @param similarityDownWeight
 *            informational down-weight factor (0-1) for similar items
 */
@Builder(toBuilder = true)
public record SaturationThresholds(
        double redundancySimilarity,
        int topicRepetitionLimit,
        double minDiversityScore,
        double similarityDownWeight) {
}
