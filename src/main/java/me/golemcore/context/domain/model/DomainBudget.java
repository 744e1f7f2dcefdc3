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
 * Per-domain caps and admission thresholds.
 *
 * @param maxItems
 *            maximum items admitted from the domain
 * @param maxChars
 *            maximum characters admitted from the domain
 * @param minRelevanceScore
 *            minimum relevance (0-100)
 * @param minConfidenceThreshold
 *            minimum confidence (0-100)
 */
@Builder(toBuilder = true)
public record DomainBudget(int maxItems, int maxChars, int minRelevanceScore, int minConfidenceThreshold) {
}
