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
 * A candidate enriched with scores and classifications for one selection call.
 * {@code diversityScore} stays null until saturation control has run.
 */
@Builder(toBuilder = true)
public record ContextItem(
        MemoryCandidate candidate,
        int relevanceScore,
        int confidenceScore,
        PriorityTier priorityTier,
        MemoryType memoryType,
        int charCount,
        Double diversityScore) {

    public String id() {
        return candidate.id();
    }

    public ContextDomain domain() {
        return candidate.domain();
    }

    public String content() {
        return candidate.content();
    }
}
