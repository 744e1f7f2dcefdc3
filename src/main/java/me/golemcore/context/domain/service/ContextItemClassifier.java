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

import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.ItemClassification;
import me.golemcore.context.domain.model.MemoryCandidate;
import me.golemcore.context.domain.model.MemoryType;
import me.golemcore.context.domain.model.PriorityTier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Assigns priority tiers and memory types to candidates. Pure function of the
 * candidate and the reference instant.
 */
@Service
public class ContextItemClassifier {

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);
    private static final Pattern HABIT_MARKERS = Pattern.compile(
            "\\b(always|never|usually|prefer|habit|routine)\\b", Pattern.CASE_INSENSITIVE);

    public ItemClassification classify(MemoryCandidate candidate, Instant now) {
        return new ItemClassification(classifyPriorityTier(candidate), classifyMemoryType(candidate, now));
    }

    public PriorityTier classifyPriorityTier(MemoryCandidate candidate) {
        ContextDomain domain = candidate.domain();
        int importance = candidate.importance();

        // Critical: identity, close relationships, anything marked highly important
        if (domain == ContextDomain.PERSONAL && importance >= 30) {
            return PriorityTier.CRITICAL;
        }
        if (domain == ContextDomain.RELATIONSHIPS && importance >= 50) {
            return PriorityTier.CRITICAL;
        }
        if (importance >= 70) {
            return PriorityTier.CRITICAL;
        }

        if (importance >= 30) {
            return PriorityTier.RELEVANT;
        }
        if (isCoreDomain(domain) && importance >= 20) {
            return PriorityTier.RELEVANT;
        }
        return PriorityTier.OPTIONAL;
    }

    public MemoryType classifyMemoryType(MemoryCandidate candidate, Instant now) {
        Instant occurredAt = candidate.occurredAt();
        if (occurredAt != null && Duration.between(occurredAt, now).compareTo(RECENT_WINDOW) < 0) {
            return MemoryType.RECENT;
        }
        if (HABIT_MARKERS.matcher(candidate.content()).find()) {
            return MemoryType.PATTERN;
        }
        return MemoryType.LONG_TERM;
    }

    private boolean isCoreDomain(ContextDomain domain) {
        return domain == ContextDomain.HEALTH
                || domain == ContextDomain.GOALS
                || domain == ContextDomain.PREFERENCES;
    }
}
