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
import me.golemcore.context.domain.model.MemoryCandidate;
import me.golemcore.context.domain.model.RelevanceDecay;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes relevance and confidence scores (0-100) for candidates.
 */
@Service
public class ContextItemScorer {

    private static final double SECONDS_PER_HOUR = 3_600.0;
    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;
    private static final int MAX_SCORE = 100;

    /**
     * Importance decayed by age and boosted by domain.
     */
    public int relevance(MemoryCandidate candidate, Instant now, RelevanceDecay decay) {
        int base = clampScore(candidate.importance());
        double decayFactor = decayFactor(candidate.occurredAt(), now, decay);
        double boosted = base * decayFactor * domainBoost(candidate.domain());
        return clampScore((int) Math.round(boosted));
    }

    /**
     * Overall quality adjusted by provenance and importance.
     */
    public int confidence(MemoryCandidate candidate, int qualityScore) {
        int confidence = qualityScore;

        confidence += switch (candidate.source()) {
        case SYSTEM -> 10;
        case TEXT -> 5;
        case VOICE -> -5;
        case OTHER -> 0;
        };

        if (candidate.importance() >= 70) {
            confidence += 10;
        } else if (candidate.importance() >= 50) {
            confidence += 5;
        }

        return clampScore(confidence);
    }

    double decayFactor(Instant occurredAt, Instant now, RelevanceDecay decay) {
        if (occurredAt == null || decay == null || decay.halfLifeHours() <= 0) {
            return 1.0;
        }
        Duration age = Duration.between(occurredAt, now);
        if (age.isNegative() || age.isZero()) {
            return 1.0;
        }
        // millis overflow across the full Instant range
        double ageHours = age.getSeconds() / SECONDS_PER_HOUR + age.getNano() / NANOS_PER_HOUR;
        double factor = Math.pow(0.5, ageHours / decay.halfLifeHours());
        return Math.max(decay.floor(), factor);
    }

    double domainBoost(ContextDomain domain) {
        return switch (domain) {
        case PERSONAL -> 1.5;
        case RELATIONSHIPS -> 1.3;
        case HEALTH -> 1.2;
        case GOALS, PREFERENCES, CONVERSATION, TASKS, COMMUNITY, EVENTS_MEETUPS, PRODUCTS_SERVICES, NOTES -> 1.0;
        };
    }

    private int clampScore(int value) {
        if (value < 0) {
            return 0;
        }
        return Math.min(MAX_SCORE, value);
    }
}
