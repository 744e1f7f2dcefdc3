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

/**
 * Confidence bands shared with the memory quality subsystem.
 */
public enum ConfidenceBand {
    LOW(0, 39), MEDIUM(40, 69), HIGH(70, 85), VERY_HIGH(86, 100);

    private final int min;
    private final int max;

    ConfidenceBand(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static ConfidenceBand of(int confidence) {
        if (confidence < LOW.min) {
            return LOW;
        }
        for (ConfidenceBand band : values()) {
            if (confidence >= band.min && confidence <= band.max) {
                return band;
            }
        }
        return VERY_HIGH;
    }
}
