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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Provenance of a memory candidate. Unrecognized tags map to {@link #OTHER}.
 */
public enum MemorySource {
    SYSTEM("system"), TEXT("orb_text"), VOICE("orb_voice"), OTHER("other");

    private final String code;

    MemorySource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static MemorySource fromCode(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MemorySource source : values()) {
            if (source.code.equals(normalized) || source.name().equalsIgnoreCase(normalized)) {
                return source;
            }
        }
        return OTHER;
    }
}
