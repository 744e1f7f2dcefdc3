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
 * Fixed set of memory domains used to partition the context budget.
 */
public enum ContextDomain {
    PERSONAL("personal"),
    RELATIONSHIPS("relationships"),
    HEALTH("health"),
    GOALS("goals"),
    PREFERENCES("preferences"),
    CONVERSATION("conversation"),
    TASKS("tasks"),
    COMMUNITY("community"),
    EVENTS_MEETUPS("events_meetups"),
    PRODUCTS_SERVICES("products_services"),
    NOTES("notes");

    private final String code;

    ContextDomain(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ContextDomain fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Context domain is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ContextDomain domain : values()) {
            if (domain.code.equals(normalized) || domain.name().equalsIgnoreCase(normalized)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown context domain: " + value);
    }

    @Override
    public String toString() {
        return code;
    }
}
