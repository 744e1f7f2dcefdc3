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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Typed cause for keeping a candidate out of the context window.
 */
public enum ExclusionReasonType {
    DOMAIN_CAP_EXCEEDED("domain_cap_exceeded"),
    TOTAL_CAP_EXCEEDED("total_cap_exceeded"),
    BELOW_RELEVANCE_THRESHOLD("below_relevance_threshold"),
    BELOW_CONFIDENCE_THRESHOLD("below_confidence_threshold"),
    REDUNDANT_CONTENT("redundant_content"),
    TOPIC_SATURATION("topic_saturation"),
    CHAR_LIMIT_EXCEEDED("char_limit_exceeded"),
    SENSITIVE_DOMAIN_PROTECTION("sensitive_domain_protection");

    private final String code;

    ExclusionReasonType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
