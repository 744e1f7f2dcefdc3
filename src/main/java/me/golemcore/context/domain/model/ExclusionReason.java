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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Explanation for an excluded candidate. Scores and {@code similarityTo} are
 * present only for the reasons that involve them.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExclusionReason(
        String itemId,
        ContextDomain domain,
        ExclusionReasonType reason,
        String explanation,
        Integer relevanceScore,
        Integer confidenceScore,
        String similarityTo,
        BudgetScope scope) {
}
