package me.golemcore.context.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Static configuration for the context window service, bound from
 * application.properties under the {@code context-window.*} prefix.
 *
 * <p>
 * The runtime-tunable budget table lives in
 * {@link me.golemcore.context.domain.service.ContextBudgetConfigService}; these
 * properties cover the surrounding plumbing:
 * <ul>
 * <li>{@link DebugLogProperties} - bounded in-memory log of recent
 * selections</li>
 * <li>{@link PromptProperties} - rendering of selected items for the LLM
 * prompt</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "context-window")
@Data
public class ContextWindowProperties {

    private int defaultQualityScore = 50;
    private DebugLogProperties debugLog = new DebugLogProperties();
    private PromptProperties prompt = new PromptProperties();

    @Data
    public static class DebugLogProperties {
        private boolean enabled = true;
        private int capacity = 100;
        private int defaultLimit = 10;
    }

    @Data
    public static class PromptProperties {
        private int maxItemChars = 150;
        private String header = "## User Context (from Memory)";
    }
}
