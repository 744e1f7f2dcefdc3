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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.component.SimilarityComponent;
import me.golemcore.context.domain.component.TopicComponent;
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.service.ContextBudgetConfigService;
import me.golemcore.context.domain.service.ContextWindowLogBuffer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for the context window service.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper} beans</li>
 * <li>Creates the debug log buffer when
 * {@code context-window.debug-log.enabled} is true</li>
 * <li>Logs the active budget table and strategies on startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ContextWindowConfiguration {

    private final ContextWindowProperties properties;
    private final ContextBudgetConfigService configService;
    private final SimilarityComponent similarityComponent;
    private final TopicComponent topicComponent;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnProperty(prefix = "context-window.debug-log", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ContextWindowLogBuffer contextWindowLogBuffer(ContextWindowProperties contextWindowProperties) {
        return new ContextWindowLogBuffer(contextWindowProperties.getDebugLog().getCapacity());
    }

    @PostConstruct
    public void init() {
        ContextBudgetConfig config = configService.getConfig();
        log.info("[ContextWindow] Context window service starting...");
        log.info("[ContextWindow] Budget: {} chars, {} items, {} domains, fallback={}",
                config.totalBudgetChars(), config.totalItemLimit(), config.domainBudgets().size(),
                config.fallbackDomain());
        log.info("[ContextWindow] Strategies: similarity={}, topic={}",
                similarityComponent.getClass().getSimpleName(), topicComponent.getClass().getSimpleName());
        if (properties.getDebugLog().isEnabled()) {
            log.info("[ContextWindow] Debug log enabled (capacity {})", properties.getDebugLog().getCapacity());
        } else {
            log.info("[ContextWindow] Debug log disabled");
        }
    }
}
