package me.golemcore.context;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the context window service.
 *
 * <p>
 * Selects a small, diverse, budget-constrained subset of memory facts for
 * injection into a language model prompt, and explains every exclusion.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout:
 *
 * <pre>
 * Input Layer        → ContextWindowController, ContextConfigController
 * Domain Layer       → ContextWindowService, selector, saturation, metrics
 * Infrastructure     → Spring configuration, trace listener
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Static settings via {@code application.properties} under the
 * {@code context-window.*} prefix. The budget table is tunable at runtime
 * through {@code /api/context/config}.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextWindowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextWindowApplication.class, args);
    }

}
