package me.golemcore.context.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.context.domain.model.ContextBudgetConfig;
import me.golemcore.context.domain.model.ContextBudgetConfigUpdate;
import me.golemcore.context.domain.service.ContextBudgetConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Runtime budget table endpoints.
 */
@RestController
@RequestMapping("/api/context/config")
@RequiredArgsConstructor
public class ContextConfigController {

    private final ContextBudgetConfigService configService;

    @GetMapping
    public Mono<ResponseEntity<ContextBudgetConfig>> getConfig() {
        return Mono.just(ResponseEntity.ok(configService.getConfig()));
    }

    @PatchMapping
    public Mono<ResponseEntity<ContextBudgetConfig>> updateConfig(@RequestBody ContextBudgetConfigUpdate update) {
        return Mono.just(ResponseEntity.ok(configService.updateConfig(update)));
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<ContextBudgetConfig>> resetConfig() {
        return Mono.just(ResponseEntity.ok(configService.resetConfig()));
    }
}
