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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.adapter.inbound.web.dto.ContextSelectionRequest;
import me.golemcore.context.adapter.inbound.web.dto.ContextSelectionResponse;
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.ContextSelectionResult;
import me.golemcore.context.domain.model.ContextWindowLog;
import me.golemcore.context.domain.model.MemoryCandidate;
import me.golemcore.context.domain.model.MemorySource;
import me.golemcore.context.domain.model.SelectionMetadata;
import me.golemcore.context.domain.service.ContextPromptFormatter;
import me.golemcore.context.domain.service.ContextWindowLogBuffer;
import me.golemcore.context.domain.service.ContextWindowService;
import me.golemcore.context.domain.service.SelectionDebugFormatter;
import me.golemcore.context.infrastructure.config.ContextWindowProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Context window selection endpoints.
 */
@RestController
@RequestMapping("/api/context")
@RequiredArgsConstructor
@Slf4j
public class ContextWindowController {

    private final ContextWindowService contextWindowService;
    private final ContextPromptFormatter promptFormatter;
    private final SelectionDebugFormatter debugFormatter;
    private final ContextWindowProperties properties;
    private final ObjectProvider<ContextWindowLogBuffer> logBufferProvider;

    @PostMapping("/select")
    public Mono<ResponseEntity<ContextSelectionResponse>> select(@RequestBody ContextSelectionRequest request) {
        ContextSelectionResult result = runSelection(request);
        ContextSelectionResponse response = ContextSelectionResponse.builder()
                .result(result)
                .renderedContext(promptFormatter.format(result))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @PostMapping("/preview")
    public Mono<ResponseEntity<ContextSelectionResponse>> preview(@RequestBody ContextSelectionRequest request) {
        ContextSelectionResult result = runSelection(request);
        ContextSelectionResponse response = ContextSelectionResponse.builder()
                .result(result)
                .renderedContext(promptFormatter.format(result))
                .report(debugFormatter.format(result))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/logs")
    public Mono<ResponseEntity<List<ContextWindowLog>>> getLogs(@RequestParam(required = false) Integer limit) {
        ContextWindowLogBuffer logBuffer = logBufferProvider.getIfAvailable();
        if (logBuffer == null) {
            throw new IllegalStateException("Context window debug log is disabled");
        }
        int resolvedLimit = limit != null ? limit : properties.getDebugLog().getDefaultLimit();
        if (resolvedLimit <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");
        }
        return Mono.just(ResponseEntity.ok(logBuffer.recent(resolvedLimit)));
    }

    private ContextSelectionResult runSelection(ContextSelectionRequest request) {
        if (request == null || request.getCandidates() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "candidates are required");
        }
        Integer qualityScore = request.getQualityScore();
        if (qualityScore != null && (qualityScore < 0 || qualityScore > 100)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "qualityScore must be within 0-100");
        }

        List<MemoryCandidate> candidates = new ArrayList<>(request.getCandidates().size());
        for (ContextSelectionRequest.CandidateDto dto : request.getCandidates()) {
            candidates.add(toCandidate(dto));
        }
        SelectionMetadata metadata = new SelectionMetadata(request.getTurnId(), request.getUserId(),
                request.getTenantId());
        log.debug("[API] Context selection requested: {} candidates, turn={}", candidates.size(),
                metadata.turnId());
        return contextWindowService.selectContext(candidates, qualityScore, metadata);
    }

    private MemoryCandidate toCandidate(ContextSelectionRequest.CandidateDto dto) {
        if (dto == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "candidate must not be null");
        }
        if (dto.getId() == null || dto.getId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "candidate id is required");
        }
        return MemoryCandidate.builder()
                .id(dto.getId())
                .domain(ContextDomain.fromCode(dto.getDomain()))
                .content(dto.getContent())
                .importance(dto.getImportance())
                .occurredAt(dto.getOccurredAt())
                .source(MemorySource.fromCode(dto.getSource()))
                .build();
    }
}
