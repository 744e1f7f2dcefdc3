package me.golemcore.context.domain.service;

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
import me.golemcore.context.domain.model.ContextDomain;
import me.golemcore.context.domain.model.ContextItem;
import me.golemcore.context.domain.model.ContextSelectionResult;
import me.golemcore.context.infrastructure.config.ContextWindowProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders selected context items as a markdown block for the system prompt.
 *
 * <p>
 * Items are grouped by domain. Identity and relationship facts come first so
 * the model reads them before anything else; within a domain the admission
 * order is kept.
 */
@Service
@RequiredArgsConstructor
public class ContextPromptFormatter {

    private static final List<ContextDomain> LEADING_DOMAINS = List.of(
            ContextDomain.PERSONAL,
            ContextDomain.RELATIONSHIPS,
            ContextDomain.PREFERENCES,
            ContextDomain.HEALTH,
            ContextDomain.GOALS,
            ContextDomain.CONVERSATION);

    private final ContextWindowProperties properties;
    private final Clock clock;

    public String format(ContextSelectionResult result) {
        if (result == null) {
            return "";
        }
        return format(result.includedItems());
    }

    public String format(List<ContextItem> items) {
        if (items == null || items.isEmpty()) {
            return "";
        }

        Map<ContextDomain, List<ContextItem>> grouped = new EnumMap<>(ContextDomain.class);
        for (ContextItem item : items) {
            grouped.computeIfAbsent(item.domain(), k -> new ArrayList<>()).add(item);
        }

        Instant now = clock.instant();
        int maxItemChars = properties.getPrompt().getMaxItemChars();
        StringBuilder sb = new StringBuilder();
        sb.append(properties.getPrompt().getHeader()).append("\n\n");
        for (ContextDomain domain : renderOrder()) {
            List<ContextItem> domainItems = grouped.get(domain);
            if (domainItems == null) {
                continue;
            }
            sb.append("### ").append(heading(domain)).append("\n");
            for (ContextItem item : domainItems) {
                sb.append("- [")
                        .append(relativeTime(item.candidate().occurredAt(), now))
                        .append("] ")
                        .append(truncate(item.content(), maxItemChars))
                        .append("\n");
            }
            sb.append("\n");
        }
        return sb.toString().trim();
    }

    String heading(ContextDomain domain) {
        return switch (domain) {
        case PERSONAL -> "Personal Identity (IMPORTANT - User's Name, Location, etc.)";
        case RELATIONSHIPS -> "Relationships & Family";
        case HEALTH -> "Health & Wellness";
        case GOALS -> "Goals & Plans";
        case PREFERENCES -> "User Preferences";
        case CONVERSATION -> "Recent Conversations";
        case TASKS -> "Tasks & Work";
        case COMMUNITY -> "Community";
        case EVENTS_MEETUPS -> "Events";
        case PRODUCTS_SERVICES -> "Products & Services";
        case NOTES -> "Notes";
        };
    }

    String relativeTime(Instant occurredAt, Instant now) {
        if (occurredAt == null) {
            return "unknown";
        }
        Duration age = Duration.between(occurredAt, now);
        long minutes = age.toMinutes();
        long hours = age.toHours();
        long days = age.toDays();

        if (minutes < 5) {
            return "just now";
        }
        if (minutes < 60) {
            return minutes + "m ago";
        }
        if (hours < 24) {
            return hours + "h ago";
        }
        if (days == 1) {
            return "yesterday";
        }
        if (days < 7) {
            return days + "d ago";
        }
        return LocalDate.ofInstant(occurredAt, clock.getZone()).toString();
    }

    private Set<ContextDomain> renderOrder() {
        Set<ContextDomain> order = new LinkedHashSet<>(LEADING_DOMAINS);
        order.addAll(List.of(ContextDomain.values()));
        return order;
    }

    private String truncate(String text, int maxLen) {
        String normalized = text.replace('\r', ' ').replace('\n', ' ').trim();
        if (normalized.length() <= maxLen) {
            return normalized;
        }
        return normalized.substring(0, Math.max(0, maxLen - 3)) + "...";
    }
}
