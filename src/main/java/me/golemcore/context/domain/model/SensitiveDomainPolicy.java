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

import lombok.Builder;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Flood protection for sensitive domains: once a sensitive domain holds
 * {@code maxNonCriticalItems} admitted items, only critical items get in.
 */
@Builder(toBuilder = true)
public record SensitiveDomainPolicy(Set<ContextDomain> domains, int maxNonCriticalItems) {

    public SensitiveDomainPolicy {
        domains = immutableDomainSet(domains);
    }

    public boolean isSensitive(ContextDomain domain) {
        return domains.contains(domain);
    }

    static Set<ContextDomain> immutableDomainSet(Collection<ContextDomain> source) {
        EnumSet<ContextDomain> copy = EnumSet.noneOf(ContextDomain.class);
        if (source != null) {
            for (ContextDomain domain : source) {
                if (domain != null) {
                    copy.add(domain);
                }
            }
        }
        return Collections.unmodifiableSet(copy);
    }
}
