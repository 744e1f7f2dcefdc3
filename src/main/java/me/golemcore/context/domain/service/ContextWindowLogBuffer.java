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

import me.golemcore.context.domain.model.ContextWindowLog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded ring buffer of recent selection logs. Appends are serialized; reads
 * return a copy, so readers may see a slightly stale view.
 */
public class ContextWindowLogBuffer {

    private final int capacity;
    private final Deque<ContextWindowLog> entries;

    public ContextWindowLogBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Log buffer capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void append(ContextWindowLog entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Newest {@code limit} entries, oldest first.
     */
    public synchronized List<ContextWindowLog> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ContextWindowLog> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - limit);
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
