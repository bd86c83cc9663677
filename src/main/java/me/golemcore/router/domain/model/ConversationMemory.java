package me.golemcore.router.domain.model;

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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, ordered turn log for one conversation.
 *
 * <p>
 * Appending beyond capacity evicts the oldest turns first. System turns can be
 * dropped at append time when {@code includeSystemTurns} is false. Not
 * thread-safe: a conversation is processed one turn at a time by its owner.
 */
public class ConversationMemory {

    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final boolean includeSystemTurns;
    private final Deque<Turn> turns = new ArrayDeque<>();

    public ConversationMemory() {
        this(DEFAULT_CAPACITY, true);
    }

    public ConversationMemory(int capacity, boolean includeSystemTurns) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.includeSystemTurns = includeSystemTurns;
    }

    public void append(Turn turn) {
        if (turn.isSystem() && !includeSystemTurns) {
            return;
        }
        turns.addLast(turn);
        while (turns.size() > capacity) {
            turns.removeFirst();
        }
    }

    /**
     * Returns a snapshot of the stored turns, oldest first.
     */
    public List<Turn> recent() {
        return List.copyOf(turns);
    }

    /**
     * Returns at most {@code limit} most recent turns, oldest first.
     */
    public List<Turn> recent(int limit) {
        List<Turn> all = recent();
        if (limit <= 0 || all.size() <= limit) {
            return all;
        }
        return all.subList(all.size() - limit, all.size());
    }

    public int size() {
        return turns.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        turns.clear();
    }
}
