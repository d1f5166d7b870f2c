package me.golemcore.monitor.history;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring buffer of exchanges for a single user.
 *
 * <p>
 * Appending to a full buffer overwrites the oldest slot, so the capacity is
 * never exceeded. Iteration order is arrival order.
 *
 * <p>
 * Not thread-safe; {@link SessionHistory} only touches a buffer while holding
 * the map bin for its user.
 */
class ExchangeBuffer {

    private final Exchange[] slots;
    private int head;
    private int size;

    ExchangeBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive, got " + capacity);
        }
        this.slots = new Exchange[capacity];
    }

    void append(Exchange exchange) {
        int tail = (head + size) % slots.length;
        slots[tail] = exchange;
        if (size < slots.length) {
            size++;
        } else {
            head = (head + 1) % slots.length;
        }
    }

    /**
     * Drop every exchange recorded before {@code cutoff}, keeping the rest in
     * order.
     *
     * @return number of exchanges removed
     */
    int removeOlderThan(Instant cutoff) {
        Exchange[] ordered = new Exchange[size];
        for (int i = 0; i < size; i++) {
            ordered[i] = slots[(head + i) % slots.length];
        }
        int kept = 0;
        for (Exchange exchange : ordered) {
            if (!exchange.timestamp().isBefore(cutoff)) {
                slots[kept++] = exchange;
            }
        }
        for (int i = kept; i < slots.length; i++) {
            slots[i] = null;
        }
        int removed = size - kept;
        head = 0;
        size = kept;
        return removed;
    }

    List<Exchange> snapshot() {
        List<Exchange> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(slots[(head + i) % slots.length]);
        }
        return List.copyOf(copy);
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    int capacity() {
        return slots.length;
    }
}
