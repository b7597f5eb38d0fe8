package me.golemcore.orchestrator.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.CapacityExhaustedException;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Generational index allocator for session ids.
 *
 * <p>
 * A {@link SessionId} packs {@code (generation << indexBits) | index} into 32
 * bits. Released slots go onto a LIFO free stack; reusing a slot bumps its
 * generation (modulo {@code 2^(32 - indexBits)}) so every id previously handed
 * out for that slot stops validating. Slots are never handed out twice while
 * alive and the allocator never wraps past its capacity.
 *
 * <p>
 * After {@code 2^(32 - indexBits)} reuses of the same slot the generation
 * wraps and a very old id could validate again; this is inherent to the
 * scheme.
 *
 * <p>
 * Mutations happen on the scheduler thread; the methods are synchronized so
 * validity checks from other threads see a consistent view.
 */
@Component
@Slf4j
public class GenerationalIdAllocator {

    private static final int MIN_INDEX_BITS = 1;
    private static final int MAX_INDEX_BITS = 24;
    private static final int INITIAL_SLOTS = 64;

    private final int indexBits;
    private final int indexMask;
    private final int generationMask;
    private final int capacity;
    private final Deque<Integer> freeSlots = new ArrayDeque<>();

    private int[] generations = new int[INITIAL_SLOTS];
    private boolean[] alive = new boolean[INITIAL_SLOTS];
    private int highWater;
    private int liveCount;

    @Autowired
    public GenerationalIdAllocator(OrchestratorProperties properties) {
        this(properties.getIds().getIndexBits());
    }

    public GenerationalIdAllocator(int indexBits) {
        if (indexBits < MIN_INDEX_BITS || indexBits > MAX_INDEX_BITS) {
            throw new IllegalArgumentException("indexBits must be between " + MIN_INDEX_BITS + " and "
                    + MAX_INDEX_BITS + ", got " + indexBits);
        }
        this.indexBits = indexBits;
        this.capacity = 1 << indexBits;
        this.indexMask = capacity - 1;
        this.generationMask = (int) ((1L << (32 - indexBits)) - 1);
    }

    /**
     * Hands out a fresh or recycled slot.
     *
     * @throws CapacityExhaustedException
     *             when every slot is alive
     */
    public synchronized SessionId allocate() {
        int index;
        if (!freeSlots.isEmpty()) {
            index = freeSlots.pop();
            generations[index] = (generations[index] + 1) & generationMask;
        } else if (highWater < capacity) {
            index = highWater++;
            ensureSlots(highWater);
            generations[index] = 0;
        } else {
            log.error("[Ids] Session capacity exhausted: {} live sessions", liveCount);
            throw new CapacityExhaustedException(capacity);
        }
        alive[index] = true;
        liveCount++;
        return encode(index, generations[index]);
    }

    /**
     * Frees the slot behind {@code id}.
     *
     * @return false, without touching any state, when the id is not currently
     *         valid
     */
    public synchronized boolean release(SessionId id) {
        if (!isValid(id)) {
            return false;
        }
        int index = indexOf(id);
        alive[index] = false;
        liveCount--;
        freeSlots.push(index);
        return true;
    }

    public synchronized boolean isValid(SessionId id) {
        if (id == null) {
            return false;
        }
        int index = indexOf(id);
        return index < highWater && alive[index] && generations[index] == generationOf(id);
    }

    /**
     * Whether the slot behind {@code id} has ever been handed out. An issued id
     * that is no longer valid is stale rather than unknown.
     */
    public synchronized boolean wasIssued(SessionId id) {
        return id != null && indexOf(id) < highWater;
    }

    /**
     * Last generation issued for every slot that has ever been handed out,
     * indexed by slot.
     */
    public synchronized int[] generationTable() {
        return Arrays.copyOf(generations, highWater);
    }

    /**
     * Seeds the allocator with a table from {@link #generationTable()} so that
     * ids issued before a restart are never issued again. Every restored slot
     * starts out free; live ids are re-established with {@link #claim}
     * afterwards.
     *
     * @throws IllegalStateException
     *             if any slot has already been handed out
     */
    public synchronized void restoreGenerations(int[] table) {
        if (highWater > 0) {
            throw new IllegalStateException("Generations can only be restored into an empty allocator");
        }
        int slots = Math.min(table.length, capacity);
        ensureSlots(slots);
        for (int slot = slots - 1; slot >= 0; slot--) {
            generations[slot] = table[slot] & generationMask;
            freeSlots.push(slot);
        }
        highWater = slots;
    }

    /**
     * Re-establishes an id read back from persisted records. Slots below it
     * that were never claimed become free.
     *
     * @throws IllegalStateException
     *             if the slot is already alive
     */
    public synchronized void claim(SessionId id) {
        int index = indexOf(id);
        if (index < highWater && alive[index]) {
            throw new IllegalStateException("Session slot " + index + " is already claimed");
        }
        if (index >= highWater) {
            ensureSlots(index + 1);
            for (int slot = highWater; slot < index; slot++) {
                generations[slot] = 0;
                freeSlots.push(slot);
            }
            highWater = index + 1;
        } else {
            freeSlots.remove(index);
        }
        generations[index] = generationOf(id);
        alive[index] = true;
        liveCount++;
    }

    public synchronized int getLiveCount() {
        return liveCount;
    }

    public int getIndexBits() {
        return indexBits;
    }

    public int getCapacity() {
        return capacity;
    }

    public int indexOf(SessionId id) {
        return id.value() & indexMask;
    }

    public int generationOf(SessionId id) {
        return (id.value() >>> indexBits) & generationMask;
    }

    private SessionId encode(int index, int generation) {
        return new SessionId((generation << indexBits) | index);
    }

    private void ensureSlots(int required) {
        if (required <= generations.length) {
            return;
        }
        int size = Math.min(capacity, Math.max(required, generations.length * 2));
        generations = Arrays.copyOf(generations, size);
        alive = Arrays.copyOf(alive, size);
    }
}
