package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.exception.CapacityExhaustedException;
import me.golemcore.orchestrator.domain.model.SessionId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GenerationalIdAllocatorTest {

    private GenerationalIdAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new GenerationalIdAllocator(16);
    }

    // ==================== allocate ====================

    @Test
    void firstAllocationUsesSlotZeroGenerationZero() {
        SessionId id = allocator.allocate();

        assertEquals(0, id.value());
        assertEquals(0, allocator.indexOf(id));
        assertEquals(0, allocator.generationOf(id));
        assertTrue(allocator.isValid(id));
    }

    @Test
    void freshAllocationsUseDistinctSlots() {
        Set<Integer> indexes = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            indexes.add(allocator.indexOf(allocator.allocate()));
        }

        assertEquals(100, indexes.size());
        assertEquals(100, allocator.getLiveCount());
    }

    @Test
    void releasedSlotIsReusedWithNextGeneration() {
        SessionId first = allocator.allocate();

        assertTrue(allocator.release(first));
        SessionId second = allocator.allocate();

        assertEquals(allocator.indexOf(first), allocator.indexOf(second));
        assertEquals(1, allocator.generationOf(second));
        assertEquals(0x0001_0000, second.value());
        assertFalse(allocator.isValid(first));
        assertTrue(allocator.isValid(second));
    }

    @Test
    void freeSlotsAreReusedLastInFirstOut() {
        SessionId a = allocator.allocate();
        SessionId b = allocator.allocate();
        SessionId c = allocator.allocate();
        allocator.release(a);
        allocator.release(c);

        assertEquals(allocator.indexOf(c), allocator.indexOf(allocator.allocate()));
        assertEquals(allocator.indexOf(a), allocator.indexOf(allocator.allocate()));
        assertTrue(allocator.isValid(b));
    }

    @Test
    void exhaustingCapacityThrowsInsteadOfWrapping() {
        GenerationalIdAllocator small = new GenerationalIdAllocator(2);
        for (int i = 0; i < 4; i++) {
            small.allocate();
        }

        assertThrows(CapacityExhaustedException.class, small::allocate);
        assertEquals(4, small.getLiveCount());
    }

    @Test
    void capacityFreesUpAfterRelease() {
        GenerationalIdAllocator small = new GenerationalIdAllocator(1);
        SessionId first = small.allocate();
        small.allocate();
        small.release(first);

        SessionId reused = small.allocate();

        assertEquals(small.indexOf(first), small.indexOf(reused));
        assertNotEquals(first, reused);
    }

    @Test
    void generationWrapsWithinItsBits() {
        GenerationalIdAllocator wide = new GenerationalIdAllocator(24);
        SessionId id = wide.allocate();
        for (int i = 0; i < 256; i++) {
            wide.release(id);
            id = wide.allocate();
        }

        assertEquals(0, wide.generationOf(id));
        assertEquals(0, wide.indexOf(id));
    }

    // ==================== release ====================

    @Test
    void releaseOfAlreadyReleasedIdReturnsFalse() {
        SessionId id = allocator.allocate();
        allocator.release(id);

        assertFalse(allocator.release(id));
        assertEquals(0, allocator.getLiveCount());
    }

    @Test
    void releaseOfStaleIdDoesNotFreeTheNewOccupant() {
        SessionId old = allocator.allocate();
        allocator.release(old);
        SessionId current = allocator.allocate();

        assertFalse(allocator.release(old));
        assertTrue(allocator.isValid(current));
    }

    @Test
    void releaseOfNeverIssuedIdReturnsFalse() {
        assertFalse(allocator.release(new SessionId(42)));
        assertFalse(allocator.release(null));
    }

    // ==================== isValid / wasIssued ====================

    @Test
    void oldIdStaysInvalidAcrossManyReuses() {
        SessionId original = allocator.allocate();
        SessionId current = original;
        for (int i = 0; i < 10; i++) {
            allocator.release(current);
            current = allocator.allocate();
        }

        assertFalse(allocator.isValid(original));
        assertTrue(allocator.wasIssued(original));
    }

    @Test
    void neverIssuedIdIsNotValidAndNotIssued() {
        SessionId unknown = new SessionId(7);

        assertFalse(allocator.isValid(unknown));
        assertFalse(allocator.wasIssued(unknown));
    }

    // ==================== claim ====================

    @Test
    void claimRestoresPersistedIdAndFreesSkippedSlots() {
        SessionId persisted = new SessionId((3 << 16) | 5);

        allocator.claim(persisted);

        assertTrue(allocator.isValid(persisted));
        assertEquals(1, allocator.getLiveCount());
        Set<Integer> reused = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            reused.add(allocator.indexOf(allocator.allocate()));
        }
        assertEquals(Set.of(0, 1, 2, 3, 4), reused);
        assertEquals(6, allocator.indexOf(allocator.allocate()));
    }

    @Test
    void claimOfLiveSlotIsRejected() {
        SessionId id = allocator.allocate();

        assertThrows(IllegalStateException.class, () -> allocator.claim(id));
    }

    // ==================== generation table ====================

    @Test
    void generationTableTracksLastIssuedGeneration() {
        SessionId first = allocator.allocate();
        allocator.allocate();
        allocator.release(first);
        allocator.allocate();

        assertArrayEquals(new int[] { 1, 0 }, allocator.generationTable());
    }

    @Test
    void restoredGenerationsAreNeverIssuedAgain() {
        GenerationalIdAllocator previous = new GenerationalIdAllocator(16);
        SessionId old = previous.allocate();
        previous.release(old);
        SessionId reused = previous.allocate();
        previous.release(reused);

        allocator.restoreGenerations(previous.generationTable());

        SessionId next = allocator.allocate();
        assertEquals(0, allocator.indexOf(next));
        assertEquals(2, allocator.generationOf(next));
        assertFalse(allocator.isValid(reused));
        assertTrue(allocator.wasIssued(reused));
    }

    @Test
    void claimAfterRestoreTakesSlotOffTheFreeStack() {
        allocator.restoreGenerations(new int[] { 3, 4 });
        SessionId live = new SessionId((4 << 16) | 1);

        allocator.claim(live);

        assertTrue(allocator.isValid(live));
        SessionId next = allocator.allocate();
        assertEquals(0, allocator.indexOf(next));
        assertEquals(4, allocator.generationOf(next));
        assertEquals(2, allocator.indexOf(allocator.allocate()));
    }

    @Test
    void restoreIntoUsedAllocatorIsRejected() {
        allocator.allocate();

        assertThrows(IllegalStateException.class, () -> allocator.restoreGenerations(new int[] { 1 }));
    }

    @Test
    void rejectsUnsupportedIndexBits() {
        assertThrows(IllegalArgumentException.class, () -> new GenerationalIdAllocator(0));
        assertThrows(IllegalArgumentException.class, () -> new GenerationalIdAllocator(31));
    }
}
