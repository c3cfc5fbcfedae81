package org.itinera.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilIDMapperTest {

    private static final List<String> SCHOOLS = List.of("School A", "School B", "School C");

    @Test
    @DisplayName("Baseline Correctness: names map to request positions and back")
    void testSimpleMapping() {
        IDMapper mapper = IDMapper.fromOrderedNames(SCHOOLS);

        // Reverse
        assertEquals("School A", mapper.toExternal(0));
        assertEquals("School B", mapper.toExternal(1));

        // Membership
        assertTrue(mapper.containsExternal("School A"));
        assertFalse(mapper.containsExternal("School D"));

        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Unicode Support: non-Latin location names")
    void testUnicodeMapping() {
        IDMapper mapper = new FastUtilIDMapper(List.of("東京タワー", "Café Müller"));

        assertTrue(mapper.containsExternal("東京タワー"));
        assertEquals("Café Müller", mapper.toExternal(1));
    }

    @Test
    @DisplayName("Exception Path: invalid index")
    void testInvalidIndex() {
        IDMapper mapper = IDMapper.fromOrderedNames(SCHOOLS);

        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(3));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Validation: duplicate and null names are rejected")
    void testValidation() {
        assertThrows(IDMapper.DuplicateIDException.class,
                () -> IDMapper.fromOrderedNames(List.of("A", "B", "A")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(Arrays.asList("A", null)));
    }

    @Test
    @DisplayName("Edge Case: empty mapping")
    void testEmpty() {
        IDMapper mapper = IDMapper.fromOrderedNames(List.of());

        assertEquals(0, mapper.size());
        assertFalse(mapper.containsExternal("A"));
    }

    @Test
    @DisplayName("Concurrency: parallel reads see a consistent mapping")
    void testConcurrentReads() throws InterruptedException {
        IDMapper mapper = IDMapper.fromOrderedNames(SCHOOLS);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger errors = new AtomicInteger();

        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 1_000; i++) {
                    int index = i % SCHOOLS.size();
                    if (!mapper.containsExternal(SCHOOLS.get(index))
                            || !SCHOOLS.get(index).equals(mapper.toExternal(index))) {
                        errors.incrementAndGet();
                    }
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(0, errors.get());
    }
}
