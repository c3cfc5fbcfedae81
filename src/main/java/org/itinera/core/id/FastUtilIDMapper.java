package org.itinera.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link IDMapper} backed by a fastutil open hash map.
 *
 * Thread-safe for concurrent reads.
 */
public class FastUtilIDMapper implements IDMapper {

    // name -> index
    private final Object2IntOpenHashMap<String> forward;
    // index -> name
    private final String[] reverse;

    /**
     * Builds the mapping from names in index order.
     */
    public FastUtilIDMapper(List<String> orderedNames) {
        if (orderedNames == null) {
            throw new IllegalArgumentException("Names cannot be null");
        }
        int size = orderedNames.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.reverse = new String[size];

        for (int index = 0; index < size; index++) {
            String name = orderedNames.get(index);
            if (name == null) {
                throw new IllegalArgumentException("Name at index " + index + " cannot be null");
            }
            if (forward.containsKey(name)) {
                throw new DuplicateIDException("Duplicate name: " + name);
            }
            forward.put(name, index);
            reverse[index] = name;
        }
        this.forward.trim();
    }

    @Override
    public String toExternal(int index) {
        try {
            return reverse[index];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Index out of bounds: " + index);
        }
    }

    @Override
    public boolean containsExternal(String name) {
        return forward.containsKey(name);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
