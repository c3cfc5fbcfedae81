package org.itinera.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Mapping between location names and dense matrix indices.
 *
 * <p>Index {@code i} is the position of the name in the planning request, which is also
 * the row/column of that location in the travel matrix. Used to reject repeated names
 * and to name locations referenced by index.</p>
 */
public interface IDMapper {

    /**
     * Converts a matrix index back to its name.
     * @param index matrix index.
     * @return location name.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String toExternal(int index);

    /**
     * Checks whether a name is mapped.
     */
    boolean containsExternal(String name);

    /**
     * Returns number of mapped names.
     */
    int size();

    /**
     * Exception thrown when the same name appears twice in the input order.
     */
    @StandardException
    class DuplicateIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable mapper from names in matrix order.
     *
     * @param orderedNames names, position = index.
     * @return immutable mapper.
     * @throws DuplicateIDException when a name repeats.
     */
    static IDMapper fromOrderedNames(List<String> orderedNames) {
        return new FastUtilIDMapper(orderedNames);
    }
}
