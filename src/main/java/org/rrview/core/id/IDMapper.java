package org.rrview.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Two-way lookup between user-facing names (net names, block names) and the dense
 * integer ids the engine works with.
 */
public interface IDMapper {

    /**
     * Resolves a name to its dense id.
     *
     * @param name user-facing name.
     * @return dense id.
     * @throws UnknownIDException if the name is not mapped.
     */
    int toInternal(String name) throws UnknownIDException;

    /**
     * Resolves a dense id to its name.
     *
     * @param internalId dense id.
     * @return user-facing name.
     * @throws IndexOutOfBoundsException if the id is outside {@code [0, size)}.
     */
    String toExternal(int internalId);

    boolean containsExternal(String name);

    boolean containsInternal(int internalId);

    int size();

    /**
     * Raised when a name has no mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Builds an immutable mapper where {@code names.get(i)} maps to id {@code i}.
     *
     * @param names names in id order; must be non-null and unique.
     */
    static IDMapper fromOrderedNames(List<String> names) {
        return new FastUtilIDMapper(names);
    }
}
