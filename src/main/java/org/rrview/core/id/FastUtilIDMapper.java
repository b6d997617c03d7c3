package org.rrview.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link IDMapper} over a fastutil open hash map (name -> id) and a plain
 * array (id -> name). Lookups do not box.
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * @param names names in id order; id {@code i} is {@code names.get(i)}.
     */
    public FastUtilIDMapper(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("Names cannot be null");
        }
        int size = names.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int id = 0; id < size; id++) {
            String name = names.get(id);
            if (name == null) {
                throw new IllegalArgumentException("Name at index " + id + " is null");
            }
            int previous = forward.put(name, id);
            if (previous != MISSING) {
                throw new IllegalArgumentException(
                        "Duplicate name '" + name + "' at indices " + previous + " and " + id);
            }
            reverse[id] = name;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String name) throws UnknownIDException {
        int id = forward.getInt(name);
        if (id == MISSING) {
            throw new UnknownIDException("Name not found: " + name);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String name) {
        return forward.containsKey(name);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
