package org.Aayush.wfst.compose;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.fst.InvalidStateException;

import java.util.Objects;

/**
 * Append-only bijection between state tuples and dense state ids.
 * <p>
 * An id is assigned the first time a tuple is seen and reused thereafter. Ids are never
 * freed or reused, so the table only grows.
 * </p>
 *
 * @param <T> tuple type with value equality.
 */
public final class StateTable<T> {
    private static final int ABSENT = -1;

    // tuple -> id (forward lookup)
    private final Object2IntOpenHashMap<T> idByTuple = new Object2IntOpenHashMap<>();
    // id -> tuple (reverse lookup)
    private final ObjectArrayList<T> tupleById = new ObjectArrayList<>();

    public StateTable() {
        idByTuple.defaultReturnValue(ABSENT);
    }

    /**
     * Returns the id of {@code tuple}, allocating the next id on first sight.
     */
    public int findId(T tuple) {
        Objects.requireNonNull(tuple, "tuple");
        int id = idByTuple.getInt(tuple);
        if (id == ABSENT) {
            id = tupleById.size();
            tupleById.add(tuple);
            idByTuple.put(tuple, id);
        }
        return id;
    }

    /**
     * Returns the tuple registered under {@code id}.
     *
     * @throws InvalidStateException when {@code id} was never allocated.
     */
    public T findTuple(int id) {
        if (!contains(id)) {
            throw InvalidStateException.unknownState(id, tupleById.size());
        }
        return tupleById.get(id);
    }

    public boolean contains(int id) {
        return id >= 0 && id < tupleById.size();
    }

    public int size() {
        return tupleById.size();
    }
}
