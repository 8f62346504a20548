// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.record;

import com.google.common.collect.ImmutableList;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// The ordered names of the scalar fields stored in every record of one data set. Records hold
/// their values in a plain array in this order, so field lookups in the accumulation loops are
/// array reads rather than string hashing. Names are resolved to indexes once per request.
public class FieldSchema {

    public static final int NOT_PRESENT = -1;

    private final ImmutableList<String> names;
    private final TObjectIntMap<String> indexForName;

    public FieldSchema (List<String> names) {
        this.names = ImmutableList.copyOf(names);
        this.indexForName = new TObjectIntHashMap<>(names.size() * 2, 0.5f, NOT_PRESENT);
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            checkArgument(!indexForName.containsKey(name), "Duplicate field name in schema: %s", name);
            indexForName.put(name, i);
        }
    }

    public static FieldSchema of (String... names) {
        return new FieldSchema(List.of(names));
    }

    /// @return the position of the named field in record value arrays, or NOT_PRESENT.
    public int indexOf (String name) {
        return indexForName.get(name);
    }

    public boolean contains (String name) {
        return indexForName.containsKey(name);
    }

    public int size () {
        return names.size();
    }

    public List<String> names () {
        return names;
    }

    @Override
    public boolean equals (Object other) {
        return other instanceof FieldSchema schema && names.equals(schema.names);
    }

    @Override
    public int hashCode () {
        return names.hashCode();
    }

    @Override
    public String toString () {
        return "FieldSchema" + names;
    }
}
