package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * A partial assignment of truth values to atoms. Atoms the model does not mention are
 * unconstrained.
 */
public final class Model {
    private final ImmutableSortedMap<String, Boolean> assignment;

    private Model(ImmutableSortedMap<String, Boolean> assignment) {
        this.assignment = assignment;
    }

    /**
     * Reinterpret a clause as an assignment: atoms on its left are true, atoms on its right false.
     */
    public static Model of(Clause c) {
        ImmutableSortedMap.Builder<String, Boolean> b = ImmutableSortedMap.naturalOrder();
        c.left().forEach(a -> b.put(a, true));
        c.right().forEach(a -> b.put(a, false));
        return new Model(b.build());
    }

    public static Model of(Map<String, Boolean> assignment) {
        return new Model(ImmutableSortedMap.copyOf(assignment));
    }

    public ImmutableSortedMap<String, Boolean> assignment() { return assignment; }

    /** @return the assignment as (atom, value) pairs ordered by atom name */
    public ImmutableList<Map.Entry<String, Boolean>> entries() { return assignment.entrySet().asList(); }

    public boolean isEmpty() { return assignment.isEmpty(); }

    /**
     * Extend this model to a total valuation of the given atoms.
     * @param atoms atoms that must receive a value
     * @param unconstrained value given to atoms this model leaves open
     * @return a valuation covering the model's atoms and the given ones
     */
    public Map<String, Boolean> valuation(Iterable<String> atoms, boolean unconstrained) {
        Map<String, Boolean> v = Maps.newTreeMap();
        atoms.forEach(a -> v.put(a, unconstrained));
        v.putAll(assignment);
        return v;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Model && ((Model) o).assignment.equals(assignment);
    }

    @Override
    public int hashCode() { return assignment.hashCode(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        assignment.forEach((a, b) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(a).append('=').append(b);
        });
        return sb.toString();
    }
}
