package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Numbers the atoms of a clause set 1, 2, ... in lexicographic order, so that they can
 * serve as DIMACS variables. Every encoding of a clause set should go through one index.
 */
public final class VariableIndex {
    private final ImmutableSortedMap<String, Integer> ids;
    private final ImmutableList<String> atoms;  // atoms.get(i-1) has id i

    private VariableIndex(ImmutableSortedSet<String> atoms) {
        ImmutableSortedMap.Builder<String, Integer> b = ImmutableSortedMap.naturalOrder();
        int i = 0;
        for (String a : atoms) b.put(a, ++i);
        this.ids = b.build();
        this.atoms = atoms.asList();
    }

    public static VariableIndex of(Iterable<Clause> clauses) {
        ImmutableSortedSet.Builder<String> b = ImmutableSortedSet.naturalOrder();
        for (Clause c : clauses) {
            b.addAll(c.left());
            b.addAll(c.right());
        }
        return new VariableIndex(b.build());
    }

    /** @return the atom to id mapping */
    public ImmutableSortedMap<String, Integer> ids() { return ids; }

    public int size() { return atoms.size(); }

    public int id(String atom) {
        Integer i = ids.get(atom);
        if (i == null) throw new IllegalArgumentException("atom not indexed: " + atom);
        return i;
    }

    public String atom(int id) {
        if (id < 1 || id > atoms.size()) throw new IllegalArgumentException("variable out of range: " + id);
        return atoms.get(id - 1);
    }

    @Override
    public String toString() { return ids.toString(); }
}
