package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Optional;

/**
 * The atoms forced true and forced false so far along one path of a tableau. Both sets only
 * grow as the path is extended. A path closes when an atom about to be forced one way is
 * already forced the other way.
 */
final class Branch {
    private final ImmutableSortedSet<String> trueAtoms;
    private final ImmutableSortedSet<String> falseAtoms;

    private Branch(ImmutableSortedSet<String> trueAtoms, ImmutableSortedSet<String> falseAtoms) {
        this.trueAtoms = trueAtoms;
        this.falseAtoms = falseAtoms;
    }

    /**
     * The initial sets are taken as given, even if they overlap; only atoms added later are checked.
     * @return a branch with the given forced atoms
     */
    static Branch of(Iterable<String> trueAtoms, Iterable<String> falseAtoms) {
        return new Branch(ImmutableSortedSet.copyOf(trueAtoms), ImmutableSortedSet.copyOf(falseAtoms));
    }

    /**
     * @param atom an atom found among the hypotheses
     * @return the extended branch, or empty if the atom is already forced false
     */
    Optional<Branch> assertTrue(String atom) {
        if (falseAtoms.contains(atom)) return Optional.empty();
        if (trueAtoms.contains(atom)) return Optional.of(this);
        return Optional.of(new Branch(with(trueAtoms, atom), falseAtoms));
    }

    /**
     * @param atom an atom found among the goals
     * @return the extended branch, or empty if the atom is already forced true
     */
    Optional<Branch> assertFalse(String atom) {
        if (trueAtoms.contains(atom)) return Optional.empty();
        if (falseAtoms.contains(atom)) return Optional.of(this);
        return Optional.of(new Branch(trueAtoms, with(falseAtoms, atom)));
    }

    private static ImmutableSortedSet<String> with(ImmutableSortedSet<String> s, String atom) {
        return ImmutableSortedSet.<String>naturalOrder().addAll(s).add(atom).build();
    }

    Clause toClause() { return new Clause(trueAtoms, falseAtoms); }

    @Override
    public String toString() { return toClause().toString(); }
}
