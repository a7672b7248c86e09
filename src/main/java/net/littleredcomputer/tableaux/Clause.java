package net.littleredcomputer.tableaux;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;

/**
 * The atoms forced true and forced false along one saturated branch of a tableau. Read as a
 * sequent {@code p, q ⊢ r, s}, the clause is falsified exactly by the assignments making every
 * atom on the left true and every atom on the right false.
 */
public final class Clause {
    private static final Joiner commaJoiner = Joiner.on(", ");

    private final ImmutableSortedSet<String> left;
    private final ImmutableSortedSet<String> right;

    Clause(ImmutableSortedSet<String> left, ImmutableSortedSet<String> right) {
        this.left = left;
        this.right = right;
    }

    public static Clause of(Collection<String> left, Collection<String> right) {
        return new Clause(ImmutableSortedSet.copyOf(left), ImmutableSortedSet.copyOf(right));
    }

    /** @return atoms forced true on this branch */
    public ImmutableSortedSet<String> left() { return left; }

    /** @return atoms forced false on this branch */
    public ImmutableSortedSet<String> right() { return right; }

    public boolean isEmpty() { return left.isEmpty() && right.isEmpty(); }

    public Model toModel() { return Model.of(this); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        Clause c = (Clause) o;
        return left.equals(c.left) && right.equals(c.right);
    }

    @Override
    public int hashCode() {
        return 31 * left.hashCode() + right.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        commaJoiner.appendTo(sb, left);
        if (!left.isEmpty()) sb.append(' ');
        sb.append('⊢');
        if (!right.isEmpty()) sb.append(' ');
        commaJoiner.appendTo(sb, right);
        return sb.append(')').toString();
    }

    /**
     * @return the clauses as a comma-separated list of sequents, e.g. {@code (a, b ⊢ c), (⊢ d)}
     */
    public static String toString(Iterable<Clause> clauses) {
        return commaJoiner.join(clauses);
    }
}
