package net.littleredcomputer.tableaux;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A proof obligation {@code left ⊢ right}: the formulas on the left are assumed true and
 * those on the right assumed false. Decomposition always works on the head (first element)
 * of a side, and new formulas are prepended.
 */
public final class Sequent {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private static final Sequent EMPTY = new Sequent(ImmutableList.of(), ImmutableList.of());

    private final ImmutableList<Formula> left;
    private final ImmutableList<Formula> right;

    private Sequent(ImmutableList<Formula> left, ImmutableList<Formula> right) {
        this.left = left;
        this.right = right;
    }

    public static Sequent of(Iterable<Formula> left, Iterable<Formula> right) {
        return new Sequent(ImmutableList.copyOf(left), ImmutableList.copyOf(right));
    }

    public static Sequent empty() { return EMPTY; }

    /** The sequent {@code ⊢ f}, refuted exactly by the countermodels of f. */
    public static Sequent goal(Formula f) { return new Sequent(ImmutableList.of(), ImmutableList.of(checkNotNull(f))); }

    /** The sequent {@code f ⊢}, refuted exactly by the models of f. */
    public static Sequent hypothesis(Formula f) { return new Sequent(ImmutableList.of(checkNotNull(f)), ImmutableList.of()); }

    public ImmutableList<Formula> left() { return left; }
    public ImmutableList<Formula> right() { return right; }

    public boolean isEmpty() { return left.isEmpty() && right.isEmpty(); }

    ImmutableList<Formula> leftRest() { return left.subList(1, left.size()); }
    ImmutableList<Formula> rightRest() { return right.subList(1, right.size()); }

    /** @return this sequent without the head of its left side */
    Sequent dropLeft() { return new Sequent(leftRest(), right); }

    /** @return this sequent without the head of its right side */
    Sequent dropRight() { return new Sequent(left, rightRest()); }

    static ImmutableList<Formula> prepend(Formula f, ImmutableList<Formula> fs) {
        return ImmutableList.<Formula>builderWithExpectedSize(fs.size() + 1).add(f).addAll(fs).build();
    }

    static ImmutableList<Formula> prepend(Formula f, Formula g, ImmutableList<Formula> fs) {
        return ImmutableList.<Formula>builderWithExpectedSize(fs.size() + 2).add(f).add(g).addAll(fs).build();
    }

    static Sequent of(ImmutableList<Formula> left, ImmutableList<Formula> right) {
        return new Sequent(left, right);
    }

    /** @return the number of connectives on both sides; each decomposition step lowers it */
    public int size() {
        int n = 0;
        for (Formula f : left) n += f.size();
        for (Formula f : right) n += f.size();
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequent)) return false;
        Sequent s = (Sequent) o;
        return left.equals(s.left) && right.equals(s.right);
    }

    @Override
    public int hashCode() { return 31 * left.hashCode() + right.hashCode(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        commaJoiner.appendTo(sb, left);
        if (!left.isEmpty()) sb.append(' ');
        sb.append('⊢');
        if (!right.isEmpty()) sb.append(' ');
        return commaJoiner.appendTo(sb, right).toString();
    }
}
