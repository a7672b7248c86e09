// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable propositional formula. Formulas are built with the static factories below;
 * two formulas are equal when they have the same shape. There is no primitive biconditional:
 * {@link #iff} expands into a conjunction of two implications.
 */
public abstract class Formula {
    public enum Kind {
        CONSTANT,
        ATOM,
        NOT,
        AND,
        OR,
        IMPLIES,
    }

    public static final Formula TRUE = new Constant(true);
    public static final Formula FALSE = new Constant(false);

    private final Kind kind;

    private Formula(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    public static Formula constant(boolean value) { return value ? TRUE : FALSE; }

    public static Formula atom(String name) {
        checkNotNull(name);
        checkArgument(!name.isEmpty(), "atom name must not be empty");
        return new Atom(name);
    }

    public static Formula not(Formula a) { return new Not(checkNotNull(a)); }
    public static Formula and(Formula a, Formula b) { return new Binary(Kind.AND, a, b); }
    public static Formula or(Formula a, Formula b) { return new Binary(Kind.OR, a, b); }
    public static Formula implies(Formula a, Formula b) { return new Binary(Kind.IMPLIES, a, b); }

    /** a ↔ b, written as (a → b) ∧ (b → a). */
    public static Formula iff(Formula a, Formula b) {
        return and(implies(a, b), implies(b, a));
    }

    /**
     * Conjunction of a sequence of formulas, associated to the right. The empty conjunction is TRUE.
     */
    public static Formula and(Iterable<Formula> fs) { return fold(Kind.AND, fs, TRUE); }

    /**
     * Disjunction of a sequence of formulas, associated to the right. The empty disjunction is FALSE.
     */
    public static Formula or(Iterable<Formula> fs) { return fold(Kind.OR, fs, FALSE); }

    private static Formula fold(Kind kind, Iterable<Formula> fs, Formula unit) {
        List<Formula> l = Lists.newArrayList(fs);
        if (l.isEmpty()) return unit;
        Formula f = checkNotNull(l.get(l.size() - 1));
        for (int i = l.size() - 2; i >= 0; --i) f = new Binary(kind, l.get(i), f);
        return f;
    }

    // Accessors for the individual variants. Asking a formula for a part it doesn't have
    // is a programming error.
    public boolean value() { throw wrongKind("value"); }
    public String name() { throw wrongKind("name"); }
    public Formula operand() { throw wrongKind("operand"); }
    public Formula left() { throw wrongKind("left"); }
    public Formula right() { throw wrongKind("right"); }

    private IllegalStateException wrongKind(String part) {
        return new IllegalStateException(kind + " formula has no " + part);
    }

    /**
     * @return the names of the atoms occurring in this formula, in lexicographic order
     */
    public ImmutableSortedSet<String> atoms() {
        ImmutableSortedSet.Builder<String> b = ImmutableSortedSet.naturalOrder();
        Deque<Formula> work = new ArrayDeque<>();
        work.push(this);
        while (!work.isEmpty()) {
            Formula f = work.pop();
            switch (f.kind) {
                case CONSTANT: break;
                case ATOM: b.add(f.name()); break;
                case NOT: work.push(f.operand()); break;
                default:
                    work.push(f.right());
                    work.push(f.left());
            }
        }
        return b.build();
    }

    /**
     * @return the number of connectives occurring in this formula
     */
    public int size() {
        int n = 0;
        Deque<Formula> work = new ArrayDeque<>();
        work.push(this);
        while (!work.isEmpty()) {
            Formula f = work.pop();
            switch (f.kind) {
                case CONSTANT:
                case ATOM:
                    break;
                case NOT:
                    ++n;
                    work.push(f.operand());
                    break;
                default:
                    ++n;
                    work.push(f.right());
                    work.push(f.left());
            }
        }
        return n;
    }

    /**
     * Evaluate this formula under two-valued semantics.
     * @param valuation truth values for (at least) every atom of the formula
     * @return the truth value of the formula
     * @throws IllegalArgumentException if an atom has no value
     */
    public boolean evaluate(Map<String, Boolean> valuation) {
        switch (kind) {
            case CONSTANT: return value();
            case ATOM: {
                Boolean b = valuation.get(name());
                if (b == null) throw new IllegalArgumentException("no value for atom " + name());
                return b;
            }
            case NOT: return !operand().evaluate(valuation);
            case AND: return left().evaluate(valuation) && right().evaluate(valuation);
            case OR: return left().evaluate(valuation) || right().evaluate(valuation);
            case IMPLIES: return !left().evaluate(valuation) || right().evaluate(valuation);
            default: throw new IllegalStateException("unknown formula kind " + kind);
        }
    }

    private static final class Constant extends Formula {
        private final boolean value;
        Constant(boolean value) {
            super(Kind.CONSTANT);
            this.value = value;
        }
        @Override public boolean value() { return value; }
        @Override public boolean equals(Object o) { return o instanceof Constant && ((Constant) o).value == value; }
        @Override public int hashCode() { return Boolean.hashCode(value); }
        @Override public String toString() { return value ? "⊤" : "⊥"; }
    }

    private static final class Atom extends Formula {
        private final String name;
        Atom(String name) {
            super(Kind.ATOM);
            this.name = name;
        }
        @Override public String name() { return name; }
        @Override public boolean equals(Object o) { return o instanceof Atom && ((Atom) o).name.equals(name); }
        @Override public int hashCode() { return name.hashCode(); }
        @Override public String toString() { return name; }
    }

    private static final class Not extends Formula {
        private final Formula operand;
        private final int hash;
        Not(Formula operand) {
            super(Kind.NOT);
            this.operand = operand;
            this.hash = 31 * Kind.NOT.ordinal() + operand.hashCode();
        }
        @Override public Formula operand() { return operand; }
        @Override public boolean equals(Object o) {
            return this == o || o instanceof Not && hash == o.hashCode() && ((Not) o).operand.equals(operand);
        }
        @Override public int hashCode() { return hash; }
        @Override public String toString() { return "¬" + operand; }
    }

    private static final class Binary extends Formula {
        private final Formula left;
        private final Formula right;
        private final int hash;  // cached
        Binary(Kind kind, Formula left, Formula right) {
            super(kind);
            this.left = checkNotNull(left);
            this.right = checkNotNull(right);
            this.hash = Objects.hash(kind.ordinal(), left, right);
        }
        @Override public Formula left() { return left; }
        @Override public Formula right() { return right; }
        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binary) || hash != o.hashCode()) return false;
            Binary b = (Binary) o;
            return kind() == b.kind() && left.equals(b.left) && right.equals(b.right);
        }
        @Override public int hashCode() { return hash; }
        @Override public String toString() {
            String op;
            switch (kind()) {
                case AND: op = " ∧ "; break;
                case OR: op = " ∨ "; break;
                default: op = " → "; break;
            }
            return "(" + left + op + right + ")";
        }
    }
}
