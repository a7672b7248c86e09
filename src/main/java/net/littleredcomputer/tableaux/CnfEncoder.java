package net.littleredcomputer.tableaux;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.tableaux.sat.SATProblem;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Writes clause sets as integer CNF. A clause {@code p, q ⊢ r} becomes the disjunction
 * {@code ¬p ∨ ¬q ∨ r}: the atoms a branch forced true appear negated, those it forced false
 * appear positively.
 */
public final class CnfEncoder {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final Joiner lineJoiner = Joiner.on('\n');

    private CnfEncoder() {}

    /**
     * @return one list of signed variable numbers per clause, in the iteration order of clauses
     */
    public static ImmutableList<ImmutableList<Integer>> asCnfList(VariableIndex index, Iterable<Clause> clauses) {
        ImmutableList.Builder<ImmutableList<Integer>> b = ImmutableList.builder();
        for (Clause c : clauses) b.add(encode(index, c));
        return b.build();
    }

    private static ImmutableList<Integer> encode(VariableIndex index, Clause c) {
        ImmutableList.Builder<Integer> b = ImmutableList.builderWithExpectedSize(c.left().size() + c.right().size());
        for (String a : c.left()) b.add(-index.id(a));
        for (String a : c.right()) b.add(index.id(a));
        return b.build();
    }

    /**
     * Render clauses in DIMACS CNF: a comment line, the {@code p cnf} header, then one
     * zero-terminated line per clause. There is no newline after the last line.
     */
    public static String asDimacs(VariableIndex index, Iterable<Clause> clauses, String comment) {
        List<String> lines = new ArrayList<>();
        lines.add("c " + comment);
        ImmutableList<ImmutableList<Integer>> cnf = asCnfList(index, clauses);
        lines.add("p cnf " + index.size() + " " + cnf.size());
        for (List<Integer> c : cnf) {
            lines.add(c.isEmpty() ? "0" : spaceJoiner.join(c) + " 0");
        }
        return lineJoiner.join(lines);
    }

    /**
     * Invert {@link #asCnfList}: read each list of literals back into a clause.
     * @throws IllegalArgumentException on a zero literal, a variable the index doesn't know,
     * or a variable occurring with both signs
     */
    public static ImmutableSet<Clause> decode(VariableIndex index, Iterable<? extends List<Integer>> cnf) {
        ImmutableSet.Builder<Clause> b = ImmutableSet.builder();
        for (List<Integer> literals : cnf) {
            TreeSet<String> left = new TreeSet<>();
            TreeSet<String> right = new TreeSet<>();
            for (int l : literals) {
                if (l == 0) throw new IllegalArgumentException("zero literal in clause " + literals);
                String a = index.atom(Math.abs(l));
                (l < 0 ? left : right).add(a);
                if (left.contains(a) && right.contains(a)) {
                    throw new IllegalArgumentException("complementary literals in clause " + literals);
                }
            }
            b.add(Clause.of(left, right));
        }
        return b.build();
    }

    /**
     * Build the solver's view of the clauses, numbered by index.
     */
    public static SATProblem toProblem(VariableIndex index, Iterable<Clause> clauses) {
        return SATProblem.of(index.size(), asCnfList(index, clauses));
    }
}
