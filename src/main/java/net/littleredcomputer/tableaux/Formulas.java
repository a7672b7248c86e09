package net.littleredcomputer.tableaux;

import java.util.ArrayList;
import java.util.List;

import static net.littleredcomputer.tableaux.Formula.and;
import static net.littleredcomputer.tableaux.Formula.atom;
import static net.littleredcomputer.tableaux.Formula.iff;
import static net.littleredcomputer.tableaux.Formula.implies;
import static net.littleredcomputer.tableaux.Formula.not;
import static net.littleredcomputer.tableaux.Formula.or;

/**
 * Some well-known formulas, for exercising the prover.
 */
public final class Formulas {
    private Formulas() {}

    private static final Formula a = atom("a");
    private static final Formula b = atom("b");
    private static final Formula c = atom("c");

    /** a ∨ (b ∧ c) ↔ (a ∨ b) ∧ (a ∨ c), a tautology. */
    public static Formula distributive() {
        return iff(or(a, and(b, c)), and(or(a, b), or(a, c)));
    }

    /** a ∨ (b ∧ c) ↔ (a ∨ b) ∨ (a ∨ c), which fails when exactly one of b, c holds and a doesn't. */
    public static Formula nondistributive() {
        return iff(or(a, and(b, c)), or(or(a, b), or(a, c)));
    }

    /**
     * The pigeonhole principle: n+1 pigeons cannot roost in n holes, one to a hole. Atom
     * {@code p<i>_<j>} says pigeon i sits in hole j. The formula asserts that every pigeon has a
     * hole and no hole has two pigeons; it is unsatisfiable for every n ≥ 1.
     * @param n number of holes
     */
    public static Formula pigeonhole(int n) {
        if (n < 1) throw new IllegalArgumentException("there must be at least one hole");
        List<Formula> constraints = new ArrayList<>();
        for (int i = 1; i <= n + 1; ++i) {
            List<Formula> holes = new ArrayList<>();
            for (int j = 1; j <= n; ++j) holes.add(roost(i, j));
            constraints.add(or(holes));
        }
        for (int j = 1; j <= n; ++j) {
            for (int i = 1; i <= n + 1; ++i) {
                for (int k = i + 1; k <= n + 1; ++k) {
                    constraints.add(not(and(roost(i, j), roost(k, j))));
                }
            }
        }
        return and(constraints);
    }

    private static Formula roost(int pigeon, int hole) {
        return atom("p" + pigeon + "_" + hole);
    }

    /**
     * (p1 → p2) ∧ (p2 → p3) ∧ ... ∧ (p(n-1) → pn) → (p1 → pn), a tautology whose
     * tableau is as deep as it is long.
     * @param n number of atoms in the chain
     */
    public static Formula chain(int n) {
        if (n < 2) throw new IllegalArgumentException("a chain needs at least two links");
        List<Formula> links = new ArrayList<>();
        for (int i = 1; i < n; ++i) links.add(implies(atom("p" + i), atom("p" + (i + 1))));
        return implies(and(links), implies(atom("p1"), atom("p" + n)));
    }
}
