// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Validity, satisfiability and clausification of propositional formulas by tableaux.
 */
public final class Prover {
    private static final Logger log = LogManager.getFormatterLogger(Prover.class);

    private Prover() {}

    /**
     * The clauses of every countermodel branch of f. Read as CNF (each clause the disjunction of
     * its negated left atoms and its right atoms) they are equivalent to f.
     */
    public static ImmutableSet<Clause> clausify(Formula f) {
        return Tableaux.expand(Strategy.UNION, Sequent.goal(f));
    }

    /**
     * The clauses of every branch refuting the sequent {@code left ⊢ right}.
     */
    public static ImmutableSet<Clause> clausify(Formula left, Formula right) {
        return Tableaux.expand(Strategy.UNION, Sequent.of(ImmutableList.of(left), ImmutableList.of(right)));
    }

    /**
     * Decide whether f is a tautology.
     * @return empty if f is valid; otherwise a countermodel, under which f is false
     */
    public static Optional<Model> prove(Formula f) {
        Optional<Model> m = first(Sequent.goal(f));
        if (log.isDebugEnabled()) log.debug("prove, %d connectives: %s", f.size(), m.map(x -> "countermodel " + x).orElse("valid"));
        return m;
    }

    public static boolean isTautology(Formula f) {
        return !prove(f).isPresent();
    }

    /**
     * Decide whether f is satisfiable.
     * @return a model of f, or empty if f is unsatisfiable
     */
    public static Optional<Model> sat(Formula f) {
        Optional<Model> m = first(Sequent.hypothesis(f));
        if (log.isDebugEnabled()) log.debug("sat, %d connectives: %s", f.size(), m.map(x -> "model " + x).orElse("unsatisfiable"));
        return m;
    }

    private static Optional<Model> first(Sequent s) {
        return Tableaux.expand(Strategy.SHORTCUT, s).stream().findFirst().map(Clause::toModel);
    }
}
