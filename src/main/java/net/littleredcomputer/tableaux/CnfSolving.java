package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableSortedMap;
import net.littleredcomputer.tableaux.sat.SATProblem;
import net.littleredcomputer.tableaux.sat.SatSolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Optional;

/**
 * Hands clause sets to a SAT solver and reads its answer back in terms of atom names.
 */
public final class CnfSolving {
    private static final Logger log = LogManager.getFormatterLogger(CnfSolving.class);

    private CnfSolving() {}

    /**
     * Find an assignment satisfying every clause read as a disjunction (see {@link CnfEncoder}).
     * @return a model assigning every atom of the clauses, or empty if the clauses are unsatisfiable
     */
    public static Optional<Model> solve(Collection<Clause> clauses, SatSolver solver) {
        if (clauses.stream().anyMatch(Clause::isEmpty)) {
            log.debug("empty clause among %d: unsatisfiable", clauses.size());
            return Optional.empty();
        }
        VariableIndex index = VariableIndex.of(clauses);
        SATProblem p = CnfEncoder.toProblem(index, clauses);
        return solver.solve(p).map(bs -> {
            if (!p.evaluate(bs)) throw new IllegalStateException("solver returned a non-satisfying assignment");
            return toModel(index, bs);
        });
    }

    /**
     * Decide satisfiability of f by clausifying it and consulting the solver.
     */
    public static Optional<Model> sat(Formula f, SatSolver solver) {
        return solve(Prover.clausify(f), solver);
    }

    /**
     * Read a solver's assignment back through the index that numbered the variables.
     */
    public static Model toModel(VariableIndex index, boolean[] assignment) {
        if (assignment.length < index.size()) throw new IllegalArgumentException("assignment too short");
        ImmutableSortedMap.Builder<String, Boolean> b = ImmutableSortedMap.naturalOrder();
        for (int v = 1; v <= index.size(); ++v) b.put(index.atom(v), assignment[v - 1]);
        return Model.of(b.build());
    }
}
