package net.littleredcomputer.tableaux.sat;

import java.util.Optional;

/**
 * Anything that can decide a CNF instance.
 */
public interface SatSolver {
    /**
     * @param problem the instance to decide
     * @return a satisfying assignment (element v-1 the value of variable v), or empty if unsatisfiable
     */
    Optional<boolean[]> solve(SATProblem problem);
}
