package net.littleredcomputer.tableaux;

import java.util.Set;

/**
 * How the two subgoals of a branching rule are combined. Both strategies explore the first
 * subgoal before the second, and both apply at every branching point of the tableau.
 * <p>
 * The engine applies a strategy as a cutoff on its agenda of pending subgoals: once
 * {@link #isSettled} holds, no further subgoal is explored.
 */
public enum Strategy {
    /**
     * Explore both subgoals and keep the clauses of each. Yields every saturated branch,
     * which is what clausification needs.
     */
    UNION {
        @Override
        boolean isSettled(Set<Clause> found) { return false; }
    },
    /**
     * Explore the second subgoal only when the first yields nothing. Yields at most one
     * clause, the first saturated branch, which is all a validity or satisfiability query needs.
     */
    SHORTCUT {
        @Override
        boolean isSettled(Set<Clause> found) { return !found.isEmpty(); }
    };

    /**
     * @param found the clauses collected so far
     * @return true if the remaining subgoals need not be explored
     */
    abstract boolean isSettled(Set<Clause> found);
}
