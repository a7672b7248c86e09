package net.littleredcomputer.tableaux.sat;

import gnu.trove.list.array.TIntArrayList;

import java.util.List;
import java.util.Optional;

/**
 * Backtracking with one watched literal per clause, after Algorithm B of TAOCP 7.2.2.2.
 * Variables are set in order 1..n. Every clause watches a literal that is not false under
 * the current partial assignment; making a literal false moves each clause that watches it
 * to another literal, and a clause with nowhere to go forces a retreat. Retreating never
 * invalidates a watch, so the watch lists need no repair on backtrack.
 * <p>
 * This is a stand-in for an external solver behind {@link SatSolver}, used by the tests and
 * by the {@code solve} task; the prover itself never searches for assignments this way.
 */
public class BacktrackingSolver extends AbstractSATSolver {

    public BacktrackingSolver() {
        super("B");
    }

    @Override
    Optional<boolean[]> search(SATProblem problem) {
        final int n = problem.nVariables();
        final List<? extends List<Integer>> encoded = problem.encodedClauses();
        final int[][] clauses = new int[encoded.size()][];
        final TIntArrayList[] watch = new TIntArrayList[2 * n + 2];
        for (int i = 0; i < watch.length; ++i) watch[i] = new TIntArrayList();
        for (int j = 0; j < clauses.length; ++j) {
            List<Integer> c = encoded.get(j);
            clauses[j] = new int[c.size()];
            for (int k = 0; k < c.size(); ++k) clauses[j][k] = c.get(k);
            watch[clauses[j][0]].add(j);
        }

        // m[d] records the move at depth d: 0 or 1 on the first try (true or false), 3 or 2 on the second.
        final int[] m = new int[n + 1];
        int d = 1;

        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(m);
            if (d > n) {
                boolean[] solution = new boolean[n];
                for (int v = 1; v <= n; ++v) solution[v - 1] = (m[v] & 1) == 0;
                return Optional.of(solution);
            }
            // Try first the value whose falsified literal nobody watches, if there is one.
            m[d] = (watch[poslit(d)].isEmpty() || !watch[neglit(d)].isEmpty()) ? 1 : 0;
            while (!makeFalse(not(2 * d + (m[d] & 1)), d, m, clauses, watch)) {
                // Try again, or backtrack until some level still has an untried value.
                while (m[d] >= 2) {
                    if (d == 1) return Optional.empty();
                    --d;
                }
                m[d] = 3 - m[d];
            }
            ++d;
        }
    }

    /**
     * Move every clause watching the newly false literal f to another literal that is not false.
     * @return false if some clause has no such literal
     */
    private boolean makeFalse(int f, int d, int[] m, int[][] clauses, TIntArrayList[] watch) {
        final TIntArrayList ws = watch[f];
        int i = 0;
        while (i < ws.size()) {
            final int j = ws.get(i);
            final int[] c = clauses[j];
            int k;
            for (k = 1; k < c.length; ++k) {
                int v = thevar(c[k]);
                if (v > d || (c[k] + m[v]) % 2 == 0) break;
            }
            if (k == c.length) return false;
            c[0] = c[k];
            c[k] = f;
            watch[c[0]].add(j);
            final int last = ws.size() - 1;
            ws.set(i, ws.get(last));
            ws.removeAt(last);
        }
        return true;
    }
}
