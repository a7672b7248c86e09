// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.tableaux;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import javax.annotation.CheckReturnValue;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;
import static net.littleredcomputer.tableaux.Sequent.prepend;

/**
 * Sequent-style semantic tableaux for classical propositional logic.
 * <p>
 * A sequent is decomposed head first, one rule at a time, until every path through the
 * tableau either closes (some atom is forced both true and false) or saturates (both sides
 * are empty). Each saturated path contributes the {@link Clause} of atoms it forced. The
 * rules are tried in this order:
 * <ol>
 *     <li>both sides empty: the path saturates</li>
 *     <li>atom on the left, then atom on the right: record it, or close on a clash</li>
 *     <li>⊤ on the left, ⊥ on the right: drop it</li>
 *     <li>⊤ on the right, ⊥ on the left: close</li>
 *     <li>¬ on either side: move the operand to the other side</li>
 *     <li>∧ on the left, ∨ on the right, → on the right: decompose in place</li>
 *     <li>∨ on the left, ∧ on the right, → on the left: branch, as the {@link Strategy} directs</li>
 * </ol>
 * Every step removes a connective or an atom, so the procedure terminates. Pending subgoals
 * are kept on an explicit agenda rather than the Java stack, so the depth of the formula is
 * not limited by the thread's stack size.
 * <p>
 * Instances are not thread-safe: they keep step counts for progress reporting.
 */
public class Tableaux {
    private static final Logger log = LogManager.getFormatterLogger(Tableaux.class);
    private static final int logCheckSteps = 10000;

    private final Strategy strategy;
    private long stepCount;
    private long closedCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    private static final class Goal {
        final Sequent sequent;
        final Branch branch;
        Goal(Sequent sequent, Branch branch) {
            this.sequent = sequent;
            this.branch = branch;
        }
    }

    public Tableaux(Strategy strategy) {
        this.strategy = checkNotNull(strategy);
    }

    public Tableaux setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public Strategy strategy() { return strategy; }

    /** @return the number of rule applications made by the most recent expansion */
    public long stepCount() { return stepCount; }

    /** @return the number of paths closed by the most recent expansion */
    public long closedCount() { return closedCount; }

    @CheckReturnValue
    public static ImmutableSet<Clause> expand(Strategy strategy, Sequent sequent) {
        return new Tableaux(strategy).expand(sequent);
    }

    @CheckReturnValue
    public ImmutableSet<Clause> expand(Sequent sequent) {
        return expand(sequent, Collections.emptySet(), Collections.emptySet());
    }

    /**
     * Decompose a sequent, starting from a path on which some atoms are already forced.
     * @param sequent the obligation to decompose
     * @param trueAtoms atoms already forced true
     * @param falseAtoms atoms already forced false
     * @return the clauses of the saturated paths found; empty if every path closes
     */
    @CheckReturnValue
    public ImmutableSet<Clause> expand(Sequent sequent, Iterable<String> trueAtoms, Iterable<String> falseAtoms) {
        checkNotNull(sequent);
        stepCount = 0;
        closedCount = 0;
        start();
        final Set<Clause> found = new LinkedHashSet<>();
        final Deque<Goal> agenda = new ArrayDeque<>();
        agenda.push(new Goal(sequent, Branch.of(trueAtoms, falseAtoms)));

        while (!agenda.isEmpty() && !strategy.isSettled(found)) {
            Goal g = agenda.pop();
            Sequent s = g.sequent;
            Branch b = g.branch;
            PATH: while (true) {
                ++stepCount;
                if (stepCount % logCheckSteps == 0) maybeReportProgress(agenda.size(), found.size());
                if (s.isEmpty()) {
                    found.add(b.toClause());
                    break;
                }
                final ImmutableList<Formula> left = s.left();
                final ImmutableList<Formula> right = s.right();
                final Formula l = left.isEmpty() ? null : left.get(0);
                final Formula r = right.isEmpty() ? null : right.get(0);
                final Formula.Kind lk = l == null ? null : l.kind();
                final Formula.Kind rk = r == null ? null : r.kind();

                if (lk == Formula.Kind.ATOM) {
                    Branch bb = b.assertTrue(l.name()).orElse(null);
                    if (bb == null) {
                        ++closedCount;
                        break PATH;
                    }
                    b = bb;
                    s = s.dropLeft();
                } else if (rk == Formula.Kind.ATOM) {
                    Branch bb = b.assertFalse(r.name()).orElse(null);
                    if (bb == null) {
                        ++closedCount;
                        break PATH;
                    }
                    b = bb;
                    s = s.dropRight();
                } else if (lk == Formula.Kind.CONSTANT && l.value()) {
                    s = s.dropLeft();
                } else if (rk == Formula.Kind.CONSTANT && !r.value()) {
                    s = s.dropRight();
                } else if (rk == Formula.Kind.CONSTANT || lk == Formula.Kind.CONSTANT) {
                    // ⊤ among the goals or ⊥ among the hypotheses: nothing can refute this sequent.
                    ++closedCount;
                    break PATH;
                } else if (lk == Formula.Kind.NOT) {
                    s = Sequent.of(s.leftRest(), prepend(l.operand(), right));
                } else if (rk == Formula.Kind.NOT) {
                    s = Sequent.of(prepend(r.operand(), left), s.rightRest());
                } else if (lk == Formula.Kind.AND) {
                    s = Sequent.of(prepend(l.left(), l.right(), s.leftRest()), right);
                } else if (rk == Formula.Kind.OR) {
                    s = Sequent.of(left, prepend(r.left(), r.right(), s.rightRest()));
                } else if (rk == Formula.Kind.IMPLIES) {
                    s = Sequent.of(prepend(r.left(), left), prepend(r.right(), s.rightRest()));
                } else if (lk == Formula.Kind.OR) {
                    ImmutableList<Formula> rest = s.leftRest();
                    agenda.push(new Goal(Sequent.of(prepend(l.right(), rest), right), b));
                    s = Sequent.of(prepend(l.left(), rest), right);
                } else if (rk == Formula.Kind.AND) {
                    ImmutableList<Formula> rest = s.rightRest();
                    agenda.push(new Goal(Sequent.of(left, prepend(r.right(), rest)), b));
                    s = Sequent.of(left, prepend(r.left(), rest));
                } else if (lk == Formula.Kind.IMPLIES) {
                    // Every head the right side could have is handled above, so it is empty here.
                    ImmutableList<Formula> rest = s.leftRest();
                    agenda.push(new Goal(Sequent.of(prepend(l.right(), rest), right), b));
                    s = Sequent.of(rest, prepend(l.left(), right));
                } else {
                    throw new IllegalStateException("no tableau rule applies to " + s);
                }
            }
        }
        stopwatch.stop();
        log.debug("%s: %d steps, %d paths closed, %d clauses, %s", strategy, stepCount, closedCount, found.size(), stopwatch);
        return ImmutableSet.copyOf(found);
    }

    private void start() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private void maybeReportProgress(int pending, int clauses) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %d pending %d clauses",
                strategy, stepCount, stopwatch, perSec, pending, clauses));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
