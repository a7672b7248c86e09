package net.littleredcomputer.tableaux.sat;

import com.google.common.base.Splitter;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Iterator;
import java.util.Optional;

/**
 * The answer format of the SAT competitions: a status line {@code s SATISFIABLE} or
 * {@code s UNSATISFIABLE}, followed for satisfiable instances by {@code v} lines listing the
 * true literals and ending with 0. Lines beginning with {@code c} are comments.
 */
public final class SolverOutput {
    private static final Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();

    private SolverOutput() {}

    public static String format(Optional<boolean[]> outcome) {
        if (!outcome.isPresent()) return "s UNSATISFIABLE\n";
        StringBuilder sb = new StringBuilder("s SATISFIABLE\nv ");
        boolean[] bs = outcome.get();
        for (int i = 0; i < bs.length; ++i) sb.append(bs[i] ? i + 1 : -i - 1).append(' ');
        return sb.append("0\n").toString();
    }

    public static Optional<boolean[]> parse(String s, int nVariables) {
        return parse(new StringReader(s), nVariables);
    }

    /**
     * Interpret a solver's answer.
     * @param r the solver's output
     * @param nVariables the number of variables of the instance that was solved
     * @return the assignment reported (variables it doesn't mention are false), or empty if unsatisfiable
     * @throws IllegalArgumentException if the output has no definite status, or mentions a variable out of range
     */
    public static Optional<boolean[]> parse(Reader r, int nVariables) {
        Iterator<String> ls = new BufferedReader(r).lines()
                .map(String::trim)
                .filter(s -> !s.isEmpty() && !s.startsWith("c"))
                .iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("no status line in solver output");
        String status = ls.next();
        switch (status) {
            case "s UNSATISFIABLE":
                return Optional.empty();
            case "s SATISFIABLE":
                break;
            default:
                throw new IllegalArgumentException("solver did not decide the instance: " + status);
        }
        boolean[] solution = new boolean[nVariables];
        boolean terminated = false;
        while (ls.hasNext()) {
            String line = ls.next();
            if (!line.startsWith("v")) throw new IllegalArgumentException("unexpected line in solver output: " + line);
            for (String lit : splitter.split(line.substring(1))) {
                final int l;
                try {
                    l = Integer.parseInt(lit);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("not a literal: " + lit, e);
                }
                if (l == 0) {
                    terminated = true;
                    continue;
                }
                if (l > nVariables || l < -nVariables) throw new IllegalArgumentException("literal out of range: " + l);
                solution[Math.abs(l) - 1] = l > 0;
            }
        }
        if (!terminated) throw new IllegalArgumentException("assignment not terminated by 0");
        return Optional.of(solution);
    }
}
