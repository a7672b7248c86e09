package net.littleredcomputer.tableaux.sat;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.StreamSupport;

import static java.util.stream.Collectors.toList;

/**
 * A CNF instance over variables 1..n, as handed to a {@link SatSolver}. Literals are stored
 * in the encoding of TAOCP 7.2.2.2 (57): variable v is 2v, its negation 2v+1.
 */
public class SATProblem {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private final int nVariables;
    private final List<ImmutableList<Integer>> clauses = new ArrayList<>();
    private int nLiterals = 0;
    private int width = 0;

    private SATProblem(int nVariables) {
        if (nVariables < 0) throw new IllegalArgumentException("Variable count must not be negative");
        this.nVariables = nVariables;
    }

    /**
     * @param nVariables number of variables; literals must lie in [-nVariables, nVariables]
     * @param clauses nonempty clauses of nonzero signed variable numbers
     * @return the problem
     */
    public static SATProblem of(int nVariables, Iterable<? extends Iterable<Integer>> clauses) {
        SATProblem p = new SATProblem(nVariables);
        clauses.forEach(p::addClause);
        return p;
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public int nLiterals() { return nLiterals; }

    /** @return the length of the longest clause */
    public int width() { return width; }

    List<ImmutableList<Integer>> encodedClauses() { return clauses; }

    /** @return the i-th clause as signed variable numbers */
    public List<Integer> getClause(int i) {
        return clauses.get(i).stream().map(SATProblem::decodeLiteral).collect(toList());
    }

    static int encodeLiteral(int variable) {
        return variable > 0 ? 2 * variable : -2 * variable + 1;
    }

    static int decodeLiteral(int literal) {
        int sign = ((literal & 1) == 0) ? 1 : -1;
        return sign * (literal >> 1);
    }

    private void addClause(Iterable<Integer> literals) {
        ImmutableList.Builder<Integer> b = ImmutableList.builder();
        for (int l : literals) {
            if (l == 0) throw new IllegalArgumentException("zero is not a literal");
            if (l > nVariables || l < -nVariables) throw new IllegalArgumentException("literal out of declared bounds: " + l);
            b.add(encodeLiteral(l));
        }
        ImmutableList<Integer> clause = b.build();
        if (clause.isEmpty()) throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
        nLiterals += clause.size();
        clauses.add(clause);
        if (clause.size() > width) width = clause.size();
    }

    /**
     * Evaluate the boolean function represented by the problem's clauses at the specified point
     * @param p point (i.e., vector of booleans, p[v-1] the value of variable v) at which to evaluate
     * @return the truth value of this problem at p
     */
    public boolean evaluate(boolean[] p) {
        if (p.length < nVariables) throw new IllegalArgumentException("assignment too short");
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[(literal >> 1) - 1] == ((literal & 1) == 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    public static SATProblem parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Read a problem in DIMACS CNF. Comment lines are skipped; clauses may span lines.
     * @throws IllegalArgumentException if the text is not well-formed DIMACS or disagrees with its header
     */
    public static SATProblem parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines()
                .filter(s -> !s.startsWith("c") && !s.trim().isEmpty())
                .iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        SATProblem p = new SATProblem(nVar);
        ls.forEachRemaining(line -> StreamSupport.stream(splitter.split(line).spliterator(), false)
                .mapToInt(SATProblem::parseLiteral)
                .forEach(l -> {
                    if (l == 0) {
                        p.addClause(literals);
                        literals.clear();
                    } else {
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (p.nClauses() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return p;
    }

    private static int parseLiteral(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a literal: " + s, e);
        }
    }
}
