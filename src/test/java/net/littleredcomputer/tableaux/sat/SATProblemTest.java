package net.littleredcomputer.tableaux.sat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class SATProblemTest {

    @Test
    public void simple() {
        SATProblem p = SATProblem.parseFrom(new StringReader("c simple test\nc heh\np cnf 3 2\n1 -3 0\n2 3 -1 0"));
        assertThat(p.nVariables(), is(3));
        assertThat(p.nClauses(), is(2));
        assertThat(p.nLiterals(), is(5));
        assertThat(p.width(), is(3));
        assertThat(p.getClause(0), contains(1, -3));
        assertThat(p.getClause(1), contains(2, 3, -1));
    }

    @Test
    public void clausesMaySpanLines() {
        SATProblem p = SATProblem.parseFrom("p cnf 3 2\n\n1 -3\n   0 2\n3 -1 0\n");
        assertThat(p.nClauses(), is(2));
        assertThat(p.getClause(1), contains(2, 3, -1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyClauseThrows() {
        SATProblem.parseFrom(new StringReader("c empty clause\np cnf 3 3\n1 2 3 0 0 1 2 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalOutOfBounds() {
        SATProblem.parseFrom(new StringReader("c oob literal\np cnf 3 2\n1 2 3 0\n2 3 4 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyClauses() {
        SATProblem.parseFrom(new StringReader("c oob clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void danglingClause() {
        SATProblem.parseFrom(new StringReader("c unclosed clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingHeader() {
        SATProblem.parseFrom("1 2 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void noData() {
        SATProblem.parseFrom("c nothing here\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void junkLiteral() {
        SATProblem.parseFrom("p cnf 2 1\n1 x 0");
    }

    @Test
    public void ofSignedLists() {
        SATProblem p = SATProblem.of(2, ImmutableList.of(ImmutableList.of(-1, 2), ImmutableList.of(1)));
        assertThat(p.nClauses(), is(2));
        assertThat(p.getClause(0), contains(-1, 2));
        assertThat(p.evaluate(new boolean[]{true, true}), is(true));
        assertThat(p.evaluate(new boolean[]{true, false}), is(false));
        assertThat(p.evaluate(new boolean[]{false, true}), is(false));
    }

    @Test
    public void noVariablesNoClauses() {
        SATProblem p = SATProblem.of(0, Collections.<ImmutableList<Integer>>emptyList());
        assertThat(p.nClauses(), is(0));
        assertThat(p.evaluate(new boolean[0]), is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void ofRejectsZero() {
        SATProblem.of(2, ImmutableList.of(Arrays.asList(1, 0, 2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void ofRejectsEmptyClause() {
        SATProblem.of(2, ImmutableList.of(Collections.<Integer>emptyList()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeVariableCount() {
        SATProblem.of(-1, Collections.<ImmutableList<Integer>>emptyList());
    }

    @Test
    public void literalEncoding() {
        assertThat(SATProblem.encodeLiteral(3), is(6));
        assertThat(SATProblem.encodeLiteral(-3), is(7));
        assertThat(SATProblem.decodeLiteral(6), is(3));
        assertThat(SATProblem.decodeLiteral(7), is(-3));
    }
}
