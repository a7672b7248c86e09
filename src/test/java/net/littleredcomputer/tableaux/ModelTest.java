package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static net.littleredcomputer.tableaux.Formula.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ModelTest extends TableauxTestBase {
    private final Clause clause = Clause.of(Arrays.asList("b", "a"), Arrays.asList("d", "c"));

    @Test
    public void clauseToString() {
        assertThat(clause.toString(), is("(a, b ⊢ c, d)"));
        assertThat(Clause.of(Collections.emptyList(), Collections.singletonList("d")).toString(), is("(⊢ d)"));
        assertThat(Clause.of(Collections.emptyList(), Collections.emptyList()).toString(), is("(⊢)"));
        assertThat(Clause.toString(ImmutableList.of(clause, Clause.of(Collections.singletonList("e"), Collections.emptyList()))),
                is("(a, b ⊢ c, d), (e ⊢)"));
    }

    @Test
    public void clauseAsModel() {
        Model m = clause.toModel();
        assertThat(m.assignment(), is(ImmutableMap.of("a", true, "b", true, "c", false, "d", false)));
        assertThat(m.entries(), is(ImmutableList.<Map.Entry<String, Boolean>>of(
                Maps.immutableEntry("a", true),
                Maps.immutableEntry("b", true),
                Maps.immutableEntry("c", false),
                Maps.immutableEntry("d", false))));
        assertThat(m.toString(), is("a=true, b=true, c=false, d=false"));
        assertThat(Model.of(Collections.emptyMap()).isEmpty(), is(true));
    }

    @Test
    public void valuationCompletesModel() {
        Model m = Model.of(ImmutableMap.of("a", true));
        Map<String, Boolean> v = m.valuation(ImmutableSet.of("a", "b"), false);
        Map<String, Boolean> expected = ImmutableMap.of("a", true, "b", false);
        assertThat(v, is(expected));
        assertThat(implies(a, b).evaluate(v), is(false));
        assertThat(implies(a, b).evaluate(m.valuation(implies(a, b).atoms(), true)), is(true));
    }

    @Test
    public void sequents() {
        Sequent s = Sequent.of(ImmutableList.of(a, and(b, c)), ImmutableList.of(Formula.not(d)));
        assertThat(s.toString(), is("a, (b ∧ c) ⊢ ¬d"));
        assertThat(s.size(), is(2));
        assertThat(Sequent.empty().toString(), is("⊢"));
        assertThat(Sequent.goal(a).toString(), is("⊢ a"));
        assertThat(Sequent.hypothesis(a).isEmpty(), is(false));
        assertThat(Sequent.empty().isEmpty(), is(true));
    }
}
