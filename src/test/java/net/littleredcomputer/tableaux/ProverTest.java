// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.tableaux;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static net.littleredcomputer.tableaux.Formula.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ProverTest extends TableauxTestBase {

    @Test
    public void distributiveLawIsValid() {
        assertThat(Prover.prove(Formulas.distributive()), isEmpty());
        assertThat(Prover.isTautology(Formulas.distributive()), is(true));
    }

    @Test
    public void nondistributiveLawHasCountermodel() {
        Formula f = Formulas.nondistributive();
        Optional<Model> m = Prover.prove(f);
        assertThat(m, isPresent());
        assertThat(refutes(m.get(), f), is(true));
        // Only a=false with b and c differing falsifies it.
        assertThat(m.get().assignment().get("a"), is(false));
        assertThat(m.get().assignment().get("b").equals(m.get().assignment().get("c")), is(false));
    }

    @Test
    public void contradictionIsUnsatisfiable() {
        assertThat(Prover.sat(and(a, Formula.not(a))), isEmpty());
        assertThat(Prover.sat(FALSE), isEmpty());
    }

    @Test
    public void satisfiableFormulaGetsModel() {
        assertThat(Prover.sat(and(a, Formula.not(b))),
                isPresentAndIs(Model.of(ImmutableMap.of("a", true, "b", false))));
        assertThat(Prover.sat(TRUE), isPresentAndIs(Model.of(Collections.emptyMap())));
    }

    @Test
    public void disjunctionIsSatisfiable() {
        Optional<Model> m = Prover.sat(or(a, b));
        assertThat(m, isPresent());
        assertThat(m.get().assignment().getOrDefault("a", false) || m.get().assignment().getOrDefault("b", false), is(true));
    }

    @Test
    public void clausifyImplication() {
        assertThat(Prover.clausify(implies(a, b)),
                is(ImmutableSet.of(Clause.of(Collections.singletonList("a"), Collections.singletonList("b")))));
    }

    @Test
    public void clausifyConjunction() {
        assertThat(Prover.clausify(and(a, b)), is(ImmutableSet.of(
                Clause.of(Collections.emptyList(), Collections.singletonList("a")),
                Clause.of(Collections.emptyList(), Collections.singletonList("b")))));
    }

    @Test
    public void clausifySequent() {
        assertThat(Prover.clausify(a, a).isEmpty(), is(true));
        assertThat(Prover.clausify(a, b),
                is(ImmutableSet.of(Clause.of(Collections.singletonList("a"), Collections.singletonList("b")))));
    }

    @Test
    public void clausifyConstants() {
        assertThat(Prover.clausify(TRUE).isEmpty(), is(true));
        assertThat(Prover.clausify(FALSE),
                is(ImmutableSet.of(Clause.of(Collections.emptyList(), Collections.emptyList()))));
    }

    @Test
    public void pigeonholeIsUnsatisfiable() {
        assertThat(Prover.sat(Formulas.pigeonhole(1)), isEmpty());
        assertThat(Prover.sat(Formulas.pigeonhole(2)), isEmpty());
        assertThat(Prover.sat(Formulas.pigeonhole(3)), isEmpty());
        assertThat(Prover.isTautology(Formula.not(Formulas.pigeonhole(3))), is(true));
    }

    @Test
    public void chainIsValid() {
        assertThat(Prover.isTautology(Formulas.chain(2)), is(true));
        assertThat(Prover.isTautology(Formulas.chain(50)), is(true));
        assertThat(Prover.isTautology(Formulas.chain(2000)), is(true));
    }

    @Test
    public void brokenChainHasCountermodel() {
        // Dropping the last link leaves p_n unconstrained.
        Formula f = implies(and(implies(atom("p1"), atom("p2")), implies(atom("p2"), atom("p3"))),
                implies(atom("p1"), atom("p4")));
        Optional<Model> m = Prover.prove(f);
        assertThat(m, isPresent());
        assertThat(m.get().assignment().get("p1"), is(true));
        assertThat(m.get().assignment().get("p4"), is(false));
    }

    @Test
    public void agreesWithTruthTables() {
        Random r = new Random(1);
        for (int i = 0; i < 1000; ++i) {
            Formula f = randomFormula(r, 5);
            Optional<Model> counter = Prover.prove(f);
            assertThat(f.toString(), counter.isPresent(), is(!isTautologyByTruthTable(f)));
            counter.ifPresent(m -> assertThat(f.toString(), refutes(m, f), is(true)));
            Optional<Model> model = Prover.sat(f);
            assertThat(f.toString(), model.isPresent(), is(isSatisfiableByTruthTable(f)));
            model.ifPresent(m -> assertThat(f.toString(), forces(m, f), is(true)));
        }
    }

    @Test
    public void validityAndSatisfiabilityAreDual() {
        Random r = new Random(2);
        for (int i = 0; i < 500; ++i) {
            Formula f = randomFormula(r, 4);
            assertThat(f.toString(), Prover.isTautology(f), is(!Prover.sat(Formula.not(f)).isPresent()));
            assertThat(f.toString(), Prover.prove(f), is(Prover.sat(Formula.not(f))));
        }
    }

    @Test
    public void clausesAreEquivalentToFormula() {
        Random r = new Random(3);
        for (int i = 0; i < 500; ++i) {
            Formula f = randomFormula(r, 4);
            ImmutableSet<Clause> cnf = Prover.clausify(f);
            for (Clause cl : cnf) assertThat(f + " / " + cl, refutes(cl.toModel(), f), is(true));
            for (Map<String, Boolean> v : valuations(f.atoms())) {
                boolean all = cnf.stream().allMatch(cl -> satisfies(v, cl));
                assertThat(f + " at " + v, all, is(f.evaluate(v)));
            }
        }
    }
}
