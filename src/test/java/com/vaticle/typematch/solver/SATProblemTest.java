/*
 * Copyright (C) 2021 Vaticle
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 *
 */

package com.vaticle.typematch.solver;

import com.vaticle.typematch.common.exception.TypeMatchException;
import org.junit.Before;
import org.junit.Test;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.BOOLEAN_CONSTANTS_EQUATED;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.COMPOUND_VARIABLE;
import static com.vaticle.typematch.solver.Formula.FALSE;
import static com.vaticle.typematch.solver.Formula.TRUE;
import static com.vaticle.typematch.solver.Formula.variable;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SATProblemTest {

    private final Formula p = variable("p");
    private final Formula q = variable("q");
    private final Formula foo = variable("foo");
    private final Formula bar = variable("bar");
    private final Formula zot = variable("zot");
    private final Formula qux = variable("qux");

    private BacktrackingSolverBackend backend;
    private SATProblem problem;

    @Before
    public void setUp() {
        backend = new BacktrackingSolverBackend();
        problem = new SATProblem("PROBLEM", backend);
    }

    private static void assertConstraint(Constraint constraint, List<Integer> literals, List<Integer> coefficients,
                                         @Nullable Integer lowerBound, @Nullable Integer upperBound, String description) {
        assertEquals(literals, constraint.literals());
        assertEquals(coefficients, constraint.coefficients());
        assertEquals(Optional.ofNullable(lowerBound), constraint.lowerBound());
        assertEquals(Optional.ofNullable(upperBound), constraint.upperBound());
        assertEquals(description, constraint.description());
    }

    private void assertSolution(Map<Object, Boolean> expected) {
        boolean solved = problem.solve();
        assertEquals(!expected.isEmpty(), solved);
        assertEquals(expected, problem.results());
    }

    @Test
    public void implies_true_adds_nothing() {
        problem.implies(foo, TRUE);
        LinearBooleanProblem lowered = problem.problem();
        assertEquals("PROBLEM", lowered.name());
        assertEquals(0, lowered.numVariables());
        assertTrue(lowered.constraints().isEmpty());
    }

    @Test
    public void implies_false_assigns_the_condition_false() {
        problem.implies(foo, FALSE);
        LinearBooleanProblem lowered = problem.problem();
        assertEquals(List.of("foo"), lowered.varNames());
        assertEquals(1, lowered.constraints().size());
        assertConstraint(lowered.constraints().get(0), List.of(1), List.of(1), null, 0,
                         "foo ==> False ... foo <==> False ... foo :=> False");
    }

    @Test
    public void implies_between_variables() {
        problem.implies(foo, bar);
        LinearBooleanProblem lowered = problem.problem();
        assertEquals(List.of("foo", "bar"), lowered.varNames());
        assertConstraint(lowered.constraints().get(0), List.of(-1, 2), List.of(1, 1), 1, null, "foo ==> bar");
    }

    @Test
    public void implies_a_conjunction_requires_every_conjunct() {
        problem.implies(foo, Conjunction.of(bar, zot));
        assertConstraint(problem.constraints().get(0), List.of(-1, 2, 3), List.of(2, 1, 1), 2, null,
                         "foo ==> (bar & zot)");
    }

    @Test
    public void implies_a_disjunction_requires_one_disjunct() {
        problem.implies(foo, Disjunction.of(bar, zot));
        assertConstraint(problem.constraints().get(0), List.of(-1, 2, 3), List.of(1, 1, 1), 1, null,
                         "foo ==> (bar | zot)");
    }

    @Test
    public void implies_from_a_conjunction_negates_every_conjunct() {
        problem.implies(Conjunction.of(foo, bar), zot);
        assertConstraint(problem.constraints().get(0), List.of(-1, -2, 3), List.of(1, 1, 1), 1, null,
                         "(foo & bar) ==> zot");
    }

    @Test
    public void implies_from_a_disjunction_is_distributed() {
        problem.implies(Disjunction.of(foo, bar), zot);
        assertEquals(List.of("foo", "zot", "bar"), problem.problem().varNames());
        assertEquals(2, problem.constraints().size());
        assertConstraint(problem.constraints().get(0), List.of(-1, 2), List.of(1, 1), 1, null,
                         "(foo | bar) ==> zot ... foo ==> zot");
        assertConstraint(problem.constraints().get(1), List.of(-3, 2), List.of(1, 1), 1, null,
                         "(foo | bar) ==> zot ... bar ==> zot");
    }

    @Test
    public void equivalent_variables_imply_each_other() {
        problem.equivalent(foo, bar);
        LinearBooleanProblem lowered = problem.problem();
        assertEquals(List.of("foo", "bar"), lowered.varNames());
        assertEquals(2, lowered.constraints().size());
        assertConstraint(lowered.constraints().get(0), List.of(-1, 2), List.of(1, 1), 1, null,
                         "foo <==> bar ... foo ==> bar");
        assertConstraint(lowered.constraints().get(1), List.of(-2, 1), List.of(1, 1), 1, null,
                         "foo <==> bar ... bar ==> foo");
    }

    @Test
    public void equivalent_to_a_constant_is_an_assignment() {
        problem.equivalent(foo, TRUE);
        assertConstraint(problem.constraints().get(0), List.of(1), List.of(1), 1, null,
                         "foo <==> True ... foo :=> True");
    }

    @Test
    public void equivalent_with_the_constant_first_is_swapped() {
        problem.equivalent(TRUE, foo);
        assertConstraint(problem.constraints().get(0), List.of(1), List.of(1), 1, null,
                         "True <==> foo ... foo <==> True ... foo :=> True");
    }

    @Test
    public void equivalent_to_false_bounds_from_above() {
        problem.equivalent(foo, FALSE);
        problem.equivalent(FALSE, bar);
        assertConstraint(problem.constraints().get(0), List.of(1), List.of(1), null, 0,
                         "foo <==> False ... foo :=> False");
        assertConstraint(problem.constraints().get(1), List.of(2), List.of(1), null, 0,
                         "False <==> bar ... bar <==> False ... bar :=> False");
    }

    @Test
    public void equivalent_constants_throw() {
        try {
            problem.equivalent(TRUE, FALSE);
            fail();
        } catch (TypeMatchException e) {
            assertEquals(BOOLEAN_CONSTANTS_EQUATED, e.errorMessage());
        }
    }

    @Test
    public void assign_variable() {
        problem.assign(foo, false);
        problem.assign(bar, true);
        assertConstraint(problem.constraints().get(0), List.of(1), List.of(1), null, 0, "foo :=> False");
        assertConstraint(problem.constraints().get(1), List.of(2), List.of(1), 1, null, "bar :=> True");
    }

    @Test
    public void assign_conjunction_uses_negated_literals() {
        problem.assign(Conjunction.of(foo, bar), false);
        problem.assign(Conjunction.of(bar, zot), true);
        assertConstraint(problem.constraints().get(0), List.of(-1, -2), List.of(1, 1), 1, null, "(foo & bar) :=> False");
        assertConstraint(problem.constraints().get(1), List.of(-2, -3), List.of(1, 1), null, 0, "(bar & zot) :=> True");
    }

    @Test
    public void assign_disjunction_uses_plain_literals() {
        problem.assign(Disjunction.of(foo, bar), true);
        problem.assign(Disjunction.of(bar, zot), false);
        assertConstraint(problem.constraints().get(0), List.of(1, 2), List.of(1, 1), 1, null, "(foo | bar) :=> True");
        assertConstraint(problem.constraints().get(1), List.of(2, 3), List.of(1, 1), null, 0, "(bar | zot) :=> False");
    }

    @Test
    public void compound_literals_are_lifted_into_auxiliary_variables() {
        problem.implies(foo, Conjunction.of(bar, Disjunction.of(zot, qux)));
        LinearBooleanProblem lowered = problem.problem();
        assertEquals(List.of("foo", "bar", "tmp3", "zot", "qux"), lowered.varNames());
        assertEquals(4, lowered.constraints().size());
        assertConstraint(lowered.constraints().get(0), List.of(-1, 2, 3), List.of(2, 1, 1), 2, null,
                         "foo ==> (bar & (zot | qux))");
        assertConstraint(lowered.constraints().get(1), List.of(-3, 4, 5), List.of(1, 1, 1), 1, null,
                         "Lift: (zot | qux) ... tmp3 <==> (zot | qux) ... tmp3 ==> (zot | qux)");
        assertConstraint(lowered.constraints().get(2), List.of(-4, 3), List.of(1, 1), 1, null,
                         "Lift: (zot | qux) ... tmp3 <==> (zot | qux) ... (zot | qux) ==> tmp3 ... zot ==> tmp3");
        assertConstraint(lowered.constraints().get(3), List.of(-5, 3), List.of(1, 1), 1, null,
                         "Lift: (zot | qux) ... tmp3 <==> (zot | qux) ... (zot | qux) ==> tmp3 ... qux ==> tmp3");
    }

    @Test
    public void between_n_and_m_bounds_the_number_of_true_variables() {
        problem.betweenNM(List.of(foo, bar, zot), 1, 2, "label");
        problem.betweenNM(List.of(foo, bar), null, 1, "open");
        assertConstraint(problem.constraints().get(0), List.of(1, 2, 3), List.of(1, 1, 1), 1, 2, "Force assign label");
        assertConstraint(problem.constraints().get(1), List.of(1, 2), List.of(1, 1), null, 1, "Force assign open");
    }

    @Test
    public void between_n_and_m_rejects_compound_variables() {
        try {
            problem.betweenNM(List.of(foo, Conjunction.of(bar, zot)), 1, null, "compound");
            fail();
        } catch (TypeMatchException e) {
            assertEquals(COMPOUND_VARIABLE, e.errorMessage());
        }
    }

    @Test
    public void identical_constraints_are_added_once() {
        problem.implies(foo, bar);
        problem.implies(foo, bar);
        problem.assign(zot, true);
        problem.assign(zot, true);
        problem.betweenNM(List.of(foo, zot), 1, null, "twice");
        problem.betweenNM(List.of(foo, zot), 1, null, "twice");
        assertEquals(3, problem.problem().constraints().size());

        problem.equivalent(foo, bar);
        assertEquals(4, problem.problem().constraints().size());
        problem.assign(zot, false);
        assertEquals(5, problem.problem().constraints().size());
    }

    @Test
    public void prefer_adds_objective_terms_to_minimise() {
        problem.prefer(foo, true);
        problem.prefer(bar, false);
        LinearBooleanProblem lowered = problem.problem();
        assertEquals(List.of(1, -2), lowered.objectiveLiterals());
        assertEquals(List.of(-1, -1), lowered.objectiveCoefficients());
        assertTrue(lowered.constraints().isEmpty());
    }

    @Test
    public void hints_are_passed_to_the_backend() {
        problem.implies(foo, bar);
        problem.hint(bar, true);
        problem.hint(foo, false);
        assertEquals(Map.of(2, true, 1, false), problem.problem().hints());
    }

    @Test
    public void implies_is_satisfied_by_true_condition_and_true_implicand() {
        problem.implies(p, q);
        problem.equivalent(p, TRUE);
        problem.equivalent(q, TRUE);
        assertSolution(Map.of("p", true, "q", true));
    }

    @Test
    public void implies_is_unsatisfiable_with_true_condition_and_false_implicand() {
        problem.implies(p, q);
        problem.equivalent(p, TRUE);
        problem.equivalent(q, FALSE);
        assertSolution(Map.of());
        assertFalse(problem.isSolved());
        assertEquals(Optional.empty(), problem.value("p"));
    }

    @Test
    public void implies_is_vacuously_true_for_a_false_condition() {
        problem.implies(p, q);
        problem.equivalent(p, FALSE);
        problem.equivalent(q, TRUE);
        assertSolution(Map.of("p", false, "q", true));

        setUp();
        problem.implies(p, q);
        problem.equivalent(p, FALSE);
        problem.equivalent(q, FALSE);
        assertSolution(Map.of("p", false, "q", false));
    }

    @Test
    public void equivalent_variables_take_the_same_value() {
        problem.equivalent(p, q);
        problem.equivalent(p, TRUE);
        problem.equivalent(q, TRUE);
        assertSolution(Map.of("p", true, "q", true));

        setUp();
        problem.equivalent(p, q);
        problem.equivalent(p, FALSE);
        problem.equivalent(q, FALSE);
        assertSolution(Map.of("p", false, "q", false));
    }

    @Test
    public void equivalent_variables_cannot_differ() {
        problem.equivalent(p, q);
        problem.equivalent(p, TRUE);
        problem.equivalent(q, FALSE);
        assertSolution(Map.of());

        setUp();
        problem.equivalent(p, q);
        problem.equivalent(p, FALSE);
        problem.equivalent(q, TRUE);
        assertSolution(Map.of());
    }

    @Test
    public void lifted_formulas_keep_their_meaning() {
        // foo ==> (bar & (zot | qux)), with foo true and zot false
        problem.implies(foo, Conjunction.of(bar, Disjunction.of(zot, qux)));
        problem.assign(foo, true);
        problem.assign(zot, false);
        assertTrue(problem.solve());
        assertEquals(Optional.of(true), problem.value("bar"));
        assertEquals(Optional.of(true), problem.value(qux));
        assertEquals(Optional.of(false), problem.value(zot));
    }

    @Test
    public void preference_selects_among_satisfying_assignments() {
        problem.implies(p, q);
        problem.prefer(p, true);
        assertSolution(Map.of("p", true, "q", true));

        setUp();
        problem.implies(p, q);
        problem.prefer(q, false);
        problem.hint(p, true);
        assertSolution(Map.of("p", false, "q", false));
    }

    @Test
    public void cardinality_is_respected_by_the_solution() {
        problem.betweenNM(List.of(foo, bar, zot), 2, 2, "exactly two");
        problem.assign(foo, false);
        assertSolution(Map.of("foo", false, "bar", true, "zot", true));
    }

    @Test
    public void failing_backend_gives_no_results() {
        SATProblem failing = new SATProblem("FAILING", unused -> Optional.empty());
        failing.implies(p, q);
        assertFalse(failing.solve());
        assertTrue(failing.results().isEmpty());
        assertEquals(Optional.empty(), failing.value(p));
    }

    @Test
    public void out_of_range_literals_give_no_results() {
        SATProblem malformed = new SATProblem("MALFORMED", unused -> Optional.of(List.of(1, -2, 7)));
        malformed.implies(p, q);
        assertFalse(malformed.solve());
        assertFalse(malformed.isSolved());
    }

    @Test
    public void results_are_listed_in_variable_order() {
        problem.implies(foo, bar);
        problem.implies(bar, zot);
        problem.assign(foo, true);
        assertTrue(problem.solve());
        assertEquals(List.of("foo", "bar", "zot"), List.copyOf(problem.results().keySet()));
        assertEquals(1, backend.calls());
    }

    @Test
    public void pretty_problem_names_the_variables() {
        problem.implies(foo, bar);
        problem.assign(bar, false);
        String pretty = problem.problem().pretty();
        assertThat(pretty, containsString("name: 'PROBLEM'"));
        assertThat(pretty, containsString("num_variables: 2"));
        assertThat(pretty, containsString("1 <= 1*-foo 1*bar"));
        assertThat(pretty, containsString("1*bar <= 0"));
        assertThat(pretty, containsString("# foo ==> bar"));
    }
}
