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

import com.google.common.base.Stopwatch;
import com.vaticle.typematch.common.exception.TypeMatchException;
import com.vaticle.typematch.common.parameters.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.BOOLEAN_CONSTANTS_EQUATED;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.COMPOUND_VARIABLE;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.EMPTY_SOLUTION;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.MALFORMED_SOLUTION;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.stream.Collectors.toList;

/**
 * Accumulates boolean constraints over arbitrary variables and lowers them into a
 * {@link LinearBooleanProblem}. Constraints are expressed with {@link Formula}s: a
 * {@link Conjunction} or {@link Disjunction} found where a single literal is needed is replaced by a
 * fresh auxiliary variable constrained equivalent to it.
 *
 * After {@link #solve()}, the value of each variable is available through {@link #value(Object)}
 * and {@link #results()}. An unsatisfiable problem, or a failing solver, leaves no results.
 */
public class SATProblem {

    private static final Logger LOG = LoggerFactory.getLogger(SATProblem.class);

    private final String name;
    private final SolverBackend backend;
    private final VariableTable variables;
    private final List<Constraint> constraints;
    private final Set<List<Object>> added;
    private final List<Integer> objectiveLiterals;
    private final List<Integer> objectiveCoefficients;
    private final Map<Integer, Boolean> hints;
    private Map<Object, Boolean> results;

    public SATProblem(Options options) {
        this(options.problemName(), SolverBackend.of(options));
    }

    public SATProblem(String name, SolverBackend backend) {
        this.name = name;
        this.backend = backend;
        this.variables = new VariableTable();
        this.constraints = new ArrayList<>();
        this.added = new HashSet<>();
        this.objectiveLiterals = new ArrayList<>();
        this.objectiveCoefficients = new ArrayList<>();
        this.hints = new LinkedHashMap<>();
        this.results = Map.of();
    }

    /**
     * Adds {@code condition ==> implicand}.
     */
    public void implies(Formula condition, Formula implicand) {
        implies(condition, implicand, List.of());
    }

    /**
     * Adds {@code left <==> right}. At most one side may be a boolean constant.
     */
    public void equivalent(Formula left, Formula right) {
        equivalent(left, right, List.of());
    }

    /**
     * Forces a variable, or a conjunction or disjunction of variables, to the given value.
     */
    public void assign(Formula target, boolean value) {
        assign(target, value, List.of());
    }

    /**
     * Requires the number of true variables to lie between {@code n} and {@code m}, inclusive.
     *
     * @param n the lower bound, or null for none
     * @param m the upper bound, or null for none
     * @param label describes the constraint in the rendered problem
     */
    public void betweenNM(List<? extends Formula> vars, @Nullable Integer n, @Nullable Integer m, String label) {
        if (!added.add(Arrays.asList("BetweenNM", new ArrayList<>(vars), n, m))) return;
        Constraint constraint = addConstraint(List.of("Force assign " + label));
        for (Formula var : vars) constraint.add(variables.id(var), 1);
        if (n != null) constraint.lowerBound(n);
        if (m != null) constraint.upperBound(m);
    }

    /**
     * Biases the objective towards the given value of a variable, without constraining it.
     */
    public void prefer(Formula var, boolean value) {
        // the objective is minimised
        objectiveLiterals.add((value ? 1 : -1) * variables.id(var));
        objectiveCoefficients.add(-1);
    }

    /**
     * Suggests a starting value for a variable. Backends that cannot take hints ignore them.
     */
    public void hint(Formula var, boolean value) {
        hints.put(variables.id(var), value);
    }

    private void implies(Formula condition, Formula implicand, List<String> descriptionSoFar) {
        List<String> description = append(descriptionSoFar, condition + " ==> " + implicand);
        if (implicand.isFalse()) {
            equivalent(condition, implicand, description);
        } else if (implicand.isTrue()) {
            return;
        } else if (condition.isDisjunction()) {
            for (Formula disjunct : condition.asDisjunction().formulas()) {
                implies(disjunct, implicand, description);
            }
        } else {
            if (!added.add(Arrays.asList("Implies", condition, implicand))) return;
            Constraint constraint = addConstraint(description);
            Collection<Formula> conditions = condition.isConjunction()
                    ? condition.asConjunction().formulas() : List.of(condition);
            Collection<Formula> implicands = members(implicand);
            // a single false condition literal must be enough to meet the bound
            int required = implicand.isDisjunction() ? 1 : implicands.size();
            for (Formula formula : conditions) constraint.add(-idOrLift(formula), required);
            for (Formula formula : implicands) constraint.add(idOrLift(formula), 1);
            constraint.lowerBound(required);
        }
    }

    private void equivalent(Formula left, Formula right, List<String> descriptionSoFar) {
        List<String> description = append(descriptionSoFar, left + " <==> " + right);
        if (left.isConstant()) {
            if (right.isConstant()) throw TypeMatchException.of(BOOLEAN_CONSTANTS_EQUATED, left, right);
            equivalent(right, left, description);
        } else if (right.isConstant()) {
            assign(left, right.isTrue(), description);
        } else {
            implies(left, right, description);
            implies(right, left, description);
        }
    }

    private void assign(Formula target, boolean value, List<String> descriptionSoFar) {
        List<String> description = append(descriptionSoFar, target + " :=> " + (value ? "True" : "False"));
        if (target.isConstant()) throw TypeMatchException.of(COMPOUND_VARIABLE, target);
        if (!added.add(Arrays.asList("Assign", target, value))) return;
        Constraint constraint = addConstraint(description);
        int polarity = target.isConjunction() ? -1 : 1;
        for (Formula formula : members(target)) constraint.add(polarity * idOrLift(formula), 1);
        if (value != target.isConjunction()) constraint.lowerBound(1);
        else constraint.upperBound(0);
    }

    private int idOrLift(Formula formula) {
        if (!formula.isCompound()) return variables.id(formula);
        Formula auxiliary = Formula.variable(new Formula.Auxiliary(variables.size() + 1));
        int id = variables.id(auxiliary);
        equivalent(auxiliary, formula, List.of("Lift: " + formula));
        return id;
    }

    private static Collection<Formula> members(Formula formula) {
        if (formula.isConjunction()) return formula.asConjunction().formulas();
        else if (formula.isDisjunction()) return formula.asDisjunction().formulas();
        else return List.of(formula);
    }

    private Constraint addConstraint(List<String> description) {
        Constraint constraint = new Constraint(String.join(" ... ", description));
        constraints.add(constraint);
        return constraint;
    }

    private static List<String> append(List<String> description, String step) {
        List<String> extended = new ArrayList<>(description);
        extended.add(step);
        return extended;
    }

    public List<Constraint> constraints() {
        return unmodifiableList(constraints);
    }

    public int numVariables() {
        return variables.size();
    }

    /**
     * Builds and validates the problem accumulated so far.
     */
    public LinearBooleanProblem problem() {
        List<String> varNames = variables.variables().stream().map(Object::toString).collect(toList());
        LinearBooleanProblem problem = new LinearBooleanProblem(
                name, varNames, constraints, objectiveLiterals, objectiveCoefficients, hints
        );
        problem.validate();
        return problem;
    }

    /**
     * Solves the problem with the backend.
     *
     * @return true if an assignment was found
     */
    public boolean solve() {
        LinearBooleanProblem problem = problem();
        LOG.info("{} formulae, {} variables", constraints.size(), variables.size());
        if (LOG.isDebugEnabled()) {
            for (int id = 1; id <= variables.size(); id++) LOG.debug("{}: {}", id, variables.variable(id));
            LOG.debug("SAT pretty/problem:\n{}SAT pretty (end)", problem.pretty());
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        Optional<List<Integer>> literals = backend.solve(problem);
        LOG.info("Solver finished in {} ms", stopwatch.elapsed(MILLISECONDS));
        results = Map.of();
        if (literals.isEmpty()) {
            LOG.info("No assignment found for the problem '{}'", name);
            return false;
        }

        Boolean[] values = new Boolean[variables.size()];
        for (int literal : literals.get()) {
            int id = Math.abs(literal);
            if (id < 1 || id > values.length) {
                LOG.error(MALFORMED_SOLUTION.message(literal));
                return false;
            }
            values[id - 1] = literal > 0;
        }
        Map<Object, Boolean> assignment = new LinkedHashMap<>();
        for (int id = 1; id <= values.length; id++) {
            if (values[id - 1] != null) assignment.put(variables.variable(id).key(), values[id - 1]);
        }
        if (assignment.isEmpty() && variables.size() > 0) {
            LOG.error(EMPTY_SOLUTION.message(variables.size()));
            return false;
        }
        results = unmodifiableMap(assignment);
        LOG.debug("SAT result: {}", results);
        return true;
    }

    public boolean isSolved() {
        return !results.isEmpty();
    }

    /**
     * @param key a variable key, or the variable formula wrapping it
     * @return the solved value, or empty if the problem is unsolved or the variable was never assigned
     */
    public Optional<Boolean> value(Object key) {
        Formula formula = Formula.variable(key);
        if (formula.isCompound()) throw TypeMatchException.of(COMPOUND_VARIABLE, formula);
        return Optional.ofNullable(results.get(formula.asVariable().key()));
    }

    /**
     * @return variable key to its solved value, in the order the variables were first used
     */
    public Map<Object, Boolean> results() {
        return results;
    }

    @Override
    public String toString() {
        return "SATProblem[name='" + name + "', variables=" + variables.size() +
                ", constraints=" + constraints.size() + ", solved=" + isSolved() + "]";
    }
}
