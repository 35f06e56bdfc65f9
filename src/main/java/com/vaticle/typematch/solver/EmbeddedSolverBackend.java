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
import com.vaticle.typematch.common.parameters.Options;
import com.vaticle.typematch.solver.optimiser.Optimiser;
import com.vaticle.typematch.solver.optimiser.OptimiserConstraint;
import com.vaticle.typematch.solver.optimiser.OptimiserVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.EMBEDDED_SOLVER_FAILED;

/**
 * Solves the problem in-process with an OR-Tools mixed integer solver.
 */
public class EmbeddedSolverBackend implements SolverBackend {

    private static final Logger LOG = LoggerFactory.getLogger(EmbeddedSolverBackend.class);

    private final String solverId;
    private final long timeoutMillis;

    public EmbeddedSolverBackend(Options options) {
        this.solverId = options.embeddedSolverId();
        this.timeoutMillis = options.solverTimeoutMillis();
    }

    @Override
    public Optional<List<Integer>> solve(LinearBooleanProblem problem) {
        try {
            Optimiser optimiser = new Optimiser(solverId);
            List<OptimiserVariable.Boolean> variables = new ArrayList<>();
            for (int id = 1; id <= problem.numVariables(); id++) {
                variables.add(optimiser.booleanVar("x" + id));
            }
            problem.constraints().forEach(constraint -> addConstraint(optimiser, variables, constraint));
            for (int i = 0; i < problem.objectiveLiterals().size(); i++) {
                int literal = problem.objectiveLiterals().get(i);
                double coefficient = problem.objectiveCoefficients().get(i);
                // the constant part of a negated literal does not change the optimum
                optimiser.setObjectiveCoefficient(variable(variables, literal), literal > 0 ? coefficient : -coefficient);
            }
            problem.hints().forEach((id, value) -> optimiser.setHint(variables.get(id - 1), value));

            Optimiser.Status status = optimiser.optimise(timeoutMillis);
            LOG.debug("Embedded solver finished: {}", optimiser);
            if (status == Optimiser.Status.INFEASIBLE) {
                LOG.info("The problem '{}' is unsatisfiable", problem.name());
                return Optional.empty();
            } else if (!optimiser.isOptimal() && !optimiser.isFeasible()) {
                LOG.error(EMBEDDED_SOLVER_FAILED.message(status));
                return Optional.empty();
            }

            List<Integer> literals = new ArrayList<>();
            for (int id = 1; id <= variables.size(); id++) {
                literals.add(variables.get(id - 1).value() ? id : -id);
            }
            return Optional.of(literals);
        } catch (TypeMatchException e) {
            LOG.error(e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * A negated literal {@code c * (1 - x)} is added as {@code -c * x}, moving {@code c} into the bounds.
     */
    private static void addConstraint(Optimiser optimiser, List<OptimiserVariable.Boolean> variables, Constraint constraint) {
        double shift = negatedCoefficients(constraint);
        double lowerBound = constraint.lowerBound().map(lb -> lb - shift).orElse(Double.NEGATIVE_INFINITY);
        double upperBound = constraint.upperBound().map(ub -> ub - shift).orElse(Double.POSITIVE_INFINITY);
        OptimiserConstraint optimiserConstraint = optimiser.constraint(lowerBound, upperBound, constraint.description());
        for (int i = 0; i < constraint.literals().size(); i++) {
            int literal = constraint.literals().get(i);
            double coefficient = constraint.coefficients().get(i);
            optimiserConstraint.addCoefficient(variable(variables, literal), literal > 0 ? coefficient : -coefficient);
        }
    }

    private static double negatedCoefficients(Constraint constraint) {
        double total = 0;
        for (int i = 0; i < constraint.literals().size(); i++) {
            if (constraint.literals().get(i) < 0) total += constraint.coefficients().get(i);
        }
        return total;
    }

    private static OptimiserVariable.Boolean variable(List<OptimiserVariable.Boolean> variables, int literal) {
        return variables.get(Math.abs(literal) - 1);
    }
}
