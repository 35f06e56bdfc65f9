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

package com.vaticle.typematch.solver.optimiser;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import com.vaticle.typematch.common.exception.TypeMatchException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.ortools.linearsolver.MPSolverParameters.IntegerParam.PRESOLVE;
import static com.google.ortools.linearsolver.MPSolverParameters.PresolveValues.PRESOLVE_ON;
import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.EMBEDDED_SOLVER_UNAVAILABLE;

/**
 * A one-shot model of boolean variables and linear constraints, solved by an OR-Tools solver. The
 * native solver only exists for the duration of {@link #optimise(long)}.
 */
public class Optimiser {

    private static boolean nativeLibrariesLoaded = false;

    private final String solverId;
    private final List<OptimiserVariable.Boolean> variables;
    private final List<OptimiserConstraint> constraints;
    private final Map<OptimiserVariable.Boolean, Double> objectiveCoefficients;
    private final Map<OptimiserVariable.Boolean, Boolean> hints;
    private Status status;

    public Optimiser(String solverId) {
        this.solverId = solverId;
        variables = new ArrayList<>();
        constraints = new ArrayList<>();
        objectiveCoefficients = new LinkedHashMap<>();
        hints = new LinkedHashMap<>();
        status = Status.NOT_SOLVED;
    }

    private static synchronized void loadNativeLibraries(String solverId) {
        if (nativeLibrariesLoaded) return;
        try {
            Loader.loadNativeLibraries();
            nativeLibrariesLoaded = true;
        } catch (RuntimeException | LinkageError e) {
            throw TypeMatchException.of(EMBEDDED_SOLVER_UNAVAILABLE, solverId);
        }
    }

    public Status optimise(long timeLimitMillis) {
        assert status == Status.NOT_SOLVED;
        loadNativeLibraries(solverId);
        MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null) throw TypeMatchException.of(EMBEDDED_SOLVER_UNAVAILABLE, solverId);
        MPSolverParameters parameters = new MPSolverParameters();
        try {
            parameters.setIntegerParam(PRESOLVE, PRESOLVE_ON.swigValue());
            solver.objective().setMinimization();
            variables.forEach(var -> var.initialise(solver));
            constraints.forEach(constraint -> constraint.initialise(solver));
            objectiveCoefficients.forEach((var, coeff) -> solver.objective().setCoefficient(var.mpVariable(), coeff));
            setHints(solver);
            solver.setTimeLimit(timeLimitMillis);
            status = Status.of(solver.solve(parameters));
            if (isOptimal() || isFeasible()) variables.forEach(OptimiserVariable::recordSolutionValue);
            assert !(isOptimal() || isFeasible()) || constraints.stream().allMatch(OptimiserConstraint::isSatisfied);
            return status;
        } finally {
            constraints.forEach(OptimiserConstraint::release);
            variables.forEach(OptimiserVariable::release);
            parameters.delete();
            solver.delete();
        }
    }

    private void setHints(MPSolver solver) {
        if (hints.isEmpty()) return;
        MPVariable[] mpVariables = new MPVariable[hints.size()];
        double[] values = new double[hints.size()];
        int i = 0;
        for (Map.Entry<OptimiserVariable.Boolean, Boolean> hint : hints.entrySet()) {
            mpVariables[i] = hint.getKey().mpVariable();
            values[i] = hint.getValue() ? 1.0 : 0.0;
            i++;
        }
        solver.setHint(mpVariables, values);
    }

    public boolean isOptimal() {
        return status == Status.OPTIMAL;
    }

    public boolean isFeasible() {
        return status == Status.FEASIBLE;
    }

    public void setObjectiveCoefficient(OptimiserVariable.Boolean var, double coeff) {
        objectiveCoefficients.merge(var, coeff, Double::sum);
    }

    public void setHint(OptimiserVariable.Boolean var, boolean value) {
        hints.put(var, value);
    }

    public OptimiserConstraint constraint(double lowerBound, double upperBound, String name) {
        assert status == Status.NOT_SOLVED;
        OptimiserConstraint constraint = new OptimiserConstraint(lowerBound, upperBound, name);
        constraints.add(constraint);
        return constraint;
    }

    public OptimiserVariable.Boolean booleanVar(String name) {
        assert status == Status.NOT_SOLVED;
        OptimiserVariable.Boolean var = new OptimiserVariable.Boolean(name);
        variables.add(var);
        return var;
    }

    public Status status() {
        return status;
    }

    public enum Status {
        NOT_SOLVED, OPTIMAL, FEASIBLE, INFEASIBLE, ERROR;

        static Status of(MPSolver.ResultStatus mpStatus) {
            switch (mpStatus) {
                case NOT_SOLVED:
                    return NOT_SOLVED;
                case OPTIMAL:
                    return OPTIMAL;
                case FEASIBLE:
                    return FEASIBLE;
                case INFEASIBLE:
                    return INFEASIBLE;
                case UNBOUNDED:
                case ABNORMAL:
                    return ERROR;
                default:
                    throw TypeMatchException.of(ILLEGAL_STATE);
            }
        }
    }

    @Override
    public String toString() {
        return "Optimiser[solver=" + solverId + ", variables=" + variables.size() +
                ", constraints=" + constraints.size() + ", status=" + status + "]";
    }
}
