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

import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.vaticle.typematch.common.exception.TypeMatchException;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.UNEXPECTED_OPTIMISER_VALUE;

public abstract class OptimiserVariable<T> {

    final String name;
    MPVariable mpVariable;
    T value;

    OptimiserVariable(String name) {
        this.name = name;
    }

    public T value() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public abstract double valueAsDouble();

    MPVariable mpVariable() {
        return mpVariable;
    }

    abstract void recordSolutionValue();

    abstract void initialise(MPSolver solver);

    void release() {
        if (mpVariable != null) mpVariable.delete();
        mpVariable = null;
    }

    @Override
    public String toString() {
        return name + "[" + getClass().getSimpleName() + "]";
    }

    public static class Boolean extends OptimiserVariable<java.lang.Boolean> {

        Boolean(String name) {
            super(name);
        }

        @Override
        void recordSolutionValue() {
            double solution = Math.round(mpVariable.solutionValue());
            if (solution == 0.0) value = false;
            else if (solution == 1.0) value = true;
            else throw TypeMatchException.of(UNEXPECTED_OPTIMISER_VALUE);
        }

        @Override
        void initialise(MPSolver mpSolver) {
            this.mpVariable = mpSolver.makeBoolVar(name);
        }

        @Override
        public double valueAsDouble() {
            assert hasValue();
            if (value) return 1.0;
            else return 0.0;
        }
    }
}
