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

import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPSolver;

import java.util.LinkedHashMap;
import java.util.Map;

public class OptimiserConstraint {

    private final double lowerBound;
    private final double upperBound;
    private final String name;
    private final Map<OptimiserVariable<?>, Double> coefficients;
    private MPConstraint mpConstraint;

    OptimiserConstraint(double lowerBound, double upperBound, String name) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.coefficients = new LinkedHashMap<>();
        this.name = name;
    }

    /**
     * Adds to the coefficient of the variable, so a variable given twice gets the sum of both.
     */
    public void addCoefficient(OptimiserVariable<?> variable, double coeff) {
        assert mpConstraint == null;
        coefficients.merge(variable, coeff, Double::sum);
    }

    void initialise(MPSolver solver) {
        this.mpConstraint = solver.makeConstraint(lowerBound, upperBound, name);
        coefficients.forEach((var, coeff) -> mpConstraint.setCoefficient(var.mpVariable(), coeff));
    }

    void release() {
        if (mpConstraint != null) mpConstraint.delete();
        mpConstraint = null;
    }

    boolean isSatisfied() {
        double total = 0.0;
        for (Map.Entry<OptimiserVariable<?>, Double> entry : coefficients.entrySet()) {
            total += entry.getKey().valueAsDouble() * entry.getValue();
        }
        return lowerBound <= total && total <= upperBound;
    }

    @Override
    public String toString() {
        return lowerBound + " <= " + coefficients + " <= " + upperBound + " # " + name;
    }
}
