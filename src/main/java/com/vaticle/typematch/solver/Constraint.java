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

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Collections.unmodifiableList;

/**
 * A linear pseudo-boolean constraint {@code lowerBound <= sum(coefficient * literal) <= upperBound}.
 * A positive literal {@code v} stands for the variable with id {@code v}, a negative literal
 * {@code -v} for its negation, which contributes {@code coefficient * (1 - x_v)}.
 */
public class Constraint {

    private final List<Integer> literals;
    private final List<Integer> coefficients;
    private final String description;
    private Integer lowerBound;
    private Integer upperBound;

    Constraint(String description) {
        this.description = description;
        this.literals = new ArrayList<>();
        this.coefficients = new ArrayList<>();
        this.lowerBound = null;
        this.upperBound = null;
    }

    public static Constraint of(List<Integer> literals, List<Integer> coefficients,
                                @Nullable Integer lowerBound, @Nullable Integer upperBound, String description) {
        Constraint constraint = new Constraint(description);
        constraint.literals.addAll(literals);
        constraint.coefficients.addAll(coefficients);
        constraint.lowerBound = lowerBound;
        constraint.upperBound = upperBound;
        return constraint;
    }

    void add(int literal, int coefficient) {
        literals.add(literal);
        coefficients.add(coefficient);
    }

    void lowerBound(int lowerBound) {
        this.lowerBound = lowerBound;
    }

    void upperBound(int upperBound) {
        this.upperBound = upperBound;
    }

    public List<Integer> literals() {
        return unmodifiableList(literals);
    }

    public List<Integer> coefficients() {
        return unmodifiableList(coefficients);
    }

    public Optional<Integer> lowerBound() {
        return Optional.ofNullable(lowerBound);
    }

    public Optional<Integer> upperBound() {
        return Optional.ofNullable(upperBound);
    }

    public String description() {
        return description;
    }

    /**
     * Evaluates the weighted sum of this constraint for the given assignment.
     *
     * @param values variable values, where the value of variable {@code v} is at index {@code v - 1}
     */
    public int sum(boolean[] values) {
        int sum = 0;
        for (int i = 0; i < literals.size(); i++) {
            int literal = literals.get(i);
            boolean value = values[Math.abs(literal) - 1];
            if (literal > 0 == value) sum += coefficients.get(i);
        }
        return sum;
    }

    public boolean isSatisfiedBy(boolean[] values) {
        int sum = sum(values);
        return (lowerBound == null || lowerBound <= sum) && (upperBound == null || sum <= upperBound);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (lowerBound != null) builder.append(lowerBound).append(" <= ");
        for (int i = 0; i < literals.size(); i++) {
            builder.append(coefficients.get(i)).append("*").append(literals.get(i)).append(" ");
        }
        if (upperBound != null) builder.append("<= ").append(upperBound).append(" ");
        return builder.append(" # ").append(description).toString();
    }
}
