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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.INVALID_CONSTRAINT;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * The flat optimisation problem handed to a {@link SolverBackend}: a number of boolean variables,
 * a list of linear constraints over their literals, an objective to minimise, and optional hints
 * for the initial value of some variables.
 */
public class LinearBooleanProblem {

    private final String name;
    private final int numVariables;
    private final List<String> varNames;
    private final List<Constraint> constraints;
    private final List<Integer> objectiveLiterals;
    private final List<Integer> objectiveCoefficients;
    private final Map<Integer, Boolean> hints;

    public LinearBooleanProblem(String name, List<String> varNames, List<Constraint> constraints,
                                List<Integer> objectiveLiterals, List<Integer> objectiveCoefficients,
                                Map<Integer, Boolean> hints) {
        this.name = name;
        this.numVariables = varNames.size();
        this.varNames = unmodifiableList(new ArrayList<>(varNames));
        this.constraints = unmodifiableList(new ArrayList<>(constraints));
        this.objectiveLiterals = unmodifiableList(new ArrayList<>(objectiveLiterals));
        this.objectiveCoefficients = unmodifiableList(new ArrayList<>(objectiveCoefficients));
        this.hints = unmodifiableMap(new LinkedHashMap<>(hints));
    }

    public String name() {
        return name;
    }

    public int numVariables() {
        return numVariables;
    }

    public List<String> varNames() {
        return varNames;
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    public List<Integer> objectiveLiterals() {
        return objectiveLiterals;
    }

    public List<Integer> objectiveCoefficients() {
        return objectiveCoefficients;
    }

    public boolean hasObjective() {
        return !objectiveLiterals.isEmpty();
    }

    /**
     * @return variable id to the value the solver should try first
     */
    public Map<Integer, Boolean> hints() {
        return hints;
    }

    public void validate() {
        for (Constraint constraint : constraints) {
            validateLiterals(constraint.literals(), constraint.coefficients(), constraint.description());
        }
        validateLiterals(objectiveLiterals, objectiveCoefficients, "objective");
        hints.keySet().forEach(id -> {
            if (id < 1 || id > numVariables) throw TypeMatchException.of(INVALID_CONSTRAINT, "hint", "unknown variable " + id);
        });
    }

    private void validateLiterals(List<Integer> literals, List<Integer> coefficients, String description) {
        if (literals.size() != coefficients.size()) {
            throw TypeMatchException.of(INVALID_CONSTRAINT, description, "literals and coefficients differ in length");
        }
        for (int literal : literals) {
            if (literal == 0 || Math.abs(literal) > numVariables) {
                throw TypeMatchException.of(INVALID_CONSTRAINT, description, "literal " + literal + " is out of range");
            }
        }
        for (int coefficient : coefficients) {
            if (coefficient == 0) throw TypeMatchException.of(INVALID_CONSTRAINT, description, "zero coefficient");
        }
    }

    public boolean isSatisfiedBy(boolean[] values) {
        for (Constraint constraint : constraints) {
            if (!constraint.isSatisfiedBy(values)) return false;
        }
        return true;
    }

    public int objectiveValue(boolean[] values) {
        int value = 0;
        for (int i = 0; i < objectiveLiterals.size(); i++) {
            int literal = objectiveLiterals.get(i);
            if (literal > 0 == values[Math.abs(literal) - 1]) value += objectiveCoefficients.get(i);
        }
        return value;
    }

    /**
     * Renders the problem with variable names in place of ids, one constraint per line.
     */
    public String pretty() {
        StringBuilder builder = new StringBuilder();
        builder.append("name: '").append(name).append("'\n");
        builder.append("num_variables: ").append(numVariables).append("\n");
        builder.append("var_names: [");
        for (int i = 0; i < varNames.size(); i++) {
            if (i > 0) builder.append(", ");
            builder.append("(").append(i).append(", '").append(varNames.get(i)).append("')");
        }
        builder.append("]\n");
        for (Constraint constraint : constraints) {
            List<String> duplicates = duplicates(constraint.literals());
            if (!duplicates.isEmpty()) builder.append("***duplicates: ").append(duplicates).append(" ");
            constraint.lowerBound().ifPresent(lb -> builder.append(lb).append(" <= "));
            for (int i = 0; i < constraint.literals().size(); i++) {
                int literal = constraint.literals().get(i);
                builder.append(constraint.coefficients().get(i)).append("*");
                if (literal < 0) builder.append("-");
                builder.append(literalName(Math.abs(literal))).append(" ");
            }
            constraint.upperBound().ifPresent(ub -> builder.append("<= ").append(ub).append(" "));
            builder.append(" # ").append(constraint.description()).append("\n");
        }
        return builder.toString();
    }

    private String literalName(int id) {
        if (id >= 1 && id <= varNames.size()) return varNames.get(id - 1);
        else return "(!!" + id + "!!)";
    }

    private List<String> duplicates(List<Integer> literals) {
        Map<Integer, Integer> counts = new HashMap<>();
        literals.forEach(literal -> counts.merge(Math.abs(literal), 1, Integer::sum));
        List<String> duplicates = new ArrayList<>();
        counts.forEach((id, count) -> {
            if (count > 1) duplicates.add(literalName(id));
        });
        return duplicates;
    }

    @Override
    public String toString() {
        return "LinearBooleanProblem[name='" + name + "', variables=" + numVariables +
                ", constraints=" + constraints.size() + "]";
    }
}
