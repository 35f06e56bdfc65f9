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
import java.util.List;
import java.util.Map;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.COMPOUND_VARIABLE;
import static java.util.Collections.unmodifiableList;

/**
 * Numbers variables 1, 2, 3, ... in the order they are first used, and maps the numbers back.
 */
public class VariableTable {

    private final Map<Formula.Variable, Integer> ids;
    private final List<Formula.Variable> variables;

    public VariableTable() {
        ids = new HashMap<>();
        variables = new ArrayList<>();
    }

    public int id(Formula formula) {
        if (formula.isCompound()) throw TypeMatchException.of(COMPOUND_VARIABLE, formula);
        Formula.Variable variable = formula.asVariable();
        Integer id = ids.get(variable);
        if (id != null) return id;
        variables.add(variable);
        id = variables.size();
        ids.put(variable, id);
        assert ids.size() == variables.size();
        return id;
    }

    public boolean contains(Formula formula) {
        return formula.isVariable() && ids.containsKey(formula.asVariable());
    }

    public Formula.Variable variable(int id) {
        if (id < 1 || id > variables.size()) throw TypeMatchException.of(ILLEGAL_ARGUMENT, id);
        return variables.get(id - 1);
    }

    public int size() {
        return variables.size();
    }

    /**
     * @return all variables, where the variable with id {@code i} is at index {@code i - 1}
     */
    public List<Formula.Variable> variables() {
        return unmodifiableList(variables);
    }
}
