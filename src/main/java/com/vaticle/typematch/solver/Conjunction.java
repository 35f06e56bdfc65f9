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

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableSet;

/**
 * A conjunction of formulas. It never directly contains a constant or another conjunction.
 */
public class Conjunction extends Formula {

    private final Set<Formula> formulas;
    private final int hash;

    private Conjunction(Set<Formula> formulas) {
        assert formulas.size() > 1;
        this.formulas = unmodifiableSet(formulas);
        this.hash = formulas.hashCode();
    }

    public static Formula of(Formula... formulas) {
        return of(Arrays.asList(formulas));
    }

    public static Formula of(Collection<? extends Formula> formulas) {
        Set<Formula> flattened = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            if (formula.isFalse()) return FALSE;
            else if (formula.isTrue()) continue;
            else if (formula.isConjunction()) flattened.addAll(formula.asConjunction().formulas);
            else flattened.add(formula);
        }
        if (flattened.isEmpty()) return TRUE;
        else if (flattened.size() == 1) return flattened.iterator().next();
        else return new Conjunction(flattened);
    }

    /**
     * @return the conjuncts, in the order they were first given
     */
    public Set<Formula> formulas() {
        return formulas;
    }

    @Override
    public boolean isConjunction() {
        return true;
    }

    @Override
    public Conjunction asConjunction() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conjunction that = (Conjunction) o;
        return hash == that.hash && formulas.equals(that.formulas);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return formulas.stream().map(Object::toString).collect(Collectors.joining(" & ", "(", ")"));
    }
}
