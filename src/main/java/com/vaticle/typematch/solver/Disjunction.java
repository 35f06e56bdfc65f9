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
 * A disjunction of formulas. It never directly contains a constant or another disjunction.
 */
public class Disjunction extends Formula {

    private final Set<Formula> formulas;
    private final int hash;

    private Disjunction(Set<Formula> formulas) {
        assert formulas.size() > 1;
        this.formulas = unmodifiableSet(formulas);
        this.hash = 31 * formulas.hashCode() + 1;
    }

    public static Formula of(Formula... formulas) {
        return of(Arrays.asList(formulas));
    }

    public static Formula of(Collection<? extends Formula> formulas) {
        Set<Formula> flattened = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            if (formula.isTrue()) return TRUE;
            else if (formula.isFalse()) continue;
            else if (formula.isDisjunction()) flattened.addAll(formula.asDisjunction().formulas);
            else flattened.add(formula);
        }
        if (flattened.isEmpty()) return FALSE;
        else if (flattened.size() == 1) return flattened.iterator().next();
        else return new Disjunction(flattened);
    }

    /**
     * @return the disjuncts, in the order they were first given
     */
    public Set<Formula> formulas() {
        return formulas;
    }

    @Override
    public boolean isDisjunction() {
        return true;
    }

    @Override
    public Disjunction asDisjunction() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Disjunction that = (Disjunction) o;
        return hash == that.hash && formulas.equals(that.formulas);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return formulas.stream().map(Object::toString).collect(Collectors.joining(" | ", "(", ")"));
    }
}
