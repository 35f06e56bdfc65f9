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

package com.vaticle.typematch.logic.term;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableSet;

/**
 * A conjunction of terms. It never directly contains a constant or another {@code And}.
 */
public class And extends BooleanTerm {

    private final Set<BooleanTerm> terms;
    private final int hash;

    private And(Set<BooleanTerm> terms) {
        assert terms.size() > 1;
        this.terms = unmodifiableSet(terms);
        this.hash = terms.hashCode();
    }

    public static BooleanTerm of(BooleanTerm... terms) {
        return of(Arrays.asList(terms));
    }

    public static BooleanTerm of(Collection<? extends BooleanTerm> terms) {
        Set<BooleanTerm> flattened = new HashSet<>();
        for (BooleanTerm term : terms) {
            if (term.isFalse()) return FALSE;
            else if (term.isTrue()) continue;
            else if (term.isAnd()) flattened.addAll(term.asAnd().terms);
            else flattened.add(term);
        }
        if (flattened.isEmpty()) return TRUE;
        else if (flattened.size() == 1) return flattened.iterator().next();
        else return new And(flattened);
    }

    public Set<BooleanTerm> terms() {
        return terms;
    }

    @Override
    public BooleanTerm simplify(Map<String, ? extends Set<String>> assignments) {
        return And.of(terms.stream().map(term -> term.simplify(assignments)).collect(Collectors.toSet()));
    }

    @Override
    public Map<String, Set<String>> extractPivots() {
        Map<String, Set<String>> pivots = new HashMap<>();
        for (BooleanTerm term : terms) {
            term.extractPivots().forEach((name, values) -> {
                Set<String> existing = pivots.get(name);
                if (existing == null) pivots.put(name, new HashSet<>(values));
                else existing.retainAll(values);
            });
        }
        return pivots;
    }

    @Override
    public boolean isAnd() {
        return true;
    }

    @Override
    public And asAnd() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        And that = (And) o;
        return hash == that.hash && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return terms.stream().map(Object::toString).sorted().collect(Collectors.joining(" & ", "(", ")"));
    }
}
