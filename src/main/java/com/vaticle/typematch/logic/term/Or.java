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
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableSet;

/**
 * A disjunction of terms. It never directly contains a constant or another {@code Or}.
 */
public class Or extends BooleanTerm {

    private final Set<BooleanTerm> terms;
    private final int hash;

    private Or(Set<BooleanTerm> terms) {
        assert terms.size() > 1;
        this.terms = unmodifiableSet(terms);
        this.hash = 31 * terms.hashCode() + 1;
    }

    public static BooleanTerm of(BooleanTerm... terms) {
        return of(Arrays.asList(terms));
    }

    public static BooleanTerm of(Collection<? extends BooleanTerm> terms) {
        Set<BooleanTerm> flattened = new HashSet<>();
        for (BooleanTerm term : terms) {
            if (term.isTrue()) return TRUE;
            else if (term.isFalse()) continue;
            else if (term.isOr()) flattened.addAll(term.asOr().terms);
            else flattened.add(term);
        }
        if (flattened.isEmpty()) return FALSE;
        else if (flattened.size() == 1) return flattened.iterator().next();
        else return new Or(flattened);
    }

    public Set<BooleanTerm> terms() {
        return terms;
    }

    @Override
    public BooleanTerm simplify(Map<String, ? extends Set<String>> assignments) {
        return Or.of(terms.stream().map(term -> term.simplify(assignments)).collect(Collectors.toSet()));
    }

    /**
     * A variable is a pivot of a disjunction only if every branch narrows it.
     */
    @Override
    public Map<String, Set<String>> extractPivots() {
        Iterator<BooleanTerm> iterator = terms.iterator();
        Map<String, Set<String>> pivots = new HashMap<>();
        iterator.next().extractPivots().forEach((name, values) -> pivots.put(name, new HashSet<>(values)));
        while (iterator.hasNext() && !pivots.isEmpty()) {
            Map<String, Set<String>> branch = iterator.next().extractPivots();
            pivots.keySet().retainAll(branch.keySet());
            pivots.forEach((name, values) -> values.addAll(branch.get(name)));
        }
        return pivots;
    }

    @Override
    public boolean isOr() {
        return true;
    }

    @Override
    public Or asOr() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Or that = (Or) o;
        return hash == that.hash && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return terms.stream().map(Object::toString).sorted().collect(Collectors.joining(" | ", "(", ")"));
    }
}
