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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A symmetric equality between a variable and a value, or between two variables. The side that
 * sorts higher is always kept on the left, so {@code Eq.of(a, b)} and {@code Eq.of(b, a)} are equal.
 */
public class Eq extends BooleanTerm {

    private final String left;
    private final String right;
    private final int hash;

    private Eq(String left, String right) {
        assert left.compareTo(right) > 0;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(left, right);
    }

    public static BooleanTerm of(String left, String right) {
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
        int order = left.compareTo(right);
        if (order == 0) return TRUE;
        else if (order > 0) return new Eq(left, right);
        else return new Eq(right, left);
    }

    public String left() {
        return left;
    }

    public String right() {
        return right;
    }

    /**
     * Keeps the equality if one side is still a candidate of the other. Otherwise, both sides are
     * rewritten as being bound to a common value, which is FALSE when no such value remains.
     */
    @Override
    public BooleanTerm simplify(Map<String, ? extends Set<String>> assignments) {
        Set<String> leftValues = assignments.containsKey(left) ? assignments.get(left) : Set.of();
        Set<String> rightValues = assignments.containsKey(right) ? assignments.get(right) : Set.of();
        if (leftValues.contains(right) || rightValues.contains(left)) return this;

        Set<String> intersection = new HashSet<>(leftValues);
        intersection.retainAll(rightValues);
        Set<BooleanTerm> alternatives = new HashSet<>();
        for (String value : intersection) {
            alternatives.add(And.of(Eq.of(left, value), Eq.of(value, right)));
        }
        return Or.of(alternatives);
    }

    @Override
    public Map<String, Set<String>> extractPivots() {
        Map<String, Set<String>> pivots = new HashMap<>();
        pivots.put(left, Set.of(right));
        pivots.put(right, Set.of(left));
        return pivots;
    }

    @Override
    public boolean isEq() {
        return true;
    }

    @Override
    public Eq asEq() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Eq that = (Eq) o;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return left + " == " + right;
    }
}
