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

package com.vaticle.typematch.matcher;

import com.vaticle.typematch.common.exception.TypeMatchException;

import java.util.Objects;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;

/**
 * The statement that two types are the same. It is symmetric: {@code Equality.of(a, b)} equals
 * {@code Equality.of(b, a)}. Used as a variable of the SAT problem.
 */
public class Equality {

    private final Type left;
    private final Type right;
    private final int hash;

    private Equality(Type left, Type right) {
        this.left = left;
        this.right = right;
        this.hash = left.hashCode() + right.hashCode();
    }

    public static Equality of(Type first, Type second) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        if (first.equals(second)) throw TypeMatchException.of(ILLEGAL_ARGUMENT, first + " = " + second);
        if (first.compareTo(second) <= 0) return new Equality(first, second);
        else return new Equality(second, first);
    }

    public Type left() {
        return left;
    }

    public Type right() {
        return right;
    }

    public boolean contains(Type type) {
        return left.equals(type) || right.equals(type);
    }

    /**
     * @return the side that is not the given type
     */
    public Type other(Type type) {
        return left.equals(type) ? right : left;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Equality that = (Equality) o;
        return (left.equals(that.left) && right.equals(that.right)) ||
                (left.equals(that.right) && right.equals(that.left));
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "[" + left + "=" + right + "]";
    }
}
