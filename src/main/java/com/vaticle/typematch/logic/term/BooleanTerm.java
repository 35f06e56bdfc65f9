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

import com.vaticle.typematch.common.exception.TypeMatchException;

import java.util.Map;
import java.util.Set;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * An immutable boolean equation over named variables and values. The subclasses are closed:
 * {@link #TRUE}, {@link #FALSE}, {@link Eq}, {@link And} and {@link Or}. Terms are normalised on
 * construction, so structurally equivalent terms are equal and hash alike.
 */
public abstract class BooleanTerm {

    public static final BooleanTerm TRUE = new Constant(true);
    public static final BooleanTerm FALSE = new Constant(false);

    BooleanTerm() {}

    /**
     * Simplifies this term given the values each variable may still take.
     *
     * @param assignments variable name to the set of value (or variable) names it may be bound to
     * @return a new, potentially simpler term
     */
    public abstract BooleanTerm simplify(Map<String, ? extends Set<String>> assignments);

    /**
     * Finds the variables that appear in every branch of this term, together with the values they
     * can be narrowed to. For example {@code t = v1 | (t = v2 & (t = v2 | t = v3))} narrows
     * {@code t} to {@code {v1, v2}}. The values may themselves be variable names unless the term was
     * simplified first.
     *
     * @return variable name to the set of values it may take
     */
    public abstract Map<String, Set<String>> extractPivots();

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isFalse() {
        return this == FALSE;
    }

    public boolean isConstant() {
        return false;
    }

    public boolean isEq() {
        return false;
    }

    public boolean isAnd() {
        return false;
    }

    public boolean isOr() {
        return false;
    }

    public Eq asEq() {
        throw TypeMatchException.of(ILLEGAL_CAST, className(getClass()), className(Eq.class));
    }

    public And asAnd() {
        throw TypeMatchException.of(ILLEGAL_CAST, className(getClass()), className(And.class));
    }

    public Or asOr() {
        throw TypeMatchException.of(ILLEGAL_CAST, className(getClass()), className(Or.class));
    }

    static String className(Class<?> clazz) {
        return clazz.getSimpleName();
    }

    private static class Constant extends BooleanTerm {

        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        @Override
        public BooleanTerm simplify(Map<String, ? extends Set<String>> assignments) {
            return this;
        }

        @Override
        public Map<String, Set<String>> extractPivots() {
            return Map.of();
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public String toString() {
            return value ? "TRUE" : "FALSE";
        }
    }
}
