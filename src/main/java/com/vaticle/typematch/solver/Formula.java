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

import java.util.Objects;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * The shape of a boolean expression before it is lowered into linear constraints: a constant, a
 * single variable, or a {@link Conjunction} or {@link Disjunction} of other formulas.
 */
public abstract class Formula {

    public static final Formula TRUE = new Constant(true);
    public static final Formula FALSE = new Constant(false);

    Formula() {}

    /**
     * Wraps a key as a variable. Any object with value semantics can be a key.
     */
    public static Formula variable(Object key) {
        if (key instanceof Formula) return (Formula) key;
        else if (key instanceof Boolean) return constant((Boolean) key);
        else return new Variable(key);
    }

    public static Formula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isFalse() {
        return this == FALSE;
    }

    public boolean isConstant() {
        return false;
    }

    public boolean isVariable() {
        return false;
    }

    public boolean isConjunction() {
        return false;
    }

    public boolean isDisjunction() {
        return false;
    }

    /**
     * @return true if this formula must be lifted into an auxiliary variable to be used as a literal
     */
    public boolean isCompound() {
        return isConstant() || isConjunction() || isDisjunction();
    }

    public Variable asVariable() {
        throw TypeMatchException.of(ILLEGAL_CAST, getClass().getSimpleName(), Variable.class.getSimpleName());
    }

    public Conjunction asConjunction() {
        throw TypeMatchException.of(ILLEGAL_CAST, getClass().getSimpleName(), Conjunction.class.getSimpleName());
    }

    public Disjunction asDisjunction() {
        throw TypeMatchException.of(ILLEGAL_CAST, getClass().getSimpleName(), Disjunction.class.getSimpleName());
    }

    private static class Constant extends Formula {

        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public String toString() {
            return value ? "True" : "False";
        }
    }

    public static class Variable extends Formula {

        private final Object key;
        private final int hash;

        private Variable(Object key) {
            this.key = Objects.requireNonNull(key);
            this.hash = key.hashCode();
        }

        public Object key() {
            return key;
        }

        @Override
        public boolean isVariable() {
            return true;
        }

        @Override
        public Variable asVariable() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Variable that = (Variable) o;
            return key.equals(that.key);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return key.toString();
        }
    }

    /**
     * The key of a variable introduced to stand in for a compound formula.
     */
    public static class Auxiliary {

        private final String name;

        Auxiliary(int id) {
            this.name = "tmp" + id;
        }

        public String name() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return name.equals(((Auxiliary) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
