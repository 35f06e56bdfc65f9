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
import com.vaticle.typematch.declaration.FunctionDecl;
import com.vaticle.typematch.declaration.TypeRef;

import java.util.Map;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * A type taking part in matching. Its structure maps member names to the functions it offers.
 * A complete type is fully known; an incomplete type is one whose identity is being solved for.
 */
public abstract class Type implements Comparable<Type> {

    Type() {}

    public abstract Map<String, FunctionDecl> structure();

    public abstract boolean isComplete();

    public abstract boolean isNominallyCompatibleWith(Type other);

    public abstract TypeRef toTypeRef();

    public boolean isClassType() {
        return false;
    }

    public boolean isUnionType() {
        return false;
    }

    public ClassType asClassType() {
        throw TypeMatchException.of(ILLEGAL_CAST, getClass().getSimpleName(), ClassType.class.getSimpleName());
    }

    public UnionType asUnionType() {
        throw TypeMatchException.of(ILLEGAL_CAST, getClass().getSimpleName(), UnionType.class.getSimpleName());
    }

    /**
     * Orders types by their rendering. Incomplete classes render with a trailing {@code #}, so a
     * complete class sorts before the incomplete class of the same name.
     */
    @Override
    public int compareTo(Type other) {
        return toString().compareTo(other.toString());
    }
}
