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

import com.vaticle.typematch.declaration.ClassDecl;
import com.vaticle.typematch.declaration.FunctionDecl;
import com.vaticle.typematch.declaration.TypeRef;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

public class ClassType extends Type {

    private final ClassDecl cls;
    private final boolean complete;
    private final Map<String, FunctionDecl> structure;
    private final int hash;

    public ClassType(ClassDecl cls, boolean complete) {
        this.cls = Objects.requireNonNull(cls);
        this.complete = complete;
        Map<String, FunctionDecl> structure = new LinkedHashMap<>();
        cls.methods().forEach(method -> structure.put(method.name(), method));
        this.structure = unmodifiableMap(structure);
        this.hash = Objects.hash(cls, complete);
    }

    public ClassDecl classDecl() {
        return cls;
    }

    @Override
    public Map<String, FunctionDecl> structure() {
        return structure;
    }

    @Override
    public boolean isComplete() {
        return complete;
    }

    /**
     * Two complete classes are only compatible if they are the same class.
     */
    @Override
    public boolean isNominallyCompatibleWith(Type other) {
        // TODO: check the superclasses of incomplete classes once declarations carry them
        if (other.isClassType() && complete && other.isComplete()) return cls.equals(other.asClassType().cls);
        else return true;
    }

    @Override
    public TypeRef toTypeRef() {
        return TypeRef.named(cls.name());
    }

    @Override
    public boolean isClassType() {
        return true;
    }

    @Override
    public ClassType asClassType() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClassType that = (ClassType) o;
        return complete == that.complete && cls.equals(that.cls);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return cls.name() + (complete ? "" : "#");
    }
}
