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
import com.vaticle.typematch.declaration.Signature;
import com.vaticle.typematch.declaration.TypeRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.vaticle.typematch.common.exception.ErrorMessage.Matcher.EMPTY_UNION;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * A union of class types. Its structure is what all of its members have in common.
 */
public class UnionType extends Type {

    private final Set<ClassType> subtypes;
    private final boolean complete;
    private final Map<String, FunctionDecl> structure;
    private final int hash;

    public UnionType(Collection<ClassType> subtypes) {
        if (subtypes.isEmpty()) throw TypeMatchException.of(EMPTY_UNION);
        this.subtypes = unmodifiableSet(new LinkedHashSet<>(subtypes));
        this.complete = subtypes.stream().allMatch(ClassType::isComplete);
        this.structure = unmodifiableMap(intersectStructures(this.subtypes));
        this.hash = this.subtypes.hashCode();
    }

    /**
     * Keeps the members present in every subtype, with only the signatures every subtype has for
     * them. A member without a signature in common is dropped.
     */
    private static Map<String, FunctionDecl> intersectStructures(Set<ClassType> subtypes) {
        Iterator<ClassType> iterator = subtypes.iterator();
        Map<String, FunctionDecl> first = iterator.next().structure();
        List<Map<String, FunctionDecl>> others = new ArrayList<>();
        iterator.forEachRemaining(subtype -> others.add(subtype.structure()));

        Map<String, FunctionDecl> structure = new LinkedHashMap<>();
        first.forEach((name, function) -> {
            if (!others.stream().allMatch(other -> other.containsKey(name))) return;
            List<Signature> signatures = new ArrayList<>(function.signatures());
            others.forEach(other -> signatures.retainAll(other.get(name).signatures()));
            if (!signatures.isEmpty()) structure.put(name, new FunctionDecl(name, signatures));
        });
        return structure;
    }

    public Set<ClassType> subtypes() {
        return subtypes;
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
     * A union is not named, so it may be equal to any type.
     */
    @Override
    public boolean isNominallyCompatibleWith(Type other) {
        return true;
    }

    @Override
    public TypeRef toTypeRef() {
        return TypeRef.union(subtypes.stream().map(ClassType::toTypeRef).collect(Collectors.toList()));
    }

    @Override
    public boolean isUnionType() {
        return true;
    }

    @Override
    public UnionType asUnionType() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return subtypes.equals(((UnionType) o).subtypes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return subtypes.stream().map(Object::toString).sorted().collect(Collectors.joining(", ", "U(", ")"));
    }
}
