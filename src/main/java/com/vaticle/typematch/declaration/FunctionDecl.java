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

package com.vaticle.typematch.declaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableList;

/**
 * A named function with one or more signatures. Several signatures mean the function is overloaded.
 */
public class FunctionDecl {

    private final String name;
    private final List<Signature> signatures;
    private final int hash;

    public FunctionDecl(String name, List<Signature> signatures) {
        this.name = Objects.requireNonNull(name);
        this.signatures = unmodifiableList(new ArrayList<>(signatures));
        this.hash = Objects.hash(name, this.signatures);
    }

    public String name() {
        return name;
    }

    public List<Signature> signatures() {
        return signatures;
    }

    FunctionDecl withSignature(Signature signature) {
        List<Signature> extended = new ArrayList<>(signatures);
        extended.add(signature);
        return new FunctionDecl(name, extended);
    }

    FunctionDecl substitute(Map<String, TypeRef> substitutions) {
        return new FunctionDecl(
                name, signatures.stream().map(signature -> signature.substitute(substitutions)).collect(Collectors.toList())
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionDecl that = (FunctionDecl) o;
        return name.equals(that.name) && signatures.equals(that.signatures);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return signatures.stream().map(signature -> "def " + name + signature).collect(Collectors.joining("\n"));
    }
}
