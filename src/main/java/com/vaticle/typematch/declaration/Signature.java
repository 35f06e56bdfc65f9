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
 * One way of calling a function: its parameters, return type and declared exceptions.
 */
public class Signature {

    private final List<Parameter> params;
    private final TypeRef returnType;
    private final List<TypeRef> exceptions;
    private final int hash;

    public Signature(List<Parameter> params, TypeRef returnType, List<TypeRef> exceptions) {
        this.params = unmodifiableList(new ArrayList<>(params));
        this.returnType = Objects.requireNonNull(returnType);
        this.exceptions = unmodifiableList(new ArrayList<>(exceptions));
        this.hash = Objects.hash(this.params, returnType, this.exceptions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Parameter> params() {
        return params;
    }

    public TypeRef returnType() {
        return returnType;
    }

    public List<TypeRef> exceptions() {
        return exceptions;
    }

    Signature substitute(Map<String, TypeRef> substitutions) {
        return new Signature(
                params.stream().map(param -> param.substitute(substitutions)).collect(Collectors.toList()),
                returnType.substitute(substitutions),
                exceptions.stream().map(exception -> exception.substitute(substitutions)).collect(Collectors.toList())
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Signature that = (Signature) o;
        return params.equals(that.params) && returnType.equals(that.returnType) && exceptions.equals(that.exceptions);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        String signature = params.stream().map(Parameter::toString).collect(Collectors.joining(", ", "(", ")")) +
                " -> " + returnType;
        if (exceptions.isEmpty()) return signature;
        else return signature + " raises " + exceptions.stream().map(Object::toString).collect(Collectors.joining(", "));
    }

    public static class Builder {

        private final List<Parameter> params;
        private final List<TypeRef> exceptions;
        private TypeRef returnType;

        private Builder() {
            params = new ArrayList<>();
            exceptions = new ArrayList<>();
            returnType = TypeRef.named("NoneType");
        }

        public Builder param(String name, TypeRef type) {
            params.add(new Parameter(name, type));
            return this;
        }

        public Builder param(String name, String typeName) {
            return param(name, TypeRef.named(typeName));
        }

        public Builder returns(TypeRef returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder returns(String typeName) {
            return returns(TypeRef.named(typeName));
        }

        public Builder raises(TypeRef exception) {
            exceptions.add(exception);
            return this;
        }

        public Signature build() {
            return new Signature(params, returnType, exceptions);
        }
    }
}
