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

import com.vaticle.typematch.common.exception.TypeMatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;
import static java.util.Collections.unmodifiableList;

/**
 * A reference to a type, as written in a declaration.
 */
public abstract class TypeRef {

    TypeRef() {}

    public static Named named(String name) {
        return new Named(name);
    }

    public static Union union(TypeRef... refs) {
        return new Union(Arrays.asList(refs));
    }

    public static Union union(List<? extends TypeRef> refs) {
        return new Union(refs);
    }

    public static Generic generic(TypeRef base, TypeRef... parameters) {
        return new Generic(base, Arrays.asList(parameters));
    }

    public static HomogeneousContainer container(TypeRef base, TypeRef element) {
        return new HomogeneousContainer(base, element);
    }

    public static Anything anything() {
        return Anything.INSTANCE;
    }

    /**
     * Replaces every named reference found in the map by its replacement.
     */
    public abstract TypeRef substitute(Map<String, TypeRef> substitutions);

    public boolean isNamed() {
        return false;
    }

    public boolean isUnion() {
        return false;
    }

    public boolean isGeneric() {
        return false;
    }

    public boolean isContainer() {
        return false;
    }

    public boolean isAnything() {
        return false;
    }

    public Named asNamed() {
        throw TypeMatchException.of(ILLEGAL_CAST, className(getClass()), className(Named.class));
    }

    public Union asUnion() {
        throw TypeMatchException.of(ILLEGAL_CAST, className(getClass()), className(Union.class));
    }

    public Generic asGeneric() {
        throw TypeMatchException.of(ILLEGAL_CAST, className(getClass()), className(Generic.class));
    }

    public HomogeneousContainer asContainer() {
        throw TypeMatchException.of(ILLEGAL_CAST, className(getClass()), className(HomogeneousContainer.class));
    }

    private static String className(Class<?> clazz) {
        return clazz.getSimpleName();
    }

    /**
     * A type named by a class or by a template parameter.
     */
    public static class Named extends TypeRef {

        private final String name;

        private Named(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String name() {
            return name;
        }

        @Override
        public TypeRef substitute(Map<String, TypeRef> substitutions) {
            return substitutions.getOrDefault(name, this);
        }

        @Override
        public boolean isNamed() {
            return true;
        }

        @Override
        public Named asNamed() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return name.equals(((Named) o).name);
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

    public static class Union extends TypeRef {

        private final List<TypeRef> refs;
        private final int hash;

        private Union(List<? extends TypeRef> refs) {
            if (refs.isEmpty()) throw TypeMatchException.of(ILLEGAL_ARGUMENT, refs);
            this.refs = unmodifiableList(new ArrayList<>(refs));
            this.hash = Objects.hash(Union.class, this.refs);
        }

        public List<TypeRef> refs() {
            return refs;
        }

        @Override
        public TypeRef substitute(Map<String, TypeRef> substitutions) {
            return new Union(refs.stream().map(ref -> ref.substitute(substitutions)).collect(Collectors.toList()));
        }

        @Override
        public boolean isUnion() {
            return true;
        }

        @Override
        public Union asUnion() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return refs.equals(((Union) o).refs);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return refs.stream().map(Object::toString).collect(Collectors.joining(" or "));
        }
    }

    /**
     * A parameterised class, such as {@code dict<str, int>}.
     */
    public static class Generic extends TypeRef {

        private final TypeRef base;
        private final List<TypeRef> parameters;
        private final int hash;

        private Generic(TypeRef base, List<? extends TypeRef> parameters) {
            this.base = Objects.requireNonNull(base);
            this.parameters = unmodifiableList(new ArrayList<>(parameters));
            this.hash = Objects.hash(Generic.class, base, this.parameters);
        }

        public TypeRef base() {
            return base;
        }

        public List<TypeRef> parameters() {
            return parameters;
        }

        @Override
        public TypeRef substitute(Map<String, TypeRef> substitutions) {
            return new Generic(
                    base.substitute(substitutions),
                    parameters.stream().map(ref -> ref.substitute(substitutions)).collect(Collectors.toList())
            );
        }

        @Override
        public boolean isGeneric() {
            return true;
        }

        @Override
        public Generic asGeneric() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Generic that = (Generic) o;
            return base.equals(that.base) && parameters.equals(that.parameters);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return base + parameters.stream().map(Object::toString).collect(Collectors.joining(", ", "<", ">"));
        }
    }

    /**
     * A container whose elements all have the same type, such as {@code list<int, ...>}.
     */
    public static class HomogeneousContainer extends TypeRef {

        private final TypeRef base;
        private final TypeRef element;
        private final int hash;

        private HomogeneousContainer(TypeRef base, TypeRef element) {
            this.base = Objects.requireNonNull(base);
            this.element = Objects.requireNonNull(element);
            this.hash = Objects.hash(HomogeneousContainer.class, base, element);
        }

        public TypeRef base() {
            return base;
        }

        public TypeRef element() {
            return element;
        }

        @Override
        public TypeRef substitute(Map<String, TypeRef> substitutions) {
            return new HomogeneousContainer(base.substitute(substitutions), element.substitute(substitutions));
        }

        @Override
        public boolean isContainer() {
            return true;
        }

        @Override
        public HomogeneousContainer asContainer() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            HomogeneousContainer that = (HomogeneousContainer) o;
            return base.equals(that.base) && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return base + "<" + element + ", ...>";
        }
    }

    /**
     * The unknown type {@code ?}, which is compatible with everything.
     */
    public static class Anything extends TypeRef {

        private static final Anything INSTANCE = new Anything();

        private Anything() {}

        @Override
        public TypeRef substitute(Map<String, TypeRef> substitutions) {
            return this;
        }

        @Override
        public boolean isAnything() {
            return true;
        }

        @Override
        public String toString() {
            return "?";
        }
    }
}
