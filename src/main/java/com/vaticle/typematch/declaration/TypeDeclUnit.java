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
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableList;

/**
 * The classes declared by one source, such as a parsed declaration file or the builtins.
 */
public class TypeDeclUnit {

    private final String name;
    private final List<ClassDecl> classes;

    public TypeDeclUnit(String name, List<ClassDecl> classes) {
        this.name = Objects.requireNonNull(name);
        this.classes = unmodifiableList(new ArrayList<>(classes));
    }

    public static TypeDeclUnit of(String name, ClassDecl... classes) {
        return new TypeDeclUnit(name, Arrays.asList(classes));
    }

    public String name() {
        return name;
    }

    public List<ClassDecl> classes() {
        return classes;
    }

    public Optional<ClassDecl> lookupClass(String className) {
        return classes.stream().filter(cls -> cls.name().equals(className)).findFirst();
    }

    /**
     * Rewrites every named type reference found in the map, throughout all classes.
     */
    public TypeDeclUnit substitute(Map<String, TypeRef> substitutions) {
        return new TypeDeclUnit(name, classes.stream().map(cls -> cls.substitute(substitutions)).collect(Collectors.toList()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeDeclUnit that = (TypeDeclUnit) o;
        return name.equals(that.name) && classes.equals(that.classes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, classes);
    }

    @Override
    public String toString() {
        return classes.stream().map(ClassDecl::toString).collect(Collectors.joining("\n\n"));
    }
}
