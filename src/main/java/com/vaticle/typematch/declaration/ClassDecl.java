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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableList;

/**
 * A declared class: its name, template parameters and methods.
 */
public class ClassDecl {

    private final String name;
    private final List<String> templates;
    private final List<FunctionDecl> methods;
    private final int hash;

    public ClassDecl(String name, List<String> templates, List<FunctionDecl> methods) {
        this.name = Objects.requireNonNull(name);
        this.templates = unmodifiableList(new ArrayList<>(templates));
        this.methods = unmodifiableList(new ArrayList<>(methods));
        this.hash = Objects.hash(name, this.templates, this.methods);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> templates() {
        return templates;
    }

    public List<FunctionDecl> methods() {
        return methods;
    }

    public Optional<FunctionDecl> method(String name) {
        return methods.stream().filter(method -> method.name().equals(name)).findFirst();
    }

    ClassDecl substitute(Map<String, TypeRef> substitutions) {
        return new ClassDecl(
                name, templates, methods.stream().map(method -> method.substitute(substitutions)).collect(Collectors.toList())
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClassDecl that = (ClassDecl) o;
        return hash == that.hash && name.equals(that.name) &&
                templates.equals(that.templates) && methods.equals(that.methods);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        String header = "class " + name + (templates.isEmpty() ? "" : "<" + String.join(", ", templates) + ">") + ":";
        if (methods.isEmpty()) return header + "\n    pass";
        return header + methods.stream().map(method -> "\n    " + method.toString().replace("\n", "\n    "))
                .collect(Collectors.joining());
    }

    public static class Builder {

        private final String name;
        private final List<String> templates;
        private final Map<String, FunctionDecl> methods;

        private Builder(String name) {
            this.name = name;
            this.templates = new ArrayList<>();
            this.methods = new LinkedHashMap<>();
        }

        public Builder template(String... names) {
            templates.addAll(Arrays.asList(names));
            return this;
        }

        /**
         * Declares a method. Declaring the same name again adds overloads to it.
         */
        public Builder method(String methodName, Signature... signatures) {
            for (Signature signature : signatures) {
                methods.compute(methodName, (key, existing) -> existing == null
                        ? new FunctionDecl(methodName, List.of(signature))
                        : existing.withSignature(signature));
            }
            return this;
        }

        public ClassDecl build() {
            return new ClassDecl(name, templates, new ArrayList<>(methods.values()));
        }
    }
}
