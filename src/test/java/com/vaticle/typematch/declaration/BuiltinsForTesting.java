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

/**
 * A handful of builtin classes, small enough for an exhaustive solver.
 */
public class BuiltinsForTesting {

    public static final ClassDecl NONE_TYPE = ClassDecl.builder("NoneType").build();

    public static final ClassDecl INT = ClassDecl.builder("int")
            .method("__add__", binary("int", "int", "int"))
            .build();

    public static final ClassDecl FLOAT = ClassDecl.builder("float")
            .method("__add__", binary("float", "int", "float"), binary("float", "float", "float"))
            .build();

    public static final ClassDecl STR = ClassDecl.builder("str")
            .method("__add__", binary("str", "str", "str"))
            .build();

    public static final ClassDecl BYTEARRAY = ClassDecl.builder("bytearray")
            .method("__add__", binary("bytearray", "bytearray", "bytearray"))
            .build();

    public static final ClassDecl LIST = ClassDecl.builder("list")
            .template("T")
            .method("append", binary("list", "T", "NoneType"))
            .method("remove", binary("list", "T", "NoneType"))
            .build();

    private BuiltinsForTesting() {}

    public static Signature binary(String self, String argument, String returns) {
        return Signature.builder().param("self", self).param("v", argument).returns(returns).build();
    }

    public static TypeDeclUnit builtins(ClassDecl... classes) {
        return TypeDeclUnit.of("builtins", classes);
    }
}
