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

package com.vaticle.typematch.inference;

import com.vaticle.typematch.common.exception.TypeMatchException;
import com.vaticle.typematch.common.parameters.Options;
import com.vaticle.typematch.declaration.ClassDecl;
import com.vaticle.typematch.declaration.TypeDeclUnit;
import com.vaticle.typematch.declaration.TypeRef;
import com.vaticle.typematch.matcher.SATEncoder;
import com.vaticle.typematch.solver.SolverBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.vaticle.typematch.common.exception.ErrorMessage.Matcher.DUPLICATE_CLASS_NAME;
import static com.vaticle.typematch.common.exception.ErrorMessage.Matcher.UNRESOLVED_CLASSES;
import static java.util.Collections.unmodifiableMap;

/**
 * Resolves the classes of a parsed declaration unit to builtin classes.
 */
public class TypeInferencer {

    private static final Logger LOG = LoggerFactory.getLogger(TypeInferencer.class);

    private final TypeDeclUnit builtins;
    private final Options options;
    private final SolverBackend backend;

    public TypeInferencer(TypeDeclUnit builtins, Options options) {
        this(builtins, options, SolverBackend.of(options));
    }

    public TypeInferencer(TypeDeclUnit builtins, Options options, SolverBackend backend) {
        this.builtins = builtins;
        this.options = options;
        this.backend = backend;
    }

    /**
     * @return the name of every resolved class to the type it resolves to, or an empty map if the
     * classes could not be matched
     */
    public Map<String, TypeRef> solve(TypeDeclUnit parsed) {
        validateUniqueNames(parsed.classes());
        LOG.info("Matching {} classes of '{}' against {} builtin classes",
                 parsed.classes().size(), parsed.name(), builtins.classes().size());

        SATEncoder encoder = new SATEncoder(options, backend);
        encoder.generate(builtins.classes(), parsed.classes());
        Map<ClassDecl, TypeRef> resolved = encoder.solve();

        Map<String, TypeRef> byName = new LinkedHashMap<>();
        resolved.forEach((cls, type) -> byName.put(cls.name(), type));
        if (!byName.isEmpty()) {
            Set<String> unresolved = new TreeSet<>();
            parsed.classes().forEach(cls -> {
                if (!byName.containsKey(cls.name())) unresolved.add(cls.name());
            });
            if (!unresolved.isEmpty()) throw TypeMatchException.of(UNRESOLVED_CLASSES, unresolved);
        }
        return unmodifiableMap(byName);
    }

    /**
     * Solves, then replaces every reference to a resolved class in the unit by its resolution.
     */
    public TypeDeclUnit solveAndSubstitute(TypeDeclUnit parsed) {
        return parsed.substitute(solve(parsed));
    }

    private static void validateUniqueNames(List<ClassDecl> classes) {
        Set<String> names = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (ClassDecl cls : classes) {
            if (!names.add(cls.name())) duplicates.add(cls.name());
        }
        if (!duplicates.isEmpty()) throw TypeMatchException.of(DUPLICATE_CLASS_NAME, duplicates);
    }
}
