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
import com.vaticle.typematch.common.parameters.Options;
import com.vaticle.typematch.declaration.ClassDecl;
import com.vaticle.typematch.declaration.FunctionDecl;
import com.vaticle.typematch.declaration.Signature;
import com.vaticle.typematch.declaration.TypeRef;
import com.vaticle.typematch.solver.Conjunction;
import com.vaticle.typematch.solver.Disjunction;
import com.vaticle.typematch.solver.Formula;
import com.vaticle.typematch.solver.SATProblem;
import com.vaticle.typematch.solver.SolverBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.vaticle.typematch.common.exception.ErrorMessage.Matcher.AMBIGUOUS_RESOLUTION;
import static com.vaticle.typematch.common.exception.ErrorMessage.Matcher.FIXPOINT_EXHAUSTED;
import static com.vaticle.typematch.common.exception.ErrorMessage.Matcher.UNSUPPORTED_TYPE_REFERENCE;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.stream.Collectors.toList;

/**
 * Encodes which incomplete classes can be equal to which complete classes as a SAT problem, and
 * decodes the solution into a resolution of every incomplete class.
 *
 * Two types can only be equal if their members match: for every member both declare, each
 * signature of the complete side must be matched by some signature of the other side, which in
 * turn requires the types in those signatures to be equal. Those type equalities become new
 * variables, so the encoding is repeated until no new pair of types shows up.
 */
public class SATEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(SATEncoder.class);

    private final Options options;
    private final SATProblem problem;
    private final Set<Type> types;
    private final Set<Equality> variables;
    private boolean exhausted;

    public SATEncoder(Options options) {
        this(options, new SATProblem(options));
    }

    public SATEncoder(Options options, SolverBackend backend) {
        this(options, new SATProblem(options.problemName(), backend));
    }

    SATEncoder(Options options, SATProblem problem) {
        this.options = options;
        this.problem = problem;
        this.types = new LinkedHashSet<>();
        this.variables = new LinkedHashSet<>();
        this.exhausted = false;
    }

    /**
     * Generates the constraints for matching the incomplete classes against the complete ones.
     *
     * @param completeClasses classes of which everything is known
     * @param incompleteClasses classes to be matched against the complete classes
     */
    public void generate(Collection<ClassDecl> completeClasses, Collection<ClassDecl> incompleteClasses) {
        Set<Type> classTypes = new LinkedHashSet<>();
        completeClasses.forEach(cls -> classTypes.add(new ClassType(cls, true)));
        incompleteClasses.forEach(cls -> classTypes.add(new ClassType(cls, false)));
        types.addAll(classTypes);
        Set<Equality> added = pairs(classTypes);
        variables.addAll(added);

        int iterations = 0;
        while (!added.isEmpty()) {
            if (iterations >= options.maxIterations() || types.size() > options.maxTypes()) {
                LOG.warn(FIXPOINT_EXHAUSTED.message(iterations, types.size()));
                exhausted = true;
                return;
            }
            iterations++;
            generateConstraints(added);
            added = pairs(types);
            added.removeAll(variables);
            LOG.debug("New variables: {}", added);
            variables.addAll(added);
        }

        LOG.info("# Types: {}", types.size());
        LOG.info("# Vars: {}", variables.size());
        LOG.debug("Types: {}", types);
        LOG.debug("Vars: {}", variables);

        if (options.transitivity()) generateTransitivity();
        generateUniqueness();
    }

    private static Set<Equality> pairs(Collection<Type> types) {
        List<Type> list = new ArrayList<>(types);
        Set<Equality> pairs = new LinkedHashSet<>();
        for (int i = 0; i < list.size(); i++) {
            for (int j = i + 1; j < list.size(); j++) {
                pairs.add(Equality.of(list.get(i), list.get(j)));
            }
        }
        return pairs;
    }

    private void generateConstraints(Set<Equality> equalities) {
        for (Equality equality : equalities) {
            Type left = equality.left();
            Type right = equality.right();
            Formula variable = Formula.variable(equality);
            if (!left.isNominallyCompatibleWith(right)) {
                problem.equivalent(variable, Formula.FALSE);
                continue;
            }

            List<Formula> requirements = new ArrayList<>();
            Set<String> names = new LinkedHashSet<>(left.structure().keySet());
            names.addAll(right.structure().keySet());
            for (String name : names) {
                FunctionDecl leftFunction = left.structure().get(name);
                FunctionDecl rightFunction = right.structure().get(name);
                if (leftFunction != null && rightFunction != null) {
                    // type parameters are named after the type they are bound to, which is the other side
                    if (right.isComplete()) {
                        requirements.add(functionsEqualOneWay(leftFunction, rightFunction, right, left));
                    }
                    if (left.isComplete()) {
                        requirements.add(functionsEqualOneWay(rightFunction, leftFunction, left, right));
                    }
                } else if ((leftFunction == null && left.isComplete()) || (rightFunction == null && right.isComplete())) {
                    requirements.add(Formula.FALSE);
                    break;
                }
            }

            Formula requirement = Conjunction.of(requirements);
            if (left.isComplete() && right.isComplete()) {
                problem.equivalent(variable, requirement);
            } else {
                problem.implies(variable, requirement);
                problem.hint(variable, true);
            }
        }
    }

    /**
     * Every signature of {@code left} must be matched by at least one signature of {@code right}.
     */
    private Formula functionsEqualOneWay(FunctionDecl left, FunctionDecl right, Type leftPath, Type rightPath) {
        List<Formula> conjuncts = new ArrayList<>();
        for (Signature leftSignature : left.signatures()) {
            List<Formula> disjuncts = new ArrayList<>();
            for (Signature rightSignature : right.signatures()) {
                disjuncts.add(signaturesEqual(leftSignature, rightSignature, leftPath, rightPath));
            }
            conjuncts.add(Disjunction.of(disjuncts));
        }
        return Conjunction.of(conjuncts);
    }

    private Formula signaturesEqual(Signature a, Signature b, Type aPath, Type bPath) {
        if (a.params().size() != b.params().size()) return Formula.FALSE;
        List<Formula> equalities = new ArrayList<>();
        for (int i = 0; i < a.params().size(); i++) {
            TypeRef aType = a.params().get(i).type();
            TypeRef bType = b.params().get(i).type();
            if (!aType.equals(bType)) equalities.add(equality(toType(aType, aPath), toType(bType, bPath)));
        }
        if (!a.returnType().equals(b.returnType())) {
            equalities.add(equality(toType(a.returnType(), aPath), toType(b.returnType(), bPath)));
        }
        return Conjunction.of(equalities);
    }

    private Formula equality(Type a, Type b) {
        types.add(a);
        types.add(b);
        if (a.equals(b)) return Formula.TRUE;
        else return Formula.variable(Equality.of(a, b));
    }

    /**
     * Converts a type reference found in a signature. A name that is no known class is a template
     * parameter, which becomes an incomplete class named after the type it is bound to.
     */
    private Type toType(TypeRef ref, Type path) {
        if (ref.isNamed()) {
            Optional<ClassType> known = lookup(ref.asNamed().name());
            if (known.isPresent()) return known.get();
            ClassDecl parameter = ClassDecl.builder(path + "." + ref.asNamed().name()).build();
            return new ClassType(parameter, false);
        } else if (ref.isGeneric()) {
            return toType(ref.asGeneric().base(), path);
        } else if (ref.isContainer()) {
            return toType(ref.asContainer().base(), path);
        } else if (ref.isUnion()) {
            Set<ClassType> subtypes = new LinkedHashSet<>();
            for (TypeRef member : ref.asUnion().refs()) {
                Type type = toType(member, path);
                if (type.isUnionType()) subtypes.addAll(type.asUnionType().subtypes());
                else subtypes.add(type.asClassType());
            }
            return new UnionType(subtypes);
        } else {
            throw TypeMatchException.of(UNSUPPORTED_TYPE_REFERENCE, ref);
        }
    }

    private Optional<ClassType> lookup(String name) {
        return types.stream().filter(Type::isClassType).map(Type::asClassType)
                .filter(type -> type.classDecl().name().equals(name)).findFirst();
    }

    /**
     * Two types equal to the same incomplete type are equal to each other.
     */
    private void generateTransitivity() {
        List<Type> all = new ArrayList<>(types);
        List<Type> incompletes = all.stream().filter(type -> !type.isComplete()).collect(toList());
        for (Type a : all) {
            for (Type b : incompletes) {
                if (a.equals(b)) continue;
                for (Type c : all) {
                    if (a.equals(c) || b.equals(c)) continue;
                    Formula ab = Formula.variable(Equality.of(a, b));
                    Formula bc = Formula.variable(Equality.of(b, c));
                    Formula ac = Formula.variable(Equality.of(a, c));
                    assert variables.contains(Equality.of(a, b)) && variables.contains(Equality.of(b, c));
                    problem.implies(Conjunction.of(ab, bc), ac);
                }
            }
        }
    }

    /**
     * Every incomplete class must be equal to at least one complete type.
     */
    private void generateUniqueness() {
        for (Type type : types) {
            if (!type.isClassType() || type.isComplete()) continue;
            List<Formula> candidates = variables.stream()
                    .filter(equality -> equality.contains(type) && equality.other(type).isComplete())
                    .map(Formula::variable).collect(toList());
            problem.betweenNM(candidates, 1, candidates.size(), type.toString());
        }
    }

    /**
     * Solves the generated constraints.
     *
     * @return each incomplete class that was matched, to the type it was matched with. Empty if the
     * problem is unsatisfiable, the solver failed, or the encoding gave up.
     */
    public Map<ClassDecl, TypeRef> solve() {
        if (exhausted) {
            LOG.warn("Not solving: the encoding was abandoned after reaching its limits");
            return Map.of();
        }
        if (!problem.solve()) return Map.of();

        Map<ClassDecl, TypeRef> results = new LinkedHashMap<>();
        problem.results().forEach((key, value) -> {
            if (value) LOG.info("{} = {}", key, value);
            if (!value || !(key instanceof Equality)) return;
            Equality equality = (Equality) key;
            Type incomplete = equality.left().isComplete() ? equality.right() : equality.left();
            Type resolved = equality.other(incomplete);
            if (incomplete.isComplete() || !incomplete.isClassType() || !resolved.isComplete()) return;

            ClassDecl cls = incomplete.asClassType().classDecl();
            TypeRef existing = results.get(cls);
            if (existing == null) {
                results.put(cls, resolved.toTypeRef());
            } else {
                LOG.warn(AMBIGUOUS_RESOLUTION.message(incomplete, existing, resolved.toTypeRef(), existing));
            }
        });
        return unmodifiableMap(results);
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public SATProblem problem() {
        return problem;
    }

    public Set<Type> types() {
        return unmodifiableSet(types);
    }

    public Set<Equality> variables() {
        return unmodifiableSet(variables);
    }
}
