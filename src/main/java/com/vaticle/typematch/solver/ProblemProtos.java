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

package com.vaticle.typematch.solver;

import com.google.ortools.sat.BooleanAssignment;
import com.google.ortools.sat.LinearBooleanConstraint;
import com.google.ortools.sat.LinearObjective;
import com.google.protobuf.InvalidProtocolBufferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.EMPTY_SOLUTION;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.MALFORMED_SOLUTION;

/**
 * Converts problems to the OR-Tools {@code LinearBooleanProblem} protocol buffer read by {@code sat_runner},
 * and reads back the assignment it writes.
 */
public class ProblemProtos {

    private static final Logger LOG = LoggerFactory.getLogger(ProblemProtos.class);

    private ProblemProtos() {}

    public static com.google.ortools.sat.LinearBooleanProblem toProto(LinearBooleanProblem problem) {
        com.google.ortools.sat.LinearBooleanProblem.Builder proto = com.google.ortools.sat.LinearBooleanProblem.newBuilder()
                .setName(problem.name())
                .setNumVariables(problem.numVariables())
                .addAllVarNames(problem.varNames());
        for (Constraint constraint : problem.constraints()) {
            LinearBooleanConstraint.Builder row = LinearBooleanConstraint.newBuilder()
                    .addAllLiterals(constraint.literals())
                    .setName(constraint.description());
            for (int coefficient : constraint.coefficients()) row.addCoefficients(coefficient);
            constraint.lowerBound().ifPresent(row::setLowerBound);
            constraint.upperBound().ifPresent(row::setUpperBound);
            proto.addConstraints(row);
        }
        if (problem.hasObjective()) {
            LinearObjective.Builder objective = LinearObjective.newBuilder()
                    .addAllLiterals(problem.objectiveLiterals());
            for (int coefficient : problem.objectiveCoefficients()) objective.addCoefficients(coefficient);
            proto.setObjective(objective);
        }
        return proto.build();
    }

    public static void write(LinearBooleanProblem problem, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            toProto(problem).writeTo(out);
        }
    }

    /**
     * Reads the assignment the solver stored in the {@code assignment} field of its output problem.
     *
     * @return the literals, or empty if the output cannot be parsed or carries no assignment
     */
    public static Optional<List<Integer>> readSolution(Path file, int numVariables) throws IOException {
        com.google.ortools.sat.LinearBooleanProblem solution;
        try {
            solution = com.google.ortools.sat.LinearBooleanProblem.parseFrom(Files.readAllBytes(file));
        } catch (InvalidProtocolBufferException e) {
            LOG.error(MALFORMED_SOLUTION.message(file), e);
            return Optional.empty();
        }
        if (LOG.isDebugEnabled()) LOG.debug("SAT solution:\n{}SAT solution (end)", solution);

        BooleanAssignment assignment = solution.getAssignment();
        if (assignment.getLiteralsCount() == 0 && numVariables > 0) {
            LOG.error(EMPTY_SOLUTION.message(numVariables));
            return Optional.empty();
        }
        return Optional.of(List.copyOf(assignment.getLiteralsList()));
    }
}
