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

import com.vaticle.typematch.common.exception.TypeMatchException;
import com.vaticle.typematch.common.parameters.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.UNEXPECTED_INTERRUPTION;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.SOLVER_IO_FAILURE;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.SOLVER_PROCESS_FAILED;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.SOLVER_PROCESS_NOT_STARTED;
import static com.vaticle.typematch.common.exception.ErrorMessage.Solver.SOLVER_TIMEOUT;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs a solver executable such as OR-Tools' {@code sat_runner}. The problem is written as a binary
 * {@code LinearBooleanProblem} to a temporary file and the solver writes the same message, with its
 * assignment filled in, to a second temporary file. Both files are removed afterwards.
 */
public class ExternalSolverBackend implements SolverBackend {

    private static final Logger LOG = LoggerFactory.getLogger(ExternalSolverBackend.class);

    private final String binary;
    private final Path tmpDir;
    private final long timeoutMillis;
    private final boolean initialPolarity;

    public ExternalSolverBackend(Options options) {
        this.binary = options.solverBinary();
        this.tmpDir = options.tmpDir().orElse(null);
        this.timeoutMillis = options.solverTimeoutMillis();
        this.initialPolarity = options.initialPolarity();
    }

    @Override
    public Optional<List<Integer>> solve(LinearBooleanProblem problem) {
        Path problemFile = null;
        Path solutionFile = null;
        try {
            LOG.info("Storing SAT problem");
            problemFile = createTempFile("problem_", ".pb");
            ProblemProtos.write(problem, problemFile);
            solutionFile = createTempFile("solution_", ".pb");
            LOG.info("Solving: {}", problemFile);
            if (!run(command(problemFile, solutionFile))) return Optional.empty();
            return ProblemProtos.readSolution(solutionFile, problem.numVariables());
        } catch (IOException e) {
            LOG.error(SOLVER_IO_FAILURE.message(problemFile), e);
            return Optional.empty();
        } finally {
            delete(problemFile);
            delete(solutionFile);
        }
    }

    List<String> command(Path problemFile, Path solutionFile) {
        List<String> command = new ArrayList<>();
        command.add(binary);
        if (LOG.isInfoEnabled()) command.add("-logtostderr");
        if (initialPolarity) {
            command.add("-params");
            command.add("initial_polarity:0");
        }
        command.add("-input=" + problemFile);
        command.add("-output=" + solutionFile);
        command.add("-use_lp_proto=false");
        return command;
    }

    private boolean run(List<String> command) {
        LOG.debug("Solver command: {}", command);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            LOG.error(SOLVER_PROCESS_NOT_STARTED.message(binary), e);
            return false;
        }

        try {
            if (!process.waitFor(timeoutMillis, MILLISECONDS)) {
                process.destroyForcibly();
                LOG.error(SOLVER_TIMEOUT.message(timeoutMillis));
                return false;
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw TypeMatchException.of(UNEXPECTED_INTERRUPTION);
        }

        if (process.exitValue() != 0) {
            LOG.error(SOLVER_PROCESS_FAILED.message(binary, process.exitValue()));
            return false;
        }
        return true;
    }

    private Path createTempFile(String prefix, String suffix) throws IOException {
        if (tmpDir != null) return Files.createTempFile(tmpDir, prefix, suffix);
        else return Files.createTempFile(prefix, suffix);
    }

    private static void delete(@Nullable Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary file '{}'", file, e);
        }
    }
}
