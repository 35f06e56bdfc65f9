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

package com.vaticle.typematch.common.parameters;

import com.vaticle.typematch.common.exception.TypeMatchException;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Optional;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Settings shared by the solver backends and the matcher. Every setting falls back to a default
 * when it has not been set explicitly.
 */
public class Options {

    public enum Backend {EXTERNAL, EMBEDDED}

    public static final Backend DEFAULT_BACKEND = Backend.EMBEDDED;
    public static final String DEFAULT_SOLVER_BINARY = "sat_runner";
    public static final String DEFAULT_EMBEDDED_SOLVER_ID = "SAT";
    public static final long DEFAULT_SOLVER_TIMEOUT_MILLIS = SECONDS.toMillis(60);
    public static final boolean DEFAULT_INITIAL_POLARITY = true;
    public static final boolean DEFAULT_TRANSITIVITY = true;
    public static final int DEFAULT_MAX_ITERATIONS = 64;
    public static final int DEFAULT_MAX_TYPES = 512;
    public static final String DEFAULT_PROBLEM_NAME = "";

    private Backend backend = null;
    private String solverBinary = null;
    private String embeddedSolverId = null;
    private Path tmpDir = null;
    private Long solverTimeoutMillis = null;
    private Boolean initialPolarity = null;
    private Boolean transitivity = null;
    private Integer maxIterations = null;
    private Integer maxTypes = null;
    private String problemName = null;

    public Backend backend() {
        if (backend != null) return backend;
        else return DEFAULT_BACKEND;
    }

    public Options backend(Backend backend) {
        this.backend = backend;
        return this;
    }

    public String solverBinary() {
        if (solverBinary != null) return solverBinary;
        else return DEFAULT_SOLVER_BINARY;
    }

    public Options solverBinary(String solverBinary) {
        this.solverBinary = solverBinary;
        return this;
    }

    public String embeddedSolverId() {
        if (embeddedSolverId != null) return embeddedSolverId;
        else return DEFAULT_EMBEDDED_SOLVER_ID;
    }

    public Options embeddedSolverId(String embeddedSolverId) {
        this.embeddedSolverId = embeddedSolverId;
        return this;
    }

    /**
     * @return the directory for the solver's problem and solution files, or empty to use the system default
     */
    public Optional<Path> tmpDir() {
        return Optional.ofNullable(tmpDir);
    }

    public Options tmpDir(@Nullable Path tmpDir) {
        this.tmpDir = tmpDir;
        return this;
    }

    public long solverTimeoutMillis() {
        if (solverTimeoutMillis != null) return solverTimeoutMillis;
        else return DEFAULT_SOLVER_TIMEOUT_MILLIS;
    }

    public Options solverTimeoutMillis(long solverTimeoutMillis) {
        if (solverTimeoutMillis <= 0) throw TypeMatchException.of(ILLEGAL_ARGUMENT, solverTimeoutMillis);
        this.solverTimeoutMillis = solverTimeoutMillis;
        return this;
    }

    public boolean initialPolarity() {
        if (initialPolarity != null) return initialPolarity;
        else return DEFAULT_INITIAL_POLARITY;
    }

    public Options initialPolarity(boolean initialPolarity) {
        this.initialPolarity = initialPolarity;
        return this;
    }

    public boolean transitivity() {
        if (transitivity != null) return transitivity;
        else return DEFAULT_TRANSITIVITY;
    }

    public Options transitivity(boolean transitivity) {
        this.transitivity = transitivity;
        return this;
    }

    public int maxIterations() {
        if (maxIterations != null) return maxIterations;
        else return DEFAULT_MAX_ITERATIONS;
    }

    public Options maxIterations(int maxIterations) {
        if (maxIterations <= 0) throw TypeMatchException.of(ILLEGAL_ARGUMENT, maxIterations);
        this.maxIterations = maxIterations;
        return this;
    }

    public int maxTypes() {
        if (maxTypes != null) return maxTypes;
        else return DEFAULT_MAX_TYPES;
    }

    public Options maxTypes(int maxTypes) {
        if (maxTypes <= 0) throw TypeMatchException.of(ILLEGAL_ARGUMENT, maxTypes);
        this.maxTypes = maxTypes;
        return this;
    }

    public String problemName() {
        if (problemName != null) return problemName;
        else return DEFAULT_PROBLEM_NAME;
    }

    public Options problemName(String problemName) {
        this.problemName = problemName;
        return this;
    }

    @Override
    public String toString() {
        return "Options[backend=" + backend() + ", solverBinary=" + solverBinary() +
                ", embeddedSolverId=" + embeddedSolverId() + ", tmpDir=" + tmpDir +
                ", solverTimeoutMillis=" + solverTimeoutMillis() + ", initialPolarity=" + initialPolarity() +
                ", transitivity=" + transitivity() + ", maxIterations=" + maxIterations() +
                ", maxTypes=" + maxTypes() + "]";
    }
}
