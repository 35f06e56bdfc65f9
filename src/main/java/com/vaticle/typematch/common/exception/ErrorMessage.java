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

package com.vaticle.typematch.common.exception;

import java.util.HashMap;
import java.util.Map;

public abstract class ErrorMessage {

    private static final Map<String, Map<Integer, ErrorMessage>> errors = new HashMap<>();
    // codes are padded to a fixed width, whichever groups have been loaded
    static final int CODE_DIGITS = 2;

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;
    private String code = null;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;

        assert errors.get(codePrefix) == null || errors.get(codePrefix).get(codeNumber) == null;
        errors.computeIfAbsent(codePrefix, s -> new HashMap<>()).put(codeNumber, this);
    }

    public String code() {
        if (code != null) return code;

        StringBuilder zeros = new StringBuilder();
        for (int digits = (int) Math.ceil(Math.log10(codeNumber + 1)); digits < CODE_DIGITS; digits++) {
            zeros.append("0");
        }
        code = codePrefix + zeros + codeNumber;
        return code;
    }

    public String message(Object... parameters) {
        return String.format(toString(), parameters);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_ARGUMENT =
                new Internal(2, "Illegal argument provided: '%s'.");
        public static final Internal ILLEGAL_CAST =
                new Internal(3, "Illegal casting operation from '%s' to '%s'.");
        public static final Internal UNEXPECTED_OPTIMISER_VALUE =
                new Internal(4, "Unexpected optimiser value.");
        public static final Internal UNEXPECTED_INTERRUPTION =
                new Internal(5, "Unexpected thread interruption!");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Solver extends ErrorMessage {
        public static final Solver BOOLEAN_CONSTANTS_EQUATED =
                new Solver(1, "Boolean constants cannot be constrained equal to each other: '%s' <==> '%s'.");
        public static final Solver COMPOUND_VARIABLE =
                new Solver(2, "The formula '%s' is compound and cannot be used as a plain variable.");
        public static final Solver INVALID_CONSTRAINT =
                new Solver(3, "The constraint '%s' is invalid: %s.");
        public static final Solver SOLVER_PROCESS_FAILED =
                new Solver(4, "The solver process '%s' failed with exit code '%s'.");
        public static final Solver SOLVER_PROCESS_NOT_STARTED =
                new Solver(5, "The solver process '%s' could not be started.");
        public static final Solver SOLVER_TIMEOUT =
                new Solver(6, "The solver process did not finish within '%s' milliseconds.");
        public static final Solver SOLVER_IO_FAILURE =
                new Solver(7, "Failed to exchange the problem with the solver through '%s'.");
        public static final Solver MALFORMED_SOLUTION =
                new Solver(8, "The solution could not be parsed: '%s'.");
        public static final Solver EMPTY_SOLUTION =
                new Solver(9, "The solver returned no assignment for a problem with '%s' variables.");
        public static final Solver EMBEDDED_SOLVER_UNAVAILABLE =
                new Solver(10, "The embedded solver '%s' is not available.");
        public static final Solver EMBEDDED_SOLVER_FAILED =
                new Solver(11, "The embedded solver finished with status '%s'.");

        private static final String codePrefix = "SAT";
        private static final String messagePrefix = "Invalid Solver Operation";

        Solver(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Matcher extends ErrorMessage {
        public static final Matcher UNSUPPORTED_TYPE_REFERENCE =
                new Matcher(1, "The type reference '%s' cannot be converted into a matching type.");
        public static final Matcher DUPLICATE_CLASS_NAME =
                new Matcher(2, "The class names '%s' are declared more than once.");
        public static final Matcher UNRESOLVED_CLASSES =
                new Matcher(3, "The classes '%s' were not resolved although the problem was satisfiable.");
        public static final Matcher AMBIGUOUS_RESOLUTION =
                new Matcher(4, "'%s' is assigned more than once to a complete type: '%s', '%s'. Keeping '%s'.");
        public static final Matcher FIXPOINT_EXHAUSTED =
                new Matcher(5, "Gave up discovering equalities after '%s' iterations and '%s' types.");
        public static final Matcher EMPTY_UNION =
                new Matcher(6, "A union type requires at least one class type.");

        private static final String codePrefix = "MAT";
        private static final String messagePrefix = "Invalid Type Matching";

        Matcher(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Config extends ErrorMessage {
        public static final Config CONFIG_FILE_NOT_FOUND =
                new Config(1, "Could not find/read the configuration file '%s'.");
        public static final Config CONFIG_KEY_MISSING =
                new Config(2, "Required configuration '%s' is missing.");
        public static final Config CONFIG_VALUE_UNEXPECTED =
                new Config(3, "Configuration '%s' received an unexpected value '%s'.");

        private static final String codePrefix = "CFG";
        private static final String messagePrefix = "Invalid Configuration";

        Config(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
