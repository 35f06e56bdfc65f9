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

import java.util.List;
import java.util.Optional;

import static com.vaticle.typematch.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

/**
 * Solves a {@link LinearBooleanProblem}. Implementations never throw for an unsatisfiable problem
 * or a failing solver: both are reported as an empty result.
 */
public interface SolverBackend {

    /**
     * @return one literal per variable, positive if the variable is true, or empty if no assignment was found
     */
    Optional<List<Integer>> solve(LinearBooleanProblem problem);

    static SolverBackend of(Options options) {
        switch (options.backend()) {
            case EXTERNAL:
                return new ExternalSolverBackend(options);
            case EMBEDDED:
                return new EmbeddedSolverBackend(options);
            default:
                throw TypeMatchException.of(ILLEGAL_STATE);
        }
    }
}
