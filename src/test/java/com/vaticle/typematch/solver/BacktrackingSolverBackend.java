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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A complete pseudo-boolean search with bound propagation, for tests that should not depend on a
 * native or external solver. Hinted variables are tried with their hint first, others with false
 * first. With an objective, every solution is visited and the first one with the lowest value kept.
 */
public class BacktrackingSolverBackend implements SolverBackend {

    private int calls = 0;
    private LinearBooleanProblem lastProblem = null;

    public int calls() {
        return calls;
    }

    public LinearBooleanProblem lastProblem() {
        return lastProblem;
    }

    @Override
    public Optional<List<Integer>> solve(LinearBooleanProblem problem) {
        calls++;
        lastProblem = problem;
        Search search = new Search(problem);
        search.run(new Boolean[problem.numVariables()]);
        if (search.best == null) return Optional.empty();
        List<Integer> literals = new ArrayList<>();
        for (int id = 1; id <= search.best.length; id++) literals.add(search.best[id - 1] ? id : -id);
        return Optional.of(literals);
    }

    private static class Search {

        private final LinearBooleanProblem problem;
        private boolean[] best;
        private int bestValue;

        private Search(LinearBooleanProblem problem) {
            this.problem = problem;
            this.best = null;
            this.bestValue = Integer.MAX_VALUE;
        }

        /**
         * @return true when the search can stop
         */
        private boolean run(Boolean[] values) {
            if (!propagate(values)) return false;
            int next = -1;
            for (int i = 0; i < values.length; i++) {
                if (values[i] == null) {
                    next = i;
                    break;
                }
            }
            if (next < 0) return record(values);

            boolean first = problem.hints().getOrDefault(next + 1, false);
            for (boolean value : new boolean[]{first, !first}) {
                Boolean[] branch = values.clone();
                branch[next] = value;
                if (run(branch)) return true;
            }
            return false;
        }

        private boolean record(Boolean[] values) {
            boolean[] assignment = new boolean[values.length];
            for (int i = 0; i < values.length; i++) assignment[i] = values[i];
            assert problem.isSatisfiedBy(assignment);
            int value = problem.objectiveValue(assignment);
            if (best == null || value < bestValue) {
                best = assignment;
                bestValue = value;
            }
            return !problem.hasObjective();
        }

        private boolean propagate(Boolean[] values) {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (Constraint constraint : problem.constraints()) {
                    int fixed = 0;
                    int open = 0;
                    List<Integer> literals = constraint.literals();
                    List<Integer> coefficients = constraint.coefficients();
                    for (int i = 0; i < literals.size(); i++) {
                        Boolean value = values[Math.abs(literals.get(i)) - 1];
                        if (value == null) open += coefficients.get(i);
                        else if (value == literals.get(i) > 0) fixed += coefficients.get(i);
                    }
                    Integer lowerBound = constraint.lowerBound().orElse(null);
                    Integer upperBound = constraint.upperBound().orElse(null);
                    if (lowerBound != null && fixed + open < lowerBound) return false;
                    if (upperBound != null && fixed > upperBound) return false;

                    for (int i = 0; i < literals.size(); i++) {
                        int literal = literals.get(i);
                        int coefficient = coefficients.get(i);
                        int index = Math.abs(literal) - 1;
                        if (values[index] != null) continue;
                        if (lowerBound != null && fixed + open - coefficient < lowerBound) {
                            values[index] = literal > 0;
                            changed = true;
                            break;
                        } else if (upperBound != null && fixed + coefficient > upperBound) {
                            values[index] = literal < 0;
                            changed = true;
                            break;
                        }
                    }
                }
            }
            return true;
        }
    }
}
