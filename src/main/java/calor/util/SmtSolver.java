// Copyright 2026 The Calor Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package calor.util;

import java.util.List;

import calor.core.BoundModule.Expr;

/**
 * A narrow interface onto an external SMT solver. Assertions are boolean bound
 * expressions over integer and boolean variables. Implementations never throw
 * for a query they cannot answer, and instead return {@link Result#UNKNOWN}.
 *
 * @author The Calor Project Developers
 *
 */
public interface SmtSolver {

    public enum Result {
        SAT, UNSAT, UNKNOWN
    }

    /**
     * Determine whether this solver can actually answer queries. This is
     * expected to be cheap after the first call.
     *
     * @return
     */
    boolean isAvailable();

    /**
     * Check whether the conjunction of a list of assertions is satisfiable.
     *
     * @param assertions boolean expressions to be asserted together.
     * @param timeoutMs  time limit for this query (in milliseconds).
     * @return
     */
    Result checkSat(List<Expr> assertions, int timeoutMs);

    /**
     * Check whether a goal is satisfiable together with those assumptions this
     * solver can express. Assumptions outside the solver's fragment are dropped,
     * which only weakens the query: {@link Result#UNSAT} remains conclusive,
     * whilst {@link Result#SAT} may be spurious. A goal which cannot be expressed
     * gives {@link Result#UNKNOWN}. By default every assumption is required.
     *
     * @param assumptions facts known to hold.
     * @param goal        boolean expression to check against them.
     * @param timeoutMs   time limit for this query (in milliseconds).
     * @return
     */
    default Result checkGoal(List<Expr> assumptions, Expr goal, int timeoutMs) {
        return checkSat(Util.append(assumptions, goal), timeoutMs);
    }

    /**
     * A solver which is never available, and hence for which every query is
     * unknown.
     */
    public static final SmtSolver NONE = new SmtSolver() {
        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public Result checkSat(List<Expr> assertions, int timeoutMs) {
            return Result.UNKNOWN;
        }

        @Override
        public String toString() {
            return "none";
        }
    };
}
