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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;

/**
 * A wrapper for the Z3 theorem prover. Bound expressions are translated into
 * the quantifier-free fragment of linear integer arithmetic with booleans; any
 * other construct makes the query unknown. Each query runs in its own Z3
 * context, which is closed afterwards.
 *
 * @author The Calor Project Developers
 */
public class Z3Solver implements SmtSolver {
    private static final Logger logger = LoggerFactory.getLogger(Z3Solver.class);

    /**
     * Result of the availability probe, or <code>null</code> if not yet probed.
     */
    private Boolean available;

    @Override
    public synchronized boolean isAvailable() {
        if (available == null) {
            available = probe();
        }
        return available;
    }

    private static boolean probe() {
        try (Context ctx = new Context()) {
            Solver s = ctx.mkSolver();
            s.add(ctx.mkTrue());
            boolean ok = s.check() == Status.SATISFIABLE;
            logger.debug("Z3 solver available (version {})", com.microsoft.z3.Version.getString());
            return ok;
        } catch (LinkageError | Z3Exception e) {
            logger.debug("Z3 solver unavailable: {}", e.toString());
            return false;
        }
    }

    @Override
    public Result checkSat(List<Expr> assertions, int timeoutMs) {
        checkTimeout(timeoutMs);
        if (!isAvailable()) {
            return Result.UNKNOWN;
        }
        try (Context ctx = new Context()) {
            Translator translator = new Translator(ctx);
            Solver solver = newSolver(ctx, timeoutMs);
            for (Expr assertion : assertions) {
                solver.add(translator.toBool(assertion));
            }
            return check(solver);
        } catch (UnsupportedTermException e) {
            logger.debug("query not expressible in Z3: {}", e.getMessage());
            return Result.UNKNOWN;
        } catch (Z3Exception e) {
            logger.debug("Z3 failure", e);
            return Result.UNKNOWN;
        }
    }

    @Override
    public Result checkGoal(List<Expr> assumptions, Expr goal, int timeoutMs) {
        checkTimeout(timeoutMs);
        if (!isAvailable()) {
            return Result.UNKNOWN;
        }
        try (Context ctx = new Context()) {
            Translator translator = new Translator(ctx);
            Solver solver = newSolver(ctx, timeoutMs);
            for (Expr assumption : assumptions) {
                try {
                    solver.add(translator.toBool(assumption));
                } catch (UnsupportedTermException e) {
                    logger.debug("assumption dropped: {}", e.getMessage());
                }
            }
            solver.add(translator.toBool(goal));
            return check(solver);
        } catch (UnsupportedTermException e) {
            logger.debug("goal not expressible in Z3: {}", e.getMessage());
            return Result.UNKNOWN;
        } catch (Z3Exception e) {
            logger.debug("Z3 failure", e);
            return Result.UNKNOWN;
        }
    }

    private static void checkTimeout(int timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("invalid timeout (" + timeoutMs + "ms)");
        }
    }

    private static Solver newSolver(Context ctx, int timeoutMs) {
        Solver solver = ctx.mkSolver();
        Params params = ctx.mkParams();
        params.add("timeout", timeoutMs);
        solver.setParameters(params);
        return solver;
    }

    private static Result check(Solver solver) {
        Status status = solver.check();
        switch (status) {
        case SATISFIABLE:
            return Result.SAT;
        case UNSATISFIABLE:
            return Result.UNSAT;
        default:
            logger.debug("Z3 returned unknown: {}", solver.getReasonUnknown());
            return Result.UNKNOWN;
        }
    }

    @Override
    public String toString() {
        return "z3";
    }

    private static class UnsupportedTermException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public UnsupportedTermException(String message) {
            super(message);
        }
    }

    /**
     * Translates bound expressions into Z3 terms over a given context.
     */
    private static class Translator extends AbstractExpressionVisitor<com.microsoft.z3.Expr<?>> {
        private final Context ctx;

        public Translator(Context ctx) {
            this.ctx = ctx;
        }

        public com.microsoft.z3.Expr<BoolSort> toBool(Expr expr) {
            return asBool(visitExpression(expr));
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructIntLiteral(Expr.IntLiteral expr) {
            return ctx.mkInt(expr.getValue());
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructFloatLiteral(Expr.FloatLiteral expr) {
            throw new UnsupportedTermException("floating point literal");
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructBoolLiteral(Expr.BoolLiteral expr) {
            return ctx.mkBool(expr.getValue());
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructStringLiteral(Expr.StringLiteral expr) {
            throw new UnsupportedTermException("string literal");
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructVariableAccess(Expr.VariableAccess expr) {
            BoundModule.Variable v = expr.getVariable();
            if (BoundModule.Types.isIntegral(v.getType())) {
                return ctx.mkIntConst(v.getName());
            } else if (BoundModule.Types.isBoolean(v.getType())) {
                return ctx.mkBoolConst(v.getName());
            } else {
                throw new UnsupportedTermException("variable " + v);
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructUnary(Expr.Unary expr, com.microsoft.z3.Expr<?> operand) {
            switch (expr.getOperator()) {
            case NOT:
                return ctx.mkNot(asBool(operand));
            case NEGATE:
                return ctx.mkUnaryMinus(asInt(operand));
            default:
                throw new UnsupportedTermException("operator " + expr.getOperator());
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructBinary(Expr.Binary expr, com.microsoft.z3.Expr<?> lhs,
                com.microsoft.z3.Expr<?> rhs) {
            switch (expr.getOperator()) {
            case ADD:
                return ctx.mkAdd(asInt(lhs), asInt(rhs));
            case SUB:
                return ctx.mkSub(asInt(lhs), asInt(rhs));
            case MUL:
                return ctx.mkMul(asInt(lhs), asInt(rhs));
            case DIV:
                return ctx.mkDiv(asInt(lhs), asInt(rhs));
            case MOD:
                return ctx.mkMod(asInt(lhs), asInt(rhs));
            case LT:
                return ctx.mkLt(asInt(lhs), asInt(rhs));
            case LTEQ:
                return ctx.mkLe(asInt(lhs), asInt(rhs));
            case GT:
                return ctx.mkGt(asInt(lhs), asInt(rhs));
            case GTEQ:
                return ctx.mkGe(asInt(lhs), asInt(rhs));
            case EQ:
                return equal(lhs, rhs);
            case NEQ:
                return ctx.mkNot(equal(lhs, rhs));
            case AND:
                return ctx.mkAnd(asBool(lhs), asBool(rhs));
            case OR:
                return ctx.mkOr(asBool(lhs), asBool(rhs));
            default:
                throw new UnsupportedTermException("operator " + expr.getOperator());
            }
        }

        private BoolExpr equal(com.microsoft.z3.Expr<?> lhs, com.microsoft.z3.Expr<?> rhs) {
            if (lhs.isBool() && rhs.isBool()) {
                return ctx.mkEq(asBool(lhs), asBool(rhs));
            } else {
                return ctx.mkEq(asInt(lhs), asInt(rhs));
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructImplies(Expr.Implies expr, com.microsoft.z3.Expr<?> lhs,
                com.microsoft.z3.Expr<?> rhs) {
            return ctx.mkImplies(asBool(lhs), asBool(rhs));
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructConditional(Expr.Conditional expr,
                com.microsoft.z3.Expr<?> condition, com.microsoft.z3.Expr<?> trueBranch,
                com.microsoft.z3.Expr<?> falseBranch) {
            if (trueBranch.isBool() && falseBranch.isBool()) {
                return ctx.mkITE(asBool(condition), asBool(trueBranch), asBool(falseBranch));
            } else {
                return ctx.mkITE(asBool(condition), asInt(trueBranch), asInt(falseBranch));
            }
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructUniversalQuantifier(Expr.UniversalQuantifier expr,
                com.microsoft.z3.Expr<?> body) {
            throw new UnsupportedTermException("quantifier");
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructExistentialQuantifier(Expr.ExistentialQuantifier expr,
                com.microsoft.z3.Expr<?> body) {
            throw new UnsupportedTermException("quantifier");
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructInvoke(Expr.Invoke expr, List<com.microsoft.z3.Expr<?>> arguments) {
            throw new UnsupportedTermException("call to " + expr.getTarget());
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructArrayAccess(Expr.ArrayAccess expr,
                com.microsoft.z3.Expr<?> source, com.microsoft.z3.Expr<?> index) {
            throw new UnsupportedTermException("array access");
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructFieldAccess(Expr.FieldAccess expr,
                com.microsoft.z3.Expr<?> source) {
            throw new UnsupportedTermException("field access");
        }

        @Override
        protected com.microsoft.z3.Expr<?> constructCollectionLiteral(Expr.CollectionLiteral expr,
                List<com.microsoft.z3.Expr<?>> elements) {
            throw new UnsupportedTermException("collection literal");
        }

        @SuppressWarnings("unchecked")
        private static com.microsoft.z3.Expr<IntSort> asInt(com.microsoft.z3.Expr<?> e) {
            if (!e.isInt()) {
                throw new UnsupportedTermException("expected integer term: " + e);
            }
            return (com.microsoft.z3.Expr<IntSort>) e;
        }

        @SuppressWarnings("unchecked")
        private static com.microsoft.z3.Expr<BoolSort> asBool(com.microsoft.z3.Expr<?> e) {
            if (!e.isBool()) {
                throw new UnsupportedTermException("expected boolean term: " + e);
            }
            return (com.microsoft.z3.Expr<BoolSort>) e;
        }
    }
}
