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
package calor.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Types;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.io.BoundExpressionPrinter;
import calor.util.AbstractExpressionFold;
import calor.util.SmtSolver;

/**
 * Finds 32-bit integer arithmetic which may wrap around. Operations on two
 * literals are evaluated exactly and reported when the result does not fit.
 * Other additions, subtractions, multiplications and negations are put to the
 * SMT solver (if enabled), which is asked whether the exact result can leave
 * the range of <code>i32</code> given the conditions known to hold and the
 * range of each operand variable. Nothing is reported for non-literal
 * operations when the solver is unavailable.
 *
 * @author The Calor Project Developers
 *
 */
public class OverflowChecker extends PathSensitiveChecker {
	private static final Logger logger = LoggerFactory.getLogger(OverflowChecker.class);

	public OverflowChecker() {
		this(SmtSolver.NONE, new BugPatternOptions().setUseZ3Verification(false));
	}

	public OverflowChecker(SmtSolver solver, BugPatternOptions options) {
		super(solver, options);
	}

	@Override
	public String getName() {
		return "OVERFLOW";
	}

	@Override
	protected void checkBinary(Expr.Binary expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
		String operation = describe(expr.getOperator());
		if (operation == null || !isInt32(expr.getType())) {
			return;
		}
		Integer lhs = intValue(expr.getLeftHandSide());
		Integer rhs = intValue(expr.getRightHandSide());
		if (lhs != null && rhs != null) {
			Long result = evaluate(expr.getOperator(), lhs, rhs);
			if (result != null && (result < Integer.MIN_VALUE || result > Integer.MAX_VALUE)) {
				diagnostics.reportWarning(expr.getSpan(), DiagnosticCode.INTEGER_OVERFLOW,
						"Integer overflow in " + operation + " of constants (" + result + ")");
			}
		} else if (expr.getOperator() != Expr.BinaryOperator.SHL && isSolverEnabled()) {
			Expr goal = BoundModule.OR(BoundModule.COMPARE(Expr.BinaryOperator.GT, expr, max()),
					BoundModule.COMPARE(Expr.BinaryOperator.LT, expr, min()));
			if (isPossible(expr, assumptions, goal)) {
				diagnostics.reportWarning(expr.getSpan(), DiagnosticCode.INTEGER_OVERFLOW,
						"Potential integer overflow in " + operation);
			}
		}
	}

	@Override
	protected void checkUnary(Expr.Unary expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
		if (expr.getOperator() != Expr.UnaryOperator.NEGATE || !isInt32(expr.getType())) {
			return;
		}
		Expr operand = expr.getOperand();
		if (operand instanceof Expr.IntLiteral) {
			if (((Expr.IntLiteral) operand).getValue() == Integer.MIN_VALUE) {
				diagnostics.reportWarning(expr.getSpan(), DiagnosticCode.INTEGER_OVERFLOW,
						"Negation of INT_MIN causes overflow");
			}
		} else if (isSolverEnabled()
				&& isPossible(operand, assumptions, BoundModule.COMPARE(Expr.BinaryOperator.EQ, operand, min()))) {
			diagnostics.reportWarning(expr.getSpan(), DiagnosticCode.INTEGER_OVERFLOW,
					"Potential overflow in negation (value may be INT_MIN)");
		}
	}

	/**
	 * Check whether a goal over some expression is satisfiable, assuming each
	 * integer variable it reads is itself within range.
	 */
	private boolean isPossible(Expr expr, List<Expr> assumptions, Expr goal) {
		ArrayList<Expr> constraints = new ArrayList<>(assumptions);
		for (Expr.VariableAccess v : new IntVariables().visitExpression(expr).values()) {
			constraints.add(BoundModule.COMPARE(Expr.BinaryOperator.GTEQ, v, min()));
			constraints.add(BoundModule.COMPARE(Expr.BinaryOperator.LTEQ, v, max()));
		}
		SmtSolver.Result result = query(constraints, goal);
		logger.debug("overflow of {} is {}", BoundExpressionPrinter.toString(expr), result);
		return result == SmtSolver.Result.SAT;
	}

	private static String describe(Expr.BinaryOperator op) {
		switch (op) {
		case ADD:
			return "addition";
		case SUB:
			return "subtraction";
		case MUL:
			return "multiplication";
		case SHL:
			return "left shift";
		default:
			return null;
		}
	}

	/**
	 * Evaluate an operation on two integers exactly.
	 *
	 * @return <code>null</code> for a shift whose distance is out of range.
	 */
	private static Long evaluate(Expr.BinaryOperator op, long lhs, long rhs) {
		switch (op) {
		case ADD:
			return lhs + rhs;
		case SUB:
			return lhs - rhs;
		case MUL:
			return lhs * rhs;
		default:
			if (rhs < 0 || rhs > 31) {
				return null;
			}
			return lhs << rhs;
		}
	}

	private static Integer intValue(Expr e) {
		if (e instanceof Expr.IntLiteral) {
			return ((Expr.IntLiteral) e).getValue();
		} else if (e instanceof Expr.Unary && ((Expr.Unary) e).getOperator() == Expr.UnaryOperator.NEGATE) {
			Integer v = intValue(((Expr.Unary) e).getOperand());
			return v == null || v == Integer.MIN_VALUE ? null : -v;
		}
		return null;
	}

	private static boolean isInt32(String type) {
		return Types.INT.equals(type) || "int".equalsIgnoreCase(type);
	}

	private static Expr min() {
		return BoundModule.CONST(Integer.MIN_VALUE);
	}

	private static Expr max() {
		return BoundModule.CONST(Integer.MAX_VALUE);
	}

	/**
	 * Collects the distinct 32-bit integer variables read by an expression.
	 */
	private static class IntVariables extends AbstractExpressionFold<Map<String, Expr.VariableAccess>> {
		@Override
		protected Map<String, Expr.VariableAccess> constructVariableAccess(Expr.VariableAccess expr) {
			Map<String, Expr.VariableAccess> result = new LinkedHashMap<>();
			if (isInt32(expr.getType())) {
				result.put(expr.getVariable().getName(), expr);
			}
			return result;
		}

		@Override
		public Map<String, Expr.VariableAccess> join(Map<String, Expr.VariableAccess> lhs,
				Map<String, Expr.VariableAccess> rhs) {
			Map<String, Expr.VariableAccess> result = new LinkedHashMap<>(lhs);
			for (Map.Entry<String, Expr.VariableAccess> e : rhs.entrySet()) {
				result.putIfAbsent(e.getKey(), e.getValue());
			}
			return result;
		}

		@Override
		public Map<String, Expr.VariableAccess> BOTTOM() {
			return new LinkedHashMap<>();
		}
	}
}
