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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Types;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.io.BoundExpressionPrinter;
import calor.util.SmtSolver;

/**
 * Finds divisions and remainders whose divisor may be zero. A literal zero
 * divisor is always an error. Any other non-literal divisor is reported as a
 * warning unless it is known to be nonzero, either because one of the
 * conditions known to hold at that point rules it out syntactically (e.g.
 * <code>y != 0</code> or <code>y &gt; 0</code>), or because an SMT solver
 * shows that the divisor cannot be zero under those conditions.
 *
 * <p>
 * Syntactic guards must compare the divisor against a literal. A comparison
 * against another variable, such as <code>y &lt; n</code>, says nothing about
 * whether <code>y</code> is zero and is left to the solver.
 * </p>
 *
 * @author The Calor Project Developers
 *
 */
public class DivisionByZeroChecker extends PathSensitiveChecker {
	private static final Logger logger = LoggerFactory.getLogger(DivisionByZeroChecker.class);

	public DivisionByZeroChecker() {
		this(SmtSolver.NONE, new BugPatternOptions().setUseZ3Verification(false));
	}

	public DivisionByZeroChecker(SmtSolver solver, BugPatternOptions options) {
		super(solver, options);
	}

	@Override
	public String getName() {
		return "DIV_ZERO";
	}

	@Override
	protected void checkBinary(Expr.Binary division, List<Expr> assumptions, DiagnosticBag diagnostics) {
		Expr.BinaryOperator op = division.getOperator();
		if (op != Expr.BinaryOperator.DIV && op != Expr.BinaryOperator.MOD) {
			return;
		}
		Expr divisor = division.getRightHandSide();
		Double value = literalValue(divisor);
		if (value != null && value == 0.0) {
			diagnostics.reportError(division.getSpan(), DiagnosticCode.DIVISION_BY_ZERO, "Division by literal zero");
		} else if (value != null) {
			// nonzero literal
		} else if (!isGuarded(divisor, assumptions) && !isDischarged(divisor, assumptions)) {
			diagnostics.reportWarning(division.getSpan(), DiagnosticCode.DIVISION_BY_ZERO,
					"Potential division by zero: '" + BoundExpressionPrinter.toString(divisor) + "' may be zero");
		}
	}

	private boolean isDischarged(Expr divisor, List<Expr> assumptions) {
		Expr zero;
		if (Types.isFloating(divisor.getType())) {
			zero = new Expr.FloatLiteral(0.0, divisor.getSpan());
		} else {
			zero = new Expr.IntLiteral(0, divisor.getSpan());
		}
		SmtSolver.Result result = query(assumptions, BoundModule.COMPARE(Expr.BinaryOperator.EQ, divisor, zero));
		logger.debug("divisor {} == 0 is {}", BoundExpressionPrinter.toString(divisor), result);
		return result == SmtSolver.Result.UNSAT;
	}

	/**
	 * Check whether some assumption syntactically rules out the divisor being
	 * zero.
	 */
	private static boolean isGuarded(Expr divisor, List<Expr> assumptions) {
		for (Expr fact : facts(assumptions)) {
			if (excludesZero(divisor, fact)) {
				return true;
			}
		}
		return false;
	}

	private static boolean excludesZero(Expr divisor, Expr fact) {
		if (fact instanceof Expr.Unary && ((Expr.Unary) fact).getOperator() == Expr.UnaryOperator.NOT) {
			Expr operand = ((Expr.Unary) fact).getOperand();
			return operand instanceof Expr.Binary && ((Expr.Binary) operand).getOperator() == Expr.BinaryOperator.EQ
					&& comparesWithZero(divisor, (Expr.Binary) operand);
		} else if (fact instanceof Expr.Binary && ((Expr.Binary) fact).getOperator() == Expr.BinaryOperator.NEQ) {
			return comparesWithZero(divisor, (Expr.Binary) fact);
		}
		Bound bound = Bound.of(divisor, fact);
		if (bound == null) {
			return false;
		}
		switch (bound.getOperator()) {
		case GT:
			return bound.getValue() >= 0;
		case GTEQ:
			return bound.getValue() > 0;
		case LT:
			return bound.getValue() <= 0;
		default:
			return bound.getValue() < 0;
		}
	}

	private static boolean comparesWithZero(Expr divisor, Expr.Binary b) {
		return (matches(divisor, b.getLeftHandSide()) && isZero(b.getRightHandSide()))
				|| (matches(divisor, b.getRightHandSide()) && isZero(b.getLeftHandSide()));
	}

	private static boolean isZero(Expr e) {
		Double value = literalValue(e);
		return value != null && value == 0.0;
	}
}
