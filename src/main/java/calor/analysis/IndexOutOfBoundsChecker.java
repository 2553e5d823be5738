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
import calor.core.BoundModule.Span;
import calor.core.BoundModule.Types;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.io.BoundExpressionPrinter;
import calor.util.SmtSolver;

/**
 * Finds array accesses whose index may be negative. Both indexing expressions
 * (<code>a[i]</code>) and accessor calls (<code>a.get(i)</code>,
 * <code>array_get(i, ...)</code>) are considered, where the index of a call is
 * its first argument. A negative literal index is an error. Any other index is
 * accepted when a condition known to hold gives it a lower bound of zero or
 * more (e.g. <code>i &gt;= 0</code>, or the range of a counted loop starting
 * at zero). Otherwise, the solver (if enabled) is asked whether the index can
 * be negative; without it, only plain variable indices are reported.
 *
 * @author The Calor Project Developers
 *
 */
public class IndexOutOfBoundsChecker extends PathSensitiveChecker {
	private static final Logger logger = LoggerFactory.getLogger(IndexOutOfBoundsChecker.class);

	private static final String[] ACCESSORS = { ".get", ".at", "[]" };
	private static final String[] FUNCTIONS = { "array_get", "list_get" };

	public IndexOutOfBoundsChecker() {
		this(SmtSolver.NONE, new BugPatternOptions().setUseZ3Verification(false));
	}

	public IndexOutOfBoundsChecker(SmtSolver solver, BugPatternOptions options) {
		super(solver, options);
	}

	@Override
	public String getName() {
		return "INDEX_OOB";
	}

	@Override
	protected void checkArrayAccess(Expr.ArrayAccess expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
		check(expr.getIndex(), expr.getSpan(), assumptions, diagnostics);
	}

	@Override
	protected void checkInvoke(Expr.Invoke expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
		if (isAccessor(expr.getTarget()) && !expr.getArguments().isEmpty()) {
			check(expr.getArguments().get(0), expr.getSpan(), assumptions, diagnostics);
		}
	}

	private void check(Expr index, Span span, List<Expr> assumptions, DiagnosticBag diagnostics) {
		if (!Types.isIntegral(index.getType())) {
			return;
		}
		Double value = literalValue(index);
		if (value != null) {
			if (value < 0) {
				diagnostics.reportError(span, DiagnosticCode.INDEX_OUT_OF_BOUNDS,
						"Array access with negative literal index: " + value.longValue());
			}
		} else if (isNonNegative(index, assumptions)) {
			// guarded
		} else if (isSolverEnabled()) {
			SmtSolver.Result result = query(assumptions,
					BoundModule.COMPARE(Expr.BinaryOperator.LT, index, BoundModule.CONST(0)));
			logger.debug("index {} < 0 is {}", BoundExpressionPrinter.toString(index), result);
			if (result == SmtSolver.Result.SAT) {
				diagnostics.reportWarning(span, DiagnosticCode.INDEX_OUT_OF_BOUNDS,
						"Potential array access with negative index");
			}
		} else if (index instanceof Expr.VariableAccess) {
			diagnostics.reportWarning(span, DiagnosticCode.INDEX_OUT_OF_BOUNDS, "Array access with '"
					+ ((Expr.VariableAccess) index).getVariable().getName() + "' may be out of bounds");
		}
	}

	static boolean isAccessor(String target) {
		String name = target.toLowerCase();
		for (String suffix : ACCESSORS) {
			if (name.endsWith(suffix)) {
				return true;
			}
		}
		for (String function : FUNCTIONS) {
			if (name.equals(function)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Check whether some assumption gives the index a lower bound of zero.
	 */
	private static boolean isNonNegative(Expr index, List<Expr> assumptions) {
		for (Expr fact : facts(assumptions)) {
			Bound bound = Bound.of(index, fact);
			if (bound == null) {
				continue;
			} else if (bound.getOperator() == Expr.BinaryOperator.GTEQ && bound.getValue() >= 0) {
				return true;
			} else if (bound.getOperator() == Expr.BinaryOperator.GT && bound.getValue() >= -1) {
				return true;
			}
		}
		return false;
	}
}
