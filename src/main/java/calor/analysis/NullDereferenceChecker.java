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

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Span;
import calor.core.BoundModule.Stmt;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.util.SmtSolver;

/**
 * Finds unwraps of optional or result values which are not preceded by a check
 * that a value is present. An unwrap is a call such as <code>opt.unwrap()</code>
 * or <code>res.expect(msg)</code>, while a check is a condition such as
 * <code>opt.is_some()</code>, <code>res.is_ok()</code> or
 * <code>opt != None</code> which is known to hold at the unwrap. Unwraps with a
 * fallback value (e.g. <code>unwrap_or</code>) are safe.
 *
 * @author The Calor Project Developers
 *
 */
public class NullDereferenceChecker extends PathSensitiveChecker {
	private static final String[] UNSAFE = { ".unwrap", ".unwrap_unchecked", ".expect", ".get_unchecked" };
	private static final String[] SAFE = { "unwrap_or", "unwrap_or_default", "unwrap_or_else" };
	private static final String[] PRESENT = { ".is_some", ".is_ok", ".has_value", ".is_present" };
	private static final String[] ABSENT = { ".is_none", ".is_err" };

	public NullDereferenceChecker() {
		this(SmtSolver.NONE, new BugPatternOptions().setUseZ3Verification(false));
	}

	public NullDereferenceChecker(SmtSolver solver, BugPatternOptions options) {
		super(solver, options);
	}

	@Override
	public String getName() {
		return "NULL_DEREF";
	}

	@Override
	protected void checkInvoke(Expr.Invoke expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
		check(expr.getTarget(), expr.getSpan(), assumptions, diagnostics);
	}

	@Override
	protected void checkCall(Stmt.Call stmt, List<Expr> assumptions, DiagnosticBag diagnostics) {
		check(stmt.getTarget(), stmt.getSpan(), assumptions, diagnostics);
	}

	private void check(String target, Span span, List<Expr> assumptions, DiagnosticBag diagnostics) {
		if (!isUnsafeUnwrap(target)) {
			return;
		}
		String receiver = receiverOf(target);
		if (receiver == null) {
			diagnostics.reportWarning(span, DiagnosticCode.NULL_DEREFERENCE,
					"Potential unsafe unwrap without prior Option/Result check");
		} else if (!isChecked(receiver, assumptions)) {
			diagnostics.reportWarning(span, DiagnosticCode.UNSAFE_UNWRAP,
					"Unsafe unwrap on '" + receiver + "' without prior Some/Ok check");
		}
	}

	static boolean isUnsafeUnwrap(String target) {
		String name = target.toLowerCase();
		for (String suffix : SAFE) {
			if (name.endsWith(suffix)) {
				return false;
			}
		}
		for (String suffix : UNSAFE) {
			if (name.endsWith(suffix)) {
				return true;
			}
		}
		return name.contains("unwrap");
	}

	private static boolean isChecked(String receiver, List<Expr> assumptions) {
		for (Expr fact : facts(assumptions)) {
			if (isPresenceCheck(receiver, fact)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isPresenceCheck(String receiver, Expr fact) {
		if (fact instanceof Expr.Invoke) {
			return isCall(receiver, (Expr.Invoke) fact, PRESENT);
		} else if (fact instanceof Expr.Unary && ((Expr.Unary) fact).getOperator() == Expr.UnaryOperator.NOT) {
			Expr operand = ((Expr.Unary) fact).getOperand();
			return operand instanceof Expr.Invoke && isCall(receiver, (Expr.Invoke) operand, ABSENT);
		} else if (fact instanceof Expr.Binary && ((Expr.Binary) fact).getOperator() == Expr.BinaryOperator.NEQ) {
			Expr.Binary b = (Expr.Binary) fact;
			return (isVariable(receiver, b.getLeftHandSide()) && isNone(b.getRightHandSide()))
					|| (isVariable(receiver, b.getRightHandSide()) && isNone(b.getLeftHandSide()));
		}
		return false;
	}

	private static boolean isCall(String receiver, Expr.Invoke call, String[] methods) {
		String target = call.getTarget().toLowerCase();
		for (String method : methods) {
			if (target.equals(receiver.toLowerCase() + method)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isVariable(String name, Expr e) {
		return e instanceof Expr.VariableAccess && ((Expr.VariableAccess) e).getVariable().getName().equals(name);
	}

	private static boolean isNone(Expr e) {
		return (e instanceof Expr.Invoke && ((Expr.Invoke) e).getTarget().equals("None"))
				|| isVariable("None", e);
	}
}
