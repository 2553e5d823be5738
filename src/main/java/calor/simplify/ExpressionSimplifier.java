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
package calor.simplify;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Span;
import calor.core.BoundModule.Types;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.util.AbstractExpressionTransform;

/**
 * Algebraically simplifies boolean and arithmetic expressions. A single call to
 * {@link #simplify(Expr)} performs one bottom-up pass: the children of a node
 * are simplified first, after which the rewrite rules are tried against the
 * rebuilt node in a fixed order, with the first matching rule winning. The
 * rules are:
 *
 * <ul>
 * <li><b>Constant folding</b> of integer, floating point and mixed operands.
 * Division and remainder are never folded when the divisor is zero, since
 * this is left for the division by zero checker to report.</li>
 * <li><b>Algebraic identities</b> such as <code>x + 0</code>,
 * <code>x * 1</code> and <code>x - x</code>.</li>
 * <li><b>Boolean identities</b> for conjunction, disjunction, equality and
 * negation, including the detection of tautologies such as
 * <code>x || !x</code> and contradictions such as <code>x &amp;&amp; !x</code>.</li>
 * <li><b>Implication</b>, <b>De Morgan</b>, <b>conditional</b> and
 * <b>quantifier</b> rewrites.</li>
 * </ul>
 *
 * When a diagnostic bag is given, every rewrite is reported. Tautologies are
 * reported as information and contradictions as warnings. Since one pass may
 * enable further rewrites, callers wanting a canonical form should use
 * {@link #simplifyToFixedPoint(Expr, int, DiagnosticBag)}.
 *
 * @author The Calor Project Developers
 *
 */
public class ExpressionSimplifier extends AbstractExpressionTransform {
	/**
	 * Default bound on the number of passes made when computing a fixed point.
	 * This only guards against rules which unexpectedly cycle.
	 */
	public static final int DEFAULT_MAX_ITERATIONS = 10;

	private final DiagnosticBag diagnostics;
	private boolean changed;

	public ExpressionSimplifier() {
		this(null);
	}

	public ExpressionSimplifier(DiagnosticBag diagnostics) {
		this.diagnostics = diagnostics;
	}

	/**
	 * Check whether any rewrite rule fired since this simplifier was created.
	 *
	 * @return
	 */
	public boolean isChanged() {
		return changed;
	}

	public Expr simplify(Expr expr) {
		return visitExpression(expr);
	}

	/**
	 * Repeatedly simplify an expression until a pass makes no change, or the
	 * iteration limit is reached.
	 *
	 * @param expr
	 * @param maxIterations
	 * @param diagnostics   Bag for reporting rewrites, which may be
	 *                      <code>null</code>.
	 * @return
	 */
	public static Expr simplifyToFixedPoint(Expr expr, int maxIterations, DiagnosticBag diagnostics) {
		if (maxIterations < 1) {
			throw new IllegalArgumentException("invalid iteration limit (" + maxIterations + ")");
		}
		Expr current = expr;
		for (int i = 0; i != maxIterations; ++i) {
			ExpressionSimplifier simplifier = new ExpressionSimplifier(diagnostics);
			Expr next = simplifier.simplify(current);
			if (!simplifier.isChanged()) {
				break;
			}
			current = next;
		}
		return current;
	}

	public static Expr simplifyToFixedPoint(Expr expr) {
		return simplifyToFixedPoint(expr, DEFAULT_MAX_ITERATIONS, null);
	}

	// =========================================================================
	// Binary Operators
	// =========================================================================

	@Override
	protected Expr constructBinary(Expr.Binary expr, Expr lhs, Expr rhs) {
		Span span = expr.getSpan();
		Expr.BinaryOperator op = expr.getOperator();
		//
		if (lhs instanceof Expr.IntLiteral && rhs instanceof Expr.IntLiteral) {
			Expr folded = foldInteger(span, op, ((Expr.IntLiteral) lhs).getValue(), ((Expr.IntLiteral) rhs).getValue());
			if (folded != null) {
				return simplified(span, "integer constant folded", folded);
			}
		}
		if (lhs instanceof Expr.FloatLiteral && rhs instanceof Expr.FloatLiteral) {
			Expr folded = foldFloat(span, op, ((Expr.FloatLiteral) lhs).getValue(),
					((Expr.FloatLiteral) rhs).getValue());
			if (folded != null) {
				return simplified(span, "float constant folded", folded);
			}
		}
		if (isNumericLiteral(lhs) && isNumericLiteral(rhs)
				&& (lhs instanceof Expr.FloatLiteral || rhs instanceof Expr.FloatLiteral)) {
			Expr folded = foldFloat(span, op, numericValue(lhs), numericValue(rhs));
			if (folded != null) {
				return simplified(span, "mixed constant folded", folded);
			}
		}
		//
		Expr identity = simplifyAlgebraicIdentity(expr, lhs, rhs);
		if (identity != null) {
			return identity;
		}
		//
		switch (op) {
		case AND:
			return simplifyAnd(expr, lhs, rhs);
		case OR:
			return simplifyOr(expr, lhs, rhs);
		case EQ:
			return simplifyEqual(expr, lhs, rhs);
		case NEQ:
			return simplifyNotEqual(expr, lhs, rhs);
		default:
			return super.constructBinary(expr, lhs, rhs);
		}
	}

	private static Expr foldInteger(Span span, Expr.BinaryOperator op, int l, int r) {
		switch (op) {
		case ADD:
			return new Expr.IntLiteral(l + r, span);
		case SUB:
			return new Expr.IntLiteral(l - r, span);
		case MUL:
			return new Expr.IntLiteral(l * r, span);
		case DIV:
			return r == 0 ? null : new Expr.IntLiteral(l / r, span);
		case MOD:
			return r == 0 ? null : new Expr.IntLiteral(l % r, span);
		case LT:
			return new Expr.BoolLiteral(l < r, span);
		case LTEQ:
			return new Expr.BoolLiteral(l <= r, span);
		case GT:
			return new Expr.BoolLiteral(l > r, span);
		case GTEQ:
			return new Expr.BoolLiteral(l >= r, span);
		case EQ:
			return new Expr.BoolLiteral(l == r, span);
		case NEQ:
			return new Expr.BoolLiteral(l != r, span);
		case BITAND:
			return new Expr.IntLiteral(l & r, span);
		case BITOR:
			return new Expr.IntLiteral(l | r, span);
		case BITXOR:
			return new Expr.IntLiteral(l ^ r, span);
		case SHL:
			return new Expr.IntLiteral(l << r, span);
		case SHR:
			return new Expr.IntLiteral(l >> r, span);
		default:
			return null;
		}
	}

	private static Expr foldFloat(Span span, Expr.BinaryOperator op, double l, double r) {
		switch (op) {
		case ADD:
			return new Expr.FloatLiteral(l + r, span);
		case SUB:
			return new Expr.FloatLiteral(l - r, span);
		case MUL:
			return new Expr.FloatLiteral(l * r, span);
		case DIV:
			return r == 0.0 ? null : new Expr.FloatLiteral(l / r, span);
		case MOD:
			return r == 0.0 ? null : new Expr.FloatLiteral(l % r, span);
		case POW:
			return new Expr.FloatLiteral(Math.pow(l, r), span);
		case LT:
			return new Expr.BoolLiteral(l < r, span);
		case LTEQ:
			return new Expr.BoolLiteral(l <= r, span);
		case GT:
			return new Expr.BoolLiteral(l > r, span);
		case GTEQ:
			return new Expr.BoolLiteral(l >= r, span);
		case EQ:
			return new Expr.BoolLiteral(l == r, span);
		case NEQ:
			return new Expr.BoolLiteral(l != r, span);
		default:
			return null;
		}
	}

	private Expr simplifyAlgebraicIdentity(Expr.Binary expr, Expr lhs, Expr rhs) {
		Span span = expr.getSpan();
		switch (expr.getOperator()) {
		case ADD:
			if (isZero(rhs)) {
				return simplified(span, "x + 0 -> x", lhs);
			} else if (isZero(lhs)) {
				return simplified(span, "0 + x -> x", rhs);
			}
			break;
		case SUB:
			if (isZero(rhs)) {
				return simplified(span, "x - 0 -> x", lhs);
			} else if (StructuralEquality.equalOrCommutative(lhs, rhs)) {
				return simplified(span, "x - x -> 0", zero(expr.getType(), span));
			}
			break;
		case MUL:
			if (isOne(rhs)) {
				return simplified(span, "x * 1 -> x", lhs);
			} else if (isOne(lhs)) {
				return simplified(span, "1 * x -> x", rhs);
			} else if (isZero(rhs)) {
				return simplified(span, "x * 0 -> 0", rhs);
			} else if (isZero(lhs)) {
				return simplified(span, "0 * x -> 0", lhs);
			}
			break;
		case DIV:
			if (isOne(rhs)) {
				return simplified(span, "x / 1 -> x", lhs);
			} else if (lhs instanceof Expr.IntLiteral && rhs instanceof Expr.IntLiteral) {
				int l = ((Expr.IntLiteral) lhs).getValue();
				int r = ((Expr.IntLiteral) rhs).getValue();
				if (l == r && l != 0) {
					return simplified(span, "n / n -> 1", new Expr.IntLiteral(1, span));
				}
			}
			break;
		case MOD:
			if (isOne(rhs) && (lhs instanceof Expr.IntLiteral || lhs instanceof Expr.VariableAccess)) {
				return simplified(span, "x % 1 -> 0", new Expr.IntLiteral(0, span));
			}
			break;
		default:
		}
		return null;
	}

	private Expr simplifyAnd(Expr.Binary expr, Expr lhs, Expr rhs) {
		Span span = expr.getSpan();
		if (isTrue(lhs)) {
			return simplified(span, "(&& true x) -> x", rhs);
		} else if (isTrue(rhs)) {
			return simplified(span, "(&& x true) -> x", lhs);
		} else if (isFalse(lhs)) {
			return contradiction(span, "(&& false x) is always false");
		} else if (isFalse(rhs)) {
			return contradiction(span, "(&& x false) is always false");
		} else if (StructuralEquality.equalOrCommutative(lhs, rhs)) {
			return simplified(span, "(&& x x) -> x", lhs);
		} else if (StructuralEquality.isNegationOf(rhs, lhs) || StructuralEquality.isNegationOf(lhs, rhs)) {
			return contradiction(span, "(&& x (! x)) is a contradiction");
		}
		return super.constructBinary(expr, lhs, rhs);
	}

	private Expr simplifyOr(Expr.Binary expr, Expr lhs, Expr rhs) {
		Span span = expr.getSpan();
		if (isTrue(lhs)) {
			return tautology(span, "(|| true x) is always true");
		} else if (isTrue(rhs)) {
			return tautology(span, "(|| x true) is always true");
		} else if (isFalse(lhs)) {
			return simplified(span, "(|| false x) -> x", rhs);
		} else if (isFalse(rhs)) {
			return simplified(span, "(|| x false) -> x", lhs);
		} else if (StructuralEquality.equalOrCommutative(lhs, rhs)) {
			return simplified(span, "(|| x x) -> x", lhs);
		} else if (StructuralEquality.isNegationOf(rhs, lhs) || StructuralEquality.isNegationOf(lhs, rhs)) {
			return tautology(span, "(|| x (! x)) is a tautology");
		}
		return super.constructBinary(expr, lhs, rhs);
	}

	private Expr simplifyEqual(Expr.Binary expr, Expr lhs, Expr rhs) {
		Span span = expr.getSpan();
		if (StructuralEquality.equalOrCommutative(lhs, rhs)) {
			return tautology(span, "(== x x) is always true");
		} else if (isTrue(lhs)) {
			return simplified(span, "(== true x) -> x", rhs);
		} else if (isTrue(rhs)) {
			return simplified(span, "(== x true) -> x", lhs);
		} else if (isFalse(lhs)) {
			return simplified(span, "(== false x) -> (! x)", not(rhs, span));
		} else if (isFalse(rhs)) {
			return simplified(span, "(== x false) -> (! x)", not(lhs, span));
		}
		return super.constructBinary(expr, lhs, rhs);
	}

	private Expr simplifyNotEqual(Expr.Binary expr, Expr lhs, Expr rhs) {
		if (StructuralEquality.equalOrCommutative(lhs, rhs)) {
			return contradiction(expr.getSpan(), "(!= x x) is always false");
		}
		return super.constructBinary(expr, lhs, rhs);
	}

	// =========================================================================
	// Unary Operators
	// =========================================================================

	@Override
	protected Expr constructUnary(Expr.Unary expr, Expr operand) {
		Span span = expr.getSpan();
		switch (expr.getOperator()) {
		case NOT:
			if (isTrue(operand)) {
				return simplified(span, "(! true) -> false", new Expr.BoolLiteral(false, span));
			} else if (isFalse(operand)) {
				return simplified(span, "(! false) -> true", new Expr.BoolLiteral(true, span));
			} else if (isUnary(operand, Expr.UnaryOperator.NOT)) {
				return simplified(span, "(! (! x)) -> x", ((Expr.Unary) operand).getOperand());
			} else if (isBinary(operand, Expr.BinaryOperator.AND)) {
				Expr.Binary b = (Expr.Binary) operand;
				Expr result = new Expr.Binary(Expr.BinaryOperator.OR, not(b.getLeftHandSide(), span),
						not(b.getRightHandSide(), span), Types.BOOL, span);
				return simplified(span, "De Morgan: (! (&& a b)) -> (|| (! a) (! b))", result);
			} else if (isBinary(operand, Expr.BinaryOperator.OR)) {
				Expr.Binary b = (Expr.Binary) operand;
				Expr result = new Expr.Binary(Expr.BinaryOperator.AND, not(b.getLeftHandSide(), span),
						not(b.getRightHandSide(), span), Types.BOOL, span);
				return simplified(span, "De Morgan: (! (|| a b)) -> (&& (! a) (! b))", result);
			}
			break;
		case NEGATE:
			if (operand instanceof Expr.IntLiteral) {
				int v = ((Expr.IntLiteral) operand).getValue();
				return simplified(span, "integer negation folded", new Expr.IntLiteral(-v, span));
			} else if (operand instanceof Expr.FloatLiteral) {
				double v = ((Expr.FloatLiteral) operand).getValue();
				return simplified(span, "float negation folded", new Expr.FloatLiteral(-v, span));
			} else if (isUnary(operand, Expr.UnaryOperator.NEGATE)) {
				return simplified(span, "(- (- x)) -> x", ((Expr.Unary) operand).getOperand());
			}
			break;
		case BITWISE_NOT:
			if (operand instanceof Expr.IntLiteral) {
				int v = ((Expr.IntLiteral) operand).getValue();
				return simplified(span, "bitwise not folded", new Expr.IntLiteral(~v, span));
			} else if (isUnary(operand, Expr.UnaryOperator.BITWISE_NOT)) {
				return simplified(span, "(~ (~ x)) -> x", ((Expr.Unary) operand).getOperand());
			}
			break;
		}
		return super.constructUnary(expr, operand);
	}

	// =========================================================================
	// Implication, Conditionals & Quantifiers
	// =========================================================================

	@Override
	protected Expr constructImplies(Expr.Implies expr, Expr lhs, Expr rhs) {
		Span span = expr.getSpan();
		if (isFalse(lhs)) {
			return tautology(span, "(-> false p) is always true");
		} else if (isTrue(lhs)) {
			return simplified(span, "(-> true p) -> p", rhs);
		} else if (isTrue(rhs)) {
			return tautology(span, "(-> p true) is always true");
		} else if (isFalse(rhs)) {
			return simplified(span, "(-> p false) -> (! p)", not(lhs, span));
		} else if (StructuralEquality.equalOrCommutative(lhs, rhs)) {
			return tautology(span, "(-> p p) is always true");
		} else if (StructuralEquality.isNegationOf(lhs, rhs)) {
			return simplified(span, "(-> (! p) p) -> p", rhs);
		}
		return super.constructImplies(expr, lhs, rhs);
	}

	@Override
	protected Expr constructConditional(Expr.Conditional expr, Expr condition, Expr trueBranch, Expr falseBranch) {
		Span span = expr.getSpan();
		if (isTrue(condition)) {
			return simplified(span, "(? true t f) -> t", trueBranch);
		} else if (isFalse(condition)) {
			return simplified(span, "(? false t f) -> f", falseBranch);
		} else if (StructuralEquality.equalOrCommutative(trueBranch, falseBranch)) {
			return simplified(span, "(? c x x) -> x", trueBranch);
		} else if (isTrue(trueBranch) && isFalse(falseBranch)) {
			return simplified(span, "(? c true false) -> c", condition);
		} else if (isFalse(trueBranch) && isTrue(falseBranch)) {
			return simplified(span, "(? c false true) -> (! c)", not(condition, span));
		}
		return super.constructConditional(expr, condition, trueBranch, falseBranch);
	}

	@Override
	protected Expr constructUniversalQuantifier(Expr.UniversalQuantifier expr, Expr body) {
		if (isTrue(body)) {
			return tautology(expr.getSpan(), "(forall (...) true) is always true");
		} else if (isFalse(body)) {
			return contradiction(expr.getSpan(), "(forall (...) false) is always false (assuming non-empty domain)");
		}
		return super.constructUniversalQuantifier(expr, body);
	}

	@Override
	protected Expr constructExistentialQuantifier(Expr.ExistentialQuantifier expr, Expr body) {
		if (isTrue(body)) {
			return tautology(expr.getSpan(), "(exists (...) true) is always true (assuming non-empty domain)");
		} else if (isFalse(body)) {
			return contradiction(expr.getSpan(), "(exists (...) false) is always false");
		}
		return super.constructExistentialQuantifier(expr, body);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private Expr simplified(Span span, String message, Expr result) {
		changed = true;
		if (diagnostics != null) {
			diagnostics.reportInfo(span, DiagnosticCode.CONTRACT_SIMPLIFIED, message);
		}
		return result;
	}

	private Expr tautology(Span span, String message) {
		changed = true;
		if (diagnostics != null) {
			diagnostics.reportInfo(span, DiagnosticCode.CONTRACT_TAUTOLOGY, message);
		}
		return new Expr.BoolLiteral(true, span);
	}

	private Expr contradiction(Span span, String message) {
		changed = true;
		if (diagnostics != null) {
			diagnostics.reportWarning(span, DiagnosticCode.CONTRACT_CONTRADICTION, message);
		}
		return new Expr.BoolLiteral(false, span);
	}

	private static Expr not(Expr operand, Span span) {
		return new Expr.Unary(Expr.UnaryOperator.NOT, operand, Types.BOOL, span);
	}

	private static Expr zero(String type, Span span) {
		if (Types.isFloating(type)) {
			return new Expr.FloatLiteral(0.0, span);
		} else {
			return new Expr.IntLiteral(0, span);
		}
	}

	private static boolean isTrue(Expr e) {
		return e instanceof Expr.BoolLiteral && ((Expr.BoolLiteral) e).getValue();
	}

	private static boolean isFalse(Expr e) {
		return e instanceof Expr.BoolLiteral && !((Expr.BoolLiteral) e).getValue();
	}

	private static boolean isZero(Expr e) {
		if (e instanceof Expr.IntLiteral) {
			return ((Expr.IntLiteral) e).getValue() == 0;
		} else if (e instanceof Expr.FloatLiteral) {
			// NOTE: this holds for both 0.0 and -0.0
			return ((Expr.FloatLiteral) e).getValue() == 0.0;
		}
		return false;
	}

	private static boolean isOne(Expr e) {
		if (e instanceof Expr.IntLiteral) {
			return ((Expr.IntLiteral) e).getValue() == 1;
		} else if (e instanceof Expr.FloatLiteral) {
			return ((Expr.FloatLiteral) e).getValue() == 1.0;
		}
		return false;
	}

	private static boolean isNumericLiteral(Expr e) {
		return e instanceof Expr.IntLiteral || e instanceof Expr.FloatLiteral;
	}

	private static double numericValue(Expr e) {
		if (e instanceof Expr.IntLiteral) {
			return ((Expr.IntLiteral) e).getValue();
		} else {
			return ((Expr.FloatLiteral) e).getValue();
		}
	}

	private static boolean isUnary(Expr e, Expr.UnaryOperator op) {
		return e instanceof Expr.Unary && ((Expr.Unary) e).getOperator() == op;
	}

	private static boolean isBinary(Expr e, Expr.BinaryOperator op) {
		return e instanceof Expr.Binary && ((Expr.Binary) e).getOperator() == op;
	}
}
