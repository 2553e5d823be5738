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

import java.util.List;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Variable;

/**
 * Determines whether two bound expressions have the same shape and values.
 * Variables are compared by name, since the same variable may be accessed
 * through distinct nodes.
 *
 * @author The Calor Project Developers
 *
 */
public class StructuralEquality {

	public static boolean equal(Expr a, Expr b) {
		if (a == b) {
			return true;
		} else if (a == null || b == null || a.getClass() != b.getClass()) {
			return false;
		} else if (a instanceof Expr.IntLiteral) {
			return ((Expr.IntLiteral) a).getValue() == ((Expr.IntLiteral) b).getValue();
		} else if (a instanceof Expr.FloatLiteral) {
			// NOTE: zeros of either sign are considered equal
			return ((Expr.FloatLiteral) a).getValue() == ((Expr.FloatLiteral) b).getValue();
		} else if (a instanceof Expr.BoolLiteral) {
			return ((Expr.BoolLiteral) a).getValue() == ((Expr.BoolLiteral) b).getValue();
		} else if (a instanceof Expr.StringLiteral) {
			return ((Expr.StringLiteral) a).getValue().equals(((Expr.StringLiteral) b).getValue());
		} else if (a instanceof Expr.VariableAccess) {
			return equal(((Expr.VariableAccess) a).getVariable(), ((Expr.VariableAccess) b).getVariable());
		} else if (a instanceof Expr.Unary) {
			Expr.Unary ua = (Expr.Unary) a;
			Expr.Unary ub = (Expr.Unary) b;
			return ua.getOperator() == ub.getOperator() && equal(ua.getOperand(), ub.getOperand());
		} else if (a instanceof Expr.Binary) {
			Expr.Binary ba = (Expr.Binary) a;
			Expr.Binary bb = (Expr.Binary) b;
			return ba.getOperator() == bb.getOperator() && equal(ba.getLeftHandSide(), bb.getLeftHandSide())
					&& equal(ba.getRightHandSide(), bb.getRightHandSide());
		} else if (a instanceof Expr.Implies) {
			Expr.Implies ia = (Expr.Implies) a;
			Expr.Implies ib = (Expr.Implies) b;
			return equal(ia.getLeftHandSide(), ib.getLeftHandSide())
					&& equal(ia.getRightHandSide(), ib.getRightHandSide());
		} else if (a instanceof Expr.Conditional) {
			Expr.Conditional ca = (Expr.Conditional) a;
			Expr.Conditional cb = (Expr.Conditional) b;
			return equal(ca.getCondition(), cb.getCondition()) && equal(ca.getTrueBranch(), cb.getTrueBranch())
					&& equal(ca.getFalseBranch(), cb.getFalseBranch());
		} else if (a instanceof Expr.Quantifier) {
			Expr.Quantifier qa = (Expr.Quantifier) a;
			Expr.Quantifier qb = (Expr.Quantifier) b;
			return equalVariables(qa.getVariables(), qb.getVariables()) && equal(qa.getBody(), qb.getBody());
		} else if (a instanceof Expr.Invoke) {
			Expr.Invoke ia = (Expr.Invoke) a;
			Expr.Invoke ib = (Expr.Invoke) b;
			return ia.getTarget().equals(ib.getTarget()) && equal(ia.getArguments(), ib.getArguments());
		} else if (a instanceof Expr.ArrayAccess) {
			Expr.ArrayAccess aa = (Expr.ArrayAccess) a;
			Expr.ArrayAccess ab = (Expr.ArrayAccess) b;
			return equal(aa.getSource(), ab.getSource()) && equal(aa.getIndex(), ab.getIndex());
		} else if (a instanceof Expr.FieldAccess) {
			Expr.FieldAccess fa = (Expr.FieldAccess) a;
			Expr.FieldAccess fb = (Expr.FieldAccess) b;
			return fa.getField().equals(fb.getField()) && equal(fa.getSource(), fb.getSource());
		} else if (a instanceof Expr.CollectionLiteral) {
			return equal(((Expr.CollectionLiteral) a).getElements(), ((Expr.CollectionLiteral) b).getElements());
		} else {
			return false;
		}
	}

	/**
	 * Determine whether two expressions are equal, allowing the operands of the
	 * outermost commutative operator to be swapped. For example,
	 * <code>a + b</code> and <code>b + a</code> are considered equal.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public static boolean equalOrCommutative(Expr a, Expr b) {
		if (equal(a, b)) {
			return true;
		} else if (a instanceof Expr.Binary && b instanceof Expr.Binary) {
			Expr.Binary ba = (Expr.Binary) a;
			Expr.Binary bb = (Expr.Binary) b;
			return ba.getOperator() == bb.getOperator() && ba.getOperator().isCommutative()
					&& equal(ba.getLeftHandSide(), bb.getRightHandSide())
					&& equal(ba.getRightHandSide(), bb.getLeftHandSide());
		}
		return false;
	}

	/**
	 * Determine whether <code>a</code> is the logical negation of <code>b</code>,
	 * i.e. <code>a</code> is <code>!x</code> with <code>x</code> equal to
	 * <code>b</code>.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public static boolean isNegationOf(Expr a, Expr b) {
		if (a instanceof Expr.Unary) {
			Expr.Unary u = (Expr.Unary) a;
			return u.getOperator() == Expr.UnaryOperator.NOT && equalOrCommutative(u.getOperand(), b);
		}
		return false;
	}

	private static boolean equal(Variable a, Variable b) {
		return a == b || (a.getName().equals(b.getName()) && sameType(a.getType(), b.getType()));
	}

	private static boolean sameType(String a, String b) {
		return a == null ? b == null : a.equals(b);
	}

	private static boolean equalVariables(List<Variable> a, List<Variable> b) {
		if (a.size() != b.size()) {
			return false;
		}
		for (int i = 0; i != a.size(); ++i) {
			if (!equal(a.get(i), b.get(i))) {
				return false;
			}
		}
		return true;
	}

	private static boolean equal(List<Expr> a, List<Expr> b) {
		if (a.size() != b.size()) {
			return false;
		}
		for (int i = 0; i != a.size(); ++i) {
			if (!equal(a.get(i), b.get(i))) {
				return false;
			}
		}
		return true;
	}
}
