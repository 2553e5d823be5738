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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Stmt;
import calor.core.DiagnosticBag;
import calor.simplify.StructuralEquality;
import calor.util.AbstractExpressionFold;
import calor.util.AbstractStatementVisitor;
import calor.util.SmtSolver;
import calor.util.Util;
import calor.util.VariableExtractor;

/**
 * Base for bug pattern checks which depend upon the conditions known to hold at
 * each point in a function. These are the function's preconditions, the
 * conditions of enclosing branches and loops, and the short-circuiting context
 * within an expression. Subclasses are handed each expression of interest
 * together with the conditions holding there.
 *
 * <p>
 * A condition stops holding once a variable it mentions may have been
 * assigned. Hence, a bind removes the conditions on its variable for the
 * statements which follow it, and a loop body starts without the conditions on
 * any variable the loop assigns (other than the loop condition itself). The
 * body of a counted loop also knows the range of its loop variable. A
 * condition such as <code>opt.is_some()</code> is treated as mentioning
 * <code>opt</code>.
 * </p>
 *
 * @author The Calor Project Developers
 *
 */
public abstract class PathSensitiveChecker implements BugPatternChecker {
	protected final SmtSolver solver;
	protected final BugPatternOptions options;

	protected PathSensitiveChecker(SmtSolver solver, BugPatternOptions options) {
		this.solver = solver == null ? SmtSolver.NONE : solver;
		this.options = options == null ? new BugPatternOptions() : options;
	}

	@Override
	public void check(Function function, DiagnosticBag diagnostics) {
		new Walker(diagnostics).visitStatements(function.getBody(), function.getPreconditions());
	}

	protected void checkBinary(Expr.Binary expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
	}

	protected void checkUnary(Expr.Unary expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
	}

	protected void checkInvoke(Expr.Invoke expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
	}

	protected void checkArrayAccess(Expr.ArrayAccess expr, List<Expr> assumptions, DiagnosticBag diagnostics) {
	}

	protected void checkCall(Stmt.Call stmt, List<Expr> assumptions, DiagnosticBag diagnostics) {
	}

	/**
	 * Determine whether potential problems should be put to the solver.
	 *
	 * @return
	 */
	protected boolean isSolverEnabled() {
		return options.isUseZ3Verification() && solver.isAvailable();
	}

	/**
	 * Ask the solver whether a goal can hold under the given assumptions. Those
	 * assumptions which the solver cannot express are ignored.
	 *
	 * @param assumptions
	 * @param goal
	 * @return {@link SmtSolver.Result#UNKNOWN} if the solver is not enabled.
	 */
	protected SmtSolver.Result query(List<Expr> assumptions, Expr goal) {
		if (!isSolverEnabled()) {
			return SmtSolver.Result.UNKNOWN;
		}
		return solver.checkGoal(assumptions, goal, options.getZ3TimeoutMs());
	}

	// =========================================================================
	// Conditions
	// =========================================================================

	/**
	 * Split a list of assumptions into its individual conjuncts.
	 */
	protected static List<Expr> facts(List<Expr> assumptions) {
		ArrayList<Expr> facts = new ArrayList<>();
		for (Expr assumption : assumptions) {
			flatten(assumption, facts);
		}
		return facts;
	}

	private static void flatten(Expr e, List<Expr> facts) {
		if (e instanceof Expr.Binary && ((Expr.Binary) e).getOperator() == Expr.BinaryOperator.AND) {
			flatten(((Expr.Binary) e).getLeftHandSide(), facts);
			flatten(((Expr.Binary) e).getRightHandSide(), facts);
		} else {
			facts.add(e);
		}
	}

	/**
	 * Get the value of a numeric literal (possibly negated), or
	 * <code>null</code> for anything else.
	 */
	protected static Double literalValue(Expr e) {
		if (e instanceof Expr.IntLiteral) {
			return (double) ((Expr.IntLiteral) e).getValue();
		} else if (e instanceof Expr.FloatLiteral) {
			return ((Expr.FloatLiteral) e).getValue();
		} else if (e instanceof Expr.Unary && ((Expr.Unary) e).getOperator() == Expr.UnaryOperator.NEGATE) {
			Double v = literalValue(((Expr.Unary) e).getOperand());
			return v == null ? null : -v;
		}
		return null;
	}

	protected static boolean matches(Expr subject, Expr e) {
		return StructuralEquality.equalOrCommutative(subject, e);
	}

	/**
	 * Get the receiver of a method-style call target (e.g. <code>opt</code> for
	 * <code>opt.unwrap</code>), or <code>null</code> if there is none.
	 */
	protected static String receiverOf(String target) {
		int dot = target.lastIndexOf('.');
		return dot > 0 ? target.substring(0, dot) : null;
	}

	/**
	 * A comparison between some subject expression and a numeric literal,
	 * oriented so that the subject is on the left (e.g. <code>0 &lt; y</code>
	 * becomes <code>y &gt; 0</code>).
	 */
	protected static final class Bound {
		private final Expr.BinaryOperator operator;
		private final double value;

		private Bound(Expr.BinaryOperator operator, double value) {
			this.operator = operator;
			this.value = value;
		}

		public Expr.BinaryOperator getOperator() {
			return operator;
		}

		public double getValue() {
			return value;
		}

		/**
		 * Extract the bound which a fact places on a subject, if it is a
		 * comparison of the subject against a literal.
		 *
		 * @return <code>null</code> if the fact is not such a comparison.
		 */
		public static Bound of(Expr subject, Expr fact) {
			if (!(fact instanceof Expr.Binary)) {
				return null;
			}
			Expr.Binary b = (Expr.Binary) fact;
			Expr.BinaryOperator op = b.getOperator();
			if (op != Expr.BinaryOperator.LT && op != Expr.BinaryOperator.LTEQ && op != Expr.BinaryOperator.GT
					&& op != Expr.BinaryOperator.GTEQ) {
				return null;
			}
			Double rhs = literalValue(b.getRightHandSide());
			if (rhs != null && matches(subject, b.getLeftHandSide())) {
				return new Bound(op, rhs);
			}
			Double lhs = literalValue(b.getLeftHandSide());
			if (lhs != null && matches(subject, b.getRightHandSide())) {
				return new Bound(flip(op), lhs);
			}
			return null;
		}

		private static Expr.BinaryOperator flip(Expr.BinaryOperator op) {
			switch (op) {
			case LT:
				return Expr.BinaryOperator.GT;
			case LTEQ:
				return Expr.BinaryOperator.GTEQ;
			case GT:
				return Expr.BinaryOperator.LT;
			default:
				return Expr.BinaryOperator.LTEQ;
			}
		}
	}

	/**
	 * Remove those conditions which mention any of the given variables.
	 */
	private static List<Expr> invalidate(List<Expr> context, Set<String> variables) {
		if (variables.isEmpty()) {
			return context;
		}
		ArrayList<Expr> result = new ArrayList<>();
		for (Expr condition : context) {
			if (Collections.disjoint(new References().visitExpression(condition), variables)) {
				result.add(condition);
			}
		}
		return result.size() == context.size() ? context : result;
	}

	private static Set<String> assignedBy(Stmt s) {
		Assignments assignments = new Assignments();
		assignments.visitStatement(s, null);
		return assignments.variables;
	}

	private static Set<String> assignedBy(List<Stmt> stmts) {
		Assignments assignments = new Assignments();
		assignments.visitStatements(stmts, null);
		return assignments.variables;
	}

	private static class Assignments extends AbstractStatementVisitor<Void> {
		private final Set<String> variables = new LinkedHashSet<>();

		@Override
		protected void visitBind(Stmt.Bind s, Void context) {
			variables.add(s.getVariable().getName());
		}

		@Override
		protected void visitFor(Stmt.For s, Void context) {
			variables.add(s.getVariable().getName());
			super.visitFor(s, context);
		}
	}

	/**
	 * The variables a condition depends on, including call receivers.
	 */
	private static class References extends VariableExtractor {
		@Override
		protected Set<String> constructInvoke(Expr.Invoke expr, List<Set<String>> arguments) {
			Set<String> result = new LinkedHashSet<>(join(arguments));
			String receiver = receiverOf(expr.getTarget());
			if (receiver != null) {
				result.add(receiver);
			}
			return result;
		}
	}

	// =========================================================================
	// Traversal
	// =========================================================================

	private class Walker extends AbstractStatementVisitor<List<Expr>> {
		private final DiagnosticBag diagnostics;

		public Walker(DiagnosticBag diagnostics) {
			this.diagnostics = diagnostics;
		}

		@Override
		public void visitStatements(List<Stmt> stmts, List<Expr> context) {
			for (Stmt s : stmts) {
				visitStatement(s, context);
				context = invalidate(context, assignedBy(s));
			}
		}

		@Override
		protected void visitCall(Stmt.Call s, List<Expr> context) {
			super.visitCall(s, context);
			checkCall(s, context, diagnostics);
		}

		@Override
		protected void visitIfElse(Stmt.IfElse s, List<Expr> context) {
			visitExpression(s.getCondition(), context);
			visitStatements(s.getTrueBranch(), Util.append(context, s.getCondition()));
			List<Expr> otherwise = Util.append(context, BoundModule.NOT(s.getCondition()));
			for (Stmt.ElseIf elseIf : s.getElseIfs()) {
				visitExpression(elseIf.getCondition(), otherwise);
				visitStatements(elseIf.getBody(), Util.append(otherwise, elseIf.getCondition()));
				otherwise = Util.append(otherwise, BoundModule.NOT(elseIf.getCondition()));
			}
			if (s.getFalseBranch() != null) {
				visitStatements(s.getFalseBranch(), otherwise);
			}
		}

		@Override
		protected void visitFor(Stmt.For s, List<Expr> context) {
			visitExpression(s.getFrom(), context);
			visitExpression(s.getTo(), context);
			if (s.getStep() != null) {
				visitExpression(s.getStep(), context);
			}
			Set<String> assigned = assignedBy(s);
			visitStatements(s.getBody(), range(s, assigned, invalidate(context, assigned)));
		}

		/**
		 * Add the range of the loop variable, provided the loop bounds are not
		 * themselves assigned within the loop and the step has a known sign.
		 */
		private List<Expr> range(Stmt.For s, Set<String> assigned, List<Expr> context) {
			References references = new References();
			Set<String> bounds = new LinkedHashSet<>(references.visitExpression(s.getFrom()));
			bounds.addAll(references.visitExpression(s.getTo()));
			Double step = s.getStep() == null ? Double.valueOf(1) : literalValue(s.getStep());
			if (!Collections.disjoint(bounds, assigned) || step == null || step == 0.0) {
				return context;
			}
			Expr v = BoundModule.VAR(s.getVariable());
			Expr.BinaryOperator lower = step > 0 ? Expr.BinaryOperator.GTEQ : Expr.BinaryOperator.LTEQ;
			Expr.BinaryOperator upper = step > 0 ? Expr.BinaryOperator.LTEQ : Expr.BinaryOperator.GTEQ;
			List<Expr> result = Util.append(context, BoundModule.COMPARE(lower, v, s.getFrom()));
			return Util.append(result, BoundModule.COMPARE(upper, v, s.getTo()));
		}

		@Override
		protected void visitWhile(Stmt.While s, List<Expr> context) {
			// the condition is evaluated again after each iteration
			List<Expr> entry = invalidate(context, assignedBy(s.getBody()));
			visitExpression(s.getCondition(), entry);
			visitStatements(s.getBody(), Util.append(entry, s.getCondition()));
		}

		@Override
		protected void visitExpression(Expr expr, List<Expr> context) {
			new Scanner(context, diagnostics).visitExpression(expr);
		}
	}

	/**
	 * Hands each expression to the checks, extending the known conditions
	 * through conditionals, implications and short-circuiting operators.
	 */
	private class Scanner extends AbstractExpressionFold<Void> {
		private final ArrayList<Expr> assumptions;
		private final DiagnosticBag diagnostics;

		public Scanner(List<Expr> assumptions, DiagnosticBag diagnostics) {
			this.assumptions = new ArrayList<>(assumptions);
			this.diagnostics = diagnostics;
		}

		@Override
		protected Void visitBinary(Expr.Binary expr) {
			switch (expr.getOperator()) {
			case AND:
				visitExpression(expr.getLeftHandSide());
				visitUnder(expr.getLeftHandSide(), expr.getRightHandSide());
				break;
			case OR:
				visitExpression(expr.getLeftHandSide());
				visitUnder(BoundModule.NOT(expr.getLeftHandSide()), expr.getRightHandSide());
				break;
			default:
				super.visitBinary(expr);
			}
			checkBinary(expr, assumptions, diagnostics);
			return null;
		}

		@Override
		protected Void visitUnary(Expr.Unary expr) {
			super.visitUnary(expr);
			checkUnary(expr, assumptions, diagnostics);
			return null;
		}

		@Override
		protected Void visitInvoke(Expr.Invoke expr) {
			super.visitInvoke(expr);
			checkInvoke(expr, assumptions, diagnostics);
			return null;
		}

		@Override
		protected Void visitArrayAccess(Expr.ArrayAccess expr) {
			super.visitArrayAccess(expr);
			checkArrayAccess(expr, assumptions, diagnostics);
			return null;
		}

		@Override
		protected Void visitImplies(Expr.Implies expr) {
			visitExpression(expr.getLeftHandSide());
			visitUnder(expr.getLeftHandSide(), expr.getRightHandSide());
			return null;
		}

		@Override
		protected Void visitConditional(Expr.Conditional expr) {
			visitExpression(expr.getCondition());
			visitUnder(expr.getCondition(), expr.getTrueBranch());
			visitUnder(BoundModule.NOT(expr.getCondition()), expr.getFalseBranch());
			return null;
		}

		private void visitUnder(Expr assumption, Expr expr) {
			assumptions.add(assumption);
			visitExpression(expr);
			assumptions.remove(assumptions.size() - 1);
		}

		@Override
		public Void join(Void lhs, Void rhs) {
			return null;
		}

		@Override
		public Void BOTTOM() {
			return null;
		}
	}
}
