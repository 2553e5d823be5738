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
package calor.loops;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Stmt;
import calor.core.BoundModule.Types;
import calor.core.BoundModule.Variable;
import calor.util.AbstractStatementVisitor;
import calor.util.VariableExtractor;

/**
 * Extracts the shape of simple loops: which variable a loop condition bounds,
 * by which integer constants, and how the body steps that variable. Only the
 * common forms are recognised, namely comparisons of a variable against an
 * integer literal (optionally conjoined) and updates of the form
 * <code>v = v + k</code>, <code>v = k + v</code> or <code>v = v - k</code>.
 *
 * @author The Calor Project Developers
 *
 */
public class WhileConditionAnalyzer {

	/**
	 * Describes the bounds a loop condition places on its loop variable. A
	 * strict lower bound is stored inclusively (i.e. <code>v &gt; 0</code> gives
	 * a lower bound of <code>1</code>).
	 */
	public static class WhileLoopInfo {
		private final String loopVariable;
		private final Integer lowerBound;
		private final Integer upperBound;
		private final boolean decrementing;
		private final Expr.BinaryOperator conditionOperator;
		private final Expr boundExpression;

		public WhileLoopInfo(String loopVariable, Integer lowerBound, Integer upperBound, boolean decrementing,
				Expr.BinaryOperator conditionOperator, Expr boundExpression) {
			this.loopVariable = loopVariable;
			this.lowerBound = lowerBound;
			this.upperBound = upperBound;
			this.decrementing = decrementing;
			this.conditionOperator = conditionOperator;
			this.boundExpression = boundExpression;
		}

		public String getLoopVariable() {
			return loopVariable;
		}

		public Integer getLowerBound() {
			return lowerBound;
		}

		public Integer getUpperBound() {
			return upperBound;
		}

		public boolean isDecrementing() {
			return decrementing;
		}

		public Expr.BinaryOperator getConditionOperator() {
			return conditionOperator;
		}

		public Expr getBoundExpression() {
			return boundExpression;
		}

		public boolean isAnalyzable() {
			return loopVariable != null && (lowerBound != null || upperBound != null);
		}

		@Override
		public String toString() {
			return loopVariable + " in [" + lowerBound + ", " + upperBound + "]" + (decrementing ? " (dec)" : "");
		}
	}

	public enum TransitionKind {
		ADD_CONSTANT, SUB_CONSTANT, UNKNOWN
	}

	/**
	 * Describes how a loop body updates its loop variable.
	 */
	public static class TransitionInfo {
		private final String variable;
		private final TransitionKind kind;
		private final Integer delta;

		public TransitionInfo(String variable, TransitionKind kind, Integer delta) {
			this.variable = variable;
			this.kind = kind;
			this.delta = delta;
		}

		public String getVariable() {
			return variable;
		}

		public TransitionKind getKind() {
			return kind;
		}

		public Integer getDelta() {
			return delta;
		}

		public boolean isWellFormed() {
			return kind != TransitionKind.UNKNOWN && delta != null;
		}

		/**
		 * Get the signed amount by which the variable changes on each
		 * iteration.
		 *
		 * @return
		 */
		public int getStep() {
			return kind == TransitionKind.SUB_CONSTANT ? -delta : delta;
		}
	}

	// =========================================================================
	// Conditions
	// =========================================================================

	/**
	 * Analyze a loop condition.
	 *
	 * @param condition
	 * @return The extracted bounds, or <code>null</code> if the condition has an
	 *         unrecognised shape.
	 */
	public static WhileLoopInfo analyze(Expr condition) {
		if (!(condition instanceof Expr.Binary)) {
			return null;
		}
		Expr.Binary b = (Expr.Binary) condition;
		Expr lhs = b.getLeftHandSide();
		Expr rhs = b.getRightHandSide();
		String var;
		Integer bound;
		switch (b.getOperator()) {
		case AND:
			return analyzeConjunction(analyze(lhs), analyze(rhs));
		case LT:
			var = variableOf(lhs);
			if (var != null) {
				return new WhileLoopInfo(var, null, intOf(rhs), false, Expr.BinaryOperator.LT, rhs);
			}
			var = variableOf(rhs);
			bound = intOf(lhs);
			if (var != null && bound != null) {
				return new WhileLoopInfo(var, successor(bound), null, true, Expr.BinaryOperator.LT, lhs);
			}
			return null;
		case LTEQ:
			var = variableOf(lhs);
			return var == null ? null
					: new WhileLoopInfo(var, null, intOf(rhs), false, Expr.BinaryOperator.LTEQ, rhs);
		case GT:
			var = variableOf(lhs);
			bound = intOf(rhs);
			return var == null ? null
					: new WhileLoopInfo(var, successor(bound), null, true, Expr.BinaryOperator.GT,
							rhs);
		case GTEQ:
			var = variableOf(lhs);
			return var == null ? null
					: new WhileLoopInfo(var, intOf(rhs), null, true, Expr.BinaryOperator.GTEQ, rhs);
		case NEQ: {
			boolean left = variableOf(lhs) != null;
			var = left ? variableOf(lhs) : variableOf(rhs);
			bound = intOf(lhs) != null ? intOf(lhs) : intOf(rhs);
			return var == null ? null
					: new WhileLoopInfo(var, null, bound, false, Expr.BinaryOperator.NEQ, left ? rhs : lhs);
		}
		default:
			return null;
		}
	}

	private static WhileLoopInfo analyzeConjunction(WhileLoopInfo left, WhileLoopInfo right) {
		if (left != null && right != null && left.getLoopVariable().equals(right.getLoopVariable())) {
			return new WhileLoopInfo(left.getLoopVariable(),
					left.getLowerBound() != null ? left.getLowerBound() : right.getLowerBound(),
					left.getUpperBound() != null ? left.getUpperBound() : right.getUpperBound(),
					left.isDecrementing() || right.isDecrementing(), left.getConditionOperator(),
					left.getBoundExpression() != null ? left.getBoundExpression() : right.getBoundExpression());
		}
		return left != null ? left : right;
	}

	// =========================================================================
	// Transitions
	// =========================================================================

	/**
	 * Find the first update of a given variable within a loop body, searching
	 * nested branches and loops.
	 *
	 * @param body
	 * @param variable
	 * @return The recognised update, or <code>null</code> if there is none.
	 */
	public static TransitionInfo analyzeTransition(List<Stmt> body, String variable) {
		for (Stmt s : body) {
			TransitionInfo t = analyzeTransition(s, variable);
			if (t != null) {
				return t;
			}
		}
		return null;
	}

	private static TransitionInfo analyzeTransition(Stmt s, String variable) {
		if (s instanceof Stmt.Bind) {
			Stmt.Bind b = (Stmt.Bind) s;
			return b.getVariable().getName().equals(variable) ? analyzeUpdate(b.getInitializer(), variable) : null;
		} else if (s instanceof Stmt.IfElse) {
			Stmt.IfElse i = (Stmt.IfElse) s;
			TransitionInfo t = analyzeTransition(i.getTrueBranch(), variable);
			for (int j = 0; t == null && j != i.getElseIfs().size(); ++j) {
				t = analyzeTransition(i.getElseIfs().get(j).getBody(), variable);
			}
			if (t == null && i.getFalseBranch() != null) {
				t = analyzeTransition(i.getFalseBranch(), variable);
			}
			return t;
		} else if (s instanceof Stmt.Loop) {
			return analyzeTransition(((Stmt.Loop) s).getBody(), variable);
		} else {
			return null;
		}
	}

	private static TransitionInfo analyzeUpdate(Expr init, String variable) {
		if (!(init instanceof Expr.Binary)) {
			return null;
		}
		Expr.Binary b = (Expr.Binary) init;
		if (variable.equals(variableOf(b.getLeftHandSide()))) {
			Integer delta = intOf(b.getRightHandSide());
			if (delta == null) {
				return null;
			} else if (b.getOperator() == Expr.BinaryOperator.ADD) {
				return new TransitionInfo(variable, TransitionKind.ADD_CONSTANT, delta);
			} else if (b.getOperator() == Expr.BinaryOperator.SUB) {
				return new TransitionInfo(variable, TransitionKind.SUB_CONSTANT, delta);
			}
		} else if (variable.equals(variableOf(b.getRightHandSide()))) {
			Integer delta = intOf(b.getLeftHandSide());
			if (delta != null && b.getOperator() == Expr.BinaryOperator.ADD) {
				return new TransitionInfo(variable, TransitionKind.ADD_CONSTANT, delta);
			}
		}
		return null;
	}

	// =========================================================================
	// Loop contexts
	// =========================================================================

	/**
	 * Summarise a while loop for invariant synthesis.
	 *
	 * @param loop
	 * @param info       bounds extracted from the condition, which may be
	 *                   <code>null</code>.
	 * @param transition update of the loop variable, which may be
	 *                   <code>null</code>.
	 * @return
	 */
	public static LoopContext createLoopContext(Stmt.While loop, WhileLoopInfo info, TransitionInfo transition) {
		Usage usage = new Usage();
		usage.visitStatements(loop.getBody(), null);
		boolean decrementing;
		if (transition != null && transition.isWellFormed()) {
			decrementing = transition.getStep() < 0;
		} else {
			decrementing = info != null && info.isDecrementing();
		}
		return new LoopContext(info == null ? null : info.getLoopVariable(),
				info == null ? null : info.getLowerBound(), info == null ? null : info.getUpperBound(), decrementing,
				new ArrayList<>(usage.modified), new ArrayList<>(usage.read), loop.getCondition());
	}

	/**
	 * Summarise a counting loop for invariant synthesis. The bounds are known
	 * only when they are integer literals.
	 *
	 * @param loop
	 * @return
	 */
	public static LoopContext createLoopContext(Stmt.For loop) {
		Usage usage = new Usage();
		usage.visitStatement(loop, null);
		Variable v = loop.getVariable();
		Variable var = new Variable(v.getName(), Types.INT);
		Expr condition = BoundModule.COMPARE(Expr.BinaryOperator.LTEQ, BoundModule.VAR(var), loop.getTo());
		return new LoopContext(v.getName(), intOf(loop.getFrom()), intOf(loop.getTo()), false,
				new ArrayList<>(usage.modified), new ArrayList<>(usage.read), condition);
	}

	/**
	 * Collects the variables written and read within a loop body.
	 */
	private static class Usage extends AbstractStatementVisitor<Void> {
		private final Set<String> modified = new LinkedHashSet<>();
		private final Set<String> read = new LinkedHashSet<>();

		@Override
		protected void visitBind(Stmt.Bind s, Void context) {
			modified.add(s.getVariable().getName());
			super.visitBind(s, context);
		}

		@Override
		protected void visitFor(Stmt.For s, Void context) {
			modified.add(s.getVariable().getName());
			super.visitFor(s, context);
		}

		@Override
		protected void visitExpression(Expr expr, Void context) {
			read.addAll(VariableExtractor.extract(expr));
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	static String variableOf(Expr e) {
		return e instanceof Expr.VariableAccess ? ((Expr.VariableAccess) e).getVariable().getName() : null;
	}

	/**
	 * Get the least integer above a strict lower bound, or <code>null</code> if
	 * there is none.
	 */
	static Integer successor(Integer bound) {
		return bound == null || bound == Integer.MAX_VALUE ? null : bound + 1;
	}

	static Integer intOf(Expr e) {
		return e instanceof Expr.IntLiteral ? ((Expr.IntLiteral) e).getValue() : null;
	}
}
