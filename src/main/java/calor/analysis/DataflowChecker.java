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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Stmt;
import calor.core.BoundModule.Variable;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.util.AbstractExpressionFold;
import calor.util.AbstractStatementVisitor;
import calor.util.VariableExtractor;

/**
 * Simple checks over the structured body of a function for reads of variables
 * which may not have been assigned, and for stores which are never read.
 *
 * @author The Calor Project Developers
 *
 */
public class DataflowChecker {

	/**
	 * Check a function, reporting any issues found.
	 *
	 * @param function
	 * @param diagnostics
	 * @return The number of issues reported.
	 */
	public int check(Function function, DiagnosticBag diagnostics) {
		int before = diagnostics.size();
		checkUninitialised(function, diagnostics);
		checkDeadStores(function, diagnostics);
		return diagnostics.size() - before;
	}

	// =========================================================================
	// Uninitialised variables
	// =========================================================================

	private void checkUninitialised(Function function, DiagnosticBag diagnostics) {
		HashSet<String> assigned = new HashSet<>();
		for (Variable p : function.getParameters()) {
			assigned.add(p.getName());
		}
		new DefiniteAssignment(diagnostics).check(function.getBody(), assigned);
	}

	/**
	 * Tracks the set of definitely assigned variables through the body. Only
	 * variables declared without an initialiser are ever reported, since every
	 * other variable is assigned on declaration.
	 */
	private static class DefiniteAssignment {
		private final DiagnosticBag diagnostics;
		private final Set<String> declared = new HashSet<>();
		private final Set<String> reported = new HashSet<>();

		public DefiniteAssignment(DiagnosticBag diagnostics) {
			this.diagnostics = diagnostics;
		}

		/**
		 * Check a block of statements starting from a given set of definitely
		 * assigned variables. The set is updated in place to reflect what is
		 * assigned at the end of the block.
		 */
		public void check(List<Stmt> block, Set<String> assigned) {
			for (Stmt s : block) {
				check(s, assigned);
			}
		}

		private void check(Stmt s, Set<String> assigned) {
			if (s instanceof Stmt.Bind) {
				Stmt.Bind b = (Stmt.Bind) s;
				String name = b.getVariable().getName();
				if (b.getInitializer() == null) {
					declared.add(name);
					assigned.remove(name);
				} else {
					read(b.getInitializer(), assigned);
					assigned.add(name);
				}
			} else if (s instanceof Stmt.Call) {
				for (Expr arg : ((Stmt.Call) s).getArguments()) {
					read(arg, assigned);
				}
			} else if (s instanceof Stmt.Return) {
				Stmt.Return r = (Stmt.Return) s;
				if (r.getOperand() != null) {
					read(r.getOperand(), assigned);
				}
			} else if (s instanceof Stmt.IfElse) {
				checkIfElse((Stmt.IfElse) s, assigned);
			} else if (s instanceof Stmt.For) {
				Stmt.For f = (Stmt.For) s;
				read(f.getFrom(), assigned);
				read(f.getTo(), assigned);
				if (f.getStep() != null) {
					read(f.getStep(), assigned);
				}
				HashSet<String> body = new HashSet<>(assigned);
				body.add(f.getVariable().getName());
				check(f.getBody(), body);
			} else if (s instanceof Stmt.While) {
				Stmt.While w = (Stmt.While) s;
				read(w.getCondition(), assigned);
				check(w.getBody(), new HashSet<>(assigned));
			} else {
				throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
			}
		}

		private void checkIfElse(Stmt.IfElse s, Set<String> assigned) {
			read(s.getCondition(), assigned);
			HashSet<String> result = new HashSet<>(assigned);
			check(s.getTrueBranch(), result);
			for (Stmt.ElseIf elseIf : s.getElseIfs()) {
				read(elseIf.getCondition(), assigned);
				HashSet<String> branch = new HashSet<>(assigned);
				check(elseIf.getBody(), branch);
				result.retainAll(branch);
			}
			if (s.getFalseBranch() != null) {
				HashSet<String> branch = new HashSet<>(assigned);
				check(s.getFalseBranch(), branch);
				result.retainAll(branch);
			} else {
				result.retainAll(assigned);
			}
			assigned.clear();
			assigned.addAll(result);
		}

		private void read(Expr e, Set<String> assigned) {
			for (Expr.VariableAccess access : new AccessExtractor().visitExpression(e)) {
				String name = access.getVariable().getName();
				if (declared.contains(name) && !assigned.contains(name) && reported.add(name)) {
					diagnostics.reportWarning(access.getSpan(), DiagnosticCode.UNINITIALIZED_VARIABLE,
							"Variable '" + name + "' may be used before it is assigned");
				}
			}
		}
	}

	/**
	 * Collects every variable access in an expression, in order.
	 */
	private static class AccessExtractor extends AbstractExpressionFold<List<Expr.VariableAccess>> {
		@Override
		protected List<Expr.VariableAccess> constructVariableAccess(Expr.VariableAccess expr) {
			return Collections.singletonList(expr);
		}

		@Override
		public List<Expr.VariableAccess> join(List<Expr.VariableAccess> lhs, List<Expr.VariableAccess> rhs) {
			if (lhs.isEmpty()) {
				return rhs;
			} else if (rhs.isEmpty()) {
				return lhs;
			}
			ArrayList<Expr.VariableAccess> result = new ArrayList<>(lhs);
			result.addAll(rhs);
			return result;
		}

		@Override
		public List<Expr.VariableAccess> BOTTOM() {
			return Collections.emptyList();
		}
	}

	// =========================================================================
	// Dead stores
	// =========================================================================

	private void checkDeadStores(Function function, DiagnosticBag diagnostics) {
		final HashSet<String> read = new HashSet<>();
		for (Expr e : function.getPreconditions()) {
			read.addAll(VariableExtractor.extract(e));
		}
		for (Expr e : function.getPostconditions()) {
			read.addAll(VariableExtractor.extract(e));
		}
		new AbstractStatementVisitor<Void>() {
			@Override
			protected void visitFor(Stmt.For s, Void context) {
				visitInvariants(s.getInvariants());
				super.visitFor(s, context);
			}

			@Override
			protected void visitWhile(Stmt.While s, Void context) {
				visitInvariants(s.getInvariants());
				super.visitWhile(s, context);
			}

			private void visitInvariants(List<Expr> invariants) {
				for (Expr e : invariants) {
					read.addAll(VariableExtractor.extract(e));
				}
			}

			@Override
			protected void visitExpression(Expr expr, Void context) {
				read.addAll(VariableExtractor.extract(expr));
			}
		}.visitStatements(function.getBody(), null);
		//
		final HashSet<String> parameters = new HashSet<>();
		for (Variable p : function.getParameters()) {
			parameters.add(p.getName());
		}
		new AbstractStatementVisitor<Void>() {
			@Override
			protected void visitBind(Stmt.Bind s, Void context) {
				String name = s.getVariable().getName();
				if (s.getInitializer() != null && !read.contains(name) && !parameters.contains(name)
						&& !name.startsWith("_")) {
					diagnostics.reportWarning(s.getSpan(), DiagnosticCode.DEAD_STORE,
							"Value assigned to '" + name + "' is never used");
				}
			}
		}.visitStatements(function.getBody(), null);
	}
}
