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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Stmt;
import calor.core.BoundModule.Types;
import calor.core.BoundModule.Variable;
import calor.io.BoundExpressionPrinter;
import calor.loops.KInductionResult.Status;
import calor.loops.WhileConditionAnalyzer.TransitionInfo;
import calor.loops.WhileConditionAnalyzer.WhileLoopInfo;
import calor.util.AbstractExpressionTransform;
import calor.util.SmtSolver;
import calor.util.VariableExtractor;

/**
 * Proves loop invariants by k-induction over a simple model of the loop, in
 * which the loop variable is stepped by a constant on each iteration. The
 * value of the loop variable after <code>i</code> iterations is represented
 * by a fresh variable <code>v@i</code>. For a given depth <code>k</code>, the
 * prover checks:
 *
 * <ul>
 * <li><b>Base case</b>. The invariant holds for every value permitted on
 * entry to the loop. A counterexample here disproves the invariant.</li>
 * <li><b>Inductive step</b>. If the guard and invariant hold for
 * <code>k</code> consecutive iterations, then the invariant holds on the next
 * iteration where the guard still holds.</li>
 * </ul>
 *
 * Depths from one up to the configured maximum are tried in turn. Other
 * variables appearing in an invariant are treated as constants, provided the
 * loop body does not modify them. A solver which is unavailable, or which
 * cannot decide a query, simply leaves the invariant unproven.
 *
 * @author The Calor Project Developers
 *
 */
public class KInductionProver {
	private static final Logger logger = LoggerFactory.getLogger(KInductionProver.class);

	private final SmtSolver solver;
	private final KInductionOptions options;

	public KInductionProver(SmtSolver solver) {
		this(solver, KInductionOptions.defaults());
	}

	public KInductionProver(SmtSolver solver, KInductionOptions options) {
		if (solver == null) {
			throw new NullPointerException("solver");
		}
		this.solver = solver;
		this.options = options == null ? KInductionOptions.defaults() : options;
	}

	// =========================================================================
	// While loops
	// =========================================================================

	public KInductionResult proveInvariant(Stmt.While loop, Expr invariant) {
		long start = System.nanoTime();
		WhileLoopInfo info = WhileConditionAnalyzer.analyze(loop.getCondition());
		if (info == null || !info.isAnalyzable()) {
			return result(Status.UNKNOWN, 0, invariant, "loop condition not recognised", start);
		}
		String v = info.getLoopVariable();
		TransitionInfo transition = WhileConditionAnalyzer.analyzeTransition(loop.getBody(), v);
		if (transition == null || !transition.isWellFormed()) {
			return result(Status.UNKNOWN, 0, invariant, "loop variable update not recognised", start);
		}
		LoopContext context = WhileConditionAnalyzer.createLoopContext(loop, info, transition);
		if (!isEncodable(invariant, v, context)) {
			return result(Status.UNSUPPORTED, 0, invariant, "invariant depends on variables modified by the loop",
					start);
		}
		// Base case
		ArrayList<Expr> entry = new ArrayList<>();
		if (info.getLowerBound() != null) {
			entry.add(compare(Expr.BinaryOperator.GTEQ, at(v, 0), info.getLowerBound()));
		}
		if (info.getUpperBound() != null) {
			entry.add(compare(Expr.BinaryOperator.LTEQ, at(v, 0), info.getUpperBound()));
		}
		KInductionResult base = checkBase(entry, invariant, v, start);
		if (base != null) {
			return base;
		}
		// Inductive step
		int step = transition.getStep();
		for (int k = 1; k <= options.getMaxK(); ++k) {
			ArrayList<Expr> query = new ArrayList<>();
			for (int i = 0; i < k; ++i) {
				addIfPresent(query, buildLoopCondition(info, at(v, i)));
				query.add(rename(invariant, v, i));
				query.add(transition(v, i, step));
			}
			addIfPresent(query, buildLoopCondition(info, at(v, k)));
			query.add(BoundModule.NOT(rename(invariant, v, k)));
			if (check(query) == SmtSolver.Result.UNSAT) {
				return result(Status.PROVEN, k, invariant, null, start);
			}
		}
		return result(Status.UNKNOWN, options.getMaxK(), invariant, "not proven", start);
	}

	/**
	 * Encode the condition of a while loop for a given value of its loop
	 * variable.
	 *
	 * @return The encoding, or <code>null</code> if the relevant bound is
	 *         unknown.
	 */
	private static Expr buildLoopCondition(WhileLoopInfo info, Expr v) {
		Integer lower = info.getLowerBound();
		Integer upper = info.getUpperBound();
		switch (info.getConditionOperator()) {
		case LT:
			return upper == null ? null : compare(Expr.BinaryOperator.LT, v, upper);
		case LTEQ:
			return upper == null ? null : compare(Expr.BinaryOperator.LTEQ, v, upper);
		case GT:
			return lower == null ? null : compare(Expr.BinaryOperator.GT, v, lower - 1);
		case GTEQ:
			return lower == null ? null : compare(Expr.BinaryOperator.GTEQ, v, lower);
		case NEQ:
			return upper == null ? null : compare(Expr.BinaryOperator.NEQ, v, upper);
		default:
			return null;
		}
	}

	// =========================================================================
	// For loops
	// =========================================================================

	public KInductionResult proveInvariant(Stmt.For loop, Expr invariant) {
		long start = System.nanoTime();
		Integer from = WhileConditionAnalyzer.intOf(loop.getFrom());
		Integer to = WhileConditionAnalyzer.intOf(loop.getTo());
		Integer step = loop.getStep() == null ? Integer.valueOf(1) : WhileConditionAnalyzer.intOf(loop.getStep());
		if (from == null || to == null || step == null || step <= 0) {
			return result(Status.UNSUPPORTED, 0, invariant, "loop bounds are not constant", start);
		}
		String v = loop.getVariable().getName();
		if (!isEncodable(invariant, v, WhileConditionAnalyzer.createLoopContext(loop))) {
			return result(Status.UNSUPPORTED, 0, invariant, "invariant depends on variables modified by the loop",
					start);
		}
		ArrayList<Expr> entry = new ArrayList<>();
		entry.add(compare(Expr.BinaryOperator.EQ, at(v, 0), from));
		KInductionResult base = checkBase(entry, invariant, v, start);
		if (base != null) {
			return base;
		}
		for (int k = 1; k <= options.getMaxK(); ++k) {
			ArrayList<Expr> query = new ArrayList<>();
			for (int i = 0; i < k; ++i) {
				query.add(compare(Expr.BinaryOperator.LTEQ, at(v, i), to));
				query.add(rename(invariant, v, i));
				query.add(transition(v, i, step));
			}
			query.add(BoundModule.NOT(rename(invariant, v, k)));
			if (check(query) == SmtSolver.Result.UNSAT) {
				return result(Status.PROVEN, k, invariant, null, start);
			}
		}
		return result(Status.UNKNOWN, options.getMaxK(), invariant, "not proven", start);
	}

	// =========================================================================
	// Synthesis
	// =========================================================================

	/**
	 * Try each candidate invariant for a loop in turn, followed by their
	 * conjunction, returning the first which is proven.
	 *
	 * @param loop
	 * @return
	 */
	public KInductionResult synthesizeAndProve(Stmt.Loop loop) {
		long start = System.nanoTime();
		LoopContext context = contextOf(loop);
		List<Expr> candidates = options.isUseInvariantTemplates() ? InvariantTemplates.synthesizeInvariants(context)
				: new ArrayList<Expr>();
		for (Expr candidate : candidates) {
			KInductionResult r = prove(loop, candidate);
			logger.debug("candidate {}: {}", BoundExpressionPrinter.toString(candidate), r.getStatus());
			if (r.isProven()) {
				return r;
			}
		}
		if (candidates.size() > 1) {
			KInductionResult r = prove(loop, BoundModule.AND(candidates));
			if (r.isProven()) {
				return r;
			}
		}
		Expr strongest = candidates.isEmpty() ? null : BoundModule.AND(candidates);
		return result(Status.UNKNOWN, options.getMaxK(), strongest, "no candidate invariant proven", start);
	}

	public KInductionResult prove(Stmt.Loop loop, Expr invariant) {
		if (loop instanceof Stmt.While) {
			return proveInvariant((Stmt.While) loop, invariant);
		} else if (loop instanceof Stmt.For) {
			return proveInvariant((Stmt.For) loop, invariant);
		} else {
			throw new IllegalArgumentException("unknown loop encountered (" + loop.getClass().getName() + ")");
		}
	}

	private static LoopContext contextOf(Stmt.Loop loop) {
		if (loop instanceof Stmt.While) {
			Stmt.While w = (Stmt.While) loop;
			WhileLoopInfo info = WhileConditionAnalyzer.analyze(w.getCondition());
			TransitionInfo transition = info == null || info.getLoopVariable() == null ? null
					: WhileConditionAnalyzer.analyzeTransition(w.getBody(), info.getLoopVariable());
			return WhileConditionAnalyzer.createLoopContext(w, info, transition);
		} else if (loop instanceof Stmt.For) {
			return WhileConditionAnalyzer.createLoopContext((Stmt.For) loop);
		} else {
			throw new IllegalArgumentException("unknown loop encountered (" + loop.getClass().getName() + ")");
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private KInductionResult checkBase(List<Expr> entry, Expr invariant, String v, long start) {
		ArrayList<Expr> query = new ArrayList<>(entry);
		query.add(BoundModule.NOT(rename(invariant, v, 0)));
		SmtSolver.Result r = check(query);
		if (r == SmtSolver.Result.SAT) {
			return result(Status.DISPROVEN, 1, invariant, "invariant fails at loop entry", start);
		} else if (r == SmtSolver.Result.UNKNOWN) {
			return result(Status.UNKNOWN, 0, invariant, "base case undecided", start);
		}
		return null;
	}

	private SmtSolver.Result check(List<Expr> query) {
		if (!solver.isAvailable()) {
			return SmtSolver.Result.UNKNOWN;
		}
		return solver.checkSat(query, options.getTimeoutMs());
	}

	/**
	 * Check that every variable of the invariant other than the loop variable is
	 * left unchanged by the loop.
	 */
	private static boolean isEncodable(Expr invariant, String v, LoopContext context) {
		for (String name : VariableExtractor.extract(invariant)) {
			if (!name.equals(v) && context.getModifiedVariables().contains(name)) {
				return false;
			}
		}
		return true;
	}

	private static Expr at(String v, int i) {
		return BoundModule.VAR(new Variable(v + "@" + i, Types.INT));
	}

	private static Expr compare(Expr.BinaryOperator op, Expr lhs, int rhs) {
		return BoundModule.COMPARE(op, lhs, BoundModule.CONST(rhs));
	}

	private static Expr transition(String v, int i, int step) {
		Expr next = BoundModule.ARITH(Expr.BinaryOperator.ADD, at(v, i), BoundModule.CONST(step));
		return BoundModule.COMPARE(Expr.BinaryOperator.EQ, at(v, i + 1), next);
	}

	private static Expr rename(Expr invariant, String v, int i) {
		return new Renamer(v, i).visitExpression(invariant);
	}

	private static void addIfPresent(List<Expr> query, Expr e) {
		if (e != null) {
			query.add(e);
		}
	}

	private static KInductionResult result(Status status, int k, Expr invariant, String explanation, long start) {
		return new KInductionResult(status, k, invariant, explanation, Duration.ofNanos(System.nanoTime() - start));
	}

	/**
	 * Replaces the loop variable with its value after a given number of
	 * iterations.
	 */
	private static class Renamer extends AbstractExpressionTransform {
		private final String variable;
		private final int iteration;

		public Renamer(String variable, int iteration) {
			this.variable = variable;
			this.iteration = iteration;
		}

		@Override
		protected Expr constructVariableAccess(Expr.VariableAccess expr) {
			if (expr.getVariable().getName().equals(variable)) {
				Variable renamed = new Variable(variable + "@" + iteration, Types.INT);
				return new Expr.VariableAccess(renamed, expr.getSpan());
			}
			return expr;
		}
	}
}
