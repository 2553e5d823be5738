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

import static calor.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.junit.jupiter.api.Test;

import calor.core.BoundModule;
import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Expr.BinaryOperator;
import calor.core.BoundModule.Stmt;
import calor.loops.KInductionResult.Status;
import calor.simplify.StructuralEquality;
import calor.util.SmtSolver;
import calor.util.VariableExtractor;
import calor.util.Z3Solver;

public class KInductionProverTest {

	/**
	 * Answers queries from a script, falling back to a default once the script
	 * is exhausted.
	 */
	private static class ScriptedSolver implements SmtSolver {
		private final Deque<Result> script;
		private final Result otherwise;
		private final List<List<Expr>> queries = new ArrayList<>();

		public ScriptedSolver(Result otherwise, Result... script) {
			this.script = new ArrayDeque<>(Arrays.asList(script));
			this.otherwise = otherwise;
		}

		@Override
		public boolean isAvailable() {
			return true;
		}

		@Override
		public Result checkSat(List<Expr> assertions, int timeoutMs) {
			queries.add(assertions);
			return script.isEmpty() ? otherwise : script.poll();
		}
	}

	private static Stmt.While countUp() {
		return loop(bin(BinaryOperator.LT, var("i"), i(10)), Collections.<Expr>emptyList(), 2,
				bind(intVar("i"), bin(BinaryOperator.ADD, var("i"), i(1)), 3));
	}

	private static Stmt.For forLoop() {
		return loop(intVar("i"), i(0), i(9), null, 2, call("print", 3, var("i")));
	}

	@Test
	public void nullSolver() {
		assertThrows(NullPointerException.class, () -> new KInductionProver(null));
	}

	@Test
	public void unavailableSolver() {
		KInductionResult r = new KInductionProver(SmtSolver.NONE).proveInvariant(countUp(),
				bin(BinaryOperator.LTEQ, var("i"), i(10)));
		assertEquals(Status.UNKNOWN, r.getStatus());
	}

	@Test
	public void provenAtDepthOne() {
		ScriptedSolver solver = new ScriptedSolver(SmtSolver.Result.UNSAT);
		KInductionResult r = new KInductionProver(solver).proveInvariant(countUp(),
				bin(BinaryOperator.LTEQ, var("i"), i(10)));
		assertTrue(r.isProven());
		assertEquals(1, r.getK());
		// base case then one inductive step
		assertEquals(2, solver.queries.size());
		assertTrue(VariableExtractor.extract(BoundModule.AND(solver.queries.get(1))).containsAll(
				Arrays.asList("i@0", "i@1")));
	}

	@Test
	public void provenAtDepthTwo() {
		ScriptedSolver solver = new ScriptedSolver(SmtSolver.Result.UNSAT, SmtSolver.Result.UNSAT,
				SmtSolver.Result.SAT);
		KInductionResult r = new KInductionProver(solver).proveInvariant(countUp(),
				bin(BinaryOperator.LTEQ, var("i"), i(10)));
		assertTrue(r.isProven());
		assertEquals(2, r.getK());
		assertTrue(VariableExtractor.extract(BoundModule.AND(solver.queries.get(2))).contains("i@2"));
	}

	@Test
	public void disprovenAtEntry() {
		KInductionResult r = new KInductionProver(new ScriptedSolver(SmtSolver.Result.SAT))
				.proveInvariant(countUp(), bin(BinaryOperator.GTEQ, var("i"), i(0)));
		assertEquals(Status.DISPROVEN, r.getStatus());
		assertEquals(1, r.getK());
	}

	@Test
	public void depthExhausted() {
		ScriptedSolver solver = new ScriptedSolver(SmtSolver.Result.SAT, SmtSolver.Result.UNSAT);
		KInductionOptions options = KInductionOptions.defaults().setMaxK(3);
		KInductionResult r = new KInductionProver(solver, options).proveInvariant(countUp(),
				bin(BinaryOperator.LTEQ, var("i"), i(10)));
		assertEquals(Status.UNKNOWN, r.getStatus());
		assertEquals(3, r.getK());
		assertEquals(4, solver.queries.size());
	}

	@Test
	public void unrecognisedCondition() {
		Stmt.While w = loop(bool("more"), Collections.<Expr>emptyList(), 2,
				bind(intVar("i"), bin(BinaryOperator.ADD, var("i"), i(1)), 3));
		KInductionResult r = new KInductionProver(new ScriptedSolver(SmtSolver.Result.UNSAT)).proveInvariant(w,
				bin(BinaryOperator.GTEQ, var("i"), i(0)));
		assertEquals(Status.UNKNOWN, r.getStatus());
	}

	@Test
	public void unrecognisedUpdate() {
		Stmt.While w = loop(bin(BinaryOperator.LT, var("i"), i(10)), Collections.<Expr>emptyList(), 2,
				bind(intVar("i"), bin(BinaryOperator.MUL, var("i"), i(2)), 3));
		KInductionResult r = new KInductionProver(new ScriptedSolver(SmtSolver.Result.UNSAT)).proveInvariant(w,
				bin(BinaryOperator.LTEQ, var("i"), i(10)));
		assertEquals(Status.UNKNOWN, r.getStatus());
	}

	@Test
	public void invariantOverModifiedVariable() {
		Stmt.While w = loop(bin(BinaryOperator.LT, var("i"), i(10)), Collections.<Expr>emptyList(), 2,
				bind(intVar("s"), bin(BinaryOperator.ADD, var("s"), i(1)), 3),
				bind(intVar("i"), bin(BinaryOperator.ADD, var("i"), i(1)), 4));
		ScriptedSolver solver = new ScriptedSolver(SmtSolver.Result.UNSAT);
		KInductionResult r = new KInductionProver(solver).proveInvariant(w,
				bin(BinaryOperator.LTEQ, var("i"), var("s")));
		assertEquals(Status.UNSUPPORTED, r.getStatus());
		assertTrue(solver.queries.isEmpty());
	}

	@Test
	public void forLoopWithVariableBound() {
		Stmt.For f = loop(intVar("i"), i(0), var("n"), null, 2, call("print", 3, var("i")));
		KInductionResult r = new KInductionProver(new ScriptedSolver(SmtSolver.Result.UNSAT)).proveInvariant(f,
				bin(BinaryOperator.GTEQ, var("i"), i(0)));
		assertEquals(Status.UNSUPPORTED, r.getStatus());
	}

	@Test
	public void forLoopWithZeroStep() {
		Stmt.For f = loop(intVar("i"), i(0), i(9), i(0), 2, call("print", 3, var("i")));
		KInductionResult r = new KInductionProver(new ScriptedSolver(SmtSolver.Result.UNSAT)).proveInvariant(f,
				bin(BinaryOperator.GTEQ, var("i"), i(0)));
		assertEquals(Status.UNSUPPORTED, r.getStatus());
	}

	@Test
	public void forLoopEntry() {
		ScriptedSolver solver = new ScriptedSolver(SmtSolver.Result.UNSAT);
		KInductionResult r = new KInductionProver(solver).proveInvariant(forLoop(),
				bin(BinaryOperator.GTEQ, var("i"), i(0)));
		assertTrue(r.isProven());
		List<Expr> base = solver.queries.get(0);
		assertEquals(2, base.size());
		assertTrue(StructuralEquality.equal(bin(BinaryOperator.EQ, BoundModule.VAR(intVar("i@0")), i(0)),
				base.get(0)));
	}

	@Test
	public void forLoopStepLeavesLastStateUnbounded() {
		ScriptedSolver solver = new ScriptedSolver(SmtSolver.Result.UNSAT);
		new KInductionProver(solver).proveInvariant(forLoop(), bin(BinaryOperator.GTEQ, var("i"), i(0)));
		// i@0 <= 9, invariant at 0, transition, negated invariant at 1
		List<Expr> step = solver.queries.get(1);
		assertEquals(4, step.size());
		assertTrue(StructuralEquality.equal(bin(BinaryOperator.LTEQ, BoundModule.VAR(intVar("i@0")), i(9)),
				step.get(0)));
	}

	@Test
	public void synthesisWithoutTemplates() {
		KInductionOptions options = KInductionOptions.defaults().setUseInvariantTemplates(false);
		KInductionResult r = new KInductionProver(new ScriptedSolver(SmtSolver.Result.UNSAT), options)
				.synthesizeAndProve(countUp());
		assertEquals(Status.UNKNOWN, r.getStatus());
		assertNull(r.getInvariant());
	}

	@Test
	public void synthesisReturnsFirstProven() {
		KInductionResult r = new KInductionProver(new ScriptedSolver(SmtSolver.Result.UNSAT))
				.synthesizeAndProve(countUp());
		assertTrue(r.isProven());
		assertTrue(StructuralEquality.equal(bin(BinaryOperator.LTEQ, var("i"), i(10)), r.getInvariant()));
	}

	@Test
	public void synthesisFailureGivesStrongest() {
		KInductionResult r = new KInductionProver(SmtSolver.NONE).synthesizeAndProve(countUp());
		assertEquals(Status.UNKNOWN, r.getStatus());
		assertNotNull(r.getInvariant());
	}

	@Test
	public void invalidOptions() {
		assertThrows(IllegalArgumentException.class, () -> KInductionOptions.defaults().setMaxK(0));
		assertThrows(IllegalArgumentException.class, () -> KInductionOptions.defaults().setTimeoutMs(-1));
	}

	// ======================================================================
	// Z3
	// ======================================================================

	@Test
	public void z3ProvesUpperBound() {
		Z3Solver z3 = new Z3Solver();
		assumeTrue(z3.isAvailable());
		KInductionResult r = new KInductionProver(z3).proveInvariant(countUp(),
				bin(BinaryOperator.LTEQ, var("i"), i(10)));
		assertEquals(Status.PROVEN, r.getStatus());
	}

	@Test
	public void z3DisprovesUnknownLowerBound() {
		Z3Solver z3 = new Z3Solver();
		assumeTrue(z3.isAvailable());
		KInductionResult r = new KInductionProver(z3).proveInvariant(countUp(),
				bin(BinaryOperator.GTEQ, var("i"), i(0)));
		assertEquals(Status.DISPROVEN, r.getStatus());
	}

	@Test
	public void z3ProvesForLoopBounds() {
		Z3Solver z3 = new Z3Solver();
		assumeTrue(z3.isAvailable());
		// the loop variable reaches 10 on exit
		Expr inv = BoundModule.AND(bin(BinaryOperator.LTEQ, i(0), var("i")), bin(BinaryOperator.LTEQ, var("i"), i(10)));
		assertTrue(new KInductionProver(z3).proveInvariant(forLoop(), inv).isProven());
	}

	@Test
	public void z3InclusiveBoundFailsOnExit() {
		Z3Solver z3 = new Z3Solver();
		assumeTrue(z3.isAvailable());
		KInductionOptions options = KInductionOptions.defaults().setMaxK(3);
		KInductionResult r = new KInductionProver(z3, options).proveInvariant(forLoop(),
				bin(BinaryOperator.LTEQ, var("i"), i(9)));
		assertFalse(r.isProven());
	}

	@Test
	public void z3DisprovesForLoopInvariant() {
		Z3Solver z3 = new Z3Solver();
		assumeTrue(z3.isAvailable());
		KInductionResult r = new KInductionProver(z3).proveInvariant(forLoop(),
				bin(BinaryOperator.GTEQ, var("i"), i(5)));
		assertEquals(Status.DISPROVEN, r.getStatus());
	}

	@Test
	public void z3Synthesis() {
		Z3Solver z3 = new Z3Solver();
		assumeTrue(z3.isAvailable());
		assertTrue(new KInductionProver(z3).synthesizeAndProve(forLoop()).isProven());
	}
}
