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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Expr.BinaryOperator;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Stmt;
import calor.core.Diagnostic;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.util.SmtSolver;

public class LoopAnalysisRunnerTest {

	private static final SmtSolver ALWAYS_UNSAT = new SmtSolver() {
		@Override
		public boolean isAvailable() {
			return true;
		}

		@Override
		public Result checkSat(List<Expr> assertions, int timeoutMs) {
			return Result.UNSAT;
		}
	};

	private static Stmt.While countUp(int line) {
		return loop(bin(BinaryOperator.LT, var("i"), i(10)), Collections.<Expr>emptyList(), line,
				bind(intVar("i"), bin(BinaryOperator.ADD, var("i"), i(1)), line + 1));
	}

	@Test
	public void nullDiagnostics() {
		assertThrows(NullPointerException.class,
				() -> new LoopAnalysisRunner(null, KInductionOptions.defaults(), SmtSolver.NONE));
	}

	@Test
	public void provenInvariantReported() {
		Function f = function("f").body(bind(intVar("i"), i(0), 1), countUp(2)).build();
		DiagnosticBag bag = new DiagnosticBag();
		int n = new LoopAnalysisRunner(bag, KInductionOptions.defaults(), ALWAYS_UNSAT).analyzeFunction(f);
		assertEquals(1, n);
		assertEquals(1, bag.size());
		Diagnostic d = bag.get(0);
		assertEquals(DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED, d.getCode());
		assertEquals(Diagnostic.Severity.INFO, d.getSeverity());
		assertEquals("Loop invariant proven: i <= 10 (k=1)", d.getMessage());
		assertEquals(span(2), d.getSpan());
	}

	@Test
	public void unprovenInvariantReported() {
		Function f = function("f").body(countUp(2)).build();
		DiagnosticBag bag = new DiagnosticBag();
		int n = new LoopAnalysisRunner(bag, KInductionOptions.defaults(), SmtSolver.NONE).analyzeFunction(f);
		assertEquals(0, n);
		assertEquals(1, bag.size());
		assertEquals(DiagnosticCode.LOOP_INVARIANT_UNKNOWN, bag.get(0).getCode());
		assertTrue(bag.get(0).getMessage().startsWith("Could not prove loop invariant: "));
	}

	@Test
	public void noCandidatesNoDiagnostic() {
		Function f = function("f").body(countUp(2)).build();
		DiagnosticBag bag = new DiagnosticBag();
		KInductionOptions options = KInductionOptions.defaults().setUseInvariantTemplates(false);
		new LoopAnalysisRunner(bag, options, ALWAYS_UNSAT).analyzeFunction(f);
		assertTrue(bag.isEmpty());
	}

	@Test
	public void nestedLoops() {
		Stmt outer = loop(intVar("j"), i(0), i(4), null, 2, countUp(3));
		Function f = function("f").body(outer).build();
		DiagnosticBag bag = new DiagnosticBag();
		assertEquals(2, new LoopAnalysisRunner(bag, KInductionOptions.defaults(), ALWAYS_UNSAT).analyzeFunction(f));
		assertEquals(2, bag.count(0, DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED));
	}

	@Test
	public void wholeModule() {
		Function f = function("f").body(countUp(2)).build();
		Function g = function("g").body(call("print", 2, i(1))).build();
		DiagnosticBag bag = new DiagnosticBag();
		assertEquals(1, new LoopAnalysisRunner(bag, KInductionOptions.defaults(), ALWAYS_UNSAT)
				.analyzeModule(module(f, g)));
	}
}
