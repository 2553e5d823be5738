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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import calor.core.BoundModule;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Stmt;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.io.BoundExpressionPrinter;
import calor.util.AbstractStatementVisitor;
import calor.util.SmtSolver;

/**
 * Attempts to synthesise and prove an invariant for every loop in a function,
 * including nested loops, reporting the outcome of each attempt.
 *
 * @author The Calor Project Developers
 *
 */
public class LoopAnalysisRunner {
	private static final Logger logger = LoggerFactory.getLogger(LoopAnalysisRunner.class);

	private final DiagnosticBag diagnostics;
	private final KInductionProver prover;

	public LoopAnalysisRunner(DiagnosticBag diagnostics, KInductionOptions options, SmtSolver solver) {
		if (diagnostics == null) {
			throw new NullPointerException("diagnostics");
		}
		this.diagnostics = diagnostics;
		this.prover = new KInductionProver(solver, options);
	}

	public int analyzeModule(BoundModule module) {
		int proven = 0;
		for (Function f : module.getFunctions()) {
			proven += analyzeFunction(f);
		}
		return proven;
	}

	/**
	 * Analyze every loop of a function.
	 *
	 * @param function
	 * @return The number of loops for which an invariant was proven.
	 */
	public int analyzeFunction(Function function) {
		final int[] proven = new int[1];
		new AbstractStatementVisitor<Void>() {
			@Override
			protected void visitFor(Stmt.For s, Void context) {
				proven[0] += analyzeLoop(s);
				super.visitFor(s, context);
			}

			@Override
			protected void visitWhile(Stmt.While s, Void context) {
				proven[0] += analyzeLoop(s);
				super.visitWhile(s, context);
			}
		}.visitStatements(function.getBody(), null);
		return proven[0];
	}

	private int analyzeLoop(Stmt.Loop loop) {
		KInductionResult result = prover.synthesizeAndProve(loop);
		logger.debug("loop at {}: {} in {}ms", loop.getSpan(), result, result.getDuration().toMillis());
		if (result.isProven()) {
			diagnostics.reportInfo(loop.getSpan(), DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED, "Loop invariant proven: "
					+ BoundExpressionPrinter.toString(result.getInvariant()) + " (k=" + result.getK() + ")");
			return 1;
		} else if (result.getInvariant() != null) {
			diagnostics.reportInfo(loop.getSpan(), DiagnosticCode.LOOP_INVARIANT_UNKNOWN,
					"Could not prove loop invariant: " + BoundExpressionPrinter.toString(result.getInvariant()));
		}
		return 0;
	}
}
