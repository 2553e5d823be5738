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
package calor.tasks;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import calor.analysis.BugPatternRunner;
import calor.analysis.DataflowChecker;
import calor.analysis.TaintAnalysisRunner;
import calor.core.BoundModule;
import calor.core.BoundModule.Function;
import calor.core.DiagnosticBag;
import calor.core.DiagnosticCode;
import calor.loops.LoopAnalysisRunner;
import calor.util.SmtSolver;
import calor.util.Z3Solver;

/**
 * Runs the enabled analyses over every function of a module, in declaration
 * order. Findings are reported to the diagnostic bag given on construction,
 * whilst the returned result only summarises how many were found. A failure
 * whilst analysing one function is logged and does not prevent the remaining
 * functions (or remaining analyses) from being run.
 *
 * @author The Calor Project Developers
 *
 */
public class VerificationAnalysisPass {
	private static final Logger logger = LoggerFactory.getLogger(VerificationAnalysisPass.class);

	private final DiagnosticBag diagnostics;
	private final VerificationOptions options;
	private final SmtSolver solver;

	public VerificationAnalysisPass(DiagnosticBag diagnostics) {
		this(diagnostics, VerificationOptions.defaults());
	}

	public VerificationAnalysisPass(DiagnosticBag diagnostics, VerificationOptions options) {
		this(diagnostics, options, new Z3Solver());
	}

	public VerificationAnalysisPass(DiagnosticBag diagnostics, VerificationOptions options, SmtSolver solver) {
		if (diagnostics == null) {
			throw new NullPointerException("diagnostics");
		}
		this.diagnostics = diagnostics;
		this.options = options == null ? VerificationOptions.defaults() : options;
		this.solver = solver == null ? SmtSolver.NONE : solver;
	}

	public VerificationAnalysisResult analyze(BoundModule module) {
		long start = System.nanoTime();
		SmtSolver smt = options.isUseZ3Verification() ? solver : SmtSolver.NONE;
		DataflowChecker dataflow = new DataflowChecker();
		BugPatternRunner bugs = new BugPatternRunner(diagnostics, options.getBugPatternOptions(), smt);
		TaintAnalysisRunner taint = new TaintAnalysisRunner(diagnostics, options.getTaintOptions());
		LoopAnalysisRunner loops = new LoopAnalysisRunner(diagnostics, options.getKInductionOptions(), smt);
		int dataflowIssues = 0;
		int bugPatternsFound = 0;
		int taintVulnerabilities = 0;
		int loopInvariants = 0;
		//
		for (Function function : module.getFunctions()) {
			String name = function.getName();
			if (options.isEnableDataflow()) {
				try {
					dataflowIssues += dataflow.check(function, diagnostics);
				} catch (RuntimeException e) {
					logger.warn("dataflow analysis of {} failed", name, e);
				}
			}
			if (options.isEnableBugPatterns()) {
				int before = diagnostics.size();
				try {
					bugs.checkFunction(function);
				} catch (RuntimeException e) {
					logger.warn("bug pattern analysis of {} failed", name, e);
				}
				bugPatternsFound += diagnostics.size() - before;
			}
			if (options.isEnableTaintAnalysis()) {
				try {
					taintVulnerabilities += taint.analyzeFunction(function).size();
				} catch (RuntimeException e) {
					logger.warn("taint analysis of {} failed", name, e);
				}
			}
			if (options.isEnableKInduction()) {
				int before = diagnostics.size();
				try {
					loops.analyzeFunction(function);
				} catch (RuntimeException e) {
					logger.warn("loop analysis of {} failed", name, e);
				}
				loopInvariants += diagnostics.count(before, DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED);
			}
		}
		//
		Duration duration = Duration.ofNanos(System.nanoTime() - start);
		VerificationAnalysisResult result = new VerificationAnalysisResult(module.getFunctions().size(),
				dataflowIssues, bugPatternsFound, taintVulnerabilities, loopInvariants, duration);
		logger.debug("verified module {}: {}", module.getName(), result);
		return result;
	}
}
