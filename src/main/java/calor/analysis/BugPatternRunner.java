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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import calor.core.BoundModule;
import calor.core.BoundModule.Function;
import calor.core.DiagnosticBag;
import calor.util.SmtSolver;

/**
 * Runs the enabled bug pattern checks over functions or whole modules.
 *
 * @author The Calor Project Developers
 *
 */
public class BugPatternRunner {
	private static final Logger logger = LoggerFactory.getLogger(BugPatternRunner.class);

	private final DiagnosticBag diagnostics;
	private final List<BugPatternChecker> checkers = new ArrayList<>();

	public BugPatternRunner(DiagnosticBag diagnostics) {
		this(diagnostics, new BugPatternOptions().setUseZ3Verification(false), SmtSolver.NONE);
	}

	public BugPatternRunner(DiagnosticBag diagnostics, BugPatternOptions options, SmtSolver solver) {
		if (diagnostics == null) {
			throw new NullPointerException("diagnostics");
		}
		this.diagnostics = diagnostics;
		if (options.isCheckDivisionByZero()) {
			checkers.add(new DivisionByZeroChecker(solver, options));
		}
		if (options.isCheckIndexOutOfBounds()) {
			checkers.add(new IndexOutOfBoundsChecker(solver, options));
		}
		if (options.isCheckNullDereference()) {
			checkers.add(new NullDereferenceChecker(solver, options));
		}
		if (options.isCheckOverflow()) {
			checkers.add(new OverflowChecker(solver, options));
		}
	}

	public List<BugPatternChecker> getCheckers() {
		return Collections.unmodifiableList(checkers);
	}

	public BugPatternRunner add(BugPatternChecker checker) {
		checkers.add(checker);
		return this;
	}

	public void checkModule(BoundModule module) {
		for (Function f : module.getFunctions()) {
			checkFunction(f);
		}
	}

	public void checkFunction(Function function) {
		for (BugPatternChecker checker : checkers) {
			int before = diagnostics.size();
			checker.check(function, diagnostics);
			logger.debug("{} reported {} issue(s) in {}", checker.getName(), diagnostics.size() - before,
					function.getName());
		}
	}
}
