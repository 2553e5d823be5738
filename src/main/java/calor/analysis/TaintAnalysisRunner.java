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

import java.util.List;

import calor.core.BoundModule;
import calor.core.BoundModule.Function;
import calor.core.DiagnosticBag;

/**
 * Runs taint analysis over every function of a module, reporting any
 * vulnerabilities found.
 *
 * @author The Calor Project Developers
 *
 */
public class TaintAnalysisRunner {
	private final DiagnosticBag diagnostics;
	private final TaintAnalysisOptions options;

	public TaintAnalysisRunner(DiagnosticBag diagnostics) {
		this(diagnostics, TaintAnalysisOptions.defaults());
	}

	public TaintAnalysisRunner(DiagnosticBag diagnostics, TaintAnalysisOptions options) {
		if (diagnostics == null) {
			throw new NullPointerException("diagnostics");
		}
		this.diagnostics = diagnostics;
		this.options = options == null ? TaintAnalysisOptions.defaults() : options;
	}

	public void analyze(BoundModule module) {
		for (Function f : module.getFunctions()) {
			analyzeFunction(f);
		}
	}

	/**
	 * Analyze a single function.
	 *
	 * @param function
	 * @return The vulnerabilities found, which have also been reported.
	 */
	public List<TaintVulnerability> analyzeFunction(Function function) {
		TaintAnalysis analysis = new TaintAnalysis(function, options);
		analysis.reportDiagnostics(diagnostics);
		return analysis.getVulnerabilities();
	}
}
