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

/**
 * Summary counts from running the verification pass over a module.
 *
 * @author The Calor Project Developers
 *
 */
public class VerificationAnalysisResult {
	private final int functionsAnalyzed;
	private final int dataflowIssues;
	private final int bugPatternsFound;
	private final int taintVulnerabilities;
	private final int loopInvariantsSynthesized;
	private final Duration duration;

	public VerificationAnalysisResult(int functionsAnalyzed, int dataflowIssues, int bugPatternsFound,
			int taintVulnerabilities, int loopInvariantsSynthesized, Duration duration) {
		this.functionsAnalyzed = functionsAnalyzed;
		this.dataflowIssues = dataflowIssues;
		this.bugPatternsFound = bugPatternsFound;
		this.taintVulnerabilities = taintVulnerabilities;
		this.loopInvariantsSynthesized = loopInvariantsSynthesized;
		this.duration = duration;
	}

	public int getFunctionsAnalyzed() {
		return functionsAnalyzed;
	}

	public int getDataflowIssues() {
		return dataflowIssues;
	}

	public int getBugPatternsFound() {
		return bugPatternsFound;
	}

	public int getTaintVulnerabilities() {
		return taintVulnerabilities;
	}

	public int getLoopInvariantsSynthesized() {
		return loopInvariantsSynthesized;
	}

	public Duration getDuration() {
		return duration;
	}

	@Override
	public String toString() {
		return functionsAnalyzed + " function(s): " + dataflowIssues + " dataflow issue(s), " + bugPatternsFound
				+ " bug pattern(s), " + taintVulnerabilities + " taint vulnerabilit(ies), "
				+ loopInvariantsSynthesized + " loop invariant(s) in " + duration.toMillis() + "ms";
	}
}
