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

/**
 * Options controlling the k-induction prover.
 *
 * @author The Calor Project Developers
 *
 */
public class KInductionOptions {
	public static final int DEFAULT_MAX_K = 10;
	public static final int DEFAULT_TIMEOUT_MS = 10000;

	private int maxK = DEFAULT_MAX_K;
	private int timeoutMs = DEFAULT_TIMEOUT_MS;
	private boolean useInvariantTemplates = true;

	public static KInductionOptions defaults() {
		return new KInductionOptions();
	}

	public int getMaxK() {
		return maxK;
	}

	public KInductionOptions setMaxK(int maxK) {
		if (maxK < 1) {
			throw new IllegalArgumentException("invalid maximum k (" + maxK + ")");
		}
		this.maxK = maxK;
		return this;
	}

	/**
	 * Get the time limit for each individual solver query.
	 *
	 * @return
	 */
	public int getTimeoutMs() {
		return timeoutMs;
	}

	public KInductionOptions setTimeoutMs(int timeoutMs) {
		if (timeoutMs <= 0) {
			throw new IllegalArgumentException("invalid timeout (" + timeoutMs + ")");
		}
		this.timeoutMs = timeoutMs;
		return this;
	}

	public boolean isUseInvariantTemplates() {
		return useInvariantTemplates;
	}

	public KInductionOptions setUseInvariantTemplates(boolean flag) {
		this.useInvariantTemplates = flag;
		return this;
	}
}
