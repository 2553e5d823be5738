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

import calor.core.BoundModule.Expr;
import calor.io.BoundExpressionPrinter;

/**
 * The outcome of attempting to prove a loop invariant by k-induction.
 *
 * @author The Calor Project Developers
 *
 */
public class KInductionResult {
	public enum Status {
		/**
		 * The invariant holds on every iteration.
		 */
		PROVEN,
		/**
		 * The invariant fails on entry to the loop.
		 */
		DISPROVEN,
		/**
		 * Neither proof nor refutation was found within the bound on k.
		 */
		UNKNOWN,
		/**
		 * The loop or invariant has a shape which cannot be encoded.
		 */
		UNSUPPORTED
	}

	private final Status status;
	private final int k;
	private final Expr invariant;
	private final String explanation;
	private final Duration duration;

	public KInductionResult(Status status, int k, Expr invariant, String explanation, Duration duration) {
		this.status = status;
		this.k = k;
		this.invariant = invariant;
		this.explanation = explanation;
		this.duration = duration;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isProven() {
		return status == Status.PROVEN;
	}

	/**
	 * Get the depth at which the outcome was decided.
	 *
	 * @return
	 */
	public int getK() {
		return k;
	}

	/**
	 * Get the invariant concerned, which is <code>null</code> when no candidate
	 * invariant could be found.
	 *
	 * @return
	 */
	public Expr getInvariant() {
		return invariant;
	}

	public String getExplanation() {
		return explanation;
	}

	public Duration getDuration() {
		return duration;
	}

	@Override
	public String toString() {
		String inv = invariant == null ? "" : " " + BoundExpressionPrinter.toString(invariant);
		return status + inv + " (k=" + k + ")";
	}
}
