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

/**
 * Options controlling the bug pattern checks.
 *
 * @author The Calor Project Developers
 *
 */
public class BugPatternOptions {
	public static final int DEFAULT_TIMEOUT_MS = 5000;

	private boolean checkDivisionByZero = true;
	private boolean checkIndexOutOfBounds = true;
	private boolean checkNullDereference = true;
	private boolean checkOverflow = true;
	private boolean useZ3Verification = true;
	private int z3TimeoutMs = DEFAULT_TIMEOUT_MS;

	public boolean isCheckDivisionByZero() {
		return checkDivisionByZero;
	}

	public BugPatternOptions setCheckDivisionByZero(boolean flag) {
		this.checkDivisionByZero = flag;
		return this;
	}

	public boolean isCheckIndexOutOfBounds() {
		return checkIndexOutOfBounds;
	}

	public BugPatternOptions setCheckIndexOutOfBounds(boolean flag) {
		this.checkIndexOutOfBounds = flag;
		return this;
	}

	public boolean isCheckNullDereference() {
		return checkNullDereference;
	}

	public BugPatternOptions setCheckNullDereference(boolean flag) {
		this.checkNullDereference = flag;
		return this;
	}

	public boolean isCheckOverflow() {
		return checkOverflow;
	}

	public BugPatternOptions setCheckOverflow(boolean flag) {
		this.checkOverflow = flag;
		return this;
	}

	/**
	 * Check whether potential problems should be discharged with an SMT solver
	 * before being reported.
	 *
	 * @return
	 */
	public boolean isUseZ3Verification() {
		return useZ3Verification;
	}

	public BugPatternOptions setUseZ3Verification(boolean flag) {
		this.useZ3Verification = flag;
		return this;
	}

	public int getZ3TimeoutMs() {
		return z3TimeoutMs;
	}

	public BugPatternOptions setZ3TimeoutMs(int timeout) {
		if (timeout <= 0) {
			throw new IllegalArgumentException("invalid timeout (" + timeout + ")");
		}
		this.z3TimeoutMs = timeout;
		return this;
	}
}
