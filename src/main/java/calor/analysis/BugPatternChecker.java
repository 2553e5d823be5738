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

import calor.core.BoundModule.Function;
import calor.core.DiagnosticBag;

/**
 * A check for a particular kind of likely bug within a single function.
 *
 * @author The Calor Project Developers
 *
 */
public interface BugPatternChecker {

	/**
	 * Get a short identifier for this check (e.g. <code>DIV_ZERO</code>).
	 *
	 * @return
	 */
	String getName();

	/**
	 * Check a function, reporting any problems found.
	 *
	 * @param function
	 * @param diagnostics
	 */
	void check(Function function, DiagnosticBag diagnostics);
}
