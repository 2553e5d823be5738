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
package calor.core;

/**
 * The closed set of diagnostics which the verification passes can report.
 * Each code has a stable identifier which tooling may match on.
 */
public enum DiagnosticCode {
	CONTRACT_TAUTOLOGY("Calor0330"),
	CONTRACT_CONTRADICTION("Calor0331"),
	CONTRACT_SIMPLIFIED("Calor0332"),
	UNINITIALIZED_VARIABLE("Calor0900"),
	DEAD_STORE("Calor0902"),
	DIVISION_BY_ZERO("Calor0920"),
	INDEX_OUT_OF_BOUNDS("Calor0921"),
	NULL_DEREFERENCE("Calor0922"),
	INTEGER_OVERFLOW("Calor0923"),
	UNSAFE_UNWRAP("Calor0925"),
	LOOP_INVARIANT_SYNTHESIZED("Calor0950"),
	LOOP_INVARIANT_UNKNOWN("Calor0951"),
	SQL_INJECTION("Calor0981"),
	COMMAND_INJECTION("Calor0982"),
	PATH_TRAVERSAL("Calor0983"),
	CROSS_SITE_SCRIPTING("Calor0984"),
	OPEN_REDIRECT("Calor0985");

	private final String id;

	DiagnosticCode(String id) {
		this.id = id;
	}

	public String getId() {
		return id;
	}

	@Override
	public String toString() {
		return id;
	}
}
