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

import calor.core.DiagnosticCode;

/**
 * Categories of security sensitive operations. Every sink corresponds to
 * exactly one diagnostic code, which is used when tainted data is found to
 * reach it.
 *
 * @author The Calor Project Developers
 *
 */
public enum TaintSink {
	SQL_QUERY(DiagnosticCode.SQL_INJECTION, "SQL injection", "SQL query"),
	COMMAND_EXECUTION(DiagnosticCode.COMMAND_INJECTION, "command injection", "command execution"),
	FILE_PATH(DiagnosticCode.PATH_TRAVERSAL, "path traversal", "file path"),
	URL_REDIRECT(DiagnosticCode.OPEN_REDIRECT, "open redirect", "URL redirect"),
	HTML_OUTPUT(DiagnosticCode.CROSS_SITE_SCRIPTING, "XSS", "HTML output");

	private final DiagnosticCode code;
	private final String vulnerability;
	private final String description;

	private TaintSink(DiagnosticCode code, String vulnerability, String description) {
		this.code = code;
		this.vulnerability = vulnerability;
		this.description = description;
	}

	public DiagnosticCode getCode() {
		return code;
	}

	/**
	 * Get the name of the attack enabled when tainted data reaches this sink
	 * (e.g. "SQL injection").
	 *
	 * @return
	 */
	public String getVulnerability() {
		return vulnerability;
	}

	public String getDescription() {
		return description;
	}
}
