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

import calor.core.BoundModule.Span;

/**
 * A single finding reported by one of the verification passes.
 *
 * @author The Calor Project Developers
 *
 */
public class Diagnostic {

	public enum Severity {
		ERROR, WARNING, INFO
	}

	private final DiagnosticCode code;
	private final Severity severity;
	private final String message;
	private final Span span;

	public Diagnostic(DiagnosticCode code, Severity severity, String message, Span span) {
		if (code == null || severity == null) {
			throw new IllegalArgumentException("invalid diagnostic");
		}
		this.code = code;
		this.severity = severity;
		this.message = message;
		this.span = span == null ? Span.NONE : span;
	}

	public DiagnosticCode getCode() {
		return code;
	}

	public Severity getSeverity() {
		return severity;
	}

	public String getMessage() {
		return message;
	}

	public Span getSpan() {
		return span;
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		return span + ": " + severity.name().toLowerCase() + " " + code.getId() + ": " + message;
	}
}
