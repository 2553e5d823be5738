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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import calor.core.BoundModule.Span;
import calor.core.Diagnostic.Severity;

/**
 * Append-only collection of diagnostics shared by the passes of a single
 * verification run. The bag is owned by the caller and is not thread-safe.
 *
 * @author The Calor Project Developers
 *
 */
public class DiagnosticBag implements Iterable<Diagnostic> {
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public void report(Diagnostic diagnostic) {
		if (diagnostic == null) {
			throw new IllegalArgumentException("invalid diagnostic");
		}
		diagnostics.add(diagnostic);
	}

	public void reportError(Span span, DiagnosticCode code, String message) {
		report(new Diagnostic(code, Severity.ERROR, message, span));
	}

	public void reportWarning(Span span, DiagnosticCode code, String message) {
		report(new Diagnostic(code, Severity.WARNING, message, span));
	}

	public void reportInfo(Span span, DiagnosticCode code, String message) {
		report(new Diagnostic(code, Severity.INFO, message, span));
	}

	public int size() {
		return diagnostics.size();
	}

	public boolean isEmpty() {
		return diagnostics.isEmpty();
	}

	public Diagnostic get(int i) {
		return diagnostics.get(i);
	}

	public boolean hasErrors() {
		for (Diagnostic d : diagnostics) {
			if (d.isError()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Count the diagnostics with a given code reported at or after a given
	 * position in this bag.
	 *
	 * @param from
	 * @param code
	 * @return
	 */
	public int count(int from, DiagnosticCode code) {
		int count = 0;
		for (int i = from; i < diagnostics.size(); ++i) {
			if (diagnostics.get(i).getCode() == code) {
				count++;
			}
		}
		return count;
	}

	public List<Diagnostic> getDiagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	@Override
	public Iterator<Diagnostic> iterator() {
		return getDiagnostics().iterator();
	}
}
