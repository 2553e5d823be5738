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

import java.util.Objects;

import calor.core.BoundModule.Span;
import calor.core.DiagnosticCode;

/**
 * A flow of tainted data into a security sensitive sink. Two vulnerabilities
 * are equal when they concern the same sink category, the same label and the
 * same sink location.
 *
 * @author The Calor Project Developers
 *
 */
public class TaintVulnerability {
	private final TaintSink sink;
	private final TaintLabel label;
	private final String sinkDescription;
	private final Span sinkSpan;

	public TaintVulnerability(TaintSink sink, TaintLabel label, String sinkDescription, Span sinkSpan) {
		this.sink = Objects.requireNonNull(sink);
		this.label = Objects.requireNonNull(label);
		this.sinkDescription = Objects.requireNonNull(sinkDescription);
		this.sinkSpan = Objects.requireNonNull(sinkSpan);
	}

	public TaintSink getSink() {
		return sink;
	}

	public TaintLabel getLabel() {
		return label;
	}

	public TaintSource getSource() {
		return label.getSource();
	}

	/**
	 * Get a short description of the sink expression, typically the call target
	 * together with the tainted argument.
	 *
	 * @return
	 */
	public String getSinkDescription() {
		return sinkDescription;
	}

	public Span getSinkSpan() {
		return sinkSpan;
	}

	public DiagnosticCode getCode() {
		return sink.getCode();
	}

	public String getMessage() {
		return "Potential " + sink.getVulnerability() + ": tainted data from " + label.getSource().getDescription()
				+ " ('" + label.getSourceVariable() + "' at " + label.getSourceSpan() + ") flows to "
				+ sink.getDescription() + " (" + sinkDescription + ")";
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof TaintVulnerability) {
			TaintVulnerability v = (TaintVulnerability) o;
			return sink == v.sink && label.equals(v.label) && sinkSpan.equals(v.sinkSpan);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(sink, label, sinkSpan);
	}

	@Override
	public String toString() {
		return getCode() + " " + getMessage();
	}
}
