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

/**
 * Records where a piece of tainted data originated: the category of source,
 * the variable (or call target) which introduced it and its location.
 *
 * @author The Calor Project Developers
 *
 */
public class TaintLabel {
	private final TaintSource source;
	private final String sourceVariable;
	private final Span sourceSpan;

	public TaintLabel(TaintSource source, String sourceVariable, Span sourceSpan) {
		this.source = Objects.requireNonNull(source);
		this.sourceVariable = Objects.requireNonNull(sourceVariable);
		this.sourceSpan = Objects.requireNonNull(sourceSpan);
	}

	public TaintSource getSource() {
		return source;
	}

	public String getSourceVariable() {
		return sourceVariable;
	}

	public Span getSourceSpan() {
		return sourceSpan;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof TaintLabel) {
			TaintLabel l = (TaintLabel) o;
			return source == l.source && sourceVariable.equals(l.sourceVariable) && sourceSpan.equals(l.sourceSpan);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(source, sourceVariable, sourceSpan);
	}

	@Override
	public String toString() {
		return source + "(" + sourceVariable + "@" + sourceSpan + ")";
	}
}
