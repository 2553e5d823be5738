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

import java.util.Collections;
import java.util.List;

import calor.core.BoundModule.Expr;

/**
 * What is known about a loop when synthesising candidate invariants for it.
 * Bounds are inclusive and absent when they are not integer constants.
 *
 * @author The Calor Project Developers
 *
 */
public class LoopContext {
	private final String loopVariable;
	private final Integer lowerBound;
	private final Integer upperBound;
	private final boolean decrementing;
	private final List<String> modifiedVariables;
	private final List<String> readVariables;
	private final Expr condition;

	public LoopContext(String loopVariable, Integer lowerBound, Integer upperBound, boolean decrementing,
			List<String> modifiedVariables, List<String> readVariables, Expr condition) {
		this.loopVariable = loopVariable;
		this.lowerBound = lowerBound;
		this.upperBound = upperBound;
		this.decrementing = decrementing;
		this.modifiedVariables = Collections.unmodifiableList(modifiedVariables);
		this.readVariables = Collections.unmodifiableList(readVariables);
		this.condition = condition;
	}

	public String getLoopVariable() {
		return loopVariable;
	}

	public Integer getLowerBound() {
		return lowerBound;
	}

	public Integer getUpperBound() {
		return upperBound;
	}

	public boolean isDecrementing() {
		return decrementing;
	}

	public List<String> getModifiedVariables() {
		return modifiedVariables;
	}

	public List<String> getReadVariables() {
		return readVariables;
	}

	public Expr getCondition() {
		return condition;
	}

	public boolean hasKnownBounds() {
		return lowerBound != null && upperBound != null;
	}
}
