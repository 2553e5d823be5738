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
 * Categories of externally influenced data.
 *
 * @author The Calor Project Developers
 *
 */
public enum TaintSource {
	USER_INPUT("user input"),
	NETWORK_INPUT("network input"),
	FILE_READ("file read"),
	DATABASE_RESULT("database result"),
	ENVIRONMENT("environment");

	private final String description;

	private TaintSource(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}
}
