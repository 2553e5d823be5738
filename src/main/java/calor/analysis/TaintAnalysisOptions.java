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

import java.util.EnumSet;

/**
 * Selects which taint sources are tracked and which sinks are checked. By
 * default everything is enabled.
 *
 * @author The Calor Project Developers
 *
 */
public class TaintAnalysisOptions {
	private final EnumSet<TaintSource> trackedSources = EnumSet.allOf(TaintSource.class);
	private final EnumSet<TaintSink> detectedSinks = EnumSet.allOf(TaintSink.class);

	public static TaintAnalysisOptions defaults() {
		return new TaintAnalysisOptions();
	}

	public boolean isTracked(TaintSource source) {
		return trackedSources.contains(source);
	}

	public boolean isDetected(TaintSink sink) {
		return detectedSinks.contains(sink);
	}

	public TaintAnalysisOptions setTrackSource(TaintSource source, boolean flag) {
		if (flag) {
			trackedSources.add(source);
		} else {
			trackedSources.remove(source);
		}
		return this;
	}

	public TaintAnalysisOptions setDetectSink(TaintSink sink, boolean flag) {
		if (flag) {
			detectedSinks.add(sink);
		} else {
			detectedSinks.remove(sink);
		}
		return this;
	}
}
