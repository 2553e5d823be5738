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
package calor.tasks;

import java.util.Properties;

import calor.analysis.BugPatternOptions;
import calor.analysis.TaintAnalysisOptions;
import calor.loops.KInductionOptions;

/**
 * Selects which analyses the verification pass runs and how. Three profiles
 * are provided: {@link #fast()} which never consults an SMT solver,
 * {@link #defaults()} which uses one to discharge potential bugs, and
 * {@link #thorough()} which additionally synthesises loop invariants.
 *
 * @author The Calor Project Developers
 *
 */
public class VerificationOptions {
	public static final String PREFIX = "calor.verify.";
	public static final int DEFAULT_TIMEOUT_MS = 5000;

	private boolean enableDataflow = true;
	private boolean enableBugPatterns = true;
	private boolean enableTaintAnalysis = true;
	private boolean enableKInduction = false;
	private boolean useZ3Verification = true;
	private int z3TimeoutMs = DEFAULT_TIMEOUT_MS;
	private BugPatternOptions bugPatternOptions;
	private TaintAnalysisOptions taintOptions;
	private KInductionOptions kInductionOptions;

	public static VerificationOptions fast() {
		return new VerificationOptions().setUseZ3Verification(false).setEnableKInduction(false);
	}

	public static VerificationOptions defaults() {
		return new VerificationOptions();
	}

	public static VerificationOptions thorough() {
		return new VerificationOptions().setEnableKInduction(true).setUseZ3Verification(true).setZ3TimeoutMs(10000);
	}

	/**
	 * Read options from a set of properties. The profile given by
	 * <code>calor.verify.profile</code> (one of <code>fast</code>,
	 * <code>default</code> or <code>thorough</code>) provides the starting point,
	 * which individual keys such as <code>calor.verify.z3</code> or
	 * <code>calor.verify.z3TimeoutMs</code> then override.
	 *
	 * @param properties
	 * @return
	 * @throws IllegalArgumentException if a property has an invalid value.
	 */
	public static VerificationOptions fromProperties(Properties properties) {
		String profile = properties.getProperty(PREFIX + "profile", "default").trim();
		VerificationOptions options;
		switch (profile) {
		case "fast":
			options = fast();
			break;
		case "default":
			options = defaults();
			break;
		case "thorough":
			options = thorough();
			break;
		default:
			throw new IllegalArgumentException("invalid verification profile \"" + profile + "\"");
		}
		String value = properties.getProperty(PREFIX + "dataflow");
		if (value != null) {
			options.setEnableDataflow(parseBoolean("dataflow", value));
		}
		value = properties.getProperty(PREFIX + "bugPatterns");
		if (value != null) {
			options.setEnableBugPatterns(parseBoolean("bugPatterns", value));
		}
		value = properties.getProperty(PREFIX + "taint");
		if (value != null) {
			options.setEnableTaintAnalysis(parseBoolean("taint", value));
		}
		value = properties.getProperty(PREFIX + "kInduction");
		if (value != null) {
			options.setEnableKInduction(parseBoolean("kInduction", value));
		}
		value = properties.getProperty(PREFIX + "z3");
		if (value != null) {
			options.setUseZ3Verification(parseBoolean("z3", value));
		}
		value = properties.getProperty(PREFIX + "z3TimeoutMs");
		if (value != null) {
			try {
				options.setZ3TimeoutMs(Integer.parseInt(value.trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("invalid value for " + PREFIX + "z3TimeoutMs \"" + value + "\"",
						e);
			}
		}
		return options;
	}

	private static boolean parseBoolean(String key, String value) {
		switch (value.trim().toLowerCase()) {
		case "true":
			return true;
		case "false":
			return false;
		default:
			throw new IllegalArgumentException("invalid value for " + PREFIX + key + " \"" + value + "\"");
		}
	}

	public boolean isEnableDataflow() {
		return enableDataflow;
	}

	public VerificationOptions setEnableDataflow(boolean flag) {
		this.enableDataflow = flag;
		return this;
	}

	public boolean isEnableBugPatterns() {
		return enableBugPatterns;
	}

	public VerificationOptions setEnableBugPatterns(boolean flag) {
		this.enableBugPatterns = flag;
		return this;
	}

	public boolean isEnableTaintAnalysis() {
		return enableTaintAnalysis;
	}

	public VerificationOptions setEnableTaintAnalysis(boolean flag) {
		this.enableTaintAnalysis = flag;
		return this;
	}

	public boolean isEnableKInduction() {
		return enableKInduction;
	}

	public VerificationOptions setEnableKInduction(boolean flag) {
		this.enableKInduction = flag;
		return this;
	}

	public boolean isUseZ3Verification() {
		return useZ3Verification;
	}

	public VerificationOptions setUseZ3Verification(boolean flag) {
		this.useZ3Verification = flag;
		return this;
	}

	public int getZ3TimeoutMs() {
		return z3TimeoutMs;
	}

	public VerificationOptions setZ3TimeoutMs(int timeout) {
		if (timeout <= 0) {
			throw new IllegalArgumentException("invalid timeout (" + timeout + ")");
		}
		this.z3TimeoutMs = timeout;
		return this;
	}

	/**
	 * Get the options for bug pattern checks. Unless set explicitly these are
	 * derived from the solver settings.
	 *
	 * @return
	 */
	public BugPatternOptions getBugPatternOptions() {
		if (bugPatternOptions != null) {
			return bugPatternOptions;
		}
		return new BugPatternOptions().setUseZ3Verification(useZ3Verification).setZ3TimeoutMs(z3TimeoutMs);
	}

	public VerificationOptions setBugPatternOptions(BugPatternOptions options) {
		this.bugPatternOptions = options;
		return this;
	}

	public TaintAnalysisOptions getTaintOptions() {
		return taintOptions != null ? taintOptions : TaintAnalysisOptions.defaults();
	}

	public VerificationOptions setTaintOptions(TaintAnalysisOptions options) {
		this.taintOptions = options;
		return this;
	}

	public KInductionOptions getKInductionOptions() {
		if (kInductionOptions != null) {
			return kInductionOptions;
		}
		return new KInductionOptions().setTimeoutMs(z3TimeoutMs);
	}

	public VerificationOptions setKInductionOptions(KInductionOptions options) {
		this.kInductionOptions = options;
		return this;
	}
}
