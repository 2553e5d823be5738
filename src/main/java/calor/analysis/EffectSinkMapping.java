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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import calor.analysis.EffectDeclaration.Access;
import calor.analysis.EffectDeclaration.Kind;

/**
 * Maps declared effects onto the taint sources and sinks they represent.
 * Effects may be given either in the short form <code>resource:access</code>
 * (e.g. <code>db:w</code>, <code>net:rw</code>) or in the normalised form
 * <code>category:resource_access</code> produced by the binder (e.g.
 * <code>io:database_write</code>). Both forms map identically and all matching
 * is case insensitive. Effects which are malformed or name an unrecognised
 * resource map to nothing.
 *
 * @author The Calor Project Developers
 *
 */
public final class EffectSinkMapping {

	/**
	 * A group of resource names which denote the same kind of resource.
	 */
	private enum Family {
		DATABASE(Kind.IO, TaintSink.SQL_QUERY, TaintSource.DATABASE_RESULT, "db", "database", "sql"),
		FILESYSTEM(Kind.IO, TaintSink.FILE_PATH, TaintSource.FILE_READ, "fs", "filesystem", "file"),
		NETWORK(Kind.IO, TaintSink.URL_REDIRECT, TaintSource.NETWORK_INPUT, "net", "network", "http"),
		PROCESS(Kind.PROCESS, TaintSink.COMMAND_EXECUTION, null, "process", "system", "exec", "shell"),
		HTML(Kind.IO, TaintSink.HTML_OUTPUT, null, "html", "web", "response"),
		CONSOLE(Kind.CONSOLE, null, TaintSource.USER_INPUT, "console", "stdin"),
		ENVIRONMENT(Kind.IO, null, TaintSource.ENVIRONMENT, "env", "environment");

		private final Kind kind;
		private final TaintSink sink;
		private final TaintSource source;
		private final List<String> resources;

		private Family(Kind kind, TaintSink sink, TaintSource source, String... resources) {
			this.kind = kind;
			this.sink = sink;
			this.source = source;
			this.resources = Arrays.asList(resources);
		}

		private static Family lookup(String resource) {
			for (Family f : values()) {
				if (f.resources.contains(resource)) {
					return f;
				}
			}
			return null;
		}

		private boolean accepts(Kind k) {
			// IO is the generic category used for unclassified resources
			return kind == k || k == Kind.IO;
		}
	}

	private EffectSinkMapping() {
	}

	// =========================================================================
	// Parsing
	// =========================================================================

	/**
	 * Parse an effect in the short form <code>resource:access</code>, where
	 * access is one of <code>r</code>, <code>w</code> or <code>rw</code>.
	 *
	 * @param effect
	 * @return The parsed declaration, or <code>null</code> if the string is
	 *         malformed.
	 */
	public static EffectDeclaration parseEffect(String effect) {
		if (effect == null) {
			return null;
		}
		String[] parts = effect.split(":", -1);
		if (parts.length != 2) {
			return null;
		}
		String resource = lower(parts[0].trim());
		Access access = parseAccessSymbol(lower(parts[1].trim()));
		if (resource.isEmpty() || access == null) {
			return null;
		}
		return new EffectDeclaration(classify(resource), resource, access);
	}

	private static Access parseAccessSymbol(String symbol) {
		switch (symbol) {
		case "r":
			return Access.READ;
		case "w":
			return Access.WRITE;
		case "rw":
			return Access.READ_WRITE;
		default:
			return null;
		}
	}

	private static Access parseAccessWord(String word) {
		switch (word) {
		case "read":
			return Access.READ;
		case "write":
			return Access.WRITE;
		case "readwrite":
			return Access.READ_WRITE;
		default:
			return null;
		}
	}

	private static Kind classify(String resource) {
		switch (resource) {
		case "mem":
		case "memory":
		case "alloc":
			return Kind.MEMORY;
		case "stdout":
		case "stderr":
			return Kind.CONSOLE;
		default:
			Family f = Family.lookup(resource);
			return f == null ? Kind.IO : f.kind;
		}
	}

	private static Kind parseCategory(String category) {
		switch (lower(category.trim())) {
		case "process":
			return Kind.PROCESS;
		case "mem":
		case "memory":
			return Kind.MEMORY;
		case "console":
			return Kind.CONSOLE;
		default:
			return Kind.IO;
		}
	}

	/**
	 * Parse an effect value under a given category, accepting either
	 * <code>database_write</code> or <code>db:w</code>.
	 */
	private static EffectDeclaration parseValue(Kind kind, String value) {
		if (value.indexOf(':') >= 0) {
			return parseEffect(value);
		}
		int split = value.lastIndexOf('_');
		if (split <= 0) {
			return null;
		}
		String resource = value.substring(0, split);
		Access access = parseAccessWord(value.substring(split + 1));
		if (access == null) {
			return null;
		}
		return new EffectDeclaration(kind, resource, access);
	}

	// =========================================================================
	// Sinks
	// =========================================================================

	/**
	 * Map an effect onto the sink it writes to. Read-only effects are never
	 * sinks.
	 *
	 * @param effect
	 * @return
	 */
	public static TaintSink mapEffectToSink(EffectDeclaration effect) {
		if (!effect.getAccess().isWritable()) {
			return null;
		}
		Family f = Family.lookup(lower(effect.getResource()));
		return f == null ? null : f.sink;
	}

	/**
	 * Map a normalised effect value (e.g. <code>database_write</code>) under the
	 * given kind onto a sink. Any process effect whose value mentions execution,
	 * a shell or the system is a command execution sink.
	 *
	 * @param kind
	 * @param value
	 * @return
	 */
	public static TaintSink mapEffectToSink(Kind kind, String value) {
		if (value == null) {
			return null;
		}
		String v = lower(value);
		if (kind == Kind.PROCESS
				&& (v.contains("exec") || v.contains("shell") || v.contains("system") || v.equals("process:rw"))) {
			return TaintSink.COMMAND_EXECUTION;
		}
		EffectDeclaration effect = parseValue(kind, v);
		if (effect == null) {
			return null;
		}
		Family f = Family.lookup(effect.getResource());
		if (f == null || !f.accepts(kind)) {
			return null;
		}
		return mapEffectToSink(effect);
	}

	/**
	 * Map an effect string in either the short or the normalised form onto a
	 * sink.
	 *
	 * @param effect
	 * @return
	 */
	public static TaintSink mapEffectStringToSink(String effect) {
		EffectDeclaration decl = parseEffect(effect);
		if (decl != null) {
			return mapEffectToSink(decl);
		}
		String[] parts = split(effect);
		return parts == null ? null : mapEffectToSink(parseCategory(parts[0]), parts[1]);
	}

	/**
	 * Determine the distinct sinks denoted by a list of effects, in the order
	 * first encountered.
	 *
	 * @param effects
	 * @return
	 */
	public static List<TaintSink> getSinksFromEffects(Collection<String> effects) {
		ArrayList<TaintSink> sinks = new ArrayList<>();
		for (String effect : effects) {
			TaintSink sink = mapEffectStringToSink(effect);
			if (sink != null && !sinks.contains(sink)) {
				sinks.add(sink);
			}
		}
		return sinks;
	}

	// =========================================================================
	// Sources
	// =========================================================================

	public static TaintSource mapEffectToSource(EffectDeclaration effect) {
		if (!effect.getAccess().isReadable()) {
			return null;
		}
		Family f = Family.lookup(lower(effect.getResource()));
		return f == null ? null : f.source;
	}

	public static TaintSource mapEffectToSource(Kind kind, String value) {
		if (value == null) {
			return null;
		}
		EffectDeclaration effect = parseValue(kind, lower(value));
		if (effect == null) {
			return null;
		}
		Family f = Family.lookup(effect.getResource());
		if (f == null || !f.accepts(kind)) {
			return null;
		}
		return mapEffectToSource(effect);
	}

	public static TaintSource mapEffectStringToSource(String effect) {
		EffectDeclaration decl = parseEffect(effect);
		if (decl != null) {
			return mapEffectToSource(decl);
		}
		String[] parts = split(effect);
		return parts == null ? null : mapEffectToSource(parseCategory(parts[0]), parts[1]);
	}

	public static List<TaintSource> getSourcesFromEffects(Collection<String> effects) {
		ArrayList<TaintSource> sources = new ArrayList<>();
		for (String effect : effects) {
			TaintSource source = mapEffectStringToSource(effect);
			if (source != null && !sources.contains(source)) {
				sources.add(source);
			}
		}
		return sources;
	}

	// =========================================================================
	// Resource names
	// =========================================================================

	/**
	 * Get the names by which calls into a sink resource are recognised. A call
	 * such as <code>db.execute</code> or <code>sql_query</code> is taken to
	 * target the resource named by its leading segment.
	 *
	 * @param sink
	 * @return
	 */
	public static List<String> resourceAliases(TaintSink sink) {
		switch (sink) {
		case SQL_QUERY:
			return aliases("db", "database", "sql", "query", "mysql", "postgres", "sqlite", "mongo");
		case FILE_PATH:
			return aliases("fs", "filesystem", "file", "path", "directory", "dir");
		case URL_REDIRECT:
			return aliases("net", "network", "http", "https", "url", "socket", "redirect");
		case COMMAND_EXECUTION:
			return aliases("process", "system", "exec", "shell", "spawn", "cmd", "command");
		case HTML_OUTPUT:
			return aliases("html", "web", "response", "render");
		default:
			throw new IllegalArgumentException("unknown sink encountered (" + sink + ")");
		}
	}

	public static List<String> resourceAliases(TaintSource source) {
		switch (source) {
		case DATABASE_RESULT:
			return aliases("db", "database", "sql", "query", "mysql", "postgres", "sqlite", "mongo");
		case FILE_READ:
			return aliases("fs", "filesystem", "file", "path", "directory", "dir");
		case NETWORK_INPUT:
			return aliases("net", "network", "http", "https", "url", "socket", "fetch", "request");
		case USER_INPUT:
			return aliases("console", "stdin", "readline", "input", "prompt");
		case ENVIRONMENT:
			return aliases("env", "environment", "getenv");
		default:
			throw new IllegalArgumentException("unknown source encountered (" + source + ")");
		}
	}

	/**
	 * Check whether a call target names one of the given resources. The target
	 * matches when its leading segment (up to the first <code>.</code> or
	 * <code>_</code>) or any inner dotted segment equals an alias.
	 *
	 * @param target
	 * @param aliases
	 * @return
	 */
	public static boolean targetMatches(String target, List<String> aliases) {
		String t = lower(target);
		for (String alias : aliases) {
			if (t.equals(alias) || t.startsWith(alias + ".") || t.startsWith(alias + "_")
					|| t.contains("." + alias + ".") || t.endsWith("." + alias)) {
				return true;
			}
		}
		return false;
	}

	private static List<String> aliases(String... names) {
		return Collections.unmodifiableList(Arrays.asList(names));
	}

	private static String[] split(String effect) {
		if (effect == null) {
			return null;
		}
		String[] parts = effect.split(":", -1);
		if (parts.length != 2 || parts[0].trim().isEmpty() || parts[1].trim().isEmpty()) {
			return null;
		}
		return new String[] { parts[0], parts[1].trim() };
	}

	private static String lower(String s) {
		return s.toLowerCase(Locale.ROOT);
	}
}
