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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import calor.core.BoundModule.Expr;
import calor.core.BoundModule.Function;
import calor.core.BoundModule.Span;
import calor.core.BoundModule.Stmt;
import calor.core.BoundModule.Variable;
import calor.core.DiagnosticBag;
import calor.util.AbstractExpressionFold;
import calor.util.AbstractStatementVisitor;

/**
 * Tracks externally influenced data through a function body and reports where
 * it reaches a security sensitive operation. Both sources and sinks are taken
 * exclusively from the effects the function declares. Hence, a function
 * declaring no source effect, or no sink effect, never has any vulnerability.
 *
 * <p>
 * Every parameter is assumed to carry data from each declared source. Calls
 * into a declared source resource (e.g. <code>net.fetch</code> under
 * <code>net:r</code>) also produce tainted data. Taint flows through bindings
 * and any operator or call with a tainted operand, except for sanitising calls
 * (e.g. <code>html_escape</code>). Taint is accumulated flow-insensitively and
 * loop bodies are revisited until no new taint is discovered.
 * </p>
 *
 * @author The Calor Project Developers
 *
 */
public class TaintAnalysis {
	private static final String[] SANITIZERS = { "escape", "sanitize", "encode", "quote", "parameterize" };

	private final Function function;
	private final TaintAnalysisOptions options;
	private final List<TaintSource> sources = new ArrayList<>();
	private final List<TaintSink> sinks = new ArrayList<>();
	private final Map<String, Set<TaintLabel>> tainted = new HashMap<>();
	private final LinkedHashSet<TaintVulnerability> vulnerabilities = new LinkedHashSet<>();

	public TaintAnalysis(Function function) {
		this(function, TaintAnalysisOptions.defaults());
	}

	public TaintAnalysis(Function function, TaintAnalysisOptions options) {
		if (function == null) {
			throw new NullPointerException("function");
		}
		this.function = function;
		this.options = options == null ? TaintAnalysisOptions.defaults() : options;
		for (TaintSource source : EffectSinkMapping.getSourcesFromEffects(function.getEffects())) {
			if (this.options.isTracked(source)) {
				sources.add(source);
			}
		}
		for (TaintSink sink : EffectSinkMapping.getSinksFromEffects(function.getEffects())) {
			if (this.options.isDetected(sink)) {
				sinks.add(sink);
			}
		}
		if (!sources.isEmpty() && !sinks.isEmpty()) {
			analyze();
		}
	}

	public Function getFunction() {
		return function;
	}

	public List<TaintVulnerability> getVulnerabilities() {
		return Collections.unmodifiableList(new ArrayList<>(vulnerabilities));
	}

	/**
	 * Get the labels accumulated for a given variable.
	 *
	 * @param variable
	 * @return
	 */
	public Set<TaintLabel> getLabels(String variable) {
		Set<TaintLabel> labels = tainted.get(variable);
		return labels == null ? Collections.<TaintLabel>emptySet() : Collections.unmodifiableSet(labels);
	}

	public void reportDiagnostics(DiagnosticBag diagnostics) {
		for (TaintVulnerability v : vulnerabilities) {
			diagnostics.reportWarning(v.getSinkSpan(), v.getCode(), v.getMessage());
		}
	}

	private void analyze() {
		for (Variable parameter : function.getParameters()) {
			for (TaintSource source : sources) {
				addTaint(parameter.getName(), new TaintLabel(source, parameter.getName(), parameter.getSpan()));
			}
		}
		new Propagator().visitStatements(function.getBody(), null);
	}

	private void addTaint(String variable, Set<TaintLabel> labels) {
		if (!labels.isEmpty()) {
			Set<TaintLabel> existing = tainted.get(variable);
			if (existing == null) {
				existing = new LinkedHashSet<>();
				tainted.put(variable, existing);
			}
			existing.addAll(labels);
		}
	}

	private void addTaint(String variable, TaintLabel label) {
		addTaint(variable, Collections.singleton(label));
	}

	private int size() {
		int n = 0;
		for (Set<TaintLabel> labels : tainted.values()) {
			n += labels.size();
		}
		return n;
	}

	private Set<TaintLabel> labelsOf(Expr expr) {
		return new LabelFold(null, null).visitExpression(expr);
	}

	/**
	 * Report a vulnerability for every tainted argument of a call whose target
	 * names a declared sink. Sanitising calls are never sinks.
	 */
	private void checkSink(String target, List<Expr> arguments, List<Set<TaintLabel>> labels, Span span) {
		if (isSanitizer(target)) {
			// e.g. html_escape
			return;
		}
		for (TaintSink sink : sinks) {
			if (EffectSinkMapping.targetMatches(target, EffectSinkMapping.resourceAliases(sink))) {
				for (int i = 0; i != arguments.size(); ++i) {
					String description = target + "(" + describe(arguments.get(i)) + ")";
					for (TaintLabel label : labels.get(i)) {
						vulnerabilities.add(new TaintVulnerability(sink, label, description, span));
					}
				}
				return;
			}
		}
	}

	private TaintSource sourceOf(String target) {
		for (TaintSource source : sources) {
			if (EffectSinkMapping.targetMatches(target, EffectSinkMapping.resourceAliases(source))) {
				return source;
			}
		}
		return null;
	}

	private static boolean isSanitizer(String target) {
		String t = target.toLowerCase(Locale.ROOT);
		for (String s : SANITIZERS) {
			if (t.contains(s)) {
				return true;
			}
		}
		return false;
	}

	private static String describe(Expr expr) {
		if (expr instanceof Expr.VariableAccess) {
			return ((Expr.VariableAccess) expr).getVariable().getName();
		} else {
			return "expression";
		}
	}

	/**
	 * Walks the statements of the function body, propagating taint and checking
	 * calls against the declared sinks.
	 */
	private class Propagator extends AbstractStatementVisitor<Void> {

		@Override
		protected void visitBind(Stmt.Bind s, Void context) {
			Expr init = s.getInitializer();
			if (init != null) {
				String name = s.getVariable().getName();
				addTaint(name, new LabelFold(init, name).visitExpression(init));
			}
		}

		@Override
		protected void visitCall(Stmt.Call s, Void context) {
			ArrayList<Set<TaintLabel>> labels = new ArrayList<>();
			for (Expr arg : s.getArguments()) {
				labels.add(labelsOf(arg));
			}
			checkSink(s.getTarget(), s.getArguments(), labels, s.getSpan());
		}

		@Override
		protected void visitFor(Stmt.For s, Void context) {
			addTaint(s.getVariable().getName(), labelsOf(s.getFrom()));
			int before;
			do {
				before = size();
				super.visitFor(s, context);
			} while (size() != before);
		}

		@Override
		protected void visitWhile(Stmt.While s, Void context) {
			int before;
			do {
				before = size();
				super.visitWhile(s, context);
			} while (size() != before);
		}

		@Override
		protected void visitExpression(Expr expr, Void context) {
			labelsOf(expr);
		}
	}

	/**
	 * Computes the labels of an expression's value. Calls encountered along the
	 * way are checked against the declared sinks. Data read from a source
	 * resource is labelled with the call target, unless the call is the whole
	 * initialiser of a binding in which case the bound variable is used.
	 */
	private class LabelFold extends AbstractExpressionFold<Set<TaintLabel>> {
		private final Expr root;
		private final String binding;

		public LabelFold(Expr root, String binding) {
			this.root = root;
			this.binding = binding;
		}

		@Override
		protected Set<TaintLabel> constructVariableAccess(Expr.VariableAccess expr) {
			Set<TaintLabel> labels = tainted.get(expr.getVariable().getName());
			return labels == null ? BOTTOM() : new LinkedHashSet<>(labels);
		}

		@Override
		protected Set<TaintLabel> constructInvoke(Expr.Invoke expr, List<Set<TaintLabel>> arguments) {
			checkSink(expr.getTarget(), expr.getArguments(), arguments, expr.getSpan());
			if (isSanitizer(expr.getTarget())) {
				return BOTTOM();
			}
			Set<TaintLabel> result = join(arguments);
			TaintSource source = sourceOf(expr.getTarget());
			if (source != null) {
				String name = expr == root ? binding : expr.getTarget();
				result = join(result, Collections.singleton(new TaintLabel(source, name, expr.getSpan())));
			}
			return result;
		}

		@Override
		public Set<TaintLabel> join(Set<TaintLabel> lhs, Set<TaintLabel> rhs) {
			if (lhs.isEmpty()) {
				return rhs;
			} else if (rhs.isEmpty()) {
				return lhs;
			}
			Set<TaintLabel> result = new LinkedHashSet<>(lhs);
			result.addAll(rhs);
			return result;
		}

		@Override
		public Set<TaintLabel> BOTTOM() {
			return new LinkedHashSet<>();
		}
	}
}
