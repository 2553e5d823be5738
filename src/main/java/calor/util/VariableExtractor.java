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
package calor.util;

import java.util.LinkedHashSet;
import java.util.Set;

import calor.core.BoundModule.Expr;

/**
 * Determines the names of all variables read by an expression, in the order
 * they are first encountered. Variables bound by a quantifier are excluded.
 */
public class VariableExtractor extends AbstractExpressionFold<Set<String>> {

    public static Set<String> extract(Expr expr) {
        return new VariableExtractor().visitExpression(expr);
    }

    @Override
    protected Set<String> constructVariableAccess(Expr.VariableAccess expr) {
        Set<String> result = new LinkedHashSet<>();
        result.add(expr.getVariable().getName());
        return result;
    }

    @Override
    protected Set<String> constructUniversalQuantifier(Expr.UniversalQuantifier expr, Set<String> body) {
        return unbind(expr, body);
    }

    @Override
    protected Set<String> constructExistentialQuantifier(Expr.ExistentialQuantifier expr, Set<String> body) {
        return unbind(expr, body);
    }

    private Set<String> unbind(Expr.Quantifier expr, Set<String> body) {
        Set<String> result = new LinkedHashSet<>(body);
        for (int i = 0; i != expr.getVariables().size(); ++i) {
            result.remove(expr.getVariables().get(i).getName());
        }
        return result;
    }

    @Override
    public Set<String> join(Set<String> lhs, Set<String> rhs) {
        if (lhs.isEmpty()) {
            return rhs;
        } else if (rhs.isEmpty()) {
            return lhs;
        }
        Set<String> result = new LinkedHashSet<>(lhs);
        result.addAll(rhs);
        return result;
    }

    @Override
    public Set<String> BOTTOM() {
        return new LinkedHashSet<>();
    }
}
