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

import java.util.List;

import calor.core.BoundModule.Expr;

/**
 * Folds a bound expression into a single summary value, such as the set of
 * variables it reads. Leaves produce {@link #BOTTOM()} unless overridden and
 * compound nodes join the results of their children.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructIntLiteral(Expr.IntLiteral expr) {
        return BOTTOM();
    }

    @Override
    protected E constructFloatLiteral(Expr.FloatLiteral expr) {
        return BOTTOM();
    }

    @Override
    protected E constructBoolLiteral(Expr.BoolLiteral expr) {
        return BOTTOM();
    }

    @Override
    protected E constructStringLiteral(Expr.StringLiteral expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVariableAccess(Expr.VariableAccess expr) {
        return BOTTOM();
    }

    @Override
    protected E constructUnary(Expr.Unary expr, E operand) {
        return operand;
    }

    @Override
    protected E constructBinary(Expr.Binary expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructImplies(Expr.Implies expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructConditional(Expr.Conditional expr, E condition, E trueBranch, E falseBranch) {
        return join(condition, join(trueBranch, falseBranch));
    }

    @Override
    protected E constructUniversalQuantifier(Expr.UniversalQuantifier expr, E body) {
        return body;
    }

    @Override
    protected E constructExistentialQuantifier(Expr.ExistentialQuantifier expr, E body) {
        return body;
    }

    @Override
    protected E constructInvoke(Expr.Invoke expr, List<E> arguments) {
        return join(arguments);
    }

    @Override
    protected E constructArrayAccess(Expr.ArrayAccess expr, E source, E index) {
        return join(source, index);
    }

    @Override
    protected E constructFieldAccess(Expr.FieldAccess expr, E source) {
        return source;
    }

    @Override
    protected E constructCollectionLiteral(Expr.CollectionLiteral expr, List<E> elements) {
        return join(elements);
    }

    protected E join(List<E> operands) {
        E result = BOTTOM();
        for (int i = 0; i != operands.size(); ++i) {
            result = join(result, operands.get(i));
        }
        return result;
    }

    public abstract E join(E lhs, E rhs);

    public abstract E BOTTOM();
}
