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
 * Rewrites a bound expression bottom-up. The default behaviour rebuilds a node
 * only when one of its children was rewritten, and otherwise returns the
 * original instance. Subclasses override the <code>construct</code> methods to
 * rewrite nodes after their children have been transformed.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    @Override
    protected Expr constructIntLiteral(Expr.IntLiteral expr) {
        return expr;
    }

    @Override
    protected Expr constructFloatLiteral(Expr.FloatLiteral expr) {
        return expr;
    }

    @Override
    protected Expr constructBoolLiteral(Expr.BoolLiteral expr) {
        return expr;
    }

    @Override
    protected Expr constructStringLiteral(Expr.StringLiteral expr) {
        return expr;
    }

    @Override
    protected Expr constructVariableAccess(Expr.VariableAccess expr) {
        return expr;
    }

    @Override
    protected Expr constructUnary(Expr.Unary expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return new Expr.Unary(expr.getOperator(), operand, expr.getType(), expr.getSpan());
        }
    }

    @Override
    protected Expr constructBinary(Expr.Binary expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return new Expr.Binary(expr.getOperator(), lhs, rhs, expr.getType(), expr.getSpan());
        }
    }

    @Override
    protected Expr constructImplies(Expr.Implies expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return new Expr.Implies(lhs, rhs, expr.getSpan());
        }
    }

    @Override
    protected Expr constructConditional(Expr.Conditional expr, Expr condition, Expr trueBranch, Expr falseBranch) {
        if (expr.getCondition() == condition && expr.getTrueBranch() == trueBranch
                && expr.getFalseBranch() == falseBranch) {
            return expr;
        } else {
            return new Expr.Conditional(condition, trueBranch, falseBranch, expr.getType(), expr.getSpan());
        }
    }

    @Override
    protected Expr constructUniversalQuantifier(Expr.UniversalQuantifier expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return new Expr.UniversalQuantifier(expr.getVariables(), body, expr.getSpan());
        }
    }

    @Override
    protected Expr constructExistentialQuantifier(Expr.ExistentialQuantifier expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return new Expr.ExistentialQuantifier(expr.getVariables(), body, expr.getSpan());
        }
    }

    @Override
    protected Expr constructInvoke(Expr.Invoke expr, List<Expr> arguments) {
        if (Util.identical(expr.getArguments(), arguments)) {
            return expr;
        } else {
            return new Expr.Invoke(expr.getTarget(), arguments, expr.getType(), expr.getSpan());
        }
    }

    @Override
    protected Expr constructArrayAccess(Expr.ArrayAccess expr, Expr source, Expr index) {
        if (expr.getSource() == source && expr.getIndex() == index) {
            return expr;
        } else {
            return new Expr.ArrayAccess(source, index, expr.getType(), expr.getSpan());
        }
    }

    @Override
    protected Expr constructFieldAccess(Expr.FieldAccess expr, Expr source) {
        if (expr.getSource() == source) {
            return expr;
        } else {
            return new Expr.FieldAccess(source, expr.getField(), expr.getType(), expr.getSpan());
        }
    }

    @Override
    protected Expr constructCollectionLiteral(Expr.CollectionLiteral expr, List<Expr> elements) {
        if (Util.identical(expr.getElements(), elements)) {
            return expr;
        } else {
            return new Expr.CollectionLiteral(elements, expr.getType(), expr.getSpan());
        }
    }
}
