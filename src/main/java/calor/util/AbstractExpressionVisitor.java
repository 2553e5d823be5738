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

import java.util.ArrayList;
import java.util.List;

import calor.core.BoundModule.Expr;

/**
 * Bottom-up traversal of a bound expression. Each compound node is visited by
 * first visiting its children and then passing their results to the matching
 * <code>construct</code> method.
 *
 * @param <E> the result produced for each expression.
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.IntLiteral) {
            return constructIntLiteral((Expr.IntLiteral) expr);
        } else if (expr instanceof Expr.FloatLiteral) {
            return constructFloatLiteral((Expr.FloatLiteral) expr);
        } else if (expr instanceof Expr.BoolLiteral) {
            return constructBoolLiteral((Expr.BoolLiteral) expr);
        } else if (expr instanceof Expr.StringLiteral) {
            return constructStringLiteral((Expr.StringLiteral) expr);
        } else if (expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.Unary) {
            return visitUnary((Expr.Unary) expr);
        } else if (expr instanceof Expr.Binary) {
            return visitBinary((Expr.Binary) expr);
        } else if (expr instanceof Expr.Implies) {
            return visitImplies((Expr.Implies) expr);
        } else if (expr instanceof Expr.Conditional) {
            return visitConditional((Expr.Conditional) expr);
        } else if (expr instanceof Expr.UniversalQuantifier) {
            return visitUniversalQuantifier((Expr.UniversalQuantifier) expr);
        } else if (expr instanceof Expr.ExistentialQuantifier) {
            return visitExistentialQuantifier((Expr.ExistentialQuantifier) expr);
        } else if (expr instanceof Expr.Invoke) {
            return visitInvoke((Expr.Invoke) expr);
        } else if (expr instanceof Expr.ArrayAccess) {
            return visitArrayAccess((Expr.ArrayAccess) expr);
        } else if (expr instanceof Expr.FieldAccess) {
            return visitFieldAccess((Expr.FieldAccess) expr);
        } else if (expr instanceof Expr.CollectionLiteral) {
            return visitCollectionLiteral((Expr.CollectionLiteral) expr);
        } else if (expr == null) {
            throw new IllegalArgumentException("null expression encountered");
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitUnary(Expr.Unary expr) {
        E operand = visitExpression(expr.getOperand());
        return constructUnary(expr, operand);
    }

    protected E visitBinary(Expr.Binary expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructBinary(expr, lhs, rhs);
    }

    protected E visitImplies(Expr.Implies expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructImplies(expr, lhs, rhs);
    }

    protected E visitConditional(Expr.Conditional expr) {
        E condition = visitExpression(expr.getCondition());
        E trueBranch = visitExpression(expr.getTrueBranch());
        E falseBranch = visitExpression(expr.getFalseBranch());
        return constructConditional(expr, condition, trueBranch, falseBranch);
    }

    protected E visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
        E body = visitExpression(expr.getBody());
        return constructUniversalQuantifier(expr, body);
    }

    protected E visitExistentialQuantifier(Expr.ExistentialQuantifier expr) {
        E body = visitExpression(expr.getBody());
        return constructExistentialQuantifier(expr, body);
    }

    protected E visitInvoke(Expr.Invoke expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        return constructInvoke(expr, arguments);
    }

    protected E visitArrayAccess(Expr.ArrayAccess expr) {
        E source = visitExpression(expr.getSource());
        E index = visitExpression(expr.getIndex());
        return constructArrayAccess(expr, source, index);
    }

    protected E visitFieldAccess(Expr.FieldAccess expr) {
        E source = visitExpression(expr.getSource());
        return constructFieldAccess(expr, source);
    }

    protected E visitCollectionLiteral(Expr.CollectionLiteral expr) {
        List<E> elements = visitExpressions(expr.getElements());
        return constructCollectionLiteral(expr, elements);
    }

    protected abstract E constructIntLiteral(Expr.IntLiteral expr);

    protected abstract E constructFloatLiteral(Expr.FloatLiteral expr);

    protected abstract E constructBoolLiteral(Expr.BoolLiteral expr);

    protected abstract E constructStringLiteral(Expr.StringLiteral expr);

    protected abstract E constructVariableAccess(Expr.VariableAccess expr);

    protected abstract E constructUnary(Expr.Unary expr, E operand);

    protected abstract E constructBinary(Expr.Binary expr, E lhs, E rhs);

    protected abstract E constructImplies(Expr.Implies expr, E lhs, E rhs);

    protected abstract E constructConditional(Expr.Conditional expr, E condition, E trueBranch, E falseBranch);

    protected abstract E constructUniversalQuantifier(Expr.UniversalQuantifier expr, E body);

    protected abstract E constructExistentialQuantifier(Expr.ExistentialQuantifier expr, E body);

    protected abstract E constructInvoke(Expr.Invoke expr, List<E> arguments);

    protected abstract E constructArrayAccess(Expr.ArrayAccess expr, E source, E index);

    protected abstract E constructFieldAccess(Expr.FieldAccess expr, E source);

    protected abstract E constructCollectionLiteral(Expr.CollectionLiteral expr, List<E> elements);
}
