/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stepfunnel.plan;

public abstract class PlanVisitor<R, C> {
    public R process(Node node, C context) {
        return node.accept(this, context);
    }

    protected R visitNode(Node node, C context) {
        throw new UnsupportedOperationException("not yet implemented: " + getClass().getSimpleName() + " for " + node.getClass().getSimpleName());
    }

    protected R visitExpression(Expression node, C context) {
        return visitNode(node, context);
    }

    protected R visitColumnReference(ColumnReference node, C context) {
        return visitExpression(node, context);
    }

    protected R visitAllColumns(AllColumns node, C context) {
        return visitExpression(node, context);
    }

    protected R visitLiteral(Literal node, C context) {
        return visitExpression(node, context);
    }

    protected R visitComparisonExpression(ComparisonExpression node, C context) {
        return visitExpression(node, context);
    }

    protected R visitLogicalAnd(LogicalAnd node, C context) {
        return visitExpression(node, context);
    }

    protected R visitInListExpression(InListExpression node, C context) {
        return visitExpression(node, context);
    }

    protected R visitLikePredicate(LikePredicate node, C context) {
        return visitExpression(node, context);
    }

    protected R visitBetweenPredicate(BetweenPredicate node, C context) {
        return visitExpression(node, context);
    }

    protected R visitIsNotNullPredicate(IsNotNullPredicate node, C context) {
        return visitExpression(node, context);
    }

    protected R visitCaseWhen(CaseWhen node, C context) {
        return visitExpression(node, context);
    }

    protected R visitFunctionCall(FunctionCall node, C context) {
        return visitExpression(node, context);
    }

    protected R visitAggregateCall(AggregateCall node, C context) {
        return visitExpression(node, context);
    }

    protected R visitSourceTable(SourceTable node, C context) {
        return visitNode(node, context);
    }

    protected R visitCteReference(CteReference node, C context) {
        return visitNode(node, context);
    }

    protected R visitJoin(Join node, C context) {
        return visitNode(node, context);
    }

    protected R visitSelectItem(SelectItem node, C context) {
        return visitNode(node, context);
    }

    protected R visitSelect(Select node, C context) {
        return visitNode(node, context);
    }

    protected R visitWithQuery(WithQuery node, C context) {
        return visitNode(node, context);
    }

    protected R visitQueryPlan(QueryPlan node, C context) {
        return visitNode(node, context);
    }
}
