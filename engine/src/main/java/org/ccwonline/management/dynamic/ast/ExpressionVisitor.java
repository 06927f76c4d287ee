package org.ccwonline.management.dynamic.ast;

/**
 * Visitor interface for traversing dynamic expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitConstant(Constant constant);

    T visitParameter(ParameterRef parameter);

    T visitMemberAccess(MemberAccess memberAccess);

    T visitIndexer(Indexer indexer);

    T visitBinary(BinaryExpression binary);

    T visitUnary(UnaryExpression unary);

    T visitConditional(ConditionalExpression conditional);

    T visitConvert(ConvertExpression convert);

    T visitMethodCall(MethodCall methodCall);

    /**
     * Visit a sequence function such as {@code Orders.Any(Total > 10)}.
     */
    T visitAggregate(AggregateCall aggregate);

    /**
     * Visit a {@code new(...)} projection.
     */
    T visitNewRecord(NewRecord newRecord);

    T visitNewArray(NewArray newArray);

    T visitLambda(LambdaExpression lambda);
}
