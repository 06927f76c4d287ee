package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

/**
 * Sealed interface for nodes of a parsed dynamic expression.
 *
 * Trees are immutable and fully typed: every node knows its static type once the
 * parser has built it, so the compiler never has to infer anything.
 */
public sealed interface Expression
        permits Constant, ParameterRef, MemberAccess, Indexer, BinaryExpression, UnaryExpression,
        ConditionalExpression, ConvertExpression, MethodCall, AggregateCall, NewRecord, NewArray,
        LambdaExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * @return The static type of this expression
     */
    TypeRef type();
}
