package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed lambda.
 *
 * @param parameters The declared parameters, occupying the first frame slots
 * @param body       The body
 * @param frameSize  Number of frame slots, including element variables of nested sequence functions
 */
public record LambdaExpression(List<ParameterRef> parameters, Expression body, int frameSize) implements Expression {

    public LambdaExpression {
        parameters = List.copyOf(parameters);
        Objects.requireNonNull(body, "Body cannot be null");
        if (frameSize < parameters.size()) {
            throw new IllegalArgumentException("Frame too small for parameters: " + frameSize);
        }
    }

    @Override
    public TypeRef type() {
        return body.type();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLambda(this);
    }
}
