package org.ccwonline.management.dynamic.compiler;

import org.ccwonline.management.dynamic.ast.LambdaExpression;
import org.ccwonline.management.dynamic.types.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An executable lambda compiled from a parsed expression.
 *
 * Instances are immutable and may be invoked concurrently.
 */
public final class CompiledLambda {

    private static final Logger logger = LoggerFactory.getLogger(CompiledLambda.class);

    private final LambdaExpression lambda;
    private final Evaluator body;

    private CompiledLambda(LambdaExpression lambda, Evaluator body) {
        this.lambda = lambda;
        this.body = body;
    }

    public static CompiledLambda compile(LambdaExpression lambda) {
        Objects.requireNonNull(lambda, "Lambda cannot be null");
        Evaluator body = new ExpressionCompiler().compile(lambda.body());
        logger.debug("Compiled lambda with {} parameter(s) returning {}",
                lambda.parameters().size(), lambda.type().typeName());
        return new CompiledLambda(lambda, body);
    }

    public LambdaExpression lambda() {
        return lambda;
    }

    public TypeRef returnType() {
        return lambda.type();
    }

    /**
     * Invokes the lambda with one argument per declared parameter.
     */
    public Object invoke(Object... args) {
        if (args.length != lambda.parameters().size()) {
            throw new IllegalArgumentException("Expected " + lambda.parameters().size()
                    + " argument(s) but got " + args.length);
        }
        Object[] frame = new Object[lambda.frameSize()];
        System.arraycopy(args, 0, frame, 0, args.length);
        return body.evaluate(frame);
    }

    /**
     * Views a single-parameter boolean lambda as a predicate; a null result counts as false.
     */
    public <T> Predicate<T> asPredicate() {
        return value -> Boolean.TRUE.equals(invoke(value));
    }

    /**
     * Views a single-parameter lambda as a function.
     */
    @SuppressWarnings("unchecked")
    public <T, R> Function<T, R> asFunction() {
        return value -> (R) invoke(value);
    }
}
