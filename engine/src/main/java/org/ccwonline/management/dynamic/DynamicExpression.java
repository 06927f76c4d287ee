package org.ccwonline.management.dynamic;

import org.ccwonline.management.dynamic.ast.Expression;
import org.ccwonline.management.dynamic.ast.LambdaExpression;
import org.ccwonline.management.dynamic.ast.ParameterRef;
import org.ccwonline.management.dynamic.classes.ClassFactory;
import org.ccwonline.management.dynamic.classes.DynamicProperty;
import org.ccwonline.management.dynamic.compiler.CompiledLambda;
import org.ccwonline.management.dynamic.compiler.OrderingComparator;
import org.ccwonline.management.dynamic.parser.ExpressionParser;
import org.ccwonline.management.dynamic.types.Promotions;
import org.ccwonline.management.dynamic.types.RecordType;
import org.ccwonline.management.dynamic.types.TypeRef;
import org.ccwonline.management.dynamic.types.Types;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Entry point for parsing and compiling dynamic expressions.
 *
 * <pre>
 *   Predicate&lt;Conference&gt; p = DynamicExpression.parsePredicate(Conference.class, "ConferenceId &lt; @0", 100);
 *   Comparator&lt;Conference&gt; c = DynamicExpression.parseComparator(Conference.class, "Status, ConferenceId desc");
 * </pre>
 *
 * Members of the element type are in scope unqualified; {@code it} names the element itself.
 */
public final class DynamicExpression {

    private DynamicExpression() {
    }

    // ==================== Parsing ====================

    /**
     * Parses an expression without parameters.
     *
     * @param resultType The required result type, or null for any
     */
    public static Expression parse(TypeRef resultType, String expression, Object... values) {
        return new ExpressionParser(List.of(), expression, values).parse(resultType);
    }

    /**
     * Parses a lambda over the implicit parameter {@code it}.
     *
     * @param itType     The parameter type
     * @param resultType The required result type, or null for any
     */
    public static LambdaExpression parseLambda(TypeRef itType, TypeRef resultType, String expression, Object... values) {
        Objects.requireNonNull(itType, "Parameter type cannot be null");
        ExpressionParser parser = new ExpressionParser(List.of(new ParameterRef("", itType, 0)), expression, values);
        Expression body = parser.parse(resultType);
        return new LambdaExpression(parser.parameters(), body, parser.frameSize());
    }

    public static LambdaExpression parseLambda(Class<?> itType, Class<?> resultType, String expression, Object... values) {
        return parseLambda(TypeRef.of(itType), resultType == null ? null : TypeRef.of(resultType), expression, values);
    }

    /**
     * Parses a lambda over named parameters, in declaration order.
     */
    public static LambdaExpression parseLambda(Map<String, TypeRef> parameters, TypeRef resultType,
                                               String expression, Object... values) {
        List<ParameterRef> refs = new ArrayList<>();
        for (Map.Entry<String, TypeRef> entry : parameters.entrySet()) {
            refs.add(new ParameterRef(entry.getKey(), entry.getValue(), refs.size()));
        }
        ExpressionParser parser = new ExpressionParser(refs, expression, values);
        Expression body = parser.parse(resultType);
        return new LambdaExpression(parser.parameters(), body, parser.frameSize());
    }

    /**
     * Parses a boolean lambda over {@code it}. A nullable boolean result is accepted and
     * null counts as false.
     */
    public static LambdaExpression parsePredicateLambda(TypeRef itType, String expression, Object... values) {
        LambdaExpression lambda = parseLambda(itType, null, expression, values);
        if (Types.isBoolean(lambda.type())) {
            return lambda;
        }
        Expression promoted = Promotions.promote(lambda.body(), TypeRef.BOOLEAN, true);
        if (promoted == null) {
            throw new ParseException("Expression of type 'Boolean' expected", 0);
        }
        return new LambdaExpression(lambda.parameters(), promoted, lambda.frameSize());
    }

    public static <T> Predicate<T> parsePredicate(Class<T> itType, String expression, Object... values) {
        return compile(parsePredicateLambda(TypeRef.of(itType), expression, values)).asPredicate();
    }

    /**
     * Parses and compiles a value lambda over {@code it}.
     */
    public static CompiledLambda parseSelector(TypeRef itType, String expression, Object... values) {
        return compile(parseLambda(itType, null, expression, values));
    }

    /**
     * Parses an ordering such as {@code "Status, ConferenceId desc"}.
     */
    public static List<DynamicOrdering> parseOrdering(TypeRef itType, String ordering, Object... values) {
        return orderingParser(itType, ordering, values).parseOrdering();
    }

    public static <T> Comparator<T> parseComparator(Class<T> itType, String ordering, Object... values) {
        return parseComparator(TypeRef.of(itType), ordering, values);
    }

    public static <T> Comparator<T> parseComparator(TypeRef itType, String ordering, Object... values) {
        ExpressionParser parser = orderingParser(itType, ordering, values);
        List<DynamicOrdering> orderings = parser.parseOrdering();
        return new OrderingComparator<>(orderings, parser.frameSize());
    }

    private static ExpressionParser orderingParser(TypeRef itType, String ordering, Object... values) {
        Objects.requireNonNull(itType, "Parameter type cannot be null");
        return new ExpressionParser(List.of(new ParameterRef("", itType, 0)), ordering, values);
    }

    // ==================== Compilation and Types ====================

    public static CompiledLambda compile(LambdaExpression lambda) {
        return CompiledLambda.compile(lambda);
    }

    /**
     * Returns the dynamic record type with the given properties, shared by every caller
     * asking for the same set of (name, type) pairs.
     */
    public static RecordType createClass(List<DynamicProperty> properties) {
        return ClassFactory.instance().getDynamicClass(properties);
    }

    public static RecordType createClass(DynamicProperty... properties) {
        return createClass(List.of(properties));
    }
}
