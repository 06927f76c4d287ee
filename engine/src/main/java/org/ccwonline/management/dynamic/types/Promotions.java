package org.ccwonline.management.dynamic.types;

import org.ccwonline.management.dynamic.ast.Constant;
import org.ccwonline.management.dynamic.ast.ConvertExpression;
import org.ccwonline.management.dynamic.ast.Expression;

import java.math.BigDecimal;

/**
 * Promotes an expression to a target type.
 *
 * Literals are re-typed rather than converted: an integer literal written as {@code 100}
 * becomes a {@code long} or {@code BigDecimal} constant when that is what the other
 * operand needs, and the {@code null} literal becomes a constant of any nullable type.
 */
public final class Promotions {

    private Promotions() {
    }

    /**
     * @param expr  The expression to promote
     * @param type  The target type
     * @param exact true to always wrap a changed type in a conversion node
     * @return The promoted expression, or null if no implicit promotion exists
     */
    public static Expression promote(Expression expr, TypeRef type, boolean exact) {
        if (expr.type().equals(type)) {
            return expr;
        }
        if (expr instanceof Constant constant && constant.isLiteral()) {
            if (constant.isNullLiteral()) {
                return Types.isNullable(type) ? new Constant(null, type, Constant.NULL_TEXT) : null;
            }
            Constant retyped = retypeLiteral(constant, type);
            if (retyped != null) {
                return retyped;
            }
        }
        if (Types.isCompatibleWith(expr.type(), type)) {
            if (Types.isValueType(type) || exact) {
                return new ConvertExpression(expr, type);
            }
            return expr;
        }
        return null;
    }

    private static Constant retypeLiteral(Constant literal, TypeRef type) {
        if (!(type instanceof TypeRef.ClassType ct)) {
            return null;
        }
        Class<?> target = Types.unbox(ct.type());
        // Integer literals retype to any numeric type, real literals only to decimal
        boolean integral = Types.isIntegral(literal.type());
        if (Types.isNumeric(literal.type()) && Types.isNumeric(type)
                && (integral || target == BigDecimal.class)) {
            Object value = parseNumber(literal.literalText(), target);
            return value == null ? null : new Constant(value, type, literal.literalText());
        }
        if (target.isEnum() && literal.value() instanceof String name) {
            Object value = parseEnum(name, target);
            return value == null ? null : new Constant(value, type, literal.literalText());
        }
        return null;
    }

    /**
     * Parses numeric literal text as the given primitive or decimal type.
     *
     * @return The value, or null if the text is not a valid literal of that type
     */
    static Object parseNumber(String text, Class<?> target) {
        try {
            if (target == byte.class) return Byte.parseByte(text);
            if (target == short.class) return Short.parseShort(text);
            if (target == int.class) return Integer.parseInt(text);
            if (target == long.class) return Long.parseLong(text);
            if (target == float.class) return Float.parseFloat(text);
            if (target == double.class) return Double.parseDouble(text);
            if (target == BigDecimal.class) return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }

    private static Object parseEnum(String name, Class<?> enumType) {
        for (Object constant : enumType.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(name)) {
                return constant;
            }
        }
        return null;
    }
}
