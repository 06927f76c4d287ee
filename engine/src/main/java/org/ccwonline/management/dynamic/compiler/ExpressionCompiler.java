package org.ccwonline.management.dynamic.compiler;

import org.ccwonline.management.dynamic.ast.AggregateCall;
import org.ccwonline.management.dynamic.ast.BinaryExpression;
import org.ccwonline.management.dynamic.ast.BinaryExpression.BinaryOperator;
import org.ccwonline.management.dynamic.ast.ConditionalExpression;
import org.ccwonline.management.dynamic.ast.Constant;
import org.ccwonline.management.dynamic.ast.ConvertExpression;
import org.ccwonline.management.dynamic.ast.Expression;
import org.ccwonline.management.dynamic.ast.ExpressionVisitor;
import org.ccwonline.management.dynamic.ast.Indexer;
import org.ccwonline.management.dynamic.ast.LambdaExpression;
import org.ccwonline.management.dynamic.ast.MemberAccess;
import org.ccwonline.management.dynamic.ast.MethodCall;
import org.ccwonline.management.dynamic.ast.NewArray;
import org.ccwonline.management.dynamic.ast.NewRecord;
import org.ccwonline.management.dynamic.ast.ParameterRef;
import org.ccwonline.management.dynamic.ast.UnaryExpression;
import org.ccwonline.management.dynamic.types.AggregateFunction;
import org.ccwonline.management.dynamic.types.BuiltinMethod;
import org.ccwonline.management.dynamic.types.Member;
import org.ccwonline.management.dynamic.types.RecordType;
import org.ccwonline.management.dynamic.types.TypeRef;
import org.ccwonline.management.dynamic.types.Types;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Compiles expression trees into {@link Evaluator} closures.
 *
 * Member reads and method calls on a null target yield null instead of failing, unless
 * the member is defined for null ({@code HasValue}, {@code Value}).
 */
public final class ExpressionCompiler implements ExpressionVisitor<Evaluator> {

    public Evaluator compile(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Evaluator visitConstant(Constant constant) {
        Object value = constant.value();
        return frame -> value;
    }

    @Override
    public Evaluator visitParameter(ParameterRef parameter) {
        int slot = parameter.slot();
        return frame -> frame[slot];
    }

    @Override
    public Evaluator visitMemberAccess(MemberAccess memberAccess) {
        Member member = memberAccess.member();
        if (memberAccess.instance() == null) {
            return frame -> member.get(null);
        }
        Evaluator instance = compile(memberAccess.instance());
        boolean handlesNull = member.handlesNull();
        return frame -> {
            Object target = instance.evaluate(frame);
            if (target == null && !handlesNull) {
                return null;
            }
            return member.get(target);
        };
    }

    @Override
    public Evaluator visitIndexer(Indexer indexer) {
        Evaluator instance = compile(indexer.instance());
        Evaluator index = compile(indexer.index());
        return frame -> {
            Object target = instance.evaluate(frame);
            Object key = index.evaluate(frame);
            if (target == null || key == null) {
                return null;
            }
            return Operators.elementAt(target, key);
        };
    }

    @Override
    public Evaluator visitBinary(BinaryExpression binary) {
        Evaluator left = compile(binary.left());
        Evaluator right = compile(binary.right());
        BinaryOperator op = binary.operator();
        return switch (op) {
            case AND -> frame -> {
                Object l = left.evaluate(frame);
                if (Boolean.FALSE.equals(l)) {
                    return false;
                }
                Object r = right.evaluate(frame);
                if (Boolean.FALSE.equals(r)) {
                    return false;
                }
                return l == null || r == null ? null : Boolean.TRUE;
            };
            case OR -> frame -> {
                Object l = left.evaluate(frame);
                if (Boolean.TRUE.equals(l)) {
                    return true;
                }
                Object r = right.evaluate(frame);
                if (Boolean.TRUE.equals(r)) {
                    return true;
                }
                return l == null || r == null ? null : Boolean.FALSE;
            };
            case EQUAL -> frame -> Operators.equal(left.evaluate(frame), right.evaluate(frame));
            case NOT_EQUAL -> frame -> !Operators.equal(left.evaluate(frame), right.evaluate(frame));
            case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL ->
                    frame -> Operators.relational(op, left.evaluate(frame), right.evaluate(frame));
            case CONCAT -> frame -> Operators.concat(left.evaluate(frame), right.evaluate(frame));
            default -> frame -> Operators.arithmetic(op, left.evaluate(frame), right.evaluate(frame));
        };
    }

    @Override
    public Evaluator visitUnary(UnaryExpression unary) {
        Evaluator operand = compile(unary.operand());
        if (unary.operator() == UnaryExpression.UnaryOperator.NEGATE) {
            return frame -> Operators.negate(operand.evaluate(frame));
        }
        return frame -> Operators.not(operand.evaluate(frame));
    }

    @Override
    public Evaluator visitConditional(ConditionalExpression conditional) {
        Evaluator test = compile(conditional.test());
        Evaluator ifTrue = compile(conditional.ifTrue());
        Evaluator ifFalse = compile(conditional.ifFalse());
        return frame -> Boolean.TRUE.equals(test.evaluate(frame)) ? ifTrue.evaluate(frame) : ifFalse.evaluate(frame);
    }

    @Override
    public Evaluator visitConvert(ConvertExpression convert) {
        Evaluator operand = compile(convert.operand());
        TypeRef type = convert.type();
        return frame -> Conversions.convert(operand.evaluate(frame), type);
    }

    @Override
    public Evaluator visitMethodCall(MethodCall methodCall) {
        BuiltinMethod method = methodCall.method();
        Evaluator instance = methodCall.instance() == null ? null : compile(methodCall.instance());
        List<Evaluator> arguments = methodCall.arguments().stream().map(this::compile).toList();
        List<TypeRef> parameterTypes = method.parameterTypes();
        return frame -> {
            Object target = null;
            if (instance != null) {
                target = instance.evaluate(frame);
                if (target == null) {
                    return null;
                }
            }
            Object[] args = new Object[arguments.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = arguments.get(i).evaluate(frame);
                if (args[i] == null && !Types.isNullable(parameterTypes.get(i))) {
                    return null;
                }
            }
            return method.invoker().invoke(target, args);
        };
    }

    @Override
    public Evaluator visitAggregate(AggregateCall aggregate) {
        Evaluator source = compile(aggregate.source());
        Evaluator argument = aggregate.argument() == null ? null : compile(aggregate.argument());
        int slot = aggregate.element() == null ? -1 : aggregate.element().slot();
        TypeRef type = aggregate.type();
        return switch (aggregate.function()) {
            case WHERE -> frame -> {
                Object sequence = source.evaluate(frame);
                if (sequence == null) return null;
                List<Object> result = new ArrayList<>();
                for (Object element : Operators.iterable(sequence)) {
                    if (matches(argument, slot, element, frame)) {
                        result.add(element);
                    }
                }
                return result;
            };
            case ANY -> frame -> {
                Object sequence = source.evaluate(frame);
                if (sequence == null) return null;
                for (Object element : Operators.iterable(sequence)) {
                    if (matches(argument, slot, element, frame)) {
                        return true;
                    }
                }
                return false;
            };
            case ALL -> frame -> {
                Object sequence = source.evaluate(frame);
                if (sequence == null) return null;
                for (Object element : Operators.iterable(sequence)) {
                    if (!matches(argument, slot, element, frame)) {
                        return false;
                    }
                }
                return true;
            };
            case COUNT -> frame -> {
                Object sequence = source.evaluate(frame);
                if (sequence == null) return null;
                int count = 0;
                for (Object element : Operators.iterable(sequence)) {
                    if (matches(argument, slot, element, frame)) {
                        count++;
                    }
                }
                return count;
            };
            case MIN, MAX -> {
                boolean max = aggregate.function() == AggregateFunction.MAX;
                yield frame -> {
                    Object sequence = source.evaluate(frame);
                    if (sequence == null) return null;
                    Object best = null;
                    for (Object value : select(argument, slot, sequence, frame)) {
                        if (value != null && (best == null
                                || (max ? Operators.compare(value, best) > 0 : Operators.compare(value, best) < 0))) {
                            best = value;
                        }
                    }
                    return best;
                };
            }
            case SUM -> frame -> {
                Object sequence = source.evaluate(frame);
                if (sequence == null) return null;
                Object sum = Conversions.convert(0, type);
                for (Object value : select(argument, slot, sequence, frame)) {
                    if (value != null) {
                        sum = add(sum, Conversions.convert(value, type));
                    }
                }
                return sum;
            };
            case AVERAGE -> frame -> {
                Object sequence = source.evaluate(frame);
                if (sequence == null) return null;
                BigDecimal sum = BigDecimal.ZERO;
                double doubleSum = 0;
                int count = 0;
                for (Object value : select(argument, slot, sequence, frame)) {
                    if (value != null) {
                        if (value instanceof BigDecimal bd) {
                            sum = sum.add(bd);
                        } else {
                            doubleSum += ((Number) value).doubleValue();
                        }
                        count++;
                    }
                }
                if (count == 0) {
                    return null;
                }
                if (type.runtimeClass() == BigDecimal.class) {
                    return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128);
                }
                return doubleSum / count;
            };
            case CONTAINS -> frame -> {
                Object sequence = source.evaluate(frame);
                if (sequence == null) return null;
                Object value = argument.evaluate(frame);
                for (Object element : Operators.iterable(sequence)) {
                    if (Operators.equal(element, value)) {
                        return true;
                    }
                }
                return false;
            };
        };
    }

    private static boolean matches(Evaluator predicate, int slot, Object element, Object[] frame) {
        if (predicate == null) {
            return true;
        }
        frame[slot] = element;
        return Boolean.TRUE.equals(predicate.evaluate(frame));
    }

    private static Iterable<Object> select(Evaluator selector, int slot, Object sequence, Object[] frame) {
        Iterator<?> elements = Operators.iterable(sequence).iterator();
        return () -> new Iterator<>() {
            @Override
            public boolean hasNext() {
                return elements.hasNext();
            }

            @Override
            public Object next() {
                frame[slot] = elements.next();
                return selector.evaluate(frame);
            }
        };
    }

    private static Object add(Object sum, Object value) {
        if (sum instanceof Integer s) return Math.addExact(s, (Integer) value);
        if (sum instanceof Long s) return Math.addExact(s, (Long) value);
        return Operators.arithmetic(BinaryOperator.ADD, sum, value);
    }

    @Override
    public Evaluator visitNewRecord(NewRecord newRecord) {
        RecordType type = newRecord.type();
        List<Evaluator> values = newRecord.values().stream().map(this::compile).toList();
        return frame -> {
            Object[] args = new Object[values.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = values.get(i).evaluate(frame);
            }
            return type.newInstance(args);
        };
    }

    @Override
    public Evaluator visitNewArray(NewArray newArray) {
        List<Evaluator> elements = newArray.elements().stream().map(this::compile).toList();
        return frame -> {
            List<Object> result = new ArrayList<>(elements.size());
            for (Evaluator element : elements) {
                result.add(element.evaluate(frame));
            }
            return result;
        };
    }

    @Override
    public Evaluator visitLambda(LambdaExpression lambda) {
        return compile(lambda.body());
    }
}
