package org.ccwonline.management.dynamic.parser;

import org.ccwonline.management.dynamic.AmbiguousOperatorException;
import org.ccwonline.management.dynamic.DynamicOrdering;
import org.ccwonline.management.dynamic.IncompatibleOperandsException;
import org.ccwonline.management.dynamic.ParseException;
import org.ccwonline.management.dynamic.UnknownMemberException;
import org.ccwonline.management.dynamic.ast.AggregateCall;
import org.ccwonline.management.dynamic.ast.BinaryExpression;
import org.ccwonline.management.dynamic.ast.BinaryExpression.BinaryOperator;
import org.ccwonline.management.dynamic.ast.ConditionalExpression;
import org.ccwonline.management.dynamic.ast.Constant;
import org.ccwonline.management.dynamic.ast.ConvertExpression;
import org.ccwonline.management.dynamic.ast.Expression;
import org.ccwonline.management.dynamic.ast.Indexer;
import org.ccwonline.management.dynamic.ast.MemberAccess;
import org.ccwonline.management.dynamic.ast.MethodCall;
import org.ccwonline.management.dynamic.ast.NewArray;
import org.ccwonline.management.dynamic.ast.NewRecord;
import org.ccwonline.management.dynamic.ast.ParameterRef;
import org.ccwonline.management.dynamic.ast.UnaryExpression;
import org.ccwonline.management.dynamic.ast.UnaryExpression.UnaryOperator;
import org.ccwonline.management.dynamic.classes.ClassFactory;
import org.ccwonline.management.dynamic.classes.DynamicProperty;
import org.ccwonline.management.dynamic.types.AggregateFunction;
import org.ccwonline.management.dynamic.types.BuiltinMethod;
import org.ccwonline.management.dynamic.types.BuiltinMethods;
import org.ccwonline.management.dynamic.types.Member;
import org.ccwonline.management.dynamic.types.MemberResolver;
import org.ccwonline.management.dynamic.types.OverloadResolver;
import org.ccwonline.management.dynamic.types.OverloadResolver.Resolution;
import org.ccwonline.management.dynamic.types.PredefinedTypes;
import org.ccwonline.management.dynamic.types.Promotions;
import org.ccwonline.management.dynamic.types.RecordType;
import org.ccwonline.management.dynamic.types.Signatures;
import org.ccwonline.management.dynamic.types.TypeRef;
import org.ccwonline.management.dynamic.types.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import static org.ccwonline.management.dynamic.parser.TokenId.*;

/**
 * Recursive descent parser producing typed expression trees.
 *
 * Precedence, lowest first:
 * <pre>
 *   ?:                    conditional
 *   ||  or                logical or
 *   &amp;&amp;  and               logical and
 *   ==  =  !=  &lt;&gt;         equality
 *   &lt;  &lt;=  &gt;  &gt;=          relational
 *   +  -  &amp;               additive, string concatenation
 *   *  /  %  mod          multiplicative
 *   -  !  not             unary
 *   primary               literals, identifiers, x.y, x[i], f(...), new(...), iif(...)
 * </pre>
 *
 * Identifiers resolve, in order, to predefined type names, declared parameters,
 * substitution values ({@code @0}, {@code {0}}, named values) and finally members of the
 * implicit {@code it} parameter. A parser instance parses one text once.
 */
public final class ExpressionParser {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);

    private final Lexer lexer;
    private final Map<String, Object> symbols = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, Object> externals = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final List<ParameterRef> parameters;
    private ParameterRef it;
    private int frameSize;

    /**
     * @param parameters The lambda parameters, occupying frame slots 0..n-1. A single
     *                   parameter with an empty name becomes the implicit {@code it}.
     * @param text       The expression text
     * @param values     Substitution values for {@code @0}, {@code @1}, ...; a trailing
     *                   {@code Map<String, ?>} supplies named values
     */
    public ExpressionParser(List<ParameterRef> parameters, String text, Object... values) {
        Objects.requireNonNull(text, "Expression text cannot be null");
        this.parameters = List.copyOf(parameters);
        this.frameSize = this.parameters.size();
        processParameters();
        processValues(values == null ? new Object[0] : values);
        this.lexer = new Lexer(text);
    }

    public List<ParameterRef> parameters() {
        return parameters;
    }

    /**
     * @return The number of frame slots the parsed expressions need
     */
    public int frameSize() {
        return frameSize;
    }

    // ==================== Entry Points ====================

    /**
     * Parses the whole text as one expression.
     *
     * @param resultType The required result type, or null to accept any type
     */
    public Expression parse(TypeRef resultType) {
        logger.debug("Parsing expression '{}'", lexer.text());
        int exprPos = lexer.tokenPos();
        Expression expr = parseExpression();
        if (resultType != null) {
            Expression promoted = Promotions.promote(expr, resultType, true);
            if (promoted == null) {
                throw new ParseException("Expression of type '" + resultType.typeName() + "' expected", exprPos);
            }
            expr = promoted;
        }
        validateEnd();
        return expr;
    }

    /**
     * Parses a comma separated list of keys, each optionally followed by
     * {@code asc}, {@code ascending}, {@code desc} or {@code descending}.
     */
    public List<DynamicOrdering> parseOrdering() {
        logger.debug("Parsing ordering '{}'", lexer.text());
        List<DynamicOrdering> orderings = new ArrayList<>();
        do {
            Expression expr = parseExpression();
            boolean ascending = true;
            if (check(ASC) || check(ASCENDING)) {
                advance();
            } else if (check(DESC) || check(DESCENDING)) {
                advance();
                ascending = false;
            }
            orderings.add(new DynamicOrdering(expr, ascending));
        } while (consumeIf(COMMA));
        validateEnd();
        return orderings;
    }

    // ==================== Token Helpers ====================

    private TokenId current() {
        return lexer.tokenId();
    }

    private boolean check(TokenId t) {
        return current() == t;
    }

    private void advance() {
        lexer.nextToken();
    }

    private boolean consumeIf(TokenId t) {
        if (check(t)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenId t, String message) {
        if (!check(t)) {
            throw error(message);
        }
        advance();
    }

    private String expectIdentifier() {
        if (check(IDENTIFIER) || current().isKeyword()) {
            String name = lexer.token().text();
            advance();
            return name;
        }
        throw error("Identifier expected");
    }

    private void validateEnd() {
        if (!check(EOF)) {
            throw error("Syntax error");
        }
    }

    private ParseException error(String message) {
        return new ParseException(message, lexer.tokenPos());
    }

    // ==================== Symbols ====================

    private void processParameters() {
        for (int i = 0; i < parameters.size(); i++) {
            ParameterRef p = parameters.get(i);
            if (p.slot() != i) {
                throw new IllegalArgumentException("Parameter '" + p.name() + "' must use slot " + i);
            }
            if (!p.name().isEmpty()) {
                addSymbol(p.name(), p);
            }
        }
        if (parameters.size() == 1 && parameters.get(0).name().isEmpty()) {
            it = parameters.get(0);
        }
    }

    private void processValues(Object[] values) {
        for (int i = 0; i < values.length; i++) {
            Object value = values[i];
            if (i == values.length - 1 && value instanceof Map<?, ?> named) {
                for (Map.Entry<?, ?> entry : named.entrySet()) {
                    externals.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            } else {
                addSymbol("@" + i, value);
            }
        }
    }

    private void addSymbol(String name, Object value) {
        if (symbols.containsKey(name)) {
            throw new ParseException("The identifier '" + name + "' was defined more than once", 0);
        }
        symbols.put(name, value);
    }

    /**
     * Static type of a substituted value. Non-null boxed numbers are typed as their primitive.
     */
    static TypeRef valueType(Object value) {
        if (value == null) {
            return TypeRef.OBJECT;
        }
        if (value instanceof Iterable<?> iterable) {
            Class<?> common = null;
            for (Object element : iterable) {
                if (element == null) {
                    continue;
                }
                if (common == null) {
                    common = element.getClass();
                } else if (!common.isInstance(element)) {
                    common = Object.class;
                }
            }
            return TypeRef.sequenceOf(common == null ? TypeRef.OBJECT : TypeRef.of(common));
        }
        return TypeRef.of(Types.unbox(value.getClass()));
    }

    // ==================== Conditional and Logical ====================

    // ?: operator
    private Expression parseExpression() {
        int errorPos = lexer.tokenPos();
        Expression expr = parseLogicalOr();
        if (consumeIf(QUESTION)) {
            Expression ifTrue = parseExpression();
            expect(COLON, "':' expected");
            Expression ifFalse = parseExpression();
            expr = generateConditional(expr, ifTrue, ifFalse, errorPos);
        }
        return expr;
    }

    // ||, or operator
    private Expression parseLogicalOr() {
        Expression left = parseLogicalAnd();
        while (check(DOUBLE_BAR) || check(OR)) {
            Token op = lexer.token();
            advance();
            Expression right = parseLogicalAnd();
            List<Expression> operands = checkAndPromoteOperands(Signatures.LOGICAL, op, left, right);
            left = new BinaryExpression(BinaryOperator.OR, operands.get(0), operands.get(1), operands.get(0).type());
        }
        return left;
    }

    // &&, and operator
    private Expression parseLogicalAnd() {
        Expression left = parseEquality();
        while (check(DOUBLE_AMPERSAND) || check(AND)) {
            Token op = lexer.token();
            advance();
            Expression right = parseEquality();
            List<Expression> operands = checkAndPromoteOperands(Signatures.LOGICAL, op, left, right);
            left = new BinaryExpression(BinaryOperator.AND, operands.get(0), operands.get(1), operands.get(0).type());
        }
        return left;
    }

    // ==================== Comparison ====================

    // =, ==, !=, <> operators
    private Expression parseEquality() {
        Expression left = parseRelational();
        while (check(EQUAL) || check(DOUBLE_EQUAL) || check(NOT_EQUAL)) {
            Token op = lexer.token();
            advance();
            Expression right = parseRelational();
            List<Expression> operands;
            if (Types.isEnum(left.type()) || Types.isEnum(right.type())) {
                operands = promoteEnumOperands(op, left, right);
            } else if (!Types.isValueType(left.type()) && !Types.isValueType(right.type())) {
                operands = promoteReferenceOperands(op, left, right);
            } else {
                operands = checkAndPromoteOperands(Signatures.EQUALITY, op, left, right);
            }
            BinaryOperator operator = op.id() == NOT_EQUAL ? BinaryOperator.NOT_EQUAL : BinaryOperator.EQUAL;
            left = new BinaryExpression(operator, operands.get(0), operands.get(1), TypeRef.BOOLEAN);
        }
        return left;
    }

    // <, <=, >, >= operators
    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (check(LESS_THAN) || check(LESS_EQUAL) || check(GREATER_THAN) || check(GREATER_EQUAL)) {
            Token op = lexer.token();
            advance();
            Expression right = parseAdditive();
            List<Expression> operands;
            if (Types.isEnum(left.type()) || Types.isEnum(right.type())) {
                operands = promoteEnumOperands(op, left, right);
            } else {
                operands = checkAndPromoteOperands(Signatures.RELATIONAL, op, left, right);
            }
            BinaryOperator operator = switch (op.id()) {
                case LESS_THAN -> BinaryOperator.LESS;
                case LESS_EQUAL -> BinaryOperator.LESS_EQUAL;
                case GREATER_THAN -> BinaryOperator.GREATER;
                default -> BinaryOperator.GREATER_EQUAL;
            };
            left = new BinaryExpression(operator, operands.get(0), operands.get(1), TypeRef.BOOLEAN);
        }
        return left;
    }

    private List<Expression> promoteEnumOperands(Token op, Expression left, Expression right) {
        if (left.type().equals(right.type())) {
            return List.of(left, right);
        }
        Expression promoted = Promotions.promote(right, left.type(), true);
        if (promoted != null) {
            return List.of(left, promoted);
        }
        promoted = Promotions.promote(left, right.type(), true);
        if (promoted != null) {
            return List.of(promoted, right);
        }
        throw new IncompatibleOperandsException(op.text(), left.type(), right.type(), op.pos());
    }

    private List<Expression> promoteReferenceOperands(Token op, Expression left, Expression right) {
        if (left.type().equals(right.type())) {
            return List.of(left, right);
        }
        Expression promoted = Promotions.promote(right, left.type(), true);
        if (promoted != null) {
            return List.of(left, promoted);
        }
        promoted = Promotions.promote(left, right.type(), true);
        if (promoted != null) {
            return List.of(promoted, right);
        }
        throw new IncompatibleOperandsException(op.text(), left.type(), right.type(), op.pos());
    }

    // ==================== Arithmetic ====================

    // +, -, & operators
    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (check(PLUS) || check(MINUS) || check(AMPERSAND)) {
            Token op = lexer.token();
            advance();
            Expression right = parseMultiplicative();
            if (op.id() == AMPERSAND
                    || (op.id() == PLUS && (Types.isString(left.type()) || Types.isString(right.type())))) {
                left = new BinaryExpression(BinaryOperator.CONCAT, left, right, TypeRef.STRING);
                continue;
            }
            Signatures signatures = op.id() == PLUS ? Signatures.ADD : Signatures.SUBTRACT;
            List<Expression> operands = checkAndPromoteOperands(signatures, op, left, right);
            BinaryOperator operator = op.id() == PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            left = new BinaryExpression(operator, operands.get(0), operands.get(1),
                    additiveResultType(operator, operands.get(0).type(), operands.get(1).type()));
        }
        return left;
    }

    private static TypeRef additiveResultType(BinaryOperator operator, TypeRef left, TypeRef right) {
        Class<?> date = LocalDateTime.class;
        if (operator == BinaryOperator.SUBTRACT && left.runtimeClass() == date && right.runtimeClass() == date) {
            return TypeRef.of(Duration.class);
        }
        return left;
    }

    // *, /, %, mod operators
    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (check(ASTERISK) || check(SLASH) || check(PERCENT) || check(MOD)) {
            Token op = lexer.token();
            advance();
            Expression right = parseUnary();
            List<Expression> operands = checkAndPromoteOperands(Signatures.ARITHMETIC, op, left, right);
            BinaryOperator operator = switch (op.id()) {
                case ASTERISK -> BinaryOperator.MULTIPLY;
                case SLASH -> BinaryOperator.DIVIDE;
                default -> BinaryOperator.MODULO;
            };
            left = new BinaryExpression(operator, operands.get(0), operands.get(1), operands.get(0).type());
        }
        return left;
    }

    // -, !, not unary operators
    private Expression parseUnary() {
        if (check(MINUS) || check(EXCLAMATION) || check(NOT)) {
            Token op = lexer.token();
            advance();
            if (op.id() == MINUS && (check(INTEGER_LITERAL) || check(REAL_LITERAL))) {
                return parsePrimary(true);
            }
            Expression operand = parseUnary();
            if (op.id() == MINUS) {
                Expression promoted = checkAndPromoteOperand(Signatures.NEGATION, op, operand);
                return new UnaryExpression(UnaryOperator.NEGATE, promoted, promoted.type());
            }
            Expression promoted = checkAndPromoteOperand(Signatures.NOT, op, operand);
            return new UnaryExpression(UnaryOperator.NOT, promoted, promoted.type());
        }
        return parsePrimary(false);
    }

    // ==================== Overload Resolution ====================

    private List<Expression> checkAndPromoteOperands(Signatures signatures, Token op, Expression left, Expression right) {
        List<Resolution<Signatures.OperatorSignature>> best =
                OverloadResolver.findBest(signatures.signatures(), List.of(left, right));
        if (best.isEmpty()) {
            throw new IncompatibleOperandsException(op.text(), left.type(), right.type(), op.pos());
        }
        if (best.size() > 1) {
            throw new AmbiguousOperatorException(op.text(), left.type(), right.type(), op.pos());
        }
        return best.get(0).arguments();
    }

    private Expression checkAndPromoteOperand(Signatures signatures, Token op, Expression operand) {
        List<Resolution<Signatures.OperatorSignature>> best =
                OverloadResolver.findBest(signatures.signatures(), List.of(operand));
        if (best.isEmpty()) {
            throw new IncompatibleOperandsException(op.text(), operand.type(), op.pos());
        }
        if (best.size() > 1) {
            throw new AmbiguousOperatorException(op.text(), operand.type(), op.pos());
        }
        return best.get(0).arguments().get(0);
    }

    // ==================== Primary ====================

    private Expression parsePrimary(boolean negative) {
        Expression expr = parsePrimaryStart(negative);
        while (true) {
            if (consumeIf(DOT)) {
                expr = parseMemberAccess(null, expr);
            } else if (check(OPEN_BRACKET)) {
                expr = parseElementAccess(expr);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expression parsePrimaryStart(boolean negative) {
        return switch (current()) {
            case IDENTIFIER -> parseIdentifier();
            case STRING_LITERAL, CHAR_LITERAL -> parseStringLiteral();
            case INTEGER_LITERAL -> parseIntegerLiteral(negative);
            case REAL_LITERAL -> parseRealLiteral(negative);
            case OPEN_PAREN -> parseParenExpression();
            case IT -> parseIt();
            case IIF -> parseIif();
            case NEW -> parseNew();
            case TRUE, FALSE -> parseBooleanLiteral();
            case NULL -> {
                advance();
                yield Constant.nullLiteral();
            }
            default -> throw error("Expression expected");
        };
    }

    private Expression parseParenExpression() {
        expect(OPEN_PAREN, "'(' expected");
        Expression expr = parseExpression();
        expect(CLOSE_PAREN, "')' or operator expected");
        return expr;
    }

    private Expression parseIt() {
        if (it == null) {
            throw error("No 'it' is in scope");
        }
        advance();
        return it;
    }

    private Expression parseIdentifier() {
        String name = lexer.stringVal();
        Optional<TypeRef> type = PredefinedTypes.find(name);
        if (type.isPresent()) {
            return parseTypeAccess(type.get());
        }
        if (symbols.containsKey(name)) {
            advance();
            Object value = symbols.get(name);
            return value instanceof ParameterRef p ? p : Constant.of(value, valueType(value));
        }
        if (externals.containsKey(name)) {
            advance();
            Object value = externals.get(name);
            return Constant.of(value, valueType(value));
        }
        if (it != null) {
            return parseMemberAccess(null, it);
        }
        throw error("Unknown identifier '" + name + "'");
    }

    // ==================== Literals ====================

    private Expression parseBooleanLiteral() {
        Token token = lexer.token();
        advance();
        return new Constant(token.id() == TRUE, TypeRef.BOOLEAN, token.text());
    }

    private Expression parseStringLiteral() {
        Token token = lexer.token();
        String value = lexer.stringVal();
        advance();
        if (token.id() == CHAR_LITERAL) {
            return new Constant(value.charAt(0), TypeRef.of(char.class), token.text());
        }
        return new Constant(value, TypeRef.STRING, token.text());
    }

    private Expression parseIntegerLiteral(boolean negative) {
        Token token = lexer.token();
        String text = token.text();
        int errorPos = negative ? token.pos() - 1 : token.pos();
        int end = text.length();
        while (end > 0 && "lLuU".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        boolean suffixed = end < text.length();
        boolean hex = text.startsWith("0x") || text.startsWith("0X");
        String digits = hex ? text.substring(2, end) : text.substring(0, end);
        BigInteger value = new BigInteger(digits, hex ? 16 : 10);
        if (negative) {
            value = value.negate();
        }
        advance();

        String literalText = suffixed || hex ? null : (negative ? "-" : "") + digits;
        if (!suffixed && value.bitLength() < Integer.SIZE) {
            return new Constant(value.intValue(), TypeRef.INT, literalText);
        }
        if (value.bitLength() < Long.SIZE) {
            return new Constant(value.longValue(), TypeRef.of(long.class), literalText);
        }
        throw new ParseException("Invalid integer literal '" + (negative ? "-" : "") + text + "'", errorPos);
    }

    private Expression parseRealLiteral(boolean negative) {
        Token token = lexer.token();
        String text = (negative ? "-" : "") + token.text();
        int errorPos = negative ? token.pos() - 1 : token.pos();
        advance();
        char last = Character.toUpperCase(text.charAt(text.length() - 1));
        String digits = "FDM".indexOf(last) >= 0 ? text.substring(0, text.length() - 1) : text;
        try {
            return switch (last) {
                case 'F' -> {
                    float f = Float.parseFloat(digits);
                    if (Float.isInfinite(f)) {
                        throw new NumberFormatException(digits);
                    }
                    yield new Constant(f, TypeRef.of(float.class), null);
                }
                case 'M' -> new Constant(new BigDecimal(digits), TypeRef.of(BigDecimal.class), null);
                default -> {
                    double d = Double.parseDouble(digits);
                    if (Double.isInfinite(d)) {
                        throw new NumberFormatException(digits);
                    }
                    yield new Constant(d, TypeRef.of(double.class), last == 'D' ? null : digits);
                }
            };
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid real literal '" + text + "'", errorPos);
        }
    }

    // ==================== Conditional ====================

    private Expression parseIif() {
        int errorPos = lexer.tokenPos();
        advance();
        List<Expression> args = parseArgumentList();
        if (args.size() != 3) {
            throw new ParseException("The 'iif' function requires three arguments", errorPos);
        }
        return generateConditional(args.get(0), args.get(1), args.get(2), errorPos);
    }

    private Expression generateConditional(Expression test, Expression ifTrue, Expression ifFalse, int errorPos) {
        if (!Types.isBoolean(test.type())) {
            throw new ParseException("The first expression must be of type 'Boolean'", errorPos);
        }
        if (!ifTrue.type().equals(ifFalse.type())) {
            Expression trueAsFalse = isNullLiteral(ifFalse) ? null : Promotions.promote(ifTrue, ifFalse.type(), true);
            Expression falseAsTrue = isNullLiteral(ifTrue) ? null : Promotions.promote(ifFalse, ifTrue.type(), true);
            if (trueAsFalse != null && falseAsTrue == null) {
                ifTrue = trueAsFalse;
            } else if (falseAsTrue != null && trueAsFalse == null) {
                ifFalse = falseAsTrue;
            } else {
                String type1 = isNullLiteral(ifTrue) ? "null" : ifTrue.type().typeName();
                String type2 = isNullLiteral(ifFalse) ? "null" : ifFalse.type().typeName();
                if (trueAsFalse != null) {
                    throw new ParseException("Both of the types '" + type1 + "' and '" + type2
                            + "' convert to the other", errorPos);
                }
                throw new ParseException("Neither of the types '" + type1 + "' and '" + type2
                        + "' converts to the other", errorPos);
            }
        }
        return new ConditionalExpression(test, ifTrue, ifFalse);
    }

    private static boolean isNullLiteral(Expression expr) {
        return expr instanceof Constant c && c.isNullLiteral();
    }

    // ==================== new(...) and new[] {...} ====================

    private Expression parseNew() {
        advance();
        if (consumeIf(OPEN_BRACKET)) {
            expect(CLOSE_BRACKET, "']' expected");
            return parseNewArray();
        }
        expect(OPEN_PAREN, "'(' expected");
        List<String> names = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        do {
            int exprPos = lexer.tokenPos();
            Expression expr = parseExpression();
            String name;
            if (consumeIf(AS)) {
                name = expectIdentifier();
            } else if (expr instanceof MemberAccess access) {
                name = access.member().name();
            } else {
                throw new ParseException("Expression is missing an 'as' clause", exprPos);
            }
            for (String existing : names) {
                if (existing.equalsIgnoreCase(name)) {
                    throw new ParseException("The property '" + name + "' is already defined", exprPos);
                }
            }
            names.add(name);
            values.add(expr);
        } while (consumeIf(COMMA));
        expect(CLOSE_PAREN, "')' or ',' expected");

        List<DynamicProperty> properties = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            properties.add(new DynamicProperty(names.get(i), values.get(i).type()));
        }
        RecordType type = ClassFactory.instance().getDynamicClass(properties);
        // A cached type may list the same properties in another order
        Expression[] ordered = new Expression[values.size()];
        for (int i = 0; i < names.size(); i++) {
            ordered[type.indexOf(names.get(i))] = values.get(i);
        }
        return new NewRecord(type, List.of(ordered));
    }

    private Expression parseNewArray() {
        int errorPos = lexer.tokenPos();
        expect(OPEN_BRACE, "'{' expected");
        List<Expression> elements = check(CLOSE_BRACE) ? List.of() : parseArguments();
        expect(CLOSE_BRACE, "'}' or ',' expected");
        if (elements.isEmpty()) {
            throw new ParseException("No best type found for implicitly-typed array", errorPos);
        }
        TypeRef elementType = elements.get(0).type();
        for (Expression element : elements) {
            if (Promotions.promote(element, elementType, true) != null) {
                continue;
            }
            TypeRef candidate = element.type();
            if (elements.stream().allMatch(e -> Promotions.promote(e, candidate, true) != null)) {
                elementType = candidate;
            } else {
                throw new ParseException("No best type found for implicitly-typed array", errorPos);
            }
        }
        List<Expression> promoted = new ArrayList<>();
        for (Expression element : elements) {
            promoted.add(Promotions.promote(element, elementType, true));
        }
        return new NewArray(elementType, promoted);
    }

    // ==================== Types ====================

    private Expression parseTypeAccess(TypeRef type) {
        int errorPos = lexer.tokenPos();
        advance();
        if (consumeIf(QUESTION)) {
            if (!Types.isValueType(type) || Types.isNullable(type)) {
                throw new ParseException("Type '" + type.typeName() + "' has no nullable form", errorPos);
            }
            type = Types.nullable(type);
        }
        if (check(OPEN_PAREN)) {
            List<Expression> args = parseArgumentList();
            List<Resolution<BuiltinMethod>> best = OverloadResolver.findBest(BuiltinMethods.constructors(type), args);
            if (best.size() == 1) {
                return new MethodCall(null, best.get(0).overload(), best.get(0).arguments());
            }
            if (args.size() == 1) {
                return generateConversion(args.get(0), type, errorPos);
            }
            throw new ParseException("No matching constructor in type '" + type.typeName() + "'", errorPos);
        }
        expect(DOT, "'.' or '(' expected");
        return parseMemberAccess(type, null);
    }

    private Expression generateConversion(Expression expr, TypeRef type, int errorPos) {
        if (expr.type().equals(type)) {
            return expr;
        }
        if (Types.isExplicitlyConvertible(expr.type(), type)) {
            return new ConvertExpression(expr, type);
        }
        throw new ParseException("A value of type '" + expr.type().typeName()
                + "' cannot be converted to type '" + type.typeName() + "'", errorPos);
    }

    // ==================== Members ====================

    private Expression parseMemberAccess(TypeRef staticType, Expression instance) {
        TypeRef type = instance != null ? instance.type() : staticType;
        int errorPos = lexer.tokenPos();
        String name = expectIdentifier();
        if (check(OPEN_PAREN)) {
            if (instance != null) {
                TypeRef elementType = TypeRef.elementTypeOf(type);
                Optional<AggregateFunction> function = AggregateFunction.find(name);
                if (elementType != null && function.isPresent()) {
                    return parseAggregate(instance, elementType, function.get(), errorPos);
                }
            }
            List<Expression> args = parseArgumentList();
            List<BuiltinMethod> methods = instance != null
                    ? BuiltinMethods.instanceMethods(type, name)
                    : BuiltinMethods.staticMethods(type, name);
            List<Resolution<BuiltinMethod>> best = OverloadResolver.findBest(methods, args);
            if (best.isEmpty()) {
                throw new UnknownMemberException("No applicable method '" + name + "' exists in type '"
                        + type.typeName() + "'", name, errorPos);
            }
            if (best.size() > 1) {
                throw new ParseException("Ambiguous invocation of method '" + name + "' in type '"
                        + type.typeName() + "'", errorPos);
            }
            return new MethodCall(instance, best.get(0).overload(), best.get(0).arguments());
        }
        Optional<Member> member = MemberResolver.find(type, name, instance == null);
        if (member.isEmpty()) {
            throw new UnknownMemberException("No property or field '" + name + "' exists in type '"
                    + type.typeName() + "'", name, errorPos);
        }
        return new MemberAccess(instance, member.get());
    }

    private Expression parseAggregate(Expression source, TypeRef elementType, AggregateFunction function,
                                      int errorPos) {
        ParameterRef element = null;
        List<Expression> args;
        if (function.argumentKind() == AggregateFunction.ArgumentKind.VALUE) {
            args = parseArgumentList();
        } else {
            ParameterRef outerIt = it;
            element = new ParameterRef("", elementType, frameSize++);
            it = element;
            try {
                args = parseArgumentList();
            } finally {
                it = outerIt;
            }
        }
        if (args.size() > 1 || (function.argumentRequired() && args.isEmpty())) {
            throw new ParseException("No applicable aggregate method '" + function.methodName() + "' exists", errorPos);
        }
        Expression argument = args.isEmpty() ? null : args.get(0);

        return switch (function.argumentKind()) {
            case PREDICATE -> {
                if (argument != null && !Types.isBoolean(argument.type())) {
                    throw new ParseException("Expression of type 'Boolean' expected", errorPos);
                }
                TypeRef type = switch (function) {
                    case WHERE -> TypeRef.sequenceOf(elementType);
                    case COUNT -> TypeRef.INT;
                    default -> TypeRef.BOOLEAN;
                };
                yield new AggregateCall(source, function, argument == null ? null : element, argument, type);
            }
            case SELECTOR -> {
                Expression selector = argument != null ? argument : element;
                yield new AggregateCall(source, function, element, selector,
                        selectorResultType(function, selector.type(), errorPos));
            }
            case VALUE -> {
                Expression value = Promotions.promote(argument, elementType, true);
                if (value == null) {
                    throw new IncompatibleOperandsException(function.methodName(), elementType,
                            argument.type(), errorPos);
                }
                yield new AggregateCall(source, function, null, value, TypeRef.BOOLEAN);
            }
        };
    }

    private static TypeRef selectorResultType(AggregateFunction function, TypeRef selectorType, int errorPos) {
        switch (function) {
            case MIN, MAX -> {
                if (!Types.isComparable(selectorType)) {
                    throw new ParseException("Values of type '" + selectorType.typeName()
                            + "' cannot be compared", errorPos);
                }
                return Types.nullable(selectorType);
            }
            case SUM -> {
                if (!Types.isNumeric(selectorType)) {
                    throw new ParseException("Expression of numeric type expected", errorPos);
                }
                TypeRef type = Types.nonNullable(selectorType);
                Class<?> c = type.runtimeClass();
                return c == Byte.class || c == Short.class ? TypeRef.INT : type;
            }
            default -> {
                if (!Types.isNumeric(selectorType)) {
                    throw new ParseException("Expression of numeric type expected", errorPos);
                }
                return selectorType.runtimeClass() == BigDecimal.class
                        ? TypeRef.of(BigDecimal.class)
                        : TypeRef.of(Double.class);
            }
        }
    }

    // ==================== Element Access ====================

    private Expression parseElementAccess(Expression expr) {
        int errorPos = lexer.tokenPos();
        expect(OPEN_BRACKET, "'[' expected");
        List<Expression> args = parseArguments();
        expect(CLOSE_BRACKET, "']' or ',' expected");
        if (args.size() == 1) {
            TypeRef elementType = TypeRef.elementTypeOf(expr.type());
            Expression index = args.get(0);
            if (elementType != null || Types.isString(expr.type())) {
                Expression intIndex = Promotions.promote(index, TypeRef.INT, true);
                if (intIndex == null) {
                    throw new ParseException("Array index must be an integer expression", errorPos);
                }
                TypeRef type = elementType != null ? elementType : TypeRef.of(char.class);
                return new Indexer(expr, intIndex, type);
            }
            if (expr.type() instanceof TypeRef.ClassType ct && Map.class.isAssignableFrom(ct.type())) {
                return new Indexer(expr, index, TypeRef.OBJECT);
            }
        }
        throw new ParseException("No applicable indexer exists in type '" + expr.type().typeName() + "'", errorPos);
    }

    // ==================== Arguments ====================

    private List<Expression> parseArgumentList() {
        expect(OPEN_PAREN, "'(' expected");
        List<Expression> args = check(CLOSE_PAREN) ? List.of() : parseArguments();
        expect(CLOSE_PAREN, "')' or ',' expected");
        return args;
    }

    private List<Expression> parseArguments() {
        List<Expression> args = new ArrayList<>();
        do {
            args.add(parseExpression());
        } while (consumeIf(COMMA));
        return args;
    }
}
