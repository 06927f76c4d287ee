package org.ccwonline.management.dynamic.parser;

import org.ccwonline.management.dynamic.AmbiguousOperatorException;
import org.ccwonline.management.dynamic.DynamicExpression;
import org.ccwonline.management.dynamic.IncompatibleOperandsException;
import org.ccwonline.management.dynamic.ParseException;
import org.ccwonline.management.dynamic.Product;
import org.ccwonline.management.dynamic.UnknownMemberException;
import org.ccwonline.management.dynamic.ast.BinaryExpression;
import org.ccwonline.management.dynamic.ast.BinaryExpression.BinaryOperator;
import org.ccwonline.management.dynamic.ast.ConditionalExpression;
import org.ccwonline.management.dynamic.ast.Constant;
import org.ccwonline.management.dynamic.ast.Expression;
import org.ccwonline.management.dynamic.ast.LambdaExpression;
import org.ccwonline.management.dynamic.ast.MemberAccess;
import org.ccwonline.management.dynamic.ast.NewRecord;
import org.ccwonline.management.dynamic.ast.ParameterRef;
import org.ccwonline.management.dynamic.types.RecordType;
import org.ccwonline.management.dynamic.types.TypeRef;
import org.ccwonline.management.model.Conference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExpressionParser Tests")
class ExpressionParserTest {

    private static Expression body(String text, Object... values) {
        return DynamicExpression.parseLambda(TypeRef.of(Product.class), null, text, values).body();
    }

    @Nested
    @DisplayName("Operator precedence")
    class Precedence {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testMultiplicative() {
            Expression expr = DynamicExpression.parse(null, "1 + 2 * 3");
            BinaryExpression add = assertInstanceOf(BinaryExpression.class, expr);
            assertEquals(BinaryOperator.ADD, add.operator());
            BinaryExpression mul = assertInstanceOf(BinaryExpression.class, add.right());
            assertEquals(BinaryOperator.MULTIPLY, mul.operator());
            assertEquals(TypeRef.INT, expr.type());
        }

        @Test
        @DisplayName("And binds tighter than or")
        void testLogical() {
            Expression expr = body("Price > 1 or Stock > 2 and Name == \"x\"");
            BinaryExpression or = assertInstanceOf(BinaryExpression.class, expr);
            assertEquals(BinaryOperator.OR, or.operator());
            assertEquals(BinaryOperator.AND, assertInstanceOf(BinaryExpression.class, or.right()).operator());
        }

        @Test
        @DisplayName("Relational binds tighter than equality")
        void testEqualityOverRelational() {
            Expression expr = body("Price > 1 == true");
            BinaryExpression eq = assertInstanceOf(BinaryExpression.class, expr);
            assertEquals(BinaryOperator.EQUAL, eq.operator());
            assertEquals(BinaryOperator.GREATER, assertInstanceOf(BinaryExpression.class, eq.left()).operator());
        }

        @Test
        @DisplayName("Single = is equality")
        void testSingleEquals() {
            BinaryExpression eq = assertInstanceOf(BinaryExpression.class, body("ProductId = 3"));
            assertEquals(BinaryOperator.EQUAL, eq.operator());
        }

        @Test
        @DisplayName("Conditional operator is lowest")
        void testConditional() {
            Expression expr = body("Price > 10 ? \"high\" : \"low\"");
            ConditionalExpression conditional = assertInstanceOf(ConditionalExpression.class, expr);
            assertEquals(TypeRef.STRING, conditional.type());
        }
    }

    @Nested
    @DisplayName("Identifiers and values")
    class Identifiers {

        @Test
        @DisplayName("Members are resolved on it, ignoring case")
        void testImplicitMember() {
            MemberAccess access = assertInstanceOf(MemberAccess.class, body("PRODUCTID"));
            assertEquals("productId", access.member().name());
            assertInstanceOf(ParameterRef.class, access.instance());
            assertEquals(TypeRef.INT, access.type());
        }

        @Test
        @DisplayName("@n and {n} refer to the same value")
        void testPlaceholders() {
            BinaryExpression a = assertInstanceOf(BinaryExpression.class, body("ProductId == @0", 5));
            BinaryExpression b = assertInstanceOf(BinaryExpression.class, body("ProductId == {0}", 5));
            assertEquals(5, assertInstanceOf(Constant.class, a.right()).value());
            assertEquals(5, assertInstanceOf(Constant.class, b.right()).value());
        }

        @Test
        @DisplayName("Boxed values are typed as primitives")
        void testBoxedValueType() {
            Expression expr = DynamicExpression.parse(null, "@0", Integer.valueOf(4));
            assertEquals(TypeRef.INT, expr.type());
        }

        @Test
        @DisplayName("A trailing map supplies named values")
        void testNamedValues() {
            BinaryExpression expr = assertInstanceOf(BinaryExpression.class,
                    body("Price > @0 and Name == limitName", 2.5, Map.of("limitName", "Pen")));
            assertEquals(BinaryOperator.AND, expr.operator());
        }

        @Test
        @DisplayName("Named lambda parameters")
        void testNamedParameters() {
            LambdaExpression lambda = DynamicExpression.parseLambda(
                    Map.of("a", TypeRef.INT), TypeRef.INT, "a * 2");
            assertEquals(1, lambda.parameters().size());
            assertEquals(TypeRef.INT, lambda.type());
        }

        @Test
        @DisplayName("Unknown identifier without it in scope")
        void testUnknownIdentifier() {
            ParseException e = assertThrows(ParseException.class, () -> DynamicExpression.parse(null, "1 + Foo"));
            assertEquals(4, e.getPosition());
            assertEquals("Unknown identifier 'Foo' (at index 4)", e.getMessage());
        }

        @Test
        @DisplayName("Unknown member on it")
        void testUnknownMember() {
            UnknownMemberException e = assertThrows(UnknownMemberException.class, () -> body("Weight > 1"));
            assertEquals("Weight", e.getMemberName());
            assertEquals(0, e.getPosition());
        }
    }

    @Nested
    @DisplayName("Typing and promotion")
    class Typing {

        @Test
        @DisplayName("Nullable operand makes the result nullable")
        void testLiftedArithmetic() {
            assertEquals(TypeRef.of(Integer.class), body("Stock + 1").type());
        }

        @Test
        @DisplayName("Integer literal widens to double")
        void testLiteralPromotion() {
            BinaryExpression expr = assertInstanceOf(BinaryExpression.class, body("Price > 1"));
            assertEquals(TypeRef.of(double.class), expr.right().type());
        }

        @Test
        @DisplayName("Enum compares with a string literal")
        void testEnumLiteral() {
            BinaryExpression expr = assertInstanceOf(BinaryExpression.class, body("Category == \"games\""));
            assertEquals(Product.Category.GAMES, assertInstanceOf(Constant.class, expr.right()).value());
        }

        @Test
        @DisplayName("String plus anything concatenates")
        void testConcat() {
            BinaryExpression expr = assertInstanceOf(BinaryExpression.class, body("Name + ProductId"));
            assertEquals(BinaryOperator.CONCAT, expr.operator());
            assertEquals(TypeRef.STRING, expr.type());
        }

        @Test
        @DisplayName("Incompatible operands name both types")
        void testIncompatibleOperands() {
            IncompatibleOperandsException e = assertThrows(IncompatibleOperandsException.class,
                    () -> body("Name - 1"));
            assertTrue(e.getMessage().contains("'-'"), e.getMessage());
            assertTrue(e.getMessage().contains("String"), e.getMessage());
            assertTrue(e.getMessage().contains("Int32"), e.getMessage());
            assertEquals(5, e.getPosition());
        }

        @Test
        @DisplayName("null + null is ambiguous")
        void testNullPlusNull() {
            assertThrows(AmbiguousOperatorException.class, () -> DynamicExpression.parse(null, "null + null"));
        }

        @Test
        @DisplayName("Predicate result must be boolean")
        void testResultType() {
            ParseException e = assertThrows(ParseException.class,
                    () -> DynamicExpression.parseLambda(Product.class, boolean.class, "Name"));
            assertEquals(0, e.getPosition());
            assertTrue(e.getMessage().startsWith("Expression of type 'Boolean' expected"));
        }

        @Test
        @DisplayName("iif requires a boolean test")
        void testIifTest() {
            ParseException e = assertThrows(ParseException.class, () -> body("iif(Price, 1, 2)"));
            assertTrue(e.getMessage().startsWith("The first expression must be of type 'Boolean'"));
        }

        @Test
        @DisplayName("iif branches with unrelated types")
        void testIifBranches() {
            ParseException e = assertThrows(ParseException.class, () -> body("iif(Price > 1, Name, Created)"));
            assertTrue(e.getMessage().startsWith("Neither of the types"), e.getMessage());
        }
    }

    @Nested
    @DisplayName("Projections")
    class Projections {

        @Test
        @DisplayName("new(...) names properties from members or as clauses")
        void testNewRecord() {
            NewRecord expr = assertInstanceOf(NewRecord.class, body("new(Name, Price * 2 as Doubled)"));
            RecordType type = expr.type();
            assertEquals(2, type.properties().size());
            assertTrue(type.findProperty("name").isPresent());
            assertEquals(TypeRef.of(double.class), type.findProperty("Doubled").get().type());
        }

        @Test
        @DisplayName("Duplicate property names are rejected")
        void testDuplicateProperty() {
            ParseException e = assertThrows(ParseException.class, () -> body("new(Name, Price as name)"));
            assertTrue(e.getMessage().startsWith("The property 'name' is already defined"), e.getMessage());
        }

        @Test
        @DisplayName("Computed value without a name is rejected")
        void testMissingAs() {
            assertThrows(ParseException.class, () -> body("new(Price * 2)"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Incomplete comparison fails at the end of the text")
        void testIncompleteComparison() {
            String text = "ConferenceId <";
            ParseException e = assertThrows(ParseException.class,
                    () -> DynamicExpression.parsePredicate(Conference.class, text));
            assertEquals(text.length(), e.getPosition());
            assertEquals(14, e.getPosition());
            assertEquals("Expression expected (at index 14)", e.getMessage());
        }

        @Test
        @DisplayName("Trailing tokens are a syntax error")
        void testTrailingTokens() {
            ParseException e = assertThrows(ParseException.class, () -> body("Price > 1 2"));
            assertEquals(10, e.getPosition());
        }

        @Test
        @DisplayName("Unbalanced parenthesis")
        void testUnbalanced() {
            ParseException e = assertThrows(ParseException.class, () -> body("(Price > 1"));
            assertTrue(e.getMessage().startsWith("')' or operator expected"));
        }

        @Test
        @DisplayName("Caret rendering points at the position")
        void testCaret() {
            ParseException e = assertThrows(ParseException.class, () -> body("Price >"));
            assertEquals("Price >" + System.lineSeparator() + "       ^", e.caret("Price >"));
        }

        @Test
        @DisplayName("Parsing is deterministic")
        void testDeterministic() {
            String text = "Price * 2 > @0 and Name.StartsWith(\"P\") or Stock == null";
            List<Expression> parsed = List.of(body(text, 3), body(text, 3));
            assertEquals(parsed.get(0).toString(), parsed.get(1).toString());
        }
    }
}
