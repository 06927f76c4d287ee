package org.ccwonline.management.dynamic.types;

import org.ccwonline.management.dynamic.Product;
import org.ccwonline.management.dynamic.ast.Constant;
import org.ccwonline.management.dynamic.ast.ConvertExpression;
import org.ccwonline.management.dynamic.ast.Expression;
import org.ccwonline.management.dynamic.ast.ParameterRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Overload Resolution Tests")
class OverloadResolverTest {

    private static Expression param(Class<?> type) {
        return new ParameterRef("x", TypeRef.of(type), 0);
    }

    private static List<TypeRef> types(Class<?>... classes) {
        return Arrays.stream(classes).map(TypeRef::of).toList();
    }

    @Nested
    @DisplayName("findBest")
    class FindBest {

        @Test
        @DisplayName("Exact match wins")
        void testExact() {
            var best = OverloadResolver.findBest(Signatures.ARITHMETIC.signatures(),
                    List.of(param(int.class), param(int.class)));
            assertEquals(1, best.size());
            assertEquals(types(int.class, int.class), best.get(0).overload().parameterTypes());
        }

        @Test
        @DisplayName("Mixed widths widen to the narrowest common type")
        void testWidening() {
            var best = OverloadResolver.findBest(Signatures.ARITHMETIC.signatures(),
                    List.of(param(int.class), param(long.class)));
            assertEquals(1, best.size());
            assertEquals(types(long.class, long.class), best.get(0).overload().parameterTypes());
            assertInstanceOf(ConvertExpression.class, best.get(0).arguments().get(0));
        }

        @Test
        @DisplayName("A nullable operand selects the nullable signature")
        void testNullableOperand() {
            var best = OverloadResolver.findBest(Signatures.ARITHMETIC.signatures(),
                    List.of(param(int.class), param(Integer.class)));
            assertEquals(1, best.size());
            assertEquals(types(Integer.class, Integer.class), best.get(0).overload().parameterTypes());
        }

        @Test
        @DisplayName("No applicable candidate yields an empty result")
        void testNoCandidate() {
            assertTrue(OverloadResolver.findBest(Signatures.ARITHMETIC.signatures(),
                    List.of(param(String.class), param(int.class))).isEmpty());
        }

        @Test
        @DisplayName("Two null literals are ambiguous for addition")
        void testAmbiguous() {
            var best = OverloadResolver.findBest(Signatures.ADD.signatures(),
                    List.of(Constant.nullLiteral(), Constant.nullLiteral()));
            assertTrue(best.size() > 1);
        }

        @Test
        @DisplayName("Two null literals pick the narrowest nullable number")
        void testNullLiteralsArithmetic() {
            var best = OverloadResolver.findBest(Signatures.ARITHMETIC.signatures(),
                    List.of(Constant.nullLiteral(), Constant.nullLiteral()));
            assertEquals(1, best.size());
            assertEquals(types(Integer.class, Integer.class), best.get(0).overload().parameterTypes());
        }
    }

    @Nested
    @DisplayName("Promotions")
    class Promote {

        @Test
        @DisplayName("Null literal promotes only to nullable types")
        void testNullLiteral() {
            assertNull(Promotions.promote(Constant.nullLiteral(), TypeRef.INT, false));
            Expression promoted = Promotions.promote(Constant.nullLiteral(), TypeRef.of(Integer.class), false);
            assertInstanceOf(Constant.class, promoted);
            assertEquals(TypeRef.of(Integer.class), promoted.type());
            assertNull(((Constant) promoted).value());
        }

        @Test
        @DisplayName("Integer literals are re-typed")
        void testIntegerLiteral() {
            Constant literal = new Constant(100, TypeRef.INT, "100");
            Expression promoted = Promotions.promote(literal, TypeRef.of(long.class), false);
            assertEquals(100L, ((Constant) promoted).value());
            Expression decimal = Promotions.promote(literal, TypeRef.of(BigDecimal.class), false);
            assertEquals(new BigDecimal("100"), ((Constant) decimal).value());
        }

        @Test
        @DisplayName("Real literals re-type only to decimal")
        void testRealLiteral() {
            Constant literal = new Constant(2.5d, TypeRef.of(double.class), "2.5");
            assertNull(Promotions.promote(literal, TypeRef.of(float.class), false));
            Expression decimal = Promotions.promote(literal, TypeRef.of(BigDecimal.class), false);
            assertEquals(new BigDecimal("2.5"), ((Constant) decimal).value());
        }

        @Test
        @DisplayName("String literals name enum constants")
        void testEnumLiteral() {
            Constant literal = new Constant("games", TypeRef.STRING, "\"games\"");
            Expression promoted = Promotions.promote(literal, TypeRef.of(Product.Category.class), false);
            assertEquals(Product.Category.GAMES, ((Constant) promoted).value());
            assertNull(Promotions.promote(new Constant("nope", TypeRef.STRING, "\"nope\""),
                    TypeRef.of(Product.Category.class), false));
        }

        @Test
        @DisplayName("Reference widening keeps the expression")
        void testReferenceWidening() {
            Expression text = param(String.class);
            assertSame(text, Promotions.promote(text, TypeRef.of(CharSequence.class), false));
            assertInstanceOf(ConvertExpression.class, Promotions.promote(text, TypeRef.of(CharSequence.class), true));
        }
    }

    @Nested
    @DisplayName("Conversions")
    class Conversions {

        @Test
        @DisplayName("Boxed to primitive is not implicit")
        void testUnboxing() {
            assertFalse(Types.isCompatibleWith(TypeRef.of(Integer.class), TypeRef.INT));
            assertTrue(Types.isCompatibleWith(TypeRef.INT, TypeRef.of(Integer.class)));
            assertTrue(Types.isCompatibleWith(TypeRef.INT, TypeRef.of(Long.class)));
        }

        @Test
        @DisplayName("Floating point does not convert to decimal implicitly")
        void testDecimal() {
            assertFalse(Types.isCompatibleWith(TypeRef.of(double.class), TypeRef.of(BigDecimal.class)));
            assertTrue(Types.isExplicitlyConvertible(TypeRef.of(double.class), TypeRef.of(BigDecimal.class)));
        }

        @Test
        @DisplayName("Display names follow the expression language")
        void testDisplayNames() {
            assertEquals("Int32", Types.displayName(int.class));
            assertEquals("Int32?", Types.displayName(Integer.class));
            assertEquals("String", Types.displayName(String.class));
        }
    }
}
