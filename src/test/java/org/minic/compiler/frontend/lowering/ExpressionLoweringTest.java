package org.minic.compiler.frontend.lowering;

import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.diagnostics.Diagnostic;
import org.minic.compiler.diagnostics.DiagnosticsEngine;
import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;
import org.minic.compiler.frontend.ast.IdentifierAttr;
import org.minic.compiler.frontend.ast.IntegerLiteralAttr;
import org.minic.compiler.frontend.cst.CstTestReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the lowering of expressions: the shared left fold of all binary levels,
 * unary operators, calls and primary expressions.
 */
@Tag("unit")
public class ExpressionLoweringTest {

    private LoweringContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new LoweringContext("expr.mc", new DiagnosticsEngine());
    }

    private AstNode lower(String source) {
        return ctx.lowerExpression(CstTestReader.expression(source));
    }

    /**
     * A chain of same-precedence operators folds to the left at every binary level.
     */
    @Test
    void testBinaryChain_SamePrecedence_IsLeftAssociative() {
        assertThat(lower("a - b - c").toString()).isEqualTo("(- (- a b) c)");
        assertThat(lower("a + b - c + d").toString()).isEqualTo("(+ (- (+ a b) c) d)");
        assertThat(lower("a / b * c % d").toString()).isEqualTo("(% (* (/ a b) c) d)");
        assertThat(lower("a < b >= c").toString()).isEqualTo("(>= (< a b) c)");
        assertThat(lower("a == b != c").toString()).isEqualTo("(!= (== a b) c)");
        assertThat(lower("a && b && c").toString()).isEqualTo("(&& (&& a b) c)");
        assertThat(lower("a || b || c").toString()).isEqualTo("(|| (|| a b) c)");
    }

    @Test
    void testBinaryChain_MixedPrecedence_HigherLevelBindsTighter() {
        assertThat(lower("1 + 2 * 3").toString()).isEqualTo("(+ 1 (* 2 3))");
        assertThat(lower("1 * 2 + 3").toString()).isEqualTo("(+ (* 1 2) 3)");
        assertThat(lower("a || b && c == d < e + f * g").toString())
                .isEqualTo("(|| a (&& b (== c (< d (+ e (* f g))))))");
    }

    /**
     * A level without operators yields its operand node directly; no wrapper node is created
     * for the seven levels between {@code expr} and {@code primaryExp}.
     */
    @Test
    void testOperatorFreeLevels_AreTransparent() {
        AstNode node = lower("x");

        assertThat(node.kind()).isEqualTo(AstOperatorType.LEAF_VAR_ID);
        assertThat(node.attributeAs(IdentifierAttr.class)).map(IdentifierAttr::text).contains("x");
        assertThat(node.children()).isEmpty();
    }

    @Test
    void testParentheses_OverridePrecedence_WithoutWrapperNode() {
        AstNode node = lower("(1 + 2) * 3");

        assertThat(node.kind()).isEqualTo(AstOperatorType.MUL);
        assertThat(node.child(0).kind()).isEqualTo(AstOperatorType.ADD);
        assertThat(lower("((x))").kind()).isEqualTo(AstOperatorType.LEAF_VAR_ID);
    }

    @Test
    void testBinaryNode_TakesLineOfOperatorToken() {
        AstNode node = lower("a\n+\nb");

        assertThat(node.kind()).isEqualTo(AstOperatorType.ADD);
        assertThat(node.line()).isEqualTo(2);
        assertThat(node.child(0).line()).isEqualTo(1);
        assertThat(node.child(1).line()).isEqualTo(3);
    }

    @Test
    void testUnaryMinus_LowersToSingleChildNegation() {
        AstNode node = lower("-5");

        assertThat(node.kind()).isEqualTo(AstOperatorType.NEG);
        assertThat(node.children()).hasSize(1);
        assertThat(node.child(0).attributeAs(IntegerLiteralAttr.class)).map(IntegerLiteralAttr::unsignedValue).contains(5L);
    }

    @Test
    void testUnaryOperators_NestAndBindTighterThanBinary() {
        assertThat(lower("--x").toString()).isEqualTo("(neg (neg x))");
        assertThat(lower("!a && -b").toString()).isEqualTo("(&& (! a) (neg b))");
        assertThat(lower("-a * b").toString()).isEqualTo("(* (neg a) b)");
    }

    /**
     * An identifier followed by parentheses is a call; its argument list is always present.
     */
    @Test
    void testCall_WithoutArguments_HasEmptyRealParams() {
        AstNode node = lower("f()");

        assertThat(node.kind()).isEqualTo(AstOperatorType.FUNC_CALL);
        assertThat(node.children()).hasSize(2);
        assertThat(node.child(0).attributeAs(IdentifierAttr.class)).map(IdentifierAttr::text).contains("f");
        assertThat(node.child(1).kind()).isEqualTo(AstOperatorType.FUNC_REAL_PARAMS);
        assertThat(node.child(1).children()).isEmpty();
    }

    @Test
    void testCall_WithArguments_LowersEachArgumentInOrder() {
        AstNode node = lower("g(1, a + b, h())");

        assertThat(node.toString()).isEqualTo("(func-call g (real-params 1 (+ a b) (func-call h (real-params))))");
    }

    @Test
    void testIdentifierWithoutParentheses_IsVariableReference() {
        assertThat(lower("f + 1").child(0).kind()).isEqualTo(AstOperatorType.LEAF_VAR_ID);
    }

    @Test
    void testDigit_RadixPrefixes() {
        assertThat(lower("0").toString()).isEqualTo("0");
        assertThat(lower("010").toString()).isEqualTo("8");
        assertThat(lower("0x10").toString()).isEqualTo("16");
        assertThat(lower("0X10").toString()).isEqualTo("16");
        assertThat(lower("10").toString()).isEqualTo("10");
    }

    @Test
    void testDigit_Malformed_RaisesLoweringExceptionWithLine() {
        assertThatThrownBy(() -> lower("1 +\n09"))
                .isInstanceOf(LoweringException.class)
                .satisfies(e -> {
                    LoweringException le = (LoweringException) e;
                    assertThat(le.getCode()).isEqualTo(CompilerErrorCode.MALFORMED_INTEGER_LITERAL);
                    assertThat(le.getLine()).isEqualTo(2);
                    assertThat(le.getCause()).isInstanceOf(NumberFormatException.class);
                });
    }

    /**
     * A literal above the signed 32-bit range is kept but recorded as a warning.
     */
    @Test
    void testDigit_AboveIntRange_RecordsWarning() {
        AstNode node = lower("\n0xFFFFFFFF");

        assertThat(node.attributeAs(IntegerLiteralAttr.class)).map(IntegerLiteralAttr::unsignedValue).contains(4294967295L);
        assertThat(ctx.diagnostics().hasErrors()).isFalse();
        assertThat(ctx.diagnostics().getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.toString()).contains("LITERAL_EXCEEDS_INT_RANGE").contains("expr.mc:2");
        });
    }

    @Test
    void testDigit_WithinIntRange_RecordsNothing() {
        lower("2147483647");

        assertThat(ctx.diagnostics().getDiagnostics()).isEmpty();
    }
}
