package org.minic.compiler.frontend.lowering;

import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;
import org.minic.compiler.frontend.cst.CstTestReader;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the lowering of statements inside function bodies.
 */
@Tag("unit")
public class StatementLoweringTest {

    /**
     * Lowers {@code int main() { <body> }} and returns the body block.
     */
    private AstNode body(String statements) {
        AstNode unit = new CstToAstTransformer().transform(
                CstTestReader.compileUnit("int main() {" + statements + "}"), "stmt.mc");
        return unit.child(0).child(2);
    }

    @Test
    void testAssignAndReturn() {
        AstNode block = body("a = 1 + 2; return a;");

        assertThat(block.toString()).isEqualTo("(block (= a (+ 1 2)) (return a))");
    }

    /**
     * Empty statements produce no node at all, so a block of only semicolons is empty.
     */
    @Test
    void testEmptyStatements_AreSkipped() {
        assertThat(body(";").children()).isEmpty();
        assertThat(body(";;a;;").toString()).isEqualTo("(block a)");
    }

    @Test
    void testExpressionStatement_YieldsExpressionNode() {
        AstNode block = body("f(1);");

        assertThat(block.child(0).kind()).isEqualTo(AstOperatorType.FUNC_CALL);
    }

    @Test
    void testNestedBlock_IsKeptAsBlock() {
        assertThat(body("{ }").toString()).isEqualTo("(block (block))");
        assertThat(body("{ a; { b; } }").toString()).isEqualTo("(block (block a (block b)))");
    }

    @Test
    void testIfWithoutElse_HasTwoChildren() {
        AstNode node = body("if (a) b = 1;").child(0);

        assertThat(node.kind()).isEqualTo(AstOperatorType.IF);
        assertThat(node.children()).hasSize(2);
        assertThat(node.toString()).isEqualTo("(if a (= b 1))");
    }

    @Test
    void testIfWithElse_HasThreeChildren() {
        AstNode node = body("if (a < 1) return 1; else return 2;").child(0);

        assertThat(node.kind()).isEqualTo(AstOperatorType.IF_ELSE);
        assertThat(node.toString()).isEqualTo("(if-else (< a 1) (return 1) (return 2))");
    }

    /**
     * {@code if (a) if (b) x; else y;} attaches the else to the inner if: the outer node is a
     * plain if whose then-branch is an if-else.
     */
    @Test
    void testDanglingElse_BindsToInnermostIf() {
        AstNode outer = body("if (a) if (b) x; else y;").child(0);

        assertThat(outer.kind()).isEqualTo(AstOperatorType.IF);
        assertThat(outer.children()).hasSize(2);
        AstNode inner = outer.child(1);
        assertThat(inner.kind()).isEqualTo(AstOperatorType.IF_ELSE);
        assertThat(inner.children()).hasSize(3);
        assertThat(outer.toString()).isEqualTo("(if a (if-else b x y))");
    }

    @Test
    void testIfElseChain() {
        AstNode node = body("if (a) x; else if (b) y; else z;").child(0);

        assertThat(node.toString()).isEqualTo("(if-else a x (if-else b y z))");
    }

    @Test
    void testEmptyBranch_BecomesEmptyBlock() {
        AstNode node = body("if (a) ; else b;").child(0);

        assertThat(node.kind()).isEqualTo(AstOperatorType.IF_ELSE);
        assertThat(node.child(1).kind()).isEqualTo(AstOperatorType.BLOCK);
        assertThat(node.child(1).children()).isEmpty();
        assertThat(body("while (a) ;").toString()).isEqualTo("(block (while a (block)))");
    }

    @Test
    void testWhileBreakContinue() {
        AstNode loop = body("while (i < 10) { if (i == 5) break; i = i + 1; continue; }").child(0);

        assertThat(loop.kind()).isEqualTo(AstOperatorType.WHILE);
        assertThat(loop.children()).hasSize(2);
        assertThat(loop.toString())
                .isEqualTo("(while (< i 10) (block (if (== i 5) (break)) (= i (+ i 1)) (continue)))");
    }

    /**
     * Loop membership is left to semantic analysis.
     */
    @Test
    void testBreakOutsideLoop_IsLoweredWithoutComplaint() {
        AstNode node = body("break;").child(0);

        assertThat(node.kind()).isEqualTo(AstOperatorType.BREAK);
        assertThat(node.children()).isEmpty();
    }

    @Test
    void testStatementLines() {
        AstNode block = body("\n a\n =\n 1;\n return\n 0;\n if (a) ;\n while (a) break;");

        assertThat(block.line()).isEqualTo(1);
        assertThat(block.child(0).kind()).isEqualTo(AstOperatorType.ASSIGN);
        assertThat(block.child(0).line()).isEqualTo(3);
        assertThat(block.child(1).line()).isEqualTo(5);
        assertThat(block.child(2).line()).isEqualTo(7);
        assertThat(block.child(3).line()).isEqualTo(8);
        assertThat(block.child(3).child(1).line()).isEqualTo(8);
    }
}
