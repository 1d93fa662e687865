package org.minic.compiler.frontend;

import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;
import org.minic.compiler.frontend.ast.IdentifierAttr;
import org.minic.compiler.frontend.cst.CstTestReader;
import org.minic.compiler.frontend.lowering.CstToAstTransformer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the kind-keyed {@link TreeWalker}.
 */
@Tag("unit")
public class TreeWalkerTest {

    private final AstNode ast = new CstToAstTransformer().transform(
            CstTestReader.compileUnit("int g;\nint main() { g = f(1); return g + 2; }"), "walk.mc");

    @Test
    void testHandlers_RunPerKindInPreOrder() {
        List<String> identifiers = new ArrayList<>();
        List<AstOperatorType> calls = new ArrayList<>();
        Map<AstOperatorType, Consumer<AstNode>> handlers = Map.of(
                AstOperatorType.LEAF_VAR_ID, n -> identifiers.add(n.attributeAs(IdentifierAttr.class).orElseThrow().text()),
                AstOperatorType.FUNC_CALL, n -> calls.add(n.kind()));

        new TreeWalker(handlers).walk(ast);

        assertThat(identifiers).containsExactly("g", "main", "g", "f", "g");
        assertThat(calls).hasSize(1);
    }

    @Test
    void testEveryNodeHandler_SeesParentsBeforeChildren() {
        List<AstOperatorType> kinds = new ArrayList<>();

        new TreeWalker(Map.of(), n -> kinds.add(n.kind())).walk(ast);

        assertThat(kinds.get(0)).isEqualTo(AstOperatorType.COMPILE_UNIT);
        assertThat(kinds.indexOf(AstOperatorType.FUNC_DEF)).isLessThan(kinds.indexOf(AstOperatorType.BLOCK));
        assertThat(kinds.indexOf(AstOperatorType.RETURN)).isLessThan(kinds.indexOf(AstOperatorType.ADD));
    }

    @Test
    void testWalk_NullIsIgnored() {
        List<AstNode> seen = new ArrayList<>();

        new TreeWalker(Map.of(), seen::add).walk(null);

        assertThat(seen).isEmpty();
    }
}
