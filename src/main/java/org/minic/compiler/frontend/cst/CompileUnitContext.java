package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The root production {@code compileUnit : (funcDef | varDecl)* EOF}.
 * <p>
 * The parser collects both kinds of top-level items in their own list, each in source order.
 * The relative order between a global and a function is not preserved.
 *
 * @param funcDefs All function definitions in source order.
 * @param varDecls All global variable declarations in source order.
 */
public record CompileUnitContext(List<FuncDefContext> funcDefs, List<VarDeclContext> varDecls) {
    public CompileUnitContext {
        funcDefs = List.copyOf(funcDefs);
        varDecls = List.copyOf(varDecls);
    }
}
