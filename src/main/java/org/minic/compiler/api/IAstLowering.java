package org.minic.compiler.api;

import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.cst.CompileUnitContext;

/**
 * The public interface of the lowering stage.
 * It turns the concrete syntax tree of one compile unit into its abstract syntax tree.
 */
public interface IAstLowering {

    /**
     * Lowers a complete compile unit.
     *
     * @param root     The concrete syntax tree produced by the parser.
     * @param unitName The name of the compile unit, used in diagnostics (usually the file name).
     * @return The root node of kind {@code COMPILE_UNIT}. The caller owns the returned tree.
     * @throws CompilationException if the tree cannot be lowered.
     */
    AstNode lower(CompileUnitContext root, String unitName) throws CompilationException;

    /**
     * Sets the logging verbosity level for the lowering stage.
     * @param level The verbosity level (e.g. 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE).
     */
    void setVerbosity(int level);
}
