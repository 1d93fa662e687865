package org.minic.compiler.frontend.lowering;

import org.minic.compiler.diagnostics.DiagnosticsEngine;
import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.cst.CompileUnitContext;

/**
 * Transforms the concrete syntax tree of a compile unit into its abstract syntax tree.
 * <p>
 * Every call works on a fresh {@link LoweringContext}; an instance can be shared between threads.
 * Failures are raised as {@link LoweringException} or
 * {@link org.minic.compiler.frontend.ast.AstInvariantException} and never produce a partial tree.
 */
public class CstToAstTransformer {

	/**
	 * Transforms a compile unit.
	 * @param root The root production.
	 * @param unitName The compile unit name for error messages.
	 * @return The {@code COMPILE_UNIT} node.
	 */
	public AstNode transform(CompileUnitContext root, String unitName) {
		return transform(root, unitName, new DiagnosticsEngine());
	}

	/**
	 * Transforms a compile unit and reports warnings to the given engine.
	 * @param root The root production.
	 * @param unitName The compile unit name for diagnostics.
	 * @param diagnostics Receives the warnings found while lowering.
	 * @return The {@code COMPILE_UNIT} node.
	 */
	public AstNode transform(CompileUnitContext root, String unitName, DiagnosticsEngine diagnostics) {
		return new LoweringContext(unitName, diagnostics).lowerCompileUnit(root);
	}
}
