package org.minic.compiler.frontend.lowering;

import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.diagnostics.DiagnosticsEngine;
import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.BasicType;
import org.minic.compiler.frontend.ast.IdentifierAttr;
import org.minic.compiler.frontend.ast.TypeAttr;
import org.minic.compiler.frontend.cst.BasicTypeContext;
import org.minic.compiler.frontend.cst.BlockContext;
import org.minic.compiler.frontend.cst.CompileUnitContext;
import org.minic.compiler.frontend.cst.ExprContext;
import org.minic.compiler.frontend.cst.StatementContext;
import org.minic.compiler.frontend.cst.Token;
import org.minic.compiler.frontend.cst.TokenType;

import java.util.Optional;

/**
 * Context of one lowering run.
 * <p>
 * The three lowerings (declarations, statements, expressions) reach each other only through this
 * context. A context is created per compile unit and discarded afterwards; nothing it holds is
 * shared between runs.
 */
public final class LoweringContext {

	private final String unitName;
	private final DiagnosticsEngine diagnostics;
	private final DeclarationLowering declarations;
	private final StatementLowering statements;
	private final ExpressionLowering expressions;

	/**
	 * Constructs a new lowering context.
	 * @param unitName The name of the compile unit, used in error messages.
	 * @param diagnostics The engine receiving warnings.
	 */
	public LoweringContext(String unitName, DiagnosticsEngine diagnostics) {
		this.unitName = unitName;
		this.diagnostics = diagnostics;
		this.declarations = new DeclarationLowering(this);
		this.statements = new StatementLowering(this);
		this.expressions = new ExpressionLowering(this);
	}

	/**
	 * @return The name of the compile unit being lowered.
	 */
	public String unitName() {
		return unitName;
	}

	/**
	 * @return The diagnostics engine.
	 */
	public DiagnosticsEngine diagnostics() {
		return diagnostics;
	}

	/**
	 * Reports a warning located in this compile unit.
	 * @param code The warning code.
	 * @param message The warning message.
	 * @param line The line the warning refers to.
	 */
	void warn(CompilerErrorCode code, String message, int line) {
		diagnostics.reportWarning(code, message, unitName, line);
	}

	/**
	 * Lowers a complete compile unit.
	 * @param root The root production.
	 * @return The {@code COMPILE_UNIT} node.
	 */
	public AstNode lowerCompileUnit(CompileUnitContext root) {
		return declarations.lowerCompileUnit(require(root, "compileUnit", AstNode.NO_LINE));
	}

	/**
	 * Lowers a block. An absent item list gives an empty block.
	 * @param block The block production.
	 * @return The {@code BLOCK} node.
	 */
	public AstNode lowerBlock(BlockContext block) {
		return declarations.lowerBlock(block);
	}

	/**
	 * Lowers a statement.
	 * @param statement The statement production.
	 * @return The node, or empty for the empty statement.
	 */
	public Optional<AstNode> lowerStatement(StatementContext statement) {
		return require(statement, "statement", AstNode.NO_LINE).accept(statements);
	}

	/**
	 * Lowers an expression through the whole precedence chain.
	 * @param expr The expression production.
	 * @return The expression node.
	 */
	public AstNode lowerExpression(ExprContext expr) {
		return expressions.lowerExpr(require(expr, "expr", AstNode.NO_LINE));
	}

	/**
	 * Builds the identifier attribute of a name token.
	 * @param name The identifier token.
	 * @param production The production the token belongs to, for error messages.
	 * @return The attribute with its own copy of the text and the token's line.
	 */
	IdentifierAttr identifier(Token name, String production) {
		require(name, production, AstNode.NO_LINE);
		if (name.type() != TokenType.IDENTIFIER) {
			throw new LoweringException(CompilerErrorCode.INTERNAL_INVARIANT_VIOLATION,
					String.format("%s expects an identifier but got %s '%s'", production, name.type(), name.text()),
					name.line());
		}
		return new IdentifierAttr(name.text(), name.line());
	}

	/**
	 * Builds the type attribute of a type keyword. Only {@code int} exists in the grammar.
	 * @param typeToken The type keyword.
	 * @return The attribute.
	 */
	TypeAttr type(Token typeToken) {
		require(typeToken, "basicType", AstNode.NO_LINE);
		if (typeToken.type() != TokenType.INT) {
			throw new LoweringException(CompilerErrorCode.INTERNAL_INVARIANT_VIOLATION,
					String.format("Unsupported basic type '%s'", typeToken.text()), typeToken.line());
		}
		return new TypeAttr(BasicType.INT, typeToken.line());
	}

	/**
	 * Builds the type attribute of a {@code basicType} production.
	 * @param basicType The production.
	 * @return The attribute.
	 */
	TypeAttr type(BasicTypeContext basicType) {
		return type(require(basicType, "basicType", AstNode.NO_LINE).typeToken());
	}

	/**
	 * Rejects a missing sub-production that the grammar makes mandatory.
	 * @param value The sub-production.
	 * @param production The production name for the error message.
	 * @param line The nearest known line.
	 * @param <T> The production type.
	 * @return The value, never {@code null}.
	 */
	<T> T require(T value, String production, int line) {
		if (value == null) {
			throw new LoweringException(CompilerErrorCode.INTERNAL_INVARIANT_VIOLATION,
					String.format("Missing %s in %s", production, unitName), line);
		}
		return value;
	}
}
