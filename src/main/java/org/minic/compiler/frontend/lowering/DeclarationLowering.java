package org.minic.compiler.frontend.lowering;

import org.minic.compiler.diagnostics.CompilerLogger;
import org.minic.compiler.frontend.ast.AstFactory;
import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;
import org.minic.compiler.frontend.ast.IdentifierAttr;
import org.minic.compiler.frontend.ast.TypeAttr;
import org.minic.compiler.frontend.cst.BlockContext;
import org.minic.compiler.frontend.cst.BlockItemContext;
import org.minic.compiler.frontend.cst.CompileUnitContext;
import org.minic.compiler.frontend.cst.FuncDefContext;
import org.minic.compiler.frontend.cst.StatementContext;
import org.minic.compiler.frontend.cst.VarDeclContext;
import org.minic.compiler.frontend.cst.VarDefContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers the compile unit, function definitions, blocks and variable declarations.
 */
final class DeclarationLowering implements BlockItemContext.Visitor<Optional<AstNode>> {

	private final LoweringContext ctx;

	DeclarationLowering(LoweringContext ctx) {
		this.ctx = ctx;
	}

	/**
	 * Lowers all global declarations first and then all function definitions, each group in
	 * source order. A function is therefore placed after every global even if the global is
	 * declared later in the text; detecting uses of such globals is left to semantic analysis.
	 *
	 * @param root The compile unit production.
	 * @return The {@code COMPILE_UNIT} node.
	 */
	AstNode lowerCompileUnit(CompileUnitContext root) {
		CompilerLogger.trace(String.format("Lowering %s: %d global declaration(s), %d function(s)",
				ctx.unitName(), root.varDecls().size(), root.funcDefs().size()));

		List<AstNode> items = new ArrayList<>();
		for (VarDeclContext varDecl : root.varDecls()) {
			items.add(lowerVarDecl(varDecl));
		}
		for (FuncDefContext funcDef : root.funcDefs()) {
			items.add(lowerFuncDef(funcDef));
		}
		return AstFactory.container(AstOperatorType.COMPILE_UNIT, AstNode.NO_LINE, items);
	}

	AstNode lowerFuncDef(FuncDefContext funcDef) {
		ctx.require(funcDef, "funcDef", AstNode.NO_LINE);
		TypeAttr returnType = ctx.type(funcDef.returnType());
		IdentifierAttr name = ctx.identifier(funcDef.name(), "funcDef");
		AstNode body = lowerBlock(ctx.require(funcDef.block(), "funcDef body", name.line()));
		// The grammar has no parameter list; the factory supplies an empty one.
		return AstFactory.functionDefinition(returnType, name, body, null);
	}

	/**
	 * Lowers a block item by item. Items without a node (empty statements) are skipped.
	 *
	 * @param block The block production.
	 * @return The {@code BLOCK} node, empty if the block has no items.
	 */
	AstNode lowerBlock(BlockContext block) {
		ctx.require(block, "block", AstNode.NO_LINE);
		int line = ctx.require(block.lBrace(), "'{'", AstNode.NO_LINE).line();
		List<AstNode> children = new ArrayList<>();
		block.blockItemList().ifPresent(list -> {
			for (BlockItemContext item : list.blockItems()) {
				item.accept(this).ifPresent(children::add);
			}
		});
		return AstFactory.container(AstOperatorType.BLOCK, line, children);
	}

	/**
	 * Fans a declaration out into one {@code VAR_DECL} per declared name. Each of them gets its
	 * own type node, so {@code int a, b;} holds two distinct type leaves.
	 *
	 * @param varDecl The declaration production.
	 * @return The {@code DECL_STMT} node.
	 */
	AstNode lowerVarDecl(VarDeclContext varDecl) {
		TypeAttr type = ctx.type(varDecl.basicType());
		List<AstNode> vars = new ArrayList<>(varDecl.varDefs().size());
		for (VarDefContext varDef : varDecl.varDefs()) {
			IdentifierAttr name = ctx.identifier(ctx.require(varDef, "varDef", type.line()).name(), "varDef");
			vars.add(AstFactory.operator(AstOperatorType.VAR_DECL, name.line(),
					AstFactory.typeNode(type), AstFactory.leaf(name)));
		}
		return AstFactory.container(AstOperatorType.DECL_STMT, type.line(), vars);
	}

	@Override
	public Optional<AstNode> visitStatement(StatementContext statement) {
		return ctx.lowerStatement(statement);
	}

	@Override
	public Optional<AstNode> visitVarDecl(VarDeclContext varDecl) {
		return Optional.of(lowerVarDecl(varDecl));
	}
}
