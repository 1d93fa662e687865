package org.minic.compiler.frontend.lowering;

import org.minic.compiler.frontend.ast.AstFactory;
import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;
import org.minic.compiler.frontend.cst.StatementContext;

import java.util.Collections;
import java.util.Optional;

/**
 * Lowers statements. The result is empty only for the empty statement {@code ;}.
 */
final class StatementLowering implements StatementContext.Visitor<Optional<AstNode>> {

	private final LoweringContext ctx;

	StatementLowering(LoweringContext ctx) {
		this.ctx = ctx;
	}

	@Override
	public Optional<AstNode> visitAssign(StatementContext.Assign statement) {
		int line = ctx.require(statement.assign(), "'='", AstNode.NO_LINE).line();
		AstNode target = AstFactory.leaf(ctx.identifier(ctx.require(statement.target(), "lVal", line).name(), "lVal"));
		AstNode value = ctx.lowerExpression(statement.value());
		return Optional.of(AstFactory.operator(AstOperatorType.ASSIGN, line, target, value));
	}

	@Override
	public Optional<AstNode> visitReturn(StatementContext.Return statement) {
		int line = ctx.require(statement.keyword(), "'return'", AstNode.NO_LINE).line();
		return Optional.of(AstFactory.operator(AstOperatorType.RETURN, line, ctx.lowerExpression(statement.value())));
	}

	@Override
	public Optional<AstNode> visitBlock(StatementContext.Block statement) {
		return Optional.of(ctx.lowerBlock(statement.block()));
	}

	@Override
	public Optional<AstNode> visitExpression(StatementContext.Expression statement) {
		return statement.expr().map(ctx::lowerExpression);
	}

	/**
	 * The parser stores each {@code else} in the innermost {@code if}, so an outer {@code if}
	 * whose then-branch ends in an {@code if-else} stays a plain two-child {@code IF}.
	 */
	@Override
	public Optional<AstNode> visitIf(StatementContext.If statement) {
		int line = ctx.require(statement.keyword(), "'if'", AstNode.NO_LINE).line();
		AstNode condition = ctx.lowerExpression(statement.condition());
		AstNode thenBranch = branch(statement.thenBranch(), line);
		if (statement.elseBranch().isPresent()) {
			AstNode elseBranch = branch(statement.elseBranch().get(), line);
			return Optional.of(AstFactory.operator(AstOperatorType.IF_ELSE, line, condition, thenBranch, elseBranch));
		}
		return Optional.of(AstFactory.operator(AstOperatorType.IF, line, condition, thenBranch));
	}

	@Override
	public Optional<AstNode> visitWhile(StatementContext.While statement) {
		int line = ctx.require(statement.keyword(), "'while'", AstNode.NO_LINE).line();
		AstNode condition = ctx.lowerExpression(statement.condition());
		return Optional.of(AstFactory.operator(AstOperatorType.WHILE, line, condition, branch(statement.body(), line)));
	}

	@Override
	public Optional<AstNode> visitBreak(StatementContext.Break statement) {
		int line = ctx.require(statement.keyword(), "'break'", AstNode.NO_LINE).line();
		return Optional.of(AstFactory.operator(AstOperatorType.BREAK, line));
	}

	@Override
	public Optional<AstNode> visitContinue(StatementContext.Continue statement) {
		int line = ctx.require(statement.keyword(), "'continue'", AstNode.NO_LINE).line();
		return Optional.of(AstFactory.operator(AstOperatorType.CONTINUE, line));
	}

	/**
	 * Lowers the body of an if or while. An empty statement body becomes an empty block, as the
	 * control-flow node needs a child in that position.
	 */
	private AstNode branch(StatementContext statement, int line) {
		return ctx.lowerStatement(statement).orElseGet(() -> AstFactory.container(
				AstOperatorType.BLOCK, emptyStatementLine(statement, line), Collections.emptyList()));
	}

	private static int emptyStatementLine(StatementContext statement, int fallback) {
		if (statement instanceof StatementContext.Expression e && e.semicolon() != null) {
			return e.semicolon().line();
		}
		return fallback;
	}
}
