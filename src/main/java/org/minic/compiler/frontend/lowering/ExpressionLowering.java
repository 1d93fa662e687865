package org.minic.compiler.frontend.lowering;

import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.frontend.ast.AstFactory;
import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;
import org.minic.compiler.frontend.ast.IntegerLiteralAttr;
import org.minic.compiler.frontend.cst.AddExpContext;
import org.minic.compiler.frontend.cst.EqExpContext;
import org.minic.compiler.frontend.cst.ExprContext;
import org.minic.compiler.frontend.cst.LAndExpContext;
import org.minic.compiler.frontend.cst.LOrExpContext;
import org.minic.compiler.frontend.cst.MulExpContext;
import org.minic.compiler.frontend.cst.OperatorChainContext;
import org.minic.compiler.frontend.cst.OperatorContext;
import org.minic.compiler.frontend.cst.PrimaryExpContext;
import org.minic.compiler.frontend.cst.RealParamListContext;
import org.minic.compiler.frontend.cst.RelExpContext;
import org.minic.compiler.frontend.cst.Token;
import org.minic.compiler.frontend.cst.UnaryExpContext;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Lowers expressions, from {@code expr} down to {@code primaryExp}.
 * <p>
 * All binary levels share {@link #fold}: a level without operators yields the node of its single
 * operand unchanged, otherwise the operands are combined left to right into a left-associative
 * tree. {@code a - b - c} therefore becomes {@code (- (- a b) c)}.
 */
final class ExpressionLowering implements UnaryExpContext.Visitor<AstNode>, PrimaryExpContext.Visitor<AstNode> {

	private final LoweringContext ctx;

	ExpressionLowering(LoweringContext ctx) {
		this.ctx = ctx;
	}

	AstNode lowerExpr(ExprContext expr) {
		return lowerLOr(ctx.require(expr.lOrExp(), "lOrExp", AstNode.NO_LINE));
	}

	// region Binary levels

	private AstNode lowerLOr(LOrExpContext exp) {
		return fold(exp, this::lowerLAnd, ExpressionLowering::logicalOrKind);
	}

	private AstNode lowerLAnd(LAndExpContext exp) {
		return fold(exp, this::lowerEq, ExpressionLowering::logicalAndKind);
	}

	private AstNode lowerEq(EqExpContext exp) {
		return fold(exp, this::lowerRel, ExpressionLowering::equalityKind);
	}

	private AstNode lowerRel(RelExpContext exp) {
		return fold(exp, this::lowerAdd, ExpressionLowering::relationalKind);
	}

	private AstNode lowerAdd(AddExpContext exp) {
		return fold(exp, this::lowerMul, ExpressionLowering::additiveKind);
	}

	private AstNode lowerMul(MulExpContext exp) {
		return fold(exp, this::lowerUnary, ExpressionLowering::multiplicativeKind);
	}

	private <O, K extends Enum<K>> AstNode fold(OperatorChainContext<O, K> chain,
												Function<O, AstNode> next,
												Function<K, AstOperatorType> kindOf) {
		List<O> operands = chain.operands();
		List<OperatorContext<K>> operators = chain.operators();

		AstNode left = next.apply(operands.get(0));
		for (int i = 0; i < operators.size(); i++) {
			OperatorContext<K> op = operators.get(i);
			AstNode right = next.apply(operands.get(i + 1));
			left = AstFactory.operator(kindOf.apply(op.kind()), op.token().line(), left, right);
		}
		return left;
	}

	private static AstOperatorType logicalOrKind(LOrExpContext.Op op) {
		return switch (op) {
			case OR -> AstOperatorType.LOGICAL_OR;
		};
	}

	private static AstOperatorType logicalAndKind(LAndExpContext.Op op) {
		return switch (op) {
			case AND -> AstOperatorType.LOGICAL_AND;
		};
	}

	private static AstOperatorType equalityKind(EqExpContext.Op op) {
		return switch (op) {
			case EQ -> AstOperatorType.EQ;
			case NE -> AstOperatorType.NE;
		};
	}

	private static AstOperatorType relationalKind(RelExpContext.Op op) {
		return switch (op) {
			case LT -> AstOperatorType.LT;
			case GT -> AstOperatorType.GT;
			case LE -> AstOperatorType.LE;
			case GE -> AstOperatorType.GE;
		};
	}

	private static AstOperatorType additiveKind(AddExpContext.Op op) {
		return switch (op) {
			case ADD -> AstOperatorType.ADD;
			case SUB -> AstOperatorType.SUB;
		};
	}

	private static AstOperatorType multiplicativeKind(MulExpContext.Op op) {
		return switch (op) {
			case MUL -> AstOperatorType.MUL;
			case DIV -> AstOperatorType.DIV;
			case MOD -> AstOperatorType.MOD;
		};
	}

	// endregion

	// region Unary expressions

	private AstNode lowerUnary(UnaryExpContext exp) {
		return ctx.require(exp, "unaryExp", AstNode.NO_LINE).accept(this);
	}

	@Override
	public AstNode visitPrimary(UnaryExpContext.Primary expression) {
		return ctx.require(expression.primary(), "primaryExp", AstNode.NO_LINE).accept(this);
	}

	/**
	 * {@code f(a, b)} becomes {@code FUNC_CALL[f, REAL_PARAMS[a, b]]}; {@code f()} gets an empty
	 * parameter list so every call has two children.
	 */
	@Override
	public AstNode visitCall(UnaryExpContext.Call expression) {
		AstNode realParams = expression.realParamList().map(this::lowerRealParams).orElse(null);
		return AstFactory.functionCall(ctx.identifier(expression.name(), "call"), realParams);
	}

	@Override
	public AstNode visitPrefix(UnaryExpContext.Prefix expression) {
		OperatorContext<UnaryExpContext.Op> op = ctx.require(expression.op(), "unaryOp", AstNode.NO_LINE);
		AstOperatorType kind = switch (op.kind()) {
			case MINUS -> AstOperatorType.NEG;
			case NOT -> AstOperatorType.LOGICAL_NOT;
		};
		return AstFactory.operator(kind, op.token().line(), lowerUnary(expression.operand()));
	}

	private AstNode lowerRealParams(RealParamListContext params) {
		List<AstNode> args = new ArrayList<>(params.exprs().size());
		for (ExprContext expr : params.exprs()) {
			args.add(lowerExpr(expr));
		}
		int line = args.get(0).line();
		return AstFactory.container(AstOperatorType.FUNC_REAL_PARAMS, line, args);
	}

	// endregion

	// region Primary expressions

	/**
	 * Parentheses only group; the inner expression is returned without a wrapper.
	 */
	@Override
	public AstNode visitParenthesized(PrimaryExpContext.Parenthesized expression) {
		return lowerExpr(ctx.require(expression.expr(), "expr", AstNode.NO_LINE));
	}

	@Override
	public AstNode visitDigit(PrimaryExpContext.Digit expression) {
		Token digit = ctx.require(expression.digit(), "T_DIGIT", AstNode.NO_LINE);
		IntegerLiteralAttr literal;
		try {
			literal = IntegerLiteralAttr.parse(digit.text(), digit.line());
		} catch (NumberFormatException e) {
			throw new LoweringException(CompilerErrorCode.MALFORMED_INTEGER_LITERAL,
					String.format("Integer literal '%s' is not a valid unsigned 32-bit value", digit.text()),
					digit.line(), e);
		}
		if (literal.value() < 0) {
			ctx.warn(CompilerErrorCode.LITERAL_EXCEEDS_INT_RANGE,
					String.format("Integer literal '%s' exceeds the int range and wraps to %d", digit.text(), literal.value()),
					digit.line());
		}
		return AstFactory.leaf(literal);
	}

	@Override
	public AstNode visitLValue(PrimaryExpContext.LValue expression) {
		return AstFactory.leaf(ctx.identifier(ctx.require(expression.lVal(), "lVal", AstNode.NO_LINE).name(), "lVal"));
	}

	// endregion
}
