package org.minic.compiler.frontend.cst;

/**
 * The production {@code funcDef : T_INT T_ID '(' ')' block}.
 *
 * @param returnType The return type keyword.
 * @param name The function name.
 * @param block The function body.
 */
public record FuncDefContext(Token returnType, Token name, BlockContext block) {
}
