package org.minic.compiler.frontend.cst;

import java.util.Optional;

/**
 * The production {@code block : '{' blockItemList? '}'}.
 *
 * @param lBrace The opening brace, used as the line of the block.
 * @param blockItemList The items of the block, empty for {@code { }}.
 */
public record BlockContext(Token lBrace, Optional<BlockItemListContext> blockItemList) {
}
