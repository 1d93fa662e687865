package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code blockItemList : blockItem+}.
 *
 * @param blockItems The items in source order, at least one.
 */
public record BlockItemListContext(List<BlockItemContext> blockItems) {
    public BlockItemListContext {
        blockItems = List.copyOf(blockItems);
        if (blockItems.isEmpty()) {
            throw new IllegalArgumentException("blockItemList requires at least one item");
        }
    }
}
