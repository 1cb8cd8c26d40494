package com.tyron.lylex.api.tree;

import com.tyron.lylex.api.lexer.StateStack;
import com.tyron.lylex.api.lexer.TokenRef;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A node grouping the contiguous tokens of a nested lexer state region.
 *
 * The root covers the whole token sequence; every child node belongs to a state stack one
 * level deeper than its parent. Leaves are tokens.
 */
public interface TokenTree extends TreeElement {

    /**
     * @return the depth of {@link #state()}
     */
    int depth();

    /**
     * @return the state stack of this region
     */
    StateStack state();

    @Nullable
    TokenTree parent();

    List<TreeElement> children();

    /**
     * @return all tokens below this node, in order
     */
    List<TokenRef> tokens();

    /**
     * @return the number of nested node levels below this node; 0 if it only holds tokens
     */
    int height();

    /**
     * @return the deepest node containing {@code offset}, or {@code null} if outside this node
     */
    @Nullable
    TokenTree nodeAt(int offset);

    /**
     * @return this node and all nested nodes in pre-order
     */
    List<TokenTree> nodes();

    @Override
    default boolean isLeaf() {
        return false;
    }

    default boolean isRoot() {
        return parent() == null;
    }
}
