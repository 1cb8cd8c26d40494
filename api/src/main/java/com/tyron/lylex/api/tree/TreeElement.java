package com.tyron.lylex.api.tree;

/**
 * A child of a {@link TokenTree}: either a nested node or a token leaf.
 */
public interface TreeElement {

    int start();

    int end();

    boolean isLeaf();
}
