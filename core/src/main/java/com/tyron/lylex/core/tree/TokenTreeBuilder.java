package com.tyron.lylex.core.tree;

import com.tyron.lylex.api.lexer.StateStack;
import com.tyron.lylex.api.lexer.TokenRef;
import com.tyron.lylex.api.tree.TokenTree;
import com.tyron.lylex.api.tree.TreeElement;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Groups a flat token sequence into a {@link TokenTree} in one forward pass.
 *
 * Each open node stands for a state stack prefix. A token whose stack does not extend the
 * innermost open node's stack closes nodes until it does, then opens one node per missing
 * level. Only stack contents are compared, never positions, so equal state sequences always
 * give trees of the same shape.
 */
public final class TokenTreeBuilder {

    private final TreeNode root;
    private final Deque<TreeNode> open = new ArrayDeque<>();

    public TokenTreeBuilder(@NotNull StateStack rootState) {
        this(new TreeNode(null, Objects.requireNonNull(rootState, "rootState")));
    }

    private TokenTreeBuilder(TreeNode root) {
        this.root = root;
        this.open.push(root);
    }

    /**
     * Builds a tree whose root state is the bottom of the first token's stack.
     */
    public static TokenTree build(@NotNull List<? extends TokenRef> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("cannot infer the root state of an empty token sequence");
        }
        return build(tokens, tokens.get(0).state().ancestor(1));
    }

    public static TokenTree build(@NotNull Iterable<? extends TokenRef> tokens, @NotNull StateStack rootState) {
        TokenTreeBuilder builder = new TokenTreeBuilder(rootState);
        for (TokenRef token : tokens) {
            builder.add(token);
        }
        return builder.finish();
    }

    /**
     * Continues building an existing tree from {@code offset}. Every element starting before
     * the offset is kept; the rest is cut off level by level and handed out by the returned
     * {@link Resumed}. The builder continues with the nodes that were open at the offset, so
     * feeding the tokens from the offset on yields the tree a full build would.
     */
    public static Resumed resume(@NotNull TreeNode root, int offset) {
        if (root.parent() != null) {
            throw new IllegalArgumentException("can only resume from a root node");
        }
        TokenTreeBuilder builder = new TokenTreeBuilder(root);
        List<TreeNode> path = new ArrayList<>();
        List<List<TreeElement>> tails = new ArrayList<>();
        TreeNode node = root;
        while (true) {
            List<TreeElement> children = node.children();
            int lo = 0;
            int hi = children.size();
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (children.get(mid).start() < offset) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            path.add(node);
            tails.add(node.truncate(lo));
            if (lo == 0 || children.get(lo - 1).isLeaf()) {
                break;
            }
            node = (TreeNode) children.get(lo - 1);
            builder.open.push(node);
        }
        return new Resumed(builder, path, tails);
    }

    public void add(@NotNull TokenRef token) {
        StateStack state = token.state();
        int depth = state.getDepth();

        TreeNode current = closeFor(state);
        for (int d = current.depth() + 1; d <= depth; d++) {
            TreeNode child = new TreeNode(current, state.ancestor(d));
            current.add(child);
            open.push(child);
            current = child;
        }
        current.add(token);
    }

    /**
     * Closes the open nodes that cannot hold a token in {@code state}.
     *
     * @return the innermost node left open
     */
    private TreeNode closeFor(StateStack state) {
        int depth = state.getDepth();
        while (open.size() > 1) {
            TreeNode current = open.peek();
            if (depth >= current.depth() && state.ancestor(current.depth()).equals(current.state())) {
                break;
            }
            open.pop();
        }
        return open.peek();
    }

    public TreeNode finish() {
        open.clear();
        open.push(root);
        return root;
    }

    /**
     * A builder continuing an existing tree, together with the elements cut off from it.
     *
     * Level 0 is the root, level {@code n} the node open at the resume offset at depth
     * {@code n + 1}. When the builder reaches the first token of a cut off element with that
     * element's old parent innermost open, the rest of the old tree follows unchanged and can
     * be put back with {@link #reattach}.
     */
    public static final class Resumed {

        private final TokenTreeBuilder builder;
        private final List<TreeNode> path;
        private final List<List<TreeElement>> tails;

        private Resumed(TokenTreeBuilder builder, List<TreeNode> path, List<List<TreeElement>> tails) {
            this.builder = builder;
            this.path = path;
            this.tails = tails;
        }

        public TokenTreeBuilder getBuilder() {
            return builder;
        }

        public int getLevels() {
            return path.size();
        }

        /**
         * @return the elements cut off from the open node at {@code level}
         */
        public List<TreeElement> getDetached(int level) {
            return Collections.unmodifiableList(tails.get(level));
        }

        /**
         * Puts back the cut off elements from {@code getDetached(level).get(index)} on, and all
         * elements cut off above {@code level}, if {@code next}, the first token of that element,
         * would be added to the element's old parent.
         *
         * @return false if the builder's open nodes do not allow it; nothing changed but nodes
         * {@code next} would close anyway
         */
        public boolean reattach(int level, int index, @NotNull TokenRef next) {
            if (builder.closeFor(next.state()) != path.get(level)) {
                return false;
            }
            List<TreeElement> tail = tails.get(level);
            path.get(level).addAll(tail.subList(index, tail.size()));
            for (int l = level - 1; l >= 0; l--) {
                path.get(l).addAll(tails.get(l));
            }
            return true;
        }
    }
}
