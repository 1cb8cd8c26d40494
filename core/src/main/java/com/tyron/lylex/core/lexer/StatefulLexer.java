package com.tyron.lylex.core.lexer;

import com.tyron.lylex.api.concurrent.CancellationToken;
import com.tyron.lylex.api.lexer.Grammar;
import com.tyron.lylex.api.lexer.LexerState;
import com.tyron.lylex.api.lexer.Rule;
import com.tyron.lylex.api.lexer.RuleMatch;
import com.tyron.lylex.api.lexer.StateStack;
import com.tyron.lylex.api.lexer.StopCondition;
import com.tyron.lylex.api.lexer.Token;
import com.tyron.lylex.api.lexer.TokenStream;
import org.jetbrains.annotations.NotNull;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Produces tokens from text by applying the rules of the state on top of a {@link StateStack}.
 *
 * Lexing can start at any offset given the stack in effect there. Each step either emits one
 * token for the first matching rule and applies its transition, leaves a fall-through state
 * without emitting anything, or emits a one character token of the state's fallback kind.
 * Every step that emits a token advances by at least one character, and lexing never fails.
 *
 * A lexer is stateless and may be shared; the streams it creates are not thread-safe.
 */
public final class StatefulLexer {

    private final Grammar grammar;

    public StatefulLexer(@NotNull Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public TokenStream tokenize(@NotNull CharSequence text) {
        return tokenize(text, 0, grammar.initialStack());
    }

    public TokenStream tokenize(@NotNull CharSequence text, int startOffset, @NotNull StateStack initialStack) {
        return tokenize(text, startOffset, text.length(), initialStack, StopCondition.NEVER, CancellationToken.NONE);
    }

    public TokenStream tokenize(@NotNull CharSequence text, int startOffset, @NotNull StateStack initialStack,
                                @NotNull StopCondition stopCondition) {
        return tokenize(text, startOffset, text.length(), initialStack, stopCondition, CancellationToken.NONE);
    }

    /**
     * @param endOffset      tokens never extend past this offset; rules still see the text after it
     * @param stopCondition  checked before each token
     * @param cancellation   checked before each step
     */
    public TokenStream tokenize(@NotNull CharSequence text, int startOffset, int endOffset,
                                @NotNull StateStack initialStack, @NotNull StopCondition stopCondition,
                                @NotNull CancellationToken cancellation) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(initialStack, "initialStack");
        Objects.requireNonNull(stopCondition, "stopCondition");
        Objects.requireNonNull(cancellation, "cancellation");
        if (startOffset < 0 || endOffset < startOffset || endOffset > text.length()) {
            throw new IndexOutOfBoundsException("tokenize range [" + startOffset + ", " + endOffset
                    + ") is out of bounds for length=" + text.length());
        }
        return new Stream(text, startOffset, endOffset, initialStack, stopCondition, cancellation);
    }

    public List<Token> tokenizeAll(@NotNull CharSequence text) {
        return tokenize(text).toList();
    }

    public List<Token> tokenizeAll(@NotNull CharSequence text, int startOffset, @NotNull StateStack initialStack) {
        return tokenize(text, startOffset, initialStack).toList();
    }

    /**
     * @return the stack a token belongs to: the deeper of the stacks before and after its transition
     */
    static StateStack contextOf(StateStack before, StateStack after) {
        return after.getDepth() >= before.getDepth() ? after : before;
    }

    private final class Stream implements TokenStream {

        private final CharSequence text;
        private final int end;
        private final StopCondition stopCondition;
        private final CancellationToken cancellation;
        private final Map<Rule, Matcher> matchers = new IdentityHashMap<>();

        private int offset;
        private StateStack stack;
        private Token next;
        private StateStack nextStack;
        private boolean done;

        Stream(CharSequence text, int offset, int end, StateStack stack, StopCondition stopCondition,
               CancellationToken cancellation) {
            this.text = text;
            this.offset = offset;
            this.end = end;
            this.stack = stack;
            this.stopCondition = stopCondition;
            this.cancellation = cancellation;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = advance();
                done = next == null;
            }
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token token = next;
            next = null;
            return token;
        }

        @Override
        public int offset() {
            return next != null ? next.start() : offset;
        }

        @Override
        public StateStack state() {
            return next != null ? nextStack : stack;
        }

        private Token advance() {
            while (offset < end) {
                if (stopCondition.shouldStop(offset, stack)) {
                    return null;
                }
                cancellation.throwIfCancelled();

                LexerState state = stack.getTop();
                RuleMatch match = state.matchAt(text, offset, end, this::matcher);
                if (match != null) {
                    StateStack before = stack;
                    nextStack = before;
                    StateStack after = match.transition().apply(before, grammar);
                    Token token = new Token(match.kind(), offset, match.length(), contextOf(before, after), after);
                    stack = after;
                    offset += match.length();
                    return token;
                }
                if (state.isFallthrough() && !stack.isRoot()) {
                    stack = stack.pop();
                    continue;
                }
                nextStack = stack;
                Token token = new Token(state.getFallbackKind(), offset, 1, stack, stack);
                offset++;
                return token;
            }
            return null;
        }

        private Matcher matcher(Rule rule) {
            return matchers.computeIfAbsent(rule, r -> r.matcher(text));
        }
    }
}
