package com.tyron.lylex.api.lexer;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;

/**
 * A named lexer state: an ordered list of rules and the behavior for input none of them matches.
 *
 * When nothing matches, a regular state produces a one character token of its fallback kind.
 * A fall-through state is left instead, and lexing retries at the same offset in the
 * state below it. At the bottom of a stack a fall-through state behaves like a regular one.
 */
public final class LexerState {

    private final String name;
    private final List<Rule> rules;
    private final TokenKind fallbackKind;
    private final boolean fallthrough;

    LexerState(String name, List<Rule> rules, TokenKind fallbackKind, boolean fallthrough) {
        this.name = name;
        this.rules = List.copyOf(rules);
        this.fallbackKind = fallbackKind;
        this.fallthrough = fallthrough;
    }

    public String getName() {
        return name;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public TokenKind getFallbackKind() {
        return fallbackKind;
    }

    public boolean isFallthrough() {
        return fallthrough;
    }

    /**
     * Tries the rules in declaration order, anchored at {@code offset}.
     *
     * @param end      matches never extend past this offset
     * @param matchers supplies a matcher over the text for a rule; may hand out cached instances
     * @return the first match, or {@code null} when no rule matches
     */
    @Nullable
    public RuleMatch matchAt(CharSequence text, int offset, int end, Function<Rule, Matcher> matchers) {
        for (Rule rule : rules) {
            Matcher matcher = matchers.apply(rule);
            matcher.region(offset, end);
            if (matcher.lookingAt() && matcher.end() > offset) {
                Transition transition = rule.getTransition().resolve(matcher);
                return new RuleMatch(rule, offset, matcher.end() - offset, transition, matcher.toMatchResult());
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
