package com.tyron.lylex.api.lexer;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A matching rule: a pattern, the kind of token it produces and the transition applied
 * after it matched.
 *
 * Patterns are matched anchored at the lexing offset with transparent bounds, so
 * look-arounds see the surrounding text. A match of length zero is never accepted.
 */
public final class Rule {

    private final Pattern pattern;
    private final TokenKind kind;
    private final Transition transition;

    private Rule(Pattern pattern, TokenKind kind, Transition transition) {
        this.pattern = pattern;
        this.kind = kind;
        this.transition = transition;
    }

    public static Rule of(@NotNull String regex, @NotNull TokenKind kind) {
        return of(regex, kind, Transition.none());
    }

    public static Rule of(@NotNull String regex, @NotNull TokenKind kind, @NotNull Transition transition) {
        Objects.requireNonNull(regex, "regex");
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new GrammarException("invalid pattern for " + kind + ": " + e.getDescription(), e);
        }
        return of(pattern, kind, transition);
    }

    public static Rule of(@NotNull Pattern pattern, @NotNull TokenKind kind, @NotNull Transition transition) {
        return new Rule(Objects.requireNonNull(pattern, "pattern"),
                Objects.requireNonNull(kind, "kind"),
                Objects.requireNonNull(transition, "transition"));
    }

    /**
     * A rule matching the literal text.
     */
    public static Rule literal(@NotNull String text, @NotNull TokenKind kind, @NotNull Transition transition) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new GrammarException("literal rule for " + kind + " must not be empty");
        }
        return of(Pattern.compile(Pattern.quote(text)), kind, transition);
    }

    public static Rule literal(@NotNull String text, @NotNull TokenKind kind) {
        return literal(text, kind, Transition.none());
    }

    public Pattern getPattern() {
        return pattern;
    }

    public TokenKind getKind() {
        return kind;
    }

    public Transition getTransition() {
        return transition;
    }

    /**
     * Creates a matcher over {@code text} configured the way the lexer matches rules.
     */
    public Matcher matcher(CharSequence text) {
        Matcher matcher = pattern.matcher(text);
        matcher.useTransparentBounds(true);
        matcher.useAnchoringBounds(false);
        return matcher;
    }

    @Override
    public String toString() {
        return kind + " /" + pattern.pattern() + "/" + (transition.isNone() ? "" : " " + transition);
    }
}
