package com.tyron.lylex.api.lexer;

import java.util.regex.MatchResult;

/**
 * A successful rule match.
 *
 * @param rule       the rule that matched
 * @param start      offset of the match
 * @param length     matched length, always positive
 * @param transition the transition to apply, already resolved against the match
 * @param groups     snapshot of the match, for inspecting capture groups
 */
public record RuleMatch(Rule rule, int start, int length, Transition transition, MatchResult groups) {

    public TokenKind kind() {
        return rule.getKind();
    }

    public int end() {
        return start + length;
    }
}
