package com.tyron.lylex.api.lexer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable set of named lexer states for one language.
 *
 * Grammars are built once and passed explicitly to lexers and documents; there is no global
 * registry. All definition errors surface from {@link Builder#defineState} and
 * {@link Builder#build()}.
 */
public final class Grammar {

    private final String name;
    private final Class<? extends TokenKind> kindType;
    private final String initialStateName;
    private final Map<String, LexerState> states;
    private final StateStack initialStack;

    private Grammar(Builder builder, String initialStateName) {
        this.name = builder.name;
        this.kindType = builder.kindType;
        this.initialStateName = initialStateName;
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(builder.states));
        this.initialStack = StateStack.root(states.get(initialStateName));
    }

    public static Builder builder(@NotNull String name, @NotNull Class<? extends TokenKind> kindType) {
        return new Builder(name, kindType);
    }

    public String getName() {
        return name;
    }

    public Class<? extends TokenKind> getKindType() {
        return kindType;
    }

    public String getInitialStateName() {
        return initialStateName;
    }

    /**
     * @return a root stack holding the initial state
     */
    public StateStack initialStack() {
        return initialStack;
    }

    /**
     * @return a root stack holding the named state
     */
    public StateStack stackOf(@NotNull String stateName) {
        return StateStack.root(getState(stateName));
    }

    public boolean hasState(String stateName) {
        return states.containsKey(stateName);
    }

    public LexerState getState(@NotNull String stateName) {
        LexerState state = states.get(stateName);
        if (state == null) {
            throw new IllegalArgumentException("grammar '" + name + "' has no state '" + stateName + "'");
        }
        return state;
    }

    public Collection<LexerState> getStates() {
        return states.values();
    }

    /**
     * Tries the rules of {@code state} in declaration order, anchored at {@code offset}.
     *
     * @return the first match, or empty when no rule matches; the caller then applies the
     * state's fallback kind and advances one character
     */
    public Optional<RuleMatch> matchAt(@NotNull LexerState state, @NotNull CharSequence text, int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + text.length());
        }
        return Optional.ofNullable(state.matchAt(text, offset, text.length(), rule -> rule.matcher(text)));
    }

    @Override
    public String toString() {
        return "Grammar(" + name + ", states=" + states.keySet() + ")";
    }

    public static final class Builder {

        private final String name;
        private final Class<? extends TokenKind> kindType;
        private final Map<String, LexerState> states = new LinkedHashMap<>();
        private String initialStateName;

        private Builder(String name, Class<? extends TokenKind> kindType) {
            this.name = Objects.requireNonNull(name, "name");
            this.kindType = Objects.requireNonNull(kindType, "kindType");
        }

        /**
         * Registers a state.
         *
         * @throws DuplicateStateException if a state with this name is already defined
         */
        public Builder defineState(@NotNull String stateName, @NotNull List<Rule> rules, @NotNull TokenKind fallbackKind) {
            return define(stateName, rules, fallbackKind, false);
        }

        /**
         * Registers a state that is left, instead of producing a fallback token, when none of
         * its rules match.
         */
        public Builder defineFallthroughState(@NotNull String stateName, @NotNull List<Rule> rules, @NotNull TokenKind fallbackKind) {
            return define(stateName, rules, fallbackKind, true);
        }

        /**
         * Sets the state documents start in. Defaults to the first defined state.
         */
        public Builder initialState(@NotNull String stateName) {
            this.initialStateName = Objects.requireNonNull(stateName, "stateName");
            return this;
        }

        @Nullable
        public LexerState getDefinedState(String stateName) {
            return states.get(stateName);
        }

        public Grammar build() {
            if (states.isEmpty()) {
                throw new GrammarException("grammar '" + name + "' defines no states");
            }
            String initial = initialStateName != null ? initialStateName : states.keySet().iterator().next();
            if (!states.containsKey(initial)) {
                throw new UndefinedStateException(name, "the initial state", initial);
            }
            for (LexerState state : states.values()) {
                validate(state);
            }
            return new Grammar(this, initial);
        }

        private Builder define(String stateName, List<Rule> rules, TokenKind fallbackKind, boolean fallthrough) {
            Objects.requireNonNull(stateName, "stateName");
            Objects.requireNonNull(rules, "rules");
            Objects.requireNonNull(fallbackKind, "fallbackKind");
            if (states.containsKey(stateName)) {
                throw new DuplicateStateException(name, stateName);
            }
            List<Rule> copy = new ArrayList<>(rules.size());
            for (Rule rule : rules) {
                copy.add(Objects.requireNonNull(rule, "rule"));
            }
            states.put(stateName, new LexerState(stateName, copy, fallbackKind, fallthrough));
            return this;
        }

        private void validate(LexerState state) {
            checkKind(state.getFallbackKind(), "fallback of state '" + state.getName() + "'");
            List<Rule> rules = state.getRules();
            for (int i = 0; i < rules.size(); i++) {
                Rule rule = rules.get(i);
                String where = "rule #" + i + " (" + rule.getKind() + ") of state '" + state.getName() + "'";
                checkKind(rule.getKind(), where);
                for (String target : rule.getTransition().getTargetStates()) {
                    if (!states.containsKey(target)) {
                        throw new UndefinedStateException(name, where, target);
                    }
                }
                for (String group : rule.getTransition().getGroupNames()) {
                    if (!rule.getPattern().pattern().contains("(?<" + group + ">")) {
                        throw new GrammarException("grammar '" + name + "': " + where
                                + " inspects group '" + group + "' its pattern does not define");
                    }
                }
            }
        }

        private void checkKind(TokenKind kind, String where) {
            if (!kindType.isInstance(kind)) {
                throw new GrammarException("grammar '" + name + "': " + where + " uses kind " + kind
                        + " which is not a " + kindType.getSimpleName());
            }
        }
    }
}
