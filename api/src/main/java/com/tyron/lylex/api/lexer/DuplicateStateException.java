package com.tyron.lylex.api.lexer;

/**
 * Thrown when a state name is defined twice in the same grammar.
 */
public class DuplicateStateException extends GrammarException {

    private final String stateName;

    public DuplicateStateException(String grammarName, String stateName) {
        super("grammar '" + grammarName + "' already defines state '" + stateName + "'");
        this.stateName = stateName;
    }

    public String getStateName() {
        return stateName;
    }
}
