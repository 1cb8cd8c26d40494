package com.tyron.lylex.api.lexer;

/**
 * Thrown when a rule transition or the initial state refers to a state the grammar does not define.
 */
public class UndefinedStateException extends GrammarException {

    private final String stateName;

    public UndefinedStateException(String grammarName, String referencedFrom, String stateName) {
        super("grammar '" + grammarName + "': " + referencedFrom + " refers to undefined state '" + stateName + "'");
        this.stateName = stateName;
    }

    public String getStateName() {
        return stateName;
    }
}
