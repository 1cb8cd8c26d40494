package com.tyron.lylex.core.document;

import com.tyron.lylex.api.lexer.Token;
import com.tyron.lylex.api.lexer.TokenRef;

/**
 * Live view of a document token with absolute offsets.
 *
 * The view follows its line when text before it is inserted or removed. It becomes stale
 * once the line is re-lexed; {@link #isValid()} tells.
 */
public final class DocumentToken implements TokenRef {

    private final Line line;
    private final Token token;

    DocumentToken(Line line, Token token) {
        this.line = line;
        this.token = token;
    }

    @Override
    public Token token() {
        return token;
    }

    @Override
    public int start() {
        return line.start + token.start();
    }

    @Override
    public int end() {
        return line.start + token.end();
    }

    @Override
    public int length() {
        return token.length();
    }

    public int getLine() {
        return line.index;
    }

    public boolean isValid() {
        return !line.detached;
    }

    Line line() {
        return line;
    }

    @Override
    public String toString() {
        return token.kind().name() + "@" + start() + ".." + end();
    }
}
