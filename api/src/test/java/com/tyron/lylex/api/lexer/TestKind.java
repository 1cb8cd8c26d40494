package com.tyron.lylex.api.lexer;

enum TestKind implements TokenKind {
    WORD(TokenCategory.TEXT),
    SPACE(TokenCategory.WHITESPACE),
    OPEN(TokenCategory.DELIMITER),
    CLOSE(TokenCategory.DELIMITER),
    OTHER(TokenCategory.ERROR);

    private final TokenCategory category;

    TestKind(TokenCategory category) {
        this.category = category;
    }

    @Override
    public TokenCategory category() {
        return category;
    }
}
