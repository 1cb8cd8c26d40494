package com.tyron.lylex.testFramework;

import com.tyron.lylex.api.editor.TokenizedDocument;
import com.tyron.lylex.api.lexer.TokenCategory;
import com.tyron.lylex.api.lexer.TokenKind;
import com.tyron.lylex.api.lexer.TokenRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Base class for lexer and document tests.
 * <p>
 * - Configures test logging once.
 * - Provides a seeded {@link Random} so random edit scripts are reproducible.
 * - Provides assertions and listings over token sequences.
 */
public abstract class BaseLexerTest {

    protected static final long SEED = 20240613L;

    protected Random random;

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        random = new Random(SEED);
        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() {
        afterEach();
    }

    /**
     * Subclasses override for per-test setup.
     */
    protected void beforeEach() throws Exception {
    }

    protected void afterEach() {
    }

    /**
     * Asserts that the tokens cover {@code [0, length)} without gaps or overlaps.
     */
    protected static void assertCovers(List<? extends TokenRef> tokens, int length) {
        int expected = 0;
        for (TokenRef token : tokens) {
            assertEquals(expected, token.start(), "gap or overlap before " + token);
            assertTrue(token.length() > 0, "empty token " + token);
            expected = token.end();
        }
        assertEquals(length, expected, "tokens end before the text does");
    }

    protected static void assertCovers(TokenizedDocument document) {
        assertCovers(document.tokens(), document.getTextLength());
    }

    /**
     * Asserts equal kinds, offsets, states and end states, token by token.
     */
    protected static void assertSameTokens(List<? extends TokenRef> expected, List<? extends TokenRef> actual) {
        assertEquals(describe(expected), describe(actual));
    }

    protected static String describe(List<? extends TokenRef> tokens) {
        return tokens.stream()
                .map(t -> t.kind().name() + "@" + t.start() + ".." + t.end() + " " + t.state() + " -> " + t.token().endState())
                .collect(Collectors.joining("\n"));
    }

    protected static List<String> texts(List<? extends TokenRef> tokens, CharSequence text) {
        List<String> result = new ArrayList<>(tokens.size());
        for (TokenRef token : tokens) {
            result.add(token.text(text));
        }
        return result;
    }

    protected static List<TokenKind> kinds(List<? extends TokenRef> tokens) {
        List<TokenKind> result = new ArrayList<>(tokens.size());
        for (TokenRef token : tokens) {
            result.add(token.kind());
        }
        return result;
    }

    protected static List<Integer> depths(List<? extends TokenRef> tokens) {
        List<Integer> result = new ArrayList<>(tokens.size());
        for (TokenRef token : tokens) {
            result.add(token.state().getDepth());
        }
        return result;
    }

    protected static <T extends TokenRef> List<T> withoutWhitespace(List<T> tokens) {
        List<T> result = new ArrayList<>(tokens.size());
        for (T token : tokens) {
            if (token.kind().category() != TokenCategory.WHITESPACE) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Applies a random edit: removes up to four characters at a random offset and inserts one of
     * the fragments (or nothing).
     *
     * @return a description for assertion messages
     */
    protected String randomEdit(TokenizedDocument document, List<String> fragments) {
        int length = document.getTextLength();
        int start = random.nextInt(length + 1);
        int removed = Math.min(length - start, random.nextInt(5));
        String inserted = random.nextInt(4) == 0 ? "" : fragments.get(random.nextInt(fragments.size()));
        String description = "edit start=" + start + " removed=" + removed + " inserted='" + inserted + "'";
        document.applyEdit(start, removed, inserted);
        return description;
    }
}
