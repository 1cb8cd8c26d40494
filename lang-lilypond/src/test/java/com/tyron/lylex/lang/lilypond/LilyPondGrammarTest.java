package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.lexer.Grammar;
import com.tyron.lylex.api.lexer.Indentation;
import com.tyron.lylex.api.lexer.MatchRole;
import com.tyron.lylex.api.lexer.Token;
import com.tyron.lylex.api.tree.TokenTree;
import com.tyron.lylex.core.document.TokenizedDocumentImpl;
import com.tyron.lylex.core.lexer.StatefulLexer;
import com.tyron.lylex.core.settings.DocumentSettings;
import com.tyron.lylex.core.tree.TokenTreeBuilder;
import com.tyron.lylex.testFramework.BaseLexerTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tyron.lylex.lang.lilypond.LyTokenKind.*;
import static org.junit.jupiter.api.Assertions.*;

public class LilyPondGrammarTest extends BaseLexerTest {

    private final Grammar lilypond = Modes.grammar(Modes.LILYPOND);

    private List<Token> lex(Grammar grammar, String text) {
        List<Token> tokens = new StatefulLexer(grammar).tokenizeAll(text);
        assertCovers(tokens, text.length());
        return tokens;
    }

    @Test
    public void music() {
        String text = "\\relative c' { c4 d8. r4 <c e>2 }";
        List<Token> tokens = withoutWhitespace(lex(lilypond, text));

        assertEquals(List.of("\\relative", "c", "'", "{", "c", "4", "d", "8.", "r", "4", "<", "c", "e", ">", "2", "}"),
                texts(tokens, text));
        assertEquals(List.of(COMMAND, IDENTIFIER, OCTAVE, SEQUENTIAL_START, NOTE, DURATION, NOTE, DURATION, REST,
                DURATION, CHORD_START, NOTE, NOTE, CHORD_END, DURATION, SEQUENTIAL_END), kinds(tokens));
        assertEquals(List.of(1, 1, 1, 2, 2, 2, 2, 2, 2, 2, 3, 3, 3, 3, 2, 2), depths(tokens));
    }

    @Test
    public void keywordsAssignmentsAndStrings() {
        String text = "\\version \"2.24\\\"x\"\nmelody = \\score";
        List<Token> tokens = withoutWhitespace(lex(lilypond, text));

        assertEquals(List.of(KEYWORD, STRING_START, STRING, STRING_ESCAPE, STRING, STRING_END,
                IDENTIFIER, EQUALS, KEYWORD), kinds(tokens));
    }

    @Test
    public void schemeInsideLilyPondInsideScheme() {
        String text = "#(define x #{ c4 #})\nfoo = ##t";
        List<Token> tokens = withoutWhitespace(lex(lilypond, text));

        assertEquals(List.of("#(", "define", "x", "#{", "c", "4", "#}", ")", "foo", "=", "#", "#t"), texts(tokens, text));
        assertEquals(List.of(SCHEME_LIST_START, SCHEME_WORD, SCHEME_WORD, LILYPOND_START, NOTE, DURATION, LILYPOND_END,
                SCHEME_CLOSE_PAREN, IDENTIFIER, EQUALS, SCHEME_START, SCHEME_BOOL), kinds(tokens));
        assertEquals(List.of(2, 2, 2, 3, 3, 3, 3, 2, 1, 1, 2, 2), depths(tokens));
        assertEquals(List.of("lilypond", "scheme", "lilypond-embedded"), tokens.get(4).state().getNames());
    }

    @Test
    public void deepestNestingGivesTreeHeight() {
        String text = "{ #(x #{ c #}) }";
        TokenTree tree = TokenTreeBuilder.build(lex(lilypond, text));

        assertEquals(3, tree.height());
        TokenTree deepest = tree.nodeAt(text.indexOf('c'));
        assertEquals(List.of("lilypond", "music", "scheme", "lilypond-embedded"), deepest.state().getNames());
    }

    @Test
    public void markupTakesOneArgument() {
        String text = "\\markup \\italic word next";
        List<Token> tokens = withoutWhitespace(lex(lilypond, text));

        assertEquals(List.of(MARKUP, MARKUP_COMMAND, MARKUP_WORD, IDENTIFIER), kinds(tokens));
        assertEquals(List.of(2, 2, 2, 1), depths(tokens));
    }

    @Test
    public void markupBlock() {
        String text = "\\markup { \\bold \"x\" y } z";
        List<Token> tokens = withoutWhitespace(lex(lilypond, text));

        assertEquals(List.of(MARKUP, SEQUENTIAL_START, MARKUP_COMMAND, STRING_START, STRING, STRING_END,
                MARKUP_WORD, SEQUENTIAL_END, IDENTIFIER), kinds(tokens));
        assertEquals(List.of(2, 2, 2, 3, 3, 3, 2, 2, 1), depths(tokens));
    }

    @Test
    public void comments() {
        String text = "%{ block\n still %} c % line";
        List<Token> tokens = lex(lilypond, text);

        assertEquals(List.of("%{", " block\n still ", "%}", " ", "c", " ", "% line"), texts(tokens, text));
        assertEquals(List.of(BLOCK_COMMENT_START, BLOCK_COMMENT, BLOCK_COMMENT_END, WHITESPACE, IDENTIFIER,
                WHITESPACE, LINE_COMMENT), kinds(tokens));
    }

    @Test
    public void schemeGrammar() {
        Grammar scheme = Modes.grammar(Modes.SCHEME);
        String text = "(a 'b #\\c 12 #t \"s\") ; done";
        List<Token> tokens = withoutWhitespace(lex(scheme, text));

        assertEquals(List.of(SCHEME_OPEN_PAREN, SCHEME_WORD, SCHEME_QUOTE, SCHEME_WORD, SCHEME_CHAR, SCHEME_NUMBER,
                SCHEME_BOOL, STRING_START, STRING, STRING_END, SCHEME_CLOSE_PAREN, SCHEME_COMMENT), kinds(tokens));
        assertEquals(List.of(2, 2, 2, 2, 2, 2, 2, 3, 3, 3, 2, 1), depths(tokens));
    }

    @Test
    public void schemeBlockComment() {
        Grammar scheme = Modes.grammar(Modes.SCHEME);
        String text = "#! note !# x";
        List<Token> tokens = lex(scheme, text);

        assertEquals(List.of(SCHEME_BLOCK_COMMENT_START, SCHEME_COMMENT, SCHEME_BLOCK_COMMENT_END, WHITESPACE,
                SCHEME_WORD), kinds(tokens));
    }

    @Test
    public void slursBeamsAndLigaturesPair() {
        String text = "{ c8( d) e[ f] g\\( a\\) \\[ b \\] }";
        List<Token> tokens = withoutWhitespace(lex(lilypond, text));

        assertEquals(List.of(SEQUENTIAL_START, NOTE, DURATION, SLUR_START, NOTE, SLUR_END, NOTE, BEAM_START, NOTE,
                BEAM_END, NOTE, PHRASING_SLUR_START, NOTE, PHRASING_SLUR_END, LIGATURE_START, NOTE, LIGATURE_END,
                SEQUENTIAL_END), kinds(tokens));
        assertEquals("slur", SLUR_START.matchName());
        assertEquals(MatchRole.END, SLUR_END.matchRole());
        assertEquals(Indentation.NONE, BEAM_START.indentation());
    }

    @Test
    public void bracketsIndentTheLinesAfterThem() {
        assertEquals(Indentation.INDENT, SEQUENTIAL_START.indentation());
        assertEquals(Indentation.DEDENT, SIMULTANEOUS_END.indentation());
        assertEquals(Indentation.INDENT, BLOCK_COMMENT_START.indentation());
        assertEquals(Indentation.DEDENT, SCHEME_BLOCK_COMMENT_END.indentation());
        assertEquals(SCHEME_LIST_START.matchName(), SCHEME_CLOSE_PAREN.matchName());
        assertEquals(SCHEME_OPEN_PAREN.matchName(), SCHEME_CLOSE_PAREN.matchName());
        assertEquals("schemelily", LILYPOND_END.matchName());
        assertNull(CHORD_START.matchName());
        assertEquals(MatchRole.NONE, NOTE.matchRole());
    }

    @Test
    public void plainText() {
        String text = "just some\nwords";
        List<Token> tokens = lex(Modes.grammar(Modes.TEXT), text);
        assertEquals(List.of(TEXT, WHITESPACE, TEXT, WHITESPACE, TEXT), kinds(tokens));
    }

    @Test
    public void arbitraryEditsMatchFreshDocument() {
        List<String> fragments = List.of("{", "}", "<<", ">>", "<", ">", "#(", ")", "#{", "#}", "\"", "%{", "%}",
                "% c", "\n", " ", "c4", "\\markup ", "\\bold", "#'", "$x", ";", "#!", "!#", "r8.", "'", "=");
        TokenizedDocumentImpl doc = new TokenizedDocumentImpl(lilypond,
                "\\score {\n  \\relative c' { c4 #(foo #{ d #}) }\n  \\markup { x }\n}\n", DocumentSettings.builtIn());

        for (int i = 0; i < 300; i++) {
            String edit = randomEdit(doc, fragments);
            TokenizedDocumentImpl fresh = new TokenizedDocumentImpl(lilypond, doc.getText(), DocumentSettings.builtIn());

            assertCovers(doc);
            assertEquals(describe(fresh.tokens()), describe(doc.tokens()), edit);
            assertEquals(fresh.tree().nodes().size(), doc.tree().nodes().size(), edit);
            assertEquals(doc.tokens(), doc.tree().tokens(), edit);
        }
    }
}
