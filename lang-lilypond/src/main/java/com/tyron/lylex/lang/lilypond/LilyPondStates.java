package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.lexer.Grammar;
import com.tyron.lylex.api.lexer.Rule;
import com.tyron.lylex.api.lexer.Transition;

import java.util.ArrayList;
import java.util.List;

import static com.tyron.lylex.lang.lilypond.LyTokenKind.*;

/**
 * The states shared by the LilyPond and Scheme grammars. Both languages embed each other, so
 * both grammars define the same set and only differ in the state they start in.
 */
final class LilyPondStates {

    static final String LILYPOND = "lilypond";
    static final String MUSIC = "music";
    static final String CHORD = "chord";
    static final String STRING = "string";
    static final String BLOCK_COMMENT = "block-comment";
    static final String MARKUP = "markup";
    static final String MARKUP_BLOCK = "markup-block";
    static final String SCHEME_EXPR = "scheme-expr";
    static final String SCHEME = "scheme";
    static final String SCHEME_STRING = "scheme-string";
    static final String SCHEME_BLOCK_COMMENT = "scheme-block-comment";
    static final String LILYPOND_EMBEDDED = "lilypond-embedded";

    private static final String COMMAND_REGEX = "\\\\[A-Za-z]+(?:-[A-Za-z]+)*";
    private static final String NOTE_REGEX = "[a-x]+(?![A-Za-z])";
    private static final String IDENTIFIER_REGEX = "[A-Za-z]+(?:[_-][A-Za-z]+)*";
    // a scheme atom ends at a delimiter
    private static final String SCHEME_ATOM_END = "(?![^()\"{}\\s])";

    private LilyPondStates() {
    }

    static void define(Grammar.Builder builder) {
        builder.defineState(LILYPOND, lilypond(false), ERROR)
                .defineState(MUSIC, lilypond(true), ERROR)
                .defineState(CHORD, chord(), ERROR)
                .defineState(STRING, string(), LyTokenKind.STRING)
                .defineState(BLOCK_COMMENT, List.of(
                        Rule.of("%\\}", BLOCK_COMMENT_END, Transition.pop()),
                        Rule.of("[^%]+", LyTokenKind.BLOCK_COMMENT)), LyTokenKind.BLOCK_COMMENT)
                .defineFallthroughState(MARKUP, markup(), ERROR)
                .defineState(MARKUP_BLOCK, markupBlock(), MARKUP_WORD)
                .defineFallthroughState(SCHEME_EXPR, schemeExpression(), ERROR)
                .defineState(SCHEME, scheme(), ERROR)
                .defineState(SCHEME_STRING, string(), LyTokenKind.STRING)
                .defineState(SCHEME_BLOCK_COMMENT, List.of(
                        Rule.of("!#", SCHEME_BLOCK_COMMENT_END, Transition.pop()),
                        Rule.of("[^!]+", SCHEME_COMMENT)), SCHEME_COMMENT)
                .defineState(LILYPOND_EMBEDDED, embeddedLilyPond(), ERROR);
    }

    private static List<Rule> comments() {
        return List.of(
                Rule.of("\\s+", WHITESPACE),
                Rule.of("%\\{", BLOCK_COMMENT_START, Transition.push(BLOCK_COMMENT)),
                Rule.of("%[^\\n]*", LINE_COMMENT));
    }

    /**
     * Toplevel and music rules. In music, letters are notes first; at toplevel they are
     * identifiers, as in {@code melody = \relative { ... }}.
     */
    private static List<Rule> lilypond(boolean music) {
        List<Rule> rules = new ArrayList<>(comments());
        rules.add(Rule.of("\"", STRING_START, Transition.push(STRING)));
        rules.addAll(schemeStart(false));
        rules.add(Rule.of("\\\\(?:score|book|bookpart|header|paper|layout|midi|with|context|version|include|language)(?![A-Za-z])",
                KEYWORD));
        rules.add(Rule.of("\\\\(?:markup|markuplist|markuplines)(?![A-Za-z])", LyTokenKind.MARKUP,
                Transition.push(MARKUP)));
        rules.add(Rule.of("\\\\\\(", PHRASING_SLUR_START));
        rules.add(Rule.of("\\\\\\)", PHRASING_SLUR_END));
        rules.add(Rule.of("\\\\\\[", LIGATURE_START));
        rules.add(Rule.of("\\\\\\]", LIGATURE_END));
        rules.add(Rule.of("\\\\\\\\", DELIMITER));
        rules.add(Rule.of(COMMAND_REGEX, COMMAND));
        rules.add(Rule.of("\\{", SEQUENTIAL_START, Transition.push(MUSIC)));
        rules.add(Rule.of("\\}", SEQUENTIAL_END, Transition.pop()));
        rules.add(Rule.of("<<", SIMULTANEOUS_START, Transition.push(MUSIC)));
        rules.add(Rule.of(">>", SIMULTANEOUS_END, Transition.pop()));
        rules.add(Rule.of("<", CHORD_START, Transition.push(CHORD)));
        if (music) {
            rules.add(Rule.of("[Rr](?![A-Za-z])|s(?![A-Za-z])", REST));
            rules.add(Rule.of(NOTE_REGEX, NOTE));
            rules.add(Rule.of(IDENTIFIER_REGEX, IDENTIFIER));
            rules.add(Rule.of("(?:128|64|32|16|8|4|2|1)(?!\\d)\\.*(?:\\*\\d+(?:/\\d+)?)?", DURATION));
        } else {
            rules.add(Rule.of(IDENTIFIER_REGEX, IDENTIFIER));
        }
        rules.add(Rule.of(",+|'+", OCTAVE));
        rules.add(Rule.of("\\d+(?:\\.\\d+|/\\d+)?", NUMBER));
        rules.add(Rule.of("=", EQUALS));
        rules.add(Rule.of("[-_^](?:[-+|>._^!]|\\d)?", ARTICULATION));
        rules.add(Rule.of("\\(", SLUR_START));
        rules.add(Rule.of("\\)", SLUR_END));
        rules.add(Rule.of("\\[", BEAM_START));
        rules.add(Rule.of("\\]", BEAM_END));
        rules.add(Rule.of("[|~:/!?.*+]", DELIMITER));
        return rules;
    }

    private static List<Rule> chord() {
        List<Rule> rules = new ArrayList<>(comments());
        rules.add(Rule.of(">", CHORD_END, Transition.pop()));
        rules.add(Rule.of("\"", STRING_START, Transition.push(STRING)));
        rules.addAll(schemeStart(false));
        rules.add(Rule.of(COMMAND_REGEX, COMMAND));
        rules.add(Rule.of(NOTE_REGEX, NOTE));
        rules.add(Rule.of(",+|'+", OCTAVE));
        rules.add(Rule.of("=", EQUALS));
        rules.add(Rule.of("\\d+", NUMBER));
        rules.add(Rule.of("[-_^](?:[-+|>._^!]|\\d)?", ARTICULATION));
        rules.add(Rule.of("[!?]", DELIMITER));
        return rules;
    }

    /**
     * {@code #} or {@code $} followed by a Scheme datum; a list directly after it is entered at once.
     */
    private static List<Rule> schemeStart(boolean replace) {
        return List.of(
                Rule.of("[#$]\\(", SCHEME_LIST_START, replace ? Transition.switchTo(SCHEME) : Transition.push(SCHEME)),
                Rule.of("[#$]", SCHEME_START, replace ? Transition.switchTo(SCHEME_EXPR) : Transition.push(SCHEME_EXPR)));
    }

    private static List<Rule> string() {
        return List.of(
                Rule.of("\\\\.", STRING_ESCAPE),
                Rule.of("\"", STRING_END, Transition.pop()),
                Rule.of("[^\"\\\\]+", LyTokenKind.STRING));
    }

    /**
     * One markup argument. Commands stay, waiting for their argument; anything that is not an
     * argument leaves the state.
     */
    private static List<Rule> markup() {
        List<Rule> rules = new ArrayList<>(comments());
        rules.add(Rule.of("\\{", SEQUENTIAL_START, Transition.switchTo(MARKUP_BLOCK)));
        rules.add(Rule.of("\"", STRING_START, Transition.switchTo(STRING)));
        rules.addAll(schemeStart(true));
        rules.add(Rule.of(COMMAND_REGEX, MARKUP_COMMAND));
        rules.add(Rule.of("[^{}\"\\\\\\s#$%]+", MARKUP_WORD, Transition.pop()));
        return rules;
    }

    private static List<Rule> markupBlock() {
        List<Rule> rules = new ArrayList<>(comments());
        rules.add(Rule.of("\\{", SEQUENTIAL_START, Transition.push(MARKUP_BLOCK)));
        rules.add(Rule.of("\\}", SEQUENTIAL_END, Transition.pop()));
        rules.add(Rule.of("\"", STRING_START, Transition.push(STRING)));
        rules.addAll(schemeStart(false));
        rules.add(Rule.of(COMMAND_REGEX, MARKUP_COMMAND));
        rules.add(Rule.of("[^{}\"\\\\\\s#$%]+", MARKUP_WORD));
        return rules;
    }

    /**
     * One Scheme datum after {@code #} or {@code $}. Quotes stay; atoms and lists end it.
     */
    private static List<Rule> schemeExpression() {
        List<Rule> rules = new ArrayList<>();
        rules.add(Rule.of("\\(", SCHEME_OPEN_PAREN, Transition.switchTo(SCHEME)));
        rules.add(Rule.of("\"", STRING_START, Transition.switchTo(SCHEME_STRING)));
        rules.add(Rule.of("#\\{", LILYPOND_START, Transition.switchTo(LILYPOND_EMBEDDED)));
        rules.add(Rule.of(",@|[',`]", SCHEME_QUOTE));
        rules.addAll(schemeAtoms(Transition.pop()));
        return rules;
    }

    private static List<Rule> scheme() {
        List<Rule> rules = new ArrayList<>();
        rules.add(Rule.of("\\s+", WHITESPACE));
        rules.add(Rule.of(";[^\\n]*", SCHEME_COMMENT));
        rules.add(Rule.of("#!", SCHEME_BLOCK_COMMENT_START, Transition.push(SCHEME_BLOCK_COMMENT)));
        rules.add(Rule.of("\\(", SCHEME_OPEN_PAREN, Transition.push(SCHEME)));
        rules.add(Rule.of("\\)", SCHEME_CLOSE_PAREN, Transition.pop()));
        rules.add(Rule.of("#\\{", LILYPOND_START, Transition.push(LILYPOND_EMBEDDED)));
        rules.add(Rule.of("\"", STRING_START, Transition.push(SCHEME_STRING)));
        rules.add(Rule.of(",@|[',`]", SCHEME_QUOTE));
        rules.addAll(schemeAtoms(Transition.none()));
        return rules;
    }

    private static List<Rule> schemeAtoms(Transition after) {
        return List.of(
                Rule.of("#(?:t|f|true|false)" + SCHEME_ATOM_END, SCHEME_BOOL, after),
                Rule.of("#\\\\(?:[a-z]+|.)", SCHEME_CHAR, after),
                Rule.of("(?:-?\\d+(?:/\\d+|\\.\\d*)?|#(?:b[01]+|o[0-7]+|x[0-9a-fA-F]+))" + SCHEME_ATOM_END,
                        SCHEME_NUMBER, after),
                Rule.of("[^()\"{}\\s]+", SCHEME_WORD, after));
    }

    private static List<Rule> embeddedLilyPond() {
        List<Rule> rules = new ArrayList<>();
        rules.add(Rule.of("#\\}", LILYPOND_END, Transition.pop()));
        rules.addAll(lilypond(true));
        return rules;
    }
}
