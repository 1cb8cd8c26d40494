package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.lexer.Grammar;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Registry of the text modes this module can lex. Grammars are built on first use and then shared.
 */
public final class Modes {

    private static final Logger LOG = Logger.getLogger(Modes.class.getName());

    public static final String LILYPOND = LilyPondGrammar.NAME;
    public static final String SCHEME = SchemeGrammar.NAME;
    public static final String TEXT = PlainTextGrammar.NAME;

    private static final Map<String, Supplier<Grammar>> FACTORIES;

    static {
        Map<String, Supplier<Grammar>> factories = new LinkedHashMap<>();
        factories.put(LILYPOND, LilyPondGrammar::create);
        factories.put(SCHEME, SchemeGrammar::create);
        factories.put(TEXT, PlainTextGrammar::create);
        FACTORIES = Collections.unmodifiableMap(factories);
    }

    private static final Map<String, Grammar> GRAMMARS = new ConcurrentHashMap<>();

    private Modes() {
    }

    public static Set<String> names() {
        return FACTORIES.keySet();
    }

    public static boolean isKnown(String mode) {
        return mode != null && FACTORIES.containsKey(mode);
    }

    /**
     * @throws IllegalArgumentException for an unknown mode
     */
    public static Grammar grammar(@NotNull String mode) {
        Objects.requireNonNull(mode, "mode");
        Supplier<Grammar> factory = FACTORIES.get(mode);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown mode '" + mode + "', known modes are " + names());
        }
        return GRAMMARS.computeIfAbsent(mode, m -> {
            Grammar grammar = factory.get();
            LOG.info("grammar registered mode=" + m + " states=" + grammar.getStates().size()
                    + " initial=" + grammar.getInitialStateName());
            return grammar;
        });
    }

    /**
     * Guesses the mode from the start of the text. Formats this module has no grammar for
     * (LaTeX, HTML, Texinfo) are treated as plain text.
     */
    public static String guessMode(@NotNull String text) {
        String t = text.stripLeading();
        if (t.startsWith("%") || t.startsWith("\\")) {
            if (t.contains("\\version") || t.contains("\\relative") || t.contains("\\score")) {
                return LILYPOND;
            }
            // LaTeX with embedded music
            if (t.contains("\\documentclass") || t.contains("\\begin{document}")) {
                return TEXT;
            }
            return LILYPOND;
        }
        if (t.startsWith("<<")) {
            return LILYPOND;
        }
        if (t.startsWith("<")) {
            return TEXT;
        }
        if (t.startsWith("#!") || t.startsWith(";") || t.startsWith("(")) {
            return SCHEME;
        }
        if (t.startsWith("@")) {
            return TEXT;
        }
        return LILYPOND;
    }
}
