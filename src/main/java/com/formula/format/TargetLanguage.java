package com.formula.format;

import java.util.Map;

/**
 * Languages a formula can be translated to, each with its operator and literal lexicon.
 * Lexicon keys are upper-case formula tokens.
 */
public enum TargetLanguage {
    JAVASCRIPT(Map.of(
            "=", "===",
            "<>", "!==",
            "&", "+",
            "AND", "&&",
            "OR", "||",
            "TRUE", "true",
            "FALSE", "false"
    )),

    CSHARP(Map.of(
            "=", "==",
            "<>", "!=",
            "&", "+",
            "AND", "&&",
            "OR", "||",
            "TRUE", "true",
            "FALSE", "false"
    )),

    PYTHON(Map.of(
            "=", "==",
            "<>", "!=",
            "&", "+",
            "AND", "and",
            "OR", "or",
            "TRUE", "True",
            "FALSE", "False"
    ));

    private final Map<String, String> lexicon;

    TargetLanguage(Map<String, String> lexicon) {
        this.lexicon = lexicon;
    }

    public Map<String, String> lexicon() {
        return lexicon;
    }
}
