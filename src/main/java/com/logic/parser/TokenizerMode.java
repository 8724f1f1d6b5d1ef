package com.logic.parser;

/**
 * How the tokenizer recognizes keywords and unknown characters.
 */
public enum TokenizerMode {

    /**
     * Strip whitespace and replace the substrings {@code not}, {@code and}, {@code or}
     * with operator symbols before scanning. Names containing those substrings are split
     * (e.g. {@code Corn} becomes {@code C or n}) and unknown characters are dropped.
     */
    LEGACY,

    /**
     * Whitespace separates tokens, keywords are whole words only, and unknown characters
     * are rejected.
     */
    STRICT
}
