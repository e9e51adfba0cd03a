package com.github.alexishuf.curie.exceptions;

/**
 * Text given to a deserialization entry point (e.g., {@code Curie.parse()}) is not in the
 * expected textual form.
 */
public class CurieFormatException extends CurieException {
    private final String input;

    public CurieFormatException(CharSequence input, String problem) {
        super(problem+": \""+input+"\"");
        this.input = input.toString();
    }

    /** The rejected text. */
    public String input() { return input; }
}
