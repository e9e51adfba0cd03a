package com.github.alexishuf.curie.exceptions;

import org.checkerframework.checker.nullness.qual.Nullable;

public class CurieException extends RuntimeException {
    public CurieException(String message) { this(message, null); }
    public CurieException(String message, @Nullable Throwable cause) { super(message, cause); }

    @Override public String getMessage() {
        String message = super.getMessage();
        if (message == null) {
            if (getCause() != null) {
                message = getCause().getMessage();
                if (message == null)
                    message = getCause().getClass().getSimpleName();
            } else {
                message = "<<no message nor causing exception>>";
            }
        }
        return message;
    }

    @Override public String toString() {
        return getClass().getSimpleName()+": "+getMessage();
    }
}
