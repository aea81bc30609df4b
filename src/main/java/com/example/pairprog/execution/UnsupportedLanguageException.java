package com.example.pairprog.execution;

import java.util.Collection;

/** The sandbox has no runtime configured for the requested language. */
public class UnsupportedLanguageException extends RuntimeException {

    public UnsupportedLanguageException(String language, Collection<String> supported) {
        super("Unsupported language: " + language + ". Supported languages: " + String.join(", ", supported));
    }
}
