package com.example.pairprog.autocomplete;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AutocompleteServiceTest {

    private final AutocompleteService service = new AutocompleteService();

    @Test
    void exactKeyword_completesStatement() {
        Suggestion s = service.suggest("for", 3, "python");

        assertEquals("for item in iterable:\n    pass", s.suggestion());
        assertEquals(0, s.startPosition());
        assertEquals(3, s.endPosition());
        assertEquals("Complete 'for' statement", s.description());
    }

    @Test
    void javascriptTable_forJsAndTs() {
        assertEquals("for (let i = 0; i < length; i++) {\n    \n}", service.suggest("for", 3, "ts").suggestion());
        assertEquals("const name = value;", service.suggest("x\nconst", 7, "javascript").suggestion());
    }

    @Test
    void wordIsLowercasedAndBoundedByNonWordChars() {
        Suggestion s = service.suggest("x = (PRI", 8, "python");

        assertEquals("print()", s.suggestion());
        assertEquals(5, s.startPosition());
        assertEquals("Suggested completion for 'print'", s.description());
    }

    @Test
    void singleCharPrefix_isNotEnough() {
        Suggestion s = service.suggest("q", 1, "python");

        assertEquals("", s.suggestion());
        assertEquals(Suggestion.NONE, s.description());
    }

    @Test
    void commentTags_availableInEveryLanguage() {
        assertEquals("// TODO: ", service.suggest("todo", 4, "python").suggestion());
        assertEquals("// FIXME: ", service.suggest("fix", 3, "go").suggestion());
    }

    @Test
    void unknownLanguage_mergesBothTables_jsWinsOnSharedKeys() {
        assertEquals("if (condition) {\n    \n}", service.suggest("if", 2, "rust").suggestion());
        assertEquals("elif condition:\n    pass", service.suggest("elif", 4, "rust").suggestion());
    }

    @Test
    void lineContext_completesDefinitionHeader() {
        String code = "def compute_total";
        Suggestion s = service.suggest(code, code.length(), "python");

        // the word "compute_total" matches nothing, so the line rule applies
        assertEquals("():\n    pass", s.suggestion());
        assertEquals("Complete function definition", s.description());
        assertEquals(4, s.startPosition());
    }

    @Test
    void lineContext_ignoresLinesThatAlreadyHaveColon() {
        String code = "if x: yy";
        assertEquals("", service.suggest(code, code.length(), "python").suggestion());
    }

    @Test
    void noWordUnderCursor_returnsEmptyAtCursor() {
        Suggestion s = service.suggest("x = ", 4, "python");

        assertEquals("", s.suggestion());
        assertEquals(4, s.startPosition());
        assertEquals(4, s.endPosition());
        assertEquals(Suggestion.NONE, s.description());
    }

    @Test
    void cursorBeyondBuffer_isClampedForLookup() {
        Suggestion s = service.suggest("ret", 99, "python");

        assertEquals("return value", s.suggestion());
        assertEquals(0, s.startPosition());
        assertEquals(99, s.endPosition());
    }
}
