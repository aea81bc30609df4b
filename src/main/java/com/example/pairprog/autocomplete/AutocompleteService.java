package com.example.pairprog.autocomplete;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Rule-based completion: keyword snippets for the word under the cursor, falling back to
 * finishing a {@code def}/{@code class}/{@code if}/{@code for} header on the current line.
 * Stateless.
 */
@Service
public class AutocompleteService {

    private static final Logger log = LoggerFactory.getLogger(AutocompleteService.class);

    private static final Map<String, String> PYTHON = new LinkedHashMap<>();
    private static final Map<String, String> JS = new LinkedHashMap<>();
    private static final Map<String, String> COMMENT_TAGS = new LinkedHashMap<>();

    static {
        PYTHON.put("def", "def function_name():\n    pass");
        PYTHON.put("class", "class ClassName:\n    def __init__(self):\n        pass");
        PYTHON.put("if", "if condition:\n    pass");
        PYTHON.put("elif", "elif condition:\n    pass");
        PYTHON.put("else", "else:\n    pass");
        PYTHON.put("for", "for item in iterable:\n    pass");
        PYTHON.put("while", "while condition:\n    pass");
        PYTHON.put("try", "try:\n    pass\nexcept Exception as e:\n    pass");
        PYTHON.put("except", "except Exception as e:\n    pass");
        PYTHON.put("finally", "finally:\n    pass");
        PYTHON.put("with", "with open('file.txt', 'r') as f:\n    pass");
        PYTHON.put("import", "import module_name");
        PYTHON.put("from", "from module import name");
        PYTHON.put("return", "return value");
        PYTHON.put("yield", "yield value");
        PYTHON.put("lambda", "lambda x: x");
        PYTHON.put("async", "async def function_name():\n    pass");
        PYTHON.put("await", "await coroutine()");
        PYTHON.put("print", "print()");
        PYTHON.put("len", "len()");
        PYTHON.put("range", "range()");
        PYTHON.put("list", "list()");
        PYTHON.put("dict", "dict()");
        PYTHON.put("set", "set()");
        PYTHON.put("tuple", "tuple()");
        PYTHON.put("str", "str()");
        PYTHON.put("int", "int()");
        PYTHON.put("float", "float()");
        PYTHON.put("bool", "bool()");
        PYTHON.put("input", "input('Enter value: ')");
        PYTHON.put("open", "open('filename', 'r')");

        JS.put("function", "function name() {\n    \n}");
        JS.put("const", "const name = value;");
        JS.put("let", "let name = value;");
        JS.put("var", "var name = value;");
        JS.put("if", "if (condition) {\n    \n}");
        JS.put("else", "else {\n    \n}");
        JS.put("for", "for (let i = 0; i < length; i++) {\n    \n}");
        JS.put("while", "while (condition) {\n    \n}");
        JS.put("class", "class ClassName {\n    constructor() {\n        \n    }\n}");
        JS.put("import", "import { name } from 'module';");
        JS.put("export", "export default name;");
        JS.put("async", "async function name() {\n    \n}");
        JS.put("await", "await promise;");
        JS.put("try", "try {\n    \n} catch (error) {\n    \n}");
        JS.put("catch", "catch (error) {\n    \n}");
        JS.put("finally", "finally {\n    \n}");
        JS.put("return", "return value;");
        JS.put("console", "console.log();");
        JS.put("fetch", "fetch('url').then(res => res.json())");
        JS.put("arrow", "const fn = () => {\n    \n};");
        JS.put("map", ".map(item => item)");
        JS.put("filter", ".filter(item => item)");
        JS.put("reduce", ".reduce((acc, item) => acc, initialValue)");
        JS.put("usestate", "const [state, setState] = useState(initialValue);");
        JS.put("useeffect", "useEffect(() => {\n    \n}, []);");
        JS.put("interface", "interface Name {\n    property: type;\n}");
        JS.put("type", "type Name = {\n    property: type;\n};");

        COMMENT_TAGS.put("todo", "// TODO: ");
        COMMENT_TAGS.put("fixme", "// FIXME: ");
        COMMENT_TAGS.put("note", "// NOTE: ");
        COMMENT_TAGS.put("hack", "// HACK: ");
    }

    public Suggestion suggest(String code, int cursorPosition, String language) {
        String text = (code == null) ? "" : code;
        int cursor = Math.max(0, Math.min(cursorPosition, text.length()));

        int wordStart = wordStart(text, cursor);
        String word = text.substring(wordStart, cursor).toLowerCase(Locale.ROOT);
        if (word.isEmpty()) {
            return new Suggestion("", cursorPosition, cursorPosition, Suggestion.NONE);
        }

        Map<String, String> keywords = keywordsFor(language);

        String suggestion = "";
        String description = "";

        if (keywords.containsKey(word)) {
            suggestion = keywords.get(word);
            description = "Complete '" + word + "' statement";
        } else if (word.length() >= 2) {
            for (Map.Entry<String, String> e : keywords.entrySet()) {
                if (e.getKey().startsWith(word)) {
                    suggestion = e.getValue();
                    description = "Suggested completion for '" + e.getKey() + "'";
                    break;
                }
            }
        }

        if (suggestion.isEmpty()) {
            String before = text.substring(0, cursor);
            String line = before.substring(before.lastIndexOf('\n') + 1).strip();
            if (!line.contains(":")) {
                if (line.startsWith("def ")) {
                    suggestion = "():\n    pass";
                    description = "Complete function definition";
                } else if (line.startsWith("class ")) {
                    suggestion = ":\n    def __init__(self):\n        pass";
                    description = "Complete class definition";
                } else if (line.startsWith("if ")) {
                    suggestion = ":\n    pass";
                    description = "Complete if statement";
                } else if (line.startsWith("for ")) {
                    suggestion = " in range():\n    pass";
                    description = "Complete for loop";
                }
            }
        }

        log.debug("Autocomplete language={} word='{}' hit={}", language, word, !suggestion.isEmpty());
        // the reported end is the caller's position, unclamped
        return new Suggestion(suggestion, wordStart, cursorPosition, description.isEmpty() ? Suggestion.NONE : description);
    }

    /** Start of the run of letters, digits and underscores ending at {@code cursor}. */
    static int wordStart(String text, int cursor) {
        int start = cursor;
        while (start > 0) {
            char ch = text.charAt(start - 1);
            if (!Character.isLetterOrDigit(ch) && ch != '_') break;
            start--;
        }
        return start;
    }

    /** Keyword table for a language, comment tags always included. Later tables win on shared keys. */
    static Map<String, String> keywordsFor(String language) {
        String lang = (language == null) ? "" : language.toLowerCase(Locale.ROOT);
        Map<String, String> out = new LinkedHashMap<>();
        switch (lang) {
            case "python", "py" -> out.putAll(PYTHON);
            case "javascript", "js", "typescript", "ts" -> out.putAll(JS);
            default -> {
                out.putAll(PYTHON);
                out.putAll(JS);
            }
        }
        out.putAll(COMMENT_TAGS);
        return out;
    }
}
