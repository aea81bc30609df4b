package com.example.pairprog.persistence;

import java.util.Locale;
import java.util.Map;

/** Buffer a freshly created room starts with, per language. */
public final class StarterCode {
    private StarterCode() {}

    private static final Map<String, String> TEMPLATES = Map.of(
            "python", "# Welcome to Pair Programming!\n# Start coding together...\n\n"
                    + "def main():\n    print(\"Hello, World!\")\n\nif __name__ == \"__main__\":\n    main()\n",
            "javascript", "// Welcome to Pair Programming!\n// Start coding together...\n\n"
                    + "function main() {\n    console.log(\"Hello, World!\");\n}\n\nmain();\n",
            "typescript", "// Welcome to Pair Programming!\n// Start coding together...\n\n"
                    + "function main(): void {\n    console.log(\"Hello, World!\");\n}\n\nmain();\n",
            "java", "// Welcome to Pair Programming!\n// Start coding together...\n\n"
                    + "public class Main {\n    public static void main(String[] args) {\n"
                    + "        System.out.println(\"Hello, World!\");\n    }\n}\n",
            "cpp", "// Welcome to Pair Programming!\n// Start coding together...\n\n"
                    + "#include <iostream>\n\nint main() {\n    std::cout << \"Hello, World!\" << std::endl;\n    return 0;\n}\n",
            "go", "// Welcome to Pair Programming!\n// Start coding together...\n\n"
                    + "package main\n\nimport \"fmt\"\n\nfunc main() {\n    fmt.Println(\"Hello, World!\")\n}\n",
            "rust", "// Welcome to Pair Programming!\n// Start coding together...\n\n"
                    + "fn main() {\n    println!(\"Hello, World!\");\n}\n",
            "ruby", "# Welcome to Pair Programming!\n# Start coding together...\n\n"
                    + "def main\n  puts \"Hello, World!\"\nend\n\nmain\n"
    );

    /** Unknown languages get the python template. */
    public static String forLanguage(String language) {
        String key = (language == null) ? "python" : language.trim().toLowerCase(Locale.ROOT);
        return TEMPLATES.getOrDefault(key, TEMPLATES.get("python"));
    }
}
