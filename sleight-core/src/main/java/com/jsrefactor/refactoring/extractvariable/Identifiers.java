package com.jsrefactor.refactoring.extractvariable;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rules for names a declaration can bind.
 */
final class Identifiers {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    // Separators and lower-to-upper case humps
    private static final Pattern WORD_BOUNDARY = Pattern.compile("[^A-Za-z0-9]+|(?<=[a-z0-9])(?=[A-Z])");

    private static final Set<String> RESERVED_WORDS = Set.of(
        "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default",
        "delete", "do", "else", "enum", "export", "extends", "false", "finally", "for", "function",
        "if", "implements", "import", "in", "instanceof", "interface", "let", "new", "null",
        "package", "private", "protected", "public", "return", "static", "super", "switch", "this",
        "throw", "true", "try", "typeof", "var", "void", "while", "with", "yield",
        "arguments", "eval", "undefined", "NaN", "Infinity"
    );

    private Identifiers() {
    }

    static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !RESERVED_WORDS.contains(name);
    }

    /**
     * camelCase of the words in {@code text}: "Hello world" gives
     * "helloWorld". Null when the text has no word characters.
     */
    static String camelCase(String text) {
        List<String> words = Arrays.stream(WORD_BOUNDARY.split(text))
            .filter(word -> !word.isEmpty())
            .map(word -> word.toLowerCase(Locale.ROOT))
            .toList();
        if (words.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder(words.get(0));
        for (String word : words.subList(1, words.size())) {
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
