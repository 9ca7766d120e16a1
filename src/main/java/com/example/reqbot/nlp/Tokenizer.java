package com.example.reqbot.nlp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-boundary tokenizer shared by segmentation, keyword matching and classification.
 * <p>
 * A token is a run of letters or digits, optionally joined by inner apostrophes or hyphens
 * ({@code don't}, {@code real-time}). Punctuation is never part of a token.
 */
public final class Tokenizer {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:['\\u2019\\-][\\p{L}\\p{N}]+)*");

    private Tokenizer() {}

    /** Lower-cased tokens of {@code text} in order. */
    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(m.group().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }

    /**
     * Index of the first occurrence of {@code phrase} in {@code tokens} as a whole token or consecutive
     * token sequence, or -1. The phrase is tokenized the same way as the text.
     */
    public static int indexOf(List<String> tokens, String phrase) {
        List<String> needle = tokenize(phrase);
        if (needle.isEmpty() || needle.size() > tokens.size()) return -1;
        outer:
        for (int i = 0; i <= tokens.size() - needle.size(); i++) {
            for (int j = 0; j < needle.size(); j++) {
                if (!tokens.get(i + j).equals(needle.get(j))) continue outer;
            }
            return i;
        }
        return -1;
    }

    public static boolean containsPhrase(List<String> tokens, String phrase) {
        return indexOf(tokens, phrase) >= 0;
    }

    /** True when any of {@code phrases} occurs in {@code tokens}. */
    public static boolean containsAny(List<String> tokens, Collection<String> phrases) {
        for (String phrase : phrases) {
            if (containsPhrase(tokens, phrase)) return true;
        }
        return false;
    }

    /** Purely numeric tokens such as {@code 3}, {@code 2024} or {@code 10-20}. */
    public static boolean isNumeric(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!Character.isDigit(c) && c != '-') return false;
        }
        return !token.isEmpty();
    }
}
