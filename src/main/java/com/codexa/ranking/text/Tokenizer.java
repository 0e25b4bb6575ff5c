package com.codexa.ranking.text;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class Tokenizer {
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TOKEN_LENGTH = 3;

    public static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are", "were",
            "been", "be", "have", "has", "had", "do", "does", "did", "will", "would",
            "should", "could", "may", "might", "must", "can", "this", "that", "these", "those",
            "i", "you", "he", "she", "it", "we", "they", "what", "which", "who",
            "when", "where", "why", "how"
    );

    private Tokenizer() {}

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();
        String normalized = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return Arrays.stream(WHITESPACE.split(normalized))
                .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
                .toList();
    }

    public static boolean isStopWord(String term) {
        return STOP_WORDS.contains(term);
    }
}
