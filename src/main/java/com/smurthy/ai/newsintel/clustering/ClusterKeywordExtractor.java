package com.smurthy.ai.newsintel.clustering;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives a short human-readable label for a topic from its member texts.
 */
public class ClusterKeywordExtractor {

    public static final int DEFAULT_KEYWORD_COUNT = 3;

    private static final String EDGE_PUNCTUATION = ".,!?:;\"'()-";

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "in", "on", "at", "to", "for", "of", "and", "or", "is", "are",
            "was", "were", "be", "been", "being", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "must", "shall", "can",
            "this", "that", "these", "those", "it", "its", "with", "as", "by", "from",
            "about", "into", "through", "during", "before", "after", "above", "below",
            "up", "down", "out", "off", "over", "under", "again", "further", "then", "once",
            "here", "there", "when", "where", "why", "how", "all", "each", "few", "more",
            "most", "other", "some", "such", "no", "nor", "not", "only", "own", "same",
            "so", "than", "too", "very", "just", "but", "if", "while", "says", "said",
            "new", "news");

    private final int keywordCount;

    public ClusterKeywordExtractor() {
        this(DEFAULT_KEYWORD_COUNT);
    }

    public ClusterKeywordExtractor(int keywordCount) {
        if (keywordCount < 1) {
            throw new IllegalArgumentException("keywordCount must be at least 1, got " + keywordCount);
        }
        this.keywordCount = keywordCount;
    }

    /**
     * Most frequent content words across the texts; ties keep first-occurrence order.
     */
    public List<String> extractKeywords(Collection<String> texts) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String text : texts) {
            if (text == null) {
                continue;
            }
            for (String raw : text.split("\\s+")) {
                String word = stripEdges(raw).toLowerCase(Locale.ROOT);
                if (word.length() > 2 && !STOP_WORDS.contains(word) && isAlphabetic(word)) {
                    counts.merge(word, 1, Integer::sum);
                }
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts stay in first-occurrence order
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        List<String> keywords = new ArrayList<>(keywordCount);
        for (int i = 0; i < Math.min(keywordCount, ranked.size()); i++) {
            keywords.add(ranked.get(i).getKey());
        }
        return keywords;
    }

    /**
     * Keywords title-cased and joined by spaces, or null when no keyword qualifies.
     */
    public String label(List<String> keywords) {
        if (keywords.isEmpty()) {
            return null;
        }
        List<String> words = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            words.add(Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1));
        }
        return String.join(" ", words);
    }

    private static String stripEdges(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_PUNCTUATION.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }

    private static boolean isAlphabetic(String word) {
        return word.codePoints().allMatch(Character::isLetter);
    }
}
