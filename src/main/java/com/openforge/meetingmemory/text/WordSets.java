package com.openforge.meetingmemory.text;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-set tokenization and Jaccard overlap, the lexical measure used by
 * reference resolution, topic linking and drift detection.
 */
public final class WordSets {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private WordSets() {
    }

    /** Lower-cased alphanumeric tokens of {@code text}, in first-seen order. */
    public static Set<String> words(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return words;
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    /** |a ∩ b| / |a ∪ b|; two empty sets overlap by 0. */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        int union = a.size() + b.size() - intersection.size();
        return union == 0 ? 0.0 : (double) intersection.size() / union;
    }
}
