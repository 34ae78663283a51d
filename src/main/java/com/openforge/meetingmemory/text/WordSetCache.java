package com.openforge.meetingmemory.text;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-call memo of tokenized texts.
 *
 * Owned by whoever builds an index for one enrichment call and dropped with it;
 * never shared across calls or threads.
 */
public class WordSetCache {

    private final Map<String, Set<String>> cache = new HashMap<>();

    public Set<String> words(String text) {
        return cache.computeIfAbsent(text == null ? "" : text,
                t -> Collections.unmodifiableSet(WordSets.words(t)));
    }

    public double jaccard(String a, String b) {
        return WordSets.jaccard(words(a), words(b));
    }

    public int size() {
        return cache.size();
    }
}
