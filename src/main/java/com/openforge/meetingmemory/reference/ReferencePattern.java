package com.openforge.meetingmemory.reference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The fixed vocabulary of implicit-reference phrasings. Group 1 of every
 * pattern captures the keyword used to look up candidates.
 */
public enum ReferencePattern {

    ORIGINAL       ("\\bthe original (\\w+)",                                   ReferenceType.ARTIFACT),
    PREVIOUS       ("\\bthe (?:previous|earlier|old|prior|first) (\\w+)",      ReferenceType.ARTIFACT),
    REVISED        ("\\bthe (?:updated|revised|latest|new) (\\w+)",            ReferenceType.ARTIFACT),
    DISCUSSED      ("\\bthat (\\w+) we discussed",                              ReferenceType.TEMPORAL),
    FROM_LAST_TIME ("\\bthe (\\w+) from last time",                             ReferenceType.TEMPORAL),
    LAST_MEETING   ("\\b(?:the|our) (?:last|previous) (\\w+) (?:meeting|session|sync)", ReferenceType.TEMPORAL),
    OUR_APPROACH   ("\\bour (\\w+) approach",                                   ReferenceType.DECISION),
    DECIDED_ON     ("\\bwhat we (?:decided|agreed) (?:on|about) (?:the )?(\\w+)", ReferenceType.DECISION),
    NAMED_DECISION ("\\bthe (\\w+) decision",                                   ReferenceType.DECISION),
    AS_SAID_BY     ("\\bas (\\w+) (?:mentioned|said|suggested)",                ReferenceType.PERSON),
    PERSONS_IDEA   ("\\b(\\w+)'s (?:point|idea|suggestion|proposal)",          ReferenceType.PERSON);

    /** Captures that carry no meaning on their own. */
    private static final Set<String> EMPTY_KEYWORDS = Set.of(
            "i", "we", "you", "he", "she", "they", "it", "this", "that",
            "the", "a", "an", "one", "same", "other", "whole");

    private final Pattern       pattern;
    private final ReferenceType type;

    ReferencePattern(String regex, ReferenceType type) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.type    = type;
    }

    public ReferenceType type() {
        return type;
    }

    /**
     * Every implicit reference in {@code content}, in pattern order then position.
     * The same phrase matched twice for the same type is reported once.
     */
    public static List<ImplicitReference> detect(String content) {
        if (content == null || content.isBlank()) return List.of();
        Map<String, ImplicitReference> found = new LinkedHashMap<>();
        for (ReferencePattern p : values()) {
            Matcher m = p.pattern.matcher(content);
            while (m.find()) {
                String keyword = m.group(1).toLowerCase(Locale.ROOT);
                if (EMPTY_KEYWORDS.contains(keyword)) continue;
                String text = m.group();
                found.putIfAbsent(p.type + "|" + text.toLowerCase(Locale.ROOT),
                        new ImplicitReference(text, keyword, p.type, content));
            }
        }
        return new ArrayList<>(found.values());
    }
}
