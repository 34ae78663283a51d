package com.openforge.meetingmemory.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.meetingmemory.chunk.MemoryType;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The fixed set of query intents. Rules are tried in declaration order; the
 * first match wins and anything unmatched is {@link #GENERAL}, so every query
 * gets a plan.
 */
public enum QueryType {

    PRE_MEETING(
            "\\bboard\\b|pre-meeting|\\bprepare for\\b|\\bbrief me\\b",
            Set.of(MemoryType.DECISION, MemoryType.COMMITMENT, MemoryType.RISK, MemoryType.QUESTION)),

    GAP_ANALYSIS(
            "\\bslides?\\b|\\bdeck\\b|\\bgaps?\\b|\\bmissing\\b",
            Set.of(MemoryType.TOPIC, MemoryType.QUESTION, MemoryType.TECHNICAL)),

    COMMITMENT_TRACKING(
            "\\bcommit|\\bpromis|\\bowes?\\b|\\baction items?\\b",
            Set.of(MemoryType.COMMITMENT, MemoryType.ACTION, MemoryType.REQUEST)),

    DECISION_ARCHAEOLOGY(
            "\\bwhy did\\b|\\bdecision|\\bdecid|\\bagreed\\b",
            Set.of(MemoryType.DECISION, MemoryType.REFERENCE, MemoryType.TECHNICAL)),

    CROSS_PROJECT(
            "\\bcross\\b|\\bcross-|affect my project|\\bimpact|\\bother teams?\\b",
            Set.of(MemoryType.DECISION, MemoryType.RISK, MemoryType.TECHNICAL)),

    STATUS_CHECK(
            "\\bstatus\\b|\\bblocked\\b|\\bprogress\\b|\\bwhere are we\\b",
            Set.of(MemoryType.ACTION, MemoryType.COMMITMENT, MemoryType.RISK, MemoryType.TEMPORAL)),

    GENERAL(null, Set.of());

    private final Pattern         rule;
    private final Set<MemoryType> requiredContextTypes;

    QueryType(String rule, Set<MemoryType> requiredContextTypes) {
        this.rule                 = rule == null ? null : Pattern.compile(rule, Pattern.CASE_INSENSITIVE);
        this.requiredContextTypes = requiredContextTypes;
    }

    public static QueryType classify(String query) {
        if (query == null || query.isBlank()) return GENERAL;
        String q = query.toLowerCase(Locale.ROOT);
        for (QueryType type : values()) {
            if (type.rule != null && type.rule.matcher(q).find()) return type;
        }
        return GENERAL;
    }

    /** Memory types the retrieval collaborator should favour; empty means no preference. */
    public Set<MemoryType> requiredContextTypes() {
        return requiredContextTypes;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
