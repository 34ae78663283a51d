package com.openforge.meetingmemory.query;

import com.openforge.meetingmemory.chunk.MemoryType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classification of a natural-language query: intent, time scope, and the
 * names it mentions. Drives what the retrieval collaborator is asked for.
 */
public record QueryPlan(
        String          originalQuery,
        QueryType       queryType,
        TemporalScope   temporalScope,
        List<String>    entities,
        Set<MemoryType> requiredContextTypes
) {

    private static final Pattern CAPITALIZED = Pattern.compile("\\b[A-Z][A-Za-z0-9]+\\b");
    private static final Set<String> NOT_ENTITIES = Set.of(
            "I", "What", "Why", "When", "Who", "How", "Where", "Which", "Did", "Do", "Does",
            "Is", "Are", "Was", "Were", "Can", "Should", "The", "A", "An", "Our", "We");

    public QueryPlan {
        entities             = entities == null ? List.of() : List.copyOf(entities);
        requiredContextTypes = requiredContextTypes == null ? Set.of() : Set.copyOf(requiredContextTypes);
    }

    public static QueryPlan from(String query) {
        QueryType type = QueryType.classify(query);
        return new QueryPlan(query, type, TemporalScope.detect(query), entitiesOf(query), type.requiredContextTypes());
    }

    static List<String> entitiesOf(String query) {
        List<String> entities = new ArrayList<>();
        if (query == null) return entities;
        Matcher m = CAPITALIZED.matcher(query);
        while (m.find()) {
            String word = m.group();
            if (!NOT_ENTITIES.contains(word) && !entities.contains(word)) entities.add(word);
        }
        return entities;
    }
}
