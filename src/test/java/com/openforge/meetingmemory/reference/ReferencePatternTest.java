package com.openforge.meetingmemory.reference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReferencePatternTest {

    @ParameterizedTest
    @CsvSource({
            "'Let''s go back to the original design',       design,   ARTIFACT",
            "'The revised deck is in the folder',           deck,     ARTIFACT",
            "'Is that schema we discussed still valid?',    schema,   TEMPORAL",
            "'Use the numbers from last time',              numbers,  TEMPORAL",
            "'As in our last planning meeting',             planning, TEMPORAL",
            "'Keep our caching approach',                   caching,  DECISION",
            "'Remind me what we decided on the vendor',     vendor,   DECISION",
            "'The hiring decision stands',                  hiring,   DECISION",
            "'As Priya mentioned, latency matters',         priya,    PERSON",
            "'Bob''s proposal covers it',                   bob,      PERSON"
    })
    void detectsEachPhrasing(String content, String keyword, ReferenceType type) {
        List<ImplicitReference> found = ReferencePattern.detect(content);

        assertThat(found).anySatisfy(ref -> {
            assertThat(ref.keyword()).isEqualTo(keyword);
            assertThat(ref.type()).isEqualTo(type);
            assertThat(ref.contextWindow()).isEqualTo(content);
        });
    }

    @Test
    void pronounsAndFillerWordsAreNotKeywords() {
        assertThat(ReferencePattern.detect("As I said, the first one was fine")).isEmpty();
    }

    @Test
    void repeatedPhraseIsReportedOnce() {
        List<ImplicitReference> found =
                ReferencePattern.detect("The original design, yes, the original design.");

        assertThat(found).hasSize(1);
        assertThat(found.get(0).text()).isEqualTo("The original design");
    }

    @Test
    void blankContentHasNoReferences() {
        assertThat(ReferencePattern.detect("   ")).isEmpty();
        assertThat(ReferencePattern.detect(null)).isEmpty();
    }
}
