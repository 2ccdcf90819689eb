package com.phillippitts.ambient.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityTest {

    @Test
    void shouldCountAdjacentTranspositionAsSingleEdit() {
        assertThat(TextSimilarity.editDistance("opne", "open")).isEqualTo(1);
        assertThat(TextSimilarity.editDistance("serach", "search")).isEqualTo(1);
    }

    @Test
    void shouldCountInsertDeleteAndSubstitute() {
        assertThat(TextSimilarity.editDistance("chrme", "chrome")).isEqualTo(1);
        assertThat(TextSimilarity.editDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(TextSimilarity.editDistance("", "abc")).isEqualTo(3);
        assertThat(TextSimilarity.editDistance(null, null)).isZero();
    }

    @Test
    void shouldNormaliseSimilarityByLongerString() {
        assertThat(TextSimilarity.similarity("chrme", "chrome")).isCloseTo(5.0 / 6.0, within(1e-9));
        assertThat(TextSimilarity.similarity("open", "open")).isEqualTo(1.0);
        assertThat(TextSimilarity.similarity("", "")).isEqualTo(1.0);
        assertThat(TextSimilarity.similarity("abc", "xyz")).isZero();
    }

    @Test
    void shouldComputeJaccardOverWordSets() {
        assertThat(TextSimilarity.jaccard("the quick fox", "the QUICK fox")).isEqualTo(1.0);
        assertThat(TextSimilarity.jaccard("a b c d", "a b x y")).isCloseTo(2.0 / 6.0, within(1e-9));
        assertThat(TextSimilarity.jaccard("", "  ")).isEqualTo(1.0);
        assertThat(TextSimilarity.jaccard("hello", "")).isZero();
    }
}
