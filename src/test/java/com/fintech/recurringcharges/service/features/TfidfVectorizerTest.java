package com.fintech.recurringcharges.service.features;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TfidfVectorizerTest {

    @Test
    @DisplayName("Analyzer lowercases, strips accents and emits unigrams and bigrams")
    void analyze() {
        assertThat(TfidfVectorizer.analyze("Café NETFLIX 42 x"))
                .containsExactly("cafe", "netflix", "cafe netflix");
        assertThat(TfidfVectorizer.analyze(null)).isEmpty();
    }

    @Test
    @DisplayName("Rows are L2-normalized and padded to the requested width")
    void transformNormalizesRows() {
        List<String> docs = List.of("netflix subscription", "spotify premium", "netflix premium");
        TfidfVectorizer vectorizer = TfidfVectorizer.fit(docs, 49, 0.95);

        double[][] rows = vectorizer.transform(docs);

        assertThat(vectorizer.getWidth()).isEqualTo(49);
        for (double[] row : rows) {
            assertThat(row).hasSize(49);
            double norm = Math.sqrt(Arrays.stream(row).map(v -> v * v).sum());
            assertThat(norm).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Terms present in nearly every document are dropped")
    void maxDocumentFrequency() {
        List<String> docs = List.of("acme netflix", "acme spotify", "acme hulu");

        TfidfVectorizer vectorizer = TfidfVectorizer.fit(docs, 49, 0.95);

        assertThat(vectorizer.getVocabulary()).doesNotContain("acme").contains("netflix", "spotify", "hulu");
    }

    @Test
    @DisplayName("Identical descriptions leave an empty vocabulary and zero vectors")
    void emptyVocabulary() {
        List<String> docs = List.of("NETFLIX.COM", "NETFLIX.COM", "NETFLIX.COM");

        TfidfVectorizer vectorizer = TfidfVectorizer.fit(docs, 49, 0.95);

        assertThat(vectorizer.isEmpty()).isTrue();
        assertThat(vectorizer.transform(docs)[0]).containsOnly(0.0);
    }

    @Test
    @DisplayName("Vocabulary is capped at the most frequent terms")
    void maxFeaturesCap() {
        List<String> docs = List.of("alpha beta", "alpha gamma", "delta epsilon", "zeta eta");

        TfidfVectorizer vectorizer = TfidfVectorizer.fit(docs, 2, 1.0);

        assertThat(vectorizer.getVocabulary()).hasSize(2).contains("alpha");
    }
}
