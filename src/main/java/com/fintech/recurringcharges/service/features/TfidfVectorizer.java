package com.fintech.recurringcharges.service.features;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * TF-IDF vectorizer over unigrams and bigrams of lowercase alphabetic tokens.
 * <p>
 * A vectorizer is fitted on one batch of documents and is immutable afterwards. Its
 * vocabulary is batch-local: vectors from two independently fitted vectorizers are not
 * comparable. Callers that need stable description features across runs must keep the
 * fitted instance and pass it back into extraction.
 * <p>
 * Fitting rules:
 * <ul>
 *   <li>tokens match {@code \b[a-z]{2,}\b} after accent stripping and lowercasing</li>
 *   <li>terms present in more than {@code maxDocumentFrequency} of the documents are dropped</li>
 *   <li>the {@code maxFeatures} most frequent remaining terms are kept, ties broken alphabetically</li>
 *   <li>columns are ordered alphabetically by term</li>
 *   <li>idf is smoothed: {@code ln((1 + n) / (1 + df)) + 1}; rows are L2-normalized</li>
 * </ul>
 */
public final class TfidfVectorizer {

    private static final Pattern TOKEN = Pattern.compile("\\b[a-z]{2,}\\b");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final int width;
    private final Map<String, Integer> vocabulary;
    private final double[] idf;

    private TfidfVectorizer(int width, Map<String, Integer> vocabulary, double[] idf) {
        this.width = width;
        this.vocabulary = vocabulary;
        this.idf = idf;
    }

    /**
     * Fits a vectorizer. Never fails: a corpus with no surviving terms yields an empty vocabulary.
     *
     * @param documents            raw descriptions; nulls are treated as empty
     * @param maxFeatures          output width and vocabulary cap
     * @param maxDocumentFrequency fraction of documents above which a term is ignored
     */
    public static TfidfVectorizer fit(List<String> documents, int maxFeatures, double maxDocumentFrequency) {
        int n = documents.size();
        Map<String, Integer> documentFrequency = new HashMap<>();
        Map<String, Integer> termFrequency = new HashMap<>();

        for (String document : documents) {
            List<String> terms = analyze(document);
            for (String term : terms) {
                termFrequency.merge(term, 1, Integer::sum);
            }
            for (String term : new HashSet<>(terms)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        double maxDocCount = maxDocumentFrequency * n;
        List<String> kept = termFrequency.keySet().stream()
                .filter(term -> documentFrequency.get(term) <= maxDocCount)
                .sorted(Comparator.comparing((String term) -> -termFrequency.get(term))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(maxFeatures)
                .sorted()
                .collect(Collectors.toList());

        Map<String, Integer> vocabulary = new LinkedHashMap<>();
        double[] idf = new double[kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            String term = kept.get(i);
            vocabulary.put(term, i);
            idf[i] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term))) + 1.0;
        }
        return new TfidfVectorizer(maxFeatures, Collections.unmodifiableMap(vocabulary), idf);
    }

    /**
     * Projects documents onto the fitted vocabulary. Every row has {@link #getWidth()} columns;
     * columns past the vocabulary size are zero.
     */
    public double[][] transform(List<String> documents) {
        double[][] rows = new double[documents.size()][width];
        for (int r = 0; r < documents.size(); r++) {
            double[] row = rows[r];
            for (String term : analyze(documents.get(r))) {
                Integer column = vocabulary.get(term);
                if (column != null) {
                    row[column] += 1.0;
                }
            }
            double norm = 0.0;
            for (int c = 0; c < idf.length; c++) {
                row[c] *= idf[c];
                norm += row[c] * row[c];
            }
            if (norm > 0) {
                norm = Math.sqrt(norm);
                for (int c = 0; c < idf.length; c++) {
                    row[c] /= norm;
                }
            }
        }
        return rows;
    }

    public boolean isEmpty() {
        return vocabulary.isEmpty();
    }

    public int getWidth() {
        return width;
    }

    /**
     * Terms in column order.
     */
    public List<String> getVocabulary() {
        return new ArrayList<>(new TreeMap<>(vocabulary).keySet());
    }

    static List<String> analyze(String document) {
        if (document == null || document.isEmpty()) {
            return Collections.emptyList();
        }
        String normalized = COMBINING_MARKS.matcher(Normalizer.normalize(document, Normalizer.Form.NFKD))
                .replaceAll("")
                .toLowerCase(Locale.ROOT);

        List<String> unigrams = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(normalized);
        while (matcher.find()) {
            unigrams.add(matcher.group());
        }

        List<String> terms = new ArrayList<>(unigrams);
        for (int i = 0; i + 1 < unigrams.size(); i++) {
            terms.add(unigrams.get(i) + " " + unigrams.get(i + 1));
        }
        return terms;
    }
}
