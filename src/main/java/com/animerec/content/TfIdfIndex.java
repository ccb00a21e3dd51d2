package com.animerec.content;

import com.animerec.store.AnimeCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * TF-IDF vectors for every catalog item (positions follow {@link AnimeCatalog} order) plus an inverted
 * term index used to score one item against the whole catalog without materializing a pairwise matrix.
 * idf = ln((1 + n) / (1 + df)) + 1.
 */
public final class TfIdfIndex {
    private static final Logger log = LoggerFactory.getLogger(TfIdfIndex.class);

    private final String[] vocabulary;
    private final TermVector[] vectors;
    private final double[] squaredNorms;
    private final int[][] postingDocs;
    private final double[][] postingWeights;

    private TfIdfIndex(String[] vocabulary, TermVector[] vectors, int[][] postingDocs, double[][] postingWeights) {
        this.vocabulary = vocabulary;
        this.vectors = vectors;
        this.postingDocs = postingDocs;
        this.postingWeights = postingWeights;
        this.squaredNorms = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            squaredNorms[i] = vectors[i].squaredNorm();
        }
    }

    public static TfIdfIndex build(AnimeCatalog catalog, int maxFeatures) {
        int n = catalog.size();
        List<Map<String, Integer>> termCounts = new ArrayList<>(n);
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (int i = 0; i < n; i++) {
            Map<String, Integer> counts = new HashMap<>();
            for (String token : TextFeatures.tokenize(TextFeatures.document(catalog.at(i)))) {
                counts.merge(token, 1, Integer::sum);
            }
            counts.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
            termCounts.add(counts);
        }

        String[] vocabulary = selectVocabulary(documentFrequency, maxFeatures);
        Map<String, Integer> termIds = new HashMap<>(vocabulary.length * 2);
        for (int t = 0; t < vocabulary.length; t++) termIds.put(vocabulary[t], t);

        double[] idf = new double[vocabulary.length];
        for (int t = 0; t < vocabulary.length; t++) {
            idf[t] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(vocabulary[t]))) + 1.0;
        }

        TermVector[] vectors = new TermVector[n];
        int[] postingSizes = new int[vocabulary.length];
        for (int i = 0; i < n; i++) {
            TreeMap<Integer, Double> weights = new TreeMap<>();
            termCounts.get(i).forEach((term, count) -> {
                Integer id = termIds.get(term);
                if (id != null) weights.put(id, count * idf[id]);
            });
            int[] terms = weights.keySet().stream().mapToInt(Integer::intValue).toArray();
            double[] values = weights.values().stream().mapToDouble(Double::doubleValue).toArray();
            vectors[i] = new TermVector(terms, values);
            for (int term : terms) postingSizes[term]++;
        }

        int[][] postingDocs = new int[vocabulary.length][];
        double[][] postingWeights = new double[vocabulary.length][];
        for (int t = 0; t < vocabulary.length; t++) {
            postingDocs[t] = new int[postingSizes[t]];
            postingWeights[t] = new double[postingSizes[t]];
        }
        int[] fill = new int[vocabulary.length];
        for (int i = 0; i < n; i++) {
            TermVector v = vectors[i];
            for (int k = 0; k < v.terms().length; k++) {
                int term = v.terms()[k];
                postingDocs[term][fill[term]] = i;
                postingWeights[term][fill[term]] = v.weights()[k];
                fill[term]++;
            }
        }

        log.info("Built TF-IDF index: {} documents, {} terms (max-features={})", n, vocabulary.length, maxFeatures);
        return new TfIdfIndex(vocabulary, vectors, postingDocs, postingWeights);
    }

    private static String[] selectVocabulary(Map<String, Integer> documentFrequency, int maxFeatures) {
        if (maxFeatures <= 0 || documentFrequency.size() <= maxFeatures) {
            return documentFrequency.keySet().stream().sorted().toArray(String[]::new);
        }
        return documentFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(maxFeatures)
                .map(Map.Entry::getKey)
                .sorted()
                .toArray(String[]::new);
    }

    public int documentCount() {
        return vectors.length;
    }

    public int vocabularySize() {
        return vocabulary.length;
    }

    public TermVector vector(int position) {
        return vectors[position];
    }

    public double similarity(int positionA, int positionB) {
        if (positionA == positionB) return 1.0;
        return cosine(vectors[positionA], vectors[positionB]);
    }

    /**
     * Similarity of one item to every catalog position. The item itself scores exactly 1.0.
     */
    public double[] similarities(int position) {
        double[] dots = new double[vectors.length];
        TermVector seed = vectors[position];
        for (int k = 0; k < seed.terms().length; k++) {
            int term = seed.terms()[k];
            double w = seed.weights()[k];
            int[] docs = postingDocs[term];
            double[] weights = postingWeights[term];
            for (int p = 0; p < docs.length; p++) {
                dots[docs[p]] += w * weights[p];
            }
        }
        double seedNorm = squaredNorms[position];
        for (int j = 0; j < dots.length; j++) {
            if (dots[j] == 0.0) continue;
            dots[j] = Math.min(1.0, dots[j] / Math.sqrt(seedNorm * squaredNorms[j]));
        }
        dots[position] = 1.0;
        return dots;
    }

    public static double cosine(TermVector a, TermVector b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        double dot = 0.0;
        int i = 0;
        int j = 0;
        while (i < a.terms().length && j < b.terms().length) {
            if (a.terms()[i] == b.terms()[j]) {
                dot += a.weights()[i] * b.weights()[j];
                i++;
                j++;
            } else if (a.terms()[i] < b.terms()[j]) {
                i++;
            } else {
                j++;
            }
        }
        if (dot == 0.0) return 0.0;
        return Math.min(1.0, dot / Math.sqrt(a.squaredNorm() * b.squaredNorm()));
    }

    public record TermVector(int[] terms, double[] weights) {
        public double squaredNorm() {
            double sum = 0.0;
            for (double w : weights) sum += w * w;
            return sum;
        }

        public boolean isEmpty() {
            return terms.length == 0;
        }
    }
}
