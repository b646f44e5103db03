package com.newsdigest.backend.cluster;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF vectors over short texts: lowercased word tokens of at least two characters, raw term
 * counts, smoothed idf {@code ln((1 + n) / (1 + df)) + 1} and L2-normalized rows.
 */
public class TfIdfVectorizer {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    public List<Map<String, Double>> fitTransform(List<String> documents) {
        List<Map<String, Integer>> counts = new ArrayList<>(documents.size());
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String document : documents) {
            Map<String, Integer> termCounts = new HashMap<>();
            for (String token : tokenize(document)) {
                termCounts.merge(token, 1, Integer::sum);
            }
            termCounts.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
            counts.add(termCounts);
        }

        int n = documents.size();
        List<Map<String, Double>> vectors = new ArrayList<>(n);
        for (Map<String, Integer> termCounts : counts) {
            Map<String, Double> vector = new HashMap<>();
            double norm = 0.0;
            for (Map.Entry<String, Integer> term : termCounts.entrySet()) {
                double idf = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term.getKey()))) + 1.0;
                double weight = term.getValue() * idf;
                vector.put(term.getKey(), weight);
                norm += weight * weight;
            }
            if (norm > 0) {
                double length = Math.sqrt(norm);
                vector.replaceAll((term, weight) -> weight / length);
            }
            vectors.add(vector);
        }
        return vectors;
    }

    /**
     * Cosine similarity of two L2-normalized vectors; zero when either is empty
     */
    public static double cosine(Map<String, Double> a, Map<String, Double> b) {
        Map<String, Double> smaller = a.size() <= b.size() ? a : b;
        Map<String, Double> larger = smaller == a ? b : a;
        double dot = 0.0;
        for (Map.Entry<String, Double> term : smaller.entrySet()) {
            Double other = larger.get(term.getKey());
            if (other != null) {
                dot += term.getValue() * other;
            }
        }
        return dot;
    }

    List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
