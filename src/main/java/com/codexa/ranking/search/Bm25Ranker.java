package com.codexa.ranking.search;

import com.codexa.ranking.search.SearchModels.Bm25Config;
import com.codexa.ranking.search.SearchModels.Bm25Document;
import com.codexa.ranking.search.SearchModels.ScoredDocument;
import com.codexa.ranking.text.Tokenizer;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class Bm25Ranker {

    public List<ScoredDocument> rank(String query, List<Bm25Document> documents) {
        return rank(query, documents, Bm25Config.defaults());
    }

    public List<ScoredDocument> rank(String query, List<Bm25Document> documents, Bm25Config config) {
        List<Bm25Document> docs = documents == null ? List.of() : documents;
        if (query == null || query.isBlank() || docs.isEmpty()) {
            return docs.stream().map(d -> new ScoredDocument(d, 0.0)).toList();
        }

        Map<String, Set<String>> index = buildInvertedIndex(docs);
        double avgDocLength = averageDocumentLength(docs);
        List<String> queryTerms = Tokenizer.tokenize(query);

        List<ScoredDocument> scored = new ArrayList<>(docs.size());
        for (Bm25Document doc : docs) {
            double score = score(queryTerms, doc, docs.size(), index, avgDocLength, config);
            if (score > 0) {
                scored.add(new ScoredDocument(doc, score));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredDocument::score).reversed());
        return scored;
    }

    public Map<String, Set<String>> buildInvertedIndex(List<Bm25Document> documents) {
        Map<String, Set<String>> index = new HashMap<>();
        for (Bm25Document doc : documents) {
            for (String term : new HashSet<>(Tokenizer.tokenize(doc.text()))) {
                if (Tokenizer.isStopWord(term)) continue;
                index.computeIfAbsent(term, t -> new HashSet<>()).add(doc.id());
            }
        }
        return index;
    }

    public double averageDocumentLength(List<Bm25Document> documents) {
        if (documents.isEmpty()) return 0.0;
        long total = documents.stream().mapToLong(d -> Tokenizer.tokenize(d.text()).size()).sum();
        return (double) total / documents.size();
    }

    /** {@code ln((N - n + 0.5) / (n + 0.5))}; 0 for a term that no document contains. */
    public double inverseDocumentFrequency(String term, int totalDocuments, Map<String, Set<String>> index) {
        Set<String> postings = index.get(term);
        int n = postings == null ? 0 : postings.size();
        if (n == 0) return 0.0;
        return Math.log((totalDocuments - n + 0.5) / (n + 0.5));
    }

    double score(List<String> queryTerms, Bm25Document doc, int totalDocuments,
                 Map<String, Set<String>> index, double avgDocLength, Bm25Config config) {
        if (avgDocLength <= 0) return 0.0;

        List<String> docTokens = Tokenizer.tokenize(doc.text());
        int docLength = docTokens.size();
        double lengthNorm = 1 - config.b() + config.b() * (docLength / avgDocLength);

        double score = 0.0;
        for (String term : queryTerms) {
            if (Tokenizer.isStopWord(term)) continue;

            double idf = inverseDocumentFrequency(term, totalDocuments, index);
            if (idf <= 0) continue;

            int tf = Collections.frequency(docTokens, term);
            if (tf == 0) continue;
            double termScore = idf * (tf * (config.k1() + 1)) / (tf + config.k1() * lengthNorm);
            score += termScore * fieldBoost(term, doc, config);
        }
        return score;
    }

    double fieldBoost(String term, Bm25Document doc, Bm25Config config) {
        if (containsIgnoreCase(doc.title(), term)) return config.titleBoost();
        if (containsIgnoreCase(doc.subtitle(), term)) return config.subtitleBoost();
        if (doc.tags().stream().anyMatch(tag -> containsIgnoreCase(tag, term))) return config.tagBoost();
        return 1.0;
    }

    private boolean containsIgnoreCase(String field, String term) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(term);
    }
}
