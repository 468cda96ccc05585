package uk.gegc.quizbot.features.scoring.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import uk.gegc.quizbot.features.record.domain.model.OpenRecord;
import uk.gegc.quizbot.features.record.domain.model.TestRecord;
import uk.gegc.quizbot.features.scoring.application.PointsCalculator;

/**
 * Scores open answers by the cosine similarity of their embedding to the canonical answer's.
 * Test answers are still scored by exact match.
 */
@Slf4j
@RequiredArgsConstructor
public class EmbeddingSimilarityCalculator implements PointsCalculator {

    private final EmbeddingModel embeddingModel;

    @Override
    public double scoreTest(TestRecord record) {
        return SimpleCalculator.matchesCanonical(record) ? 1.0 : 0.0;
    }

    @Override
    public double scoreOpen(OpenRecord record) {
        String given = record.getPersonAnswer();
        String expected = record.getQuestion().getAnswer();
        if (given == null || given.isBlank() || expected == null || expected.isBlank()) {
            return 0.0;
        }
        float[] answerVector = embeddingModel.embed(given.trim());
        float[] canonicalVector = embeddingModel.embed(expected.trim());
        double similarity = cosine(answerVector, canonicalVector);
        log.debug("Open answer similarity for record {}: {}", record.getId(), similarity);
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
