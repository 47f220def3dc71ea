package com.flagship.interunit_recon.matching.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JaccardSimilarityTest {

    @Test
    @DisplayName("Similarity is symmetric and bounded")
    void testSymmetricAndBounded() {
        String a = "Salary of John Doe for March 2024";
        String b = "March 2024 payroll John Doe staff";

        double forward = JaccardSimilarity.similarity(a, b);
        double backward = JaccardSimilarity.similarity(b, a);

        assertEquals(forward, backward);
        assertTrue(forward >= 0.0 && forward <= 1.0);
        assertEquals(4.0 / 7.0, forward, 1e-9);
        assertEquals(0.571, JaccardSimilarity.rounded(forward));
    }

    @Test
    @DisplayName("A narration is fully similar to itself")
    void testSelfSimilarity() {
        assertEquals(1.0, JaccardSimilarity.similarity("Interunit fund transfer", "Interunit fund transfer"));
    }

    @Test
    @DisplayName("Words in any script are tokens")
    void testNonLatinNarrations() {
        String bengali = "বেতন প্রদান মার্চ";

        assertEquals(Set.of("বেতন", "প্রদান", "মার্চ"), JaccardSimilarity.tokens(bengali));
        assertEquals(1.0, JaccardSimilarity.similarity(bengali, bengali));
        assertEquals(Set.of("müller", "gehalt"), JaccardSimilarity.tokens("Müller Gehalt"));
    }

    @Test
    @DisplayName("Short words and stop words are ignored")
    void testTokens() {
        assertEquals(Set.of("payment", "office"), JaccardSimilarity.tokens("The payment to an office of XY"));
        assertEquals(0.0, JaccardSimilarity.similarity("to of an", "to of an"));
    }

    @Test
    @DisplayName("Missing or disjoint narrations score zero")
    void testZero() {
        assertEquals(0.0, JaccardSimilarity.similarity(null, "payment"));
        assertEquals(0.0, JaccardSimilarity.similarity("  ", "payment"));
        assertEquals(0.0, JaccardSimilarity.similarity("ref A123 misc payment xyz", "unrelated ref B999"));
    }
}
