package com.familyconnections.domain.signal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameSimilarityTest {

    @Test
    void identicalIgnoringCase() {
        assertEquals(100.0, NameSimilarity.tokenSortRatio("Gregory", "GREGORY"));
    }

    @Test
    void tokenOrderIgnored() {
        assertEquals(100.0, NameSimilarity.tokenSortRatio("Smith-Jones", "Jones Smith"));
        assertEquals("JONES SMITH", NameSimilarity.sortedTokens("smith-jones"));
    }

    @Test
    void indelRatio() {
        // LCS("JOHNSON", "JOHNSTON") = 7
        assertEquals(200.0 * 7 / 15, NameSimilarity.tokenSortRatio("Johnson", "Johnston"), 1e-9);
        // LCS("SMITH", "SMYTH") = 4
        assertEquals(80.0, NameSimilarity.tokenSortRatio("Smith", "Smyth"), 1e-9);
    }

    @Test
    void symmetric() {
        assertEquals(NameSimilarity.tokenSortRatio("Gregory", "Gregson"),
            NameSimilarity.tokenSortRatio("Gregson", "Gregory"));
    }

    @Test
    void emptyOrNullIsZero() {
        assertEquals(0.0, NameSimilarity.tokenSortRatio("", "Smith"));
        assertEquals(0.0, NameSimilarity.tokenSortRatio(null, "Smith"));
        assertEquals(0.0, NameSimilarity.tokenSortRatio("--", "Smith"));
    }
}
