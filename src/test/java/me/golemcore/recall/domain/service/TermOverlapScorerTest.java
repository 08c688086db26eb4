package me.golemcore.recall.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TermOverlapScorerTest {

    private final TermOverlapScorer scorer = new TermOverlapScorer();

    @Test
    void twoWordPhraseMatchScoresSeventeen() {
        // 2 + 2 for the words, 1.5 * 2 for two distinct matches, 10 for the phrase
        assertEquals(17.0, scorer.score("boss rag", "BOSS RAG system is enterprise grade"), 1e-9);
    }

    @Test
    void countsEveryWordBoundaryOccurrence() {
        assertEquals(6.0, scorer.score("cache", "cache, cache and more cache"), 1e-9);
    }

    @Test
    void ignoresShortTokens() {
        assertEquals(0.0, scorer.score("is an", "this is not an example"), 1e-9);
    }

    @Test
    void doesNotMatchInsideWords() {
        assertEquals(0.0, scorer.score("rag", "fragment storage"), 1e-9);
    }

    @Test
    void treatsAccentedLettersAsPartOfWords() {
        assertEquals(2.0, scorer.score("café", "un café noir"), 1e-9);
        assertEquals(0.0, scorer.score("caf", "un café noir"), 1e-9);
        assertEquals(0.0, scorer.score("naï", "naïve approach"), 1e-9);
    }

    @Test
    void phraseBonusNeedsMultipleWords() {
        assertEquals(2.0, scorer.score("session", "one session"), 1e-9);
    }

    @Test
    void emptyContentScoresZero() {
        assertEquals(0.0, scorer.score("boss rag", ""), 1e-9);
        assertEquals(0.0, scorer.score("boss rag", null), 1e-9);
    }

    @Test
    void regexCharactersInQueryAreLiteral() {
        assertEquals(0.0, scorer.score("rag.*", "rag anything"), 1e-9);
    }
}
