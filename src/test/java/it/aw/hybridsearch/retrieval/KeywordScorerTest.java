package it.aw.hybridsearch.retrieval;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KeywordScorerTest {

    private final KeywordScorer scorer = new KeywordScorer();

    @Test
    void queryTermsDropStopWordsAndShortWords() {
        List<String> terms = KeywordScorer.queryTerms("The cloud security and compliance of an IT system",
                List.of("FedRAMP High", "cloud"));

        assertThat(terms).containsExactly("cloud", "security", "compliance", "system", "fedramp high");
    }

    @Test
    void bm25ScoreIsNormalisedAndReportsMatchedTerms() {
        List<String> tokens = KeywordScorer.tokenize("Cloud security compliance requirements for the hosting platform.");
        List<String> terms = List.of("cloud", "security", "compliance");

        KeywordScorer.Match match = scorer.bm25(tokens, List.of(), terms, tokens.size(), 1.5);

        // tf = 1 e lunghezza media: ogni termine vale 1.0 × boost × peso di lunghezza
        double expected = 1.5 * (0.5 + 0.8 + 1.0) / (3 * 1.5 * 2.0 * (KeywordScorer.K1 + 1));
        assertThat(match.score()).isCloseTo(expected, within(1e-9));
        assertThat(match.matchedTerms()).containsExactlyInAnyOrder("cloud", "security", "compliance");
    }

    @Test
    void chunkWithoutQueryTermsScoresZero() {
        List<String> tokens = KeywordScorer.tokenize("Delivery schedule and invoicing terms.");

        KeywordScorer.Match match = scorer.bm25(tokens, List.of(), List.of("cloud"), 5, 1.5);

        assertThat(match.score()).isZero();
        assertThat(match.matchedTerms()).isEmpty();
    }

    @Test
    void exactMatchesScoreHigherThanPrefixMatches() {
        List<String> exact = KeywordScorer.tokenize("cloud hosting");
        List<String> prefix = KeywordScorer.tokenize("clouds hosting");

        double exactScore = scorer.bm25(exact, List.of(), List.of("cloud"), 2, 1.5).score();
        double prefixScore = scorer.bm25(prefix, List.of(), List.of("cloud"), 2, 1.5).score();

        assertThat(prefixScore).isGreaterThan(0);
        assertThat(exactScore).isGreaterThan(prefixScore);
    }

    @Test
    void extractedKeywordsGrantTheBoostToPrefixMatches() {
        List<String> tokens = KeywordScorer.tokenize("clouds hosting");

        double plain = scorer.bm25(tokens, List.of(), List.of("cloud"), 2, 1.5).score();
        double boosted = scorer.bm25(tokens, List.of("cloud"), List.of("cloud"), 2, 1.5).score();

        assertThat(boosted).isCloseTo(plain * 1.5, within(1e-9));
    }

    @Test
    void phrasesMatchOnlyAsExactSequences() {
        List<String> tokens = KeywordScorer.tokenize("The contracting officer signs. An officer for contracting.");

        KeywordScorer.Match match = scorer.bm25(tokens, List.of(), List.of("contracting officer"), tokens.size(), 1.0);

        assertThat(match.matchedTerms()).containsExactly("contracting officer");
        assertThat(scorer.bm25(tokens, List.of(), List.of("officer contracting"), tokens.size(), 1.0).score())
                .isZero();
    }

    @Test
    void simpleScoringCapsTermFrequency() {
        List<String> three = KeywordScorer.tokenize("security security security");
        List<String> six = KeywordScorer.tokenize("security security security security security security");

        double a = scorer.simple(three, List.of(), List.of("security"), 1.5).score();
        double b = scorer.simple(six, List.of(), List.of("security"), 1.5).score();

        assertThat(a).isEqualTo(b);
        assertThat(a).isCloseTo(1.5 * 1.0 / (1.5 * 1.5), within(1e-9));
    }
}
