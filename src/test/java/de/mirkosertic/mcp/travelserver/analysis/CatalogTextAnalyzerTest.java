package de.mirkosertic.mcp.travelserver.analysis;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Token chain: {@code PatternReplaceCharFilter -> WhitespaceTokenizer -> LowerCaseFilter -> LengthFilter(3)}
 */
@DisplayName("CatalogTextAnalyzer")
class CatalogTextAnalyzerTest {

    private final CatalogTextAnalyzer analyzer = new CatalogTextAnalyzer();

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    @Test
    @DisplayName("Should lowercase and drop tokens of two characters or less")
    void lowercasesAndDropsShortTokens() {
        assertThat(TokenStreams.terms(analyzer, "Goa is a Beach on the Sea"))
                .containsExactly("goa", "beach", "the", "sea");
    }

    @Test
    @DisplayName("Punctuation should be removed, not split on")
    void punctuationIsRemoved() {
        assertThat(TokenStreams.terms(analyzer, "Sun-kissed beaches, shacks & sports!"))
                .containsExactly("sunkissed", "beaches", "shacks", "sports");
    }

    @Test
    @DisplayName("Duplicates should be kept in order of appearance")
    void duplicatesAreKept() {
        assertThat(TokenStreams.terms(analyzer, "beach beach Beach"))
                .containsExactly("beach", "beach", "beach");
    }

    @Test
    @DisplayName("Numbers of three digits or more are indexed")
    void numbersAreIndexed() {
        assertThat(TokenStreams.terms(analyzer, "Route 66 at 3500 m"))
                .containsExactly("route", "3500");
    }
}
