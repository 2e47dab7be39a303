package de.mirkosertic.mcp.travelserver.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs text through an {@link Analyzer} and collects the resulting terms.
 */
public final class TokenStreams {

    private static final String FIELD = "text";

    private TokenStreams() {
    }

    /**
     * Analyze the text and return its terms in order of appearance, duplicates included.
     */
    public static List<String> terms(final Analyzer analyzer, final String text) {
        final List<String> terms = new ArrayList<>();
        try (final TokenStream stream = analyzer.tokenStream(FIELD, text)) {
            final CharTermAttribute termAttr = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                terms.add(termAttr.toString());
            }
            stream.end();
        } catch (final IOException e) {
            // Only reachable through a failing Reader; analysis here always reads from a String
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return terms;
    }
}
