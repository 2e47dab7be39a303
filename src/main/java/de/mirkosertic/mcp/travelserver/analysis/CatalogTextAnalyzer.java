package de.mirkosertic.mcp.travelserver.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternReplaceCharFilter;

import java.io.Reader;
import java.util.regex.Pattern;

/**
 * Analyzer for destination names and descriptions feeding the reverse term index.
 *
 * <p>Token chain: {@code PatternReplaceCharFilter(strip non-alphanumerics) -> WhitespaceTokenizer
 * -> LowerCaseFilter -> LengthFilter(min 3)}</p>
 *
 * <p>Punctuation is deleted rather than replaced, so "sun-kissed" is indexed as "sunkissed".</p>
 */
public class CatalogTextAnalyzer extends Analyzer {

    /**
     * Tokens shorter than this are not indexed.
     */
    public static final int MIN_TOKEN_LENGTH = 3;

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9\\s]");

    @Override
    protected Reader initReader(final String fieldName, final Reader reader) {
        return new PatternReplaceCharFilter(NON_ALPHANUMERIC, "", reader);
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new WhitespaceTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new LengthFilter(stream, MIN_TOKEN_LENGTH, Integer.MAX_VALUE);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
