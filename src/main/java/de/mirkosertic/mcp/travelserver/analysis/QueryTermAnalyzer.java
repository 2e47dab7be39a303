package de.mirkosertic.mcp.travelserver.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternReplaceCharFilter;

import java.io.Reader;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Analyzer turning a free-text travel query into search terms.
 *
 * <p>Token chain: {@code PatternReplaceCharFilter(punctuation to space) -> WhitespaceTokenizer
 * -> LowerCaseFilter -> StopFilter -> LengthFilter(min 3) -> NumeralFilter}</p>
 *
 * <p>The stop list removes filler words as well as every word already consumed by a structured
 * constraint (budget, duration and distance units, budget trigger words, months and seasons),
 * so that those words do not count a second time as free-text terms.</p>
 */
public class QueryTermAnalyzer extends Analyzer {

    public static final CharArraySet STOP_WORDS = new CharArraySet(List.of(
            // articles, pronouns, filler
            "a", "an", "the", "i", "me", "my", "we", "our", "us", "you", "your", "it", "its",
            "am", "is", "are", "was", "be", "have", "has", "had", "want", "wanna", "need", "like",
            "would", "looking", "look", "find", "show", "suggest", "recommend", "give",
            "go", "going", "visit", "trip", "travel", "place", "places", "spot", "spots", "destination",
            "destinations", "some", "something", "somewhere", "good", "best", "nice", "please",
            "and", "or", "but", "with", "for", "from", "to", "in", "on", "at", "of", "by", "about",
            "near", "around", "during", "this", "that", "there", "where", "what", "which", "can",
            "mood", "vibe", "type", "kind",
            // budget units and triggers
            "budget", "rupees", "rupee", "rs", "inr", "money", "cost", "price", "upto", "up",
            "under", "below", "max", "maximum", "between", "cheap", "affordable", "afford",
            "friendly", "low",
            // duration and distance units
            "day", "days", "night", "nights", "week", "weeks", "wks", "duration", "km", "kms",
            "kilometer", "kilometers", "kilometre", "kilometres", "within", "distance", "far",
            // months and seasons
            "january", "february", "march", "april", "may", "june", "july", "august",
            "september", "october", "november", "december",
            "jan", "feb", "mar", "apr", "jun", "jul", "aug", "sep", "oct", "nov", "dec",
            "winter", "summer", "monsoon", "autumn", "season", "month", "months"
    ), false);

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{Alnum}\\s]");

    @Override
    protected Reader initReader(final String fieldName, final Reader reader) {
        return new PatternReplaceCharFilter(PUNCTUATION, " ", reader);
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new WhitespaceTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new StopFilter(stream, STOP_WORDS);
        stream = new LengthFilter(stream, CatalogTextAnalyzer.MIN_TOKEN_LENGTH, Integer.MAX_VALUE);
        stream = new NumeralFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
