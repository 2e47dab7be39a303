package de.mirkosertic.mcp.travelserver.analysis;

import org.apache.lucene.analysis.FilteringTokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Drops tokens consisting only of ASCII digits.
 */
public final class NumeralFilter extends FilteringTokenFilter {

    private final CharTermAttribute termAttr = addAttribute(CharTermAttribute.class);

    public NumeralFilter(final TokenStream in) {
        super(in);
    }

    @Override
    protected boolean accept() {
        final char[] buffer = termAttr.buffer();
        final int length = termAttr.length();
        for (int i = 0; i < length; i++) {
            if (buffer[i] < '0' || buffer[i] > '9') {
                return true;
            }
        }
        return false;
    }
}
