package org.broadinstitute.varpos.utils.position;

import org.broadinstitute.varpos.exceptions.VarPosException;

/**
 * The untranslated region a {@link VariantPosition} falls in.
 */
public enum UtrSide {
    FIVE_PRIME('-'),
    THREE_PRIME('*');

    private final char symbol;

    UtrSide(final char symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the leading character that denotes this side in position notation
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Maps a leading UTR symbol to its side. Only called with symbols that already passed the grammar,
     * so any other character is an internal error.
     */
    static UtrSide fromSymbol(final char symbol) {
        for (final UtrSide side : values()) {
            if (side.symbol == symbol) {
                return side;
            }
        }
        throw new VarPosException.ShouldNeverReachHereException("unexpected UTR symbol '" + symbol + "'");
    }
}
