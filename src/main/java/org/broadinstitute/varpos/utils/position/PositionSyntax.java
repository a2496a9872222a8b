package org.broadinstitute.varpos.utils.position;

import org.broadinstitute.varpos.exceptions.UserException;
import org.broadinstitute.varpos.utils.Utils;

import javax.annotation.Nullable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matcher for the extended variant position grammar.
 *
 * A position string has exactly one of four shapes, tried in this order:
 * <ul>
 *     <li>{@link Shape#SIMPLE}: {@code 88}</li>
 *     <li>{@link Shape#INTRONIC}: {@code 88+7}, {@code 88-7}</li>
 *     <li>{@link Shape#UTR}: {@code -12} (5' UTR), {@code *12} (3' UTR)</li>
 *     <li>{@link Shape#UTR_INTRONIC}: {@code -12+3}, {@code *12-3}</li>
 * </ul>
 * Every number is a run of ASCII digits with no leading zero, so {@code 0} is never a legal value.
 * The whole string must match.
 */
public final class PositionSyntax {

    /**
     * Shared numeric token: a positive integer without leading zeros.
     */
    public static final String NUMBER = "[1-9][0-9]*";

    public static final char INTRON_FORWARD = '+';
    public static final char INTRON_BACKWARD = '-';

    private static final String UTR_SYMBOLS = "[*-]";
    private static final String INTRON_SIGNS = "[+-]";

    private static final Pattern SIMPLE_PATTERN = Pattern.compile("(" + NUMBER + ")");
    private static final Pattern INTRONIC_PATTERN = Pattern.compile("(" + NUMBER + ")(" + INTRON_SIGNS + ")(" + NUMBER + ")");
    private static final Pattern UTR_PATTERN = Pattern.compile("(" + UTR_SYMBOLS + ")(" + NUMBER + ")");
    private static final Pattern UTR_INTRONIC_PATTERN = Pattern.compile("(" + UTR_SYMBOLS + ")(" + NUMBER + ")(" + INTRON_SIGNS + ")(" + NUMBER + ")");

    /**
     * The four mutually exclusive shapes of a position string.
     */
    public enum Shape {
        SIMPLE(SIMPLE_PATTERN, false, false),
        INTRONIC(INTRONIC_PATTERN, false, true),
        UTR(UTR_PATTERN, true, false),
        UTR_INTRONIC(UTR_INTRONIC_PATTERN, true, true);

        private final Pattern pattern;
        private final boolean utr;
        private final boolean intronic;

        Shape(final Pattern pattern, final boolean utr, final boolean intronic) {
            this.pattern = pattern;
            this.utr = utr;
            this.intronic = intronic;
        }

        public boolean hasUtrSymbol() {
            return utr;
        }

        public boolean hasIntronicOffset() {
            return intronic;
        }
    }

    private PositionSyntax(){}

    /**
     * Matches the whole of {@code text} against the grammar.
     *
     * @param text the position string, may be {@code null}
     * @return the shape that matched along with its captured substrings
     * @throws UserException.InvalidPositionSyntax if no shape matches, or a number does not fit in an {@code int}
     */
    public static Match match(final String text) {
        if (text == null) {
            throw new UserException.InvalidPositionSyntax(null);
        }
        for (final Shape shape : Shape.values()) {
            final Matcher matcher = shape.pattern.matcher(text);
            if (matcher.matches()) {
                return toMatch(text, shape, matcher);
            }
        }
        throw new UserException.InvalidPositionSyntax(text);
    }

    /**
     * @return true if {@code text} is a well formed position string
     */
    public static boolean matches(final String text) {
        try {
            match(text);
            return true;
        } catch (final UserException.InvalidPositionSyntax e) {
            return false;
        }
    }

    private static Match toMatch(final String text, final Shape shape, final Matcher matcher) {
        int group = 1;
        final Character utrSymbol = shape.hasUtrSymbol() ? matcher.group(group++).charAt(0) : null;
        final String firstNumber = checkRange(text, matcher.group(group++));
        final Character intronSign = shape.hasIntronicOffset() ? matcher.group(group++).charAt(0) : null;
        final String secondNumber = shape.hasIntronicOffset() ? checkRange(text, matcher.group(group)) : null;
        return new Match(text, shape, utrSymbol, firstNumber, intronSign, secondNumber);
    }

    // the grammar accepts digit runs of any length, positions are ints
    private static String checkRange(final String text, final String number) {
        try {
            Integer.parseInt(number);
        } catch (final NumberFormatException e) {
            throw new UserException.InvalidPositionSyntax(text, e);
        }
        return number;
    }

    /**
     * Result of a successful match: the shape plus the substrings that shape captures.
     * Captures that do not belong to the shape are {@code null}.
     */
    public static final class Match {
        private final String text;
        private final Shape shape;
        private final Character utrSymbol;
        private final String firstNumber;
        private final Character intronSign;
        private final String secondNumber;

        Match(final String text, final Shape shape, @Nullable final Character utrSymbol, final String firstNumber,
              @Nullable final Character intronSign, @Nullable final String secondNumber) {
            this.text = Utils.nonNull(text);
            this.shape = Utils.nonNull(shape);
            this.utrSymbol = utrSymbol;
            this.firstNumber = Utils.nonNull(firstNumber);
            this.intronSign = intronSign;
            this.secondNumber = secondNumber;
            Utils.validate(shape.hasUtrSymbol() == (utrSymbol != null), () -> "UTR symbol does not agree with shape " + shape + " for " + text);
            Utils.validate(shape.hasIntronicOffset() == (intronSign != null && secondNumber != null),
                    () -> "intronic captures do not agree with shape " + shape + " for " + text);
        }

        /** The full string that was matched. */
        public String getText() {
            return text;
        }

        public Shape getShape() {
            return shape;
        }

        /** {@code *} or {@code -} for UTR shapes, otherwise {@code null}. */
        @Nullable
        public Character getUtrSymbol() {
            return utrSymbol;
        }

        /** The position (non-UTR shapes) or UTR offset (UTR shapes) digits. */
        public String getFirstNumber() {
            return firstNumber;
        }

        /** {@code +} or {@code -} for intronic shapes, otherwise {@code null}. */
        @Nullable
        public Character getIntronSign() {
            return intronSign;
        }

        /** The unsigned intronic offset digits for intronic shapes, otherwise {@code null}. */
        @Nullable
        public String getSecondNumber() {
            return secondNumber;
        }

        @Override
        public String toString() {
            return shape + "(" + text + ")";
        }
    }
}
