package org.broadinstitute.varpos.utils.position;

import org.broadinstitute.varpos.exceptions.UserException;
import org.broadinstitute.varpos.exceptions.VarPosException;
import org.broadinstitute.varpos.utils.Trilean;
import org.broadinstitute.varpos.utils.Utils;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.Objects;

/**
 * Minimal immutable class representing a position relative to a transcript or coding sequence,
 * written in the extended variant position syntax.
 *
 * The populated fields are always one of these combinations:
 * <ul>
 *     <li>{@code position}: a plain position, e.g. {@code 88}</li>
 *     <li>{@code position}, {@code intronicPosition}: an intronic position, e.g. {@code 88+7}</li>
 *     <li>{@code utrSide}, {@code utrPosition}: a UTR position, e.g. {@code -12} or {@code *12}</li>
 *     <li>{@code utrSide}, {@code utrPosition}, {@code intronicPosition}: an intronic position in a UTR, e.g. {@code *12-3}</li>
 * </ul>
 *
 * Nucleotides towards the 5' end of an intron have a positive {@code intronicPosition} and their {@code position}
 * is that of the last base of the 5' exon. Nucleotides towards the 3' end of an intron have a negative
 * {@code intronicPosition} and their {@code position} is that of the first base of the 3' exon.
 *
 * Positions are totally ordered: 5' UTR positions come first, then plain and intronic positions, then 3' UTR
 * positions. At the same anchor an exon boundary sorts after the bases that precede it in the intron
 * (negative offsets) and before the bases that follow it (positive offsets).
 */
public final class VariantPosition implements Comparable<VariantPosition>, Serializable {
    private static final long serialVersionUID = 1L;

    private final Integer position;
    private final Integer intronicPosition;
    private final UtrSide utrSide;
    private final Integer utrPosition;

    /**
     * Makes a position by parsing the string.
     *
     * @param positionString position in the extended syntax, for example {@code 88}, {@code 88-7}, {@code *12} or {@code -12+3}
     * @throws UserException.InvalidPositionSyntax if the string is not a well formed position
     */
    public VariantPosition(final String positionString) {
        this(PositionSyntax.match(positionString));
    }

    private VariantPosition(final PositionSyntax.Match match) {
        Utils.nonNull(match);
        switch (match.getShape()) {
            case SIMPLE:
                position = Integer.parseInt(match.getFirstNumber());
                intronicPosition = null;
                utrSide = null;
                utrPosition = null;
                break;
            case INTRONIC:
                position = Integer.parseInt(match.getFirstNumber());
                intronicPosition = signedIntronicPosition(match);
                utrSide = null;
                utrPosition = null;
                break;
            case UTR:
                position = null;
                intronicPosition = null;
                utrSide = UtrSide.fromSymbol(match.getUtrSymbol());
                utrPosition = Integer.parseInt(match.getFirstNumber());
                break;
            case UTR_INTRONIC:
                position = null;
                intronicPosition = signedIntronicPosition(match);
                utrSide = UtrSide.fromSymbol(match.getUtrSymbol());
                utrPosition = Integer.parseInt(match.getFirstNumber());
                break;
            default:
                throw new VarPosException.ShouldNeverReachHereException("unexpected position format " + match);
        }
    }

    /**
     * Parses a position string.
     *
     * @throws UserException.InvalidPositionSyntax if the string is not a well formed position
     */
    public static VariantPosition parse(final String positionString) {
        return new VariantPosition(positionString);
    }

    /**
     * Derives the fields of a position from the output of {@link PositionSyntax#match(String)}.
     */
    public static VariantPosition fromMatch(final PositionSyntax.Match match) {
        return new VariantPosition(match);
    }

    private static int signedIntronicPosition(final PositionSyntax.Match match) {
        final int offset = Integer.parseInt(match.getSecondNumber());
        final char sign = match.getIntronSign();
        if (sign == PositionSyntax.INTRON_FORWARD) {
            return offset;
        } else if (sign == PositionSyntax.INTRON_BACKWARD) {
            return -offset;
        } else {
            throw new VarPosException.ShouldNeverReachHereException("unexpected intronic position separator '" + sign + "' in " + match);
        }
    }

    private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        Utils.validate(hasValidFields(), () -> String.format("invalid variant position fields: position=%s intronicPosition=%s utrSide=%s utrPosition=%s",
                position, intronicPosition, utrSide, utrPosition));
    }

    /**
     * True if the fields are one of the combinations the grammar can produce, with every number in range.
     */
    private boolean hasValidFields() {
        if (intronicPosition != null && intronicPosition == 0) {
            return false;
        }
        if (utrSide == null) {
            return position != null && position > 0 && utrPosition == null;
        }
        return position == null && utrPosition != null && utrPosition > 0;
    }

    /**
     * @return the plain position, or the exon boundary of an intronic position. {@code null} for UTR positions.
     */
    @Nullable
    public Integer getPosition() {
        return position;
    }

    /**
     * @return the signed number of bases into the intron, {@code null} for non-intronic positions
     */
    @Nullable
    public Integer getIntronicPosition() {
        return intronicPosition;
    }

    /**
     * @return the UTR this position falls in, {@code null} for non-UTR positions
     */
    @Nullable
    public UtrSide getUtrSide() {
        return utrSide;
    }

    /**
     * @return the number of bases into the UTR, {@code null} for non-UTR positions
     */
    @Nullable
    public Integer getUtrPosition() {
        return utrPosition;
    }

    public boolean isUtr() {
        return utrSide != null;
    }

    public boolean isIntronic() {
        return intronicPosition != null;
    }

    /**
     * @return true if the position was written using anything beyond a plain integer
     */
    public boolean isExtended() {
        return isUtr() || isIntronic();
    }

    /**
     * Determines whether this position and {@code other} are immediately adjacent in sequence space.
     *
     * Only plain positions can be answered. The last base of a transcript and the first base of its 3' UTR
     * are never reported as adjacent, since no sequence length is known here.
     *
     * @return {@link Trilean#TRUE} or {@link Trilean#FALSE} for two plain positions,
     *         {@link Trilean#UNKNOWN} if either position is extended
     */
    public Trilean adjacencyTo(final VariantPosition other) {
        Utils.nonNull(other, "other position");
        if (isExtended() || other.isExtended()) {
            return Trilean.UNKNOWN;
        }
        return Trilean.of(Math.abs((long) position - other.position) == 1);
    }

    /**
     * Same as {@link #adjacencyTo(VariantPosition)}, for callers that only deal in plain positions.
     *
     * @throws UnsupportedOperationException if either position is extended
     */
    public boolean isAdjacent(final VariantPosition other) {
        final Trilean adjacent = adjacencyTo(other);
        if (adjacent == Trilean.UNKNOWN) {
            throw new UnsupportedOperationException("adjacency is not implemented for extended positions: " + this + " and " + other);
        }
        return adjacent == Trilean.TRUE;
    }

    /**
     * @return true if this position sorts strictly before {@code other}
     */
    public boolean isLessThan(final VariantPosition other) {
        Utils.nonNull(other, "other position");
        if (utrSide == other.utrSide) {
            if (utrSide != null) {
                if (!utrPosition.equals(other.utrPosition)) {
                    return utrPosition < other.utrPosition;
                }
                return intronicLessThan(this, other);
            } else {
                if (!position.equals(other.position)) {
                    return position < other.position;
                }
                return intronicLessThan(this, other);
            }
        }
        // 5' UTR < non-UTR < 3' UTR
        return utrSide == UtrSide.FIVE_PRIME || other.utrSide == UtrSide.THREE_PRIME;
    }

    /**
     * Orders two positions by their intronic offsets, assuming all the other fields are equal.
     * An absent offset is the exon boundary itself, which comes after negative offsets and before positive ones.
     */
    private static boolean intronicLessThan(final VariantPosition a, final VariantPosition b) {
        if (Objects.equals(a.intronicPosition, b.intronicPosition)) {
            return false;
        } else if (a.intronicPosition == null) {
            return b.intronicPosition > 0;
        } else if (b.intronicPosition == null) {
            return a.intronicPosition < 0;
        } else {
            return a.intronicPosition < b.intronicPosition;
        }
    }

    public boolean isGreaterThan(final VariantPosition other) {
        return Utils.nonNull(other, "other position").isLessThan(this);
    }

    public boolean isLessThanOrEqualTo(final VariantPosition other) {
        return equals(other) || isLessThan(other);
    }

    public boolean isGreaterThanOrEqualTo(final VariantPosition other) {
        return equals(other) || isGreaterThan(other);
    }

    @Override
    public int compareTo(final VariantPosition other) {
        if (equals(other)) {
            return 0;
        }
        return isLessThan(other) ? -1 : 1;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final VariantPosition that = (VariantPosition) o;

        return Objects.equals(position, that.position)
                && Objects.equals(intronicPosition, that.intronicPosition)
                && utrSide == that.utrSide
                && Objects.equals(utrPosition, that.utrPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, intronicPosition, utrSide, utrPosition);
    }

    /**
     * @return this position in the extended position syntax, e.g. {@code 88-7} or {@code *12+3}
     */
    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        if (isUtr()) {
            sb.append(utrSide.getSymbol()).append(utrPosition);
        } else {
            sb.append(position);
        }
        if (isIntronic()) {
            sb.append(intronicPosition > 0 ? PositionSyntax.INTRON_FORWARD : PositionSyntax.INTRON_BACKWARD)
                    .append(Math.abs((long) intronicPosition));
        }
        return sb.toString();
    }
}
