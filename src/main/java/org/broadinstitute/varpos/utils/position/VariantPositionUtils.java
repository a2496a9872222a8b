package org.broadinstitute.varpos.utils.position;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.varpos.exceptions.UserException;
import org.broadinstitute.varpos.utils.Trilean;
import org.broadinstitute.varpos.utils.Utils;
import org.broadinstitute.varpos.utils.logging.OneShotLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Utilities for working with collections of {@link VariantPosition}s.
 */
public final class VariantPositionUtils {

    private static final Logger logger = LogManager.getLogger(VariantPositionUtils.class);

    private static final OneShotLogger extendedAdjacencyWarning = new OneShotLogger(VariantPositionUtils.class);

    private VariantPositionUtils(){}

    /**
     * Parses every string into a position.
     *
     * @throws UserException.InvalidPositionSyntax for the first string that is not a well formed position
     */
    public static List<VariantPosition> parsePositions(final Collection<String> positionStrings) {
        Utils.nonNull(positionStrings, "position strings");
        return positionStrings.stream().map(VariantPosition::parse).collect(Collectors.toList());
    }

    /**
     * Parses the strings into positions, skipping (and logging) any that are not well formed.
     */
    public static List<VariantPosition> parsePositionsLeniently(final Collection<String> positionStrings) {
        Utils.nonNull(positionStrings, "position strings");
        final List<VariantPosition> positions = new ArrayList<>(positionStrings.size());
        final List<String> rejected = new ArrayList<>();
        for (final String positionString : positionStrings) {
            try {
                positions.add(VariantPosition.parse(positionString));
            } catch (final UserException.InvalidPositionSyntax e) {
                logger.debug(e.getMessage());
                rejected.add(e.getPositionString());
            }
        }
        if (!rejected.isEmpty()) {
            logger.warn(skippedPositionsMessage(rejected, positionStrings.size()));
        }
        return positions;
    }

    @VisibleForTesting
    static String skippedPositionsMessage(final List<String> rejected, final int total) {
        return String.format("Skipped %d invalid variant position strings out of %d: %s",
                rejected.size(), total, StringUtils.join(rejected, ", "));
    }

    /**
     * @return an immutable copy of {@code positions} sorted from the 5' UTR to the 3' UTR
     */
    public static List<VariantPosition> sortPositions(final Collection<VariantPosition> positions) {
        Utils.containsNoNull(positions, "positions must be non-null and contain no null elements");
        return ImmutableList.sortedCopyOf(positions);
    }

    /**
     * @return true if each position is less than or equal to the one after it
     */
    public static boolean isSorted(final Iterable<VariantPosition> positions) {
        Utils.nonNull(positions, "positions");
        return Ordering.<VariantPosition>natural().isOrdered(positions);
    }

    /**
     * Determines whether each position is adjacent to the one after it.
     *
     * @return {@link Trilean#UNKNOWN} if any pair involves an extended position, since adjacency is only
     *         defined for plain positions
     */
    public static Trilean isContiguous(final List<VariantPosition> positions) {
        Utils.containsNoNull(positions, "positions must be non-null and contain no null elements");
        Trilean contiguous = Trilean.TRUE;
        for (int i = 1; i < positions.size(); i++) {
            final VariantPosition previous = positions.get(i - 1);
            final VariantPosition current = positions.get(i);
            final Trilean adjacent = previous.adjacencyTo(current);
            if (adjacent == Trilean.UNKNOWN) {
                extendedAdjacencyWarning.warn("Adjacency between intronic or UTR positions is not defined; " +
                        "contiguity of position lists containing them is reported as unknown.");
            }
            contiguous = contiguous.and(adjacent);
        }
        return contiguous;
    }
}
