package org.sdmodel.topology;

import java.util.Set;

/**
 * Lookup table from a connection's discriminator field to a polarity.
 *
 * One value marks a negative influence; everything else reads as positive. The
 * default follows the sample diagrams, which store the ASCII code of the sign
 * character ({@code 45} for '-', {@code 43} for '+', {@code 0} for none). Values
 * outside {@link #positiveMarkers()} are still positive but are flagged by the
 * resolver as unrecognized.
 *
 * @param negativeMarker  Discriminator value denoting a negative influence
 * @param positiveMarkers Discriminator values known to denote a positive (or undeclared) influence
 */
public record PolarityConvention(String negativeMarker, Set<String> positiveMarkers) {

    public static final String DEFAULT_NEGATIVE_MARKER = "45";
    public static final String DEFAULT_POSITIVE_MARKER = "43";
    public static final String UNDECLARED_MARKER = "0";

    public PolarityConvention {
        if (negativeMarker == null || negativeMarker.isBlank()) {
            throw new IllegalArgumentException("Negative marker must not be blank");
        }
        negativeMarker = negativeMarker.strip();
        positiveMarkers = Set.copyOf(positiveMarkers);
    }

    public static PolarityConvention defaults() {
        return new PolarityConvention(DEFAULT_NEGATIVE_MARKER, Set.of(UNDECLARED_MARKER, DEFAULT_POSITIVE_MARKER));
    }

    public static PolarityConvention withNegativeMarker(String negativeMarker) {
        return new PolarityConvention(negativeMarker, Set.of(UNDECLARED_MARKER, DEFAULT_POSITIVE_MARKER));
    }

    public Polarity polarityOf(String discriminator) {
        return negativeMarker.equals(normalize(discriminator)) ? Polarity.NEGATIVE : Polarity.POSITIVE;
    }

    public boolean isRecognized(String discriminator) {
        String value = normalize(discriminator);
        return value.isEmpty() || negativeMarker.equals(value) || positiveMarkers.contains(value);
    }

    /**
     * Discriminator value to write for a polarity.
     */
    public String markerFor(Polarity polarity) {
        return polarity == Polarity.NEGATIVE ? negativeMarker : DEFAULT_POSITIVE_MARKER;
    }

    private static String normalize(String discriminator) {
        return discriminator == null ? "" : discriminator.strip();
    }
}
