package org.sdmodel.topology;

/**
 * Sign of a causal influence.
 */
public enum Polarity {
    POSITIVE("positive"),
    NEGATIVE("negative");

    private final String relationship;

    Polarity(String relationship) {
        this.relationship = relationship;
    }

    /**
     * Name used in the JSON documents exchanged with collaborators.
     */
    public String relationship() {
        return relationship;
    }

    /**
     * @throws IllegalArgumentException when the text names neither polarity
     */
    public static Polarity fromRelationship(String relationship) {
        if (relationship != null) {
            for (Polarity polarity : values()) {
                if (polarity.relationship.equalsIgnoreCase(relationship.strip())) {
                    return polarity;
                }
            }
        }
        throw new IllegalArgumentException("Unrecognized relationship '" + relationship + "'");
    }
}
