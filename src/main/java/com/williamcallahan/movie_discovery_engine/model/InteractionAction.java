package com.williamcallahan.movie_discovery_engine.model;

/**
 * User reaction to a movie, with the weight it contributes to genre preferences
 */
public enum InteractionAction {
    SUPER_LIKED(2.5),
    LIKED(1.5),
    WATCH_LATER(1.0),
    VIEWED(0.2),
    SKIPPED(-0.5);

    private final double weight;

    InteractionAction(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }

    public boolean isPositive() {
        return this == LIKED || this == SUPER_LIKED;
    }
}
