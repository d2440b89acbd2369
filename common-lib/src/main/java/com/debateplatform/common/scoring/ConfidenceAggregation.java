package com.debateplatform.common.scoring;

/**
 * How two debaters' self-reported confidences combine into one aggregate.
 * Both functions are symmetric in their arguments.
 */
public enum ConfidenceAggregation {

    /** The weaker confidence bounds the pair. */
    MINIMUM {
        @Override
        public double apply(double a, double b) {
            return Math.min(a, b);
        }
    },

    /** Arithmetic mean of both confidences. */
    MEAN {
        @Override
        public double apply(double a, double b) {
            return (a + b) / 2.0;
        }
    };

    public abstract double apply(double a, double b);
}
