package com.fintech.recurringcharges.model;

/**
 * Width of the feature vectors produced by the extraction pipeline.
 * <p>
 * BASE: 17 temporal + 1 amount + 49 description.
 * ACCOUNT_AWARE: BASE + 24 account features.
 */
public enum FeatureMode {
    BASE(67),
    ACCOUNT_AWARE(91);

    private final int dimension;

    FeatureMode(int dimension) {
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }
}
