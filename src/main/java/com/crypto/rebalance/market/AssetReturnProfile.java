package com.crypto.rebalance.market;

/**
 * Daily return distribution of one asset: gaussian(mean, std) plus a constant trend.
 */
public record AssetReturnProfile(double mean, double std, double trend) {

    public AssetReturnProfile {
        if (std < 0) {
            throw new IllegalArgumentException("std must be >= 0");
        }
    }
}
