package com.maturityplatform.common.weighting;

/** A value paired with the weight it contributes with. */
public record WeightedValue(double value, double weight) {

    public double contribution() {
        return value * weight;
    }
}
