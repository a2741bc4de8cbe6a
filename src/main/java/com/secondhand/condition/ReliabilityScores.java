package com.secondhand.condition;

import lombok.Value;

/**
 * Per-system reliability of an item, each in [0.1, 1.0].
 */
@Value
public class ReliabilityScores {

    double engine;
    double hydraulic;
    double electrical;

    public double overall() {
        return (engine + hydraulic + electrical) / 3.0;
    }
}
