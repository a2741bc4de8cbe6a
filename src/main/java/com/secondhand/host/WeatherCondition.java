package com.secondhand.host;

import lombok.Getter;

/**
 * Discrete weather states reported by the host. Bad weather makes sellers more willing
 * to deal; the modifier widens their tolerance for low offers.
 */
@Getter
public enum WeatherCondition {

    SUN(0.0),
    CLOUDY(0.0),
    FOG(0.0),
    RAIN(0.05),
    SNOW(0.05),
    STORM(0.08),
    HAIL(0.12);

    private final double negotiationModifier;

    WeatherCondition(double negotiationModifier) {
        this.negotiationModifier = negotiationModifier;
    }
}
