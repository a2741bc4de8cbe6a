package com.secondhand.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Condition facts a listing can reveal to its viewer.
 */
public enum ConditionField {
    AGE,
    OPERATING_HOURS,
    GENERATION,
    DAMAGE,
    WEAR,

    /**
     * Inspector's overall grade.
     */
    OVERALL_RATING,

    /**
     * Averaged reliability across systems.
     */
    RELIABILITY,

    /**
     * Engine, hydraulic and electrical reliability individually.
     */
    RELIABILITY_DETAIL,

    /**
     * Inspector's remark hinting at the hidden quality band.
     */
    QUALITY_HINT;

    /**
     * Fields any viewer sees on a fresh listing.
     */
    public static final Set<ConditionField> VISIBLE_ON_LISTING = Collections.unmodifiableSet(
            EnumSet.of(AGE, OPERATING_HOURS, GENERATION, DAMAGE, WEAR));
}
