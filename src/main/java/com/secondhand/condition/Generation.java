package com.secondhand.condition;

import lombok.Getter;

/**
 * Age class of a generated item. Each class spans an age range in years and a range
 * of yearly operating hours.
 */
@Getter
public enum Generation {

    RECENT("Recent", 1, 3, 100, 800),

    MID_AGE("Mid-age", 4, 7, 200, 1200),

    OLD("Old", 8, 15, 500, 2500);

    private final String displayName;
    private final int minAge;
    private final int maxAge;
    private final int minHoursPerYear;
    private final int maxHoursPerYear;

    Generation(String displayName, int minAge, int maxAge, int minHoursPerYear, int maxHoursPerYear) {
        this.displayName = displayName;
        this.minAge = minAge;
        this.maxAge = maxAge;
        this.minHoursPerYear = minHoursPerYear;
        this.maxHoursPerYear = maxHoursPerYear;
    }

    /**
     * Class an item of the given age falls in. Ages past the oldest range are {@link #OLD}.
     */
    public static Generation forAge(int age) {
        if (age <= RECENT.maxAge) {
            return RECENT;
        }
        if (age <= MID_AGE.maxAge) {
            return MID_AGE;
        }
        return OLD;
    }
}
