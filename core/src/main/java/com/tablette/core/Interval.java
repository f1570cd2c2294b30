package com.tablette.core;

/**
 * Granularity of a datetime dimension.
 */
public enum Interval {
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    ANNUALLY
}
