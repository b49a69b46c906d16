package com.toolstock.notifier.hours;

/** Why the business is closed at a given instant. */
public enum ClosedReason {
    /** A public holiday or an exceptional closure. */
    HOLIDAY,
    /** The weekday has no opening window, e.g. the weekend. */
    NO_SCHEDULE,
    BEFORE_HOURS,
    AFTER_HOURS
}
