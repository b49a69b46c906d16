package com.toolstock.notifier.hours;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Open/closed verdict for one instant. {@code reason} and {@code holidayName} are null when open. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BusinessHoursResult {

    private static final BusinessHoursResult OPEN = new BusinessHoursResult(true, null, null);

    private final boolean      open;
    private final ClosedReason reason;
    private final String       holidayName;

    private BusinessHoursResult(final boolean open, final ClosedReason reason, final String holidayName) {
        this.open        = open;
        this.reason      = reason;
        this.holidayName = holidayName;
    }

    public static BusinessHoursResult open() {
        return OPEN;
    }

    public static BusinessHoursResult closed(final ClosedReason reason) {
        return new BusinessHoursResult(false, reason, null);
    }

    public static BusinessHoursResult holiday(final String holidayName) {
        return new BusinessHoursResult(false, ClosedReason.HOLIDAY, holidayName);
    }

    public boolean      isOpen()         { return open; }
    public ClosedReason getReason()      { return reason; }
    public String       getHolidayName() { return holidayName; }

    @Override
    public String toString() {
        if (open) {
            return "open";
        }
        return "closed(" + reason + (holidayName != null ? ", " + holidayName : "") + ")";
    }
}
