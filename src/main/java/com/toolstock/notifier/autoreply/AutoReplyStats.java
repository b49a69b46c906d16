package com.toolstock.notifier.autoreply;

import com.toolstock.notifier.hours.BusinessHoursResult;
import com.toolstock.notifier.hours.NextBusinessDay;

public final class AutoReplyStats {

    private final int                 repliedCount;
    private final int                 pendingCount;
    private final BusinessHoursResult businessHours;
    private final NextBusinessDay     nextBusinessDay;

    public AutoReplyStats(
            final int repliedCount,
            final int pendingCount,
            final BusinessHoursResult businessHours,
            final NextBusinessDay nextBusinessDay) {
        this.repliedCount    = repliedCount;
        this.pendingCount    = pendingCount;
        this.businessHours   = businessHours;
        this.nextBusinessDay = nextBusinessDay;
    }

    /** Conversations replied to within the suppression window. */
    public int                 getRepliedCount()    { return repliedCount; }
    public int                 getPendingCount()    { return pendingCount; }
    public BusinessHoursResult getBusinessHours()   { return businessHours; }
    public NextBusinessDay     getNextBusinessDay() { return nextBusinessDay; }

    @Override
    public String toString() {
        return "AutoReplyStats{replied=" + repliedCount
             + ", pending=" + pendingCount
             + ", businessHours=" + businessHours
             + ", nextBusinessDay=" + nextBusinessDay + "}";
    }
}
