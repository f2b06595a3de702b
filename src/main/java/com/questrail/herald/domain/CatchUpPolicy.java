package com.questrail.herald.domain;

/**
 * What a domain does with milestones that passed while the process was down.
 */
public enum CatchUpPolicy {
    /**
     * Apply the cumulative effect of every missed milestone once
     * (allowance accrual).
     */
    REPLAY,
    /**
     * Skip missed milestones without alerting; only resynchronise pointers
     * (a reminder for a past date is meaningless).
     */
    DISCARD
}
