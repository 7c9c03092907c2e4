package com.labpulse.poller;

import com.labpulse.model.CycleSummary;

/**
 * Runs on the poller thread after every completed cycle, before the next cycle may start.
 */
@FunctionalInterface
public interface PollCycleListener {
    void onCycleComplete(CycleSummary summary);
}
