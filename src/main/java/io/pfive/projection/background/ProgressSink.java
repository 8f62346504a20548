// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.background;

import io.pfive.projection.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// A ProgressListener that writes progress lines to the log, throttled so that a long call with
/// many variables does not flood it. Both the number of lines per task and the minimum interval
/// between them come from Configuration.
public class ProgressSink implements ProgressListener {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final String id;

    // Tracking current state of the task.
    private String title = "UNKNOWN";
    private int totalSteps = 1;
    private int stepsCompleted = 0;
    private long startTime;
    private boolean completed = false;

    // Variables used in throttling log messages.
    private int prevLogStep = 0;
    private int logAfter = 0;
    private long lastLogTime = 0;
    private int msecBetweenEvents = Configuration.PROGRESS_MIN_MSEC;
    private int eventCount = 0;

    public ProgressSink (String id) {
        this.id = id;
    }

    public void minTimeBetweenEventsMsec (int msec) {
        this.msecBetweenEvents = msec;
    }

    private int estimateRemainingSeconds (long currentTime) {
        double activeTimeSeconds = (currentTime - this.startTime) / 1000.0;
        double stepsRemaining = totalSteps - stepsCompleted;
        return (int)(activeTimeSeconds * stepsRemaining / stepsCompleted);
    }

    @Override
    public synchronized void beginTask (String title, int totalSteps) {
        this.title = title;
        this.totalSteps = Math.max(totalSteps, 1);
        this.startTime = System.currentTimeMillis();
        stepsCompleted = 0;
        completed = false;
        eventCount = 0;
        // Throttling will still function if totalSteps <= max events and logAfter is zero.
        logAfter = this.totalSteps / Math.max(Configuration.PROGRESS_MAX_EVENTS, 1);
        prevLogStep = 0;
        LOG.info("[{}] {}: starting {} steps.", id, title, totalSteps);
    }

    /// Threadsafe: called by every worker thread as it finishes a variable.
    @Override
    public synchronized void increment (int n) {
        if (completed) return;
        stepsCompleted += n;
        if (stepsCompleted >= totalSteps) {
            completed = true;
            long durationMsec = System.currentTimeMillis() - startTime;
            LOG.info("[{}] {}: done in {} msec.", id, title, durationMsec);
        } else if (stepsCompleted >= prevLogStep + logAfter) {
            long currTime = System.currentTimeMillis();
            if (currTime - lastLogTime < msecBetweenEvents) return;
            LOG.info("[{}] {}: {}/{} steps, about {} sec remaining.", id, title, stepsCompleted, totalSteps,
                  estimateRemainingSeconds(currTime));
            prevLogStep = stepsCompleted;
            lastLogTime = currTime;
            eventCount += 1;
        }
    }

    public synchronized int stepsCompleted () {
        return stepsCompleted;
    }

    public synchronized boolean isCompleted () {
        return completed;
    }

    /// Number of intermediate progress lines logged since the task began.
    public synchronized int eventCount () {
        return eventCount;
    }

}
