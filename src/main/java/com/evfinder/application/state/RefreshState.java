package com.evfinder.application.state;

import com.evfinder.domain.model.ValueBet;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Progress and output of the value-bet refresh, shared between the background job and readers.
 *
 * All writes go through the synchronized methods below; readers get immutable snapshots.
 */
public class RefreshState {

    public static final int MAX_LOGS = 30;

    /** One line of the refresh log. */
    public record LogEntry(Instant time, String msg) {
    }

    /** Everything a status reader needs, copied at one point in time. */
    public record Snapshot(
        RefreshStatus status,
        int progress,
        String error,
        Instant lastUpdate,
        RefreshStats stats,
        List<LogEntry> logs
    ) {
    }

    private final Clock clock;

    private RefreshStatus status = RefreshStatus.IDLE;
    private int progress;
    private String error;
    private Instant lastUpdate;
    private RefreshStats stats = RefreshStats.empty();
    private List<ValueBet> valueBets = List.of();
    private final Deque<LogEntry> logs = new ArrayDeque<>();

    public RefreshState(Clock clock) {
        this.clock = clock;
    }

    /**
     * Marks a refresh as started unless one is already running.
     *
     * @return false if a refresh is in progress; the state is then left untouched
     */
    public synchronized boolean tryBegin() {
        if (status == RefreshStatus.LOADING) {
            return false;
        }
        status = RefreshStatus.LOADING;
        error = null;
        progress = 0;
        logs.clear();
        return true;
    }

    public synchronized void log(String message) {
        logs.addLast(new LogEntry(clock.instant(), message));
        while (logs.size() > MAX_LOGS) {
            logs.removeFirst();
        }
    }

    public synchronized void progress(int percent) {
        progress = Math.max(0, Math.min(100, percent));
    }

    public synchronized void complete(List<ValueBet> detected, RefreshStats refreshStats) {
        valueBets = List.copyOf(detected);
        stats = refreshStats;
        lastUpdate = clock.instant();
        status = RefreshStatus.READY;
        progress = 100;
    }

    public synchronized void fail(String message) {
        status = RefreshStatus.ERROR;
        error = message;
        progress = 0;
    }

    public synchronized List<ValueBet> valueBets() {
        return valueBets;
    }

    public synchronized boolean isLoading() {
        return status == RefreshStatus.LOADING;
    }

    /**
     * True when no refresh completed within {@code maxAge} and none is running.
     */
    public synchronized boolean isStale(Duration maxAge) {
        if (status == RefreshStatus.LOADING) {
            return false;
        }
        return lastUpdate == null || lastUpdate.plus(maxAge).isBefore(clock.instant());
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(status, progress, error, lastUpdate, stats, List.copyOf(logs));
    }
}
