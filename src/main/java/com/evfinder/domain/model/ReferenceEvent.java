package com.evfinder.domain.model;

import java.time.Instant;

/**
 * Consensus market from a sharp reference source. Its outcomes are devigged before use.
 */
public class ReferenceEvent extends MarketEvent {

    /** How many books contributed to the consensus price. */
    private int numBooks = 1;

    /** Kick-off time as published by the reference source. */
    private Instant commenceTime;

    public int getNumBooks() {
        return numBooks;
    }

    public void setNumBooks(int numBooks) {
        this.numBooks = Math.max(1, numBooks);
    }

    public Instant getCommenceTime() {
        return commenceTime;
    }

    public void setCommenceTime(Instant commenceTime) {
        this.commenceTime = commenceTime;
    }
}
