package com.puzzlenft.puzzleservice.service;

import com.puzzlenft.puzzleservice.model.EntropySnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Clock-backed entropy: the slot is the number of whole slot durations elapsed since genesis.
 */
public class SystemEntropySource implements EntropySource {

    private final Clock clock;
    private final Instant genesis;
    private final long slotMillis;

    public SystemEntropySource(Clock clock, Instant genesis, Duration slotDuration) {
        if (slotDuration.toMillis() < 1) {
            throw new IllegalArgumentException("Slot duration must be at least 1ms: " + slotDuration);
        }
        this.clock = clock;
        this.genesis = genesis;
        this.slotMillis = slotDuration.toMillis();
    }

    @Override
    public EntropySnapshot snapshot() {
        Instant now = clock.instant();
        long elapsed = Math.max(0, now.toEpochMilli() - genesis.toEpochMilli());
        return new EntropySnapshot(elapsed / slotMillis, now.getEpochSecond());
    }
}
