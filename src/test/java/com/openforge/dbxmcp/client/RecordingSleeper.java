package com.openforge.dbxmcp.client;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Records requested waits and advances the clock instead of blocking. */
public class RecordingSleeper implements Sleeper {

    private final MutableClock   clock;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException();
        }
        sleeps.add(duration);
        clock.advance(duration);
    }

    public List<Duration> sleeps() {
        return sleeps;
    }
}
