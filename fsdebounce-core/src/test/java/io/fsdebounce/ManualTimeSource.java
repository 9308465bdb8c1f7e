package io.fsdebounce;

import io.fsdebounce.spi.TimeSource;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

public final class ManualTimeSource implements TimeSource {
    private final AtomicLong now = new AtomicLong(1_000_000_000L);

    @Override
    public long nanoTime() {
        return now.get();
    }

    public void advance(Duration duration) {
        now.addAndGet(duration.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
