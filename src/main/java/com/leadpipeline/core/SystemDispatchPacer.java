package com.leadpipeline.core;

import com.google.common.base.Ticker;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock pacer
 */
public class SystemDispatchPacer implements DispatchPacer {

    @Override
    public Ticker ticker() {
        return Ticker.systemTicker();
    }

    @Override
    public void pause(Duration delay) throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep(delay.toNanos());
    }
}
