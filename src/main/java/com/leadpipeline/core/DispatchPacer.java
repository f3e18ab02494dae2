package com.leadpipeline.core;

import com.google.common.base.Ticker;

import java.time.Duration;

/**
 * Time source and pause used to pace the dispatch loop
 */
public interface DispatchPacer {

    /**
     * Clock the loop measures elapsed time with
     */
    Ticker ticker();

    /**
     * Block for {@code delay}
     */
    void pause(Duration delay) throws InterruptedException;
}
