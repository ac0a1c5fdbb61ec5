package com.advotac.assistant.rag.rerank;

import java.time.Clock;
import java.time.Duration;

/**
 * Pauses model reranking after {@code failureLimit} failures in a row. Once the pause has
 * run out one query is let through; its outcome either lifts the pause or starts a new one.
 */
final class RerankBackoff {
    private final int failureLimit;
    private final Duration pause;
    private final Clock clock;
    private int failuresInRow;
    private boolean paused;
    private long pausedUntilMs;
    private boolean trialInFlight;

    RerankBackoff(int failureLimit, Duration pause, Clock clock) {
        this.failureLimit = Math.max(1, failureLimit);
        this.pause = pause == null || pause.isNegative() ? Duration.ofSeconds(60) : pause;
        this.clock = clock;
    }

    synchronized boolean tryAcquire() {
        if (!this.paused) {
            return true;
        }
        if (this.trialInFlight || this.clock.millis() < this.pausedUntilMs) {
            return false;
        }
        this.trialInFlight = true;
        return true;
    }

    /**
     * @return true when this success lifted a pause
     */
    synchronized boolean onSuccess() {
        boolean wasPaused = this.paused;
        this.failuresInRow = 0;
        this.paused = false;
        this.trialInFlight = false;
        return wasPaused;
    }

    /**
     * @return true when this failure started a pause
     */
    synchronized boolean onFailure() {
        this.trialInFlight = false;
        if (this.paused || ++this.failuresInRow >= this.failureLimit) {
            this.paused = true;
            this.pausedUntilMs = this.clock.millis() + this.pause.toMillis();
            this.failuresInRow = 0;
            return true;
        }
        return false;
    }

    synchronized boolean isPaused() {
        return this.paused;
    }

    Duration pause() {
        return this.pause;
    }
}
