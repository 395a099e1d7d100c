/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepflow.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Step level retry: how many times a failing node is re-entered and how long to
 * wait in between.
 */
public final class RetryPolicy {

    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);

    private final int maxAttempts;
    private final Duration delay;
    private final double backoff;
    private final Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration delay, double backoff, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.delay = Objects.requireNonNull(delay, "Delay cannot be null");
        this.backoff = backoff < 1.0 ? 1.0 : backoff;
        this.maxDelay = maxDelay != null ? maxDelay : Duration.ofMinutes(5);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getDelay() {
        return delay;
    }

    public double getBackoff() {
        return backoff;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * Delay before the given attempt (attempt 2 is the first retry).
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1 || delay.isZero()) {
            return Duration.ZERO;
        }
        double millis = delay.toMillis() * Math.pow(backoff, attempt - 2);
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxAttempts == that.maxAttempts &&
               Double.compare(that.backoff, backoff) == 0 &&
               delay.equals(that.delay) &&
               maxDelay.equals(that.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, delay, backoff, maxDelay);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", delay=" + delay + ", backoff=" + backoff + "}";
    }
}
