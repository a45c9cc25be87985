package me.golemcore.budget.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable configuration governing budgeting and bucketing of a
 * {@link BudgetTracker}.
 *
 * <p>
 * A single instance is meant to be shared by every tracker of one named config:
 * <ul>
 * <li>{@code budgetingWindow} - rolling window over which spend is summed</li>
 * <li>{@code bucketWidth} - grid that spend timestamps are truncated to</li>
 * <li>{@code backoffDuration} - minimum time a state must persist before it can
 * flip again</li>
 * <li>{@code allowedBudget} - ceiling; a window sum strictly above it exceeds
 * the budget</li>
 * <li>{@code numBuckets} - buckets retained per tracker, derived as
 * {@code ceil(budgetingWindow / bucketWidth)} unless overridden</li>
 * </ul>
 *
 * <p>
 * All values are validated on construction. Degenerate configs (zero bucket
 * width, zero buckets, negative budget) are rejected with
 * {@link IllegalArgumentException} instead of being tolerated at runtime.
 *
 * @since 1.0
 * @see BudgetTracker
 */
@Getter
@ToString(exclude = "clock")
public final class BudgetingConfig {

    private final Duration budgetingWindow;
    private final Duration bucketWidth;
    private final Duration backoffDuration;
    private final double allowedBudget;
    private final int numBuckets;
    private final Clock clock;

    public BudgetingConfig(Duration budgetingWindow, Duration bucketWidth, Duration backoffDuration,
            double allowedBudget) {
        this(budgetingWindow, bucketWidth, backoffDuration, allowedBudget,
                deriveNumBuckets(budgetingWindow, bucketWidth), new MonotonicClock());
    }

    private BudgetingConfig(Duration budgetingWindow, Duration bucketWidth, Duration backoffDuration,
            double allowedBudget, int numBuckets, Clock clock) {
        this.budgetingWindow = budgetingWindow;
        this.bucketWidth = bucketWidth;
        this.backoffDuration = Objects.requireNonNull(backoffDuration, "backoffDuration");
        this.allowedBudget = allowedBudget;
        this.numBuckets = numBuckets;
        this.clock = Objects.requireNonNull(clock, "clock");

        if (backoffDuration.isNegative()) {
            throw new IllegalArgumentException("backoffDuration must not be negative: " + backoffDuration);
        }
        if (!Double.isFinite(allowedBudget) || allowedBudget < 0) {
            throw new IllegalArgumentException("allowedBudget must be a finite non-negative number: "
                    + allowedBudget);
        }
        if (numBuckets < 1) {
            throw new IllegalArgumentException("numBuckets must be at least 1: " + numBuckets);
        }
    }

    /**
     * Returns a copy of this config reading time from the given clock.
     */
    public BudgetingConfig withClock(Clock clock) {
        return new BudgetingConfig(budgetingWindow, bucketWidth, backoffDuration, allowedBudget, numBuckets,
                clock);
    }

    /**
     * Returns a copy of this config retaining {@code numBuckets} buckets per
     * tracker instead of the derived amount.
     */
    public BudgetingConfig withNumBuckets(int numBuckets) {
        return new BudgetingConfig(budgetingWindow, bucketWidth, backoffDuration, allowedBudget, numBuckets,
                clock);
    }

    public Instant now() {
        return clock.instant();
    }

    public Instant truncatedNow() {
        return truncate(now());
    }

    /**
     * Floors {@code instant} onto the grid of {@code bucketWidth} multiples counted
     * from the epoch.
     */
    public Instant truncate(Instant instant) {
        long widthNanos = bucketWidth.toNanos();
        long epochNanos = Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L),
                instant.getNano());
        long truncated = Math.floorDiv(epochNanos, widthNanos) * widthNanos;
        return Instant.ofEpochSecond(0, truncated);
    }

    private static int deriveNumBuckets(Duration budgetingWindow, Duration bucketWidth) {
        Objects.requireNonNull(budgetingWindow, "budgetingWindow");
        Objects.requireNonNull(bucketWidth, "bucketWidth");
        if (budgetingWindow.isZero() || budgetingWindow.isNegative()) {
            throw new IllegalArgumentException("budgetingWindow must be positive: " + budgetingWindow);
        }
        if (bucketWidth.isZero() || bucketWidth.isNegative()) {
            throw new IllegalArgumentException("bucketWidth must be positive: " + bucketWidth);
        }
        long windowNanos = budgetingWindow.toNanos();
        long widthNanos = bucketWidth.toNanos();
        long buckets = (windowNanos + widthNanos - 1) / widthNanos;
        return (int) Math.min(buckets, Integer.MAX_VALUE);
    }
}
