package me.golemcore.budget.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a budget tracker's state.
 *
 * <p>
 * {@code windowSpent} only counts buckets inside the budgeting window at the
 * time of the snapshot and is what the budget is compared against. Buckets that
 * have left the window but were not yet evicted still appear in
 * {@code buckets} and in {@link #getRetainedSpent()}.
 */
@Value
@Builder
public class BudgetSnapshot {

    boolean exceedsBudget;
    Instant backoffDeadline;
    double windowSpent;
    @Singular
    List<Bucket> buckets;

    public double getRetainedSpent() {
        return buckets.stream().mapToDouble(Bucket::spent).sum();
    }

    /**
     * Spend accumulated in one grid cell starting at {@code timestamp}.
     */
    public record Bucket(Instant timestamp, double spent) {
    }
}
