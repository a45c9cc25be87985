package me.golemcore.budget.port.inbound;

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

import me.golemcore.budget.domain.model.BudgetSnapshot;

import java.util.Optional;

/**
 * Port for recording and querying per-project budget spend.
 *
 * <p>
 * Projects are addressed by a named budgeting config and a numeric project id.
 * Trackers are created lazily on first use. Both operations only report whether
 * the project exceeds its budget; acting on the signal is up to the caller.
 *
 * <p>
 * {@code projectId} is an unsigned 64-bit id held in a {@code long}.
 *
 * @since 1.0
 */
public interface ProjectBudgetPort {

    /**
     * Check whether the project currently exceeds its budget.
     */
    boolean exceedsBudget(String configName, long projectId);

    /**
     * Record spent budget for the project and return whether it now exceeds its
     * budget.
     */
    boolean recordBudgetSpend(String configName, long projectId, double spentBudget);

    /**
     * Get the current tracker state, or empty if the project is not tracked.
     */
    Optional<BudgetSnapshot> getSnapshot(String configName, long projectId);

    int getTrackedCount();
}
