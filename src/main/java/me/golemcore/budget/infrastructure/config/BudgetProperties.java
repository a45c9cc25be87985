package me.golemcore.budget.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties bound from the {@code budget.*} namespace.
 *
 * <p>
 * Each entry of {@code budget.configs} defines one named budgeting config
 * shared by every project tracked under that name:
 *
 * <pre>
 * budget:
 *   configs:
 *     api:
 *       budgeting-window: 60s
 *       bucket-width: 5s
 *       backoff-duration: 10s
 *       allowed-budget: 1000
 * </pre>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "budget")
@Data
public class BudgetProperties {

    private boolean sweepEnabled = true;
    private Duration sweepInterval = Duration.ofSeconds(60);
    private Map<String, BudgetingProperties> configs = new LinkedHashMap<>();

    @Data
    public static class BudgetingProperties {
        private Duration budgetingWindow;
        private Duration bucketWidth;
        private Duration backoffDuration = Duration.ZERO;
        private Double allowedBudget;
        // Overrides the bucket count derived from window / width
        private Integer numBuckets;
    }
}
