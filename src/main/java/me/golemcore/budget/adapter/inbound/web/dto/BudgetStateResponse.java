package me.golemcore.budget.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetStateResponse {
    private String configName;
    private String projectId;
    private boolean exceedsBudget;
    private Instant backoffDeadline;
    private double windowSpent;
    private double retainedSpent;
    private List<BucketDto> buckets;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BucketDto {
        private Instant timestamp;
        private double spent;
    }
}
