package me.golemcore.budget.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.budget.adapter.inbound.web.dto.BudgetOverviewResponse;
import me.golemcore.budget.adapter.inbound.web.dto.BudgetStateResponse;
import me.golemcore.budget.adapter.inbound.web.dto.ExceedsBudgetResponse;
import me.golemcore.budget.adapter.inbound.web.dto.RecordBudgetSpendRequest;
import me.golemcore.budget.domain.model.BudgetSnapshot;
import me.golemcore.budget.domain.service.BudgetingConfigService;
import me.golemcore.budget.port.inbound.ProjectBudgetPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Project budget endpoints: check and record spend per project.
 *
 * <p>
 * Project ids are unsigned 64-bit values. They are parsed with
 * {@link Long#parseUnsignedLong(String)}, so ids above {@link Long#MAX_VALUE}
 * are carried as negative {@code long}s internally and rendered back unsigned.
 */
@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class ProjectBudgetsController {

    private final ProjectBudgetPort projectBudgetPort;
    private final BudgetingConfigService budgetingConfigService;

    @GetMapping
    public Mono<ResponseEntity<BudgetOverviewResponse>> getOverview() {
        BudgetOverviewResponse response = BudgetOverviewResponse.builder()
                .configs(new ArrayList<>(budgetingConfigService.getConfigNames()))
                .trackedProjects(projectBudgetPort.getTrackedCount())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/{configName}/projects/{projectId}")
    public Mono<ResponseEntity<ExceedsBudgetResponse>> exceedsBudget(
            @PathVariable String configName,
            @PathVariable String projectId) {
        boolean exceeds = projectBudgetPort.exceedsBudget(configName, parseProjectId(projectId));
        return Mono.just(ResponseEntity.ok(new ExceedsBudgetResponse(exceeds)));
    }

    @PostMapping("/{configName}/projects/{projectId}/spend")
    public Mono<ResponseEntity<ExceedsBudgetResponse>> recordBudgetSpend(
            @PathVariable String configName,
            @PathVariable String projectId,
            @RequestBody RecordBudgetSpendRequest request) {
        if (request == null || request.getSpentBudget() == null) {
            throw new IllegalArgumentException("spentBudget is required");
        }
        boolean exceeds = projectBudgetPort.recordBudgetSpend(configName, parseProjectId(projectId),
                request.getSpentBudget());
        return Mono.just(ResponseEntity.ok(new ExceedsBudgetResponse(exceeds)));
    }

    @GetMapping("/{configName}/projects/{projectId}/state")
    public Mono<ResponseEntity<BudgetStateResponse>> getState(
            @PathVariable String configName,
            @PathVariable String projectId) {
        long id = parseProjectId(projectId);
        BudgetSnapshot snapshot = projectBudgetPort.getSnapshot(configName, id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Project " + Long.toUnsignedString(id) + " is not tracked under '" + configName + "'"));
        return Mono.just(ResponseEntity.ok(toStateResponse(configName, id, snapshot)));
    }

    static long parseProjectId(String raw) {
        try {
            return Long.parseUnsignedLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid project id: " + raw, e);
        }
    }

    private BudgetStateResponse toStateResponse(String configName, long projectId, BudgetSnapshot snapshot) {
        List<BudgetStateResponse.BucketDto> buckets = new ArrayList<>();
        for (BudgetSnapshot.Bucket bucket : snapshot.getBuckets()) {
            buckets.add(BudgetStateResponse.BucketDto.builder()
                    .timestamp(bucket.timestamp())
                    .spent(bucket.spent())
                    .build());
        }
        return BudgetStateResponse.builder()
                .configName(configName)
                .projectId(Long.toUnsignedString(projectId))
                .exceedsBudget(snapshot.isExceedsBudget())
                .backoffDeadline(snapshot.getBackoffDeadline())
                .windowSpent(snapshot.getWindowSpent())
                .retainedSpent(snapshot.getRetainedSpent())
                .buckets(buckets)
                .build();
    }
}
