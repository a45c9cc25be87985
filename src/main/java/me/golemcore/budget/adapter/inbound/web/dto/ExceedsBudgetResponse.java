package me.golemcore.budget.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExceedsBudgetResponse {
    private boolean exceedsBudget;
}
