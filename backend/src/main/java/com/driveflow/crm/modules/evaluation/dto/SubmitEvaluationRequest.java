package com.driveflow.crm.modules.evaluation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Mistake sheet posted by the instructor. The constraints are published in the
 * API schema; {@code EvaluationService} enforces them once the caller is
 * authorized.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitEvaluationRequest {

    @Valid
    private List<MistakeItem> mistakes = new ArrayList<>();

    /** Optional; when present it must equal the template's budget. */
    @Min(0)
    private Integer maxPoints;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MistakeItem {
        @NotNull(message = "itemId is required")
        @Min(value = 1, message = "itemId must be positive")
        private Long itemId;

        @NotNull(message = "count is required")
        @Min(value = 0, message = "count must not be negative")
        private Integer count;
    }
}
