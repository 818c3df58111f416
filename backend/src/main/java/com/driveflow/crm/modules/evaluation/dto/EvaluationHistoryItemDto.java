package com.driveflow.crm.modules.evaluation.dto;

import com.driveflow.crm.modules.evaluation.EvaluationResult;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class EvaluationHistoryItemDto {
    private Long id;
    private Long lessonId;
    private LocalDate date;
    private Integer totalPoints;
    private Integer maxPoints;
    private EvaluationResult result;
}
