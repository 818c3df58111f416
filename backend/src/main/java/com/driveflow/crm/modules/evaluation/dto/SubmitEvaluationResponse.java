package com.driveflow.crm.modules.evaluation.dto;

import com.driveflow.crm.modules.evaluation.EvaluationResult;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SubmitEvaluationResponse {
    private Long id;
    private Long lessonId;
    private Integer totalPoints;
    private Integer maxPoints;
    private EvaluationResult result;
}
