package com.driveflow.crm.modules.evaluation.dto;

import com.driveflow.crm.modules.evaluation.EvaluationResult;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Data
@Builder
public class EvaluationDetailDto {
    private Long id;
    private Long lessonId;
    private LocalDate lessonDate;
    private LocalTime startTime;
    private LocalTime endTime;
    private String studentName;
    private String instructorName;
    private Integer totalPoints;
    private Integer maxPoints;
    private EvaluationResult result;
    private Instant createdAt;
    private Instant finalizedAt;
    private List<MistakeBreakdown> mistakes;

    @Data
    @Builder
    public static class MistakeBreakdown {
        private Long itemId;
        private String description;
        private Integer count;
        private Integer penaltyPoints;
    }
}
