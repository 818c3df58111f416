package com.driveflow.crm.modules.evaluation;

import com.driveflow.crm.modules.evaluation.dto.EvaluationDetailDto;
import com.driveflow.crm.modules.evaluation.dto.EvaluationHistoryItemDto;
import com.driveflow.crm.modules.evaluation.dto.PagedResult;
import com.driveflow.crm.modules.evaluation.dto.SubmitEvaluationRequest;
import com.driveflow.crm.modules.evaluation.dto.SubmitEvaluationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Evaluations", description = "Lesson mistake sheets: submit, review and history")
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final EvaluationHistoryService historyService;

    /**
     * Instructor submits the mistakes observed during a lesson.
     * Body: { "mistakes": [{ "itemId": 1, "count": 2 }], "maxPoints": 21 }
     * The sheet is checked by the service, after the caller's role and assignment.
     */
    @PostMapping("/lessons/{lessonId}/evaluations")
    @PreAuthorize("hasRole('INSTRUCTOR')")
    @Operation(summary = "Submit and score the evaluation of a lesson (assigned instructor only)")
    public ResponseEntity<SubmitEvaluationResponse> submit(
            @PathVariable Long lessonId,
            @RequestBody(required = false) SubmitEvaluationRequest body) {
        SubmitEvaluationRequest request = body != null ? body : new SubmitEvaluationRequest();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(evaluationService.submit(lessonId, request));
    }

    @GetMapping("/evaluations/{evaluationId}")
    @PreAuthorize("hasAnyRole('INSTRUCTOR','STUDENT','SCHOOL_ADMIN')")
    @Operation(summary = "Get an evaluation with its per-item mistake breakdown")
    public ResponseEntity<EvaluationDetailDto> getEvaluation(@PathVariable Long evaluationId) {
        return ResponseEntity.ok(evaluationService.getEvaluation(evaluationId));
    }

    @GetMapping("/lessons/{lessonId}/evaluation")
    @PreAuthorize("hasAnyRole('INSTRUCTOR','STUDENT','SCHOOL_ADMIN')")
    @Operation(summary = "Get the evaluation recorded for a lesson")
    public ResponseEntity<EvaluationDetailDto> getEvaluationByLesson(@PathVariable Long lessonId) {
        return ResponseEntity.ok(evaluationService.getEvaluationByLesson(lessonId));
    }

    @GetMapping("/students/{studentId}/evaluations")
    @PreAuthorize("hasAnyRole('INSTRUCTOR','STUDENT','SCHOOL_ADMIN')")
    @Operation(summary = "Evaluation history for a student, newest lesson first. Dates are inclusive (yyyy-MM-dd).")
    public ResponseEntity<PagedResult<EvaluationHistoryItemDto>> getStudentEvaluations(
            @PathVariable UUID studentId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int pageSize) {
        return ResponseEntity.ok(historyService.listStudentEvaluations(studentId, from, to, page, pageSize));
    }
}
