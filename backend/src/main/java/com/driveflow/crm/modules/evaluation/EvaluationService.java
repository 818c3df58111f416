package com.driveflow.crm.modules.evaluation;

import com.driveflow.crm.exception.BusinessException;
import com.driveflow.crm.exception.EvaluationAlreadyExistsException;
import com.driveflow.crm.exception.ResourceNotFoundException;
import com.driveflow.crm.modules.enrollment.Enrollment;
import com.driveflow.crm.modules.evaluation.access.EvaluationAccessGate;
import com.driveflow.crm.modules.evaluation.dto.EvaluationDetailDto;
import com.driveflow.crm.modules.evaluation.dto.SubmitEvaluationRequest;
import com.driveflow.crm.modules.evaluation.dto.SubmitEvaluationResponse;
import com.driveflow.crm.modules.lesson.Lesson;
import com.driveflow.crm.modules.lesson.LessonRepository;
import com.driveflow.crm.modules.template.ExamTemplate;
import com.driveflow.crm.modules.template.ExamTemplateService;
import com.driveflow.crm.modules.template.TemplateItem;
import com.driveflow.crm.modules.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final EvaluationRepository evaluationRepository;
    private final LessonRepository lessonRepository;
    private final ExamTemplateService templateService;
    private final EvaluationScorer scorer;
    private final EvaluationAccessGate accessGate;

    // ── Submit ───────────────────────────────────────────────────────────────

    /**
     * Validates, scores and stores the mistake sheet of a lesson in one step.
     * Every check runs before the insert, so a rejected submission leaves nothing
     * behind.
     */
    @Transactional
    public SubmitEvaluationResponse submit(Long lessonId, SubmitEvaluationRequest request) {
        if (lessonId == null || lessonId <= 0) {
            throw new BusinessException("Lesson ID must be positive");
        }

        Lesson lesson = lessonRepository.findWithEnrollmentById(lessonId)
                .orElseThrow(() -> new ResourceNotFoundException("Lesson", lessonId.toString()));
        ExamTemplate template = templateService.loadTemplateForLicense(licenseOf(lesson));

        accessGate.requireSubmit(lesson);

        // Early answer for the common case; the unique constraint below decides races
        if (evaluationRepository.existsByLessonId(lessonId)) {
            throw new EvaluationAlreadyExistsException(lessonId);
        }

        EvaluationScorer.ScoredSheet sheet = scorer.score(template, toEntries(request.getMistakes()));

        if (request.getMaxPoints() != null && !request.getMaxPoints().equals(template.getMaxPoints())) {
            throw new BusinessException("maxPoints " + request.getMaxPoints()
                    + " does not match the exam template budget of " + template.getMaxPoints());
        }

        Evaluation evaluation = Evaluation.builder()
                .lesson(lesson)
                .template(template)
                .mistakes(sheet.mistakes())
                .totalPoints(sheet.totalPoints())
                .result(sheet.result())
                .finalizedAt(Instant.now())
                .build();

        try {
            evaluation = evaluationRepository.saveAndFlush(evaluation);
        } catch (DataIntegrityViolationException e) {
            if (!violatesLessonUniqueness(e)) {
                throw e;
            }
            log.warn("Concurrent evaluation insert rejected for lesson {}", lessonId);
            throw new EvaluationAlreadyExistsException(lessonId);
        }

        log.info("Evaluation {} recorded for lesson {}: {} / {} points, {}",
                evaluation.getId(), lessonId, sheet.totalPoints(), sheet.maxPoints(), sheet.result());

        return SubmitEvaluationResponse.builder()
                .id(evaluation.getId())
                .lessonId(lessonId)
                .totalPoints(sheet.totalPoints())
                .maxPoints(sheet.maxPoints())
                .result(sheet.result())
                .build();
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public EvaluationDetailDto getEvaluation(Long evaluationId) {
        Evaluation evaluation = evaluationRepository.findDetailedById(evaluationId)
                .orElseThrow(() -> new ResourceNotFoundException("Evaluation", String.valueOf(evaluationId)));
        accessGate.requireView(evaluation.getLesson());
        return toDetailDto(evaluation);
    }

    @Transactional(readOnly = true)
    public EvaluationDetailDto getEvaluationByLesson(Long lessonId) {
        if (lessonId == null || lessonId <= 0) {
            throw new BusinessException("Lesson ID must be positive");
        }
        if (!lessonRepository.existsById(lessonId)) {
            throw new ResourceNotFoundException("Lesson", lessonId.toString());
        }
        Long evaluationId = evaluationRepository.findByLessonId(lessonId)
                .map(Evaluation::getId)
                .orElseThrow(() -> new ResourceNotFoundException("No evaluation recorded for lesson " + lessonId));
        return getEvaluation(evaluationId);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Long licenseOf(Lesson lesson) {
        Enrollment enrollment = lesson.getEnrollment();
        if (enrollment == null) {
            throw new ResourceNotFoundException("Lesson " + lesson.getId() + " has no enrollment");
        }
        if (enrollment.getLicense() == null) {
            throw new ResourceNotFoundException("Enrollment " + enrollment.getId() + " has no license assigned");
        }
        return enrollment.getLicense().getId();
    }

    private static boolean violatesLessonUniqueness(DataIntegrityViolationException e) {
        String constraint = e.getCause() instanceof ConstraintViolationException cve ? cve.getConstraintName() : null;
        return mentionsLessonConstraint(constraint) || mentionsLessonConstraint(e.getMostSpecificCause().getMessage());
    }

    private static boolean mentionsLessonConstraint(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(Evaluation.LESSON_UNIQUE_CONSTRAINT);
    }

    private static List<MistakeEntry> toEntries(List<SubmitEvaluationRequest.MistakeItem> items) {
        List<MistakeEntry> entries = new ArrayList<>();
        if (items == null) {
            return entries;
        }
        for (SubmitEvaluationRequest.MistakeItem item : items) {
            if (item == null || item.getItemId() == null || item.getCount() == null) {
                throw new BusinessException("Each mistake needs an itemId and a count");
            }
            entries.add(new MistakeEntry(item.getItemId(), item.getCount()));
        }
        return entries;
    }

    private EvaluationDetailDto toDetailDto(Evaluation evaluation) {
        Lesson lesson = evaluation.getLesson();
        Enrollment enrollment = lesson.getEnrollment();
        ExamTemplate template = evaluation.getTemplate();
        User instructor = enrollment.getInstructor();

        List<EvaluationDetailDto.MistakeBreakdown> breakdown = evaluation.getMistakes().stream()
                .map(m -> template.findItem(m.itemId())
                        .map(item -> toBreakdown(item, m.count()))
                        .orElse(null))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        return EvaluationDetailDto.builder()
                .id(evaluation.getId())
                .lessonId(lesson.getId())
                .lessonDate(lesson.getDate())
                .startTime(lesson.getStartTime())
                .endTime(lesson.getEndTime())
                .studentName(enrollment.getStudent().getDisplayName())
                .instructorName(instructor != null ? instructor.getDisplayName() : null)
                .totalPoints(evaluation.getTotalPoints())
                .maxPoints(template.getMaxPoints())
                .result(evaluation.getResult())
                .createdAt(evaluation.getCreatedAt())
                .finalizedAt(evaluation.getFinalizedAt())
                .mistakes(breakdown)
                .build();
    }

    private static EvaluationDetailDto.MistakeBreakdown toBreakdown(TemplateItem item, int count) {
        return EvaluationDetailDto.MistakeBreakdown.builder()
                .itemId(item.getId())
                .description(item.getDescription())
                .count(count)
                .penaltyPoints(item.getPenaltyPoints())
                .build();
    }
}
