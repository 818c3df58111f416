package com.driveflow.crm.modules.evaluation;

import com.driveflow.crm.exception.BusinessException;
import com.driveflow.crm.exception.ResourceNotFoundException;
import com.driveflow.crm.modules.evaluation.access.EvaluationAccessGate;
import com.driveflow.crm.modules.evaluation.dto.EvaluationHistoryItemDto;
import com.driveflow.crm.modules.evaluation.dto.PagedResult;
import com.driveflow.crm.modules.user.User;
import com.driveflow.crm.modules.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Lists a student's evaluations, newest lesson first.
 *
 * Paging is 1-based; {@code pageSize} is capped at {@value #MAX_PAGE_SIZE}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationHistoryService {

    public static final int MAX_PAGE_SIZE = 100;

    // Open bounds are replaced by dates outside any lesson calendar
    private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final EvaluationRepository evaluationRepository;
    private final UserRepository userRepository;
    private final EvaluationAccessGate accessGate;

    @Transactional(readOnly = true)
    public PagedResult<EvaluationHistoryItemDto> listStudentEvaluations(UUID studentId, LocalDate from,
            LocalDate to, int page, int pageSize) {
        if (page < 1) {
            throw new BusinessException("Page must be at least 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new BusinessException("PageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new BusinessException("'from' must not be after 'to'");
        }

        User student = userRepository.findById(studentId)
                .filter(u -> u.getRole() == User.Role.STUDENT)
                .orElseThrow(() -> new ResourceNotFoundException("Student", studentId.toString()));

        accessGate.requireHistory(student);

        LocalDate lower = from != null ? from : EARLIEST;
        LocalDate upper = to != null ? to : LATEST;

        // Offsets beyond int range cannot hold any row; answer with the total alone
        if ((long) (page - 1) * pageSize > Integer.MAX_VALUE) {
            long total = evaluationRepository.countByStudentIdBetween(studentId, lower, upper);
            return new PagedResult<>(page, pageSize, total, List.of());
        }

        Page<Evaluation> result = evaluationRepository.findPageByStudentIdBetween(studentId, lower, upper,
                PageRequest.of(page - 1, pageSize));

        log.debug("History for student {}: page {} of size {}, {} total", studentId, page, pageSize,
                result.getTotalElements());

        return new PagedResult<>(page, pageSize, result.getTotalElements(),
                result.getContent().stream().map(this::toItem).toList());
    }

    private EvaluationHistoryItemDto toItem(Evaluation evaluation) {
        return EvaluationHistoryItemDto.builder()
                .id(evaluation.getId())
                .lessonId(evaluation.getLesson().getId())
                .date(evaluation.getLesson().getDate())
                .totalPoints(evaluation.getTotalPoints())
                .maxPoints(evaluation.getTemplate().getMaxPoints())
                .result(evaluation.getResult())
                .build();
    }
}
