package com.driveflow.crm.modules.evaluation.access;

import com.driveflow.crm.exception.ResourceNotFoundException;
import com.driveflow.crm.exception.UnauthorizedAccessException;
import com.driveflow.crm.modules.enrollment.Enrollment;
import com.driveflow.crm.modules.enrollment.EnrollmentRepository;
import com.driveflow.crm.modules.lesson.Lesson;
import com.driveflow.crm.modules.user.User;
import com.driveflow.crm.security.AuthenticatedUser;
import com.driveflow.crm.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Builds the access context for a target that has already been resolved and
 * enforces {@link EvaluationAccessPolicy}. Throws
 * {@link UnauthorizedAccessException} on denial.
 */
@Component
@RequiredArgsConstructor
public class EvaluationAccessGate {

    private final EvaluationAccessPolicy policy;
    private final EnrollmentRepository enrollmentRepository;
    private final SecurityUtils securityUtils;

    public void requireSubmit(Lesson lesson) {
        if (!policy.canSubmit(securityUtils.getCurrentUser(), contextOf(lesson))) {
            throw new UnauthorizedAccessException("Only the lesson's assigned instructor can submit its evaluation");
        }
    }

    public void requireView(Lesson lesson) {
        if (!policy.canView(securityUtils.getCurrentUser(), contextOf(lesson))) {
            throw new UnauthorizedAccessException("You are not allowed to view this evaluation");
        }
    }

    public void requireHistory(User student) {
        AuthenticatedUser caller = securityUtils.getCurrentUser();
        if (!policy.canViewHistory(caller, historyContextOf(caller, student))) {
            throw new UnauthorizedAccessException("You are not allowed to view this student's evaluations");
        }
    }

    static AccessContext contextOf(Lesson lesson) {
        Enrollment enrollment = lesson.getEnrollment();
        if (enrollment == null) {
            throw new ResourceNotFoundException("Lesson " + lesson.getId() + " has no enrollment");
        }
        User instructor = enrollment.getInstructor();
        return new AccessContext(
                enrollment.getStudent().getId(),
                instructor != null ? instructor.getId() : null,
                enrollment.getAutoSchoolId());
    }

    private StudentAccessContext historyContextOf(AuthenticatedUser caller, User student) {
        boolean teaches = false;
        if (User.Role.INSTRUCTOR.name().equals(caller.getRole())) {
            UUID callerId = securityUtils.getCurrentUserId();
            teaches = enrollmentRepository.existsByStudentIdAndInstructorId(student.getId(), callerId);
        }
        return new StudentAccessContext(student.getId(), student.getAutoSchoolId(), teaches);
    }
}
