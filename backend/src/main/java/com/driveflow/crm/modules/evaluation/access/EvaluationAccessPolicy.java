package com.driveflow.crm.modules.evaluation.access;

import com.driveflow.crm.modules.user.User;
import com.driveflow.crm.security.AuthenticatedUser;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.UUID;

/**
 * Role x relationship table for evaluations. Pure functions of the caller and an
 * already resolved context; anything not matched is denied.
 */
@Component
public class EvaluationAccessPolicy {

    public boolean canSubmit(AuthenticatedUser caller, AccessContext context) {
        return isRole(caller, User.Role.INSTRUCTOR) && isSameUser(caller, context.instructorId());
    }

    public boolean canView(AuthenticatedUser caller, AccessContext context) {
        if (isRole(caller, User.Role.INSTRUCTOR)) {
            return isSameUser(caller, context.instructorId());
        }
        if (isRole(caller, User.Role.STUDENT)) {
            return isSameUser(caller, context.studentId());
        }
        if (isRole(caller, User.Role.SCHOOL_ADMIN)) {
            return isSameSchool(caller, context.schoolId());
        }
        return false;
    }

    public boolean canViewHistory(AuthenticatedUser caller, StudentAccessContext context) {
        if (isRole(caller, User.Role.INSTRUCTOR)) {
            return context.callerTeachesStudent();
        }
        if (isRole(caller, User.Role.STUDENT)) {
            return isSameUser(caller, context.studentId());
        }
        if (isRole(caller, User.Role.SCHOOL_ADMIN)) {
            return isSameSchool(caller, context.schoolId());
        }
        return false;
    }

    private static boolean isRole(AuthenticatedUser caller, User.Role role) {
        return role.name().equals(caller.getRole());
    }

    private static boolean isSameUser(AuthenticatedUser caller, UUID userId) {
        return userId != null && userId.equals(parseId(caller.getId()));
    }

    private static boolean isSameSchool(AuthenticatedUser caller, Long schoolId) {
        return schoolId != null && Objects.equals(caller.getSchoolId(), schoolId);
    }

    private static UUID parseId(String id) {
        if (id == null) {
            return null;
        }
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            // subject is not one of our user ids, so it can match nothing
            return null;
        }
    }
}
