package com.driveflow.crm.modules.evaluation.access;

import java.util.UUID;

/**
 * Ownership facts about a lesson's enrollment, resolved once per request.
 *
 * @param studentId    the enrollment's student
 * @param instructorId the assigned instructor, null while unassigned
 * @param schoolId     the driving school the enrollment belongs to
 */
public record AccessContext(UUID studentId, UUID instructorId, Long schoolId) {
}
