package com.driveflow.crm.modules.evaluation.access;

import java.util.UUID;

/**
 * Facts needed to decide who may read a student's history.
 *
 * @param callerTeachesStudent true when some enrollment links the caller as
 *                             instructor to this student
 */
public record StudentAccessContext(UUID studentId, Long schoolId, boolean callerTeachesStudent) {
}
