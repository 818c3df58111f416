package com.driveflow.crm.modules.evaluation;

public enum EvaluationResult {
    OK, FAILED;

    /** A sheet passes while its penalty total stays within the template budget. */
    public static EvaluationResult of(int totalPoints, int maxPoints) {
        return totalPoints <= maxPoints ? OK : FAILED;
    }
}
