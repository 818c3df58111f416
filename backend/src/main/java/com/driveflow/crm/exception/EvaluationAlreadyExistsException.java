package com.driveflow.crm.exception;

public class EvaluationAlreadyExistsException extends RuntimeException {

    public EvaluationAlreadyExistsException(Long lessonId) {
        super("An evaluation already exists for lesson " + lessonId);
    }
}
