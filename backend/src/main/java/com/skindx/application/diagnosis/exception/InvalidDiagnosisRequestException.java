package com.skindx.application.diagnosis.exception;

public class InvalidDiagnosisRequestException extends IllegalArgumentException {
    public InvalidDiagnosisRequestException(String message) {
        super(message);
    }
}
