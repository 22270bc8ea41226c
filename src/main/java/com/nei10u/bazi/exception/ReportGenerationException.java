package com.nei10u.bazi.exception;

public class ReportGenerationException extends BaziException {

    public ReportGenerationException(String message) {
        super(message);
    }

    public ReportGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
