package com.nei10u.bazi.exception;

public class ResultWriteException extends BaziException {

    public ResultWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
