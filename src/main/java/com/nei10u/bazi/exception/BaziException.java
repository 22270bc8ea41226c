package com.nei10u.bazi.exception;

public class BaziException extends RuntimeException {

    public BaziException(String message) {
        super(message);
    }

    public BaziException(String message, Throwable cause) {
        super(message, cause);
    }
}
