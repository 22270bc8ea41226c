package com.nei10u.bazi.exception;

/**
 * 输入不合法（日期、时间、性别等），在生成任何结果之前抛出。
 */
public class InvalidInputException extends BaziException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
