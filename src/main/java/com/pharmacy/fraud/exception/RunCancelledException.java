package com.pharmacy.fraud.exception;

public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
