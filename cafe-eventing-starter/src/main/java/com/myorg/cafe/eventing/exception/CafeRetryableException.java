package com.myorg.cafe.eventing.exception;

public class CafeRetryableException extends RuntimeException {
    public CafeRetryableException(String msg) { super(msg); }
    public CafeRetryableException(String msg, Throwable cause) { super(msg, cause); }
}
