package com.docsight.research.exception;

/**
 * 리서치 엔진 예외 기본 클래스
 */
public class ResearchException extends RuntimeException {

    private final String errorCode;

    public ResearchException(String message) {
        super(message);
        this.errorCode = "RESEARCH_ERROR";
    }

    public ResearchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ResearchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
