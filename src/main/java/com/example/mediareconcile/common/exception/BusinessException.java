package com.example.mediareconcile.common.exception;

public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public static BusinessException unknownCategory(String categoryKey) {
        return new BusinessException("404", "Unknown category: " + categoryKey,
                "Use one of the configured category keys");
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
