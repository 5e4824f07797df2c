package com.projectgroup5.blobarena.service;

/**
 * 握手校验失败：名字非法、重名或服务器已满
 */
public class ValidationException extends Exception {

    public enum Reason {
        INVALID_NAME,
        NAME_TAKEN,
        SERVER_FULL
    }

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
