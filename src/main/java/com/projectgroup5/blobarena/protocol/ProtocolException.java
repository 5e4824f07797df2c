package com.projectgroup5.blobarena.protocol;

import java.io.IOException;

/**
 * 帧或负载不合法：长度越界、JSON 损坏、未知类型、状态不允许的包
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
