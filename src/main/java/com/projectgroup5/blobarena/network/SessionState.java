package com.projectgroup5.blobarena.network;

/**
 * 会话生命周期：CONNECTING → AUTHENTICATING → ACTIVE → DISCONNECTING → CLOSED
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATING,
    ACTIVE,
    DISCONNECTING,
    CLOSED
}
