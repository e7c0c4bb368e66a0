package com.chatrelay.server.handler;

public enum ConnectionState {
    AWAITING_JOIN,
    ACTIVE,
    CLOSED
}
