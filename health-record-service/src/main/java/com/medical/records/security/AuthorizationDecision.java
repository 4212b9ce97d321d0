package com.medical.records.security;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthorizationDecision {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null);

    private final boolean allowed;
    private final DenyReason reason;

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(DenyReason reason) {
        return new AuthorizationDecision(false, reason);
    }

    public enum DenyReason {
        NOT_AUTHORIZED
    }
}
