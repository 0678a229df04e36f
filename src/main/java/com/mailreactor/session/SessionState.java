package com.mailreactor.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one account session.
 * CLOSED is terminal and entered only when the account is removed.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    READY,
    BUSY,
    CLOSED;

    public boolean canMoveTo(SessionState next) {
        return allowedTargets().contains(next);
    }

    private Set<SessionState> allowedTargets() {
        switch (this) {
            case DISCONNECTED:
                return EnumSet.of(CONNECTING, CLOSED);
            case CONNECTING:
                return EnumSet.of(READY, DISCONNECTED, CLOSED);
            case READY:
                return EnumSet.of(BUSY, DISCONNECTED, CLOSED);
            case BUSY:
                return EnumSet.of(READY, DISCONNECTED, CLOSED);
            default:
                return EnumSet.noneOf(SessionState.class);
        }
    }
}
