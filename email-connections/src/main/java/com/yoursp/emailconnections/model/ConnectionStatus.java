package com.yoursp.emailconnections.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an email connection.
 *
 * <pre>
 * active  → expired | error | revoked | archived
 * expired → active | error | revoked | archived
 * error   → active | revoked | archived
 * revoked, archived: terminal
 * </pre>
 *
 * Self-transitions are allowed for the three live states (a refresh keeps an
 * active connection active, a repeated failure keeps it in error).
 */
public enum ConnectionStatus {

    ACTIVE("active"),
    EXPIRED("expired"),
    ERROR("error"),
    REVOKED("revoked"),
    ARCHIVED("archived");

    /** States from which a token refresh may be attempted. */
    public static final Set<ConnectionStatus> REFRESHABLE = EnumSet.of(ACTIVE, EXPIRED, ERROR);

    private final String value;

    ConnectionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == REVOKED || this == ARCHIVED;
    }

    public boolean canTransitionTo(ConnectionStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case ACTIVE, EXPIRED -> true;
            case ERROR -> target != EXPIRED;
            default -> false;
        };
    }

    @JsonCreator
    public static ConnectionStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ConnectionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown connection status: " + value);
    }
}
