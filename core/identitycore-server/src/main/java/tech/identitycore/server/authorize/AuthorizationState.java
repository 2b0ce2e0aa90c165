package tech.identitycore.server.authorize;

/**
 * Lifecycle of a single authorization request.
 *
 * <pre>
 * RECEIVED -> VALIDATED -> AUTHENTICATED -> CODE_ISSUED
 *     |           |
 *     +-----------+-------> REJECTED
 * </pre>
 */
public enum AuthorizationState {
    RECEIVED,
    VALIDATED,
    AUTHENTICATED,
    CODE_ISSUED,
    REJECTED;

    public boolean canTransitionTo(AuthorizationState next) {
        return switch (this) {
            case RECEIVED -> next == VALIDATED || next == REJECTED;
            case VALIDATED -> next == AUTHENTICATED || next == REJECTED;
            case AUTHENTICATED -> next == CODE_ISSUED;
            case CODE_ISSUED, REJECTED -> false;
        };
    }

    public boolean isTerminal() {
        return this == CODE_ISSUED || this == REJECTED;
    }
}
