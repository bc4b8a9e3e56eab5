package io.authrelay.registry;

import io.authrelay.host.ContractException;

public class AuthorizationError extends ContractException {
    public enum Reason {
        UNAUTHORIZED("Unauthorized"),
        OWNERSHIP("Ownership error"),
        EMPTY_LABEL("Label can't be empty"),
        LABEL_ALREADY_EXISTS("Label already exists"),
        NO_FUNCTIONS("Subroutine has no functions"),
        DIFFERENT_FUNCTION_DOMAINS("All functions of a subroutine must target the same domain"),
        PERMISSIONLESS_WITH_HIGH_PRIORITY("Permissionless authorizations can't have high priority"),
        INVALID_CONCURRENCY_LIMIT("Max concurrent executions must be at least 1"),
        DOMAIN_NOT_REGISTERED("Domain is not registered"),
        DOMAIN_ALREADY_REGISTERED("Domain already registered"),
        AUTHORIZATION_DOES_NOT_EXIST("Authorization does not exist"),
        AUTHORIZATION_DISABLED("Authorization is disabled"),
        NOT_YET_VALID("Authorization is not valid yet"),
        EXPIRED("Authorization has expired"),
        CANNOT_MINT_FOR_PERMISSIONLESS("Can't mint tokens for a permissionless authorization"),
        NO_PERMISSION_TOKEN("Caller holds no permission token"),
        MAX_CONCURRENT_EXECUTIONS_REACHED("Max concurrent executions reached"),
        INVALID_AMOUNT("Invalid message: number of messages does not match the subroutine"),
        INVALID_TYPE("Invalid message: message type does not match"),
        INVALID_JSON("Invalid message: Invalid JSON passed"),
        INVALID_STRUCTURE("Invalid message: expected a JSON object with a single top-level key"),
        DOES_NOT_MATCH("Invalid message: top-level key does not match the function"),
        INVALID_MESSAGE_PARAMS("Invalid message: parameter restrictions not satisfied"),
        EXECUTION_NOT_FOUND("Execution id does not exist"),
        NOT_RETRIABLE("Execution can't be retried");

        private final String text;

        Reason(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }

    private final Reason reason;

    public AuthorizationError(Reason reason) {
        this(reason, null);
    }

    public AuthorizationError(Reason reason, String detail) {
        super("Authorization error: " + reason.text + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
