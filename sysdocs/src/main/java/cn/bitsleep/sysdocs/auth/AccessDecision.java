package cn.bitsleep.sysdocs.auth;

import org.springframework.http.HttpStatus;

public enum AccessDecision {
    ALLOWED(HttpStatus.OK),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN);

    public final HttpStatus status;
    AccessDecision(HttpStatus status) { this.status = status; }

    public boolean isAllowed() { return this == ALLOWED; }
}
