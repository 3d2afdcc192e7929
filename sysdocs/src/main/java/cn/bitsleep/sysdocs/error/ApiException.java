package cn.bitsleep.sysdocs.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for failures that map onto a client-visible HTTP status.
 * Messages of these exceptions are safe to echo back to the caller.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
