package cn.bitsleep.sysdocs.error;

import org.springframework.http.HttpStatus;

public class UnauthenticatedException extends ApiException {

    public UnauthenticatedException() {
        this("UNAUTHENTICATED", "Unauthorized");
    }

    public UnauthenticatedException(String code, String message) {
        super(HttpStatus.UNAUTHORIZED, code, message);
    }
}
