package cn.bitsleep.sysdocs.web;

import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON body shared by every error response.
 */
public final class ErrorBody {

    private ErrorBody() {}

    public static Map<String, Object> of(Instant timestamp, HttpStatus status, String code, String message, Map<String, String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", timestamp.toString());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        if (details != null && !details.isEmpty()) body.put("details", details);
        return body;
    }
}
