package com.gatehouse.api.error;

import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

/**
 * A handler failure that maps directly onto an HTTP status and an {@link ApiError} body.
 */
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final ApiError error;
    private final HttpHeaders headers;

    public ApiException(HttpStatus status, ApiError error) {
        this(status, error, HttpHeaders.EMPTY, null);
    }

    public ApiException(HttpStatus status, ApiError error, HttpHeaders headers, Throwable cause) {
        super(error.msg(), cause);
        this.status = status;
        this.error = error;
        this.headers = headers;
    }

    public static ApiException notFound(String msg, Object input) {
        return new ApiException(HttpStatus.NOT_FOUND, ApiError.of(ErrorType.NOT_FOUND, msg, input));
    }

    public static ApiException invalidRequest(String msg, Object input, Object ctx) {
        return new ApiException(HttpStatus.UNPROCESSABLE_ENTITY, ApiError.of(ErrorType.INVALID_REQUEST, msg, input, ctx));
    }

    /** A storage failure. The context names the failing exception type, never its message. */
    public static ApiException database(String msg, Object input, Throwable cause) {
        ApiError error = ApiError.of(ErrorType.DATABASE, msg, input,
                cause == null ? null : Map.of("error", rootCause(cause).getClass().getSimpleName()));
        return new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, error, HttpHeaders.EMPTY, cause);
    }

    public static ApiException unauthorized(String msg, String challenge) {
        HttpHeaders headers = new HttpHeaders();
        if (challenge != null) {
            headers.set(HttpHeaders.WWW_AUTHENTICATE, challenge);
        }
        return new ApiException(HttpStatus.UNAUTHORIZED, ApiError.of(ErrorType.UNAUTHORIZED, msg), headers, null);
    }

    public HttpStatus status() {
        return status;
    }

    public ApiError error() {
        return error;
    }

    public HttpHeaders headers() {
        return headers;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
