package org.tfregistry.webserver.generic.dto.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorMessageResponse {
    private final String error;
    private final String errorCode;
    private final int status;
    private final Instant timestamp;

    public ErrorMessageResponse(String error, String errorCode, HttpStatus status) {
        this.error = error;
        this.errorCode = errorCode;
        this.status = status.value();
        this.timestamp = Instant.now();
    }

    public String getError() {
        return error;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
