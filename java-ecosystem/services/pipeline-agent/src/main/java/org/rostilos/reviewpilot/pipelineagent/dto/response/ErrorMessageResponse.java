package org.rostilos.reviewpilot.pipelineagent.dto.response;

import org.springframework.http.HttpStatus;

import java.time.Instant;

public class ErrorMessageResponse {
    private final String error;
    private final int status;
    private final Instant timestamp;

    public ErrorMessageResponse(String error, HttpStatus status) {
        this.error = error;
        this.status = status.value();
        this.timestamp = Instant.now();
    }

    public String getError() {
        return error;
    }

    public int getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
