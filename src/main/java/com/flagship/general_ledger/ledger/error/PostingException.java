package com.flagship.general_ledger.ledger.error;

import lombok.Getter;

/**
 * Thrown by {@code PostingResult.orElseThrow()} for callers that prefer
 * exceptions over inspecting the result.
 */
@Getter
public class PostingException extends RuntimeException {

    private final PostingError error;

    public PostingException(PostingError error) {
        super(error.getMessage(), error.getCause());
        this.error = error;
    }

    public PostingErrorCode getCode() {
        return error.getCode();
    }
}
