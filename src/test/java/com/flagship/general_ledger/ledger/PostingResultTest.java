package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.ledger.error.PostingError;
import com.flagship.general_ledger.ledger.error.PostingErrorCode;
import com.flagship.general_ledger.ledger.error.PostingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class PostingResultTest {

    @Test
    @DisplayName("First failure short-circuits later steps")
    void failureShortCircuits() {
        AtomicBoolean laterStepRan = new AtomicBoolean(false);

        PostingResult<Integer> result = PostingResult.success(1)
            .flatMap(v -> PostingResult.<Integer>failure(PostingError.invalidBatch("boom")))
            .map(v -> {
                laterStepRan.set(true);
                return v + 1;
            });

        assertTrue(result.isFailure());
        assertFalse(laterStepRan.get());
        assertEquals(PostingErrorCode.INVALID_BATCH, result.getError().getCode());
        assertEquals("boom", result.getError().getMessage());
    }

    @Test
    @DisplayName("Successful chain carries the value through")
    void successChain() {
        PostingResult<String> result = PostingResult.success(2)
            .map(v -> v * 21)
            .flatMap(v -> PostingResult.success("answer=" + v));

        assertTrue(result.isSuccess());
        assertEquals("answer=42", result.getValue());
        assertTrue(result.error().isEmpty());
    }

    @Test
    @DisplayName("Accessing the wrong side throws")
    void wrongSideAccess() {
        PostingResult<String> failure = PostingResult.failure(PostingError.invalidBatch("bad"));

        assertThrows(IllegalStateException.class, failure::getValue);
        assertThrows(IllegalStateException.class, () -> PostingResult.success("x").getError());
    }

    @Test
    @DisplayName("orElseThrow raises a PostingException with the error")
    void orElseThrow() {
        PostingResult<String> failure = PostingResult.failure(PostingError.accountFrozen("Cash"));

        PostingException exception = assertThrows(PostingException.class, failure::orElseThrow);

        assertEquals(PostingErrorCode.ACCOUNT_FROZEN, exception.getCode());
        assertEquals("Cash", exception.getError().detail("account"));
        assertEquals("ok", PostingResult.success("ok").orElseThrow());
    }

    @Test
    @DisplayName("onFailure runs only for failures")
    void onFailure() {
        AtomicBoolean called = new AtomicBoolean(false);

        PostingResult.success("x").onFailure(e -> called.set(true));
        assertFalse(called.get());

        PostingResult.failure(PostingError.invalidBatch("bad")).onFailure(e -> called.set(true));
        assertTrue(called.get());
    }

    @Test
    @DisplayName("failure requires an error")
    void failureRequiresError() {
        assertThrows(NullPointerException.class, () -> PostingResult.failure(null));
    }
}
