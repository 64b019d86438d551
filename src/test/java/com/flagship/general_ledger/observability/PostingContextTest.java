package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.ledger.VoucherRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class PostingContextTest {

    @AfterEach
    void tearDown() {
        PostingContext.end();
        PostingContext.clear();
    }

    @Test
    @DisplayName("Voucher and correlation ID are put in the MDC for the posting")
    void beginAndEnd() {
        PostingContext.setCorrelationId("req-42");

        PostingContext.begin(new VoucherRef("Journal Entry", "JV-9", "Acme Ltd"));

        assertEquals("Journal Entry", MDC.get(PostingContext.VOUCHER_TYPE_MDC_KEY));
        assertEquals("JV-9", MDC.get(PostingContext.VOUCHER_NO_MDC_KEY));
        assertEquals("req-42", MDC.get(PostingContext.CORRELATION_ID_MDC_KEY));

        PostingContext.end();

        assertNull(MDC.get(PostingContext.VOUCHER_NO_MDC_KEY));
        assertNull(MDC.get(PostingContext.CORRELATION_ID_MDC_KEY));
        assertEquals("req-42", PostingContext.getCorrelationId());
    }

    @Test
    @DisplayName("Blank correlation ID clears the current one")
    void blankCorrelationId() {
        PostingContext.setCorrelationId("req-1");
        PostingContext.setCorrelationId(" ");

        assertNull(PostingContext.getCorrelationId());
    }
}
