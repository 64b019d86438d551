package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.ledger.VoucherRef;
import org.slf4j.MDC;

/**
 * Thread-local logging context for a posting.
 *
 * Callers may set a correlation ID before posting; the engine adds the
 * voucher being posted. All keys end up in the MDC so every log line of a
 * posting can be traced back to its voucher and request.
 */
public final class PostingContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String VOUCHER_TYPE_MDC_KEY = "voucherType";
    public static final String VOUCHER_NO_MDC_KEY = "voucherNo";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private PostingContext() {
        // Utility class
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.remove();
        }
    }

    public static String getCorrelationId() {
        return correlationId.get();
    }

    /**
     * Clears the correlation ID. Should be called when the caller's unit of work ends.
     */
    public static void clear() {
        correlationId.remove();
    }

    public static void begin(VoucherRef voucher) {
        MDC.put(VOUCHER_TYPE_MDC_KEY, voucher.getVoucherType());
        MDC.put(VOUCHER_NO_MDC_KEY, voucher.getVoucherNo());
        String id = correlationId.get();
        if (id != null) {
            MDC.put(CORRELATION_ID_MDC_KEY, id);
        }
    }

    public static void end() {
        MDC.remove(VOUCHER_TYPE_MDC_KEY);
        MDC.remove(VOUCHER_NO_MDC_KEY);
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }
}
