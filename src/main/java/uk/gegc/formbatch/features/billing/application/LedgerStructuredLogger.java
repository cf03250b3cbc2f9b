package uk.gegc.formbatch.features.billing.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Emits one ledger log line with the write's key fields in MDC so that log shipping can
 * index them. MDC entries are cleared again before returning.
 */
public final class LedgerStructuredLogger {

    private LedgerStructuredLogger() {
    }

    public static void logLedgerWrite(Logger logger, String message,
                                      UUID accountId, String txType, long amount,
                                      String reservationId, long monthlyAfter, long rolloverAfter, long topupAfter,
                                      Object... args) {
        MDC.put("ledger.accountId", accountId != null ? accountId.toString() : null);
        MDC.put("ledger.txType", txType);
        MDC.put("ledger.amount", String.valueOf(amount));
        MDC.put("ledger.reservationId", reservationId);
        MDC.put("ledger.balanceAfterMonthly", String.valueOf(monthlyAfter));
        MDC.put("ledger.balanceAfterRollover", String.valueOf(rolloverAfter));
        MDC.put("ledger.balanceAfterTopup", String.valueOf(topupAfter));
        try {
            logger.info(message, args);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void logRejection(Logger logger, String message, UUID accountId, String operation,
                                    long amount, Object... args) {
        MDC.put("ledger.accountId", accountId != null ? accountId.toString() : null);
        MDC.put("ledger.operation", operation);
        MDC.put("ledger.amount", String.valueOf(amount));
        try {
            logger.warn(message, args);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void clearLedgerMDC() {
        MDC.remove("ledger.accountId");
        MDC.remove("ledger.txType");
        MDC.remove("ledger.amount");
        MDC.remove("ledger.reservationId");
        MDC.remove("ledger.balanceAfterMonthly");
        MDC.remove("ledger.balanceAfterRollover");
        MDC.remove("ledger.balanceAfterTopup");
        MDC.remove("ledger.operation");
    }
}
