package uk.gegc.members.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging context for member reconciliation with Stripe.
 * Provides consistent logging fields across all reconciliation operations.
 */
@Data
@Builder(toBuilder = true)
public class ReconciliationLoggingContext {
    private String operation;
    private UUID memberId;
    private String customerId;
    private String subscriptionId;

    public void setMDC() {
        if (operation != null) MDC.put("reconciliation_operation", operation);
        if (memberId != null) MDC.put("member_id", memberId.toString());
        if (customerId != null) MDC.put("stripe_customer_id", customerId);
        if (subscriptionId != null) MDC.put("stripe_subscription_id", subscriptionId);
    }

    public static void clearMDC() {
        MDC.remove("reconciliation_operation");
        MDC.remove("member_id");
        MDC.remove("stripe_customer_id");
        MDC.remove("stripe_subscription_id");
    }

    public ReconciliationLoggingContext withCustomer(String customerId) {
        return toBuilder().customerId(customerId).build();
    }

    public ReconciliationLoggingContext withSubscription(String subscriptionId) {
        return toBuilder().subscriptionId(subscriptionId).build();
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
