package uk.gegc.members.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://members.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI MEMBER_NOT_FOUND = URI.create(BASE_URL + "/member-not-found");
    public static final URI MEMBER_ALREADY_EXISTS = URI.create(BASE_URL + "/member-already-exists");
    public static final URI SUBSCRIPTION_NOT_FOUND = URI.create(BASE_URL + "/subscription-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Billing Errors ====================
    public static final URI STRIPE_NOT_CONFIGURED = URI.create(BASE_URL + "/stripe-not-configured");
    public static final URI UNLINKED_CUSTOMER = URI.create(BASE_URL + "/unlinked-customer");
    public static final URI CUSTOMER_ALREADY_LINKED = URI.create(BASE_URL + "/customer-already-linked");
    public static final URI COMPLIMENTARY_PLAN_NOT_FOUND = URI.create(BASE_URL + "/complimentary-plan-not-found");
    public static final URI STRIPE_ERROR = URI.create(BASE_URL + "/stripe-error");

    // ==================== Generic Errors ====================
    public static final URI DATA_INTEGRITY_VIOLATION = URI.create(BASE_URL + "/data-integrity-violation");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
