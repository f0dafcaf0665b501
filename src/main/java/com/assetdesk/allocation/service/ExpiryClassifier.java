package com.assetdesk.allocation.service;

/**
 * Maps days-until-expiry to an {@link AlertSeverity}.
 *
 * <pre>
 *   days &lt;= 0   EXPIRED
 *   1 .. 7      CRITICAL
 *   8 .. 30     WARNING
 *   &gt; 30        INFO
 * </pre>
 *
 * Whether an INFO alert is emitted at all is the scanner's decision (horizon), not this class's.
 */
public final class ExpiryClassifier {

    public static final int CRITICAL_THRESHOLD_DAYS = 7;
    public static final int WARNING_THRESHOLD_DAYS = 30;

    private ExpiryClassifier() {}

    public static AlertSeverity classify(long daysUntilExpiry) {
        if (daysUntilExpiry <= 0) {
            return AlertSeverity.EXPIRED;
        }
        if (daysUntilExpiry <= CRITICAL_THRESHOLD_DAYS) {
            return AlertSeverity.CRITICAL;
        }
        if (daysUntilExpiry <= WARNING_THRESHOLD_DAYS) {
            return AlertSeverity.WARNING;
        }
        return AlertSeverity.INFO;
    }
}
