package com.secondhand.host;

/**
 * Notification severity, mapped by the host onto its own notification styles.
 */
public enum Severity {
    INFO,
    OK,
    WARNING,
    CRITICAL
}
