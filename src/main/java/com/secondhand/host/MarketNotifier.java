package com.secondhand.host;

import com.secondhand.error.MarketError;
import com.secondhand.error.OperationResult;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Front for the host's {@link NotificationSink} that also turns failed operations into
 * owner notifications.
 */
@Slf4j
@Singleton
public class MarketNotifier {

    private final NotificationSink sink;

    @Inject
    public MarketNotifier(NotificationSink sink) {
        this.sink = sink;
    }

    public void info(String ownerId, String message) {
        sink.notify(ownerId, message, Severity.INFO);
    }

    public void ok(String ownerId, String message) {
        sink.notify(ownerId, message, Severity.OK);
    }

    public void warning(String ownerId, String message) {
        sink.notify(ownerId, message, Severity.WARNING);
    }

    public void critical(String ownerId, String message) {
        sink.notify(ownerId, message, Severity.CRITICAL);
    }

    /**
     * Notify {@code ownerId} about a failed result and hand the result back.
     */
    public <T> OperationResult<T> reject(String ownerId, OperationResult<T> result) {
        MarketError error = result.getError();
        if (error == null) {
            return result;
        }
        log.debug("Rejected for {}: {} - {}", ownerId, error.getKind(), error.getMessage());
        switch (error.getKind()) {
            case FUNDS:
                critical(ownerId, error.getMessage());
                break;
            case RACE:
            case VALIDATION:
            default:
                warning(ownerId, error.getMessage());
                break;
        }
        return result;
    }
}
