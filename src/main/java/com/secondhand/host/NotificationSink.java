package com.secondhand.host;

public interface NotificationSink {

    void notify(String ownerId, String message, Severity severity);
}
