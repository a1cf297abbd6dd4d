package com.example.jobsync.service.alert;

/**
 * Outbound notification channel. Best-effort and fire-and-forget: implementations
 * must not throw and must not block the caller on delivery.
 */
public interface Notifier {

    void notify(String eventName, String message);
}
