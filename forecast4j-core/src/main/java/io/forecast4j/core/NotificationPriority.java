package io.forecast4j.core;

public enum NotificationPriority {
    LOW,
    DEFAULT,
    HIGH
}
