package com.hostledger.rentals.notify;

import java.io.Serializable;

/**
 * Rendered notification, posted as {@code {"title":..,"body":..,"event":..}}.
 */
public class NotificationMessage implements Serializable {
    private static final long serialVersionUID = 1L;

    public String title;
    public String body;
    public String event;

    public NotificationMessage() {}

    public NotificationMessage(String title, String body, String event) {
        this.title = title;
        this.body = body;
        this.event = event;
    }
}
