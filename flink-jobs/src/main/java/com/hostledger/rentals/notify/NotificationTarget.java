package com.hostledger.rentals.notify;

import com.hostledger.rentals.model.LifecycleEventType;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A webhook endpoint that receives formatted lifecycle notifications.
 *
 * <p>{@link #events} holds the subscribed event keys ({@code rental_start}, {@code rental_end},
 * {@code rental_pause}, {@code rental_resume}, {@code error}, {@code recovery}); an empty set
 * subscribes to everything.</p>
 */
public class NotificationTarget implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String EVENT_RENTAL_START = "rental_start";
    public static final String EVENT_RENTAL_END = "rental_end";
    public static final String EVENT_RENTAL_PAUSE = "rental_pause";
    public static final String EVENT_RENTAL_RESUME = "rental_resume";
    public static final String EVENT_ERROR = "error";
    public static final String EVENT_RECOVERY = "recovery";

    public static final Set<String> VALID_EVENTS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            EVENT_RENTAL_START,
            EVENT_RENTAL_END,
            EVENT_RENTAL_PAUSE,
            EVENT_RENTAL_RESUME,
            EVENT_ERROR,
            EVENT_RECOVERY)));

    public String name;
    public String url;
    public boolean enabled = true;
    public Set<String> events = new LinkedHashSet<>();

    public NotificationTarget() {}

    public NotificationTarget(String name, String url) {
        this.name = name;
        this.url = url;
    }

    public boolean accepts(LifecycleEventType type) {
        if (!enabled) {
            return false;
        }
        return events == null || events.isEmpty() || events.contains(eventKey(type));
    }

    public static String eventKey(LifecycleEventType type) {
        switch (type) {
            case START:
                return EVENT_RENTAL_START;
            case END:
                return EVENT_RENTAL_END;
            case PAUSE:
                return EVENT_RENTAL_PAUSE;
            case RESUME:
                return EVENT_RENTAL_RESUME;
            case MACHINE_ERROR:
                return EVENT_ERROR;
            case MACHINE_RECOVERY:
                return EVENT_RECOVERY;
            default:
                throw new IllegalArgumentException("Unknown event type: " + type);
        }
    }

    @Override
    public String toString() {
        return "NotificationTarget{name=" + name + ", enabled=" + enabled + ", events=" + events + "}";
    }
}
