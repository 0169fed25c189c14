package com.hostledger.rentals.notify;

import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.streaming.api.functions.sink.RichSinkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hostledger.rentals.model.RentalLifecycleEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands lifecycle events to the {@link WebhookNotifier}. Delivery is asynchronous; a failing
 * webhook never fails the job.
 */
public class WebhookNotificationSink extends RichSinkFunction<RentalLifecycleEvent> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(WebhookNotificationSink.class);

    private final List<NotificationTarget> targets;
    private final WebhookNotifier.Settings settings;
    private transient WebhookNotifier notifier;
    private transient Counter dispatchedCounter;

    public WebhookNotificationSink(List<NotificationTarget> targets, WebhookNotifier.Settings settings) {
        this.targets = new ArrayList<>(targets);
        this.settings = settings;
    }

    @Override
    public void open(Configuration parameters) {
        this.notifier = new WebhookNotifier(targets, settings);
        this.dispatchedCounter = getRuntimeContext().getMetricGroup()
                .addGroup("rental_monitor")
                .counter("notifications_dispatched");
        LOG.info("Webhook notifier initialized (targets={}, maxAttempts={})", targets, settings.maxAttempts);
    }

    @Override
    public void invoke(RentalLifecycleEvent event, Context context) {
        dispatchedCounter.inc(notifier.dispatch(event).size());
    }

    @Override
    public void close() {
        if (notifier != null) {
            notifier.close();
        }
    }
}
