package com.stocktracker.kr.notify;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Queues events until the caller drains them, e.g. to send one digest at the end of a cycle.
 * Optionally forwards every event to another sink as it arrives.
 */
public final class BufferedNotificationSink implements NotificationSink {
    private final ConcurrentLinkedQueue<PortfolioEvent> queue = new ConcurrentLinkedQueue<>();
    private final NotificationSink forward;

    public BufferedNotificationSink() {
        this(null);
    }

    public BufferedNotificationSink(NotificationSink forward) {
        this.forward = forward;
    }

    @Override
    public void publish(PortfolioEvent event) {
        if (event == null) {
            return;
        }
        queue.add(event);
        if (forward != null) {
            forward.publish(event);
        }
    }

    public List<PortfolioEvent> drain() {
        List<PortfolioEvent> out = new ArrayList<>();
        PortfolioEvent event;
        while ((event = queue.poll()) != null) {
            out.add(event);
        }
        return out;
    }

    public int pending() {
        return queue.size();
    }
}
