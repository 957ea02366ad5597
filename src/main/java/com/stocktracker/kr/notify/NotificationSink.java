package com.stocktracker.kr.notify;

public interface NotificationSink {

    /**
     * Must not throw; delivery problems are the sink's own concern.
     */
    void publish(PortfolioEvent event);
}
