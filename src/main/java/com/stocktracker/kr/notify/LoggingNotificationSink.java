package com.stocktracker.kr.notify;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class LoggingNotificationSink implements NotificationSink {
    private static final Logger LOG = LogManager.getLogger("NOTIFY");

    @Override
    public void publish(PortfolioEvent event) {
        if (event == null) {
            return;
        }
        if (event.type() == PortfolioEvent.Type.REJECTED) {
            LOG.warn(event.toLine());
        } else {
            LOG.info(event.toLine());
        }
    }
}
