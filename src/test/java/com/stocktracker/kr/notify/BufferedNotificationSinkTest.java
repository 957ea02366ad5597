package com.stocktracker.kr.notify;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BufferedNotificationSinkTest {

    @Test
    void drain_shouldReturnEventsInPublishOrderAndEmptyTheQueue() {
        BufferedNotificationSink sink = new BufferedNotificationSink();
        sink.publish(PortfolioEvent.of(PortfolioEvent.Type.OPENED, "AAA", "c1", "buy 10000"));
        sink.publish(PortfolioEvent.of(PortfolioEvent.Type.CLOSED, "BBB", "c1", "STOP_LOSS at 9000"));
        sink.publish(null);

        assertEquals(2, sink.pending());
        List<PortfolioEvent> events = sink.drain();

        assertEquals(PortfolioEvent.Type.OPENED, events.get(0).type());
        assertEquals(PortfolioEvent.Type.CLOSED, events.get(1).type());
        assertEquals(0, sink.pending());
        assertTrue(sink.drain().isEmpty());
    }

    @Test
    void publish_shouldForwardEachEvent() {
        List<PortfolioEvent> forwarded = new ArrayList<>();
        BufferedNotificationSink sink = new BufferedNotificationSink(forwarded::add);

        sink.publish(PortfolioEvent.of(PortfolioEvent.Type.HELD, "AAA", "c1", "confidence 7"));

        assertEquals(1, forwarded.size());
        assertEquals("[HELD] AAA @c1 confidence 7", forwarded.get(0).toLine());
    }
}
