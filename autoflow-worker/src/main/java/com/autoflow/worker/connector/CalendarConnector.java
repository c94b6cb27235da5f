package com.autoflow.worker.connector;

import com.autoflow.worker.ConnectorException;
import java.time.Instant;
import java.util.List;

/**
 * Calendar event creation.
 */
public interface CalendarConnector {

    /**
     * @return event id assigned by the calendar
     */
    String scheduleEvent(String title, Instant start, Instant end, List<String> attendees) throws ConnectorException;
}
