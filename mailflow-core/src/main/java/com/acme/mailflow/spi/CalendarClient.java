package com.acme.mailflow.spi;

import java.time.Instant;
import java.util.List;

public interface CalendarClient {

  List<BusyBlock> fetchBusyBlocks(
      String userId, String connectionId, Instant start, Instant end, List<String> calendars)
      throws Exception;

  /** Reads the primary calendar of a freshly connected account. */
  PrimaryCalendar fetchPrimaryCalendar(String userId, String accessToken) throws Exception;
}
