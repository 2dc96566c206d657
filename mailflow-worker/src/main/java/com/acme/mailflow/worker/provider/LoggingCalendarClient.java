package com.acme.mailflow.worker.provider;

import com.acme.mailflow.spi.BusyBlock;
import com.acme.mailflow.spi.CalendarClient;
import com.acme.mailflow.spi.PrimaryCalendar;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Dry-run calendar: every calendar is free and the primary calendar is reported in UTC. */
@Singleton
@Secondary
@Slf4j
public class LoggingCalendarClient implements CalendarClient {

  static final String PRIMARY = "primary";
  static final String DEFAULT_TIME_ZONE = "UTC";

  @Override
  public List<BusyBlock> fetchBusyBlocks(
      String userId, String connectionId, Instant start, Instant end, List<String> calendars) {
    log.info("Dry-run busy lookup userId={} connectionId={} window=[{}, {}] calendars={}",
        userId, connectionId, start, end, calendars);
    return List.of();
  }

  @Override
  public PrimaryCalendar fetchPrimaryCalendar(String userId, String accessToken) {
    log.info("Dry-run primary calendar lookup userId={}", userId);
    return new PrimaryCalendar(PRIMARY, DEFAULT_TIME_ZONE);
  }
}
