package com.acme.mailflow.spi;

import java.time.Instant;

public record BusyBlock(String calendarId, Instant start, Instant end) {}
