package com.acme.mailflow.spi;

public record PrimaryCalendar(String calendarId, String timeZone) {}
