package com.acme.mailflow.repository;

import com.acme.mailflow.domain.CalendarConnection;
import com.acme.mailflow.domain.OAuthCredential;
import com.acme.mailflow.spi.BusyBlock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CalendarConnectionRepository {

  Optional<CalendarConnection> findById(String id);

  /** Connections whose user still holds a provider credential. */
  List<CalendarConnection> findWithCredentials();

  /** Replaces the cached busy blocks of a connection inside {@code [start, end)}. */
  int replaceBusyBlocks(String connectionId, Instant start, Instant end, List<BusyBlock> blocks);

  void markSynced(String id, Instant syncedAt);

  /** Inserts or updates the connection for (userId, provider, accountEmail); returns its id. */
  String upsert(CalendarConnection connection);

  void saveCredential(OAuthCredential credential);
}
