package com.acme.mailflow.repository;

import com.acme.mailflow.domain.EmailSnooze;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SnoozeRepository {

  Optional<EmailSnooze> findById(String id);

  List<EmailSnooze> findDue(Instant now, int limit);

  void delete(String id);
}
