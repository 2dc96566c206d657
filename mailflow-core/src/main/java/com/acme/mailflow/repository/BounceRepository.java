package com.acme.mailflow.repository;

import com.acme.mailflow.bounce.BounceEvent;
import com.acme.mailflow.bounce.BounceType;
import com.acme.mailflow.bounce.ComplaintEvent;
import java.time.Instant;

public interface BounceRepository {

  void insertBounce(BounceEvent bounce);

  void insertComplaint(ComplaintEvent complaint);

  /** Bounces of one type for an address, optionally narrowed to a sending domain. */
  long countBounces(String email, String domainId, BounceType type);

  long countDomainBounces(String domainId, Instant since);

  long countDomainComplaints(String domainId, Instant since);
}
