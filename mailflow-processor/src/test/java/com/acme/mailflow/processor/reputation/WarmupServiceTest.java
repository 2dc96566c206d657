package com.acme.mailflow.processor.reputation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.mailflow.repository.DomainReputationRepository;
import com.acme.mailflow.repository.WarmupRepository;
import com.acme.mailflow.reputation.DomainReputation;
import com.acme.mailflow.reputation.WarmupDay;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("WarmupService Tests")
class WarmupServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Instant STARTED = Instant.parse("2026-01-30T08:00:00Z");

  @Mock private DomainReputationRepository reputations;
  @Mock private WarmupRepository warmups;

  private WarmupService service;

  @BeforeEach
  void setup() {
    service = new WarmupService(reputations, warmups, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static DomainReputation inWarmup(boolean warmup) {
    return new DomainReputation(
        "d1", 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 100, warmup, warmup ? STARTED : null, null);
  }

  @Nested
  @DisplayName("startWarmup")
  class StartTests {

    @Test
    @DisplayName("should open day 1 with a target of 50")
    void testStarts() {
      // Given
      when(reputations.find("d1")).thenReturn(Optional.empty());

      // When
      service.startWarmup("d1");

      // Then
      verify(reputations).setWarmup("d1", true, NOW);
      verify(warmups).insertDay(new WarmupDay("d1", 1, 50, 0, null));
    }

    @Test
    @DisplayName("should not restart a domain already in warm-up")
    void testAlreadyWarming() {
      // Given
      when(reputations.find("d1")).thenReturn(Optional.of(inWarmup(true)));

      // When
      service.startWarmup("d1");

      // Then
      verify(reputations, never()).setWarmup(any(), anyBoolean(), any());
      verify(warmups, never()).insertDay(any());
    }
  }

  @Nested
  @DisplayName("completeWarmupDay")
  class CompleteTests {

    @Test
    @DisplayName("should open the next day at one and a half times the previous target")
    void testNextDay() {
      // Given
      when(warmups.findOpenDay("d1")).thenReturn(Optional.of(new WarmupDay("d1", 3, 112, 0, null)));

      // When
      service.completeWarmupDay("d1", 3, 110);

      // Then
      verify(warmups).completeDay("d1", 3, 110, NOW);
      verify(warmups).insertDay(new WarmupDay("d1", 4, 168, 0, null));
    }

    @Test
    @DisplayName("should end warm-up after day 30 and keep the start time")
    void testEndsAfterLastDay() {
      // Given
      when(warmups.findOpenDay("d1")).thenReturn(Optional.of(new WarmupDay("d1", 30, 10_000, 0, null)));
      when(reputations.find("d1")).thenReturn(Optional.of(inWarmup(true)));

      // When
      service.completeWarmupDay("d1", 30, 9_800);

      // Then
      verify(warmups).completeDay("d1", 30, 9_800, NOW);
      verify(reputations).setWarmup("d1", false, STARTED);
      verify(warmups, never()).insertDay(any());
    }
  }

  @Nested
  @DisplayName("canSend")
  class CanSendTests {

    @Test
    @DisplayName("should always allow mature domains")
    void testMature() {
      // Given
      when(reputations.find("d1")).thenReturn(Optional.of(inWarmup(false)));

      // When / Then
      assertThat(service.canSend("d1", 10_000)).isTrue();
    }

    @Test
    @DisplayName("should refuse a batch larger than what is left of the day")
    void testOverDailyTarget() {
      // Given
      when(reputations.find("d1")).thenReturn(Optional.of(inWarmup(true)));
      when(warmups.findOpenDay("d1")).thenReturn(Optional.of(new WarmupDay("d1", 2, 75, 70, null)));

      // When / Then
      assertThat(service.canSend("d1", 5)).isTrue();
      assertThat(service.canSend("d1", 6)).isFalse();
    }
  }
}
