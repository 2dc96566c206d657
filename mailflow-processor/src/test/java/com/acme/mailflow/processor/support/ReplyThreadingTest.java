package com.acme.mailflow.processor.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.processor.support.ReplyThreading.ReplyThread;
import com.acme.mailflow.spi.MailboxClient;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReplyThreading Tests")
class ReplyThreadingTest {

  @Mock private MailboxClient mailbox;

  private CollaboratorInvoker invoker;
  private ReplyThreading threading;

  @BeforeEach
  void setup() {
    invoker = new CollaboratorInvoker(new TimeoutConfig());
    threading = new ReplyThreading(mailbox, invoker);
  }

  @AfterEach
  void teardown() {
    invoker.shutdown();
  }

  @Nested
  @DisplayName("resolve")
  class ResolveTests {

    @Test
    @DisplayName("should use a known thread id without asking the provider")
    void testKnownThreadWins() {
      // When
      Optional<ReplyThread> thread = threading.resolve("u1", "t-1", "<m-1@mail>");

      // Then
      assertThat(thread).contains(new ReplyThread("t-1", "<m-1@mail>"));
      verifyNoInteractions(mailbox);
    }

    @Test
    @DisplayName("should look up the thread of the replied-to message")
    void testLooksUpThread() throws Exception {
      // Given
      when(mailbox.findThreadId("u1", "<m-1@mail>")).thenReturn(Optional.of("t-9"));

      // When
      Optional<ReplyThread> thread = threading.resolve("u1", null, "<m-1@mail>");

      // Then
      assertThat(thread).map(ReplyThread::threadId).contains("t-9");
      verify(mailbox).findThreadId("u1", "<m-1@mail>");
    }

    @Test
    @DisplayName("should fall back to a new thread when the lookup fails")
    void testLookupFailure() throws Exception {
      // Given
      when(mailbox.findThreadId(any(), any())).thenThrow(new IllegalStateException("401"));

      // When
      Optional<ReplyThread> thread = threading.resolve("u1", "", "<m-1@mail>");

      // Then
      assertThat(thread).isEmpty();
    }

    @Test
    @DisplayName("should return empty when neither thread nor message is known")
    void testNothingToThread() {
      assertThat(threading.resolve("u1", null, null)).isEmpty();
      verifyNoInteractions(mailbox);
    }
  }

  @Nested
  @DisplayName("replySubject and headers")
  class SubjectTests {

    @Test
    @DisplayName("should prefix Re: once, case-insensitively")
    void testReplySubject() {
      assertThat(ReplyThreading.replySubject("Quarterly numbers")).isEqualTo("Re: Quarterly numbers");
      assertThat(ReplyThreading.replySubject("RE: Quarterly numbers")).isEqualTo("RE: Quarterly numbers");
      assertThat(ReplyThreading.replySubject(null)).isEqualTo("Re: ");
    }

    @Test
    @DisplayName("should carry In-Reply-To and References only when a message id is known")
    void testHeaders() {
      assertThat(new ReplyThread("t", "<m@x>").headers())
          .containsExactlyEntriesOf(Map.of("In-Reply-To", "<m@x>", "References", "<m@x>"));
      assertThat(new ReplyThread("t", null).headers()).isEmpty();
    }
  }
}
