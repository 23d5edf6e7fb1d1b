package com.scholary.podcast.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private final List<Duration> sleeps = new ArrayList<>();
  private RetryPolicy policy;

  @BeforeEach
  void setUp() {
    policy = new RetryPolicy(3, Duration.ofSeconds(2), 2.0, sleeps::add);
  }

  @Test
  void execute_shouldReturnFirstSuccessWithoutSleeping() {
    String result = policy.execute("op", () -> "ok", e -> true);

    assertThat(result).isEqualTo("ok");
    assertThat(sleeps).isEmpty();
  }

  @Test
  void execute_shouldBackOffTwoThenFourSecondsBetweenAttempts() {
    AtomicInteger calls = new AtomicInteger();

    String result =
        policy.execute(
            "op",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky");
              }
              return "ok";
            },
            e -> true);

    assertThat(result).isEqualTo("ok");
    assertThat(calls).hasValue(3);
    assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
  }

  @Test
  void execute_shouldPropagateLastFailureWhenAttemptsExhausted() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    "op",
                    () -> {
                      throw new IllegalStateException("attempt " + calls.incrementAndGet());
                    },
                    e -> true))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("attempt 3");
    assertThat(sleeps).hasSize(2);
  }

  @Test
  void execute_shouldNotRetryNonTransientFailure() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    "op",
                    () -> {
                      calls.incrementAndGet();
                      throw new IllegalArgumentException("bad request");
                    },
                    e -> !(e instanceof IllegalArgumentException)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(calls).hasValue(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void execute_shouldAbortWhenInterruptedDuringBackoff() {
    RetryPolicy interrupted =
        new RetryPolicy(
            3,
            Duration.ofSeconds(2),
            2.0,
            d -> {
              throw new InterruptedException();
            });

    try {
      assertThatThrownBy(
              () ->
                  interrupted.execute(
                      "op",
                      () -> {
                        throw new IllegalStateException("flaky");
                      },
                      e -> true))
          .isInstanceOf(RetryInterruptedException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void constructor_shouldRejectZeroAttempts() {
    assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), 2.0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
