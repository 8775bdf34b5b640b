package io.scrapehive.supervisor.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ReloadSignalTest {

  @Test
  void raisingTwiceLeavesASinglePendingSignal() throws Exception {
    ReloadSignal signal = new ReloadSignal();

    assertThat(signal.raise()).isTrue();
    assertThat(signal.raise()).isFalse();
    assertThat(signal.isPending()).isTrue();

    assertThat(signal.await(0, TimeUnit.MILLISECONDS)).isTrue();
    assertThat(signal.isPending()).isFalse();
    assertThat(signal.await(20, TimeUnit.MILLISECONDS)).isFalse();
  }

  @Test
  void awaitWakesWhenRaisedFromAnotherThread() throws Exception {
    ReloadSignal signal = new ReloadSignal();
    CountDownLatch woke = new CountDownLatch(1);
    Thread waiter = new Thread(() -> {
      try {
        signal.await();
        woke.countDown();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    waiter.start();

    signal.raise();

    assertThat(woke.await(5, TimeUnit.SECONDS)).isTrue();
    waiter.join(5_000);
    assertThat(signal.isPending()).isFalse();
  }

  @Test
  void awaitIsInterruptible() throws Exception {
    ReloadSignal signal = new ReloadSignal();
    AtomicBoolean interrupted = new AtomicBoolean();
    Thread waiter = new Thread(() -> {
      try {
        signal.await();
      } catch (InterruptedException ex) {
        interrupted.set(true);
      }
    });
    waiter.start();

    waiter.interrupt();
    waiter.join(5_000);

    assertThat(waiter.isAlive()).isFalse();
    assertThat(interrupted).isTrue();
  }

  @Test
  void signalRaisedAfterConsumptionIsDeliveredAgain() throws Exception {
    ReloadSignal signal = new ReloadSignal();
    signal.raise();
    signal.await();

    assertThat(signal.raise()).isTrue();
    assertThat(signal.await(1, TimeUnit.SECONDS)).isTrue();
  }
}
