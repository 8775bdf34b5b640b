package io.scrapehive.supervisor.runtime;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot, coalescing "something changed" notification.
 * <p>
 * At most one signal is pending. Raising while one is pending is a no-op and
 * never blocks; waiting consumes the pending signal.
 */
public final class ReloadSignal {

  private final AtomicBoolean pending = new AtomicBoolean(false);
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition raised = lock.newCondition();

  /**
   * @return {@code true} if a signal became pending, {@code false} if one already was
   */
  public boolean raise() {
    if (!pending.compareAndSet(false, true)) {
      return false;
    }
    lock.lock();
    try {
      raised.signal();
    } finally {
      lock.unlock();
    }
    return true;
  }

  public void await() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!pending.compareAndSet(true, false)) {
        raised.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return {@code true} if a signal was consumed, {@code false} on timeout
   */
  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (!pending.compareAndSet(true, false)) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = raised.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isPending() {
    return pending.get();
  }
}
