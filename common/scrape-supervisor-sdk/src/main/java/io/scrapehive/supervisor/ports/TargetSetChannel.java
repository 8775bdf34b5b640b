package io.scrapehive.supervisor.ports;

import io.scrapehive.supervisor.targets.TargetGroup;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbuffered hand-off of target sets from the supervisor to the engine.
 * <p>
 * A send completes only once the engine has taken the set; an interrupted send
 * leaves nothing behind for the engine to pick up later.
 */
public final class TargetSetChannel {

  private final SynchronousQueue<Map<String, List<TargetGroup>>> queue = new SynchronousQueue<>();

  public void send(Map<String, List<TargetGroup>> targetSets) throws InterruptedException {
    queue.put(Objects.requireNonNull(targetSets, "targetSets"));
  }

  public Map<String, List<TargetGroup>> receive() throws InterruptedException {
    return queue.take();
  }

  /**
   * @return the next target set, or {@code null} when none was sent within the timeout
   */
  public Map<String, List<TargetGroup>> poll(long timeout, TimeUnit unit) throws InterruptedException {
    return queue.poll(timeout, unit);
  }
}
