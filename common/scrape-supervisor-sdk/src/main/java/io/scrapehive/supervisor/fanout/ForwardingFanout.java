package io.scrapehive.supervisor.fanout;

import io.scrapehive.supervisor.engine.ScrapedSample;
import io.scrapehive.supervisor.ports.SampleFanout;
import io.scrapehive.supervisor.ports.SampleReceiver;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link SampleFanout}: forwards each sample to every receiver in order.
 * <p>
 * The receiver list is swapped as a whole, so a sample is delivered either to the
 * old set or to the new one, never to a mix. A failing receiver does not prevent
 * delivery to the others.
 */
public final class ForwardingFanout implements SampleFanout {

  private static final Logger log = LoggerFactory.getLogger(ForwardingFanout.class);

  private final AtomicReference<List<SampleReceiver>> receivers = new AtomicReference<>(List.of());

  public ForwardingFanout() {
  }

  public ForwardingFanout(List<? extends SampleReceiver> receivers) {
    setReceivers(receivers);
  }

  @Override
  public void setReceivers(List<? extends SampleReceiver> newReceivers) {
    List<SampleReceiver> copy = new ArrayList<>();
    if (newReceivers != null) {
      for (SampleReceiver receiver : newReceivers) {
        if (receiver != null) {
          copy.add(receiver);
        }
      }
    }
    receivers.set(List.copyOf(copy));
  }

  @Override
  public List<SampleReceiver> receivers() {
    return receivers.get();
  }

  @Override
  public void forward(ScrapedSample sample) {
    if (sample == null) {
      return;
    }
    for (SampleReceiver receiver : receivers.get()) {
      try {
        receiver.receive(sample);
      } catch (Exception ex) {
        log.warn("Sample receiver {} failed to accept {}: {}", receiver.name(), sample.metricName(), ex.toString());
      }
    }
  }
}
