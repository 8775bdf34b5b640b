package io.scrapehive.supervisor.fanout;

import static org.assertj.core.api.Assertions.assertThat;

import io.scrapehive.supervisor.engine.ScrapedSample;
import io.scrapehive.supervisor.ports.SampleReceiver;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class ForwardingFanoutTest {

  private final ScrapedSample sample = new ScrapedSample(Map.of("__name__", "up", "job", "node"), 1_000L, 1.0);

  @Test
  void deliversToEveryReceiverInOrder() {
    List<String> calls = new ArrayList<>();
    ForwardingFanout fanout = new ForwardingFanout(List.of(
        s -> calls.add("first:" + s.metricName()),
        s -> calls.add("second:" + s.metricName())));

    fanout.forward(sample);

    assertThat(calls).containsExactly("first:up", "second:up");
  }

  @Test
  void failingReceiverDoesNotBlockOthers() {
    List<ScrapedSample> delivered = new CopyOnWriteArrayList<>();
    SampleReceiver failing = s -> {
      throw new IllegalStateException("queue full");
    };
    ForwardingFanout fanout = new ForwardingFanout(List.of(failing, delivered::add));

    fanout.forward(sample);

    assertThat(delivered).containsExactly(sample);
  }

  @Test
  void replacingReceiversRoutesSubsequentSamplesOnly() {
    List<ScrapedSample> oldSink = new ArrayList<>();
    List<ScrapedSample> newSink = new ArrayList<>();
    ForwardingFanout fanout = new ForwardingFanout(List.of(oldSink::add));
    fanout.forward(sample);

    fanout.setReceivers(List.of(newSink::add));
    fanout.forward(sample);

    assertThat(oldSink).hasSize(1);
    assertThat(newSink).hasSize(1);
  }

  @Test
  void nullReceiversAreDropped() {
    ForwardingFanout fanout = new ForwardingFanout();
    SampleReceiver receiver = s -> { };

    fanout.setReceivers(Arrays.asList(null, receiver));

    assertThat(fanout.receivers()).containsExactly(receiver);
  }
}
