package io.scrapehive.supervisor.ports;

import io.scrapehive.supervisor.engine.ScrapedSample;
import java.util.List;

/**
 * Forwarding fan-out sitting between the engine and the configured receivers.
 */
public interface SampleFanout {

  /**
   * Replace the active receivers. Samples forwarded after this call returns go
   * to the new set only.
   *
   * @param receivers new receivers, in delivery order
   */
  void setReceivers(List<? extends SampleReceiver> receivers);

  List<SampleReceiver> receivers();

  /**
   * Deliver a sample to every active receiver.
   *
   * @param sample scraped sample
   */
  void forward(ScrapedSample sample);
}
