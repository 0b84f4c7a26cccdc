package com.datracker.sdk;

import com.datracker.sdk.interfaces.DropListener;
import com.datracker.sdk.interfaces.DropReason;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts discarded records by reason and forwards each drop to the application's listener.
 */
final class DropRecorder {
  private final Map<DropReason, AtomicLong> counts = new EnumMap<>(DropReason.class);
  private final DropListener listener;
  private final LDLogger logger;

  DropRecorder(DropListener listener, LDLogger logger) {
    for (DropReason r: DropReason.values()) {
      counts.put(r, new AtomicLong());
    }
    this.listener = listener;
    this.logger = logger;
  }

  void record(DropReason reason, String name, long count) {
    if (count <= 0) {
      return;
    }
    counts.get(reason).addAndGet(count);
    if (listener != null) {
      try {
        listener.onDrop(reason, name, count);
      } catch (RuntimeException e) {
        logger.warn("Unexpected error from drop listener: {}", LogValues.exceptionSummary(e));
      }
    }
  }

  long getCount(DropReason reason) {
    return counts.get(reason).get();
  }
}
