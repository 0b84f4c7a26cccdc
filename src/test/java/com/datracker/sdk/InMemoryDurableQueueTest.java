package com.datracker.sdk;

import com.datracker.sdk.integrations.DurableQueueTestBase;
import com.datracker.sdk.subsystems.LocalStorage;

@SuppressWarnings("javadoc")
public class InMemoryDurableQueueTest extends DurableQueueTestBase {
  @Override
  protected LocalStorage makeStorage(int capacity) {
    return new InMemoryLocalStorage(capacity, testLogger);
  }

  @Override
  protected boolean isPersistent() {
    return false;
  }
}
