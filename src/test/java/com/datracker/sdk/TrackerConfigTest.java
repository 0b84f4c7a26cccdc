package com.datracker.sdk;

import com.datracker.sdk.integrations.SQLiteStorageBuilder;
import com.datracker.sdk.interfaces.DropListener;
import com.datracker.sdk.interfaces.NetworkStatusProvider;
import com.datracker.sdk.interfaces.NetworkType;
import com.datracker.sdk.subsystems.ComponentConfigurer;
import com.datracker.sdk.subsystems.LocalStorage;

import org.junit.Test;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class TrackerConfigTest {
  @Test
  public void defaults() {
    TrackerConfig config = new TrackerConfig.Builder().build();
    assertNull(config.appVersion);
    assertNull(config.appChannel);
    assertTrue(config.autoUpload);
    assertNull(config.customDeviceId);
    assertNull(config.dropListener);
    assertNotNull(config.http);
    assertNotNull(config.logging);
    assertSame(NetworkStatusProvider.UNMETERED, config.networkStatus);
    assertFalse(config.offline);
    assertFalse(config.sendOnWifi);
    assertEquals(TrackerConfig.DEFAULT_SESSION_TIMEOUT, config.sessionTimeout);
    assertThat(config.storage, instanceOf(SQLiteStorageBuilder.class));
    assertEquals(Thread.MIN_PRIORITY, config.threadPriority);
    assertNotNull(config.uploader);
  }

  @Test
  public void appInfo() {
    TrackerConfig config = new TrackerConfig.Builder().appVersion("2.0").appChannel("beta").build();
    assertEquals("2.0", config.appVersion);
    assertEquals("beta", config.appChannel);
  }

  @Test
  public void flags() {
    TrackerConfig config = new TrackerConfig.Builder().autoUpload(false).offline(true).sendOnWifi(true).build();
    assertFalse(config.autoUpload);
    assertTrue(config.offline);
    assertTrue(config.sendOnWifi);
  }

  @Test
  public void customComponents() {
    DropListener listener = (reason, name, count) -> {};
    NetworkStatusProvider network = () -> NetworkType.CELLULAR;
    ComponentConfigurer<LocalStorage> storage = Components.inMemoryStorage();
    TrackerConfig config = new TrackerConfig.Builder()
        .dropListener(listener)
        .networkStatus(network)
        .storage(storage)
        .customDeviceId("d1")
        .build();
    assertSame(listener, config.dropListener);
    assertSame(network, config.networkStatus);
    assertSame(storage, config.storage);
    assertEquals("d1", config.customDeviceId);
  }

  @Test
  public void sessionTimeout() {
    assertEquals(Duration.ofMinutes(5),
        new TrackerConfig.Builder().sessionTimeout(Duration.ofMinutes(5)).build().sessionTimeout);
    assertEquals(TrackerConfig.DEFAULT_SESSION_TIMEOUT,
        new TrackerConfig.Builder().sessionTimeout(Duration.ZERO).build().sessionTimeout);
    assertEquals(TrackerConfig.DEFAULT_SESSION_TIMEOUT,
        new TrackerConfig.Builder().sessionTimeout(null).build().sessionTimeout);
  }

  @Test
  public void threadPriorityIsClamped() {
    assertEquals(Thread.MAX_PRIORITY, new TrackerConfig.Builder().threadPriority(99).build().threadPriority);
    assertEquals(Thread.NORM_PRIORITY, new TrackerConfig.Builder().threadPriority(Thread.NORM_PRIORITY).build().threadPriority);
  }
}
