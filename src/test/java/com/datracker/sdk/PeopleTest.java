package com.datracker.sdk;

import com.datracker.sdk.interfaces.DropReason;
import com.datracker.sdk.subsystems.LocalStorage;
import com.datracker.sdk.subsystems.ProfileUpdateRecord;
import com.datracker.sdk.subsystems.ProfileUpdateRecord.Operation;
import com.datracker.sdk.subsystems.QueueEntry;
import com.datracker.sdk.subsystems.Record;
import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static com.datracker.sdk.TestComponents.specificComponent;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class PeopleTest extends BaseTest {
  private final LocalStorage storage = new InMemoryLocalStorage(100, testLogger);

  private Tracker makeTracker() {
    return new Tracker("app-key", baseConfig().storage(specificComponent(storage)).customDeviceId("device1").build());
  }

  private List<ProfileUpdateRecord> storedUpdates() {
    List<ProfileUpdateRecord> ret = new ArrayList<>();
    for (QueueEntry e: storage.getQueue().leaseBatch(1000)) {
      Record r = e.getRecord();
      if (r instanceof ProfileUpdateRecord) {
        ret.add((ProfileUpdateRecord)r);
      }
    }
    return ret;
  }

  @Test
  public void setTargetsDeviceWhenNoUserIsLoggedIn() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().set(ImmutableMap.of("plan", "pro", "age", 30));

      ProfileUpdateRecord p = storedUpdates().get(0);
      assertEquals(Operation.SET, p.getOperation());
      assertEquals("device1", p.getUserId());
      assertThat(p.getProperties(), hasEntry("plan", PropertyValue.of("pro")));
      assertThat(p.getProperties(), hasEntry("age", PropertyValue.of(30)));
    }
  }

  @Test
  public void setTargetsLoggedInUser() throws IOException {
    try (Tracker t = makeTracker()) {
      t.loginUser("u1");
      t.people().set("plan", "pro");

      assertEquals("u1", storedUpdates().get(0).getUserId());
    }
  }

  @Test
  public void setOnce() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().setOnce("firstSeen", "today");

      ProfileUpdateRecord p = storedUpdates().get(0);
      assertEquals(Operation.SET_ONCE, p.getOperation());
      assertThat(p.getProperties(), hasEntry("firstSeen", PropertyValue.of("today")));
    }
  }

  @Test
  public void setWithNothingToSetIsIgnored() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().set(ImmutableMap.<String, Object>of());
      t.people().set("k", null);
      t.people().setOnce(ImmutableMap.of("k", new Object()));

      assertTrue(storedUpdates().isEmpty());
    }
  }

  @Test
  public void unsetSendsPropertyName() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().unset("plan");

      ProfileUpdateRecord p = storedUpdates().get(0);
      assertEquals(Operation.UNSET, p.getOperation());
      assertThat(p.getPropertyNames(), contains("plan"));
      assertTrue(p.getProperties().isEmpty());
    }
  }

  @Test
  public void deleteUser() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().deleteUser();

      ProfileUpdateRecord p = storedUpdates().get(0);
      assertEquals(Operation.DELETE_USER, p.getOperation());
      assertThat(p.getPropertyNames(), empty());
      assertNull(p.getAmount());
    }
  }

  @Test
  public void trackCharge() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().trackCharge(4.99);
      t.people().trackCharge(10, ImmutableMap.of("sku", "x1"));

      List<ProfileUpdateRecord> updates = storedUpdates();
      assertEquals(Operation.CHARGE, updates.get(0).getOperation());
      assertEquals(Double.valueOf(4.99), updates.get(0).getAmount());
      assertEquals(Double.valueOf(10), updates.get(1).getAmount());
      assertThat(updates.get(1).getProperties(), hasEntry("sku", PropertyValue.of("x1")));
    }
  }

  @Test
  public void nonFiniteChargeIsDropped() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().trackCharge(Double.NaN);
      t.people().trackCharge(Double.POSITIVE_INFINITY, ImmutableMap.of("sku", "x1"));

      assertTrue(storedUpdates().isEmpty());
      assertEquals(2, t.getDroppedCount(DropReason.INVALID_VALUE));
    }
  }

  @Test
  public void clearChargesUnsetsTransactions() throws IOException {
    try (Tracker t = makeTracker()) {
      t.people().clearCharges();

      ProfileUpdateRecord p = storedUpdates().get(0);
      assertEquals(Operation.UNSET, p.getOperation());
      assertThat(p.getPropertyNames(), contains(People.TRANSACTIONS_PROPERTY));
    }
  }
}
