package com.datracker.sdk;

import com.datracker.sdk.internal.RecordSerialization;
import com.datracker.sdk.subsystems.QueueEntry;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.List;

/**
 * Transforms a batch of queued records into the JSON payload that we send to the collector.
 * Rather than creating intermediate objects to represent this schema, we use the Gson streaming
 * output API to construct JSON directly.
 * 
 * Test coverage for this logic is in RecordOutputFormatterTest and UploaderTest.
 */
final class RecordOutputFormatter {
  private final String appKey;
  private final String appVersion;
  private final String appChannel;
  private final String deviceId;

  RecordOutputFormatter(String appKey, String appVersion, String appChannel, String deviceId) {
    this.appKey = appKey;
    this.appVersion = appVersion;
    this.appChannel = appChannel;
    this.deviceId = deviceId;
  }

  @SuppressWarnings("resource")
  final int writeOutputRecords(List<QueueEntry> entries, long sentAt, Writer writer) throws IOException {
    try (JsonWriter jw = new JsonWriter(writer)) {
      jw.beginObject();
      jw.name("appKey").value(appKey);
      if (appVersion != null) {
        jw.name("appVersion").value(appVersion);
      }
      if (appChannel != null) {
        jw.name("appChannel").value(appChannel);
      }
      jw.name("deviceId").value(deviceId);
      jw.name("sdkVersion").value(Version.SDK_VERSION);
      jw.name("sentAt").value(Instant.ofEpochMilli(sentAt).toString());
      jw.name("records").beginArray();
      for (QueueEntry e: entries) {
        RecordSerialization.writeRecord(jw, e.getRecord());
      }
      jw.endArray();
      jw.endObject();
    }
    return entries.size();
  }
}
