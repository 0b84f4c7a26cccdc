package com.datracker.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;

@JsonAdapter(PropertyValueTypeAdapter.class)
final class PropertyValueDate extends PropertyValue {
  private final long epochMillis;

  PropertyValueDate(long epochMillis) {
    this.epochMillis = epochMillis;
  }

  @Override
  public PropertyValueType getType() {
    return PropertyValueType.DATE;
  }

  @Override
  public Instant instantValue() {
    return Instant.ofEpochMilli(epochMillis);
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.value(instantValue().toString());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PropertyValueDate && ((PropertyValueDate)o).epochMillis == epochMillis;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(epochMillis);
  }
}
