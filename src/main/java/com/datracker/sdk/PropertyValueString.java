package com.datracker.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(PropertyValueTypeAdapter.class)
final class PropertyValueString extends PropertyValue {
  private final String value;

  PropertyValueString(String value) {
    this.value = value;
  }

  @Override
  public PropertyValueType getType() {
    return PropertyValueType.STRING;
  }

  @Override
  public String stringValue() {
    return value;
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.value(value);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PropertyValueString && ((PropertyValueString)o).value.equals(value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }
}
