package com.datracker.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(PropertyValueTypeAdapter.class)
final class PropertyValueNumber extends PropertyValue {
  private final double value;

  PropertyValueNumber(double value) {
    this.value = value;
  }

  @Override
  public PropertyValueType getType() {
    return PropertyValueType.NUMBER;
  }

  @Override
  public double doubleValue() {
    return value;
  }

  private boolean isInt() {
    return value == (double)(long)value;
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    if (isInt()) {
      writer.value((long)value);
    } else {
      writer.value(value);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PropertyValueNumber && Double.compare(((PropertyValueNumber)o).value, value) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }
}
