package com.datracker.sdk;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

@JsonAdapter(PropertyValueTypeAdapter.class)
final class PropertyValueBool extends PropertyValue {
  private static final PropertyValueBool TRUE = new PropertyValueBool(true);
  private static final PropertyValueBool FALSE = new PropertyValueBool(false);

  private final boolean value;

  static PropertyValueBool fromBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  private PropertyValueBool(boolean value) {
    this.value = value;
  }

  @Override
  public PropertyValueType getType() {
    return PropertyValueType.BOOLEAN;
  }

  @Override
  public boolean booleanValue() {
    return value;
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.value(value);
  }
}
