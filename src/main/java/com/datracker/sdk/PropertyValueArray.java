package com.datracker.sdk;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;

@JsonAdapter(PropertyValueTypeAdapter.class)
final class PropertyValueArray extends PropertyValue {
  private final ImmutableList<PropertyValue> list;

  PropertyValueArray(ImmutableList<PropertyValue> list) {
    this.list = list;
  }

  @Override
  public PropertyValueType getType() {
    return PropertyValueType.ARRAY;
  }

  @Override
  public List<PropertyValue> values() {
    return list;
  }

  @Override
  void write(JsonWriter writer) throws IOException {
    writer.beginArray();
    for (PropertyValue v: list) {
      v.write(writer);
    }
    writer.endArray();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PropertyValueArray && ((PropertyValueArray)o).list.equals(list);
  }

  @Override
  public int hashCode() {
    return list.hashCode();
  }
}
