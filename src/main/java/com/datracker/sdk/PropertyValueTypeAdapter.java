package com.datracker.sdk;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

// Dates are written as ISO-8601 strings and therefore come back as STRING values when read.
final class PropertyValueTypeAdapter extends TypeAdapter<PropertyValue> {
  static final PropertyValueTypeAdapter INSTANCE = new PropertyValueTypeAdapter();

  @Override
  public PropertyValue read(JsonReader reader) throws IOException {
    JsonToken token = reader.peek();
    switch (token) {
    case BEGIN_ARRAY:
      List<PropertyValue> list = new ArrayList<>();
      reader.beginArray();
      while (reader.peek() != JsonToken.END_ARRAY) {
        PropertyValue v = read(reader);
        if (v != null && v.getType() != PropertyValueType.ARRAY) {
          list.add(v);
        }
      }
      reader.endArray();
      return PropertyValue.arrayOf(list);
    case BOOLEAN:
      return PropertyValue.of(reader.nextBoolean());
    case NULL:
      reader.nextNull();
      return null;
    case NUMBER:
      return PropertyValue.of(reader.nextDouble());
    case STRING:
      return PropertyValue.of(reader.nextString());
    default:
      throw new JsonParseException("unsupported property value: " + token);
    }
  }

  @Override
  public void write(JsonWriter writer, PropertyValue value) throws IOException {
    if (value == null) {
      writer.nullValue();
    } else {
      value.write(writer);
    }
  }
}
