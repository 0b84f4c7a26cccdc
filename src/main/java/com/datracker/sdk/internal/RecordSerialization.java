package com.datracker.sdk.internal;

import com.datracker.sdk.GeoLocation;
import com.datracker.sdk.PropertyValue;
import com.datracker.sdk.subsystems.EventRecord;
import com.datracker.sdk.subsystems.ProfileUpdateRecord;
import com.datracker.sdk.subsystems.Record;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON representation of records, used both for local persistence and inside upload payloads.
 * <p>
 * This class is for internal use only and should not be documented in the tracker API. It is not
 * supported for any use outside of the tracker.
 */
public abstract class RecordSerialization {
  /**
   * Value of the "type" property for {@link EventRecord}.
   */
  public static final String EVENT_TYPE = "event";

  /**
   * Value of the "type" property for {@link ProfileUpdateRecord}.
   */
  public static final String PROFILE_TYPE = "profile";

  private static final Gson gson = new Gson();
  private static final TypeAdapter<PropertyValue> propertyValueAdapter = gson.getAdapter(PropertyValue.class);

  private RecordSerialization() {}

  /**
   * Serializes a record to a JSON object string.
   * 
   * @param record the record
   * @return the JSON representation
   */
  public static String toJson(Record record) {
    StringWriter sw = new StringWriter();
    try (JsonWriter jw = new JsonWriter(sw)) {
      writeRecord(jw, record);
    } catch (IOException e) { // COVERAGE: StringWriter does not throw
      throw new IllegalStateException(e);
    }
    return sw.toString();
  }

  /**
   * Writes a record as a JSON object.
   * 
   * @param jw the JSON writer
   * @param record the record
   * @throws IOException if the writer fails
   */
  public static void writeRecord(JsonWriter jw, Record record) throws IOException {
    jw.beginObject();
    jw.name("id").value(record.getId());
    if (record instanceof EventRecord) {
      EventRecord e = (EventRecord)record;
      jw.name("type").value(EVENT_TYPE);
      jw.name("time").value(e.getTimestamp());
      jw.name("name").value(e.getName());
      writeOptionalString(jw, "sessionId", e.getSessionId());
      writeOptionalString(jw, "userId", e.getUserId());
      if (e.getCostSeconds() != null) {
        jw.name("costTime").value(e.getCostSeconds());
      }
      if (!e.getCategories().isEmpty()) {
        jw.name("categories").beginArray();
        for (String c: e.getCategories()) {
          jw.value(c);
        }
        jw.endArray();
      }
      if (!e.getAttributes().isEmpty()) {
        jw.name("attributes");
        writeProperties(jw, e.getAttributes());
      }
      if (e.getLocation() != null) {
        jw.name("location").beginObject();
        jw.name("lat").value(e.getLocation().getLatitude());
        jw.name("lng").value(e.getLocation().getLongitude());
        jw.endObject();
      }
    } else {
      ProfileUpdateRecord p = (ProfileUpdateRecord)record;
      jw.name("type").value(PROFILE_TYPE);
      jw.name("time").value(p.getTimestamp());
      jw.name("operation").value(p.getOperation().name().toLowerCase(Locale.ROOT));
      writeOptionalString(jw, "userId", p.getUserId());
      if (!p.getProperties().isEmpty()) {
        jw.name("properties");
        writeProperties(jw, p.getProperties());
      }
      if (!p.getPropertyNames().isEmpty()) {
        jw.name("propertyNames").beginArray();
        for (String n: p.getPropertyNames()) {
          jw.value(n);
        }
        jw.endArray();
      }
      if (p.getAmount() != null) {
        jw.name("amount").value(p.getAmount());
      }
    }
    jw.endObject();
  }

  /**
   * Parses a record that was written by {@link #toJson(Record)}.
   * 
   * @param json the JSON representation
   * @return the record
   * @throws JsonParseException if the JSON is malformed or is not a valid record
   */
  public static Record fromJson(String json) {
    JsonElement parsed = JsonParser.parseString(json);
    if (!parsed.isJsonObject()) {
      throw new JsonParseException("record is not a JSON object");
    }
    JsonObject o = parsed.getAsJsonObject();
    String id = requireString(o, "id");
    String type = requireString(o, "type");
    long time = requireNumber(o, "time").longValue();
    switch (type) {
    case EVENT_TYPE:
      JsonElement cost = o.get("costTime");
      return new EventRecord(
          id,
          requireString(o, "name"),
          time,
          cost == null || cost.isJsonNull() ? null : requireFiniteNumber(o, "costTime"),
          readStringList(o, "categories"),
          readProperties(o.get("attributes")),
          readLocation(o.get("location")),
          optionalString(o, "sessionId"),
          optionalString(o, "userId")
          );
    case PROFILE_TYPE:
      ProfileUpdateRecord.Operation op;
      try {
        op = ProfileUpdateRecord.Operation.valueOf(requireString(o, "operation").toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new JsonParseException("unknown profile operation", e);
      }
      JsonElement amount = o.get("amount");
      return new ProfileUpdateRecord(
          id,
          time,
          op,
          optionalString(o, "userId"),
          readProperties(o.get("properties")),
          readStringList(o, "propertyNames"),
          amount == null || amount.isJsonNull() ? null : requireFiniteNumber(o, "amount")
          );
    default:
      throw new JsonParseException("unknown record type: " + type);
    }
  }

  /**
   * Serializes a property map to a JSON object string.
   * 
   * @param properties the properties
   * @return the JSON representation
   */
  public static String propertiesToJson(Map<String, PropertyValue> properties) {
    StringWriter sw = new StringWriter();
    try (JsonWriter jw = new JsonWriter(sw)) {
      writeProperties(jw, properties);
    } catch (IOException e) { // COVERAGE: StringWriter does not throw
      throw new IllegalStateException(e);
    }
    return sw.toString();
  }

  /**
   * Parses a property map that was written by {@link #propertiesToJson(Map)}. Date values come
   * back as strings in ISO-8601 format.
   * 
   * @param json the JSON representation
   * @return an ordered map
   * @throws JsonParseException if the JSON is malformed or is not an object
   */
  public static Map<String, PropertyValue> propertiesFromJson(String json) {
    return readProperties(JsonParser.parseString(json));
  }

  private static void writeProperties(JsonWriter jw, Map<String, PropertyValue> properties) throws IOException {
    jw.beginObject();
    for (Map.Entry<String, PropertyValue> kv: properties.entrySet()) {
      jw.name(kv.getKey());
      propertyValueAdapter.write(jw, kv.getValue());
    }
    jw.endObject();
  }

  private static void writeOptionalString(JsonWriter jw, String name, String value) throws IOException {
    if (value != null) {
      jw.name(name).value(value);
    }
  }

  private static Map<String, PropertyValue> readProperties(JsonElement element) {
    Map<String, PropertyValue> ret = new LinkedHashMap<>();
    if (element == null || element.isJsonNull()) {
      return ret;
    }
    if (!element.isJsonObject()) {
      throw new JsonParseException("properties must be a JSON object");
    }
    for (Map.Entry<String, JsonElement> kv: element.getAsJsonObject().entrySet()) {
      PropertyValue v = propertyValueAdapter.fromJsonTree(kv.getValue());
      if (v != null) {
        ret.put(kv.getKey(), v);
      }
    }
    return ret;
  }

  private static GeoLocation readLocation(JsonElement element) {
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (!element.isJsonObject()) {
      throw new JsonParseException("location must be a JSON object");
    }
    JsonObject o = element.getAsJsonObject();
    return new GeoLocation(requireFiniteNumber(o, "lat"), requireFiniteNumber(o, "lng"));
  }

  private static List<String> readStringList(JsonObject o, String name) {
    List<String> ret = new ArrayList<>();
    JsonElement element = o.get(name);
    if (element == null || element.isJsonNull()) {
      return ret;
    }
    if (!element.isJsonArray()) {
      throw new JsonParseException(name + " must be a JSON array");
    }
    JsonArray a = element.getAsJsonArray();
    for (JsonElement item: a) {
      if (!item.isJsonPrimitive()) {
        throw new JsonParseException(name + " must contain strings");
      }
      ret.add(item.getAsString());
    }
    return ret;
  }

  private static String requireString(JsonObject o, String name) {
    String s = optionalString(o, name);
    if (s == null) {
      throw new JsonParseException("missing property: " + name);
    }
    return s;
  }

  private static String optionalString(JsonObject o, String name) {
    JsonElement element = o.get(name);
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new JsonParseException(name + " must be a string");
    }
    return element.getAsString();
  }

  private static double requireFiniteNumber(JsonObject o, String name) {
    double d = requireNumber(o, name).doubleValue();
    if (!Double.isFinite(d)) {
      throw new JsonParseException(name + " must be a finite number");
    }
    return d;
  }

  private static Number requireNumber(JsonObject o, String name) {
    JsonElement element = o.get(name);
    if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      throw new JsonParseException("missing or non-numeric property: " + name);
    }
    return element.getAsNumber();
  }
}
