package com.datracker.sdk;

import com.launchdarkly.logging.LDLogger;

import java.util.LinkedHashMap;
import java.util.Map;

abstract class PropertyMaps {
  private PropertyMaps() {}

  // Converts caller-supplied values, dropping null keys and unsupported values with a warning.
  static Map<String, PropertyValue> fromObjects(Map<String, ?> input, LDLogger logger) {
    Map<String, PropertyValue> ret = new LinkedHashMap<>();
    if (input == null) {
      return ret;
    }
    for (Map.Entry<String, ?> kv: input.entrySet()) {
      if (kv.getKey() == null || kv.getKey().isEmpty()) {
        logger.warn("Ignoring property with an empty name");
        continue;
      }
      PropertyValue v = PropertyValue.fromObject(kv.getValue());
      if (v == null) {
        if (kv.getValue() instanceof Number) {
          logger.warn("Ignoring property \"{}\": {} is not a finite number", kv.getKey(), kv.getValue());
        } else if (kv.getValue() != null) {
          logger.warn("Ignoring property \"{}\": unsupported value type {}", kv.getKey(),
              kv.getValue().getClass().getName());
        }
        continue;
      }
      ret.put(kv.getKey(), v);
    }
    return ret;
  }
}
