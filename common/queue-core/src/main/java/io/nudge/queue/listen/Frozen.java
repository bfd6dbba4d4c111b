package io.nudge.queue.listen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, null-tolerant unmodifiable copies of decoded JSON structures.
 */
final class Frozen {

  private Frozen() {
  }

  static Map<String, Object> map(Map<String, Object> source) {
    Map<String, Object> copy = new LinkedHashMap<>(source.size());
    source.forEach((key, value) -> copy.put(key, value(value)));
    return Collections.unmodifiableMap(copy);
  }

  @SuppressWarnings("unchecked")
  private static Object value(Object value) {
    if (value instanceof Map<?, ?> nested) {
      return map((Map<String, Object>) nested);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(value(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
