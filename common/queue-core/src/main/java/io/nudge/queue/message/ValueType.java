package io.nudge.queue.message;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Value types a {@link MessageFormat} can require for a field.
 */
public enum ValueType {

  TEXT {
    @Override
    public boolean accepts(Object value) {
      return value instanceof String;
    }
  },

  /**
   * Any integral JSON number. Decoded JSON yields {@link Integer}, {@link Long} or
   * {@link BigInteger} depending on magnitude.
   */
  INTEGER {
    @Override
    public boolean accepts(Object value) {
      return value instanceof Integer
          || value instanceof Long
          || value instanceof Short
          || value instanceof Byte
          || value instanceof BigInteger;
    }
  },

  TIMESTAMP {
    @Override
    public boolean accepts(Object value) {
      return value instanceof Instant;
    }
  };

  public abstract boolean accepts(Object value);
}
