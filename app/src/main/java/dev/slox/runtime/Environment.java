package dev.slox.runtime;

import java.util.HashMap;
import java.util.Map;

// The one and only scope: a flat map from variable names to values.
public class Environment {
  private final Map<String, Value> values = new HashMap<>();

  // Creates the binding, or replaces it if `name` is already bound.
  public void define(String name, Value value) { values.put(name, value); }

  public Value get(String name, int line) {
    Value value = values.get(name);
    if (value == null) {
      throw new RuntimeError(
          line, String.format("undefined variable: %s", name)
      );
    }
    return value;
  }

  public boolean isDefined(String name) { return values.containsKey(name); }
}
