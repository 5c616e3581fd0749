package com.mk.fx.qa.dbstress.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Identifies one logical workload target, i.e. one provisioned schema prefix. Values are upper
 * cased and restricted to {@code [A-Z0-9_]}. The empty key is the unnamed default target.
 */
public record EntityKey(String value) {

  public static final EntityKey DEFAULT = new EntityKey("");

  private static final String DEFAULT_NAME = "default";

  public EntityKey {
    value = normalise(value);
  }

  @JsonCreator
  public static EntityKey of(String raw) {
    var normalised = normalise(raw);
    return normalised.isEmpty() ? DEFAULT : new EntityKey(normalised);
  }

  public boolean isDefault() {
    return value.isEmpty();
  }

  @JsonValue
  public String displayName() {
    return isDefault() ? DEFAULT_NAME : value;
  }

  @Override
  public String toString() {
    return displayName();
  }

  private static String normalise(String raw) {
    if (raw == null) {
      return "";
    }
    var trimmed = raw.trim();
    if (trimmed.equalsIgnoreCase(DEFAULT_NAME)) {
      return "";
    }
    return trimmed.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "");
  }
}
