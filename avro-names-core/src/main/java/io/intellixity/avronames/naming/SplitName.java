package io.intellixity.avronames.naming;

import java.util.Objects;

/** A canonical short name together with the namespace that qualifies it (empty when unqualified). */
public record SplitName(String shortName, String namespace) {
  public SplitName {
    Objects.requireNonNull(shortName, "shortName");
    Objects.requireNonNull(namespace, "namespace");
  }

  /** {@code namespace.shortName}, or just the short name when the namespace is empty. */
  public String fullname() {
    if (namespace.isEmpty()) return shortName;
    return namespace + "." + shortName;
  }
}
