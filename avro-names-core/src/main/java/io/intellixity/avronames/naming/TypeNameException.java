package io.intellixity.avronames.naming;

import java.util.Objects;

/**
 * Raised by {@link TypeVerifier#requireValid} when a type description fails name verification.
 * Never transient: the schema definition itself has to be fixed.
 */
public final class TypeNameException extends RuntimeException {
  private final NameError error;

  public TypeNameException(NameError error) {
    super(Objects.requireNonNull(error, "error").message());
    this.error = error;
  }

  public NameError error() {
    return error;
  }
}
