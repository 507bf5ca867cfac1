package io.intellixity.avronames.naming;

import java.util.Objects;
import java.util.Optional;

/** Outcome of {@link TypeVerifier#verifyType}: success, or exactly one {@link NameError}. */
public final class VerificationResult {
  private static final VerificationResult OK = new VerificationResult(null);

  private final NameError error;

  private VerificationResult(NameError error) {
    this.error = error;
  }

  public static VerificationResult ok() { return OK; }

  public static VerificationResult failed(NameError error) {
    return new VerificationResult(Objects.requireNonNull(error, "error"));
  }

  public boolean isOk() { return error == null; }

  public Optional<NameError> error() { return Optional.ofNullable(error); }

  /** Throws {@link TypeNameException} when this result is a failure. */
  public void orThrow() {
    if (error != null) throw new TypeNameException(error);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof VerificationResult that)) return false;
    return Objects.equals(error, that.error);
  }

  @Override
  public int hashCode() { return Objects.hashCode(error); }

  @Override
  public String toString() {
    return error == null ? "VerificationResult[ok]" : "VerificationResult[" + error.code() + ": " + error.subject() + "]";
  }
}
