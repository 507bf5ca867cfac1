package io.intellixity.avronames.spi.verify;

import java.util.Objects;

/** Raised by {@link SchemaVerifier#verifyOrThrow} when a schema tree has naming problems. */
public final class SchemaVerificationException extends RuntimeException {
  private final VerificationReport report;

  public SchemaVerificationException(VerificationReport report) {
    super(describe(Objects.requireNonNull(report, "report")));
    this.report = report;
  }

  public VerificationReport report() {
    return report;
  }

  private static String describe(VerificationReport report) {
    StringBuilder sb = new StringBuilder("Schema has ")
        .append(report.problems().size())
        .append(" naming problem(s):");
    for (NameProblem p : report.problems()) {
      sb.append("\n  ").append(p.path()).append(' ').append(p.code()).append(": ").append(p.message());
    }
    return sb.toString();
  }
}
