package io.intellixity.avronames.spi.verify;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.intellixity.avronames.naming.NameError;

import java.util.Objects;

/**
 * One naming problem found in a schema tree.
 *
 * @param path    location inside the tree, {@code $} being the root (e.g. {@code $.fields[2].items})
 * @param code    stable problem code, e.g. {@code invalid_name}
 * @param subject the offending name or symbol
 * @param message human-readable description for the schema author
 */
@JsonPropertyOrder({"path", "code", "subject", "message"})
public record NameProblem(String path, String code, String subject, String message) {
  public NameProblem {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(code, "code");
    subject = subject == null ? "" : subject;
    message = message == null ? "" : message;
  }

  public static NameProblem of(String path, NameError error) {
    Objects.requireNonNull(error, "error");
    return new NameProblem(path, error.code(), error.subject(), error.message());
  }
}
