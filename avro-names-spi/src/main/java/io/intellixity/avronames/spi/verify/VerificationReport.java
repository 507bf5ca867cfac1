package io.intellixity.avronames.spi.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Every naming problem found in one schema tree, in discovery order. */
@JsonPropertyOrder({"valid", "problems"})
public record VerificationReport(List<NameProblem> problems) {
  public VerificationReport {
    problems = problems == null ? List.of() : List.copyOf(problems);
  }

  @JsonProperty("valid")
  public boolean isValid() {
    return problems.isEmpty();
  }

  public List<NameProblem> problemsWithCode(String code) {
    Objects.requireNonNull(code, "code");
    return problems.stream().filter(p -> code.equals(p.code())).toList();
  }
}
