package io.intellixity.avronames.spi.verify;

import io.intellixity.avronames.naming.NameResolver;
import io.intellixity.avronames.types.AvroType;
import io.intellixity.avronames.util.AvroNamesFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a fixed list of {@link TypeVerificationStrategy} instances over a type tree and collects their problems.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class SchemaVerifier {
  private static final Logger log = LoggerFactory.getLogger(SchemaVerifier.class);

  private final List<TypeVerificationStrategy> strategies;

  public SchemaVerifier(List<TypeVerificationStrategy> strategies) {
    Objects.requireNonNull(strategies, "strategies");
    if (strategies.isEmpty()) throw new IllegalArgumentException("at least one strategy is required");
    this.strategies = List.copyOf(strategies);
  }

  /** Only {@link DefaultTypeVerificationStrategy}. */
  public static SchemaVerifier defaults() {
    return new SchemaVerifier(List.of(new DefaultTypeVerificationStrategy()));
  }

  /** {@link DefaultTypeVerificationStrategy} followed by strategies registered in {@code META-INF/avro-names.factories}. */
  public static SchemaVerifier discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static SchemaVerifier discover(ClassLoader cl) {
    List<TypeVerificationStrategy> all = new ArrayList<>();
    all.add(new DefaultTypeVerificationStrategy());
    all.addAll(AvroNamesFactoriesLoader.load(TypeVerificationStrategy.class, cl));
    return new SchemaVerifier(all);
  }

  public List<TypeVerificationStrategy> strategies() {
    return strategies;
  }

  public VerificationReport verify(AvroType root) {
    return verify(root, "");
  }

  public VerificationReport verify(AvroType root, String enclosingNamespace) {
    Objects.requireNonNull(root, "root");
    String ns = enclosingNamespace == null ? "" : enclosingNamespace;

    List<NameProblem> problems = new ArrayList<>();
    for (TypeVerificationStrategy s : strategies) {
      s.verify(root, ns, problems);
    }
    VerificationReport report = new VerificationReport(problems);

    if (!report.isValid() && log.isDebugEnabled()) {
      log.debug("avronames.schema result=rejected root={} problems={} codes={}",
          NameResolver.nameOf(root),
          problems.size(),
          problems.stream().map(NameProblem::code).distinct().toList());
    }
    return report;
  }

  /** Like {@link #verify(AvroType, String)} but throws when anything is wrong. */
  public VerificationReport verifyOrThrow(AvroType root, String enclosingNamespace) {
    VerificationReport report = verify(root, enclosingNamespace);
    if (!report.isValid()) throw new SchemaVerificationException(report);
    return report;
  }
}
