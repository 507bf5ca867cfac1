package io.intellixity.avronames.spi.verify;

import io.intellixity.avronames.types.AvroType;

import java.util.List;

/**
 * SPI hook to check a whole type tree before it is accepted into a schema.
 * <p>
 * {@link SchemaVerifier} runs {@link DefaultTypeVerificationStrategy} first, then every implementation listed in
 * {@code META-INF/avro-names.factories}. Implementations append to {@code problems} instead of throwing, so one
 * run reports everything that is wrong. They must be stateless.
 */
public interface TypeVerificationStrategy {
  void verify(AvroType root, String enclosingNamespace, List<NameProblem> problems);
}
