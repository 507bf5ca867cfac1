package io.intellixity.avronames.naming;

import io.intellixity.avronames.types.AvroType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static io.intellixity.avronames.naming.NameGrammar.isCorrectDottedName;

/**
 * Checks that a type description's names are well formed and do not shadow a built-in type.
 * <p>
 * Only named types are inspected. Checks run in a fixed order and stop at the first failure: grammar of
 * name, namespace and fullname first, then the reserved-name check on the canonical short name. The
 * grammar checks must come first because splitting assumes non-empty, well-formed segments.
 */
public final class TypeVerifier {
  private static final Logger log = LoggerFactory.getLogger(TypeVerifier.class);

  private TypeVerifier() {}

  public static VerificationResult verifyType(AvroType type) {
    Objects.requireNonNull(type, "type");
    if (!NameResolver.isNamedType(type)) return VerificationResult.ok();

    String name = NameResolver.nameOf(type);
    String ns = NameResolver.namespaceOf(type);
    String fullname = NameResolver.fullnameOf(type);

    if (!isCorrectDottedName(name)) return reject(new NameError.InvalidName(name));
    if (!ns.isEmpty() && !isCorrectDottedName(ns)) return reject(new NameError.InvalidName(ns));
    if (!isCorrectDottedName(fullname)) return reject(new NameError.InvalidName(fullname));

    // Only the short name matters here, so the enclosing namespace is irrelevant.
    String shortName = NameResolver.resolveName(name, ns, "").shortName();
    if (ReservedNames.isReserved(shortName)) return reject(new NameError.ReservedNameUsed(shortName));

    return VerificationResult.ok();
  }

  /** Fail-fast variant of {@link #verifyType(AvroType)}. */
  public static void requireValid(AvroType type) {
    verifyType(type).orThrow();
  }

  private static VerificationResult reject(NameError error) {
    log.debug("avronames.verify result=rejected code={} subject='{}'", error.code(), error.subject());
    return VerificationResult.failed(error);
  }
}
