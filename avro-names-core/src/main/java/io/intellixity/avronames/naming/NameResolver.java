package io.intellixity.avronames.naming;

import io.intellixity.avronames.types.*;

import java.util.Objects;
import java.util.Optional;

/**
 * Computes canonical short names, namespaces and fullnames of type descriptions.
 * <p>
 * Resolution precedence is: a dotted name qualifies itself, then an explicit namespace, then the
 * namespace inherited from the enclosing type. All methods are pure.
 */
public final class NameResolver {
  private NameResolver() {}

  public static boolean isNamedType(AvroType type) {
    Objects.requireNonNull(type, "type");
    return type instanceof NamedType;
  }

  /**
   * Returns the stored name. For named types this is the name field exactly as given (short or dotted);
   * unnamed types answer with their format token.
   */
  public static String nameOf(AvroType type) {
    return Objects.requireNonNull(type, "type").accept(NAME);
  }

  /** Stored namespace of record/enum/fixed (possibly empty); empty for every other type. */
  public static String namespaceOf(AvroType type) {
    return Objects.requireNonNull(type, "type").accept(NAMESPACE);
  }

  /**
   * Stored fullname. Not recomputed: a named type returns whatever resolution put there, so callers
   * must resolve it first (see {@link #withResolvedFullname(AvroType, String)}).
   */
  public static String fullnameOf(AvroType type) {
    return Objects.requireNonNull(type, "type").accept(FULLNAME);
  }

  /**
   * Splits at the rightmost dot: {@code "a.b.c"} gives short name {@code "c"} and namespace {@code "a.b"}.
   * Returns empty when there is no dot at all.
   */
  public static Optional<SplitName> splitFullname(String fullname) {
    Objects.requireNonNull(fullname, "fullname");
    int dot = fullname.lastIndexOf('.');
    if (dot < 0) return Optional.empty();
    return Optional.of(new SplitName(fullname.substring(dot + 1), fullname.substring(0, dot)));
  }

  public static SplitName resolveName(String typeName, String namespace, String enclosingNamespace) {
    Objects.requireNonNull(typeName, "typeName");
    Optional<SplitName> qualified = splitFullname(typeName);
    if (qualified.isPresent()) return qualified.get();

    String ns = namespace == null || namespace.isEmpty() ? nullToEmpty(enclosingNamespace) : namespace;
    return new SplitName(typeName, ns);
  }

  /** Same as {@link #resolveName(String, String, String)} using the type's own name and namespace. */
  public static SplitName resolveName(AvroType type, String enclosingNamespace) {
    return resolveName(nameOf(type), namespaceOf(type), enclosingNamespace);
  }

  public static String buildFullname(String typeName, String namespace, String enclosingNamespace) {
    return resolveName(typeName, namespace, enclosingNamespace).fullname();
  }

  public static String buildFullname(AvroType type, String enclosingNamespace) {
    return buildFullname(nameOf(type), namespaceOf(type), enclosingNamespace);
  }

  /**
   * Returns a named type whose fullname field holds its canonical fullname under the given enclosing
   * namespace. Unnamed types are returned unchanged.
   */
  public static AvroType withResolvedFullname(AvroType type, String enclosingNamespace) {
    Objects.requireNonNull(type, "type");
    if (!(type instanceof NamedType named)) return type;
    return named.withFullname(buildFullname(named, enclosingNamespace));
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }

  private static final AvroTypeVisitor<String> NAME = new AvroTypeVisitor<>() {
    @Override public String visit(PrimitiveType primitive) { return primitive.name(); }
    @Override public String visit(RecordType record) { return record.name(); }
    @Override public String visit(EnumType enumType) { return enumType.name(); }
    @Override public String visit(FixedType fixed) { return fixed.name(); }
    @Override public String visit(ArrayType array) { return AvroTypeNames.ARRAY; }
    @Override public String visit(MapType map) { return AvroTypeNames.MAP; }
    @Override public String visit(UnionType union) { return AvroTypeNames.UNION; }
  };

  private static final AvroTypeVisitor<String> NAMESPACE = new AvroTypeVisitor<>() {
    @Override public String visit(PrimitiveType primitive) { return ""; }
    @Override public String visit(RecordType record) { return record.namespace(); }
    @Override public String visit(EnumType enumType) { return enumType.namespace(); }
    @Override public String visit(FixedType fixed) { return fixed.namespace(); }
    @Override public String visit(ArrayType array) { return ""; }
    @Override public String visit(MapType map) { return ""; }
    @Override public String visit(UnionType union) { return ""; }
  };

  private static final AvroTypeVisitor<String> FULLNAME = new AvroTypeVisitor<>() {
    @Override public String visit(PrimitiveType primitive) { return primitive.name(); }
    @Override public String visit(RecordType record) { return record.fullname(); }
    @Override public String visit(EnumType enumType) { return enumType.fullname(); }
    @Override public String visit(FixedType fixed) { return fixed.fullname(); }
    @Override public String visit(ArrayType array) { return AvroTypeNames.ARRAY; }
    @Override public String visit(MapType map) { return AvroTypeNames.MAP; }
    @Override public String visit(UnionType union) { return AvroTypeNames.UNION; }
  };
}
