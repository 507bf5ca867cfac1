package io.intellixity.avronames.types;

import java.util.List;
import java.util.Objects;

/**
 * Record type with named fields.
 *
 * @param fullname canonical dotted name; empty until resolved
 */
public record RecordType(
    String name,
    String namespace,
    String fullname,
    List<RecordField> fields
) implements NamedType {
  public RecordType {
    Objects.requireNonNull(name, "name");
    namespace = namespace == null ? "" : namespace;
    fullname = fullname == null ? "" : fullname;
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  /** Unresolved record: fullname is filled in later by the resolver. */
  public static RecordType of(String name, String namespace, List<RecordField> fields) {
    return new RecordType(name, namespace, "", fields);
  }

  @Override
  public RecordType withFullname(String fullname) {
    return new RecordType(name, namespace, fullname, fields);
  }

  @Override
  public <R> R accept(AvroTypeVisitor<R> visitor) { return visitor.visit(this); }
}
