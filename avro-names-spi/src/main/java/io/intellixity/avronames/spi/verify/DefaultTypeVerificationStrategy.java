package io.intellixity.avronames.spi.verify;

import io.intellixity.avronames.naming.NameError;
import io.intellixity.avronames.naming.NameGrammar;
import io.intellixity.avronames.naming.NameResolver;
import io.intellixity.avronames.naming.TypeVerifier;
import io.intellixity.avronames.naming.VerificationResult;
import io.intellixity.avronames.types.*;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Default, tree-wide name verification.
 *
 * Checks:
 * <ul>
 *   <li>every named type with {@link TypeVerifier}, after resolving its fullname against the enclosing namespace</li>
 *   <li>a stored fullname equals the canonical one</li>
 *   <li>no fullname is defined twice in the tree</li>
 *   <li>record field names and enum symbols are simple names, unique within their type</li>
 * </ul>
 * A named type passes its resolved namespace down to the types nested in it. The walk does not stop at the first
 * problem.
 */
public final class DefaultTypeVerificationStrategy implements TypeVerificationStrategy {
  public static final String FULLNAME_MISMATCH = "fullname_mismatch";
  public static final String DUPLICATE_FULLNAME = "duplicate_fullname";
  public static final String DUPLICATE_FIELD = "duplicate_field";
  public static final String DUPLICATE_SYMBOL = "duplicate_symbol";

  public static final String ROOT_PATH = "$";

  @Override
  public void verify(AvroType root, String enclosingNamespace, List<NameProblem> problems) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(problems, "problems");
    new Walk(problems).walk(root, enclosingNamespace == null ? "" : enclosingNamespace, ROOT_PATH);
  }

  private static final class Walk implements AvroTypeVisitor<Void> {
    private final List<NameProblem> problems;
    private final SchemaNameIndex index = new SchemaNameIndex();
    private String enclosing = "";
    private String path = ROOT_PATH;

    Walk(List<NameProblem> problems) {
      this.problems = problems;
    }

    void walk(AvroType type, String enclosingNamespace, String at) {
      String savedNs = enclosing;
      String savedPath = path;
      enclosing = enclosingNamespace;
      path = at;
      try {
        type.accept(this);
      } finally {
        enclosing = savedNs;
        path = savedPath;
      }
    }

    /** Verifies the named type at the current path and returns the namespace its nested types inherit. */
    private String named(NamedType type) {
      String canonical = NameResolver.buildFullname(type, enclosing);
      // An unresolved fullname is checked in its canonical form; verifyType reports bad name/namespace first.
      NamedType resolved = type.fullname().isEmpty() ? type.withFullname(canonical) : type;

      VerificationResult result = TypeVerifier.verifyType(resolved);
      if (!result.isOk()) {
        problems.add(NameProblem.of(path, result.error().orElseThrow()));
        return enclosing;
      }

      if (!canonical.equals(resolved.fullname())) {
        problems.add(new NameProblem(path, FULLNAME_MISMATCH, resolved.fullname(),
            "Stored fullname '" + resolved.fullname() + "' does not match canonical fullname '" + canonical + "'"));
      }
      if (!index.register(canonical, type)) {
        problems.add(new NameProblem(path, DUPLICATE_FULLNAME, canonical, "Can't redefine '" + canonical + "'"));
      }
      return NameResolver.resolveName(type, enclosing).namespace();
    }

    @Override
    public Void visit(PrimitiveType primitive) {
      return null;
    }

    @Override
    public Void visit(RecordType record) {
      String inner = named(record);
      Set<String> seen = new HashSet<>();
      List<RecordField> fields = record.fields();
      for (int i = 0; i < fields.size(); i++) {
        RecordField f = fields.get(i);
        String at = path + ".fields[" + i + "]";
        if (!NameGrammar.isCorrectName(f.name())) {
          problems.add(NameProblem.of(at, new NameError.InvalidName(f.name())));
        } else if (!seen.add(f.name())) {
          problems.add(new NameProblem(at, DUPLICATE_FIELD, f.name(),
              "Duplicate field '" + f.name() + "' in record '" + record.name() + "'"));
        }
        walk(f.type(), inner, at);
      }
      return null;
    }

    @Override
    public Void visit(EnumType enumType) {
      named(enumType);
      Set<String> seen = new HashSet<>();
      List<String> symbols = enumType.symbols();
      for (int i = 0; i < symbols.size(); i++) {
        String symbol = symbols.get(i);
        String at = path + ".symbols[" + i + "]";
        if (!NameGrammar.isCorrectName(symbol)) {
          problems.add(NameProblem.of(at, new NameError.InvalidName(symbol)));
        } else if (!seen.add(symbol)) {
          problems.add(new NameProblem(at, DUPLICATE_SYMBOL, symbol,
              "Duplicate enum symbol '" + symbol + "' in enum '" + enumType.name() + "'"));
        }
      }
      return null;
    }

    @Override
    public Void visit(FixedType fixed) {
      named(fixed);
      return null;
    }

    @Override
    public Void visit(ArrayType array) {
      walk(array.items(), enclosing, path + ".items");
      return null;
    }

    @Override
    public Void visit(MapType map) {
      walk(map.values(), enclosing, path + ".values");
      return null;
    }

    @Override
    public Void visit(UnionType union) {
      List<AvroType> branches = union.branches();
      for (int i = 0; i < branches.size(); i++) {
        walk(branches.get(i), enclosing, path + ".branches[" + i + "]");
      }
      return null;
    }
  }
}
