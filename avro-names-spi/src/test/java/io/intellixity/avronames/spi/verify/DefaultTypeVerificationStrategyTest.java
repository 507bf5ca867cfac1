package io.intellixity.avronames.spi.verify;

import io.intellixity.avronames.naming.NameError;
import io.intellixity.avronames.types.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.intellixity.avronames.spi.verify.Schemas.*;
import static org.junit.jupiter.api.Assertions.*;

final class DefaultTypeVerificationStrategyTest {
  private final DefaultTypeVerificationStrategy strategy = new DefaultTypeVerificationStrategy();

  private List<NameProblem> verify(AvroType root, String enclosingNamespace) {
    List<NameProblem> problems = new ArrayList<>();
    strategy.verify(root, enclosingNamespace, problems);
    return problems;
  }

  @Test
  void acceptsWellFormedTree() {
    assertEquals(List.of(), verify(order(), ""));
  }

  @Test
  void unnamedRootWithoutNamedTypesIsFine() {
    assertEquals(List.of(), verify(new MapType(new ArrayType(PrimitiveType.intType())), "ignored"));
  }

  @Test
  void nestedTypesInheritTheResolvedNamespace() {
    // Both Leaf records resolve to c.Leaf: the dotted name c.Deep hands namespace "c" down.
    RecordType tree = recordOf("Outer", "a.b",
        field("deep", recordOf("c.Deep", "x.y", field("leaf", recordOf("Leaf", "")))),
        field("other", recordOf("Leaf", "c")));

    List<NameProblem> problems = verify(tree, "");
    assertEquals(1, problems.size());
    NameProblem p = problems.get(0);
    assertEquals(DefaultTypeVerificationStrategy.DUPLICATE_FULLNAME, p.code());
    assertEquals("c.Leaf", p.subject());
    assertEquals("$.fields[1]", p.path());
  }

  @Test
  void sameShortNameInDifferentNamespacesIsNotADuplicate() {
    RecordType tree = recordOf("Outer", "a",
        field("x", recordOf("Leaf", "")),
        field("y", recordOf("Leaf", "b")));
    assertEquals(List.of(), verify(tree, ""));
  }

  @Test
  void rootUsesTheSuppliedEnclosingNamespace() {
    RecordType tree = recordOf("Order", "",
        field("again", recordOf("com.acme.Order", "")));

    List<NameProblem> problems = verify(tree, "com.acme");
    assertEquals(1, problems.size());
    assertEquals("com.acme.Order", problems.get(0).subject());
    assertTrue(verify(tree, "").isEmpty());
  }

  @Test
  void reportsInvalidAndReservedNamesWithPaths() {
    RecordType tree = recordOf("Order", "com.acme",
        field("status", EnumType.of("int", "", List.of("A"))),
        field("choice", UnionType.of(PrimitiveType.nullType(), FixedType.of("bad-name", "", 4))),
        field("items", new ArrayType(recordOf("Line", "bad..ns"))));

    List<NameProblem> problems = verify(tree, "");
    assertEquals(3, problems.size());

    assertEquals(NameProblem.of("$.fields[0]", new NameError.ReservedNameUsed("int")), problems.get(0));
    assertEquals(NameProblem.of("$.fields[1].branches[1]", new NameError.InvalidName("bad-name")), problems.get(1));
    assertEquals(NameProblem.of("$.fields[2].items", new NameError.InvalidName("bad..ns")), problems.get(2));
  }

  @Test
  void keepsWalkingBelowAnInvalidNamedType() {
    RecordType tree = recordOf("1Order", "",
        field("bad field", PrimitiveType.intType()));

    List<NameProblem> problems = verify(tree, "");
    assertEquals(2, problems.size());
    assertEquals("1Order", problems.get(0).subject());
    assertEquals("$", problems.get(0).path());
    assertEquals(NameError.InvalidName.CODE, problems.get(1).code());
    assertEquals("$.fields[0]", problems.get(1).path());
  }

  @Test
  void reportsBadAndDuplicateFieldNames() {
    RecordType tree = recordOf("Point", "geo",
        field("x", PrimitiveType.doubleType()),
        field("x", PrimitiveType.doubleType()),
        field("a.b", PrimitiveType.doubleType()));

    List<NameProblem> problems = verify(tree, "");
    assertEquals(2, problems.size());
    assertEquals(DefaultTypeVerificationStrategy.DUPLICATE_FIELD, problems.get(0).code());
    assertEquals("$.fields[1]", problems.get(0).path());
    assertEquals(NameProblem.of("$.fields[2]", new NameError.InvalidName("a.b")), problems.get(1));
  }

  @Test
  void reportsBadAndDuplicateEnumSymbols() {
    EnumType suit = EnumType.of("Suit", "cards", List.of("HEARTS", "SPADES", "HEARTS", "9", ""));

    List<NameProblem> problems = verify(suit, "");
    assertEquals(3, problems.size());
    assertEquals(DefaultTypeVerificationStrategy.DUPLICATE_SYMBOL, problems.get(0).code());
    assertEquals("$.symbols[2]", problems.get(0).path());
    assertEquals("9", problems.get(1).subject());
    assertEquals("", problems.get(2).subject());
  }

  @Test
  void reportsStoredFullnameThatDisagreesWithCanonical() {
    FixedType md5 = new FixedType("Md5", "hash", "other.Md5", 16);

    List<NameProblem> problems = verify(md5, "");
    assertEquals(1, problems.size());
    assertEquals(DefaultTypeVerificationStrategy.FULLNAME_MISMATCH, problems.get(0).code());
    assertEquals("other.Md5", problems.get(0).subject());
    assertTrue(problems.get(0).message().contains("'hash.Md5'"));

    assertTrue(verify(md5.withFullname("hash.Md5"), "").isEmpty());
  }

  @Test
  void malformedEnclosingNamespaceShowsUpInTheFullname() {
    List<NameProblem> problems = verify(FixedType.of("Md5", "", 16), "a..b");
    assertEquals(List.of(NameProblem.of("$", new NameError.InvalidName("a..b.Md5"))), problems);
  }
}
