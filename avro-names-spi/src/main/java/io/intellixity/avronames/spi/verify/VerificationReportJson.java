package io.intellixity.avronames.spi.verify;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/** Renders a {@link VerificationReport} as pretty-printed JSON for schema authors. Output is deterministic. */
public final class VerificationReportJson {
  private static final ObjectWriter WRITER = createWriter();

  private VerificationReportJson() {}

  public static String toJsonString(VerificationReport report) {
    Objects.requireNonNull(report, "report");
    try {
      return WRITER.writeValueAsString(report) + "\n";
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to JSON-encode verification report", e);
    }
  }

  public static void write(VerificationReport report, Writer out) throws IOException {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(out, "out");
    WRITER.writeValue(out, report);
    out.write('\n');
    out.flush();
  }

  private static ObjectWriter createWriter() {
    ObjectMapper om = new ObjectMapper();
    // Callers own the Writer.
    om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
    DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
    pp.indentObjectsWith(indenter);
    pp.indentArraysWith(indenter);
    return om.writer(pp);
  }
}
