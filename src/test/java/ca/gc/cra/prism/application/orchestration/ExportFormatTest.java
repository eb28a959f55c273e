package ca.gc.cra.prism.application.orchestration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ExportFormatTest {

  @Test
  void parsesNamesIgnoringCaseAndWhitespace() {
    assertEquals(ExportFormat.PROMETHEUS, ExportFormat.parse("Prometheus"));
    assertEquals(ExportFormat.JSON, ExportFormat.parse(" json "));
  }

  @Test
  void rejectsBlankAndUnknownNames() {
    assertThrows(IllegalArgumentException.class, () -> ExportFormat.parse(null));
    assertThrows(IllegalArgumentException.class, () -> ExportFormat.parse(""));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ExportFormat.parse("csv"));
    assertEquals("Unsupported export format: csv", ex.getMessage());
  }
}
