package ca.gc.cra.nmapper.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void trimsNonBlankValues() {
    assertEquals("nmapper", Strings.requireNonBlank("name", "  nmapper "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void topicsUseKafkaCharacters() {
    assertEquals("nmapper.changes-v1", Strings.sanitizeTopic("topic", " nmapper.changes-v1 "));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("topic", "bad topic"));
  }

  @Test
  void printableAsciiHasALengthBudget() {
    assertEquals("discovery", Strings.requirePrintableAscii("scanType", "discovery", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("scanType", "x".repeat(17), 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("scanType", "café", 16));
  }

  @Test
  void abbreviatesLongMessages() {
    assertEquals("scan", Strings.abbreviate("scanner exited", 4));
    assertEquals("short", Strings.abbreviate("short", 10));
    assertNull(Strings.abbreviate(null, 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.abbreviate("x", 0));
  }
}
