package ca.gc.cra.envlayers.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void environmentNamesAreUpperCase() {
    assertEquals("DB_PORT", Strings.requireEnvironmentName("variable", " DB_PORT "));
    assertEquals("_X1", Strings.requireEnvironmentName("variable", "_X1"));
  }

  @Test
  void environmentNamesRejectOtherShapes() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvironmentName("variable", "db_port"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvironmentName("variable", "1PORT"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvironmentName("variable", "DB-PORT"));
  }
}
