package ca.gc.cra.docwatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value  "));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0001b"));
  }

  @Test
  void requireMailAddressNeedsAtAndDot() {
    assertEquals("ops@example.com", Strings.requireMailAddress("receiver_email", " ops@example.com"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireMailAddress("receiver_email", "ops-example"));
    assertEquals("receiver_email is not a valid e-mail address: ops-example", ex.getMessage());
  }
}
