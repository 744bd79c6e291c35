package ca.gc.cra.docwatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostAcceptsHostname() {
    assertEquals("smtp.qq.com", Net.validateHost("smtp_server", " smtp.qq.com "));
  }

  @Test
  void validateHostAcceptsIpv4() {
    assertEquals("10.0.0.1", Net.validateHost("smtp_server", "10.0.0.1"));
  }

  @Test
  void validateHostRejectsBadOctet() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("smtp_server", "10.0.0.300"));
  }

  @Test
  void validateHostRejectsIllegalCharacters() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Net.validateHost("email.smtp_server", "smtp_qq.com"));
    assertEquals("email.smtp_server: invalid hostname: illegal character '_'", ex.getMessage());
  }

  @Test
  void validateHostRejectsTrailingDot() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("smtp_server", "smtp.qq.com."));
  }

  @Test
  void validatePortRejectsOutOfRange() {
    assertEquals(465, Net.validatePort("smtp_port", 465));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("smtp_port", 0));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("smtp_port", 70000));
  }
}
