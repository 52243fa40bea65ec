package ca.gc.cra.faultline.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("kafka.example.com:9092", Net.validateHostPort("kafka.example.com:9092"));
  }

  @Test
  void validateHostPortHandlesIpv6() {
    assertEquals("[2001:db8::1]:9093", Net.validateHostPort("[2001:db8::1]:9093"));
  }

  @Test
  void validateHostPortRejectsMissingPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
  }

  @Test
  void validateHostPortRejectsInvalidPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
  }

  @Test
  void validateHostPortRejectsIpv6WithoutBrackets() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
  }

  @Test
  void validateHostPortListNormalizesEntries() {
    assertEquals("a:9092,b:9093", Net.validateHostPortList(" a:9092 , b:9093 "));
  }

  @Test
  void validateHostPortListRejectsBadEntry() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPortList("a:9092,b"));
  }
}
