package ca.gc.cra.nmapper.domain.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.nmapper.domain.error.ValidationException;
import org.junit.jupiter.api.Test;

class ScanTargetTest {

  @Test
  void classifiesCidrRangeAndSingleAddress() {
    assertEquals(ScanTarget.Kind.CIDR, ScanTarget.parse("192.168.1.0/24").kind());
    assertEquals(ScanTarget.Kind.RANGE, ScanTarget.parse("10.0.0.1-40").kind());
    assertEquals(ScanTarget.Kind.SINGLE, ScanTarget.parse(" 10.0.0.5 ").kind());
    assertEquals("10.0.0.5", ScanTarget.parse(" 10.0.0.5 ").value());
  }

  @Test
  void malformedTargetsAreValidationErrors() {
    assertThrows(ValidationException.class, () -> ScanTarget.parse(""));
    assertThrows(ValidationException.class, () -> ScanTarget.parse("10.0.0.0/33"));
    assertThrows(ValidationException.class, () -> ScanTarget.parse("10.0.0.40-10.0.0.1"));
    assertThrows(ValidationException.class, () -> ScanTarget.parse("not-an-ip"));
    assertThrows(ValidationException.class, () -> ScanTarget.parse("300.1.1.1"));
  }

  @Test
  void profileDefaultsToDiscovery() {
    assertEquals(ScanProfile.DISCOVERY, ScanProfile.from(null));
    assertEquals(ScanProfile.QUICK, ScanProfile.from("Quick"));
    assertThrows(ValidationException.class, () -> ScanProfile.from("stealth"));
  }
}
