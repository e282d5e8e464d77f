package ca.gc.cra.nmapper.domain.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class IpOrderTest {

  @Test
  void sortsIpv4NumericallyBeforeOtherAddresses() {
    List<String> ips = new ArrayList<>(List.of("fe80::1", "10.0.0.10", "10.0.0.9", "9.255.255.255"));

    ips.sort(IpOrder.ASCENDING);

    assertEquals(List.of("9.255.255.255", "10.0.0.9", "10.0.0.10", "fe80::1"), ips);
  }

  @Test
  void zeroPaddedSpellingIsADistinctKey() {
    assertNotEquals(0, IpOrder.compare("010.0.0.1", "10.0.0.1"));
    assertEquals(-IpOrder.compare("010.0.0.1", "10.0.0.1"), IpOrder.compare("10.0.0.1", "010.0.0.1"));
    assertTrue(IpOrder.compare("010.0.0.1", "10.0.0.2") < 0);
    assertEquals(0, IpOrder.compare("10.0.0.1", "10.0.0.1"));
  }
}
