package ca.gc.cra.nmapper.domain.network;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Total ordering of IP address strings: IPv4 numerically, then everything else lexicographically. Only equal
 * strings compare as equal.
 *
 * <p>Used wherever output ordering must be deterministic (diff entries, snapshot devices).</p>
 *
 * @since 0.1.0
 */
public final class IpOrder {
  private static final Pattern IPV4 = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  /** Comparator over IP strings. */
  public static final Comparator<String> ASCENDING = IpOrder::compare;

  private IpOrder() {}

  /**
   * Compares two IP strings.
   *
   * @param left first address
   * @param right second address
   * @return negative, zero or positive as {@code left} sorts before, equal to or after {@code right}
   */
  public static int compare(String left, String right) {
    long l = ipv4Value(left);
    long r = ipv4Value(right);
    if (l >= 0 && r >= 0) {
      int byValue = Long.compare(l, r);
      // zero-padded spellings of one address are still distinct keys
      return byValue != 0 ? byValue : left.compareTo(right);
    }
    if (l >= 0) {
      return -1;
    }
    if (r >= 0) {
      return 1;
    }
    return left.compareTo(right);
  }

  private static long ipv4Value(String ip) {
    if (ip == null || !IPV4.matcher(ip).matches()) {
      return -1;
    }
    long value = 0;
    for (String part : ip.split("\\.")) {
      int octet = Integer.parseInt(part);
      if (octet > 255) {
        return -1;
      }
      value = (value << 8) | octet;
    }
    return value;
  }
}
