package ca.gc.cra.nmapper.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Network address validation for scan targets and broker endpoints.
 *
 * <p>Scan targets accept a single IPv4/IPv6 literal, an IPv4 CIDR block or an IPv4 dash range
 * ({@code 10.0.0.1-10.0.0.20} or the short form {@code 10.0.0.1-20}). Hostnames are never resolved.</p>
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");
  private static final Pattern OCTET_PATTERN = Pattern.compile("\\A\\d{1,3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates an IPv4 or IPv6 literal without performing DNS lookups.
   *
   * @param value candidate address
   * @return trimmed address
   * @throws IllegalArgumentException if the value is not an IP literal
   */
  public static String validateIpLiteral(String value) {
    String sanitized = Strings.requireNonBlank("ip", value);
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      ipv4ToLong(sanitized);
      return sanitized;
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
      return sanitized;
    }
    throw new IllegalArgumentException("not an IP address: " + sanitized);
  }

  /**
   * Validates an IPv4 CIDR block such as {@code 192.168.1.0/24}.
   *
   * @param value candidate block
   * @return trimmed block
   * @throws IllegalArgumentException if the address or prefix length is invalid
   */
  public static String validateCidr(String value) {
    String sanitized = Strings.requireNonBlank("cidr", value);
    int slash = sanitized.indexOf('/');
    if (slash <= 0 || slash == sanitized.length() - 1 || sanitized.indexOf('/', slash + 1) >= 0) {
      throw new IllegalArgumentException("CIDR must use ADDRESS/PREFIX format");
    }
    String address = sanitized.substring(0, slash);
    String prefix = sanitized.substring(slash + 1);
    if (!IPV4_PATTERN.matcher(address).matches()) {
      throw new IllegalArgumentException("CIDR address must be IPv4 (was " + address + ")");
    }
    ipv4ToLong(address);
    Numbers.parseInRange("CIDR prefix", prefix, 0, 32);
    return sanitized;
  }

  /**
   * Validates an IPv4 dash range. The end may be a full address or a last-octet number.
   *
   * @param value candidate range
   * @return trimmed range
   * @throws IllegalArgumentException if either bound is invalid or the start exceeds the end
   */
  public static String validateIpRange(String value) {
    String sanitized = Strings.requireNonBlank("range", value);
    int dash = sanitized.indexOf('-');
    if (dash <= 0 || dash == sanitized.length() - 1 || sanitized.indexOf('-', dash + 1) >= 0) {
      throw new IllegalArgumentException("range must use START-END format");
    }
    String start = sanitized.substring(0, dash).trim();
    String end = sanitized.substring(dash + 1).trim();
    if (!IPV4_PATTERN.matcher(start).matches()) {
      throw new IllegalArgumentException("range start must be IPv4 (was " + start + ")");
    }
    long startValue = ipv4ToLong(start);
    long endValue;
    if (OCTET_PATTERN.matcher(end).matches()) {
      long lastOctet = Numbers.parseInRange("range end octet", end, 0, 255);
      endValue = (startValue & 0xFFFFFF00L) | lastOctet;
    } else if (IPV4_PATTERN.matcher(end).matches()) {
      endValue = ipv4ToLong(end);
    } else {
      throw new IllegalArgumentException("range end must be IPv4 or an octet (was " + end + ")");
    }
    if (startValue > endValue) {
      throw new IllegalArgumentException("range start must not exceed range end");
    }
    return start + "-" + end;
  }

  /**
   * Converts a dotted-quad IPv4 address to its unsigned numeric value.
   *
   * @param address IPv4 literal
   * @return value in {@code 0..2^32-1}
   * @throws IllegalArgumentException if the value is not a valid dotted quad
   */
  public static long ipv4ToLong(String address) {
    if (address == null || !IPV4_PATTERN.matcher(address).matches()) {
      throw new IllegalArgumentException("not an IPv4 address: " + address);
    }
    long result = 0;
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      int endIndex = (i < 3) ? address.indexOf('.', startIndex) : address.length();
      int octet = Integer.parseInt(address.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      result = (result << 8) | octet;
      startIndex = endIndex + 1;
    }
    return result;
  }

  /**
   * Validates a comma-separated list of {@code host:port} Kafka bootstrap servers.
   *
   * @param value candidate list
   * @return normalized list joined with commas
   * @throws IllegalArgumentException if any entry is invalid
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    List<String> normalized = new ArrayList<>();
    for (String token : sanitized.split(",")) {
      if (!token.isBlank()) {
        normalized.add(validateHostPort(token));
      }
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap must list at least one host:port");
    }
    return String.join(",", normalized);
  }

  /**
   * Validates a host:port string supporting hostnames, IPv4 and bracketed IPv6 literals.
   *
   * @param value candidate endpoint
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the host or port is invalid
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    String normalizedHost;

    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      host = sanitized.substring(1, idx);
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
      normalizedHost = '[' + host + ']';
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        ipv4ToLong(host);
      } else {
        validateHostname(host);
      }
      normalizedHost = host;
    }

    long port = Numbers.parseInRange("port", portPart, 1, 65535);
    return normalizedHost + ':' + port;
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  // IPV6_CHARS keeps InetAddress from attempting a DNS lookup on hostnames.
  private static void validateIpv6(String host) {
    if (!IPV6_CHARS.matcher(host).matches()) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host);
    }
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
