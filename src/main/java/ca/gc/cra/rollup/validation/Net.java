package ca.gc.cra.rollup.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Network endpoint validation for the Kafka relay.
 * <p><strong>Why:</strong> A malformed {@code kafkaBootstrap} otherwise surfaces as a slow client
 * timeout long after startup; rejecting it while parsing configuration keeps the failure on the CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated Kafka bootstrap list such as {@code broker1:9092,broker2:9092}.
   *
   * @param value raw bootstrap servers
   * @return normalized list joined with commas and no surrounding whitespace
   * @throws IllegalArgumentException if the list is blank or any entry is not {@code HOST:PORT}
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    List<String> normalized = new ArrayList<>();
    for (String entry : sanitized.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        throw new IllegalArgumentException("kafkaBootstrap contains an empty entry");
      }
      normalized.add(validateHostPort(trimmed));
    }
    return String.join(",", normalized);
  }

  /**
   * Validates a single {@code host:port} pair (hostname, IPv4, or bracketed IPv6).
   *
   * @param value candidate endpoint
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the host or port is invalid
   */
  public static String validateHostPort(String value) {
    final String sanitized = Strings.requireNonBlank("host:port", value);
    final String host;
    final String portPart;
    final String normalizedHost;

    if (sanitized.startsWith("[")) {
      final int idx = sanitized.indexOf(']');
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
      final int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        validateIpv4Octets(host);
      } else {
        validateHostname(host);
      }
      normalizedHost = host;
    }

    final int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return normalizedHost + ':' + port;
  }

  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len);
    }
    int start = 0;
    while (start <= len) {
      int dot = host.indexOf('.', start);
      int end = dot == -1 ? len : dot;
      int labelLen = end - start;
      if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(host.charAt(start)) || !isAsciiAlnum(host.charAt(end - 1))) {
        throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
      }
      for (int i = start + 1; i < end - 1; i++) {
        char c = host.charAt(i);
        if (!(isAsciiAlnum(c) || c == '-')) {
          throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
        }
      }
      if (dot == -1) {
        return;
      }
      start = dot + 1;
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
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
