package com.gentoro.mistadopt.orchestrator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, thread-safe collection of {@link PushResult}s in completion order.
 *
 * <p>No ordering is implied across devices; use {@link #sortedByIp()} for stable display.
 */
public final class ResultSet {
  private final List<PushResult> results = new CopyOnWriteArrayList<>();

  void add(PushResult result) {
    results.add(result);
  }

  /** Snapshot in completion order. */
  public List<PushResult> results() {
    return List.copyOf(results);
  }

  public List<PushResult> sortedByIp() {
    List<PushResult> copy = new ArrayList<>(results);
    copy.sort(Comparator.comparing(PushResult::ip, ResultSet::compareIp));
    return copy;
  }

  public Optional<PushResult> forIp(String ip) {
    return results.stream().filter(r -> r.ip().equals(ip)).findFirst();
  }

  public int size() {
    return results.size();
  }

  public long successCount() {
    return results.stream().filter(PushResult::isSuccess).count();
  }

  public long failureCount() {
    return size() - successCount();
  }

  /** True only when the set is non-empty and every device succeeded. */
  public boolean allSucceeded() {
    return !results.isEmpty() && results.stream().allMatch(PushResult::isSuccess);
  }

  /** Dotted IPv4 addresses compare numerically, anything else lexically after them. */
  static int compareIp(String a, String b) {
    long na = ipv4Value(a);
    long nb = ipv4Value(b);
    if (na >= 0 && nb >= 0) return Long.compare(na, nb);
    if (na >= 0) return -1;
    if (nb >= 0) return 1;
    return a.compareTo(b);
  }

  private static long ipv4Value(String ip) {
    String[] parts = ip.split("\\.");
    if (parts.length != 4) return -1;
    long value = 0;
    for (String part : parts) {
      if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
        return -1;
      }
      int octet = Integer.parseInt(part);
      if (octet > 255) return -1;
      value = (value << 8) | octet;
    }
    return value;
  }
}
