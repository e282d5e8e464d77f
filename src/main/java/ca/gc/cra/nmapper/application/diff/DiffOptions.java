package ca.gc.cra.nmapper.application.diff;

import java.util.Objects;

/**
 * Comparison switches for {@link SnapshotDiffEngine}.
 *
 * @param identityPolicy device matching policy
 * @param detectOsChanges whether {@code osInfo.*} properties are compared
 * @param detectServiceChanges whether service lists are compared
 * @param includeLastSeen whether {@code lastSeen} differences count as property changes
 * @param osAccuracyThreshold minimum absolute {@code osInfo.accuracy} difference reported as a change
 * @since 0.1.0
 */
public record DiffOptions(
    DeviceIdentityPolicy identityPolicy,
    boolean detectOsChanges,
    boolean detectServiceChanges,
    boolean includeLastSeen,
    int osAccuracyThreshold) {

  public DiffOptions {
    identityPolicy = Objects.requireNonNullElse(identityPolicy, DeviceIdentityPolicy.IP);
    if (osAccuracyThreshold < 1 || osAccuracyThreshold > 100) {
      throw new IllegalArgumentException("osAccuracyThreshold must be between 1 and 100");
    }
  }

  /**
   * IP identity, OS and service detection on, {@code lastSeen} ignored, accuracy threshold 10.
   *
   * @return default options
   */
  public static DiffOptions defaults() {
    return new DiffOptions(DeviceIdentityPolicy.IP, true, true, false, 10);
  }

  /**
   * Copy of these options with a different identity policy.
   *
   * @param policy identity policy
   * @return adjusted options
   */
  public DiffOptions withIdentityPolicy(DeviceIdentityPolicy policy) {
    return new DiffOptions(policy, detectOsChanges, detectServiceChanges, includeLastSeen, osAccuracyThreshold);
  }
}
