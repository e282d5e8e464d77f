package ca.gc.cra.nmapper.domain.network;

/**
 * Operating-system fingerprint for a device. All fields are optional.
 *
 * @param name OS name (e.g. {@code Linux 5.x})
 * @param version OS version
 * @param family OS family (e.g. {@code Linux})
 * @param vendor OS vendor
 * @param type device type reported by the fingerprint (e.g. {@code general purpose})
 * @param accuracy fingerprint accuracy in percent, {@code 0..100}
 * @since 0.1.0
 */
public record OsInfo(String name, String version, String family, String vendor, String type, int accuracy) {

  /**
   * Validates the accuracy range.
   *
   * @throws IllegalArgumentException if {@code accuracy} is outside {@code 0..100}
   */
  public OsInfo {
    if (accuracy < 0 || accuracy > 100) {
      throw new IllegalArgumentException("os accuracy must be between 0 and 100 (was " + accuracy + ")");
    }
  }
}
