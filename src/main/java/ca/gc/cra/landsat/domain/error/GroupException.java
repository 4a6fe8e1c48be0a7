package ca.gc.cra.landsat.domain.error;

/**
 * Thrown when a caller iterates over a group that the metadata store does not contain.
 *
 * @since 0.1.0
 */
public final class GroupException extends LandsatMetadataException {
  private final String group;

  /**
   * Creates an exception naming the missing group.
   *
   * @param group requested group name as supplied by the caller
   */
  public GroupException(String group) {
    super("Not possible to iterate over non existing group: " + group);
    this.group = group;
  }

  /**
   * Returns the group that was requested.
   *
   * @return group name as supplied by the caller
   */
  public String group() {
    return group;
  }
}
