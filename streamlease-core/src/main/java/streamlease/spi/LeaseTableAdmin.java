package streamlease.spi;

/**
 * Provisions the storage behind a {@link LeaseStore}. One table per consumer application.
 */
public interface LeaseTableAdmin {
  /**
   * Creates the table if needed and waits until it can serve requests.
   */
  void createTableIfNotExists(String tableName);

  /**
   * @return false if there was no such table
   */
  boolean deleteTableIfExists(String tableName);
}
