package com.acme.mailflow.worker.lifecycle;

import io.micronaut.context.annotation.Property;
import jakarta.inject.Singleton;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the Flyway migrations of the configured dialect. A failed migration is logged and the
 * worker keeps running against whatever schema is already there.
 */
@Singleton
public class SchemaMigrator {
  private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

  static final String H2_LOCATION = "classpath:db/migration/h2";
  static final String POSTGRES_LOCATION = "classpath:db/migration/postgres";

  private final DataSource dataSource;
  private final String dialect;
  private final boolean enabled;

  public SchemaMigrator(
      DataSource dataSource,
      @Property(name = "db.dialect", defaultValue = "PostgreSQL") String dialect,
      @Property(name = "mailflow.migrations.enabled", defaultValue = "true") boolean enabled) {
    this.dataSource = dataSource;
    this.dialect = dialect;
    this.enabled = enabled;
  }

  /** Returns true when the schema is known to be current. */
  public boolean migrate() {
    if (!enabled) {
      LOG.info("Schema migrations disabled (mailflow.migrations.enabled=false)");
      return false;
    }
    String location = locationFor(dialect);
    try {
      MigrateResult result =
          Flyway.configure().dataSource(dataSource).locations(location).load().migrate();
      LOG.info("Schema migrated from {}: {} migrations applied, version {}",
          location, result.migrationsExecuted, result.targetSchemaVersion);
      return true;
    } catch (RuntimeException e) {
      LOG.error("Schema migration from {} failed, continuing with existing schema: {}",
          location, e.getMessage(), e);
      return false;
    }
  }

  static String locationFor(String dialect) {
    return "H2".equalsIgnoreCase(dialect) ? H2_LOCATION : POSTGRES_LOCATION;
  }
}
