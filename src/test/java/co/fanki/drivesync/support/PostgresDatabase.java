package co.fanki.drivesync.support;

import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Builds a migrated {@link Jdbi} on a test container.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PostgresDatabase {

    private PostgresDatabase() {
    }

    /**
     * Creates the test container.
     *
     * @return a container, not yet started
     */
    public static PostgreSQLContainer<?> container() {
        return new PostgreSQLContainer<>("postgres:14")
                .withDatabaseName("testdb")
                .withUsername("test")
                .withPassword("test");
    }

    /**
     * Runs the migrations and connects JDBI to the started container.
     *
     * @param postgres the running container
     * @return the JDBI instance
     */
    public static Jdbi migrate(final PostgreSQLContainer<?> postgres) {
        Flyway.configure()
                .dataSource(postgres.getJdbcUrl(), postgres.getUsername(),
                        postgres.getPassword())
                .locations("classpath:db/migration")
                .load()
                .migrate();

        final Jdbi jdbi = Jdbi.create(postgres.getJdbcUrl(),
                postgres.getUsername(), postgres.getPassword());
        jdbi.installPlugin(new PostgresPlugin());
        return jdbi;
    }

}
