package io.github.suppierk.documentstore.persistence;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.sql.DriverManager;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

class JooqStorageDriverTest extends StorageDriverContract {
  static DSLContext newDatabase() {
    try {
      final var connection =
          DriverManager.getConnection(
              "jdbc:h2:mem:"
                  + UUID.randomUUID()
                  + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
      return DSL.using(connection, SQLDialect.H2);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  @Override
  StorageDriver newDriver() {
    final var driver = JooqStorageDriver.using(newDatabase());
    driver.createSchema();
    return driver;
  }

  @Test
  void when_any_of_the_providers_is_null_illegal_argument_must_be_thrown() {
    final var provider = DslContextProvider.dslContextIdentity(newDatabase());

    assertThrows(IllegalArgumentException.class, () -> new JooqStorageDriver(null, provider));
    assertThrows(IllegalArgumentException.class, () -> new JooqStorageDriver(provider, null));
    assertThrows(IllegalArgumentException.class, () -> JooqStorageDriver.using(null));
  }

  @Test
  void when_the_schema_is_created_twice_nothing_fails() {
    final var driver = JooqStorageDriver.using(newDatabase());

    assertDoesNotThrow(driver::createSchema);
    assertDoesNotThrow(driver::createSchema);
  }
}
