package com.codeheadsystems.dbu.liquibase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.dbu.factory.JdbiFactory;
import com.codeheadsystems.dbu.model.Database;
import com.codeheadsystems.dbu.model.ImmutableDatabase;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LiquibaseHelperTest {

  private Jdbi jdbi;

  @BeforeEach
  void setup() {
    Database database = ImmutableDatabase.builder()
        .url("jdbc:hsqldb:mem:" + getClass().getSimpleName() + ":" + UUID.randomUUID())
        .username("SA")
        .password("")
        .build();
    jdbi = new JdbiFactory(database, Set.of()).createJdbi();
  }

  @Test
  void runLiquibase() {
    new LiquibaseHelper().runLiquibase(jdbi, "liquibase/test-setup.xml");
    final List<Map<String, Object>> list = jdbi.withHandle(handle -> handle.createQuery("select * from SAMPLE_TABLE").mapToMap().list());
    assertThat(list).isEmpty();
  }

  @Test
  void runLiquibase_twiceIsIdempotent() {
    final LiquibaseHelper helper = new LiquibaseHelper();
    helper.runLiquibase(jdbi, "liquibase/test-setup.xml");
    helper.runLiquibase(jdbi, "liquibase/test-setup.xml");
    final Integer count = jdbi.withHandle(handle -> handle.createQuery("select count(*) from SAMPLE_TABLE").mapTo(Integer.class).one());
    assertThat(count).isZero();
  }

  @Test
  void runLiquibase_missingChangelog() {
    assertThatExceptionOfType(IllegalStateException.class)
        .isThrownBy(() -> new LiquibaseHelper().runLiquibase(jdbi, "liquibase/does-not-exist.xml"));
  }

}
