package com.codeheadsystems.hashchain.endToEnd;

import com.codeheadsystems.dbu.model.ImmutableDatabase;
import com.codeheadsystems.hashchain.HashChainLedger;
import com.codeheadsystems.hashchain.dagger.LedgerComponent;
import com.codeheadsystems.hashchain.model.Configuration;
import com.codeheadsystems.hashchain.model.ImmutableConfiguration;
import com.codeheadsystems.hashchain.model.ImmutableLedgerConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;

public abstract class BaseEndToEndTest {

  protected LedgerComponent component;
  protected HashChainLedger ledger;

  protected Configuration configuration() {
    return ImmutableConfiguration.builder()
        .database(
            ImmutableDatabase.builder()
                .url("jdbc:hsqldb:mem:LedgerComponentTest" + UUID.randomUUID())
                .username("SA")
                .password("")
                .build())
        .ledger(ImmutableLedgerConfiguration.builder().readPageSize(3).build())
        .build();
  }

  @BeforeEach
  void setupComponent() {
    component = LedgerComponent.instance(configuration());
    ledger = component.hashChainLedger();
  }

}
