package com.codeheadsystems.hashchain.dagger;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.dbu.model.ImmutableDatabase;
import com.codeheadsystems.hashchain.model.ImmutableConfiguration;
import com.codeheadsystems.hashchain.model.ImmutableLedgerConfiguration;
import com.codeheadsystems.hashchain.model.StoreType;
import com.codeheadsystems.hashchain.model.StreamKind;
import com.codeheadsystems.hashchain.store.JdbiLedgerStore;
import com.codeheadsystems.hashchain.store.VolatileLedgerStore;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LedgerComponentTest {

  private ImmutableConfiguration.Builder configuration() {
    return ImmutableConfiguration.builder()
        .database(ImmutableDatabase.builder()
            .url("jdbc:hsqldb:mem:LedgerComponentTest" + UUID.randomUUID())
            .username("SA")
            .password("")
            .build());
  }

  @Test
  void testJdbiStore() {
    final LedgerComponent component = LedgerComponent.instance(configuration().build());

    assertThat(component.ledgerStore()).isInstanceOf(JdbiLedgerStore.class);
    assertThat(component.hashChainLedger()).isSameAs(component.hashChainLedger());
    assertThat(component.jdbi().<Long, RuntimeException>withHandle(handle ->
        handle.createQuery("select count(*) from LEDGER_RECORD").mapTo(Long.class).one())).isZero();
  }

  @Test
  void testVolatileStore() {
    final LedgerComponent component = LedgerComponent.instance(configuration()
        .ledger(ImmutableLedgerConfiguration.builder().storeType(StoreType.VOLATILE).build())
        .build());

    assertThat(component.ledgerStore()).isInstanceOf(VolatileLedgerStore.class);
    component.hashChainLedger().append(StreamKind.LEGAL_HOLDS, null, List.of(), "counsel");
    assertThat(component.chainVerifier().verifyAll(StreamKind.LEGAL_HOLDS)).hasSize(1);
  }

}
