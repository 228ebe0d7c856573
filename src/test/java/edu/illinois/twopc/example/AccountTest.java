package edu.illinois.twopc.example;

import static java.util.concurrent.TimeUnit.SECONDS;

import java.io.IOException;

import org.apache.hadoop.conf.Configuration;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import edu.illinois.twopc.coordinator.Outcome;
import edu.illinois.twopc.coordinator.TID;
import edu.illinois.twopc.coordinator.impl.InMemoryTransactionStore;
import edu.illinois.twopc.coordinator.impl.TransactionCoordinator;

public class AccountTest {

  private TransactionCoordinator coordinator;
  private Account a;
  private Account b;

  @Before
  public void before() {
    coordinator = new TransactionCoordinator(new Configuration(false),
        new InMemoryTransactionStore());
    a = new Account("a", coordinator, 1000);
    b = new Account("b", coordinator, 1000);
  }

  @After
  public void after() throws IOException {
    coordinator.close();
  }

  @Test
  public void testTransfer() throws Exception {
    Assert.assertEquals(Outcome.COMMITTED,
        Example.transfer(coordinator, a, b, 400));
    Assert.assertEquals(600, a.getValue());
    Assert.assertEquals(1400, b.getValue());
    Assert.assertFalse(a.isLocked());
    Assert.assertFalse(b.isLocked());
  }

  @Test
  public void testOverdraftAborts() throws Exception {
    Assert.assertEquals(Outcome.ABORTED,
        Example.transfer(coordinator, a, b, 1500));
    Assert.assertEquals(1000, a.getValue());
    Assert.assertEquals(1000, b.getValue());
    Assert.assertFalse(a.isLocked());
    Assert.assertFalse(b.isLocked());

    // locks are released, so the accounts can be used again
    Assert.assertEquals(Outcome.COMMITTED,
        Example.transfer(coordinator, b, a, 1000));
    Assert.assertEquals(2000, a.getValue());
    Assert.assertEquals(0, b.getValue());
  }

  @Test
  public void testStagedValueVisibleToOwner() throws Exception {
    TID tid = coordinator.begin();
    a.decrement(tid, 250);
    Assert.assertEquals(750, a.value(tid));
    Assert.assertEquals(1000, a.getValue());
  }

  @Test
  public void testLockedByOtherTransaction() throws Exception {
    TID first = coordinator.begin();
    TID second = coordinator.begin();
    a.value(first);
    try {
      a.increment(second, 10);
      Assert.fail("account is locked by the first transaction");
    } catch (IllegalStateException e) {
      // expected
    }
    // requests for transactions that do not hold the lock are ignored
    a.rollBack(second, coordinator);
    Assert.assertTrue(a.isLocked());
  }

  @Test
  public void testExample() throws Exception {
    Example.main(new String[0]);
  }

}
