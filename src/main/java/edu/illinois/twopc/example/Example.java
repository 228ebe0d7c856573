package edu.illinois.twopc.example;

import java.util.concurrent.TimeUnit;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;

import edu.illinois.twopc.coordinator.Outcome;
import edu.illinois.twopc.coordinator.TID;
import edu.illinois.twopc.coordinator.impl.InMemoryTransactionStore;
import edu.illinois.twopc.coordinator.impl.TransactionCoordinator;

/**
 * Moves half of one account's balance into another account in a single
 * transaction.
 */
public class Example {

  private static final Log LOG = LogFactory.getLog(Example.class);

  public static Outcome transfer(TransactionCoordinator coordinator,
      Account from, Account to, long amount) throws Exception {
    TID tid = coordinator.begin();
    from.decrement(tid, amount);
    to.increment(tid, amount);
    return coordinator.commit(tid).get(30, TimeUnit.SECONDS);
  }

  public static void main(String[] args) throws Exception {
    TransactionCoordinator coordinator = new TransactionCoordinator(
        new Configuration(), new InMemoryTransactionStore());
    try {
      Account account = new Account("a", coordinator, 1000);
      Account otherAccount = new Account("b", coordinator, 1000);

      TID tid = coordinator.begin();
      long amount = Math.round(account.value(tid) / 2.0);
      account.decrement(tid, amount);
      otherAccount.increment(tid, amount);
      Outcome outcome = coordinator.commit(tid).get(30, TimeUnit.SECONDS);

      LOG.info("Transfer of " + amount + " " + outcome + ": " + account
          + " = " + account.getValue() + ", " + otherAccount + " = "
          + otherAccount.getValue());
    } finally {
      coordinator.close();
    }
  }

}
