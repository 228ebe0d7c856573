package edu.illinois.twopc.example;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import edu.illinois.twopc.coordinator.Coordinator;
import edu.illinois.twopc.coordinator.Participant;
import edu.illinois.twopc.coordinator.TID;
import edu.illinois.twopc.tm.TransactionException;

/**
 * A bank account that takes part in transactions. The first transaction to
 * read or adjust the account locks it until that transaction completes; the
 * adjustment is staged and only applied once the transaction commits. The
 * account votes to abort if the staged balance would be negative.
 */
public class Account implements Participant {

  private static final Log LOG = LogFactory.getLog(Account.class);

  private final String name;
  private final Coordinator coordinator;

  // mutable state
  private long value;
  private long stagedValue;
  // transaction holding the lock, null if unlocked
  private TID owner;

  public Account(String name, Coordinator coordinator, long value) {
    this.name = name;
    this.coordinator = coordinator;
    this.value = value;
  }

  public String getName() {
    return name;
  }

  /**
   * Reads the balance as seen by the given transaction and locks the account
   * for it.
   */
  public synchronized long value(TID tid) {
    lock(tid);
    return stagedValue;
  }

  public void increment(TID tid, long amount) throws TransactionException {
    synchronized (this) {
      lock(tid);
      stagedValue += amount;
    }
    LOG.info("Account " + name + " staging adjustment " + amount);
    coordinator.addParticipant(tid, this);
  }

  public void decrement(TID tid, long amount) throws TransactionException {
    increment(tid, -amount);
  }

  /**
   * @return the committed balance
   */
  public synchronized long getValue() {
    return value;
  }

  public synchronized boolean isLocked() {
    return owner != null;
  }

  private void lock(TID tid) {
    if (owner == null) {
      owner = tid;
      stagedValue = value;
    } else if (!owner.equals(tid)) {
      throw new IllegalStateException("Account " + name
          + " is locked by transaction " + owner);
    }
  }

  @Override
  public void prepare(TID tid, Coordinator coordinator) {
    boolean commit;
    synchronized (this) {
      if (!tid.equals(owner))
        return;
      commit = stagedValue >= 0;
    }
    if (commit) {
      LOG.info("Account " + name + " voting to commit");
      coordinator.prepared(tid, this);
    } else {
      LOG.info("Account " + name + " voting to abort");
      coordinator.aborted(tid, this);
    }
  }

  @Override
  public void commit(TID tid, Coordinator coordinator) {
    synchronized (this) {
      if (!tid.equals(owner))
        return;
      value = stagedValue;
      owner = null;
    }
    LOG.info("Account " + name + " committed");
    coordinator.committed(tid, this);
  }

  @Override
  public void rollBack(TID tid, Coordinator coordinator) {
    synchronized (this) {
      if (!tid.equals(owner))
        return;
      stagedValue = value;
      owner = null;
    }
    LOG.info("Account " + name + " rolled back");
    coordinator.rolledBack(tid, this);
  }

  @Override
  public String toString() {
    return "Account(" + name + ")";
  }

}
