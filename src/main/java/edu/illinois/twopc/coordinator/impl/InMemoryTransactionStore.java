package edu.illinois.twopc.coordinator.impl;

import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentSkipListMap;

import com.google.common.collect.ImmutableSortedMap;

import edu.illinois.twopc.coordinator.Participant;
import edu.illinois.twopc.coordinator.TID;
import edu.illinois.twopc.coordinator.TransactionStore;
import edu.illinois.twopc.tm.Transaction;

/**
 * Keeps transactions in memory only: survives a coordinator being closed and
 * replaced within the same process, but not a process crash.
 */
public class InMemoryTransactionStore implements TransactionStore {

  private final SortedMap<TID, Transaction<Participant>> transactions = new ConcurrentSkipListMap<TID, Transaction<Participant>>();

  @Override
  public void put(TID tid, Transaction<Participant> transaction) {
    transactions.put(tid, transaction);
  }

  @Override
  public void remove(TID tid) {
    transactions.remove(tid);
  }

  @Override
  public Map<TID, Transaction<Participant>> loadAll() {
    return ImmutableSortedMap.copyOfSorted(transactions);
  }

  public Transaction<Participant> get(TID tid) {
    return transactions.get(tid);
  }

  public int size() {
    return transactions.size();
  }

}
