package edu.illinois.twopc.coordinator;

import java.io.IOException;
import java.util.Map;

import edu.illinois.twopc.tm.Transaction;

/**
 * Where a coordinator keeps the transactions it drives. The coordinator stores
 * every new transaction value before it acts on it, so an implementation that
 * survives crashes lets a restarted coordinator {@link #loadAll() reload} its
 * transactions and resume them.
 */
public interface TransactionStore {

  void put(TID tid, Transaction<Participant> transaction) throws IOException;

  void remove(TID tid) throws IOException;

  /**
   * @return all stored transactions ordered by id
   */
  Map<TID, Transaction<Participant>> loadAll() throws IOException;

}
