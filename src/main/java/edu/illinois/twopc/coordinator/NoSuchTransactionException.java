package edu.illinois.twopc.coordinator;

import edu.illinois.twopc.tm.TransactionException;

public class NoSuchTransactionException extends TransactionException {

  private static final long serialVersionUID = -1203985126794631357L;

  private final TID tid;

  public NoSuchTransactionException(TID tid) {
    super("No such transaction " + tid);
    this.tid = tid;
  }

  public TID getTID() {
    return tid;
  }

}
