package edu.illinois.twopc.coordinator;

import edu.illinois.twopc.tm.TransactionException;

/**
 * Messages participants send to the coordinator of a transaction.
 */
public interface Coordinator {

  /**
   * Enlists a participant while the transaction is still interactive. Blocks
   * until the coordinator has recorded the participant, so it must not be
   * called from within a {@link Participant} callback.
   */
  void addParticipant(TID tid, Participant participant)
      throws TransactionException;

  void prepared(TID tid, Participant participant);

  void aborted(TID tid, Participant participant);

  void committed(TID tid, Participant participant);

  void rolledBack(TID tid, Participant participant);

}
