package edu.illinois.twopc.coordinator;

/**
 * Messages a coordinator sends to the participants of a transaction. Each
 * participant answers asynchronously by calling back into the coordinator that
 * is passed along with the message.
 */
public interface Participant {

  /**
   * Asks the participant to vote. It must reply with
   * {@link Coordinator#prepared(TID, Participant)} if it can commit its staged
   * effects or {@link Coordinator#aborted(TID, Participant)} otherwise.
   */
  void prepare(TID tid, Coordinator coordinator);

  /**
   * Asks the participant to durably apply its staged effects and acknowledge
   * with {@link Coordinator#committed(TID, Participant)}.
   */
  void commit(TID tid, Coordinator coordinator);

  /**
   * Asks the participant to discard its staged effects and acknowledge with
   * {@link Coordinator#rolledBack(TID, Participant)}.
   */
  void rollBack(TID tid, Coordinator coordinator);

}
