package edu.illinois.twopc.tm;

/**
 * A participant voted to abort after it had already voted to commit in the same
 * round. This means a participant or the transport broke the vote-once
 * contract; coordinators should treat it as fatal rather than carry on.
 */
public class InconsistentVoteException extends TransactionException {

  private static final long serialVersionUID = 4417790623184355103L;

  private final Object participant;

  public InconsistentVoteException(Object participant) {
    super("Participant " + participant
        + " voted to abort after voting to commit");
    this.participant = participant;
  }

  public Object getParticipant() {
    return participant;
  }

}
