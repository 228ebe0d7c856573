package edu.illinois.twopc.tm;

public class UnknownParticipantException extends TransactionException {

  private static final long serialVersionUID = 6140918337520981844L;

  private final Object participant;

  public UnknownParticipantException(Object participant) {
    super("Not a participant of this transaction: " + participant);
    this.participant = participant;
  }

  public Object getParticipant() {
    return participant;
  }

}
