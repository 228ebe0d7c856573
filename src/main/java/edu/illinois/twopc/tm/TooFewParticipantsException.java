package edu.illinois.twopc.tm;

public class TooFewParticipantsException extends TransactionException {

  private static final long serialVersionUID = -3580136213395402958L;

  private final int participantCount;

  public TooFewParticipantsException(int participantCount) {
    super("Two-phase commit requires at least two participants, got "
        + participantCount);
    this.participantCount = participantCount;
  }

  public int getParticipantCount() {
    return participantCount;
  }

}
