package edu.illinois.twopc.tm;

/**
 * Phases of a two-phase commit transaction. A transaction only ever moves
 * forward through these: INTERACTIVE to VOTING, then either COMMITTING and
 * COMMITTED or ROLLING_BACK and ABORTED.
 */
public enum Phase {

  /** collecting participants, no votes requested yet */
  INTERACTIVE,
  /** waiting for participants to vote */
  VOTING,
  /** all participants voted to commit, waiting for commit acknowledgments */
  COMMITTING,
  /** some participant voted to abort, waiting for rollback acknowledgments */
  ROLLING_BACK,
  ABORTED,
  COMMITTED;

  public boolean isTerminal() {
    switch (this) {
    case ABORTED:
    case COMMITTED:
      return true;
    default:
      return false;
    }
  }

  /**
   * @return true if transactions in this phase wait on responses from a subset
   *         of their participants
   */
  public boolean isAwaiting() {
    switch (this) {
    case VOTING:
    case COMMITTING:
    case ROLLING_BACK:
      return true;
    default:
      return false;
    }
  }

}
