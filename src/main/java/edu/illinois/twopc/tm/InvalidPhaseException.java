package edu.illinois.twopc.tm;

/**
 * Thrown when an operation is invoked in a phase that does not define it, such
 * as adding a participant after voting started or acknowledging a commit while
 * the transaction is still voting.
 */
public class InvalidPhaseException extends TransactionException {

  private static final long serialVersionUID = -8470023615094730561L;

  private final String operation;
  private final Phase phase;

  public InvalidPhaseException(String operation, Phase phase) {
    super("Cannot " + operation + " in phase " + phase);
    this.operation = operation;
    this.phase = phase;
  }

  public String getOperation() {
    return operation;
  }

  public Phase getPhase() {
    return phase;
  }

}
