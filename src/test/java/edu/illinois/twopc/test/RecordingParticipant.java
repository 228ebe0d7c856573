package edu.illinois.twopc.test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import edu.illinois.twopc.coordinator.Coordinator;
import edu.illinois.twopc.coordinator.Participant;
import edu.illinois.twopc.coordinator.TID;

/**
 * Participant that records the requests it receives and answers them
 * immediately according to its configured behavior. Participants with the same
 * name are equal, so a fresh instance can stand in for one that was stored with
 * a transaction.
 */
public class RecordingParticipant implements Participant {

  public enum Vote {
    COMMIT, ABORT, SILENT
  }

  private final String name;
  private volatile Vote vote;
  private volatile boolean acknowledge = true;
  private final List<String> requests = new CopyOnWriteArrayList<String>();

  public RecordingParticipant(String name) {
    this(name, Vote.COMMIT);
  }

  public RecordingParticipant(String name, Vote vote) {
    this.name = name;
    this.vote = vote;
  }

  public RecordingParticipant setVote(Vote vote) {
    this.vote = vote;
    return this;
  }

  /**
   * @param acknowledge
   *          whether to acknowledge commit and rollback requests
   */
  public RecordingParticipant setAcknowledge(boolean acknowledge) {
    this.acknowledge = acknowledge;
    return this;
  }

  /**
   * @return requests received so far, e.g. "prepare 0"
   */
  public List<String> getRequests() {
    return requests;
  }

  @Override
  public void prepare(TID tid, Coordinator coordinator) {
    requests.add("prepare " + tid);
    switch (vote) {
    case COMMIT:
      coordinator.prepared(tid, this);
      break;
    case ABORT:
      coordinator.aborted(tid, this);
      break;
    case SILENT:
      break;
    }
  }

  @Override
  public void commit(TID tid, Coordinator coordinator) {
    requests.add("commit " + tid);
    if (acknowledge)
      coordinator.committed(tid, this);
  }

  @Override
  public void rollBack(TID tid, Coordinator coordinator) {
    requests.add("rollback " + tid);
    if (acknowledge)
      coordinator.rolledBack(tid, this);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RecordingParticipant
        && name.equals(((RecordingParticipant) obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
