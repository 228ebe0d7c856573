package edu.illinois.twopc.coordinator;

import com.google.common.primitives.Longs;

/**
 * Identifies a transaction driven by a coordinator.
 */
public class TID implements Comparable<TID> {

  private final long id;

  public TID(long id) {
    this.id = id;
  }

  public long getId() {
    return id;
  }

  @Override
  public int compareTo(TID other) {
    return Longs.compare(id, other.id);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TID ? id == ((TID) obj).id : false;
  }

  @Override
  public int hashCode() {
    return Longs.hashCode(id);
  }

  @Override
  public String toString() {
    return String.valueOf(id);
  }
}
