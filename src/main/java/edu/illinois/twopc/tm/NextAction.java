package edu.illinois.twopc.tm;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * What a coordinator has to do next to move a transaction forward, together
 * with the participants the protocol messages must go to.
 */
public final class NextAction<P> {

  public enum Type {
    /** transaction is interactive: the client is still writing data */
    WRITE_DATA,
    /** send prepare requests */
    VOTE,
    /** send rollback requests */
    ROLL_BACK,
    /** send commit requests */
    COMMIT,
    /** transaction has completed */
    NONE
  }

  private static final NextAction<Object> WRITE_DATA = new NextAction<Object>(
      Type.WRITE_DATA, ImmutableList.of());
  private static final NextAction<Object> NONE = new NextAction<Object>(
      Type.NONE, ImmutableList.of());

  private final Type type;
  private final ImmutableList<P> participants;

  private NextAction(Type type, ImmutableList<P> participants) {
    this.type = type;
    this.participants = participants;
  }

  @SuppressWarnings("unchecked")
  public static <P> NextAction<P> writeData() {
    return (NextAction<P>) WRITE_DATA;
  }

  @SuppressWarnings("unchecked")
  public static <P> NextAction<P> none() {
    return (NextAction<P>) NONE;
  }

  public static <P> NextAction<P> vote(Iterable<? extends P> participants) {
    return of(Type.VOTE, participants);
  }

  public static <P> NextAction<P> rollBack(Iterable<? extends P> participants) {
    return of(Type.ROLL_BACK, participants);
  }

  public static <P> NextAction<P> commit(Iterable<? extends P> participants) {
    return of(Type.COMMIT, participants);
  }

  private static <P> NextAction<P> of(Type type,
      Iterable<? extends P> participants) {
    ImmutableList<P> list = ImmutableList.copyOf(participants);
    Preconditions.checkArgument(!list.isEmpty(),
        "%s requires at least one participant", type);
    return new NextAction<P>(type, list);
  }

  public Type getType() {
    return type;
  }

  /**
   * @return participants the next protocol message has to be sent to, empty
   *         for {@link Type#WRITE_DATA} and {@link Type#NONE}
   */
  public ImmutableList<P> getParticipants() {
    return participants;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NextAction))
      return false;
    NextAction<?> other = (NextAction<?>) obj;
    return type == other.type && participants.equals(other.participants);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, participants);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("type", type)
        .add("participants", participants).toString();
  }

}
