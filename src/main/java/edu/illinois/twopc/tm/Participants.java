package edu.illinois.twopc.tm;

import com.google.common.base.Equivalence;
import com.google.common.base.Function;

/**
 * Factories for the relation that decides whether two participant handles
 * denote the same participant.
 */
public final class Participants {

  private Participants() {
  }

  /**
   * Participants are the same if they are equal.
   */
  public static Equivalence<Object> byEquals() {
    return Equivalence.equals();
  }

  /**
   * Participants are the same only if they are the same object.
   */
  public static Equivalence<Object> byIdentity() {
    return Equivalence.identity();
  }

  /**
   * Participants are the same if the given function maps them to equal ids.
   * Useful when handles are recreated, e.g. after loading a transaction from
   * storage, but still carry a stable id.
   */
  public static <P> Equivalence<P> byId(Function<? super P, ?> id) {
    return Equivalence.equals().onResultOf(id);
  }

}
