package edu.illinois.twopc.tm;

import static edu.illinois.twopc.tm.Phase.ABORTED;
import static edu.illinois.twopc.tm.Phase.COMMITTED;
import static edu.illinois.twopc.tm.Phase.COMMITTING;
import static edu.illinois.twopc.tm.Phase.INTERACTIVE;
import static edu.illinois.twopc.tm.Phase.ROLLING_BACK;
import static edu.illinois.twopc.tm.Phase.VOTING;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.google.common.base.Equivalence;
import com.google.common.base.Equivalence.Wrapper;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * The state of a two-phase commit as seen by its coordinator. Instances are
 * immutable: every state transition returns a new value, so a coordinator can
 * persist or snapshot a transaction at any point. Like everything else in this
 * package, this class performs no I/O and holds no locks.
 *
 * The protocol proceeds as follows:
 *
 * <ol>
 * <li>While {@link Phase#INTERACTIVE}, the client writes data and participants
 * are enlisted through {@link #addParticipant(Object)}.</li>
 * <li>{@link #prepare()} freezes the participant set and asks every participant
 * to vote.</li>
 * <li>If all participants vote to commit ({@link #prepared(Object)}), every
 * participant is asked to commit and the transaction is committed once all have
 * acknowledged ({@link #committed(Object)}).</li>
 * <li>A single vote to abort ({@link #aborted(Object)}) aborts the transaction
 * for all participants, including those that already voted to commit. The
 * transaction is aborted once all have acknowledged the rollback (
 * {@link #rolledBack(Object)}).</li>
 * </ol>
 *
 * Votes and acknowledgments from different participants may arrive in any
 * order, and duplicate acknowledgments are ignored, so protocol messages can be
 * delivered at least once. Transitions on one transaction must still be applied
 * one at a time: each reads the entire previous value.
 *
 * After a crash, a coordinator that reloads a persisted transaction calls
 * {@link #nextAction()} to find out which messages are still outstanding.
 *
 * @param <P>
 *          participant handle type, compared under the transaction's
 *          {@link Equivalence}
 */
public final class Transaction<P> {

  private static final Log LOG = LogFactory.getLog(Transaction.class);

  static final int MIN_PARTICIPANTS = 2;

  // opaque caller state
  private final Object id;
  private final Object client;

  private final Equivalence<? super P> equivalence;
  // participants in the order they were enlisted
  private final ImmutableMap<Wrapper<P>, P> participants;
  private final Phase phase;
  // participants the current phase still needs a response from
  private final ImmutableSet<Wrapper<P>> awaiting;

  private Transaction(Object id, Object client,
      Equivalence<? super P> equivalence,
      ImmutableMap<Wrapper<P>, P> participants, Phase phase,
      ImmutableSet<Wrapper<P>> awaiting) {
    this.id = id;
    this.client = client;
    this.equivalence = equivalence;
    this.participants = participants;
    this.phase = phase;
    this.awaiting = awaiting;
  }

  /**
   * Creates an interactive transaction whose participants are compared by
   * {@link Object#equals(Object)}.
   */
  public static <P> Transaction<P> create(Iterable<? extends P> participants,
      Object id, Object client) {
    return create(participants, Participants.byEquals(), id, client);
  }

  /**
   * Creates an interactive transaction. Participants that are equivalent to an
   * earlier participant are dropped.
   *
   * @param participants
   *          initial participants, may be empty
   * @param equivalence
   *          decides whether two handles denote the same participant
   * @param id
   *          transaction id, not interpreted, may be null
   * @param client
   *          handle of the requester to report the outcome to, not
   *          interpreted, may be null
   */
  public static <P> Transaction<P> create(Iterable<? extends P> participants,
      Equivalence<? super P> equivalence, Object id, Object client) {
    Preconditions.checkNotNull(participants, "participants");
    Preconditions.checkNotNull(equivalence, "equivalence");
    Map<Wrapper<P>, P> map = new LinkedHashMap<Wrapper<P>, P>();
    for (P participant : participants) {
      Preconditions.checkNotNull(participant, "participant");
      Wrapper<P> key = wrap(equivalence, participant);
      if (!map.containsKey(key))
        map.put(key, participant);
    }
    return new Transaction<P>(id, client, equivalence,
        ImmutableMap.copyOf(map), INTERACTIVE, ImmutableSet.<Wrapper<P>> of());
  }

  public Object getId() {
    return id;
  }

  public Object getClient() {
    return client;
  }

  public Equivalence<? super P> getEquivalence() {
    return equivalence;
  }

  public Phase getPhase() {
    return phase;
  }

  public boolean isTerminal() {
    return phase.isTerminal();
  }

  /**
   * @return all participants in enlistment order, regardless of phase
   */
  public ImmutableList<P> getParticipants() {
    return participants.values().asList();
  }

  public boolean contains(P participant) {
    return participants.containsKey(wrap(equivalence, participant));
  }

  /**
   * @return participants the current phase still waits on, in enlistment
   *         order; empty unless the phase {@link Phase#isAwaiting() awaits}
   *         responses
   */
  public ImmutableList<P> getAwaiting() {
    ImmutableList.Builder<P> builder = ImmutableList.builder();
    for (Map.Entry<Wrapper<P>, P> entry : participants.entrySet())
      if (awaiting.contains(entry.getKey()))
        builder.add(entry.getValue());
    return builder.build();
  }

  /**
   * Enlists another participant. Adding a participant that is already enlisted
   * returns this transaction unchanged.
   *
   * @throws InvalidPhaseException
   *           if voting has already begun
   */
  public Transaction<P> addParticipant(P participant)
      throws InvalidPhaseException {
    Preconditions.checkNotNull(participant, "participant");
    switch (phase) {
    case INTERACTIVE:
      break;
    case VOTING:
    case COMMITTING:
    case ROLLING_BACK:
    case ABORTED:
    case COMMITTED:
      throw new InvalidPhaseException("add participant", phase);
    }
    Wrapper<P> key = wrap(equivalence, participant);
    if (participants.containsKey(key))
      return this;
    ImmutableMap<Wrapper<P>, P> added = ImmutableMap
        .<Wrapper<P>, P> builder().putAll(participants).put(key, participant)
        .build();
    return new Transaction<P>(id, client, equivalence, added, phase, awaiting);
  }

  /**
   * Determines what has to happen next for this transaction to make progress.
   * Depends only on the current phase and awaited participants, so it is safe
   * to call on a transaction just reloaded after a crash.
   */
  public NextAction<P> nextAction() {
    switch (phase) {
    case INTERACTIVE:
      return NextAction.writeData();
    case VOTING:
      return NextAction.vote(getAwaiting());
    case ROLLING_BACK:
      return NextAction.rollBack(getAwaiting());
    case COMMITTING:
      return NextAction.commit(getAwaiting());
    case ABORTED:
    case COMMITTED:
      return NextAction.none();
    }
    throw new AssertionError(phase);
  }

  /**
   * Moves the transaction into the voting phase, awaiting a vote from every
   * participant. From here on the participant set is frozen.
   *
   * @throws TooFewParticipantsException
   *           if there are fewer than two participants
   * @throws InvalidPhaseException
   *           if the transaction is not interactive
   */
  public Transaction<P> prepare() throws TooFewParticipantsException,
      InvalidPhaseException {
    switch (phase) {
    case INTERACTIVE:
      break;
    case VOTING:
    case COMMITTING:
    case ROLLING_BACK:
    case ABORTED:
    case COMMITTED:
      throw new InvalidPhaseException("prepare", phase);
    }
    if (participants.size() < MIN_PARTICIPANTS)
      throw new TooFewParticipantsException(participants.size());
    return withPhase(VOTING, participants.keySet());
  }

  /**
   * Records a participant's vote to commit. Moves to the committing phase once
   * all participants have voted to commit. Votes that arrive after the
   * transaction decided to roll back are ignored.
   *
   * @throws UnknownParticipantException
   *           if the participant is not part of this transaction
   * @throws InvalidPhaseException
   *           if the transaction is neither voting nor rolling back
   */
  public Transaction<P> prepared(P participant)
      throws UnknownParticipantException, InvalidPhaseException {
    switch (phase) {
    case VOTING:
      return removeAwaiting(checkKnown(participant), COMMITTING,
          participants.keySet());
    case ROLLING_BACK:
      checkKnown(participant);
      if (LOG.isDebugEnabled())
        LOG.debug("Ignoring late commit vote from " + participant + " for "
            + this);
      return this;
    case INTERACTIVE:
    case COMMITTING:
    case ABORTED:
    case COMMITTED:
      throw new InvalidPhaseException("record commit vote", phase);
    }
    throw new AssertionError(phase);
  }

  /**
   * Records a participant's vote to abort. A single vote to abort rolls back
   * the transaction for all participants, so the full participant set is
   * awaited for rollback acknowledgments. Further votes are ignored once the
   * transaction is rolling back.
   *
   * @throws UnknownParticipantException
   *           if the participant is not part of this transaction
   * @throws InconsistentVoteException
   *           if the participant has already voted to commit
   * @throws InvalidPhaseException
   *           if the transaction is neither voting nor rolling back
   */
  public Transaction<P> aborted(P participant)
      throws UnknownParticipantException, InconsistentVoteException,
      InvalidPhaseException {
    switch (phase) {
    case VOTING:
      if (!awaiting.contains(checkKnown(participant)))
        throw new InconsistentVoteException(participant);
      return withPhase(ROLLING_BACK, participants.keySet());
    case ROLLING_BACK:
      checkKnown(participant);
      if (LOG.isDebugEnabled())
        LOG.debug("Ignoring abort vote from " + participant
            + " for transaction already rolling back " + this);
      return this;
    case INTERACTIVE:
    case COMMITTING:
    case ABORTED:
    case COMMITTED:
      throw new InvalidPhaseException("record abort vote", phase);
    }
    throw new AssertionError(phase);
  }

  /**
   * Records that a participant undid its local effects. Moves to the aborted
   * phase once all participants have rolled back.
   *
   * @throws UnknownParticipantException
   *           if the participant is not part of this transaction
   * @throws InvalidPhaseException
   *           if the transaction is not rolling back
   */
  public Transaction<P> rolledBack(P participant)
      throws UnknownParticipantException, InvalidPhaseException {
    switch (phase) {
    case ROLLING_BACK:
      return removeAwaiting(checkKnown(participant), ABORTED,
          ImmutableSet.<Wrapper<P>> of());
    case INTERACTIVE:
    case VOTING:
    case COMMITTING:
    case ABORTED:
    case COMMITTED:
      throw new InvalidPhaseException("record rollback", phase);
    }
    throw new AssertionError(phase);
  }

  /**
   * Records that a participant durably applied its local effects. Moves to the
   * committed phase once all participants have committed.
   *
   * @throws UnknownParticipantException
   *           if the participant is not part of this transaction
   * @throws InvalidPhaseException
   *           if the transaction is not committing
   */
  public Transaction<P> committed(P participant)
      throws UnknownParticipantException, InvalidPhaseException {
    switch (phase) {
    case COMMITTING:
      return removeAwaiting(checkKnown(participant), COMMITTED,
          ImmutableSet.<Wrapper<P>> of());
    case INTERACTIVE:
    case VOTING:
    case ROLLING_BACK:
    case ABORTED:
    case COMMITTED:
      throw new InvalidPhaseException("record commit", phase);
    }
    throw new AssertionError(phase);
  }

  private Wrapper<P> checkKnown(P participant)
      throws UnknownParticipantException {
    Wrapper<P> key = wrap(equivalence, participant);
    if (!participants.containsKey(key))
      throw new UnknownParticipantException(participant);
    return key;
  }

  /*
   * Removing a participant that already responded is a no-op, which makes
   * acknowledgments idempotent. Once nobody is awaited, moves on to the given
   * phase awaiting the given participants.
   */
  private Transaction<P> removeAwaiting(Wrapper<P> key, Phase next,
      ImmutableSet<Wrapper<P>> nextAwaiting) {
    if (!awaiting.contains(key))
      return this;
    ImmutableSet<Wrapper<P>> remaining = ImmutableSet.copyOf(Sets.difference(
        awaiting, ImmutableSet.of(key)));
    if (remaining.isEmpty())
      return withPhase(next, nextAwaiting);
    return withPhase(phase, remaining);
  }

  private Transaction<P> withPhase(Phase phase,
      ImmutableSet<Wrapper<P>> awaiting) {
    return new Transaction<P>(id, client, equivalence, participants, phase,
        ImmutableSet.copyOf(awaiting));
  }

  private static <P> Wrapper<P> wrap(Equivalence<? super P> equivalence,
      P participant) {
    return equivalence.wrap(participant);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this)
      return true;
    if (!(obj instanceof Transaction))
      return false;
    Transaction<?> other = (Transaction<?>) obj;
    return phase == other.phase
        && Objects.equal(id, other.id)
        && Objects.equal(client, other.client)
        && equivalence.equals(other.equivalence)
        && participants.equals(other.participants)
        && awaiting.equals(other.awaiting);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, client, phase, participants.keySet(), awaiting);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("id", id).add("phase", phase)
        .add("participants", getParticipants()).add("awaiting", getAwaiting())
        .toString();
  }

}
