package edu.illinois.twopc.coordinator.impl;

import static edu.illinois.twopc.Constants.COORDINATOR_SHUTDOWN_TIMEOUT;
import static edu.illinois.twopc.Constants.COORDINATOR_THREAD_COUNT;
import static edu.illinois.twopc.Constants.DEFAULT_COORDINATOR_SHUTDOWN_TIMEOUT;
import static edu.illinois.twopc.Constants.DEFAULT_COORDINATOR_THREAD_COUNT;

import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;

import com.google.common.base.Equivalence;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.AsyncFunction;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListenableFutureTask;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import edu.illinois.twopc.coordinator.Coordinator;
import edu.illinois.twopc.coordinator.NoSuchTransactionException;
import edu.illinois.twopc.coordinator.Outcome;
import edu.illinois.twopc.coordinator.Participant;
import edu.illinois.twopc.coordinator.TID;
import edu.illinois.twopc.coordinator.TransactionStore;
import edu.illinois.twopc.tm.InconsistentVoteException;
import edu.illinois.twopc.tm.NextAction;
import edu.illinois.twopc.tm.Participants;
import edu.illinois.twopc.tm.Phase;
import edu.illinois.twopc.tm.Transaction;
import edu.illinois.twopc.tm.TransactionException;

/**
 * Drives two-phase commit transactions to completion.
 *
 * Every in-flight transaction is owned by a mailbox: a sequential executor on
 * top of a shared thread pool. All events for a transaction (enlisting a
 * participant, preparing, votes and acknowledgments) are queued on its mailbox
 * and applied one at a time, so the transaction value is never accessed
 * concurrently.
 *
 * Each new transaction value is written to the {@link TransactionStore} before
 * the coordinator acts on it. After a restart, {@link #recover()} reloads the
 * stored transactions and re-sends whatever messages are still outstanding.
 *
 * This coordinator does not time out or re-send requests to participants that
 * fail to respond.
 */
public class TransactionCoordinator implements Coordinator, Closeable {

  private static final Log LOG = LogFactory.getLog(TransactionCoordinator.class);

  interface Transition {
    Transaction<Participant> apply(Transaction<Participant> transaction)
        throws TransactionException;
  }

  private static final Transition PREPARE = new Transition() {
    @Override
    public Transaction<Participant> apply(
        Transaction<Participant> transaction) throws TransactionException {
      return transaction.prepare();
    }

    @Override
    public String toString() {
      return "prepare";
    }
  };

  private final TransactionStore store;
  private final Equivalence<? super Participant> equivalence;
  private final ExecutorService pool;
  private final long shutdownTimeout;
  private final AtomicLong nextId = new AtomicLong();
  private final ConcurrentMap<TID, Mailbox> mailboxes = new ConcurrentHashMap<TID, Mailbox>();

  public TransactionCoordinator(Configuration conf, TransactionStore store) {
    this(conf, store, Participants.byEquals());
  }

  public TransactionCoordinator(Configuration conf, TransactionStore store,
      Equivalence<? super Participant> equivalence) {
    this.store = store;
    this.equivalence = equivalence;
    int numThreads = conf.getInt(COORDINATOR_THREAD_COUNT,
        DEFAULT_COORDINATOR_THREAD_COUNT);
    this.shutdownTimeout = conf.getLong(COORDINATOR_SHUTDOWN_TIMEOUT,
        DEFAULT_COORDINATOR_SHUTDOWN_TIMEOUT);
    this.pool = Executors.newFixedThreadPool(numThreads,
        new ThreadFactoryBuilder().setNameFormat("twopc-coordinator-%d")
            .setDaemon(true).build());
  }

  /**
   * Starts a new interactive transaction without participants. Participants
   * enlist themselves through {@link #addParticipant(TID, Participant)} as the
   * client touches them.
   */
  public TID begin() throws IOException {
    TID tid = new TID(nextId.getAndIncrement());
    SettableFuture<Outcome> outcome = SettableFuture.create();
    Transaction<Participant> transaction = Transaction.<Participant> create(
        ImmutableList.<Participant> of(), equivalence, tid, outcome);
    store.put(tid, transaction);
    mailboxes.put(tid, new Mailbox(tid, transaction, outcome));
    if (LOG.isDebugEnabled())
      LOG.debug("Began transaction " + tid);
    return tid;
  }

  /**
   * Asks all participants of the transaction to vote. The returned future
   * completes once all participants have committed or rolled back. It fails
   * right away, leaving the transaction interactive, if the transaction cannot
   * be prepared.
   */
  public ListenableFuture<Outcome> commit(TID tid) {
    final Mailbox mailbox = mailboxes.get(tid);
    if (mailbox == null)
      return Futures.immediateFailedFuture(new NoSuchTransactionException(tid));
    ListenableFuture<Void> prepared = mailbox.submit(PREPARE);
    return Futures.transformAsync(prepared, new AsyncFunction<Void, Outcome>() {
      @Override
      public ListenableFuture<Outcome> apply(Void input) {
        return Futures.nonCancellationPropagating(mailbox.outcome);
      }
    }, MoreExecutors.directExecutor());
  }

  /**
   * @return future that completes with the outcome of the given transaction
   */
  public ListenableFuture<Outcome> outcome(TID tid) {
    Mailbox mailbox = mailboxes.get(tid);
    if (mailbox == null)
      return Futures.immediateFailedFuture(new NoSuchTransactionException(tid));
    return Futures.nonCancellationPropagating(mailbox.outcome);
  }

  /**
   * @return true while the transaction has not completed
   */
  public boolean isActive(TID tid) {
    return mailboxes.containsKey(tid);
  }

  @Override
  public void addParticipant(TID tid, final Participant participant)
      throws TransactionException {
    Mailbox mailbox = mailboxes.get(tid);
    if (mailbox == null)
      throw new NoSuchTransactionException(tid);
    ListenableFuture<Void> added = mailbox.submit(new Transition() {
      @Override
      public Transaction<Participant> apply(
          Transaction<Participant> transaction) throws TransactionException {
        return transaction.addParticipant(participant);
      }

      @Override
      public String toString() {
        return "add participant " + participant;
      }
    });
    try {
      Uninterruptibles.getUninterruptibly(added);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, TransactionException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException(cause);
    }
  }

  @Override
  public void prepared(TID tid, final Participant participant) {
    deliver(tid, new Transition() {
      @Override
      public Transaction<Participant> apply(
          Transaction<Participant> transaction) throws TransactionException {
        return transaction.prepared(participant);
      }

      @Override
      public String toString() {
        return "commit vote from " + participant;
      }
    });
  }

  @Override
  public void aborted(TID tid, final Participant participant) {
    deliver(tid, new Transition() {
      @Override
      public Transaction<Participant> apply(
          Transaction<Participant> transaction) throws TransactionException {
        return transaction.aborted(participant);
      }

      @Override
      public String toString() {
        return "abort vote from " + participant;
      }
    });
  }

  @Override
  public void committed(TID tid, final Participant participant) {
    deliver(tid, new Transition() {
      @Override
      public Transaction<Participant> apply(
          Transaction<Participant> transaction) throws TransactionException {
        return transaction.committed(participant);
      }

      @Override
      public String toString() {
        return "commit from " + participant;
      }
    });
  }

  @Override
  public void rolledBack(TID tid, final Participant participant) {
    deliver(tid, new Transition() {
      @Override
      public Transaction<Participant> apply(
          Transaction<Participant> transaction) throws TransactionException {
        return transaction.rolledBack(participant);
      }

      @Override
      public String toString() {
        return "rollback from " + participant;
      }
    });
  }

  /**
   * Resumes all transactions found in the store that this coordinator is not
   * already driving: re-sends outstanding requests to participants and reports
   * completed transactions to their clients. Interactive transactions are left
   * for their clients to continue.
   *
   * @return outcome futures of the resumed transactions, keyed by id
   */
  public Map<TID, ListenableFuture<Outcome>> recover() throws IOException {
    Map<TID, Mailbox> recovered = new LinkedHashMap<TID, Mailbox>();
    for (Entry<TID, Transaction<Participant>> entry : store.loadAll()
        .entrySet()) {
      TID tid = entry.getKey();
      Transaction<Participant> transaction = entry.getValue();
      advanceNextId(tid);
      Mailbox mailbox = new Mailbox(tid, transaction, outcomeOf(transaction));
      if (mailboxes.putIfAbsent(tid, mailbox) != null)
        continue;
      LOG.info("Recovering transaction " + tid + " in phase "
          + transaction.getPhase());
      recovered.put(tid, mailbox);
    }
    // collect the outcomes before any mailbox can complete and go away
    ImmutableMap.Builder<TID, ListenableFuture<Outcome>> outcomes = ImmutableMap
        .builder();
    for (Mailbox mailbox : recovered.values())
      outcomes.put(mailbox.tid,
          Futures.nonCancellationPropagating(mailbox.outcome));
    for (final Mailbox mailbox : recovered.values()) {
      mailbox.execute(new Runnable() {
        @Override
        public void run() {
          try {
            mailbox.resume();
          } catch (IOException e) {
            LOG.error("Failed to recover transaction " + mailbox.tid, e);
          }
        }
      });
    }
    return outcomes.build();
  }

  @Override
  public void close() throws IOException {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(shutdownTimeout, TimeUnit.MILLISECONDS)) {
        LOG.warn("Coordinator did not shut down within " + shutdownTimeout
            + "ms, abandoning " + mailboxes.size() + " transactions");
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pool.shutdownNow();
    }
  }

  private void deliver(TID tid, final Transition transition) {
    final Mailbox mailbox = mailboxes.get(tid);
    if (mailbox == null) {
      LOG.warn("Ignoring " + transition + " for unknown transaction " + tid);
      return;
    }
    mailbox.execute(new Runnable() {
      @Override
      public void run() {
        try {
          mailbox.apply(transition);
        } catch (InconsistentVoteException e) {
          mailbox.abandon(e);
        } catch (TransactionException e) {
          LOG.warn("Ignoring " + transition + " for transaction " + mailbox.tid
              + ": " + e.getMessage());
        } catch (IOException e) {
          LOG.error("Failed to record " + transition + " for transaction "
              + mailbox.tid, e);
        }
      }
    });
  }

  private void advanceNextId(TID tid) {
    while (true) {
      long current = nextId.get();
      if (current > tid.getId() || nextId.compareAndSet(current, tid.getId() + 1))
        return;
    }
  }

  @SuppressWarnings("unchecked")
  private static SettableFuture<Outcome> outcomeOf(
      Transaction<Participant> transaction) {
    Object client = transaction.getClient();
    if (client instanceof SettableFuture)
      return (SettableFuture<Outcome>) client;
    return SettableFuture.create();
  }

  private class Mailbox {

    // immutable state
    final TID tid;
    final SettableFuture<Outcome> outcome;
    final Executor executor;

    // mutable state, only accessed by tasks running on executor
    Transaction<Participant> transaction;
    boolean done;

    Mailbox(TID tid, Transaction<Participant> transaction,
        SettableFuture<Outcome> outcome) {
      this.tid = tid;
      this.transaction = transaction;
      this.outcome = outcome;
      this.executor = MoreExecutors.newSequentialExecutor(pool);
    }

    void execute(Runnable task) {
      executor.execute(task);
    }

    ListenableFuture<Void> submit(final Transition transition) {
      ListenableFutureTask<Void> task = ListenableFutureTask
          .create(new Callable<Void>() {
            @Override
            public Void call() throws TransactionException, IOException {
              apply(transition);
              return null;
            }
          });
      execute(task);
      return task;
    }

    void apply(Transition transition) throws TransactionException,
        IOException {
      if (done) {
        LOG.warn("Ignoring " + transition + " for completed transaction " + tid);
        return;
      }
      Transaction<Participant> next = transition.apply(transaction);
      if (next == transaction)
        return;
      // persist state transition
      store.put(tid, next);
      // apply in-memory state transition
      Phase previous = transaction.getPhase();
      transaction = next;
      if (next.getPhase() != previous)
        dispatch();
    }

    void resume() throws IOException {
      dispatch();
    }

    // sends the requests the current phase calls for
    private void dispatch() throws IOException {
      NextAction<Participant> action = transaction.nextAction();
      switch (action.getType()) {
      case WRITE_DATA:
        break;
      case VOTE:
        for (Participant participant : action.getParticipants())
          sendPrepare(participant);
        break;
      case COMMIT:
        for (Participant participant : action.getParticipants())
          sendCommit(participant);
        break;
      case ROLL_BACK:
        for (Participant participant : action.getParticipants())
          sendRollBack(participant);
        break;
      case NONE:
        complete();
        break;
      }
    }

    private void complete() throws IOException {
      Outcome result = transaction.getPhase() == Phase.COMMITTED ? Outcome.COMMITTED
          : Outcome.ABORTED;
      store.remove(tid);
      finish();
      LOG.info("Transaction " + tid + " " + result);
      outcome.set(result);
    }

    /*
     * A participant broke the vote-once contract, so the protocol can no
     * longer be trusted for this transaction: tell everyone to roll back and
     * stop tracking it.
     */
    void abandon(InconsistentVoteException e) {
      LOG.fatal("Abandoning transaction " + tid, e);
      for (Participant participant : transaction.getParticipants())
        sendRollBack(participant);
      try {
        store.remove(tid);
      } catch (IOException ioe) {
        LOG.error("Failed to remove abandoned transaction " + tid, ioe);
      }
      finish();
      outcome.setException(e);
    }

    private void finish() {
      done = true;
      mailboxes.remove(tid, this);
    }

    private void sendPrepare(Participant participant) {
      try {
        participant.prepare(tid, TransactionCoordinator.this);
      } catch (RuntimeException e) {
        LOG.warn("Failed to request vote from " + participant
            + " for transaction " + tid, e);
      }
    }

    private void sendCommit(Participant participant) {
      try {
        participant.commit(tid, TransactionCoordinator.this);
      } catch (RuntimeException e) {
        LOG.warn("Failed to request commit from " + participant
            + " for transaction " + tid, e);
      }
    }

    private void sendRollBack(Participant participant) {
      try {
        participant.rollBack(tid, TransactionCoordinator.this);
      } catch (RuntimeException e) {
        LOG.warn("Failed to request rollback from " + participant
            + " for transaction " + tid, e);
      }
    }
  }

}
