package edu.illinois.twopc;

import static java.util.concurrent.TimeUnit.SECONDS;

public interface Constants {

  // configuration properties

  public static final String COORDINATOR_THREAD_COUNT = "twopc.coordinator.thread.count";

  public static final int DEFAULT_COORDINATOR_THREAD_COUNT = 5;

  public static final String COORDINATOR_SHUTDOWN_TIMEOUT = "twopc.coordinator.shutdown.timeout";

  public static final long DEFAULT_COORDINATOR_SHUTDOWN_TIMEOUT = SECONDS
      .toMillis(10);

}
