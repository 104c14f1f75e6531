package edu.washington.escience.rivulet;

import java.util.concurrent.Executor;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;

import edu.washington.escience.rivulet.storage.TupleBatch;

/**
 * This class holds the constants for the Rivulet execution engine.
 */
public final class RivuletConstants {

  /** Private constructor to disallow building utility class. */
  private RivuletConstants() {}

  /** The name of the system. */
  public static final String SYSTEM_NAME = "Rivulet";

  /**
   * Execution environment variable: the {@link Executor} on which background work and callbacks run.
   */
  public static final String EXEC_ENV_VAR_EXECUTOR = "executor";

  /**
   * Execution environment variable: the maximum number of rows in a batch emitted by grouped aggregation.
   */
  public static final String EXEC_ENV_VAR_OUTPUT_BATCH_SIZE = "outputBatchSize";

  /**
   * Execution environment variable: the number of queued batches at which a sink pauses its inputs. 0 disables
   * backpressure.
   */
  public static final String EXEC_ENV_VAR_SINK_HIGH_WATER_MARK = "sinkHighWaterMark";

  /**
   * Execution environment variable: the number of queued batches at which a paused sink resumes its inputs.
   */
  public static final String EXEC_ENV_VAR_SINK_LOW_WATER_MARK = "sinkLowWaterMark";

  /** Default rows per emitted batch. */
  public static final int DEFAULT_OUTPUT_BATCH_SIZE = TupleBatch.BATCH_SIZE;

  /** Default sink high-water mark, backpressure disabled. */
  public static final int DEFAULT_SINK_HIGH_WATER_MARK = 0;

  /** Default sink low-water mark. */
  public static final int DEFAULT_SINK_LOW_WATER_MARK = 0;

  /** Default number of threads in a CPU worker pool. */
  public static final int DEFAULT_CPU_POOL_SIZE = Runtime.getRuntime().availableProcessors();

  /** Prefix of the names of CPU worker threads. */
  public static final String CPU_THREAD_NAME_PREFIX = "rivulet-cpu";

  /**
   * @return the execution environment used when the caller supplies none.
   */
  public static ImmutableMap<String, Object> defaultExecEnvVars() {
    return ImmutableMap.<String, Object>of(EXEC_ENV_VAR_EXECUTOR, MoreExecutors.directExecutor());
  }
}
