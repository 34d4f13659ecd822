package com.pervasivecode.utils.boundedqueue.coordination;

import static com.google.common.base.Preconditions.checkState;
import com.google.auto.value.AutoValue;
import com.pervasivecode.utils.boundedqueue.InvalidCapacityException;

/** This object holds configuration information for a {@link TransferCoordinator} instance. */
@AutoValue
public abstract class TransferConfig {
  public static final String DEFAULT_NAME_FORMAT = "transfer-worker-%d";

  protected TransferConfig() {}

  /**
   * Create an object that will build a {@link TransferConfig} instance. One consumer and the
   * default thread name format are preset; the queue capacity must always be set.
   *
   * @return a config builder.
   */
  public static TransferConfig.Builder builder() {
    return new AutoValue_TransferConfig.Builder()
        .setNumConsumers(1)
        .setNameFormat(DEFAULT_NAME_FORMAT);
  }

  /**
   * The capacity of the queue that connects producers to consumers. When this many elements are
   * waiting to be consumed, producers will block.
   *
   * @return the queue capacity.
   */
  public abstract int queueCapacity();

  /**
   * The number of consumer tasks that will drain the queue concurrently.
   *
   * @return the number of consumers.
   */
  public abstract int numConsumers();

  /**
   * The format to use to name worker threads. This must contain a "%d" placeholder which will be
   * replaced with the worker's number.
   *
   * @return the format string.
   */
  public abstract String nameFormat();

  /**
   * This object will build a {@link TransferConfig} instance. See {@link TransferConfig} for
   * explanations of what these values mean.
   */
  @AutoValue.Builder
  public static abstract class Builder {
    protected Builder() {}

    public abstract TransferConfig.Builder setQueueCapacity(int queueCapacity);

    public abstract TransferConfig.Builder setNumConsumers(int numConsumers);

    public abstract TransferConfig.Builder setNameFormat(String nameFormat);

    abstract TransferConfig buildInternal();

    public TransferConfig build() {
      TransferConfig config = buildInternal();

      if (config.queueCapacity() <= 0) {
        throw new InvalidCapacityException(config.queueCapacity());
      }
      checkState(config.numConsumers() > 0, "numConsumers must be positive.");
      checkState(config.nameFormat().contains("%d"),
          "nameFormat must contain a %%d placeholder.");

      return config;
    }
  }
}
