package com.pervasivecode.utils.boundedqueue.coordination;

import static com.google.common.base.Preconditions.checkArgument;
import java.util.List;
import com.google.common.collect.ImmutableList;

/**
 * Thrown by {@link TransferCoordinator#transfer} after all of its tasks have ended, when at least
 * one producer or consumer task failed. The first failure is the cause; the others are attached as
 * suppressed exceptions.
 */
public class TransferFailedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<Throwable> failures;

  public TransferFailedException(List<Throwable> failures) {
    super(messageFor(failures), failures.get(0));
    this.failures = ImmutableList.copyOf(failures);
    for (Throwable failure : this.failures.subList(1, this.failures.size())) {
      addSuppressed(failure);
    }
  }

  private static String messageFor(List<Throwable> failures) {
    checkArgument(!failures.isEmpty(), "At least one failure is required.");
    return String.format("%d transfer task(s) failed. First failure: %s", failures.size(),
        failures.get(0));
  }

  /** Every recorded task failure, in the order the coordinator collected them. */
  public ImmutableList<Throwable> failures() {
    return failures;
  }
}
