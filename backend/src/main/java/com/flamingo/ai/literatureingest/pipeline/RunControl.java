package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/** Stop signal shared by the workers of one run. */
public class RunControl {

  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicReference<FatalIngestionException> fatal = new AtomicReference<>();

  public void requestStop() {
    stopRequested.set(true);
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  /** Records the first fatal error and stops every worker. */
  public void abort(FatalIngestionException error) {
    fatal.compareAndSet(null, error);
    stopRequested.set(true);
  }

  public FatalIngestionException getFatal() {
    return fatal.get();
  }
}
