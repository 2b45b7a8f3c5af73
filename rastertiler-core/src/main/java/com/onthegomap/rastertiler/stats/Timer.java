package com.onthegomap.rastertiler.stats;

import com.onthegomap.rastertiler.util.Format;
import java.time.Duration;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Measures the wall-clock time that a task takes.
 */
@ThreadSafe
public class Timer {

  private final long start;
  private volatile long end = -1;

  private Timer() {
    start = System.nanoTime();
  }

  public static Timer start() {
    return new Timer();
  }

  /** Sets the end time to now, and makes {@link #running()} return false. */
  public Timer stop() {
    synchronized (this) {
      end = System.nanoTime();
    }
    return this;
  }

  /** Returns {@code false} if {@link #stop()} has been called. */
  public boolean running() {
    return end < 0;
  }

  /** Returns the time from start to now if the task is still running, or start to end if it has finished. */
  public Duration elapsed() {
    long endTime = end;
    return Duration.ofNanos((endTime < 0 ? System.nanoTime() : endTime) - start);
  }

  @Override
  public String toString() {
    return Format.defaultInstance().duration(elapsed());
  }
}
