package relaykit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cancellation boundary that controls how long subscriptions stay active and where their
 * handlers run.
 *
 * <p>A scope pairs a name with an {@link Executor}. Subscriptions registered against a
 * scope deliver events on that executor until the scope is cancelled. Cancelling is
 * cooperative: handlers already running finish, queued events are discarded.
 *
 * <p>Scopes form a tree through {@link #child(String)}; cancelling a parent cancels all of
 * its children. Cancellation is idempotent.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Scope screen = relay.newScope("login-screen")) {
 *   relay.subscribeSticky(screen, LoginEvent.class, this::render);
 *   ...
 * } // subscriptions end here
 * }</pre>
 *
 * @see EventRelay#newScope(String)
 */
public final class Scope implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Scope.class.getName());

  private final String name;
  private final Executor executor;
  private final Object lock = new Object();
  private final List<Runnable> cancelCallbacks = new ArrayList<>();
  private volatile boolean active = true;

  private Scope(String name, Executor executor) {
    this.name = Objects.requireNonNull(name, "name");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Creates a root scope whose handlers run on the given executor.
   *
   * @param name descriptive name used in logs
   * @param executor executor that runs handler invocations
   * @return a new active scope
   */
  public static Scope of(String name, Executor executor) {
    return new Scope(name, executor);
  }

  public String name() {
    return name;
  }

  public Executor executor() {
    return executor;
  }

  public boolean isActive() {
    return active;
  }

  /**
   * Creates a child scope sharing this scope's executor. The child is cancelled when this
   * scope is cancelled; cancelling the child leaves this scope untouched.
   *
   * @param childName name of the child scope
   * @return the child scope, already cancelled if this scope is no longer active
   */
  public Scope child(String childName) {
    Scope child = new Scope(childName, executor);
    Runnable unregister = onCancel(child::cancel);
    child.onCancel(unregister);
    return child;
  }

  /**
   * Registers a callback to run when this scope is cancelled. If the scope is already
   * cancelled the callback runs immediately on the calling thread.
   *
   * @param callback the callback
   * @return an action that unregisters the callback; a no-op once the scope is cancelled
   */
  public Runnable onCancel(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    synchronized (lock) {
      if (active) {
        cancelCallbacks.add(callback);
        return () -> {
          synchronized (lock) {
            cancelCallbacks.remove(callback);
          }
        };
      }
    }
    runCallback(callback);
    return () -> {
    };
  }

  /**
   * Cancels this scope and runs all registered cancel callbacks.
   */
  public void cancel() {
    List<Runnable> callbacks;
    synchronized (lock) {
      if (!active) {
        return;
      }
      active = false;
      callbacks = new ArrayList<>(cancelCallbacks);
      cancelCallbacks.clear();
    }
    for (Runnable callback : callbacks) {
      runCallback(callback);
    }
  }

  @Override
  public void close() {
    cancel();
  }

  private void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cancel callback failed for scope " + name, e);
    }
  }

  @Override
  public String toString() {
    return "Scope[" + name + (active ? "" : ", cancelled") + "]";
  }
}
