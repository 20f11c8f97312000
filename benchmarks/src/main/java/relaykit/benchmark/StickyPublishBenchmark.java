package relaykit.benchmark;

import org.openjdk.jmh.annotations.*;
import relaykit.EventRelay;

import java.util.concurrent.TimeUnit;

/**
 * Measures publish-side throughput of sticky publishes, with and without a subscriber
 * attached. Handlers are not awaited; a full mailbox throttles the publisher.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar StickyPublishBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class StickyPublishBenchmark {

  public record Position(int value) {
  }

  @Param({"false", "true"})
  private boolean withSubscriber;

  private EventRelay relay;

  @Setup(Level.Trial)
  public void setup() {
    relay = EventRelay.builder().workerCount(1).build();
    relay.publishSticky(new Position(0));
    if (withSubscriber) {
      relay.subscribeSticky(relay.newScope("bench"), Position.class, position -> {
      });
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    relay.close();
  }

  @Benchmark
  @Threads(4)
  public int publishSticky() {
    return relay.publishSticky(new Position(1));
  }

  @Benchmark
  public boolean readSticky() {
    return relay.getSticky(Position.class).isPresent();
  }
}
