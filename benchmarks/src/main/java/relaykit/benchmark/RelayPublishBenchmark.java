package relaykit.benchmark;

import org.openjdk.jmh.annotations.*;
import relaykit.EventRelay;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures end-to-end latency: publish -> mailbox -> handler callback on every subscriber.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar RelayPublishBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class RelayPublishBenchmark {

  public record BenchEvent(long sequence) {
  }

  @Param({"1", "8"})
  private int subscriberCount;

  @Param({"2", "4"})
  private int workerCount;

  private EventRelay relay;
  private long sequence;
  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() {
    relay = EventRelay.builder()
        .workerCount(workerCount)
        .mailboxCapacity(1024)
        .build();
    relaykit.Scope scope = relay.newScope("bench");
    for (int i = 0; i < subscriberCount; i++) {
      relay.subscribe(scope, BenchEvent.class, event -> {
        CountDownLatch latch = latchRef.get();
        if (latch != null) latch.countDown();
      });
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    relay.close();
  }

  @Benchmark
  public void publishAndDeliver() throws Exception {
    CountDownLatch latch = new CountDownLatch(subscriberCount);
    latchRef.set(latch);

    relay.publish(new BenchEvent(sequence++));

    latch.await(5, TimeUnit.SECONDS);
  }
}
