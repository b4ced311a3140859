package example;

import com.obsidiandynamics.dreadlock.*;
import com.obsidiandynamics.dreadlock.mutex.*;
import com.obsidiandynamics.dreadlock.report.*;

import java.util.concurrent.*;

public class Example {
  private static class Account {
    private final MutexRef mutex = MutexRef.create();

    private int balance;

    Account(int balance) {
      this.balance = balance;
    }
  }

  public static void main(String[] args) throws InterruptedException, ExecutionException {
    final var options = new Dreadlock.Options();
    options.performanceTimeoutMs = 200;
    options.deadlockTimeoutMs = 1_000;
    options.assertOnDeadlock = false;   // report deadlocks, but carry on
    options.verbose = true;
    final var dreadlock = new Dreadlock(options, new Registry(), new ReportSink(false, new PrintStreamChannel(), new Slf4jChannel()));

    final var account = new Account(100);
    final var executor = Executors.newFixedThreadPool(2);

    // Uncontended: lock on creation, unlock on close.
    try (var handle = dreadlock.create(account.mutex, "account")) {
      account.balance += 50;
      handle.recordDestructLocation(Location.caller());
    }
    System.out.format("balance: %d%n", account.balance);

    // Contended: the second withdrawal waits long enough to draw a performance warning.
    final var holding = executor.submit(() -> withdraw(dreadlock, account, 30, 400));
    Thread.sleep(50);
    final var waiting = executor.submit(() -> withdraw(dreadlock, account, 20, 0));
    holding.get();
    waiting.get();
    System.out.format("balance: %d%n", account.balance);

    // A holder that never lets go: the waiter gives up and reports a deadlock.
    final var stuck = dreadlock.create(account.mutex, "account");
    final var acquired = executor.submit(() -> {
      try (var handle = dreadlock.createDeferred(account.mutex, "account")) {
        return handle.lock();
      }
    }).get();
    System.out.format("acquired while stuck: %b%n", acquired);
    stuck.unlock();

    executor.shutdown();
  }

  private static Void withdraw(Dreadlock dreadlock, Account account, int amount, long holdMs) throws InterruptedException {
    try (var handle = dreadlock.createDeferred(account.mutex, "account")) {
      if (handle.lock()) {
        account.balance -= amount;
        Thread.sleep(holdMs);
        handle.unlock();
      }
    }
    return null;
  }
}
