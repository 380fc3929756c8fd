package com.gentoro.mistadopt.orchestrator;

import com.gentoro.mistadopt.config.RunSettings;
import com.gentoro.mistadopt.device.DevicePushWorker;
import com.gentoro.mistadopt.exception.ExceptionUtil;
import com.gentoro.mistadopt.exception.FetchException;
import com.gentoro.mistadopt.fetch.AdoptionConfigCache;
import com.gentoro.mistadopt.fetch.AdoptionConfigClient;
import com.gentoro.mistadopt.fetch.RawConfig;
import com.gentoro.mistadopt.inventory.DeviceRecord;
import com.gentoro.mistadopt.transform.ConfigTransformer;
import com.gentoro.mistadopt.transform.PushConfig;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provisions a batch of devices with bounded parallelism.
 *
 * <p>One task per device is submitted in inventory order to a fixed pool of {@code
 * maxConcurrency} threads. Each task resolves the adoption configuration through a run-scoped
 * {@link AdoptionConfigCache}, transforms it and hands it to the {@link DevicePushWorker}. Every
 * task ends in exactly one {@link PushResult}; failures never leave the task.
 *
 * <p>{@link #cancel()} lets running tasks finish their device and turns every task that has not
 * started yet into a {@link FailureCategory#CANCELLED} result.
 */
public class ProvisioningOrchestrator {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(ProvisioningOrchestrator.class);

  private final AdoptionConfigClient client;
  private final DevicePushWorker worker;
  private final ProgressListener progress;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CountDownLatch finished = new CountDownLatch(1);

  public ProvisioningOrchestrator(AdoptionConfigClient client, DevicePushWorker worker) {
    this(client, worker, ProgressListener.noop());
  }

  public ProvisioningOrchestrator(
      AdoptionConfigClient client, DevicePushWorker worker, ProgressListener progress) {
    this.client = client;
    this.worker = worker;
    this.progress = progress;
  }

  public ResultSet run(List<DeviceRecord> devices, RunSettings settings) {
    try {
      return execute(devices, settings);
    } finally {
      finished.countDown();
    }
  }

  /** Stop starting new device tasks. Tasks already pushing run to completion. */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      log.warn("Cancellation requested; devices not yet started will be skipped");
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Wait for a running {@link #run} to return.
   *
   * @return true if the run finished within the timeout
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private ResultSet execute(List<DeviceRecord> devices, RunSettings settings) {
    ResultSet results = new ResultSet();
    int total = devices.size();
    if (total == 0) {
      log.info("No devices to provision");
      return results;
    }

    AdoptionConfigCache cache = new AdoptionConfigCache(client, settings.apiKey());
    int poolSize = Math.min(settings.maxConcurrency(), total);
    ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreadFactory());
    CompletionService<PushResult> completion = new ExecutorCompletionService<>(pool);
    Map<Future<PushResult>, DeviceTask> submitted = new HashMap<>();
    AtomicInteger completed = new AtomicInteger();

    log.info("Provisioning {} devices with up to {} in parallel", total, poolSize);
    try {
      for (DeviceRecord device : devices) {
        if (cancelled.get()) {
          record(results, PushResult.cancelled(device), completed, total);
          continue;
        }
        DeviceTask task = new DeviceTask(device, settings, cache);
        try {
          submitted.put(completion.submit(task), task);
        } catch (RejectedExecutionException e) {
          record(results, PushResult.cancelled(device), completed, total);
        }
      }

      for (int i = 0; i < submitted.size(); i++) {
        Future<PushResult> future = takeNext(completion);
        record(results, resultOf(future, submitted.get(future)), completed, total);
      }
    } finally {
      pool.shutdown();
    }

    log.info(
        "Provisioning finished: {} succeeded, {} failed ({} adoption configs fetched)",
        results.successCount(),
        results.failureCount(),
        cache.fetchCount());
    return results;
  }

  /** Where a device task is; an unexpected failure is reported with the phase's category. */
  private enum Phase {
    FETCH(FailureCategory.FETCH_ERROR),
    TRANSFORM(FailureCategory.FETCH_ERROR),
    PUSH(FailureCategory.COMMIT_ERROR);

    private final FailureCategory category;

    Phase(FailureCategory category) {
      this.category = category;
    }
  }

  /** Provisions one device. Every outcome, expected or not, becomes a {@link PushResult}. */
  private final class DeviceTask implements Callable<PushResult> {
    private final DeviceRecord device;
    private final RunSettings settings;
    private final AdoptionConfigCache cache;
    private volatile Phase phase = Phase.FETCH;
    private volatile long startNanos = System.nanoTime();

    DeviceTask(DeviceRecord device, RunSettings settings, AdoptionConfigCache cache) {
      this.device = device;
      this.settings = settings;
      this.cache = cache;
    }

    @Override
    public PushResult call() {
      if (cancelled.get()) {
        return PushResult.cancelled(device);
      }
      startNanos = System.nanoTime();
      try {
        RawConfig raw;
        try {
          raw = cache.get(device.fetchKey());
        } catch (FetchException e) {
          return PushResult.failed(
              device,
              FailureCategory.FETCH_ERROR,
              ExceptionUtil.extractErrorMessage(e),
              elapsed(startNanos));
        }

        phase = Phase.TRANSFORM;
        PushConfig config = ConfigTransformer.transform(raw, settings.keepPhoneHome());
        if (cancelled.get()) {
          return PushResult.failed(
              device, FailureCategory.CANCELLED, "Cancelled before push", elapsed(startNanos));
        }

        phase = Phase.PUSH;
        PushResult pushed = worker.push(device, config);
        return new PushResult(
            pushed.ip(),
            pushed.orgId(),
            pushed.siteId(),
            pushed.status(),
            pushed.category(),
            pushed.detail(),
            elapsed(startNanos));
      } catch (RuntimeException e) {
        return unexpected(e);
      }
    }

    PushResult unexpected(Throwable t) {
      log.error(
          "{}: unexpected {} during {}: {}",
          device.ip(),
          t.getClass().getSimpleName(),
          phase,
          ExceptionUtil.formatCompactStackTrace(t, 5));
      return PushResult.failed(
          device, phase.category, ExceptionUtil.extractErrorMessage(t), elapsed(startNanos));
    }
  }

  private void record(ResultSet results, PushResult result, AtomicInteger completed, int total) {
    results.add(result);
    int done = completed.incrementAndGet();
    if (result.isSuccess()) {
      log.info("[{} / {}] {}: OK", done, total, result.ip());
    } else {
      log.warn("[{} / {}] {}: {} - {}", done, total, result.ip(), result.category(), result.detail());
    }
    try {
      progress.onResult(done, total, result);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed: {}", e.toString());
    }
  }

  private static Future<PushResult> takeNext(CompletionService<PushResult> completion) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return completion.take();
        } catch (InterruptedException e) {
          // every submitted task must still be accounted for
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) Thread.currentThread().interrupt();
    }
  }

  private static PushResult resultOf(Future<PushResult> future, DeviceTask task) {
    try {
      return future.get();
    } catch (CancellationException e) {
      return PushResult.cancelled(task.device);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PushResult.cancelled(task.device);
    } catch (ExecutionException e) {
      // only Errors get here, the task itself converts runtime exceptions
      return task.unexpected(e.getCause());
    }
  }

  private static java.util.concurrent.ThreadFactory workerThreadFactory() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread thread = new Thread(r, "provision-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
