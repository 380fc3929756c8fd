package com.gentoro.mistadopt.orchestrator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.mistadopt.config.RunSettings;
import com.gentoro.mistadopt.device.DevicePushWorker;
import com.gentoro.mistadopt.device.DeviceSession;
import com.gentoro.mistadopt.exception.FetchException;
import com.gentoro.mistadopt.fetch.AdoptionConfigClient;
import com.gentoro.mistadopt.fetch.RawConfig;
import com.gentoro.mistadopt.inventory.DeviceRecord;
import com.gentoro.mistadopt.inventory.FetchKey;
import com.gentoro.mistadopt.transform.PushConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(20)
class ProvisioningOrchestratorTest {

  private static final String CONFIG_TEXT =
      "set system services outbound-ssh client mist device-id abc\n"
          + "delete system phone-home\n"
          + "set system services netconf ssh";

  /** Mist API stand-in counting calls per key; selected keys always fail. */
  static class FakeMist implements AdoptionConfigClient {
    final Map<FetchKey, AtomicInteger> calls = new ConcurrentHashMap<>();
    final Set<FetchKey> broken = ConcurrentHashMap.newKeySet();
    final AtomicInteger total = new AtomicInteger();

    @Override
    public RawConfig fetch(String orgId, String siteId, String apiKey) {
      FetchKey key = new FetchKey(orgId, siteId);
      calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
      total.incrementAndGet();
      if (broken.contains(key)) {
        throw new FetchException(
            FetchException.Reason.UNAVAILABLE, 503, "Mist API unavailable for " + key);
      }
      return new RawConfig(key, CONFIG_TEXT);
    }
  }

  private static DeviceRecord device(String org, String site, String ip) {
    return new DeviceRecord(org, site, ip, "admin", "pw");
  }

  private static RunSettings settings(int maxConcurrency) {
    return new RunSettings(maxConcurrency, false, "api-key");
  }

  private static Map<String, PushResult> byIp(ResultSet results) {
    return results.results().stream().collect(Collectors.toMap(PushResult::ip, r -> r));
  }

  @Test
  @DisplayName("Three devices on two sites: all succeed with one fetch per site")
  void allSucceedWithOneFetchPerKey() {
    FakeMist mist = new FakeMist();
    FakeDevices devices = new FakeDevices();
    ProvisioningOrchestrator orchestrator =
        new ProvisioningOrchestrator(mist, new DevicePushWorker(devices));

    ResultSet results =
        orchestrator.run(
            List.of(
                device("org-1", "site-1", "10.0.0.1"),
                device("org-1", "site-1", "10.0.0.2"),
                device("org-2", "site-2", "10.0.0.3")),
            settings(10));

    assertEquals(3, results.size());
    assertTrue(results.allSucceeded());
    assertEquals(2, mist.total.get());
    assertEquals(1, mist.calls.get(new FetchKey("org-1", "site-1")).get());
    assertEquals(1, mist.calls.get(new FetchKey("org-2", "site-2")).get());

    String pushed = devices.committed.get("10.0.0.1").text();
    assertFalse(pushed.contains("phone-home"), "directive is removed by default");
    assertEquals(Set.of("10.0.0.1", "10.0.0.2", "10.0.0.3"), devices.closed);
  }

  @Test
  @DisplayName("Keep-phone-home pushes the configuration untouched")
  void keepPhoneHome() {
    FakeDevices devices = new FakeDevices();
    ProvisioningOrchestrator orchestrator =
        new ProvisioningOrchestrator(new FakeMist(), new DevicePushWorker(devices));

    orchestrator.run(
        List.of(device("org-1", "site-1", "10.0.0.1")), new RunSettings(1, true, "api-key"));

    assertEquals(CONFIG_TEXT, devices.committed.get("10.0.0.1").text());
  }

  @Test
  @DisplayName("A failed fetch fails only the devices of that site")
  void fetchFailureIsolatedToKey() {
    FakeMist mist = new FakeMist();
    mist.broken.add(new FetchKey("org-1", "site-1"));
    FakeDevices devices = new FakeDevices();
    ProvisioningOrchestrator orchestrator =
        new ProvisioningOrchestrator(mist, new DevicePushWorker(devices));

    ResultSet results =
        orchestrator.run(
            List.of(
                device("org-1", "site-1", "10.0.0.1"),
                device("org-1", "site-1", "10.0.0.2"),
                device("org-2", "site-2", "10.0.0.3")),
            settings(3));

    Map<String, PushResult> r = byIp(results);
    assertEquals(FailureCategory.FETCH_ERROR, r.get("10.0.0.1").category());
    assertEquals(FailureCategory.FETCH_ERROR, r.get("10.0.0.2").category());
    assertTrue(r.get("10.0.0.2").detail().contains("unavailable"));
    assertTrue(r.get("10.0.0.3").isSuccess());
    assertFalse(results.allSucceeded());
    assertEquals(2, results.failureCount());
    // devices without a configuration are never contacted
    assertFalse(devices.connectOrder.contains("10.0.0.1"));
    assertFalse(devices.connectOrder.contains("10.0.0.2"));
  }

  @Test
  @DisplayName("One device failing authentication does not affect the other four")
  void authFailureIsolated() {
    FakeDevices devices = new FakeDevices().failing("10.0.0.3", FailureCategory.AUTH_ERROR);
    ProvisioningOrchestrator orchestrator =
        new ProvisioningOrchestrator(new FakeMist(), new DevicePushWorker(devices));

    List<DeviceRecord> inventory = new ArrayList<>();
    for (int i = 1; i <= 5; i++) inventory.add(device("org-1", "site-1", "10.0.0." + i));

    ResultSet results = orchestrator.run(inventory, settings(5));

    Map<String, PushResult> r = byIp(results);
    assertEquals(5, r.size());
    assertEquals(FailureCategory.AUTH_ERROR, r.get("10.0.0.3").category());
    assertEquals(4, results.successCount());
    assertEquals(5, devices.closed.size(), "every session is closed, including the failed one");
    assertEquals(0, devices.open.get());
  }

  @Test
  @DisplayName("Results of other devices are the same with or without a failing device")
  void isolation() {
    List<DeviceRecord> others =
        List.of(
            device("org-1", "site-1", "10.0.0.1"),
            device("org-1", "site-2", "10.0.0.2"),
            device("org-2", "site-1", "10.0.0.4"));
    DeviceRecord bad = device("org-1", "site-1", "10.0.0.3");

    ResultSet without =
        new ProvisioningOrchestrator(new FakeMist(), new DevicePushWorker(new FakeDevices()))
            .run(others, settings(2));

    List<DeviceRecord> withBad = new ArrayList<>(others);
    withBad.add(1, bad);
    ResultSet with =
        new ProvisioningOrchestrator(
                new FakeMist(),
                new DevicePushWorker(
                    new FakeDevices().failing(bad.ip(), FailureCategory.COMMIT_ERROR)))
            .run(withBad, settings(2));

    Map<String, PushResult> a = byIp(without);
    Map<String, PushResult> b = byIp(with);
    for (DeviceRecord d : others) {
      assertEquals(a.get(d.ip()).status(), b.get(d.ip()).status());
      assertEquals(a.get(d.ip()).category(), b.get(d.ip()).category());
      assertEquals(a.get(d.ip()).detail(), b.get(d.ip()).detail());
    }
    assertEquals(FailureCategory.COMMIT_ERROR, b.get(bad.ip()).category());
  }

  @Test
  @DisplayName("Never more than maxConcurrency sessions open at once")
  void concurrencyBound() {
    FakeDevices devices = new FakeDevices().withStepDelay(20);
    ProvisioningOrchestrator orchestrator =
        new ProvisioningOrchestrator(new FakeMist(), new DevicePushWorker(devices));

    List<DeviceRecord> inventory = new ArrayList<>();
    for (int i = 1; i <= 20; i++) inventory.add(device("org-1", "site-" + (i % 3), "10.0.1." + i));

    ResultSet results = orchestrator.run(inventory, settings(3));

    assertEquals(20, results.size());
    assertTrue(results.allSucceeded());
    assertTrue(devices.maxOpen.get() <= 3, "max open sessions: " + devices.maxOpen.get());
    assertTrue(devices.maxOpen.get() >= 2, "work should run in parallel");
  }

  @Test
  @DisplayName("Cancellation lets running devices finish and skips queued ones")
  void cancellation() throws Exception {
    CountDownLatch firstConnected = new CountDownLatch(1);
    CountDownLatch proceed = new CountDownLatch(1);
    FakeDevices devices =
        new FakeDevices() {
          @Override
          public DeviceSession create(DeviceRecord device) {
            DeviceSession delegate = super.create(device);
            return new DeviceSession() {
              @Override
              public void connect() {
                delegate.connect();
                firstConnected.countDown();
                try {
                  proceed.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
              }

              @Override
              public void authenticate() {
                delegate.authenticate();
              }

              @Override
              public void loadConfiguration(PushConfig config) {
                delegate.loadConfiguration(config);
              }

              @Override
              public void commit() {
                delegate.commit();
              }

              @Override
              public void close() {
                delegate.close();
              }
            };
          }
        };
    ProvisioningOrchestrator orchestrator =
        new ProvisioningOrchestrator(new FakeMist(), new DevicePushWorker(devices));

    List<DeviceRecord> inventory = new ArrayList<>();
    for (int i = 1; i <= 6; i++) inventory.add(device("org-1", "site-1", "10.0.2." + i));

    ResultSet[] holder = new ResultSet[1];
    Thread runner = new Thread(() -> holder[0] = orchestrator.run(inventory, settings(1)));
    runner.start();

    assertTrue(firstConnected.await(5, TimeUnit.SECONDS));
    orchestrator.cancel();
    proceed.countDown();
    assertTrue(orchestrator.awaitCompletion(Duration.ofSeconds(5)));
    runner.join(5000);

    ResultSet results = holder[0];
    assertNotNull(results);
    assertEquals(6, results.size());
    Map<String, PushResult> r = byIp(results);
    assertTrue(r.get("10.0.2.1").isSuccess(), "in-flight device completes its push");
    for (int i = 2; i <= 6; i++) {
      assertEquals(FailureCategory.CANCELLED, r.get("10.0.2." + i).category());
    }
    assertEquals(List.of("10.0.2.1"), devices.connectOrder);
    assertEquals(Set.of("10.0.2.1"), devices.closed);
  }

  @Test
  @DisplayName("Progress is reported once per device")
  void progressListener() {
    List<Integer> seen = new CopyOnWriteArrayList<>();
    ProvisioningOrchestrator orchestrator =
        new ProvisioningOrchestrator(
            new FakeMist(),
            new DevicePushWorker(new FakeDevices()),
            (completed, total, result) -> {
              assertEquals(4, total);
              seen.add(completed);
            });

    List<DeviceRecord> inventory = new ArrayList<>();
    for (int i = 1; i <= 4; i++) inventory.add(device("org-1", "site-1", "10.0.3." + i));
    orchestrator.run(inventory, settings(2));

    assertEquals(List.of(1, 2, 3, 4), seen);
  }

  @Test
  void emptyInventory() {
    ResultSet results =
        new ProvisioningOrchestrator(new FakeMist(), new DevicePushWorker(new FakeDevices()))
            .run(List.of(), settings(4));

    assertEquals(0, results.size());
    assertFalse(results.allSucceeded());
  }

  @Test
  @DisplayName("A failure escaping the push is a commit error and does not stop the batch")
  void unexpectedPushFailure() {
    DevicePushWorker worker = mock(DevicePushWorker.class);
    when(worker.push(any(), any()))
        .thenAnswer(
            inv -> {
              DeviceRecord device = inv.getArgument(0);
              if (device.ip().equals("10.0.4.2")) {
                throw new NullPointerException("category");
              }
              return PushResult.success(device, Duration.ZERO);
            });
    ProvisioningOrchestrator orchestrator = new ProvisioningOrchestrator(new FakeMist(), worker);

    ResultSet results =
        orchestrator.run(
            List.of(
                device("org-1", "site-1", "10.0.4.1"),
                device("org-1", "site-1", "10.0.4.2"),
                device("org-1", "site-1", "10.0.4.3")),
            settings(2));

    Map<String, PushResult> r = byIp(results);
    assertEquals(3, r.size());
    assertEquals(FailureCategory.COMMIT_ERROR, r.get("10.0.4.2").category());
    assertTrue(r.get("10.0.4.2").detail().contains("category"));
    assertTrue(r.get("10.0.4.1").isSuccess());
    assertTrue(r.get("10.0.4.3").isSuccess());
  }

  @Test
  @DisplayName("An Error thrown by a device task still yields a result for that device")
  void errorInTask() {
    DevicePushWorker worker = mock(DevicePushWorker.class);
    when(worker.push(any(), any())).thenThrow(new StackOverflowError("deep"));
    ProvisioningOrchestrator orchestrator = new ProvisioningOrchestrator(new FakeMist(), worker);

    ResultSet results =
        orchestrator.run(List.of(device("org-1", "site-1", "10.0.5.1")), settings(1));

    PushResult result = results.forIp("10.0.5.1").orElseThrow();
    assertEquals(FailureCategory.COMMIT_ERROR, result.category());
    assertTrue(result.detail().contains("deep"));
  }

  @Test
  @DisplayName("Devices are provisioned on named daemon threads")
  void workerThreads() {
    List<Thread> threads = new CopyOnWriteArrayList<>();
    DevicePushWorker worker = mock(DevicePushWorker.class);
    when(worker.push(any(), any()))
        .thenAnswer(
            inv -> {
              threads.add(Thread.currentThread());
              return PushResult.success(inv.getArgument(0), Duration.ZERO);
            });
    ProvisioningOrchestrator orchestrator = new ProvisioningOrchestrator(new FakeMist(), worker);

    orchestrator.run(
        List.of(device("org-1", "site-1", "10.0.6.1"), device("org-1", "site-1", "10.0.6.2")),
        settings(2));

    assertEquals(2, threads.size());
    for (Thread thread : threads) {
      assertTrue(thread.isDaemon(), thread.getName());
      assertTrue(thread.getName().startsWith("provision-worker-"), thread.getName());
    }
  }
}
