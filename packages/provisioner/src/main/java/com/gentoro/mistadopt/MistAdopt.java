package com.gentoro.mistadopt;

import com.gentoro.mistadopt.CommandLineOptions.Arguments;
import com.gentoro.mistadopt.config.ApiKeyResolver;
import com.gentoro.mistadopt.config.ConfigurationProvider;
import com.gentoro.mistadopt.config.RunSettings;
import com.gentoro.mistadopt.device.DevicePushWorker;
import com.gentoro.mistadopt.device.DeviceSessionFactory;
import com.gentoro.mistadopt.device.netconf.NetconfSessionFactory;
import com.gentoro.mistadopt.device.netconf.NetconfSettings;
import com.gentoro.mistadopt.exception.ConfigurationException;
import com.gentoro.mistadopt.exception.ErrorDetails;
import com.gentoro.mistadopt.exception.ExceptionUtil;
import com.gentoro.mistadopt.exception.ProvisionerException;
import com.gentoro.mistadopt.fetch.AdoptionConfigClient;
import com.gentoro.mistadopt.inventory.DeviceRecord;
import com.gentoro.mistadopt.inventory.InventoryLoader;
import com.gentoro.mistadopt.inventory.InventoryTable;
import com.gentoro.mistadopt.inventory.InventoryTablePrinter;
import com.gentoro.mistadopt.mist.MistApiClient;
import com.gentoro.mistadopt.orchestrator.ProvisioningOrchestrator;
import com.gentoro.mistadopt.orchestrator.ResultSet;
import com.gentoro.mistadopt.report.RunSummaryPrinter;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.apache.commons.cli.ParseException;
import org.apache.commons.configuration2.Configuration;

/**
 * One provisioning batch: parse arguments, load inventory and credentials, run the orchestrator and
 * report. Fatal problems are reported before any device is touched.
 */
public class MistAdopt {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(MistAdopt.class);

  /** Creates the remote collaborators; replaced in tests. */
  public interface Backends {
    AdoptionConfigClient apiClient(Configuration config);

    DeviceSessionFactory sessionFactory(Configuration config);
  }

  /** Mist cloud API and NETCONF over SSH. */
  public static final Backends DEFAULT_BACKENDS =
      new Backends() {
        @Override
        public AdoptionConfigClient apiClient(Configuration config) {
          return MistApiClient.fromConfiguration(config);
        }

        @Override
        public DeviceSessionFactory sessionFactory(Configuration config) {
          return new NetconfSessionFactory(NetconfSettings.fromConfiguration(config));
        }
      };

  private final PrintStream out;
  private final PrintStream err;
  private final ApiKeyResolver apiKeyResolver;
  private final Backends backends;
  private final boolean installShutdownHook;

  public MistAdopt(PrintStream out, PrintStream err) {
    this(out, err, new ApiKeyResolver(), DEFAULT_BACKENDS, true);
  }

  public MistAdopt(
      PrintStream out,
      PrintStream err,
      ApiKeyResolver apiKeyResolver,
      Backends backends,
      boolean installShutdownHook) {
    this.out = out;
    this.err = err;
    this.apiKeyResolver = apiKeyResolver;
    this.backends = backends;
    this.installShutdownHook = installShutdownHook;
  }

  /** @return the process exit code, see {@link ExitCode} */
  public int run(String[] args) {
    CommandLineOptions cli = new CommandLineOptions();
    Arguments arguments;
    try {
      arguments = cli.parse(args);
    } catch (ParseException e) {
      err.println("Error: " + e.getMessage());
      err.print(cli.usage());
      return ExitCode.FATAL;
    }
    if (arguments.help()) {
      out.print(cli.usage());
      return ExitCode.OK;
    }

    try {
      return provision(arguments);
    } catch (ProvisionerException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.debug("Run aborted: {}", details);
      err.println("Error: " + e.getMessage());
      return ExitCode.FATAL;
    }
  }

  private int provision(Arguments arguments) {
    Configuration config = new ConfigurationProvider(arguments.configFile()).config();
    com.gentoro.mistadopt.logging.LoggingService.applyConfiguration(config);

    InventoryLoader loader = new InventoryLoader();
    InventoryTable table = loader.read(Path.of(arguments.inventoryFile()));
    out.print(InventoryTablePrinter.render(table));
    List<DeviceRecord> devices = loader.toDevices(table);

    String apiKey = apiKeyResolver.resolve(arguments.apiKey());
    int maxThreads =
        arguments.maxThreads() != null
            ? arguments.maxThreads()
            : config.getInt("provisioning.max-threads", RunSettings.DEFAULT_MAX_CONCURRENCY);
    if (maxThreads < 1) {
      throw new ConfigurationException("provisioning.max-threads must be positive: " + maxThreads);
    }
    RunSettings settings = new RunSettings(maxThreads, arguments.keepPhoneHome(), apiKey);
    log.info("Starting run for {} devices with {}", devices.size(), settings);

    DeviceSessionFactory sessionFactory = backends.sessionFactory(config);
    try {
      ProvisioningOrchestrator orchestrator =
          new ProvisioningOrchestrator(
              backends.apiClient(config), new DevicePushWorker(sessionFactory));
      Thread hook = installShutdownHook ? shutdownHook(orchestrator, config) : null;

      ResultSet results = orchestrator.run(devices, settings);

      if (hook != null) {
        try {
          Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
          log.debug("Shutdown in progress, leaving hook in place");
        }
      }
      out.print(RunSummaryPrinter.render(results));
      return results.allSucceeded() ? ExitCode.OK : ExitCode.DEVICE_FAILURES;
    } finally {
      if (sessionFactory instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception e) {
          log.warn("Failed to release device session resources: {}", e.getMessage());
        }
      }
    }
  }

  private static Thread shutdownHook(ProvisioningOrchestrator orchestrator, Configuration config) {
    Duration grace = Duration.ofMillis(config.getLong("provisioning.shutdown-grace-ms", 120_000));
    Thread hook =
        new Thread(
            () -> {
              orchestrator.cancel();
              try {
                if (!orchestrator.awaitCompletion(grace)) {
                  log.warn("Devices still in progress after {} s; exiting anyway", grace.toSeconds());
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            },
            "provision-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    return hook;
  }
}
