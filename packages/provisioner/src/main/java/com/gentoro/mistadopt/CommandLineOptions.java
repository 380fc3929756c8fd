package com.gentoro.mistadopt;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/** Parses the command line and renders the help page. */
public class CommandLineOptions {

  static final String KEEP_PHONE_HOME_OPTION = "keep-phone-home";
  static final String MAX_THREADS_OPTION = "max-threads";
  static final String API_KEY_OPTION = "api-key";
  static final String CONFIG_FILE_OPTION = "config-file";
  static final String HELP_OPTION = "help";

  private final Options options = createOptions();

  private static Options createOptions() {
    Options options = new Options();

    options.addOption(
        Option.builder("k")
            .longOpt(KEEP_PHONE_HOME_OPTION)
            .hasArg(false)
            .desc("Keep the 'delete system phone-home' command in the configuration.")
            .build());

    options.addOption(
        Option.builder("t")
            .longOpt(MAX_THREADS_OPTION)
            .hasArg(true)
            .argName("n")
            .desc("Maximum number of devices provisioned concurrently (default: 10).")
            .build());

    options.addOption(
        Option.builder("a")
            .longOpt(API_KEY_OPTION)
            .hasArg(true)
            .argName("key")
            .desc("Mist API key. Falls back to $MIST_API_KEY, then ~/.mist/config.ini.")
            .build());

    options.addOption(
        Option.builder("c")
            .longOpt(CONFIG_FILE_OPTION)
            .hasArg(true)
            .argName("file")
            .desc("YAML file overriding the built-in application settings.")
            .build());

    options.addOption(
        Option.builder("h").longOpt(HELP_OPTION).hasArg(false).desc("Show this help.").build());

    return options;
  }

  public Arguments parse(String[] args) throws ParseException {
    CommandLine cmd = new DefaultParser().parse(options, args);
    if (cmd.hasOption(HELP_OPTION)) {
      return new Arguments(true, null, false, null, null, null);
    }

    List<String> positional = cmd.getArgList();
    if (positional.size() != 1) {
      throw new ParseException("Expected exactly one inventory file, got " + positional.size());
    }

    Integer maxThreads = null;
    if (cmd.hasOption(MAX_THREADS_OPTION)) {
      String value = cmd.getOptionValue(MAX_THREADS_OPTION);
      try {
        maxThreads = Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new ParseException("--max-threads must be an integer: " + value);
      }
      if (maxThreads < 1) {
        throw new ParseException("--max-threads must be positive: " + value);
      }
    }

    return new Arguments(
        false,
        positional.get(0),
        cmd.hasOption(KEEP_PHONE_HOME_OPTION),
        maxThreads,
        cmd.getOptionValue(API_KEY_OPTION),
        cmd.getOptionValue(CONFIG_FILE_OPTION));
  }

  public String usage() {
    StringWriter out = new StringWriter();
    PrintWriter writer = new PrintWriter(out);
    new HelpFormatter()
        .printHelp(
            writer,
            HelpFormatter.DEFAULT_WIDTH,
            "mist-adopt [options] <inventory-file>",
            "Adopt Juniper devices into Mist by pushing the site adoption configuration over NETCONF.",
            options,
            HelpFormatter.DEFAULT_LEFT_PAD,
            HelpFormatter.DEFAULT_DESC_PAD,
            "The inventory is a CSV file with columns org_id, site_id, ip, user_id, password.");
    writer.flush();
    return out.toString();
  }

  /**
   * Parsed command line.
   *
   * @param maxThreads null when not given on the command line
   * @param apiKey null when not given on the command line
   * @param configFile null when not given on the command line
   */
  public record Arguments(
      boolean help,
      String inventoryFile,
      boolean keepPhoneHome,
      Integer maxThreads,
      String apiKey,
      String configFile) {

    @Override
    public String toString() {
      return "Arguments[inventoryFile=%s, keepPhoneHome=%s, maxThreads=%s, configFile=%s]"
          .formatted(inventoryFile, keepPhoneHome, maxThreads, configFile);
    }
  }
}
