package com.gentoro.mistadopt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.mistadopt.CommandLineOptions.Arguments;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommandLineOptionsTest {
  private final CommandLineOptions cli = new CommandLineOptions();

  @Test
  void defaults() throws ParseException {
    Arguments args = cli.parse(new String[] {"devices.csv"});

    assertFalse(args.help());
    assertEquals("devices.csv", args.inventoryFile());
    assertFalse(args.keepPhoneHome());
    assertNull(args.maxThreads());
    assertNull(args.apiKey());
    assertNull(args.configFile());
  }

  @Test
  void shortOptions() throws ParseException {
    Arguments args =
        cli.parse(new String[] {"-k", "-t", "4", "-a", "secret", "-c", "prod.yaml", "devices.csv"});

    assertTrue(args.keepPhoneHome());
    assertEquals(4, args.maxThreads());
    assertEquals("secret", args.apiKey());
    assertEquals("prod.yaml", args.configFile());
  }

  @Test
  void longOptions() throws ParseException {
    Arguments args =
        cli.parse(
            new String[] {"devices.csv", "--keep-phone-home", "--max-threads=2", "--api-key", "k"});

    assertTrue(args.keepPhoneHome());
    assertEquals(2, args.maxThreads());
    assertEquals("k", args.apiKey());
  }

  @Test
  @DisplayName("Help needs no inventory file")
  void help() throws ParseException {
    assertTrue(cli.parse(new String[] {"--help"}).help());
    assertTrue(cli.parse(new String[] {"-h", "ignored.csv", "extra.csv"}).help());
  }

  @Test
  void inventoryFileRequired() {
    assertThrows(ParseException.class, () -> cli.parse(new String[] {}));
    assertThrows(ParseException.class, () -> cli.parse(new String[] {"a.csv", "b.csv"}));
  }

  @Test
  void maxThreadsMustBePositiveInteger() {
    ParseException zero =
        assertThrows(ParseException.class, () -> cli.parse(new String[] {"-t", "0", "d.csv"}));
    assertTrue(zero.getMessage().contains("positive"));
    assertThrows(ParseException.class, () -> cli.parse(new String[] {"-t", "many", "d.csv"}));
  }

  @Test
  void unknownOption() {
    assertThrows(ParseException.class, () -> cli.parse(new String[] {"--verbose", "d.csv"}));
  }

  @Test
  void toStringHidesApiKey() throws ParseException {
    Arguments args = cli.parse(new String[] {"-a", "super-secret", "d.csv"});
    assertFalse(args.toString().contains("super-secret"));
  }

  @Test
  void usageListsOptions() {
    String usage = cli.usage();
    assertTrue(usage.contains("--keep-phone-home"));
    assertTrue(usage.contains("--max-threads"));
    assertTrue(usage.contains("--api-key"));
    assertTrue(usage.contains("<inventory-file>"));
  }
}
