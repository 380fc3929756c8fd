package com.gentoro.mistadopt;

public class MistAdoptApp {

  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(MistAdoptApp.class);

  public static void main(String[] args) {
    int exitCode;
    try {
      exitCode = new MistAdopt(System.out, System.err).run(args);
    } catch (Exception e) {
      log.error("Provisioning run failed", e);
      exitCode = ExitCode.FATAL;
    }
    System.exit(exitCode);
  }
}
