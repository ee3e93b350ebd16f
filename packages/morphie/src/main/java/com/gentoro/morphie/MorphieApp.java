package com.gentoro.morphie;

import com.gentoro.morphie.exception.ErrorDetails;
import com.gentoro.morphie.exception.ExceptionUtil;

public class MorphieApp {

  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(MorphieApp.class);

  public static void main(String[] args) {
    try {
      Morphie app = new Morphie(args);
      app.initialize();
      app.run();
    } catch (Exception e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.error("Analysis failed: {}", details);
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      System.err.println(details);
      System.err.println(StartupParameters.usage());
      System.exit(1);
    }
  }
}
