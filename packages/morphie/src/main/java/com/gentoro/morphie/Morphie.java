package com.gentoro.morphie;

import com.gentoro.morphie.logging.LoggingService;
import java.io.PrintStream;
import org.apache.commons.configuration2.Configuration;

/** Wires configuration, logging and the {@link Frontend} for one command line invocation. */
public class Morphie {

  private static final org.slf4j.Logger log = LoggingService.getLogger(Morphie.class);

  private final StartupParameters startupParameters;
  private final PrintStream stdout;
  private ConfigurationProvider configurationProvider;

  public Morphie(String[] applicationArgs) {
    this(applicationArgs, System.out);
  }

  public Morphie(String[] applicationArgs, PrintStream stdout) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.stdout = stdout;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    log.debug("Configuration loaded from {}", startupParameters.configFile());
  }

  public void run() {
    if (startupParameters.isHelpMode()) {
      stdout.println(StartupParameters.usage());
      return;
    }
    if (configurationProvider == null) {
      initialize();
    }
    AnalysisOptions options = AnalysisOptions.from(startupParameters, configuration());
    new Frontend(configuration(), stdout).run(options);
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }
}
