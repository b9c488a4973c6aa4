package com.cardforge;

import com.cardforge.exception.ConfigurationException;
import com.cardforge.exception.StateException;
import com.cardforge.factcheck.ContextSourceRetriever;
import com.cardforge.factcheck.FactCheckPipeline;
import com.cardforge.generation.CardGenerationPipeline;
import com.cardforge.generation.CardVerifier;
import com.cardforge.generation.DirectCardVerifier;
import com.cardforge.generation.FactCheckCardVerifier;
import com.cardforge.generation.NoDuplicateDetector;
import com.cardforge.jobs.GenerationJobManager;
import com.cardforge.jobs.InMemoryJobStore;
import com.cardforge.logging.LoggingService;
import com.cardforge.model.AbstractModelGateway;
import com.cardforge.model.ModelGatewayFactory;
import com.cardforge.pipeline.PipelineExecutor;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/**
 * Application wiring: configuration, logging, model gateway, job store, pipelines and the job
 * manager, built once by {@link #initialize()} and released by {@link #shutdown()}.
 */
public class CardForge implements AutoCloseable {

  private static final org.slf4j.Logger log = LoggingService.getLogger(CardForge.class);

  private final StartupParameters startupParameters;
  private final Function<Configuration, AbstractModelGateway> gatewayFactory;
  private Configuration configuration;
  private AbstractModelGateway modelGateway;
  private InMemoryJobStore jobStore;
  private FactCheckPipeline factCheckPipeline;
  private CardGenerationPipeline generationPipeline;
  private GenerationJobManager jobManager;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public CardForge(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), ModelGatewayFactory::create);
  }

  CardForge(
      StartupParameters startupParameters,
      Function<Configuration, AbstractModelGateway> gatewayFactory) {
    this.startupParameters = startupParameters;
    this.gatewayFactory = gatewayFactory;
  }

  public void initialize() {
    this.configuration = new ConfigurationProvider(startupParameters.configFile()).config();
    // apply logging levels as early as possible
    LoggingService.applyConfiguration(configuration);

    this.modelGateway = gatewayFactory.apply(configuration);
    this.jobStore =
        new InMemoryJobStore(
            Clock.systemUTC(),
            Duration.ofSeconds(configuration.getLong("jobs.purge-interval-seconds", 60L)));
    this.factCheckPipeline =
        new FactCheckPipeline(modelGateway, new ContextSourceRetriever(), new PipelineExecutor());
    this.generationPipeline =
        new CardGenerationPipeline(
            modelGateway, new NoDuplicateDetector(), cardVerifier(), new PipelineExecutor());
    this.jobManager = new GenerationJobManager(jobStore, generationPipeline, configuration);
    log.info("CardForge initialized with model {}", modelGateway.defaultModel());
  }

  private CardVerifier cardVerifier() {
    String mode = configuration.getString("generation.fact-check.mode", "direct").trim();
    switch (mode.toLowerCase()) {
      case "direct":
        return new DirectCardVerifier(modelGateway);
      case "pipeline":
        return new FactCheckCardVerifier(factCheckPipeline);
      default:
        throw new ConfigurationException("Unknown generation.fact-check.mode: " + mode);
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      if (jobManager != null) {
        jobManager.close();
      }
      if (modelGateway != null) {
        modelGateway.close();
      }
      log.debug("CardForge shut down");
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  public Configuration configuration() {
    if (configuration == null) {
      throw new StateException("CardForge not initialized. Call initialize() first.");
    }
    return configuration;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public GenerationJobManager jobManager() {
    requireInitialized();
    return jobManager;
  }

  public FactCheckPipeline factCheckPipeline() {
    requireInitialized();
    return factCheckPipeline;
  }

  public CardGenerationPipeline generationPipeline() {
    requireInitialized();
    return generationPipeline;
  }

  public InMemoryJobStore jobStore() {
    requireInitialized();
    return jobStore;
  }

  private void requireInitialized() {
    if (jobManager == null) {
      throw new StateException("CardForge not initialized. Call initialize() first.");
    }
  }
}
