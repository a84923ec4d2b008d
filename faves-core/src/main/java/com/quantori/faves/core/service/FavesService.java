package com.quantori.faves.core.service;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import com.quantori.faves.core.classification.ClassificationPipeline;
import com.quantori.faves.core.classification.ClassificationResult;
import com.quantori.faves.core.configuration.FavesBootstrap;
import com.quantori.faves.core.configuration.FavesConfiguration;
import com.quantori.faves.core.configuration.FavesConfigurationProperties;
import com.quantori.faves.core.configuration.LocalSystemProvider;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the classification core. Requests are classified concurrently by a pool of
 * actors; a failure of one request never affects another.
 */
@Slf4j
public class FavesService implements AutoCloseable {
  private final ActorSystem<ClassifierRootActor.Command> actorSystem;
  private final Duration askTimeout;

  public FavesService(ClassificationPipeline pipeline, FavesConfigurationProperties properties) {
    this(
        new LocalSystemProvider().actorTypedSystem(pipeline, properties),
        properties.getAskTimeout());
  }

  public FavesService(ActorSystem<ClassifierRootActor.Command> system, Duration askTimeout) {
    this.actorSystem = system;
    this.askTimeout = askTimeout;
  }

  /**
   * Loads configuration, reference data and patterns, then starts the service.
   *
   * @return a running service
   * @throws com.quantori.faves.api.FavesException if reference data or patterns fail to load
   */
  public static FavesService start() {
    FavesConfigurationProperties properties = FavesConfiguration.load();
    return new FavesService(FavesBootstrap.createPipeline(properties), properties);
  }

  /**
   * Classifies a structure.
   *
   * @param structure SMILES text
   * @return the verdict; completes exceptionally with
   *     {@link com.quantori.faves.api.StructureParseException} when the text is malformed
   */
  public CompletionStage<ClassificationResult> classify(String structure) {
    if (structure == null) {
      throw new IllegalArgumentException("Structure must not be null");
    }
    return AskPattern.askWithStatus(
        actorSystem,
        replyTo -> new ClassifierRootActor.Classify(structure, replyTo),
        askTimeout,
        actorSystem.scheduler());
  }

  /**
   * Classifies structures independently and in parallel.
   *
   * @param structures SMILES texts
   * @return verdicts in input order; fails if any structure fails
   */
  public CompletionStage<List<ClassificationResult>> classifyAll(List<String> structures) {
    List<CompletableFuture<ClassificationResult>> futures =
        structures.stream()
            .map(structure -> classify(structure).toCompletableFuture())
            .collect(Collectors.toList());
    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
        .thenApply(
            ignored -> futures.stream().map(CompletableFuture::join).collect(Collectors.toList()));
  }

  @Override
  public void close() {
    log.info("Stopping classification service {}", actorSystem.name());
    actorSystem.terminate();
  }
}
