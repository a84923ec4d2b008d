package com.quantori.faves.core.configuration;

import akka.actor.typed.ActorSystem;
import com.quantori.faves.core.classification.ClassificationPipeline;
import com.quantori.faves.core.service.ClassifierRootActor;

public class LocalSystemProvider implements ClassifierSystemProvider {

  @Override
  public ActorSystem<ClassifierRootActor.Command> actorTypedSystem(
      ClassificationPipeline pipeline, FavesConfigurationProperties properties) {
    return ActorSystem.create(
        ClassifierRootActor.create(pipeline, properties.getWorkers()),
        getSystemNameOrDefault(properties.getSystemName()));
  }
}
