package com.quantori.faves.core.configuration;

import akka.actor.typed.ActorSystem;
import com.quantori.faves.core.classification.ClassificationPipeline;
import com.quantori.faves.core.service.ClassifierRootActor;
import org.apache.commons.lang3.StringUtils;

public interface ClassifierSystemProvider {
  String FAVES_AKKA_SYSTEM = "faves-akka-system";

  ActorSystem<ClassifierRootActor.Command> actorTypedSystem(
      ClassificationPipeline pipeline, FavesConfigurationProperties properties);

  default String getSystemNameOrDefault(String systemName) {
    if (StringUtils.isNotEmpty(systemName)) {
      return systemName;
    } else {
      return FAVES_AKKA_SYSTEM;
    }
  }
}
