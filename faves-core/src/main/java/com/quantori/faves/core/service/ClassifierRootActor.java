package com.quantori.faves.core.service;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.SupervisorStrategy;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.PoolRouter;
import akka.actor.typed.javadsl.Receive;
import akka.actor.typed.javadsl.Routers;
import akka.pattern.StatusReply;
import com.quantori.faves.core.classification.ClassificationPipeline;
import com.quantori.faves.core.classification.ClassificationResult;
import com.quantori.faves.core.configuration.FavesConfiguration;
import lombok.AllArgsConstructor;

/**
 * Guardian of the classification service: routes requests round-robin to a pool of workers that
 * share one read-only pipeline.
 */
public class ClassifierRootActor extends AbstractBehavior<ClassifierRootActor.Command> {
  private final ActorRef<ClassificationWorker.Command> workers;

  private ClassifierRootActor(
      ActorContext<Command> context, ClassificationPipeline pipeline, int poolSize) {
    super(context);
    PoolRouter<ClassificationWorker.Command> pool =
        Routers.pool(
                poolSize,
                Behaviors.supervise(ClassificationWorker.create(pipeline))
                    .onFailure(SupervisorStrategy.restart()))
            .withRouteeProps(DispatcherSelector.fromConfig(FavesConfiguration.DISPATCHER));
    this.workers = context.spawn(pool, "classification-workers");
    context.getLog().info("Classification service started with {} workers", poolSize);
  }

  public static Behavior<Command> create(ClassificationPipeline pipeline, int poolSize) {
    return Behaviors.setup(ctx -> new ClassifierRootActor(ctx, pipeline, poolSize));
  }

  @Override
  public Receive<Command> createReceive() {
    return newReceiveBuilder().onMessage(Classify.class, this::onClassify).build();
  }

  private Behavior<Command> onClassify(Classify cmd) {
    workers.tell(new ClassificationWorker.Classify(cmd.structure, cmd.replyTo));
    return this;
  }

  public interface Command {}

  @AllArgsConstructor
  public static class Classify implements Command {
    public final String structure;
    public final ActorRef<StatusReply<ClassificationResult>> replyTo;
  }
}
