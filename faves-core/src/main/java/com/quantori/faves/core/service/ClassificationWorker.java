package com.quantori.faves.core.service;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import akka.pattern.StatusReply;
import com.quantori.faves.api.StructureParseException;
import com.quantori.faves.core.classification.ClassificationPipeline;
import com.quantori.faves.core.classification.ClassificationResult;
import lombok.AllArgsConstructor;

/**
 * Classifies one structure per message. Failures are replied to the asker and never stop the
 * worker.
 */
class ClassificationWorker extends AbstractBehavior<ClassificationWorker.Command> {
  private final ClassificationPipeline pipeline;

  private ClassificationWorker(ActorContext<Command> context, ClassificationPipeline pipeline) {
    super(context);
    this.pipeline = pipeline;
  }

  static Behavior<Command> create(ClassificationPipeline pipeline) {
    return Behaviors.setup(ctx -> new ClassificationWorker(ctx, pipeline));
  }

  @Override
  public Receive<Command> createReceive() {
    return newReceiveBuilder().onMessage(Classify.class, this::onClassify).build();
  }

  private Behavior<Command> onClassify(Classify cmd) {
    try {
      cmd.replyTo.tell(StatusReply.success(pipeline.classify(cmd.structure)));
    } catch (StructureParseException e) {
      getContext().getLog().debug("Rejected structure {}: {}", cmd.structure, e.getMessage());
      cmd.replyTo.tell(StatusReply.error(e));
    } catch (RuntimeException e) {
      getContext().getLog().error("Classification of {} failed", cmd.structure, e);
      cmd.replyTo.tell(StatusReply.error(e));
    }
    return this;
  }

  interface Command {}

  @AllArgsConstructor
  static class Classify implements Command {
    public final String structure;
    public final ActorRef<StatusReply<ClassificationResult>> replyTo;
  }
}
