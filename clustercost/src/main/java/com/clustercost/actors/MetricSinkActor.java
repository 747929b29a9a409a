/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.actors;

/**
 *
 * @author rachanakeshav
 */
import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.Behaviors;
import com.clustercost.metrics.MetricSink;

public class MetricSinkActor {

    public interface Command {
    }

    public static final class Emit implements Command {

        public final String name;
        public final double value;

        public Emit(String name, double value) {
            this.name = name;
            this.value = value;
        }
    }

    // Answered once every Emit queued before it has been pushed
    public static final class Flush implements Command {

        public final ActorRef<Flushed> replyTo;

        public Flush(ActorRef<Flushed> replyTo) {
            this.replyTo = replyTo;
        }
    }

    public static final class Flushed {

        public final int emitted;

        public Flushed(int emitted) {
            this.emitted = emitted;
        }
    }

    public static Behavior<Command> create(MetricSink sink) {
        return Behaviors.setup(ctx -> {
            int[] emitted = {0};
            return Behaviors.receive(Command.class)
                    .onMessage(Emit.class, m -> {
                        ctx.getLog().info("[metric] {} {}", m.name, m.value);
                        sink.emit(m.name, m.value);
                        emitted[0]++;
                        return Behaviors.same();
                    })
                    .onMessage(Flush.class, m -> {
                        m.replyTo.tell(new Flushed(emitted[0]));
                        return Behaviors.same();
                    })
                    .build();
        });
    }
}
