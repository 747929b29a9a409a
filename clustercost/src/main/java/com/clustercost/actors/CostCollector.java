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
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.TimerScheduler;
import com.clustercost.CollectionContext;
import com.clustercost.cost.CostAggregator;
import com.clustercost.cost.CostModels.Branch;
import com.clustercost.cost.CostModels.BranchResult;
import com.clustercost.cost.CostModels.CostReport;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

public class CostCollector {

    public static final String LOOKUPS_SUCCEEDED = "cost_collection_lookups_succeeded";
    public static final String LOOKUPS_FAILED = "cost_collection_lookups_failed";

    public interface Command {
    }

    private static final class BranchDone implements Command {

        final BranchResult result;

        BranchDone(BranchResult result) {
            this.result = result;
        }
    }

    private static final class BranchFailed implements Command {

        final Branch branch;
        final Throwable cause;

        BranchFailed(Branch branch, Throwable cause) {
            this.branch = branch;
            this.cause = cause;
        }
    }

    private enum SinkFlushed implements Command {
        INSTANCE
    }

    private enum RunTimedOut implements Command {
        INSTANCE
    }

    public static Behavior<Command> create(CollectionContext context) {
        return Behaviors.setup(ctx -> Behaviors.withTimers(timers
                -> new CostCollector(ctx, timers, context).start()));
    }

    private final ActorContext<Command> ctx;
    private final TimerScheduler<Command> timers;
    private final CostAggregator aggregator;
    private final CollectionContext context;
    private final Map<Branch, BranchResult> results = new EnumMap<>(Branch.class);
    private final long t0Nanos = System.nanoTime();

    private ActorRef<MetricSinkActor.Command> sink;
    private boolean published;

    private CostCollector(ActorContext<Command> ctx, TimerScheduler<Command> timers, CollectionContext context) {
        this.ctx = ctx;
        this.timers = timers;
        this.aggregator = context.aggregator();
        this.context = context;
    }

    private Behavior<Command> start() {
        ctx.getLog().info("Cost collection started (timeout {})", context.runTimeout());
        timers.startSingleTimer(RunTimedOut.INSTANCE, context.runTimeout());
        sink = ctx.spawn(MetricSinkActor.create(context.sink()), "metric-sink", DispatcherSelector.blocking());
        runBranch(Branch.CONTROL_NODE);
        return behavior();
    }

    private Behavior<Command> behavior() {
        return Behaviors.receive(Command.class)
                .onMessage(BranchDone.class, m -> onBranch(m.result))
                .onMessage(BranchFailed.class, this::onBranchFailed)
                .onMessage(RunTimedOut.class, m -> onTimeout())
                .onMessageEquals(SinkFlushed.INSTANCE, () -> {
                    ctx.getLog().info("Cost collection finished in {} ms", (System.nanoTime() - t0Nanos) / 1_000_000);
                    return Behaviors.stopped();
                })
                .build();
    }

    private void runBranch(Branch branch) {
        Executor blocking = ctx.getSystem().dispatchers().lookup(DispatcherSelector.blocking());
        CompletableFuture<BranchResult> work = CompletableFuture.supplyAsync(
                () -> branch == Branch.CONTROL_NODE ? aggregator.controlNodeCosts() : aggregator.workerFleetCosts(),
                blocking);
        ctx.pipeToSelf(work, (res, err) -> err != null ? new BranchFailed(branch, unwrap(err)) : new BranchDone(res));
    }

    private Behavior<Command> onBranchFailed(BranchFailed m) {
        ctx.getLog().warn("Branch {} failed, reporting zero: {}", m.branch, m.cause.toString());
        return onBranch(BranchResult.failed(m.branch));
    }

    private Behavior<Command> onBranch(BranchResult result) {
        if (published) {
            return Behaviors.same();
        }
        results.put(result.branch(), result);
        if (result.branch() == Branch.CONTROL_NODE) {
            runBranch(Branch.WORKER_FLEET);
        } else {
            publish();
        }
        return Behaviors.same();
    }

    private Behavior<Command> onTimeout() {
        if (published) {
            ctx.getLog().warn("Metric sink did not flush in time; stopping");
            return Behaviors.stopped();
        }
        ctx.getLog().warn("Cost collection timed out after {}; publishing partial results", context.runTimeout());
        for (Branch b : Branch.values()) {
            results.putIfAbsent(b, BranchResult.failed(b));
        }
        publish();
        // second chance for the flush
        timers.startSingleTimer(RunTimedOut.INSTANCE, context.runTimeout());
        return Behaviors.same();
    }

    private void publish() {
        published = true;
        timers.cancel(RunTimedOut.INSTANCE);
        int ok = 0;
        int failed = 0;
        for (BranchResult r : results.values()) {
            for (CostReport report : r.reports()) {
                sink.tell(new MetricSinkActor.Emit(report.name(), report.valueUsd()));
            }
            ok += r.lookupsSucceeded();
            failed += r.lookupsFailed();
        }
        sink.tell(new MetricSinkActor.Emit(LOOKUPS_SUCCEEDED, ok));
        sink.tell(new MetricSinkActor.Emit(LOOKUPS_FAILED, failed));
        sink.tell(new MetricSinkActor.Flush(ctx.messageAdapter(MetricSinkActor.Flushed.class, f -> SinkFlushed.INSTANCE)));
        if (failed > 0) {
            ctx.getLog().warn("Collection health: {} lookup(s) ok, {} failed", ok, failed);
        }
    }

    private static Throwable unwrap(Throwable err) {
        return (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
    }
}
