/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost;

/**
 *
 * @author rachanakeshav
 */
import akka.actor.typed.ActorSystem;
import com.clustercost.actors.CostCollector;
import com.clustercost.config.CostMetricsSettings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class Boot {

    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    // Extra time past the run timeout for the sink flush and system shutdown
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    public static void main(String[] args) {
        run(ConfigFactory.load());
        // every failure path is handled inside the run; a cron job should never see non-zero
        System.exit(0);
    }

    static void run(Config config) {
        ActorSystem<CostCollector.Command> system;
        Duration runTimeout;
        try {
            CostMetricsSettings settings = CostMetricsSettings.fromConfig(config);
            CollectionContext context = CollectionContext.create(settings);
            runTimeout = settings.runTimeout();
            system = ActorSystem.create(CostCollector.create(context), "CostMetricsSystem", config);
        } catch (Exception e) {
            log.error("Cost collection could not start", e);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(system::terminate));
        try {
            // the collector stops itself after its own run-timeout; wait twice that at most
            system.getWhenTerminated().toCompletableFuture()
                    .get(runTimeout.multipliedBy(2).plus(SHUTDOWN_GRACE).toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Actor system did not terminate in time; forcing shutdown");
            system.terminate();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            system.terminate();
        } catch (Exception e) {
            log.error("Cost collection ended abnormally", e);
        }
    }
}
