/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@code sinfo --noheader --partition <queue>} and returns its output lines.
 */
public class SinfoSchedulerClient implements SchedulerClient {

    private final String sinfoPath;
    private final Duration timeout;

    public SinfoSchedulerClient(String sinfoPath, Duration timeout) {
        this.sinfoPath = sinfoPath;
        this.timeout = timeout;
    }

    List<String> command(String partition) {
        return List.of(sinfoPath, "--noheader", "--partition", partition);
    }

    @Override
    public List<String> partitionStatus(String partition) throws SchedulerQueryException {
        Process process;
        try {
            process = new ProcessBuilder(command(partition))
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new SchedulerQueryException("could not start " + sinfoPath + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SchedulerQueryException("sinfo timed out after " + timeout + " for partition " + partition);
            }
            if (process.exitValue() != 0) {
                throw new SchedulerQueryException("sinfo exited with " + process.exitValue() + " for partition " + partition);
            }
            return lines(stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SchedulerQueryException("interrupted while querying partition " + partition, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new SchedulerQueryException("could not read sinfo output for partition " + partition, e);
        }
    }

    static List<String> lines(String output) {
        List<String> out = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (!line.isBlank()) out.add(line);
        }
        return out;
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("reading sinfo output failed: " + e, e);
        }
    }
}
