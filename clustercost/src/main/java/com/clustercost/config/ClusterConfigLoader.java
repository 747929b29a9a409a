/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.config;

/**
 *
 * @author rachanakeshav
 */
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

public final class ClusterConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ClusterConfigLoader() {
    }

    public static ClusterConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /** Supplier that re-reads the file on each call; an unreadable file raises UncheckedIOException. */
    public static Supplier<ClusterConfig> fromFile(Path path) {
        return () -> {
            try {
                return load(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Cluster config " + path + " unreadable: " + e.getMessage(), e);
            }
        };
    }

    public static ClusterConfig read(InputStream in) throws IOException {
        ClusterConfig config = YAML_MAPPER.readValue(in, ClusterConfig.class);
        return config != null ? config : ClusterConfig.empty();
    }
}
