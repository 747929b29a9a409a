/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.inspect;

/**
 *
 * @author rachanakeshav
 */
import java.util.regex.Pattern;

/**
 * Counts powered-up nodes in scheduler partition output.
 * <p>
 * Each line is one node-state bucket. Buckets whose state contains {@code idle~}
 * (powered down, cloud idle) cost nothing and are skipped. The node count is read from
 * a fixed whitespace-delimited column; lines with fewer than four fields or a count
 * that is not a non-negative integer are ignored.
 */
public final class NodeStateParser {

    /** Zero-based index of NODES in sinfo's default layout (PARTITION AVAIL TIMELIMIT NODES STATE NODELIST). */
    public static final int DEFAULT_COUNT_COLUMN = 3;

    static final String POWERED_DOWN_MARKER = "idle~";
    static final int MIN_FIELDS = 4;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int countColumn;

    public NodeStateParser() {
        this(DEFAULT_COUNT_COLUMN);
    }

    public NodeStateParser(int countColumn) {
        if (countColumn < 0) {
            throw new IllegalArgumentException("countColumn must be >= 0, got " + countColumn);
        }
        this.countColumn = countColumn;
    }

    public int activeNodeCount(Iterable<String> lines) {
        int total = 0;
        for (String line : lines) {
            total += nodesOn(line);
        }
        return total;
    }

    int nodesOn(String line) {
        if (line == null || line.isBlank() || line.contains(POWERED_DOWN_MARKER)) {
            return 0;
        }
        String[] parts = WHITESPACE.split(line.trim());
        if (parts.length < MIN_FIELDS || parts.length <= countColumn) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(parts[countColumn]));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
