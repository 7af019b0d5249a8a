/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.runtime.forest;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads regression forests in the RFCSV text format.
 *
 * <pre>
 * ### NTREES=2 FEATURE_DIM=3 LENGTH=4
 * 0,1,2,0,0.5
 * 1,-1,-1,-1,10.0
 * 2,-1,-1,-1,20.0
 * 0,-1,-1,-1,15.0
 * </pre>
 *
 * <p>Every row is {@code node,left,right,splitIdx,value}. A row with {@code node == 0} starts a
 * new tree; child indices are relative to the start of their tree and may point at any row of
 * it, as long as the tree stays acyclic. Leaves have {@code splitIdx == -1}.
 */
public final class RegressionForestReader {

    private static final Logger logger = Logger.getLogger(RegressionForestReader.class.getName());

    private static final Pattern HEADER = Pattern.compile(
            "^###\\s+NTREES=\\s*(-?\\d+)\\s+FEATURE_DIM=\\s*(-?\\d+)\\s+LENGTH=\\s*(-?\\d+)\\s*$");

    private static final byte ON_PATH = 1;
    private static final byte DONE = 2;

    public RegressionForest read(Path path) throws IOException, RegressionForestFormatException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            RegressionForest forest = read(reader);
            logger.fine("Read " + forest + " from " + path);
            return forest;
        }
    }

    public RegressionForest read(Reader source) throws IOException, RegressionForestFormatException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);

        String header = reader.readLine();
        if (header == null) {
            throw new RegressionForestFormatException("Missing header line", 1);
        }
        Matcher matcher = HEADER.matcher(header.trim());
        if (!matcher.matches()) {
            throw new RegressionForestFormatException("Could not extract tree information from header [" + header + "]", 1);
        }
        int ntrees = parseHeaderInt(matcher.group(1));
        int dim = parseHeaderInt(matcher.group(2));
        int size = parseHeaderInt(matcher.group(3));

        if (size > RegressionForest.MAX_SIZE) {
            throw new RegressionForestFormatException(
                    "Requested size " + size + " exceeds size limit " + RegressionForest.MAX_SIZE);
        }
        if (dim <= 0 || ntrees <= 0 || size <= 0) {
            throw new RegressionForestFormatException(
                    "Size, dimension and number of trees must be positive: ntrees=" + ntrees
                            + ", dim=" + dim + ", size=" + size);
        }

        int[] nbegin = new int[ntrees];
        int[] child = new int[2 * size];
        int[] splitIdx = new int[size];
        double[] value = new double[size];

        int pos = 0;
        int treePos = 0;
        int lineNumber = 1;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            if (pos >= size) {
                throw new RegressionForestFormatException("More rows than LENGTH=" + size, lineNumber);
            }
            String[] fields = line.split(",");
            if (fields.length != 5) {
                throw new RegressionForestFormatException("Expected 5 fields but got " + fields.length, lineNumber);
            }
            try {
                int node = Integer.parseInt(fields[0].trim());
                child[2 * pos] = Integer.parseInt(fields[1].trim());
                child[2 * pos + 1] = Integer.parseInt(fields[2].trim());
                splitIdx[pos] = Integer.parseInt(fields[3].trim());
                value[pos] = Double.parseDouble(fields[4].trim());

                if (node == 0) {
                    if (treePos >= ntrees) {
                        throw new RegressionForestFormatException("More trees than NTREES=" + ntrees, lineNumber);
                    }
                    nbegin[treePos++] = pos;
                } else if (treePos == 0) {
                    throw new RegressionForestFormatException("First row must be the root of a tree", lineNumber);
                }
            } catch (NumberFormatException e) {
                throw new RegressionForestFormatException("Something wrong with row '" + line + "'", lineNumber, e);
            }
            if (splitIdx[pos] < -1 || splitIdx[pos] >= dim) {
                throw new RegressionForestFormatException(
                        "Split index " + splitIdx[pos] + " outside feature dimension " + dim, lineNumber);
            }
            pos++;
        }

        if (pos != size) {
            throw new RegressionForestFormatException("Expected " + size + " rows but read " + pos);
        }
        if (treePos != ntrees) {
            throw new RegressionForestFormatException("Expected " + ntrees + " trees but read " + treePos);
        }

        resolveChildren(nbegin, child, splitIdx, size);
        return new RegressionForest(dim, nbegin, child, splitIdx, value);
    }

    /**
     * Turns tree-relative child indices into absolute positions. Children may appear anywhere
     * in their tree, but no split node may be reachable from itself.
     */
    private static void resolveChildren(int[] nbegin, int[] child, int[] splitIdx, int size)
            throws RegressionForestFormatException {
        for (int tree = 0; tree < nbegin.length; tree++) {
            int begin = nbegin[tree];
            int end = tree + 1 < nbegin.length ? nbegin[tree + 1] : size;
            for (int p = begin; p < end; p++) {
                if (splitIdx[p] == -1) {
                    continue;
                }
                for (int side = 0; side < 2; side++) {
                    int relative = child[2 * p + side];
                    if (relative < 0 || relative >= end - begin) {
                        throw new RegressionForestFormatException(
                                "Child index " + relative + " of node " + (p - begin) + " in tree " + tree
                                        + " is outside the tree of " + (end - begin) + " nodes");
                    }
                    child[2 * p + side] = begin + relative;
                }
            }
            checkAcyclic(tree, begin, end, child, splitIdx);
        }
    }

    /**
     * Depth-first walk from the root; {@code ~p} on the stack marks leaving node {@code p}.
     */
    private static void checkAcyclic(int tree, int begin, int end, int[] child, int[] splitIdx)
            throws RegressionForestFormatException {
        byte[] state = new byte[end - begin];
        IntArrayList stack = new IntArrayList();
        stack.push(begin);
        while (!stack.isEmpty()) {
            int entry = stack.popInt();
            if (entry < 0) {
                state[~entry - begin] = DONE;
                continue;
            }
            if (state[entry - begin] == DONE) {
                continue;
            }
            if (state[entry - begin] == ON_PATH) {
                throw new RegressionForestFormatException(
                        "Tree " + tree + " contains a cycle through node " + (entry - begin));
            }
            state[entry - begin] = ON_PATH;
            stack.push(~entry);
            if (splitIdx[entry] != -1) {
                stack.push(child[2 * entry]);
                stack.push(child[2 * entry + 1]);
            }
        }
    }

    private static int parseHeaderInt(String text) throws RegressionForestFormatException {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new RegressionForestFormatException("Header value out of range: " + text, 1, e);
        }
    }
}
