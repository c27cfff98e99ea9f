package com.ordinalcomparator.reconcile.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ordinalcomparator.domain.BlockResult;
import com.ordinalcomparator.domain.BlockStatus;
import com.ordinalcomparator.reconcile.engine.ReportSink;
import com.ordinalcomparator.reconcile.engine.RunSummary;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON object per divergent, unverified or fatal block, plus a final summary line.
 */
@Slf4j
public class JsonLinesReportSink implements ReportSink {

    private final Path file;
    private final ObjectMapper objectMapper;
    private BufferedWriter writer;

    public JsonLinesReportSink(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void onBlock(BlockResult result) {
        if (result.status() == BlockStatus.OK && !result.hasDivergences()) {
            return;
        }
        ObjectNode line = objectMapper.createObjectNode();
        line.put("type", "block");
        line.put("height", result.height());
        line.put("status", result.status().name());
        if (result.detail() != null) {
            line.put("detail", result.detail());
        }
        line.set("divergences", objectMapper.valueToTree(result.divergences()));
        write(line);
    }

    @Override
    public synchronized void onSummary(RunSummary summary) {
        ObjectNode line = objectMapper.createObjectNode();
        line.put("type", "summary");
        line.put("state", summary.state().name());
        if (summary.range() != null) {
            line.put("start", summary.range().start());
            line.put("end", summary.range().end());
        }
        line.put("processedBlocks", summary.processedBlocks());
        line.put("divergentBlocks", summary.divergentBlocks());
        if (summary.lastReconciledHeight() != null) {
            line.put("lastReconciledHeight", summary.lastReconciledHeight());
        }
        line.put("divergenceFound", summary.divergenceFound());
        line.put("verificationIncomplete", summary.verificationIncomplete());
        line.set("divergencesByKind", objectMapper.valueToTree(summary.divergencesByKind()));
        line.set("divergencesByBucket", objectMapper.valueToTree(summary.divergencesByBucket()));
        line.set("unverifiedHeights", objectMapper.valueToTree(summary.unverifiedHeights()));
        if (summary.failure() != null) {
            line.put("failure", summary.failure());
        }
        line.put("elapsedMs", summary.elapsed().toMillis());
        write(line);
        close();
    }

    private void write(ObjectNode line) {
        try {
            if (writer == null) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
            writer.write(objectMapper.writeValueAsString(line));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report " + file, e);
        }
    }

    private void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Could not close report {}: {}", file, e.getMessage());
        } finally {
            writer = null;
        }
    }
}
