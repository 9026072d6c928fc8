package io.arrconf.runtime;

import io.arrconf.model.AttributeChange;
import io.arrconf.model.InstanceFailure;
import io.arrconf.model.InstanceRef;
import io.arrconf.model.RunStage;
import io.arrconf.model.RunStatus;
import io.arrconf.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RunReport(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        RunStatus status,
        List<String> executionOrder,
        Map<String, List<AttributeChange>> changes,
        List<Deletion> deletions,
        List<SkippedInstance> skipped,
        List<InstanceFailure> failures,
        String fatalError
) {
    public RunReport {
        executionOrder = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        changes = changes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
        deletions = deletions == null ? List.of() : List.copyOf(deletions);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static RunReport fatal(String runId, Instant startedAt, String message) {
        return new RunReport(runId, startedAt, Instant.now(), RunStatus.FATAL,
                List.of(), Map.of(), List.of(), List.of(), List.of(), message);
    }

    public int changeCount() {
        return changes.values().stream().mapToInt(List::size).sum();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public List<String> summaryLines() {
        List<String> lines = new ArrayList<>();
        lines.add("Run " + runId + " finished with status " + status
                + " in " + duration().toMillis() + "ms: "
                + changeCount() + " change(s) applied, "
                + deletions.size() + " resource(s) deleted, "
                + failures.size() + " failure(s)");
        if (fatalError != null) {
            lines.add("Fatal error: " + fatalError);
        }
        for (SkippedInstance skip : skipped) {
            lines.add("Skipped " + skip.instance() + " from stage '" + skip.stage().label() + "': " + skip.reason());
        }
        for (InstanceFailure failure : failures) {
            lines.add("Failed " + failure.instance()
                    + (failure.resource() == null ? "" : " resource '" + failure.resource() + "'")
                    + " during '" + failure.stage().label() + "' (" + failure.kind() + "): " + failure.message());
        }
        return lines;
    }

    public String toJson() {
        return Jsons.toJson(this);
    }

    public void writeTo(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run report: " + path, e);
        }
    }

    public record Deletion(InstanceRef instance, String resource, String id, String label) {
    }

    public record SkippedInstance(InstanceRef instance, RunStage stage, String reason) {
    }
}
