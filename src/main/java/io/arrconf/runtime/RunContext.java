package io.arrconf.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.arrconf.model.AttributeChange;
import io.arrconf.model.DiffResult;
import io.arrconf.model.FailureKind;
import io.arrconf.model.InstanceFailure;
import io.arrconf.model.InstanceRef;
import io.arrconf.model.RunStage;
import io.arrconf.model.RunStatus;
import io.arrconf.plugin.InstanceContext;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.BooleanSupplier;

final class RunContext {
    private final String runId = UUID.randomUUID().toString();
    private final Instant startedAt = Instant.now();
    private final InstanceRegistry registry;
    private final DependencyGraph graph;
    private final BooleanSupplier cancelled;
    private final Map<InstanceRef, InstanceContext> contexts = new TreeMap<>();
    private final Map<InstanceRef, RunReport.SkippedInstance> excluded = new TreeMap<>();
    private final Map<InstanceRef, Map<String, JsonNode>> remote = new TreeMap<>();
    private final Map<InstanceRef, DiffResult> diffs = new TreeMap<>();
    private final Map<String, List<AttributeChange>> applied = new LinkedHashMap<>();
    private final List<RunReport.Deletion> deletions = new ArrayList<>();
    private final List<InstanceFailure> failures = new ArrayList<>();
    private boolean wasCancelled;

    RunContext(InstanceRegistry registry, DependencyGraph graph, Duration requestTimeout, BooleanSupplier cancelled) {
        this.registry = registry;
        this.graph = graph;
        this.cancelled = cancelled == null ? () -> false : cancelled;
        for (InstanceRef ref : graph.order()) {
            Instance instance = registry.get(ref);
            contexts.put(ref, new InstanceContext(
                    ref,
                    instance.connection(),
                    instance.config().deepCopy(),
                    requestTimeout,
                    this::peer
            ));
        }
    }

    String runId() {
        return runId;
    }

    Instant startedAt() {
        return startedAt;
    }

    InstanceRegistry registry() {
        return registry;
    }

    DependencyGraph graph() {
        return graph;
    }

    InstanceContext context(InstanceRef ref) {
        return contexts.get(ref);
    }

    private Optional<InstanceContext> peer(InstanceRef ref) {
        return Optional.ofNullable(contexts.get(ref));
    }

    boolean isActive(InstanceRef ref) {
        return !excluded.containsKey(ref);
    }

    boolean cancellationRequested() {
        if (!wasCancelled && cancelled.getAsBoolean()) {
            wasCancelled = true;
        }
        return wasCancelled;
    }

    void exclude(InstanceRef ref, RunStage stage, FailureKind kind, String message) {
        failures.add(new InstanceFailure(ref, stage, kind, null, message));
        excluded.putIfAbsent(ref, new RunReport.SkippedInstance(ref, stage, message));
    }

    void skip(InstanceRef ref, RunStage stage, String reason) {
        excluded.putIfAbsent(ref, new RunReport.SkippedInstance(ref, stage, reason));
    }

    void resourceFailed(InstanceRef ref, RunStage stage, FailureKind kind, String resource, String message) {
        failures.add(new InstanceFailure(ref, stage, kind, resource, message));
    }

    void remote(InstanceRef ref, String resource, JsonNode state) {
        remote.computeIfAbsent(ref, r -> new LinkedHashMap<>()).put(resource, state);
    }

    Optional<JsonNode> remote(InstanceRef ref, String resource) {
        return Optional.ofNullable(remote.getOrDefault(ref, Map.of()).get(resource));
    }

    void diff(DiffResult diff) {
        diffs.put(diff.instance(), diff);
    }

    Optional<DiffResult> diff(InstanceRef ref) {
        return Optional.ofNullable(diffs.get(ref));
    }

    void applied(InstanceRef ref, List<AttributeChange> changes) {
        applied.computeIfAbsent(ref.toString(), r -> new ArrayList<>()).addAll(changes);
    }

    void deleted(RunReport.Deletion deletion) {
        deletions.add(deletion);
    }

    List<InstanceFailure> failures() {
        return List.copyOf(failures);
    }

    RunReport report() {
        RunStatus status;
        if (wasCancelled) {
            status = RunStatus.CANCELLED;
        } else if (!failures.isEmpty()) {
            status = RunStatus.PARTIAL_FAILURE;
        } else {
            status = RunStatus.SUCCESS;
        }
        return new RunReport(
                runId,
                startedAt,
                Instant.now(),
                status,
                graph.order().stream().map(InstanceRef::toString).toList(),
                applied,
                deletions,
                new ArrayList<>(excluded.values()),
                failures,
                null
        );
    }
}
