package io.arrconf.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arrconf.config.ConfigurationException;
import io.arrconf.config.LoadedConfig;
import io.arrconf.model.AttributeChange;
import io.arrconf.model.DiffResult;
import io.arrconf.model.FailureKind;
import io.arrconf.model.InstanceFailure;
import io.arrconf.model.InstanceRef;
import io.arrconf.model.ResourceDiff;
import io.arrconf.model.RunStage;
import io.arrconf.model.RunStatus;
import io.arrconf.observability.RunLogContext;
import io.arrconf.plugin.InstanceContext;
import io.arrconf.plugin.Plugin;
import io.arrconf.plugin.PluginRegistry;
import io.arrconf.plugin.RemoteApiException;
import io.arrconf.plugin.RemoteItem;
import io.arrconf.plugin.ResourceType;
import io.arrconf.plugin.SecretsException;
import io.arrconf.reconcile.AttributeDiffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.BooleanSupplier;

// Each stage finishes for every instance before the next stage starts.
public final class RunPipeline {
    private static final Logger log = LoggerFactory.getLogger(RunPipeline.class);

    private final PluginRegistry plugins;
    private final AttributeDiffer differ = new AttributeDiffer();

    public RunPipeline(PluginRegistry plugins) {
        this.plugins = plugins;
    }

    public RunReport run(LoadedConfig config, Set<String> usePlugins, BooleanSupplier cancelled) {
        RunContext run = prepare(config, usePlugins, cancelled);
        log.info("Starting run {}", run.runId());
        for (RunStage stage : RunStage.values()) {
            if (run.cancellationRequested()) {
                log.warn("Shutdown requested, stopping run before stage '{}'", stage.label());
                break;
            }
            try (RunLogContext ignored = RunLogContext.stage(stage)) {
                runStage(run, stage);
            }
        }
        RunReport report = run.report();
        logSummary(report);
        return report;
    }

    public RunReport validate(LoadedConfig config, Set<String> usePlugins) {
        String runId = UUID.randomUUID().toString();
        Instant started = Instant.now();
        RunContext run;
        try {
            run = prepare(config, usePlugins, null);
        } catch (ConfigurationException e) {
            log.error("Resolving instance configuration and dependencies: FAILED");
            log.error(e.getMessage());
            return RunReport.fatal(runId, started, e.getMessage());
        }
        log.info("Resolving instance configuration and dependencies: PASSED");

        try (RunLogContext ignored = RunLogContext.stage(RunStage.RENDER_PRE_INIT)) {
            renderPreInit(run);
        }
        boolean passed = step("Rendering dynamic configuration", run, 0);

        int before = run.failures().size();
        for (InstanceRef ref : run.graph().order()) {
            if (!run.isActive(ref)) {
                continue;
            }
            try (RunLogContext ignored = RunLogContext.instance(ref)) {
                run.registry().get(ref).plugin().validateOffline(run.context(ref));
            } catch (RuntimeException e) {
                run.exclude(ref, RunStage.RENDER_POST_INIT, FailureKind.INTERNAL, describe(e));
            }
        }
        passed &= step("Validating instance configuration", run, before);

        RunReport report = run.report();
        if (passed) {
            return report;
        }
        return new RunReport(report.runId(), report.startedAt(), report.finishedAt(), RunStatus.FATAL,
                report.executionOrder(), report.changes(), report.deletions(), report.skipped(),
                report.failures(), "Configuration validation failed");
    }

    private static boolean step(String name, RunContext run, int failuresBefore) {
        List<InstanceFailure> failures = run.failures();
        if (failures.size() == failuresBefore) {
            log.info("{}: PASSED", name);
            return true;
        }
        log.error("{}: FAILED", name);
        for (InstanceFailure failure : failures.subList(failuresBefore, failures.size())) {
            log.error("  {}: {}", failure.instance(), failure.message());
        }
        return false;
    }

    RunContext prepare(LoadedConfig config, Set<String> usePlugins, BooleanSupplier cancelled) {
        InstanceRegistry registry = InstanceRegistry.build(config, plugins, usePlugins);
        DependencyGraph graph = DependencyGraph.of(registry, plugins::isInstalled);
        if (log.isInfoEnabled()) {
            log.info("Execution order:");
            int i = 1;
            for (InstanceRef ref : graph.order()) {
                log.info("  {}. {}", i++, ref);
            }
        }
        return new RunContext(registry, graph, config.settings().requestTimeout(), cancelled);
    }

    private void runStage(RunContext run, RunStage stage) {
        log.debug("Entering stage '{}'", stage.label());
        switch (stage) {
            case RENDER_PRE_INIT -> renderPreInit(run);
            case INITIALIZE_INSTANCES -> forEachActive(run, stage, run.graph().order(), (ref, ctx, plugin) -> plugin.initialize(ctx));
            case RENDER_POST_INIT -> forEachActive(run, stage, run.graph().order(), (ref, ctx, plugin) -> plugin.renderPostInit(ctx));
            case FETCH_SECRETS -> forEachActive(run, stage, run.graph().order(), this::fetchSecrets);
            case FETCH_REMOTE -> forEachActive(run, stage, run.graph().order(), (ref, ctx, plugin) -> fetchRemote(run, ref, ctx, plugin));
            case COMPUTE_DIFF -> forEachActive(run, stage, run.graph().order(), (ref, ctx, plugin) -> computeDiff(run, ref, ctx, plugin));
            case APPLY_UPDATES -> forEachActive(run, stage, run.graph().order(), (ref, ctx, plugin) -> applyUpdates(run, ref, ctx, plugin));
            case DELETE_UNMANAGED -> forEachActive(run, stage, run.graph().reverseOrder(), (ref, ctx, plugin) -> deleteUnmanaged(run, ref, ctx, plugin));
        }
    }

    private void renderPreInit(RunContext run) {
        Map<Plugin, List<InstanceContext>> byPlugin = new LinkedHashMap<>();
        for (InstanceRef ref : run.graph().order()) {
            if (run.isActive(ref)) {
                byPlugin.computeIfAbsent(run.registry().get(ref).plugin(), p -> new ArrayList<>()).add(run.context(ref));
            }
        }
        for (Map.Entry<Plugin, List<InstanceContext>> entry : byPlugin.entrySet()) {
            Plugin plugin = entry.getKey();
            try (RunLogContext ignored = RunLogContext.plugin(plugin.name())) {
                plugin.renderPreInit(entry.getValue());
            } catch (RuntimeException e) {
                log.error("Failed to render configuration for plugin '{}': {}", plugin.name(), describe(e), e);
                for (InstanceContext ctx : entry.getValue()) {
                    run.exclude(ctx.ref(), RunStage.RENDER_PRE_INIT, FailureKind.INTERNAL, describe(e));
                }
            }
        }
    }

    private void fetchSecrets(InstanceRef ref, InstanceContext ctx, Plugin plugin) {
        log.info("Fetching secrets");
        ctx.secrets(plugin.fetchSecrets(ctx));
        log.info("Finished fetching secrets");
    }

    private void fetchRemote(RunContext run, InstanceRef ref, InstanceContext ctx, Plugin plugin) {
        log.info("Fetching remote configuration");
        for (ResourceType resource : plugin.resourceTypes()) {
            try {
                run.remote(ref, resource.name(), resource.fetchRemote(ctx));
            } catch (RemoteApiException | UncheckedIOException e) {
                resourceFailed(run, ref, RunStage.FETCH_REMOTE, resource, e);
            }
        }
        log.info("Finished fetching remote configuration");
    }

    private void computeDiff(RunContext run, InstanceRef ref, InstanceContext ctx, Plugin plugin) {
        List<ResourceDiff> resources = new ArrayList<>();
        for (ResourceType resource : plugin.resourceTypes()) {
            JsonNode remote = run.remote(ref, resource.name()).orElse(null);
            if (remote == null) {
                continue;
            }
            ObjectNode payload = resource.basePayload(remote);
            resources.add(differ.diff(resource.name(), resource.mappings(ctx), resource.localSection(ctx), remote, payload));
        }
        run.diff(new DiffResult(ref, resources));
    }

    private void applyUpdates(RunContext run, InstanceRef ref, InstanceContext ctx, Plugin plugin) {
        DiffResult diff = run.diff(ref).orElse(null);
        if (diff == null || !diff.requiresUpdate()) {
            log.info("Remote configuration is up to date");
            return;
        }
        log.info("Updating remote configuration");
        boolean failed = false;
        for (ResourceDiff resourceDiff : diff.resources()) {
            if (!resourceDiff.changed()) {
                continue;
            }
            ResourceType resource = resourceType(plugin, resourceDiff.resource());
            for (AttributeChange change : resourceDiff.changes()) {
                log.info("{}: {} -> {}", change.path(), change.oldValue(), change.newValue());
            }
            try {
                resource.apply(ctx, resourceDiff.payload(), run.remote(ref, resource.name()).orElse(null));
                run.applied(ref, resourceDiff.changes());
            } catch (RemoteApiException | UncheckedIOException e) {
                failed = true;
                resourceFailed(run, ref, RunStage.APPLY_UPDATES, resource, e);
            }
        }
        if (failed) {
            log.warn("Remote configuration partially updated");
        } else {
            log.info("Remote configuration successfully updated");
        }
    }

    private void deleteUnmanaged(RunContext run, InstanceRef ref, InstanceContext ctx, Plugin plugin) {
        for (ResourceType resource : plugin.resourceTypes()) {
            JsonNode remote = run.remote(ref, resource.name()).orElse(null);
            if (remote == null) {
                continue;
            }
            List<RemoteItem> unmanaged = resource.unmanaged(ctx, remote);
            if (unmanaged.isEmpty()) {
                continue;
            }
            if (!resource.deleteUnmanagedEnabled(ctx)) {
                for (RemoteItem item : unmanaged) {
                    log.debug("{}[{}]: (unmanaged, not deleting)", resource.name(), item.label());
                }
                continue;
            }
            for (RemoteItem item : unmanaged) {
                if (run.cancellationRequested()) {
                    return;
                }
                try {
                    log.info("{}[{}]: deleting", resource.name(), item.label());
                    resource.delete(ctx, item);
                    run.deleted(new RunReport.Deletion(ref, resource.name(), item.id(), item.label()));
                } catch (RemoteApiException | UncheckedIOException e) {
                    resourceFailed(run, ref, RunStage.DELETE_UNMANAGED, resource, e);
                }
            }
        }
    }

    private void forEachActive(RunContext run, RunStage stage, List<InstanceRef> order, InstanceStep step) {
        for (InstanceRef ref : order) {
            if (!run.isActive(ref)) {
                continue;
            }
            if (run.cancellationRequested()) {
                run.skip(ref, stage, "cancelled by shutdown request");
                continue;
            }
            Plugin plugin = run.registry().get(ref).plugin();
            try (RunLogContext ignored = RunLogContext.instance(ref)) {
                try {
                    step.accept(ref, run.context(ref), plugin);
                } catch (RuntimeException e) {
                    FailureKind kind = classify(stage, e);
                    log.error("{} failed during stage '{}' ({}): {}", ref, stage.label(), kind, describe(e));
                    if (kind == FailureKind.INTERNAL) {
                        log.debug("Stack trace", e);
                    }
                    run.exclude(ref, stage, kind, describe(e));
                }
            }
        }
    }

    private void resourceFailed(RunContext run, InstanceRef ref, RunStage stage, ResourceType resource, RuntimeException e) {
        FailureKind kind = e instanceof UncheckedIOException ? FailureKind.CONNECTIVITY : FailureKind.REMOTE_API;
        log.error("{}: {} failed ({}): {}", resource.name(), stage.label(), kind, describe(e));
        run.resourceFailed(ref, stage, kind, resource.name(), describe(e));
    }

    static FailureKind classify(RunStage stage, RuntimeException e) {
        if (e instanceof SecretsException || e instanceof UncheckedIOException) {
            return FailureKind.CONNECTIVITY;
        }
        if (e instanceof RemoteApiException) {
            return stage == RunStage.FETCH_SECRETS ? FailureKind.CONNECTIVITY : FailureKind.REMOTE_API;
        }
        return FailureKind.INTERNAL;
    }

    private static ResourceType resourceType(Plugin plugin, String name) {
        for (ResourceType resource : plugin.resourceTypes()) {
            if (resource.name().equals(name)) {
                return resource;
            }
        }
        throw new IllegalStateException("Plugin '" + plugin.name() + "' has no resource type '" + name + "'");
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static void logSummary(RunReport report) {
        List<String> lines = report.summaryLines();
        if (report.status() == RunStatus.SUCCESS) {
            lines.forEach(log::info);
        } else {
            lines.forEach(log::warn);
        }
    }

    @FunctionalInterface
    private interface InstanceStep {
        void accept(InstanceRef ref, InstanceContext ctx, Plugin plugin);
    }
}
