package io.arrconf.runtime;

import io.arrconf.config.ConfigurationException;
import io.arrconf.model.InstanceLink;
import io.arrconf.model.InstanceRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

public final class DependencyGraph {
    private final Map<InstanceRef, Set<InstanceRef>> edges;
    private final List<InstanceRef> order;

    private DependencyGraph(Map<InstanceRef, Set<InstanceRef>> edges, List<InstanceRef> order) {
        this.edges = edges;
        this.order = order;
    }

    public static DependencyGraph of(InstanceRegistry registry, Predicate<String> pluginInstalled) {
        List<InstanceRef> nodes = registry.instances().stream().map(Instance::ref).toList();
        return resolve(nodes, registry.links(), pluginInstalled);
    }

    public static DependencyGraph resolve(
            Collection<InstanceRef> nodes,
            Collection<InstanceLink> links,
            Predicate<String> pluginInstalled
    ) {
        Map<InstanceRef, Set<InstanceRef>> edges = new TreeMap<>();
        for (InstanceRef node : nodes) {
            edges.put(node, new TreeSet<>());
        }
        Set<String> activePlugins = new HashSet<>();
        nodes.forEach(n -> activePlugins.add(n.pluginName()));

        for (InstanceLink link : links) {
            if (!edges.containsKey(link.source())) {
                throw new ConfigurationException("Unknown instance " + link.source() + " declares an instance link");
            }
            InstanceRef target = link.target();
            if (!edges.containsKey(target)) {
                String prefix = "Unable to resolve instance dependency \"" + link.source() + " -> " + target + "\": ";
                String reason;
                if (!activePlugins.contains(target.pluginName())) {
                    reason = pluginInstalled.test(target.pluginName())
                            ? "Plugin '" + target.pluginName() + "' disabled, or no configuration defined for it"
                            : "Plugin '" + target.pluginName() + "' not installed";
                } else {
                    reason = "Instance '" + target.instanceName() + "' is not defined for plugin '" + target.pluginName() + "'";
                }
                throw new ConfigurationException(prefix + reason, List.of(link.source(), target));
            }
            edges.get(link.source()).add(target);
        }

        List<InstanceRef> order = new ArrayList<>();
        Set<InstanceRef> visited = new HashSet<>();
        for (InstanceRef node : edges.keySet()) {
            visit(node, edges, new LinkedHashSet<>(), visited, order);
        }
        return new DependencyGraph(edges, Collections.unmodifiableList(order));
    }

    private static void visit(
            InstanceRef node,
            Map<InstanceRef, Set<InstanceRef>> edges,
            LinkedHashSet<InstanceRef> visiting,
            Set<InstanceRef> visited,
            List<InstanceRef> order
    ) {
        if (visited.contains(node)) {
            return;
        }
        if (!visiting.add(node)) {
            throw cycle(node, visiting);
        }
        for (InstanceRef target : edges.get(node)) {
            visit(target, edges, visiting, visited, order);
        }
        visiting.remove(node);
        visited.add(node);
        order.add(node);
    }

    private static ConfigurationException cycle(InstanceRef repeated, LinkedHashSet<InstanceRef> visiting) {
        List<InstanceRef> path = new ArrayList<>();
        boolean inCycle = false;
        for (InstanceRef ref : visiting) {
            if (ref.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(ref);
            }
        }
        path.add(repeated);
        StringBuilder message = new StringBuilder("Detected dependency cycle in configuration for instance references:");
        for (int i = 0; i < path.size(); i++) {
            message.append("\n  ").append(i + 1).append(". ").append(path.get(i));
        }
        return new ConfigurationException(message.toString(), path.subList(0, path.size() - 1));
    }

    public List<InstanceRef> order() {
        return order;
    }

    // Dependents before targets, for deletion.
    public List<InstanceRef> reverseOrder() {
        List<InstanceRef> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    public Set<InstanceRef> dependenciesOf(InstanceRef instance) {
        return Collections.unmodifiableSet(edges.getOrDefault(instance, Set.of()));
    }

    public int size() {
        return order.size();
    }
}
