package io.agentloom.core.graph;

import io.agentloom.core.graph.ExecutionTreeNode.Normal;
import io.agentloom.core.graph.ExecutionTreeNode.Parallel;
import io.agentloom.core.plan.PlanAgent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Compiles a flat, dependency-annotated agent list into a chain of execution stages.
///
/// ### Algorithm
/// 1. Drop dependency edges to ids that name no agent.
/// 2. Detect cycles by in-degree reduction (Kahn). Every agent whose in-degree never
///    reaches zero is treated as cyclic.
/// 3. Repair: a cyclic agent keeps its dependencies on non-cyclic agents. If none
///    remain, it keeps its first dependency on a cyclic agent declared *before* it,
///    which orients the kept edges by declaration order and cannot re-close a cycle.
/// 4. Entry set: agents without dependencies. When every agent has one, agents
///    depending only on the virtual root `<planId>-00` (an id that names no agent).
///    Otherwise an edge to the virtual root is dangling like any other.
/// 5. Level by level: a singleton ready-set becomes {@link Normal}, a larger one
///    {@link Parallel}. The next ready-set holds every dependent whose complete
///    dependency set has been emitted.
///
/// As a side effect each compiled agent's `parallel` flag is set.
///
/// ### Contracts
/// - **Postcondition**: the returned chain is acyclic and finite
/// - **Postcondition**: each agent appears at most once
/// - **Invariant**: agents inside a stage keep declaration order; compiling the same
///   acyclic input twice yields identical stages
///
/// @implNote Stateless and thread-safe. Agent dependency lists are not modified; the
/// repaired graph lives only inside one {@link #compile(List)} call.
public final class ExecutionGraphCompiler {

    private static final Logger logger = Logger.getLogger(ExecutionGraphCompiler.class.getName());

    /// Ordinal of the virtual root every first-level agent may depend on.
    static final String VIRTUAL_ROOT_ORDINAL = "00";

    /// Compiles the agents into an execution tree and assigns `parallel` flags.
    ///
    /// @param agents agents in declaration order, not null
    /// @return root stage, never null
    /// @throws GraphCompilationException if no agent is executable
    public ExecutionTreeNode compile(List<PlanAgent> agents) {
        if (agents.isEmpty()) {
            throw GraphCompilationException.noExecutableAgent();
        }

        Map<String, PlanAgent> byId = new LinkedHashMap<>();
        for (PlanAgent agent : agents) {
            byId.putIfAbsent(agent.getId(), agent);
        }

        Map<String, List<String>> dependencies = repair(byId);

        Set<String> processed = new HashSet<>();
        List<String> entries = new ArrayList<>();
        for (String id : byId.keySet()) {
            List<String> deps = dependencies.get(id);
            if (deps.stream().allMatch(dep -> isVirtualRoot(dep, byId))) {
                entries.add(id);
                processed.addAll(deps);
            }
        }
        if (entries.isEmpty()) {
            throw GraphCompilationException.unableToBuild();
        }

        Map<String, List<String>> dependents = new HashMap<>();
        for (String id : byId.keySet()) {
            for (String dep : dependencies.get(id)) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(id);
            }
        }

        List<List<PlanAgent>> levels = new ArrayList<>();
        List<String> current = entries;
        while (!current.isEmpty()) {
            processed.addAll(current);
            levels.add(current.stream().map(byId::get).toList());

            Set<String> next = new LinkedHashSet<>();
            for (String id : current) {
                for (String dependent : dependents.getOrDefault(id, List.of())) {
                    if (!processed.contains(dependent)
                            && processed.containsAll(dependencies.get(dependent))) {
                        next.add(dependent);
                    }
                }
            }
            current = orderByDeclaration(next, byId);
        }

        int covered = levels.stream().mapToInt(List::size).sum();
        if (covered < byId.size()) {
            logger.warning(
                    "Execution tree covers " + covered + " of " + byId.size()
                            + " agents; unreachable agents are skipped");
        }

        return link(levels);
    }

    private Map<String, List<String>> repair(Map<String, PlanAgent> byId) {
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        for (PlanAgent agent : byId.values()) {
            List<String> valid = new ArrayList<>();
            for (String dep : agent.getDependsOn()) {
                if (dep.equals(agent.getId())) {
                    continue;
                }
                if ((byId.containsKey(dep) || dep.equals(virtualRootOf(agent.getId())))
                        && !valid.contains(dep)) {
                    valid.add(dep);
                }
            }
            if (valid.size() < agent.getDependsOn().size()) {
                logger.fine("Dropped dangling dependencies of agent " + agent.getId());
            }
            dependencies.put(agent.getId(), valid);
        }
        if (dependencies.values().stream().anyMatch(List::isEmpty)) {
            dependencies.values().forEach(deps -> deps.removeIf(dep -> isVirtualRoot(dep, byId)));
        }

        Set<String> cyclic = detectCyclic(dependencies);
        if (cyclic.isEmpty()) {
            return dependencies;
        }

        logger.warning("Detected circular dependency between agents " + cyclic + ", repairing");
        List<String> order = new ArrayList<>(byId.keySet());
        for (String id : order) {
            if (!cyclic.contains(id)) {
                continue;
            }
            List<String> original = dependencies.get(id);
            List<String> kept = new ArrayList<>();
            for (String dep : original) {
                if (!cyclic.contains(dep)) {
                    kept.add(dep);
                }
            }
            if (kept.isEmpty()) {
                int position = order.indexOf(id);
                for (String dep : original) {
                    if (cyclic.contains(dep) && order.indexOf(dep) < position) {
                        kept.add(dep);
                        break;
                    }
                }
            }
            if (kept.size() != original.size()) {
                logger.warning("Disconnected cyclic dependencies of agent " + id + ": kept " + kept);
            }
            dependencies.put(id, kept);
        }
        return dependencies;
    }

    private Set<String> detectCyclic(Map<String, List<String>> dependencies) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> adjacency = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            int degree = 0;
            for (String dep : entry.getValue()) {
                if (dependencies.containsKey(dep)) {
                    adjacency.computeIfAbsent(dep, k -> new ArrayList<>()).add(entry.getKey());
                    degree++;
                }
            }
            inDegree.put(entry.getKey(), degree);
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach(
                (id, degree) -> {
                    if (degree == 0) {
                        queue.add(id);
                    }
                });
        while (!queue.isEmpty()) {
            String id = queue.poll();
            for (String neighbor : adjacency.getOrDefault(id, List.of())) {
                int degree = inDegree.merge(neighbor, -1, Integer::sum);
                if (degree == 0) {
                    queue.add(neighbor);
                }
            }
        }

        Set<String> cyclic = new LinkedHashSet<>();
        inDegree.forEach(
                (id, degree) -> {
                    if (degree > 0) {
                        cyclic.add(id);
                    }
                });
        return cyclic;
    }

    /// After the first repair pass the only kept ids that name no agent are virtual roots.
    private static boolean isVirtualRoot(String dep, Map<String, PlanAgent> byId) {
        return !byId.containsKey(dep);
    }

    static String virtualRootOf(String agentId) {
        int dash = agentId.lastIndexOf('-');
        return dash < 0 ? null : agentId.substring(0, dash + 1) + VIRTUAL_ROOT_ORDINAL;
    }

    private static List<String> orderByDeclaration(Set<String> ids, Map<String, PlanAgent> byId) {
        List<String> ordered = new ArrayList<>();
        for (String id : byId.keySet()) {
            if (ids.contains(id)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    private static ExecutionTreeNode link(List<List<PlanAgent>> levels) {
        ExecutionTreeNode next = null;
        for (int i = levels.size() - 1; i >= 0; i--) {
            List<PlanAgent> level = levels.get(i);
            if (level.size() == 1) {
                PlanAgent agent = level.get(0);
                agent.setParallel(false);
                next = new Normal(agent, next);
            } else {
                List<Normal> branches = new ArrayList<>();
                for (PlanAgent agent : level) {
                    agent.setParallel(true);
                    branches.add(new Normal(agent, null));
                }
                next = new Parallel(branches, next);
            }
        }
        return next;
    }
}
