package io.agentloom.core.plan.markup;

import io.agentloom.core.plan.Plan;
import io.agentloom.core.plan.PlanAgent;
import io.agentloom.core.plan.PlanNode;
import java.util.List;
import java.util.stream.Collectors;

/// Deterministic markup renderer for plans, agents and agent task documents.
///
/// Two-space indentation, fixed attribute order, text escaped. The output of
/// {@link #plan(Plan)} parses back into an equivalent plan, and rendering that plan
/// again yields the same text.
final class PlanMarkupWriter {

    private static final String INDENT = "  ";

    private PlanMarkupWriter() {}

    static String plan(Plan plan) {
        StringBuilder out = new StringBuilder();
        out.append("<root>\n");
        element(out, 1, "name", plan.getName());
        element(out, 1, "thought", plan.getThought());
        out.append(INDENT).append("<agents>\n");
        for (PlanAgent agent : plan.getAgents()) {
            agent(out, 2, agent);
        }
        out.append(INDENT).append("</agents>\n");
        out.append("</root>");
        return out.toString();
    }

    static String agent(PlanAgent agent) {
        StringBuilder out = new StringBuilder();
        agent(out, 0, agent);
        return out.toString().stripTrailing();
    }

    /// Renders the document handed to an agent as its working brief. Top-level
    /// nodes carry their positional id.
    static String agentTaskDocument(PlanAgent agent, String mainTask) {
        StringBuilder out = new StringBuilder();
        out.append("<root>\n");
        element(out, 1, "name", agent.getName());
        element(out, 1, "mainTask", mainTask);
        element(out, 1, "currentTask", agent.getTask());
        nodes(out, 1, agent.getNodes(), true);
        out.append("</root>");
        return out.toString();
    }

    private static void agent(StringBuilder out, int depth, PlanAgent agent) {
        String dependsOn =
                agent.getDependsOn().stream()
                        .map(PlanAgent::ordinalOf)
                        .collect(Collectors.joining(","));
        indent(out, depth)
                .append("<agent name=\"")
                .append(escapeAttribute(agent.getName()))
                .append("\" id=\"")
                .append(escapeAttribute(agent.ordinal()))
                .append("\" dependsOn=\"")
                .append(escapeAttribute(dependsOn))
                .append("\">\n");
        element(out, depth + 1, "task", agent.getTask());
        nodes(out, depth + 1, agent.getNodes(), false);
        indent(out, depth).append("</agent>\n");
    }

    private static void nodes(StringBuilder out, int depth, List<PlanNode> nodes, boolean withIds) {
        if (nodes.isEmpty()) {
            indent(out, depth).append("<nodes></nodes>\n");
            return;
        }
        indent(out, depth).append("<nodes>\n");
        for (int i = 0; i < nodes.size(); i++) {
            node(out, depth + 1, nodes.get(i), withIds ? String.valueOf(i) : null);
        }
        indent(out, depth).append("</nodes>\n");
    }

    private static void node(StringBuilder out, int depth, PlanNode node, String id) {
        String idAttribute = id != null ? " id=\"" + id + "\"" : "";
        if (node instanceof PlanNode.Step step) {
            indent(out, depth)
                    .append("<node")
                    .append(idAttribute)
                    .append(optionalAttribute("input", step.input()))
                    .append(optionalAttribute("output", step.output()))
                    .append('>')
                    .append(escapeText(step.text()))
                    .append("</node>\n");
        } else if (node instanceof PlanNode.ForEach forEach) {
            indent(out, depth)
                    .append("<forEach")
                    .append(idAttribute)
                    .append(" items=\"")
                    .append(escapeAttribute(forEach.items()))
                    .append("\">\n");
            for (PlanNode.Step step : forEach.steps()) {
                node(out, depth + 1, step, null);
            }
            indent(out, depth).append("</forEach>\n");
        } else if (node instanceof PlanNode.Watch watch) {
            indent(out, depth)
                    .append("<watch")
                    .append(idAttribute)
                    .append(" event=\"")
                    .append(escapeAttribute(watch.event()))
                    .append("\" loop=\"")
                    .append(watch.loop())
                    .append("\">\n");
            element(out, depth + 1, "description", watch.description());
            indent(out, depth + 1).append("<trigger>\n");
            for (PlanNode trigger : watch.triggers()) {
                node(out, depth + 2, trigger, null);
            }
            indent(out, depth + 1).append("</trigger>\n");
            indent(out, depth).append("</watch>\n");
        }
    }

    private static void element(StringBuilder out, int depth, String name, String text) {
        indent(out, depth)
                .append('<')
                .append(name)
                .append('>')
                .append(escapeText(text))
                .append("</")
                .append(name)
                .append(">\n");
    }

    private static String optionalAttribute(String name, String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return " " + name + "=\"" + escapeAttribute(value) + "\"";
    }

    private static StringBuilder indent(StringBuilder out, int depth) {
        return out.append(INDENT.repeat(depth));
    }

    static String escapeText(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }
}
