package io.agentloom.core.testing;

import io.agentloom.core.execution.CancellationToken;
import io.agentloom.core.reasoning.FinishReason;
import io.agentloom.core.reasoning.ReasoningEngine;
import io.agentloom.core.reasoning.ReasoningEvent;
import io.agentloom.core.reasoning.ReasoningRequest;
import io.agentloom.core.reasoning.Usage;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/// Reasoning engine replaying queued responses, optionally routed by agent id.
public final class ScriptedEngine implements ReasoningEngine {

    public static final Usage USAGE = new Usage(10, 5, 15);

    @FunctionalInterface
    public interface Script {
        void play(ReasoningRequest request, Consumer<ReasoningEvent> sink, CancellationToken token)
                throws Exception;
    }

    private static final String ANY_AGENT = "*";

    private final Map<String, Deque<Script>> scripts = new ConcurrentHashMap<>();
    private final List<ReasoningRequest> requests = new CopyOnWriteArrayList<>();

    public ScriptedEngine then(Script script) {
        return forAgent(ANY_AGENT, script);
    }

    /// Queues a response served only to the given agent; such responses take precedence.
    public ScriptedEngine forAgent(String agentId, Script script) {
        Deque<Script> queue = scripts.computeIfAbsent(agentId, k -> new ArrayDeque<>());
        synchronized (queue) {
            queue.add(script);
        }
        return this;
    }

    public ScriptedEngine events(ReasoningEvent... events) {
        return then(play(events));
    }

    public ScriptedEngine text(String text) {
        return then(text(text, FinishReason.STOP));
    }

    public ScriptedEngine call(String callId, String name, String arguments) {
        return then(call(callId, name, arguments, FinishReason.TOOL_CALLS));
    }

    public ScriptedEngine fail(Exception error) {
        return then((request, sink, token) -> {
            throw error;
        });
    }

    public static Script play(ReasoningEvent... events) {
        return (request, sink, token) -> {
            for (ReasoningEvent event : events) {
                sink.accept(event);
            }
        };
    }

    public static Script text(String text, FinishReason reason) {
        return play(
                new ReasoningEvent.TextDelta(text),
                new ReasoningEvent.TextEnd(),
                new ReasoningEvent.Finish(reason, USAGE));
    }

    public static Script call(String callId, String name, String arguments, FinishReason reason) {
        return play(
                new ReasoningEvent.ToolCall(callId, name, arguments),
                new ReasoningEvent.Finish(reason, USAGE));
    }

    @Override
    public void stream(
            ReasoningRequest request, Consumer<ReasoningEvent> sink, CancellationToken cancellation)
            throws Exception {
        requests.add(request);
        Script script = next(request.agentId());
        if (script == null) {
            throw new IllegalStateException("No scripted response left for " + request.agentId());
        }
        script.play(request, sink, cancellation);
    }

    private Script next(String agentId) {
        for (String key : List.of(agentId, ANY_AGENT)) {
            Deque<Script> queue = scripts.get(key);
            if (queue != null) {
                synchronized (queue) {
                    Script script = queue.poll();
                    if (script != null) {
                        return script;
                    }
                }
            }
        }
        return null;
    }

    public List<ReasoningRequest> requests() {
        return requests;
    }
}
