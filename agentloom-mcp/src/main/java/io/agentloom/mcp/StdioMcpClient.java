package io.agentloom.mcp;

import io.agentloom.core.execution.CancellationToken;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/// MCP client talking to a child process over its standard streams.
///
/// Each JSON-RPC message is one line. Lines on standard output that do not start
/// with `{` are treated as log noise and skipped; standard error is discarded.
///
/// @implNote Thread-safe. Writes are serialized on a lock, responses are read by one
/// daemon thread per process.
public class StdioMcpClient extends AbstractMcpClient {

    private static final Logger LOG = Logger.getLogger(StdioMcpClient.class);

    private final List<String> command;
    private final Object writeLock = new Object();
    private volatile Process process;
    private volatile Writer stdin;
    private volatile boolean closed;

    /// Creates a client; the process is started by {@link #connect(CancellationToken)}.
    ///
    /// @param command program and arguments, not empty
    /// @param jsonRpc message helper, not null
    /// @param config timeouts, not null
    public StdioMcpClient(List<String> command, JsonRpc jsonRpc, McpClientConfig config) {
        super(jsonRpc, config);
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public synchronized void connect(CancellationToken cancellation) {
        cancellation.throwIfCancelled();
        if (closed) {
            throw new McpException("initialize", "client is closed");
        }
        stopProcess();

        Process started;
        try {
            started =
                    new ProcessBuilder(command)
                            .redirectError(ProcessBuilder.Redirect.DISCARD)
                            .start();
        } catch (IOException e) {
            throw McpException.connectionFailed(String.join(" ", command), e);
        }
        process = started;
        stdin = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));
        Thread reader = new Thread(() -> readOutput(started), "mcp-stdio-reader");
        reader.setDaemon(true);
        reader.start();

        try {
            handshake(cancellation);
        } catch (RuntimeException e) {
            stopProcess();
            throw e;
        }
        LOG.infov("MCP client connected to process {0}", command);
    }

    @Override
    public boolean isConnected() {
        Process current = process;
        return !closed && current != null && current.isAlive();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        pending.failAll(new McpException("connection closed"));
        stopProcess();
        LOG.infov("MCP client closed process {0}", command);
    }

    @Override
    protected void send(String method, String message, CancellationToken cancellation) {
        Process current = process;
        Writer writer = stdin;
        if (current == null || writer == null || !current.isAlive()) {
            throw new McpException(method, "process is not running");
        }
        synchronized (writeLock) {
            try {
                writer.write(message);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                throw new McpException(method, e.getMessage());
            }
        }
    }

    private void readOutput(Process source) {
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(source.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.startsWith("{")) {
                    onMessage(trimmed);
                } else if (!trimmed.isEmpty()) {
                    LOG.debugv("MCP process output: {0}", trimmed);
                }
            }
        } catch (IOException e) {
            LOG.debugv("MCP process output closed: {0}", e.getMessage());
        }
        if (!closed && source == process) {
            LOG.warnv("MCP process {0} exited", command);
            pending.failAll(new McpException("MCP server process exited"));
        }
    }

    private void stopProcess() {
        Process current = process;
        process = null;
        stdin = null;
        if (current == null) {
            return;
        }
        current.destroy();
        try {
            if (!current.waitFor(2, TimeUnit.SECONDS)) {
                current.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.destroyForcibly();
        }
    }
}
