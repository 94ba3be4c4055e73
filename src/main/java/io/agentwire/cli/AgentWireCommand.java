package io.agentwire.cli;

import io.agentwire.agent.ActionRouter;
import io.agentwire.agent.EchoHandler;
import io.agentwire.agent.FailHandler;
import io.agentwire.client.MessageClient;
import io.agentwire.client.TransportException;
import io.agentwire.config.AgentConfig;
import io.agentwire.config.AgentConfigLoader;
import io.agentwire.config.ConfigurationException;
import io.agentwire.model.AgentDescriptor;
import io.agentwire.model.EnvelopeCodec;
import io.agentwire.server.MessageServer;
import io.agentwire.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "agentwire",
        mixinStandardHelpOptions = true,
        description = "Agent-to-agent messaging over HTTP",
        subcommands = {
                AgentWireCommand.ServeCommand.class,
                AgentWireCommand.SendCommand.class,
                AgentWireCommand.InfoCommand.class,
                AgentWireCommand.HealthCommand.class,
                AgentWireCommand.WaitCommand.class
        }
)
public final class AgentWireCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_UNAVAILABLE = 1;
    public static final int EXIT_CONFIG = 2;

    static final String DEFAULT_SENDER = "agentwire-cli";

    @Spec
    CommandSpec spec;

    private final Map<String, String> env;

    public AgentWireCommand() {
        this(System.getenv());
    }

    AgentWireCommand(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Command line with the exit-code mapping: configuration and argument errors exit with 2,
     * transport failures with 1.
     */
    public static CommandLine commandLine() {
        return commandLine(new AgentWireCommand());
    }

    static CommandLine commandLine(AgentWireCommand command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ConfigurationException || ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("error: " + ex.getMessage());
                return EXIT_CONFIG;
            }
            if (ex instanceof TransportException) {
                commandLine.getErr().println("error: " + ex.getMessage());
                return EXIT_UNAVAILABLE;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        out().println("Use subcommands: serve | send | info | health | wait");
        out().flush();
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void print(Object value) {
        out().println(Jsons.toPrettyJson(value));
        out().flush();
    }

    Map<String, String> env() {
        return env;
    }

    @Command(name = "serve", description = "Run a message server for a configured agent")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        AgentWireCommand parent;

        @Option(names = {"--agent-name"}, description = "Agent name (default: AGENT_NAME)")
        String agentName;

        @Option(names = {"--config"}, description = "Agents file (overrides CONFIG_PATH)")
        String config;

        @Option(names = {"--host"}, defaultValue = MessageServer.DEFAULT_HOST, description = "Bind host")
        String host;

        @Option(names = {"--port"}, description = "Bind port (overrides the configured port)")
        Integer port;

        @Option(names = {"--handler"}, defaultValue = "echo", description = "Built-in handler: echo|fail")
        String handler;

        @Override
        public Integer call() throws Exception {
            Map<String, String> env = new HashMap<>(parent.env());
            if (config != null && !config.isBlank()) {
                env.put(AgentConfigLoader.ENV_CONFIG_PATH, config);
            }
            AgentConfig agentConfig = new AgentConfigLoader(env).load(agentName);
            if (port != null) {
                agentConfig = agentConfig.withPort(port);
            }
            ActionRouter router = router(handler);
            AgentDescriptor descriptor = new AgentDescriptor(
                    agentConfig.agentName(),
                    agentConfig.agentName(),
                    "AgentWire " + handler.toLowerCase(Locale.ROOT) + " agent (" + agentConfig.model() + ")",
                    agentConfig.endpoint(),
                    router.capabilities(),
                    "none",
                    agentConfig.provider()
            );
            MessageServer server = new MessageServer(descriptor, router, host, agentConfig.port()).start();
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                stopped.countDown();
            }, "agentwire-shutdown-hook"));
            parent.out().println("Agent " + descriptor.agentId() + " listening on " + server.baseUrl());
            parent.out().flush();
            stopped.await();
            return EXIT_OK;
        }

        static ActionRouter router(String name) {
            String normalized = name == null ? "echo" : name.trim().toLowerCase(Locale.ROOT);
            ActionRouter router = new ActionRouter();
            switch (normalized) {
                case "echo":
                    return router.register(EchoHandler.CAPABILITY, new EchoHandler());
                case "fail":
                    return router.register(FailHandler.CAPABILITY, new FailHandler());
                default:
                    throw new IllegalArgumentException("Unknown handler: " + name + " (expected echo|fail)");
            }
        }
    }

    @Command(name = "send", description = "Send one request and print the reply payload")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        AgentWireCommand parent;

        @Option(names = {"--endpoint"}, required = true, description = "Base URL of the target agent")
        String endpoint;

        @Option(names = {"--to"}, required = true, description = "Target agent id")
        String to;

        @Option(names = {"--from"}, defaultValue = DEFAULT_SENDER, description = "Sender agent id")
        String from;

        @Option(names = {"--timeout-seconds"}, defaultValue = "120", description = "Request timeout")
        long timeoutSeconds;

        @Option(names = {"--payload"}, description = "Payload as a JSON object")
        String payload;

        @Option(names = {"--field"}, description = "Payload field key=value (repeatable)")
        List<String> fields = new ArrayList<>();

        @Override
        public Integer call() {
            Map<String, Object> body = PayloadArguments.build(payload, fields);
            MessageClient client = new MessageClient(from, Duration.ofSeconds(timeoutSeconds));
            parent.print(client.sendRequest(to, endpoint, body));
            return EXIT_OK;
        }
    }

    @Command(name = "info", description = "Print the descriptor served by an agent")
    static final class InfoCommand implements Callable<Integer> {
        @ParentCommand
        AgentWireCommand parent;

        @Option(names = {"--endpoint"}, required = true, description = "Base URL of the agent")
        String endpoint;

        @Override
        public Integer call() {
            AgentDescriptor descriptor = new MessageClient(DEFAULT_SENDER).getAgentInfo(endpoint);
            parent.print(EnvelopeCodec.encodeDescriptor(descriptor));
            return EXIT_OK;
        }
    }

    @Command(name = "health", description = "Probe an agent's health endpoint")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        AgentWireCommand parent;

        @Option(names = {"--endpoint"}, required = true, description = "Base URL of the agent")
        String endpoint;

        @Override
        public Integer call() {
            parent.print(new MessageClient(DEFAULT_SENDER).health(endpoint));
            return EXIT_OK;
        }
    }

    @Command(name = "wait", description = "Wait until every listed agent answers its health probe")
    static final class WaitCommand implements Callable<Integer> {
        @ParentCommand
        AgentWireCommand parent;

        @Option(names = {"--endpoint"}, required = true, description = "Base URL of an agent (repeatable)")
        List<String> endpoints = new ArrayList<>();

        @Option(names = {"--attempts"}, defaultValue = "30", description = "Probes per agent")
        int attempts;

        @Option(names = {"--delay-ms"}, defaultValue = "2000", description = "Delay between probes")
        long delayMs;

        @Override
        public Integer call() {
            MessageClient client = new MessageClient(DEFAULT_SENDER, Duration.ofSeconds(5));
            Duration delay = Duration.ofMillis(Math.max(0L, delayMs));
            boolean allReady = true;
            for (String endpoint : endpoints) {
                boolean ready = client.waitForAgent(endpoint, attempts, delay);
                parent.out().println(endpoint + (ready ? " ready" : " not ready"));
                allReady &= ready;
            }
            parent.out().flush();
            return allReady ? EXIT_OK : EXIT_UNAVAILABLE;
        }
    }
}
