package org.sportsmcp.cli.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.sportsmcp.cli.CommandLineInterface;
import org.sportsmcp.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * Starts the node (dataset service and HTTP server) and blocks until the JVM shuts down.
 */
@Command(
    name = "serve",
    description = "Load the dataset registry and serve the HTTP API"
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws InterruptedException {
        final Config config = parent.getConfig();

        final Node node;
        try {
            node = new Node(config);
            node.start();
        } catch (IllegalStateException e) {
            log.error("Startup aborted: {}", e.getMessage());
            return 1;
        }

        final CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping node");
            node.stop();
            shutdown.countDown();
        }, "sports-mcp-shutdown"));

        shutdown.await();
        return 0;
    }
}
