package io.nosqlbench.bulkfetch.testserver;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import jakarta.servlet.DispatcherType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A test fixture that starts a Jetty web server to host download sources.
 * <p>
 * Static files are served from a resources directory by Jetty's DefaultServlet. Next to them
 * the fixture mounts a handful of scripted endpoints that misbehave on purpose, so that retry,
 * redirect, timeout and cleanup paths can be exercised against a real socket:
 * <ul>
 *   <li>{@code /status/{code}} answers with the given status and a short body</li>
 *   <li>{@code /redirect/{n}/{path}} answers 302 (or {@code ?code=301}) with a relative
 *       {@code Location}, counting down to {@code /{path}}</li>
 *   <li>{@code /loop} redirects to itself forever</li>
 *   <li>{@code /slow/{path}?chunk=&delayMs=&length=} streams a file in small, delayed chunks,
 *       with or without a {@code Content-Length}</li>
 *   <li>{@code /stall?ms=} holds the response headers back for the given time</li>
 *   <li>{@code /truncated/{path}} declares the full length, sends half and drops the connection</li>
 * </ul>
 * Every request path is counted, see {@link #requestCount(String)}.
 * <p>
 * Example usage:
 * ```java
 * try (JettyFileServerFixture server = new JettyFileServerFixture(root)) {
 *     server.start();
 *     URL baseUrl = server.getBaseUrl();
 *     // Use baseUrl in your tests
 * }
 * ```
 */
public class JettyFileServerFixture implements AutoCloseable {

    private static Logger logger() {
        return LazyLoggerHolder.LOGGER;
    }

    private static class LazyLoggerHolder {
        private static final Logger LOGGER = LogManager.getLogger(JettyFileServerFixture.class);
    }

    private Server server;
    private int port;
    private final Path resourcesRoot;
    private final Map<String, AtomicInteger> requestCounts = new ConcurrentHashMap<>();

    /**
     * Creates a new JettyFileServerFixture with the default resources directory.
     */
    public JettyFileServerFixture() {
        this(Paths.get("src/test/resources/testserver"));
    }

    /**
     * Creates a new JettyFileServerFixture with the specified resources directory.
     *
     * @param resourcesRoot The root directory containing the resources to serve
     */
    public JettyFileServerFixture(Path resourcesRoot) {
        logger().debug("resourcesRoot: {}", resourcesRoot);
        this.resourcesRoot = resourcesRoot.toAbsolutePath();

        if (!Files.isDirectory(this.resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
    }

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(0);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(resourcesRoot.toString());
        server.setHandler(context);

        ScriptedServlets scripted = new ScriptedServlets(resourcesRoot, requestCounts);
        context.addServlet(new ServletHolder("status", scripted.status()), "/status/*");
        context.addServlet(new ServletHolder("redirect", scripted.redirect()), "/redirect/*");
        context.addServlet(new ServletHolder("loop", scripted.loop()), "/loop");
        context.addServlet(new ServletHolder("slow", scripted.slow()), "/slow/*");
        context.addServlet(new ServletHolder("stall", scripted.stall()), "/stall");
        context.addServlet(new ServletHolder("truncated", scripted.truncated()), "/truncated/*");

        context.addFilter(new FilterHolder(scripted.countingFilter()), "/*", EnumSet.of(DispatcherType.REQUEST));

        ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("welcomeServlets", "false");
        defaultServlet.setInitParameter("redirectWelcome", "false");
        defaultServlet.setInitParameter("precompressed", "false");
        defaultServlet.setInitParameter("acceptRanges", "true");
        defaultServlet.setInitParameter("useFileMappedBuffer", "false");
        context.addServlet(defaultServlet, "/");

        try {
            server.start();
            this.port = connector.getLocalPort();
            logger().info("Jetty test web server started on port {} serving files from {}", port, resourcesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * Gets the base URL of the server.
     *
     * @return The base URL of the server
     */
    public URL getBaseUrl() {
        try {
            return new URL("http://127.0.0.1:" + port + "/");
        } catch (MalformedURLException e) {
            throw new RuntimeException("Failed to create server URL", e);
        }
    }

    /**
     * Resolves a path against the base URL.
     *
     * @param path a path relative to the server root, with or without a leading slash
     * @return the absolute URI
     */
    public URI uri(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return URI.create(getBaseUrl().toString()).resolve(relative);
    }

    /**
     * Gets the root directory being served by this server.
     *
     * @return The root directory path
     */
    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /**
     * Counts how many requests have hit a path since the server started.
     *
     * @param path the request path, starting with a slash, without query string
     * @return the number of requests seen for that path
     */
    public int requestCount(String path) {
        AtomicInteger count = requestCounts.get(path);
        return count == null ? 0 : count.get();
    }

    /**
     * Stops the server and releases resources.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger().info("Jetty test web server stopped");
            } catch (Exception e) {
                logger().error("Error stopping Jetty server", e);
            }
        }
    }
}
