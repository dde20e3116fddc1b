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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/// A JUnit Jupiter extension that manages one [JettyFileServerFixture] per test JVM.
///
/// The server is started the first time any test class using the extension runs, and stopped
/// by a shutdown hook when the JVM exits. Files under `src/test/resources/testserver` of the
/// module are served as-is; tests that need content of their own write it under
/// [#TEMP_RESOURCES_ROOT], which is served at `/temp/`.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(JettyFileServerExtension.class)
/// public class MyTest {
///     // Test methods
/// }
/// ```
public class JettyFileServerExtension implements BeforeAllCallback, AfterAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyFileServerExtension.class);
    private static JettyFileServerFixture server;
    private static URL baseUrl;

    // Default paths can be overridden by setting system properties
    private static final String RESOURCES_ROOT_PROPERTY = "jetty.test.resources.root";
    private static final String DEFAULT_RESOURCES_PATH = "src/test/resources/testserver";

    /// The directory served at the server root
    public static final Path DEFAULT_RESOURCES_ROOT;
    /// A scratch directory under the root, served at `/temp/`
    public static final Path TEMP_RESOURCES_ROOT;

    private static final Object lock = new Object();

    static {
        String resourcesPath = System.getProperty(RESOURCES_ROOT_PROPERTY, DEFAULT_RESOURCES_PATH);
        DEFAULT_RESOURCES_ROOT = Paths.get(resourcesPath).toAbsolutePath();
        TEMP_RESOURCES_ROOT = DEFAULT_RESOURCES_ROOT.resolve("temp");
    }

    /// Initializes and starts the server if not already started.
    /// This method is thread-safe and idempotent.
    public static void initialize() {
        synchronized (lock) {
            if (server == null) {
                try {
                    Files.createDirectories(TEMP_RESOURCES_ROOT);

                    logger.info("Starting Jetty test web server for the module");
                    server = new JettyFileServerFixture(DEFAULT_RESOURCES_ROOT);
                    server.start();
                    baseUrl = server.getBaseUrl();
                    logger.info("Jetty test web server started at {}", baseUrl);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        if (server != null) {
                            logger.info("Stopping Jetty test web server for the module (shutdown hook)");
                            server.close();
                            server = null;
                            baseUrl = null;
                        }
                    }));
                } catch (IOException e) {
                    logger.error("Failed to start Jetty test web server", e);
                    throw new RuntimeException("Failed to start Jetty test web server", e);
                }
            }
        }
    }

    /// Gets the base URL of the test web server.
    /// @return The base URL of the test web server
    public static URL getBaseUrl() {
        initialize();
        return baseUrl;
    }

    /// Gets the JettyFileServerFixture instance.
    /// @return The JettyFileServerFixture instance
    public static JettyFileServerFixture getServer() {
        initialize();
        return server;
    }

    /// Writes a file under the scratch directory and returns the URI it is served at.
    ///
    /// @param relativePath the path under `/temp/`
    /// @param content the file content
    /// @return the absolute URI of the file on the test server
    public static URI publish(String relativePath, byte[] content) {
        initialize();
        Path file = TEMP_RESOURCES_ROOT.resolve(relativePath);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return server.uri("temp/" + relativePath);
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("JettyFileServerExtension beforeAll called for {}", context.getDisplayName());
    }

    @Override
    public void afterAll(ExtensionContext context) {
        // Server will be stopped by shutdown hook
        logger.debug("JettyFileServerExtension afterAll called for {}", context.getDisplayName());
    }
}
