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

import jakarta.servlet.Filter;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/// The misbehaving endpoints mounted by [JettyFileServerFixture].
final class ScriptedServlets {
    private static final Logger logger = LogManager.getLogger(ScriptedServlets.class);

    private final Path root;
    private final Map<String, AtomicInteger> counts;

    ScriptedServlets(Path root, Map<String, AtomicInteger> counts) {
        this.root = root;
        this.counts = counts;
    }

    /// Counts every request by its path, before any servlet sees it.
    Filter countingFilter() {
        return (request, response, chain) -> {
            String path = ((HttpServletRequest) request).getRequestURI();
            counts.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
            chain.doFilter(request, response);
        };
    }

    HttpServlet status() {
        return new HttpServlet() {
            @Override
            protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
                int code = Integer.parseInt(trimSlash(req.getPathInfo()));
                byte[] body = ("status " + code + "\n").getBytes(StandardCharsets.UTF_8);
                resp.setStatus(code);
                resp.setContentType("text/plain");
                resp.setContentLength(body.length);
                resp.getOutputStream().write(body);
            }
        };
    }

    HttpServlet redirect() {
        return new HttpServlet() {
            @Override
            protected void doGet(HttpServletRequest req, HttpServletResponse resp) {
                String info = trimSlash(req.getPathInfo());
                int slash = info.indexOf('/');
                int remaining = Integer.parseInt(info.substring(0, slash));
                String rest = info.substring(slash + 1);
                String code = req.getParameter("code");
                String query = code == null ? "" : "?code=" + code;
                // host-relative, so the client has to resolve it against the current URL
                String location = remaining > 1
                    ? "/redirect/" + (remaining - 1) + "/" + rest + query
                    : "/" + rest;
                resp.setStatus(code == null ? 302 : Integer.parseInt(code));
                resp.setHeader("Location", location);
                resp.setContentLength(0);
            }
        };
    }

    HttpServlet loop() {
        return new HttpServlet() {
            @Override
            protected void doGet(HttpServletRequest req, HttpServletResponse resp) {
                resp.setStatus(302);
                resp.setHeader("Location", "/loop");
                resp.setContentLength(0);
            }
        };
    }

    HttpServlet slow() {
        return new HttpServlet() {
            @Override
            protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
                Path file = resolve(req);
                if (file == null) {
                    resp.sendError(404);
                    return;
                }
                int chunk = intParam(req, "chunk", 1024);
                long delayMs = intParam(req, "delayMs", 5);
                boolean declareLength = !"false".equals(req.getParameter("length"));

                resp.setStatus(200);
                resp.setContentType("application/octet-stream");
                if (declareLength) {
                    resp.setContentLengthLong(Files.size(file));
                }
                OutputStream out = resp.getOutputStream();
                try (InputStream in = Files.newInputStream(file)) {
                    byte[] buffer = new byte[chunk];
                    int read;
                    while ((read = in.read(buffer)) != -1) {
                        out.write(buffer, 0, read);
                        out.flush();
                        pause(delayMs);
                    }
                }
            }
        };
    }

    HttpServlet stall() {
        return new HttpServlet() {
            @Override
            protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
                pause(intParam(req, "ms", 5000));
                byte[] body = "late\n".getBytes(StandardCharsets.UTF_8);
                resp.setStatus(200);
                resp.setContentLength(body.length);
                resp.getOutputStream().write(body);
            }
        };
    }

    HttpServlet truncated() {
        return new HttpServlet() {
            @Override
            protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
                Path file = resolve(req);
                if (file == null) {
                    resp.sendError(404);
                    return;
                }
                byte[] content = Files.readAllBytes(file);
                resp.setStatus(200);
                resp.setContentType("application/octet-stream");
                resp.setContentLengthLong(content.length);
                OutputStream out = resp.getOutputStream();
                out.write(content, 0, content.length / 2);
                out.flush();
                // throwing after commit makes Jetty abort the connection
                throw new IOException("truncating " + req.getRequestURI() + " on purpose");
            }
        };
    }

    private Path resolve(HttpServletRequest req) {
        Path file = root.resolve(trimSlash(req.getPathInfo())).normalize();
        if (!file.startsWith(root) || !Files.isRegularFile(file)) {
            return null;
        }
        return file;
    }

    private static String trimSlash(String pathInfo) {
        if (pathInfo == null) {
            return "";
        }
        return pathInfo.startsWith("/") ? pathInfo.substring(1) : pathInfo;
    }

    private static int intParam(HttpServletRequest req, String name, int defaultValue) {
        String value = req.getParameter(name);
        return value == null ? defaultValue : Integer.parseInt(value);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("scripted pause interrupted");
        }
    }
}
