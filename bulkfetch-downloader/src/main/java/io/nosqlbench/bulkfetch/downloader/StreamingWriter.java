package io.nosqlbench.bulkfetch.downloader;

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

import io.nosqlbench.bulkfetch.api.transport.DestinationWriteException;
import io.nosqlbench.bulkfetch.api.transport.FetchConnectionException;
import io.nosqlbench.bulkfetch.api.transport.FetchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Copies a response body to a file one buffer at a time.
///
/// The body is never held in memory as a whole. On any failure after the destination has been
/// opened, including one raised by the [ChunkObserver] to signal cancellation, the partially
/// written file is deleted before the exception leaves [#writeStream]. If the destination
/// cannot be opened, whatever already sits at that path is left alone.
public class StreamingWriter {

    private static final Logger logger = LogManager.getLogger(StreamingWriter.class);

    /// Default copy buffer size
    public static final int DEFAULT_BUFFER_SIZE = 16 * 1024;

    private final int bufferSize;

    /// Creates a writer with the default buffer size.
    public StreamingWriter() {
        this(DEFAULT_BUFFER_SIZE);
    }

    /// @param bufferSize the copy buffer size in bytes
    public StreamingWriter(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, was " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /// Streams `body` into `destination`, replacing any existing file.
    ///
    /// @param url the URL the body came from, for error reporting
    /// @param body the response body; not closed by this method
    /// @param destination the file to write
    /// @param observer told the running total after every chunk
    /// @return the number of bytes written
    /// @throws FetchException if reading, writing or the observer fails; the file is gone by then
    public long writeStream(URI url, InputStream body, Path destination, ChunkObserver observer)
        throws FetchException
    {
        Path parent = destination.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new DestinationWriteException(url, destination, e);
        }

        OutputStream out;
        try {
            out = openDestination(destination);
        } catch (IOException e) {
            throw new DestinationWriteException(url, destination, e);
        }

        long written = 0;
        try {
            byte[] buffer = new byte[bufferSize];
            while (true) {
                int read = readChunk(url, body, buffer);
                if (read < 0) {
                    break;
                }
                if (read == 0) {
                    continue;
                }
                try {
                    out.write(buffer, 0, read);
                } catch (IOException e) {
                    throw new DestinationWriteException(url, destination, e);
                }
                written += read;
                observer.onChunk(written);
            }
            try {
                out.close();
                out = null;
            } catch (IOException e) {
                throw new DestinationWriteException(url, destination, e);
            }
            return written;
        } catch (FetchException | RuntimeException e) {
            closeQuietly(out, destination, e);
            discard(destination, e);
            throw e;
        }
    }

    /// Opens the destination for writing. Overridable so tests can substitute a failing stream.
    ///
    /// @param destination the file to open
    /// @return a stream which truncates any existing content
    /// @throws IOException if the file cannot be opened
    protected OutputStream openDestination(Path destination) throws IOException {
        return Files.newOutputStream(destination,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    private int readChunk(URI url, InputStream body, byte[] buffer) throws FetchException {
        try {
            return body.read(buffer);
        } catch (FetchException e) {
            throw e;
        } catch (IOException e) {
            throw new FetchConnectionException(url, e);
        }
    }

    private void closeQuietly(OutputStream out, Path destination, Exception cause) {
        if (out == null) {
            return;
        }
        try {
            out.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
            logger.debug("Closing {} after failure also failed: {}", destination, e.getMessage());
        }
    }

    private void discard(Path destination, Exception cause) {
        try {
            if (Files.deleteIfExists(destination)) {
                logger.debug("Deleted partial file {}", destination);
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
            logger.warn("Could not delete partial file {}: {}", destination, e.getMessage());
        }
    }

    /// Observes the running byte count while a body is copied.
    @FunctionalInterface
    public interface ChunkObserver {

        /// An observer that does nothing.
        ChunkObserver NONE = totalWritten -> {
        };

        /// @param totalWritten bytes written so far
        /// @throws FetchException to abort the copy, which then deletes the partial file
        void onChunk(long totalWritten) throws FetchException;
    }
}
