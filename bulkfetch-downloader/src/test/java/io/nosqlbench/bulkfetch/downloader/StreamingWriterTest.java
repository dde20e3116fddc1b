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
import io.nosqlbench.bulkfetch.api.transport.FetchCancelledException;
import io.nosqlbench.bulkfetch.api.transport.FetchConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StreamingWriterTest {

    private static final URI URL = URI.create("http://files.test/blob.bin");

    @TempDir
    Path tempDir;

    private static byte[] randomBytes(int size) {
        byte[] data = new byte[size];
        new Random(7L).nextBytes(data);
        return data;
    }

    @Test
    void testWritesBodyAndCreatesParentDirectories() throws Exception {
        byte[] content = randomBytes(50_000);
        Path destination = tempDir.resolve("a/b/c/blob.bin");
        List<Long> totals = new ArrayList<>();

        long written = new StreamingWriter(4096)
            .writeStream(URL, new ByteArrayInputStream(content), destination, totals::add);

        assertThat(written).isEqualTo(content.length);
        assertThat(Files.readAllBytes(destination)).isEqualTo(content);
        assertThat(totals).isSorted();
        assertThat(totals.get(totals.size() - 1)).isEqualTo(content.length);
    }

    @Test
    void testReplacesExistingFile() throws Exception {
        Path destination = tempDir.resolve("blob.bin");
        Files.write(destination, randomBytes(10_000));
        byte[] content = "short".getBytes();

        new StreamingWriter().writeStream(URL, new ByteArrayInputStream(content), destination,
            StreamingWriter.ChunkObserver.NONE);

        assertThat(Files.readAllBytes(destination)).isEqualTo(content);
    }

    @Test
    void testWriteFailureHalfwayLeavesNoFile() {
        byte[] content = randomBytes(1000);
        Path destination = tempDir.resolve("half/blob.bin");
        StreamingWriter writer = new StreamingWriter(100) {
            @Override
            protected OutputStream openDestination(Path path) throws IOException {
                return new FilterOutputStream(super.openDestination(path)) {
                    private long count = 0;

                    @Override
                    public void write(byte[] b, int off, int len) throws IOException {
                        if (count + len > content.length / 2) {
                            throw new IOException("disk full");
                        }
                        out.write(b, off, len);
                        count += len;
                    }
                };
            }
        };

        assertThatThrownBy(() -> writer.writeStream(URL, new ByteArrayInputStream(content), destination,
            StreamingWriter.ChunkObserver.NONE))
            .isInstanceOf(DestinationWriteException.class)
            .hasMessageContaining("disk full");
        assertThat(destination).doesNotExist();
        assertThat(destination.getParent()).isDirectory();
    }

    @Test
    void testReadFailureLeavesNoFileAndIsRetriable() {
        byte[] content = randomBytes(1000);
        Path destination = tempDir.resolve("read/blob.bin");

        assertThatThrownBy(() -> new StreamingWriter(100).writeStream(URL,
            new RecordingTransportClient.BreakingInputStream(content, 600), destination,
            StreamingWriter.ChunkObserver.NONE))
            .isInstanceOfSatisfying(FetchConnectionException.class, e -> assertThat(e.isRetriable()).isTrue());
        assertThat(destination).doesNotExist();
    }

    @Test
    void testObserverAbortDeletesPartialFile() {
        byte[] content = randomBytes(1000);
        Path destination = tempDir.resolve("abort.bin");

        assertThatThrownBy(() -> new StreamingWriter(100).writeStream(URL, new ByteArrayInputStream(content),
            destination, total -> {
                if (total >= 300) {
                    throw new FetchCancelledException(URL);
                }
            }))
            .isInstanceOf(FetchCancelledException.class);
        assertThat(destination).doesNotExist();
    }

    @Test
    void testEmptyBodyProducesEmptyFile() throws Exception {
        Path destination = tempDir.resolve("empty.bin");

        long written = new StreamingWriter().writeStream(URL, new ByteArrayInputStream(new byte[0]), destination,
            StreamingWriter.ChunkObserver.NONE);

        assertThat(written).isZero();
        assertThat(destination).exists().isEmptyFile();
    }

    @Test
    void testDirectoryAtDestinationIsLeftInPlace() throws Exception {
        Path destination = tempDir.resolve("occupied");
        Files.createDirectories(destination);

        assertThatThrownBy(() -> new StreamingWriter().writeStream(URL,
            new ByteArrayInputStream(randomBytes(100)), destination, StreamingWriter.ChunkObserver.NONE))
            .isInstanceOf(DestinationWriteException.class);
        assertThat(destination).isDirectory();
    }

    @Test
    void testExistingFileSurvivesWhenOpenFails() throws Exception {
        Path destination = tempDir.resolve("keep.txt");
        Files.writeString(destination, "user data");
        StreamingWriter writer = new StreamingWriter() {
            @Override
            protected OutputStream openDestination(Path path) throws IOException {
                throw new AccessDeniedException(path.toString());
            }
        };

        assertThatThrownBy(() -> writer.writeStream(URL, new ByteArrayInputStream(randomBytes(100)),
            destination, StreamingWriter.ChunkObserver.NONE))
            .isInstanceOf(DestinationWriteException.class)
            .hasCauseInstanceOf(AccessDeniedException.class);
        assertThat(destination).hasContent("user data");
    }

    @Test
    void testRejectsNonPositiveBufferSize() {
        assertThatThrownBy(() -> new StreamingWriter(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
