/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepflow.workflow.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.stepflow.config.StepflowConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * File-based {@link CheckpointStore}: one append-only stream per run.
 *
 * <p><b>Storage Layout:</b></p>
 * <pre>
 * {directory}/
 *   ├── {runId}.ckpt          // active runs
 *   └── archive/{runId}.ckpt  // terminal runs
 * </pre>
 *
 * <p>Each record is one line: eight hex digits of CRC32C over the JSON payload, a
 * space, the JSON payload, a newline. A final line without its newline is a torn
 * write and is ignored (and cut off before the next append); a complete line whose
 * checksum does not match raises {@link CheckpointCorruptedException}.</p>
 *
 * <p><b>Thread Safety:</b> appends are serialised on the store instance. A run is
 * only ever written by one executor.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class FileCheckpointStore implements CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);

    static final String EXTENSION = ".ckpt";
    static final String ARCHIVE_DIR = "archive";

    private final Path directory;
    private final boolean fsyncEnabled;
    private final CheckpointCodec codec = new CheckpointCodec();

    public FileCheckpointStore(StepflowConfiguration configuration) {
        this(configuration.getCheckpointDirectory(), configuration.isCheckpointFsync());
    }

    /**
     * @param directory    the directory for checkpoint files (created if missing)
     * @param fsyncEnabled whether to force each append to disk (true for durability, false for testing)
     */
    public FileCheckpointStore(Path directory, boolean fsyncEnabled) {
        this.directory = directory;
        this.fsyncEnabled = fsyncEnabled;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized void append(Checkpoint checkpoint) throws CheckpointException {
        String runId = checkpoint.runId();
        byte[] line = frame(codec.encode(checkpoint));
        Path file = activeFile(runId);
        try {
            Files.createDirectories(directory);
            try (FileChannel ch = FileChannel.open(file,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE)) {
                long end = dropTornTail(ch, runId);
                ByteBuffer buf = ByteBuffer.wrap(line);
                long pos = end;
                while (buf.hasRemaining()) {
                    pos += ch.write(buf, pos);
                }
                if (fsyncEnabled) {
                    ch.force(true);
                }
            }
            LOG.debug("Checkpoint {} written for run {} ({})", checkpoint.sequence(), runId, checkpoint.status());
        } catch (IOException e) {
            throw new CheckpointException(runId, "Cannot write checkpoint for run " + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Checkpoint> latest(String runId) throws CheckpointException {
        List<Checkpoint> history = history(runId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public List<Checkpoint> history(String runId) throws CheckpointException {
        Path file = activeFile(runId);
        if (!Files.exists(file)) {
            file = archivedFile(runId);
        }
        if (!Files.exists(file)) {
            return List.of();
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CheckpointException(runId, "Cannot read checkpoints for run " + runId + ": " + e.getMessage(), e);
        }

        List<Checkpoint> result = new ArrayList<>();
        int start = 0;
        long lineNumber = 0;
        while (start < content.length()) {
            int newline = content.indexOf('\n', start);
            if (newline < 0) {
                LOG.warn("Ignoring torn checkpoint record at the end of {}", file);
                break;
            }
            lineNumber++;
            String line = content.substring(start, newline);
            start = newline + 1;
            if (!line.isEmpty()) {
                result.add(parse(runId, lineNumber, line));
            }
        }
        return result;
    }

    @Override
    public synchronized void archive(String runId) throws CheckpointException {
        Path file = activeFile(runId);
        if (!Files.exists(file)) {
            return;
        }
        try {
            Path archiveDir = directory.resolve(ARCHIVE_DIR);
            Files.createDirectories(archiveDir);
            Files.move(file, archivedFile(runId), StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Archived checkpoints of run {}", runId);
        } catch (IOException e) {
            throw new CheckpointException(runId,
                    "Cannot archive checkpoints for run " + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listRuns() throws CheckpointException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> runs = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                runs.add(name.substring(0, name.length() - EXTENSION.length()));
            }
        } catch (IOException e) {
            throw new CheckpointException(null,
                    "Cannot list checkpoint directory " + directory + ": " + e.getMessage(), e);
        }
        Collections.sort(runs);
        return runs;
    }

    Path activeFile(String runId) {
        return directory.resolve(fileName(runId));
    }

    Path archivedFile(String runId) {
        return directory.resolve(ARCHIVE_DIR).resolve(fileName(runId));
    }

    private static String fileName(String runId) {
        if (runId.isEmpty() || runId.contains("/") || runId.contains("\\") || runId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid run id for a checkpoint file: " + runId);
        }
        return runId + EXTENSION;
    }

    static byte[] frame(String json) {
        byte[] payload = json.getBytes(StandardCharsets.UTF_8);
        CRC32C crc = new CRC32C();
        crc.update(payload);
        String prefix = String.format("%08x ", crc.getValue());
        byte[] line = new byte[prefix.length() + payload.length + 1];
        System.arraycopy(prefix.getBytes(StandardCharsets.US_ASCII), 0, line, 0, prefix.length());
        System.arraycopy(payload, 0, line, prefix.length(), payload.length);
        line[line.length - 1] = '\n';
        return line;
    }

    private Checkpoint parse(String runId, long lineNumber, String line) throws CheckpointCorruptedException {
        if (line.length() < 10 || line.charAt(8) != ' ') {
            throw new CheckpointCorruptedException(runId, lineNumber, "missing checksum prefix");
        }
        long stored;
        try {
            stored = Long.parseLong(line.substring(0, 8), 16);
        } catch (NumberFormatException e) {
            throw new CheckpointCorruptedException(runId, lineNumber, "malformed checksum", e);
        }
        String json = line.substring(9);
        CRC32C crc = new CRC32C();
        crc.update(json.getBytes(StandardCharsets.UTF_8));
        if (crc.getValue() != stored) {
            throw new CheckpointCorruptedException(runId, lineNumber, "CRC mismatch");
        }
        try {
            return codec.decode(json);
        } catch (JsonProcessingException e) {
            throw new CheckpointCorruptedException(runId, lineNumber, e.getOriginalMessage(), e);
        }
    }

    /**
     * Cuts a partial last record left by a crash so the next record starts on a
     * fresh line. Returns the new end of file.
     */
    private long dropTornTail(FileChannel ch, String runId) throws IOException {
        long size = ch.size();
        if (size == 0) {
            return 0;
        }
        ByteBuffer one = ByteBuffer.allocate(1);
        ch.read(one, size - 1);
        if (one.get(0) == '\n') {
            return size;
        }
        long pos = size - 1;
        while (pos > 0) {
            one.clear();
            ch.read(one, pos - 1);
            if (one.get(0) == '\n') {
                break;
            }
            pos--;
        }
        LOG.info("Truncating checkpoint stream of run {} from {} to {} bytes (removing torn write)", runId, size, pos);
        ch.truncate(pos);
        return pos;
    }
}
