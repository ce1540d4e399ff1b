package com.lorekeeper.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSON-lines file holding every stored entry. This is the
 * authoritative copy; the Lucene index is derived from it.
 */
class RecordLog {

    private static final Logger log = LoggerFactory.getLogger(RecordLog.class);

    private final Path file;
    private final ObjectMapper mapper;

    RecordLog(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    Path file() {
        return file;
    }

    /**
     * Reads all entries. Lines that are not valid UTF-8 or not a valid entry
     * (a torn final write) are logged and skipped, and an unterminated last
     * line is closed off.
     */
    List<StoredEntry> readAll() throws IOException {
        var entries = new ArrayList<StoredEntry>();
        if (!Files.exists(file)) return entries;
        var bytes = Files.readAllBytes(file);
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        int lineNo = 0;
        int start = 0;
        while (start < bytes.length) {
            int end = start;
            while (end < bytes.length && bytes[end] != '\n') end++;
            lineNo++;
            String line;
            try {
                line = decoder.decode(ByteBuffer.wrap(bytes, start, end - start)).toString();
            } catch (CharacterCodingException e) {
                log.warn("Skipping undecodable entry at {}:{}: {}", file.getFileName(), lineNo, e.toString());
                start = end + 1;
                continue;
            }
            start = end + 1;
            if (line.isBlank()) continue;
            try {
                entries.add(mapper.readValue(line, StoredEntry.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping unreadable entry at {}:{}: {}", file.getFileName(), lineNo, e.getMessage());
            }
        }
        if (bytes.length > 0 && bytes[bytes.length - 1] != '\n') {
            // Terminate the torn line so the next append starts on its own.
            log.warn("Record log {} ends mid-line; terminating it", file.getFileName());
            Files.write(file, new byte[] {'\n'}, StandardOpenOption.APPEND);
        }
        return entries;
    }

    /** Appends one entry and forces it to disk before returning. */
    void append(StoredEntry entry) throws IOException {
        var bytes = (mapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        try (var channel = FileChannel.open(file, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            var buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) channel.write(buf);
            channel.force(true);
        }
    }

    /** Replaces the whole file with {@code entries} through a temp file and an atomic move. */
    void rewrite(List<StoredEntry> entries) throws IOException {
        var tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (var channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            for (var entry : entries) {
                var buf = ByteBuffer.wrap((mapper.writeValueAsString(entry) + "\n")
                        .getBytes(StandardCharsets.UTF_8));
                while (buf.hasRemaining()) channel.write(buf);
            }
            channel.force(true);
        }
        Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
