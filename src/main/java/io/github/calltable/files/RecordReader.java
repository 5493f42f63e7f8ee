package io.github.calltable.files;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Decodes the raw records held in one input file.
 *
 * <p>Problems are isolated at the smallest unit: a malformed or non-object line in a
 * {@code .jsonl} file is logged and skipped, a non-object element of a JSON array is
 * logged and skipped, and a file that cannot be read or parsed is logged and yields
 * nothing more. No exception escapes {@link #read(Path)} for bad input.</p>
 *
 * <p>Each call re-opens the file. The returned stream holds the file open for
 * {@code .jsonl} input and must be closed.</p>
 */
public class RecordReader {

    private static final Logger LOG = LoggerFactory.getLogger(RecordReader.class);

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /**
     * Opens a lazy stream of records from {@code path}.
     *
     * @param path a {@code .json} or {@code .jsonl} file; anything that is not
     *             {@code .jsonl} is read as whole-file JSON
     * @return the decoded objects in file order
     */
    public Stream<Map<String, Object>> read(Path path) {
        InputFormat format = InputFormat.forPath(path).orElse(InputFormat.JSON);
        try {
            if (format == InputFormat.JSON_LINES) {
                return readJsonLines(path);
            }
            return readJsonDocument(path);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed reading {}: {}", path, e.toString(), e);
            return Stream.empty();
        }
    }

    private Stream<Map<String, Object>> readJsonLines(Path path) throws IOException {
        BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        JsonLinesIterator iterator = new JsonLinesIterator(path, reader);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                .onClose(() -> closeQuietly(path, reader));
    }

    private Stream<Map<String, Object>> readJsonDocument(Path path) throws IOException {
        Object document;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            document = OBJECT_MAPPER.readValue(reader, Object.class);
        }

        if (document instanceof Map<?, ?> map) {
            return Stream.of(asRecord(map));
        }
        if (document instanceof List<?> list) {
            List<Map<String, Object>> records = new ArrayList<>(list.size());
            int idx = 0;
            for (Object element : list) {
                idx++;
                if (element instanceof Map<?, ?> map) {
                    records.add(asRecord(map));
                } else {
                    LOG.warn("{} idx {}: expected JSON object in list, got {}", path, idx, jsonTypeName(element));
                }
            }
            return records.stream();
        }
        LOG.warn("{}: top-level JSON is not object or array; skipping", path);
        return Stream.empty();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asRecord(Map<?, ?> map) {
        // JSON object keys are always strings
        return (Map<String, Object>) map;
    }

    static String jsonTypeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * Closes {@code resource}, logging a failure instead of throwing it. Every record
     * has already been handed out by the time a stream is closed.
     */
    static void closeQuietly(Path path, Closeable resource) {
        try {
            resource.close();
        } catch (IOException e) {
            LOG.warn("Failed closing {}: {}", path, e.toString());
        }
    }

    /**
     * Walks a JSON Lines file one line at a time, yielding only the lines that
     * decode to a JSON object.
     */
    private static class JsonLinesIterator implements Iterator<Map<String, Object>> {
        private final Path path;
        private final BufferedReader reader;
        private int lineNumber;
        private Map<String, Object> next;
        private boolean exhausted;

        JsonLinesIterator(Path path, BufferedReader reader) {
            this.path = path;
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Map<String, Object> current = next;
            next = null;
            return current;
        }

        private Map<String, Object> advance() {
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    String trimmed = line.strip();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    Object value;
                    try {
                        value = OBJECT_MAPPER.readValue(trimmed, Object.class);
                    } catch (JsonProcessingException e) {
                        LOG.error("{} line {}: invalid JSON: {}", path, lineNumber, e.getOriginalMessage());
                        continue;
                    }
                    if (value instanceof Map<?, ?> map) {
                        return asRecord(map);
                    }
                    LOG.warn("{} line {}: expected JSON object, got {}", path, lineNumber, jsonTypeName(value));
                }
            } catch (IOException e) {
                LOG.error("Failed reading {}: {}", path, e.toString(), e);
            }
            exhausted = true;
            return null;
        }
    }
}
