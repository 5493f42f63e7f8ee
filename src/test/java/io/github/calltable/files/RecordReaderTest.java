package io.github.calltable.files;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class RecordReaderTest {

    @TempDir
    Path tempDir;

    private RecordReader reader;

    @BeforeEach
    void setUp() {
        reader = new RecordReader();
    }

    @Nested
    @DisplayName("JSON Lines")
    class JsonLines {

        @Test
        @DisplayName("yields one record per object line and skips blank lines")
        void readsObjects() throws IOException {
            Path file = write("calls.jsonl", "{\"callid\": \"1\"}\n\n   \n{\"callid\": \"2\", \"n\": 1.5}\n");

            List<Map<String, Object>> records = readAll(file);

            assertThat(records).extracting(r -> r.get("callid")).containsExactly("1", "2");
            assertThat(records.get(1).get("n")).isEqualTo(1.5);
        }

        @Test
        @DisplayName("skips invalid JSON lines without aborting the file")
        void skipsInvalidLines() throws IOException {
            Path file = write("calls.jsonl", "{\"callid\": \"1\"}\n{not json\n{\"callid\": \"2\"} trailing\n{\"callid\": \"3\"}\n");

            assertThat(readAll(file)).extracting(r -> r.get("callid")).containsExactly("1", "3");
        }

        @Test
        @DisplayName("skips lines whose value is not an object")
        void skipsNonObjects() throws IOException {
            Path file = write("calls.JSONL", "[1,2]\n\"text\"\n42\nnull\n{\"callid\": \"9\"}\n");

            assertThat(readAll(file)).extracting(r -> r.get("callid")).containsExactly("9");
        }

        @Test
        @DisplayName("is lazy and restartable")
        void lazyAndRestartable() throws IOException {
            Path file = write("calls.jsonl", "{\"a\": 1}\n{\"a\": 2}\n{\"a\": 3}\n");

            try (Stream<Map<String, Object>> records = reader.read(file)) {
                assertThat(records.findFirst()).hasValueSatisfying(r -> assertThat(r.get("a")).isEqualTo(1));
            }
            assertThat(readAll(file)).hasSize(3);
            assertThat(readAll(file)).hasSize(3);
        }

        @Test
        @DisplayName("stops without failing at an undecodable byte sequence")
        void stopsAtEncodingError() throws IOException {
            Path file = tempDir.resolve("broken.jsonl");
            byte[] head = "{\"a\": 1}\n".getBytes(StandardCharsets.UTF_8);
            byte[] bad = {(byte) 0xC3, (byte) 0x28, '\n'};
            byte[] tail = "{\"a\": 2}\n".getBytes(StandardCharsets.UTF_8);
            byte[] all = new byte[head.length + bad.length + tail.length];
            System.arraycopy(head, 0, all, 0, head.length);
            System.arraycopy(bad, 0, all, head.length, bad.length);
            System.arraycopy(tail, 0, all, head.length + bad.length, tail.length);
            Files.write(file, all);

            assertThatCode(() -> readAll(file)).doesNotThrowAnyException();
            assertThat(readAll(file)).extracting(r -> r.get("a")).doesNotContain(2);
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("yields a single top-level object")
        void singleObject() throws IOException {
            Path file = write("one.json", "{\"callid\": \"1\", \"themes\": [{\"emotion\": \"Sad\"}]}");

            List<Map<String, Object>> records = readAll(file);

            assertThat(records).hasSize(1);
            assertThat(records.get(0).get("themes")).isInstanceOf(List.class);
        }

        @Test
        @DisplayName("yields each object of a top-level array and skips the rest")
        void arrayOfObjects() throws IOException {
            Path file = write("many.json", "[{\"callid\": \"1\"}, 5, \"x\", null, {\"callid\": \"2\"}]");

            assertThat(readAll(file)).extracting(r -> r.get("callid")).containsExactly("1", "2");
        }

        @Test
        @DisplayName("yields nothing for a scalar document")
        void scalarDocument() throws IOException {
            assertThat(readAll(write("scalar.json", "\"just text\""))).isEmpty();
        }

        @Test
        @DisplayName("yields nothing for malformed or empty files")
        void malformedFile() throws IOException {
            assertThat(readAll(write("bad.json", "[{\"callid\": \"1\"}, {oops"))).isEmpty();
            assertThat(readAll(write("empty.json", ""))).isEmpty();
            assertThat(readAll(write("trailing.json", "{\"a\": 1} {\"b\": 2}"))).isEmpty();
        }

        @Test
        @DisplayName("decodes NaN literals")
        void nanLiteral() throws IOException {
            List<Map<String, Object>> records = readAll(write("nan.json", "{\"total_call_time\": NaN}"));

            assertThat((Double) records.get(0).get("total_call_time")).isNaN();
        }
    }

    @Test
    @DisplayName("yields nothing for a file that does not exist")
    void missingFile() {
        assertThat(readAll(tempDir.resolve("gone.jsonl"))).isEmpty();
        assertThat(readAll(tempDir.resolve("gone.json"))).isEmpty();
    }

    @Test
    @DisplayName("logs a failed close instead of throwing it")
    void closeFailureIsLogged() {
        AtomicBoolean closed = new AtomicBoolean();
        Closeable failing = () -> {
            closed.set(true);
            throw new IOException("device went away");
        };

        assertThatCode(() -> RecordReader.closeQuietly(tempDir.resolve("calls.jsonl"), failing))
                .doesNotThrowAnyException();
        assertThat(closed).isTrue();
    }

    @Test
    @DisplayName("names JSON types in log messages")
    void jsonTypeNames() {
        assertThat(RecordReader.jsonTypeName(null)).isEqualTo("null");
        assertThat(RecordReader.jsonTypeName(List.of())).isEqualTo("array");
        assertThat(RecordReader.jsonTypeName("s")).isEqualTo("string");
        assertThat(RecordReader.jsonTypeName(1)).isEqualTo("number");
        assertThat(RecordReader.jsonTypeName(true)).isEqualTo("boolean");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private List<Map<String, Object>> readAll(Path file) {
        try (Stream<Map<String, Object>> records = reader.read(file)) {
            return records.collect(Collectors.toList());
        }
    }
}
