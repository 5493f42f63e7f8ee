package io.github.calltable.files;

import com.google.common.base.Preconditions;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import io.github.calltable.converter.TextRenderer;
import io.github.calltable.schema.CallRow;
import io.github.calltable.schema.CallSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes extracted rows to a CSV file using OpenCSV.
 *
 * <p>Output is UTF-8, comma separated, with a header row in canonical column order
 * and CRLF record terminators. Fields are quoted only when they contain a comma,
 * a quote or a line break; embedded quotes are doubled. Values are rendered by
 * {@link TextRenderer}, so null values become empty fields. An existing file is
 * overwritten, and a failure mid-write leaves a truncated file behind.</p>
 */
public class CsvTableWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTableWriter.class);

    static final String LINE_END = "\r\n";

    /**
     * Writes {@code rows} to {@code outputDir/filename}, creating the directory if needed.
     *
     * @return the path of the written file
     * @throws IOException if the directory cannot be created or the file cannot be written
     */
    public Path write(List<CallRow> rows, Path outputDir, String filename) throws IOException {
        Preconditions.checkNotNull(rows, "rows");
        Preconditions.checkArgument(filename != null && !filename.isBlank(),
                "Output filename cannot be null or empty");

        Files.createDirectories(outputDir);
        Path outPath = outputDir.resolve(filename);

        try (Writer out = Files.newBufferedWriter(outPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     ICSVWriter.DEFAULT_SEPARATOR,
                     ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                     ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     LINE_END)) {
            writer.writeNext(CallSchema.header(), false);
            for (CallRow row : rows) {
                writer.writeNext(toFields(row), false);
            }
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("Error writing CSV file " + outPath);
            }
        }
        LOG.debug("Wrote {} rows to CSV file: {}", rows.size(), outPath);
        return outPath;
    }

    private static String[] toFields(CallRow row) {
        List<Object> values = row.values();
        String[] fields = new String[values.size()];
        for (int i = 0; i < fields.length; i++) {
            fields[i] = TextRenderer.render(values.get(i));
        }
        return fields;
    }
}
