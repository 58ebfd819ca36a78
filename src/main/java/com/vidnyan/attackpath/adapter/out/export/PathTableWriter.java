package com.vidnyan.attackpath.adapter.out.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.vidnyan.attackpath.domain.metrics.PathScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.StringJoiner;

/**
 * Writes scored paths as a CSV table, one row per path, in enumeration order.
 */
@Component
@RequiredArgsConstructor
public class PathTableWriter {

    private final CsvMapper csvMapper;

    /**
     * Write the table. The header line is always written, also for an empty path set.
     */
    public void write(List<PathScore> scores, Path file) throws IOException {
        CsvSchema schema = schema();
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(header(schema));
            try (SequenceWriter rows = csvMapper.writer(schema).writeValues(out)) {
                for (PathScore score : scores) {
                    rows.write(PathRow.of(score));
                }
            }
        }
    }

    /**
     * Fixed column order of {@link PathRow}.
     */
    CsvSchema schema() {
        return csvMapper.schemaFor(PathRow.class).withoutHeader();
    }

    private static String header(CsvSchema schema) {
        StringJoiner header = new StringJoiner(String.valueOf(schema.getColumnSeparator()));
        for (CsvSchema.Column column : schema) {
            header.add(column.getName());
        }
        return header + new String(schema.getLineSeparator());
    }

    /**
     * One CSV row. Column order is part of the file format.
     */
    @JsonPropertyOrder({"path_id", "node_sequence", "cost", "average_stealth", "length", "criticality"})
    record PathRow(
        @JsonProperty("path_id") String pathId,
        @JsonProperty("node_sequence") String nodeSequence,
        @JsonProperty("cost") double cost,
        @JsonProperty("average_stealth") double averageStealth,
        @JsonProperty("length") int length,
        @JsonProperty("criticality") double criticality
    ) {
        static PathRow of(PathScore score) {
            return new PathRow(
                    score.pathId(),
                    score.formattedNodes(),
                    score.cost(),
                    score.averageStealth(),
                    score.length(),
                    score.criticality()
            );
        }
    }
}
