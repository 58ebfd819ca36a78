package com.vidnyan.attackpath.application.port.out;

import com.vidnyan.attackpath.domain.graph.GraphModel;
import com.vidnyan.attackpath.domain.graph.MalformedGraphException;
import com.vidnyan.attackpath.domain.graph.WeightProfile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Port for turning a textual graph description into the graph model.
 * Implemented by adapters (e.g., the DOT subset parser).
 */
public interface GraphDescriptionParser {

    /**
     * Parse a description and build the graph model.
     * @throws MalformedGraphException if the description cannot be tokenized, references an
     *         undeclared node or declares conflicting attributes for a node
     */
    GraphModel parse(String description, ParsingOptions options);

    /**
     * Read and parse a description file (UTF-8).
     */
    default GraphModel parseFile(Path file, ParsingOptions options) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8), options);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read graph description " + file, e);
        }
    }

    /**
     * Parsing options.
     *
     * @param weightKeys node attribute keys parsed as numbers; all others are styling
     */
    record ParsingOptions(
        WeightProfile weightProfile,
        Set<String> weightKeys
    ) {
        public static final Set<String> DEFAULT_WEIGHT_KEYS = Set.of("cost", "stealth");

        public ParsingOptions {
            weightKeys = Set.copyOf(weightKeys);
        }

        public static ParsingOptions defaults() {
            return new ParsingOptions(WeightProfile.NEUTRAL, DEFAULT_WEIGHT_KEYS);
        }
    }
}
