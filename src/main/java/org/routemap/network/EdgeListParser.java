package org.routemap.network;

import lombok.extern.slf4j.Slf4j;
import org.routemap.core.RouteMapException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a {@link TransitNetwork} from a line-oriented edge list.
 *
 * <p>Each edge token is a one-character source stop, a one-character target stop and a
 * non-negative weight, for example {@code AB5}. Whitespace around the weight is ignored
 * ({@code AB 5}); the weight itself must be ASCII digits only, so signs ({@code AB+5},
 * {@code AB-5}) are rejected. A line holds one token, or several separated by commas
 * ({@code AB5, BC4}). Blank lines and lines starting with {@code #} are ignored.
 * Any malformed token aborts the whole load.</p>
 */
@Slf4j
public final class EdgeListParser {
    public static final String REASON_MALFORMED_EDGE_LINE = "MALFORMED_EDGE_LINE";

    private static final char COMMENT_PREFIX = '#';
    private static final String TOKEN_SEPARATOR = ",";

    /**
     * Parses the edge list stored at {@code path} (UTF-8).
     *
     * @throws IOException when the file cannot be read.
     * @throws RouteMapException when a line is malformed.
     */
    public TransitNetwork parse(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TransitNetwork network = parse(reader);
            log.info("Loaded {} stops and {} edges from {}", network.stopCount(), network.edgeCount(), path);
            return network;
        }
    }

    /**
     * Parses an in-memory edge list.
     */
    public TransitNetwork parse(String edgeList) {
        Objects.requireNonNull(edgeList, "edgeList");
        try {
            return parse(new StringReader(edgeList));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Parses every line readable from {@code source}. The reader is not closed.
     */
    public TransitNetwork parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);
        TransitNetwork.Builder builder = TransitNetwork.builder();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.charAt(0) == COMMENT_PREFIX) {
                continue;
            }
            for (String token : trimmed.split(TOKEN_SEPARATOR)) {
                addEdge(builder, token.trim(), lineNumber);
            }
        }
        return builder.build();
    }

    private static void addEdge(TransitNetwork.Builder builder, String token, int lineNumber) {
        if (token.length() < 3) {
            throw malformed(lineNumber, "expected <source><target><weight>, got '" + token + "'", null);
        }
        String from = token.substring(0, 1);
        String to = token.substring(1, 2);
        String rawWeight = token.substring(2).strip();
        if (rawWeight.isEmpty() || !isDigits(rawWeight)) {
            throw malformed(lineNumber, "weight must be decimal digits: '" + rawWeight + "'", null);
        }

        int weight;
        try {
            weight = Integer.parseInt(rawWeight);
        } catch (NumberFormatException ex) {
            throw malformed(lineNumber, "weight out of range: '" + rawWeight + "'", ex);
        }

        try {
            builder.addEdge(from, to, weight);
        } catch (RouteMapException ex) {
            throw malformed(lineNumber, ex.getMessage(), ex);
        }
    }

    private static boolean isDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static RouteMapException malformed(int lineNumber, String detail, Throwable cause) {
        String message = "line " + lineNumber + ": " + detail;
        return cause == null
                ? new RouteMapException(REASON_MALFORMED_EDGE_LINE, message)
                : new RouteMapException(REASON_MALFORMED_EDGE_LINE, message, cause);
    }
}
