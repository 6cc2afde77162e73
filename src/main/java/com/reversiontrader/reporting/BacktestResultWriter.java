package com.reversiontrader.reporting;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reversiontrader.simulator.BacktestResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists backtest results and optimization reports as pretty-printed JSON
 * under the configured output directory. These snapshots are the only durable
 * output of a backtest.
 *
 * <p>Timestamps are ISO-8601 strings and decimals are written in plain
 * notation.
 */
public class BacktestResultWriter {

    private static final Logger log = LoggerFactory.getLogger(BacktestResultWriter.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS");

    private final ObjectMapper objectMapper;
    private final Path outputDirectory;
    private final Clock clock;

    public BacktestResultWriter(Path outputDirectory, Clock clock) {
        this(defaultObjectMapper(), outputDirectory, clock);
    }

    public BacktestResultWriter(ObjectMapper objectMapper, Path outputDirectory, Clock clock) {
        this.objectMapper = objectMapper;
        this.outputDirectory = outputDirectory;
        this.clock = clock;
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new Jdk8Module());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        return mapper;
    }

    /** Writes {@code backtest-<timestamp>.json} and returns its path. */
    public Path write(BacktestResult result) {
        return writeJson("backtest", result);
    }

    /** Writes {@code parameter-optimization-<timestamp>.json} and returns its path. */
    public Path write(OptimizationReport report) {
        return writeJson("parameter-optimization", report);
    }

    private Path writeJson(String prefix, Object value) {
        Path file = outputDirectory.resolve(prefix + "-" + FILE_STAMP.format(LocalDateTime.now(clock)) + ".json");
        try {
            Files.createDirectories(outputDirectory);
            objectMapper.writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        log.info("Results saved to: {}", file);
        return file;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
