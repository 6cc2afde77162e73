package com.reversiontrader.market;

import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.exception.DataUnavailableException;
import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Historical bars from a CSV file with columns
 * {@code timestamp,open,high,low,close,volume}.
 *
 * <p>Timestamps are ISO local date-times ({@code 2024-03-01T10:00:00}) or
 * epoch milliseconds (interpreted as UTC). A header line is detected and
 * skipped, as are blank lines and lines starting with {@code #}. The file is
 * read once, lazily, and sorted ascending.
 */
public class CsvPriceDataProvider implements PriceDataProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvPriceDataProvider.class);

    static final String SOURCE = "csv";
    private static final int COLUMN_COUNT = 6;

    private final Path path;
    private List<PriceBar> bars;

    public CsvPriceDataProvider(Path path) {
        this.path = path;
    }

    @Override
    public synchronized List<PriceBar> getPriceHistory() {
        if (bars == null) {
            bars = load();
        }
        return bars;
    }

    @Override
    public BigDecimal getCurrentPrice() {
        List<PriceBar> history = getPriceHistory();
        if (history.isEmpty()) {
            throw new DataUnavailableException("No price data in " + path);
        }
        return history.get(history.size() - 1).getClose();
    }

    private List<PriceBar> load() {
        if (!Files.isReadable(path)) {
            throw new DataUnavailableException("Price file not readable: " + path, Map.of("path", path.toString()));
        }

        List<PriceBar> loaded = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#") || isHeader(trimmed)) {
                    continue;
                }
                loaded.add(parseLine(trimmed, lineNumber));
            }
        } catch (IOException e) {
            throw new DataUnavailableException("Failed to read price file " + path, e);
        }

        loaded.sort(Comparator.comparing(PriceBar::getTimestamp));
        log.info("Loaded {} bars from {}", loaded.size(), path);
        return List.copyOf(loaded);
    }

    private PriceBar parseLine(String line, int lineNumber) {
        String[] columns = line.split(",");
        if (columns.length < COLUMN_COUNT) {
            throw new DataUnavailableException(
                    "Malformed price row at line " + lineNumber + ": expected " + COLUMN_COUNT + " columns",
                    Map.of("path", path.toString(), "line", lineNumber));
        }
        try {
            return PriceBar.builder()
                    .timestamp(parseTimestamp(columns[0].trim()))
                    .open(new BigDecimal(columns[1].trim()))
                    .high(new BigDecimal(columns[2].trim()))
                    .low(new BigDecimal(columns[3].trim()))
                    .close(new BigDecimal(columns[4].trim()))
                    .volume(new BigDecimal(columns[5].trim()))
                    .source(SOURCE)
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new DataUnavailableException("Malformed price row at line " + lineNumber + ": " + line, e);
        }
    }

    static LocalDateTime parseTimestamp(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(Long.parseLong(value)), ZoneOffset.UTC);
        }
        return LocalDateTime.parse(value);
    }

    private static boolean isHeader(String line) {
        return line.toLowerCase(Locale.ROOT).startsWith("timestamp");
    }

    public Path getPath() {
        return path;
    }
}
