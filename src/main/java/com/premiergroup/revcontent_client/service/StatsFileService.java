package com.premiergroup.revcontent_client.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.revcontent_client.config.RevcontentProperties;
import com.premiergroup.revcontent_client.logging.LogLevels;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

@Service
@Log4j2
@RequiredArgsConstructor
public class StatsFileService {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final ObjectMapper objectMapper;
    private final RevcontentProperties properties;

    /**
     * Writes one stats record as pretty-printed UTF-8 JSON to
     * {@code stats_RESULT_<campaignId>_<timestamp>.json} in the configured output directory.
     *
     * @return the written file
     */
    public Path save(Map<String, Object> stats, String campaignId) {
        Path dir = Path.of(properties.getStats().getOutputDir());
        String fileName = String.format("stats_RESULT_%s_%s.json",
                fileSafe(campaignId), LocalDateTime.now().format(TIMESTAMP));
        Path file = dir.resolve(fileName);

        try {
            Files.createDirectories(dir);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, stats);
            }
        } catch (IOException e) {
            log.error("Failed to write campaign statistics to {}", file, e);
            throw new UncheckedIOException("Failed to write stats file: " + file, e);
        }

        log.log(LogLevels.SUCCESS, "Campaign statistics saved to {}", file);
        return file;
    }

    // campaign ids are opaque, keep them from escaping the output directory
    private static String fileSafe(String campaignId) {
        return campaignId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
