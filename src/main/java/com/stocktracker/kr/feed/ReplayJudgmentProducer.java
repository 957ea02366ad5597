package com.stocktracker.kr.feed;

import com.stocktracker.kr.config.Config;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.Position;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serves judgments recorded earlier as {@code <dir>/<cycleId>/<ticker>.json}.
 */
public final class ReplayJudgmentProducer implements JudgmentProducer {
    private final Path dir;

    public ReplayJudgmentProducer(Path dir) {
        this.dir = dir;
    }

    public static ReplayJudgmentProducer fromConfig(Config config) {
        return new ReplayJudgmentProducer(config.getPath("replay.judgments_dir"));
    }

    @Override
    public String produce(Position position, Cycle cycle) throws IOException {
        Path file = dir.resolve(cycle.id).resolve(position.ticker + ".json");
        if (!Files.exists(file)) {
            throw new FileNotFoundException("no recorded judgment: " + file);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
