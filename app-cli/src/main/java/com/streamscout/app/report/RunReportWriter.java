package com.streamscout.app.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamscout.core.model.RunOutcome;

import java.io.IOException;
import java.nio.file.*;
import java.util.Objects;

/** 실행 리포트 JSON 기록. 플레이리스트 옆에 `<file>.report.json`으로 둔다. */
public final class RunReportWriter {

    public static final String SUFFIX = ".report.json";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);   // ISO-8601

    /** 플레이리스트 경로 기준 리포트 경로 */
    public static Path reportPathFor(Path playlist) {
        Objects.requireNonNull(playlist, "playlist");
        return playlist.resolveSibling(playlist.getFileName().toString() + SUFFIX);
    }

    public Path write(RunOutcome outcome, Path playlist) throws IOException {
        Objects.requireNonNull(outcome, "outcome");
        Path target = reportPathFor(playlist).toAbsolutePath();
        if (target.getParent() != null) Files.createDirectories(target.getParent());

        Path tmp = target.resolveSibling(target.getFileName().toString() + ".tmp");
        try {
            om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), RunReport.from(outcome));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        return target;
    }
}
