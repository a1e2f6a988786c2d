package com.streamscout.core.export;

import com.streamscout.core.model.PlaylistEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 확장 M3U 직렬화.
 * <pre>
 * #EXTM3U
 * #EXTINF:-1 tvg-id="" tvg-name="CCTV1" tvg-logo="" group-title="CCTV",CCTV1
 * http://host/a.m3u8
 * </pre>
 * 항목은 채널 → url 순 정렬. 같은 폴더의 .tmp에 쓴 뒤 교체(가능하면 ATOMIC_MOVE).
 */
public final class PlaylistWriter {

    private static final Logger LOG = LoggerFactory.getLogger(PlaylistWriter.class);

    public static final String HEADER = "#EXTM3U";
    public static final String DEFAULT_GROUP = "CCTV";

    private final String groupTitle;

    public PlaylistWriter() {
        this(DEFAULT_GROUP);
    }

    public PlaylistWriter(String groupTitle) {
        this.groupTitle = Objects.requireNonNull(groupTitle, "groupTitle");
    }

    /** @return 기록한 항목 수 */
    public int write(Collection<PlaylistEntry> entries, Path path) throws IOException {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(path, "path");

        List<PlaylistEntry> sorted = new ArrayList<>(entries);
        sorted.sort(PlaylistEntry.CHANNEL_ORDER);

        Path target = path.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = target.resolveSibling(target.getFileName().toString() + ".tmp");
        try {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                w.write(render(sorted));
            }
            moveIntoPlace(tmp, target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        LOG.info("Playlist written: {} ({} entries)", target, sorted.size());
        return sorted.size();
    }

    /** 정렬된 항목을 파일 본문으로. 줄바꿈은 항상 \n. */
    String render(List<PlaylistEntry> sorted) {
        StringBuilder sb = new StringBuilder(64 + sorted.size() * 128);
        sb.append(HEADER).append('\n');
        for (PlaylistEntry e : sorted) {
            sb.append("#EXTINF:-1 tvg-id=\"\" tvg-name=\"").append(e.channel())
              .append("\" tvg-logo=\"\" group-title=\"").append(groupTitle)
              .append("\",").append(e.channel()).append('\n');
            sb.append(e.url()).append('\n');
        }
        return sb.toString();
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("ATOMIC_MOVE not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
