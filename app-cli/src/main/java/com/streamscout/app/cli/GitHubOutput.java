package com.streamscout.app.cli;

import com.streamscout.core.model.RunOutcome;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;

/** GitHub Actions step output(GITHUB_OUTPUT 파일)에 key=value 추가 */
final class GitHubOutput {
    private GitHubOutput() {}

    static final String ENV_ACTIONS = "GITHUB_ACTIONS";
    static final String ENV_OUTPUT = "GITHUB_OUTPUT";

    /** @return 실제로 기록했으면 true (Actions 환경이 아니면 false) */
    static boolean publish(Map<String, String> env, RunOutcome outcome) throws IOException {
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(outcome, "outcome");
        if (!"true".equals(env.get(ENV_ACTIONS))) return false;
        String target = env.get(ENV_OUTPUT);
        if (target == null || target.isBlank()) return false;

        String body = "output_file=" + outcome.getOutputFile() + "\n"
                + "total_links=" + outcome.getUnique() + "\n"
                + "valid_links=" + outcome.getValidated() + "\n";
        Files.writeString(Path.of(target), body, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        return true;
    }
}
