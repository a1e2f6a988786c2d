package com.streamscout.app.cli;

import com.streamscout.app.logging.LogSetup;
import com.streamscout.app.report.RunReportWriter;
import com.streamscout.core.api.EmptyPlaylistException;
import com.streamscout.core.api.HarvestException;
import com.streamscout.core.model.HarvestConfig;
import com.streamscout.core.model.RunOutcome;
import com.streamscout.core.service.HarvestService;
import com.streamscout.core.util.YamlConfigLoader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 명령행 진입점.
 * 종료 코드: 0 성공, 1 결과 없음/실행 실패, 2 인자/설정 오류.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String APP = "streamscout";

    private final Function<HarvestConfig, HarvestService> serviceFactory;
    private final boolean configureLogging;

    public Main() {
        this(HarvestService::new, true);
    }

    Main(Function<HarvestConfig, HarvestService> serviceFactory, boolean configureLogging) {
        this.serviceFactory = Objects.requireNonNull(serviceFactory, "serviceFactory");
        this.configureLogging = configureLogging;
    }

    public static void main(String[] args) {
        System.exit(new Main().run(args, System.getenv()));
    }

    public int run(String[] args, Map<String, String> env) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp(APP, options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(APP, options);
            return EXIT_OK;
        }

        HarvestConfig config;
        try {
            config = resolveConfig(cmd);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (configureLogging) LogSetup.configure(config.output().getDir());

        try {
            RunOutcome outcome = serviceFactory.apply(config).run();
            System.out.println("Playlist: " + outcome.getOutputFile());
            System.out.println("Links: discovered=" + outcome.getDiscovered()
                    + ", unique=" + outcome.getUnique()
                    + ", valid=" + outcome.getValidated());

            if (config.output().isReport()) {
                Path report = new RunReportWriter().write(outcome, outcome.getOutputFile());
                LOG.info("Run report written: {}", report);
            }
            if (GitHubOutput.publish(env, outcome)) {
                LOG.info("GitHub step outputs written");
            }
            return EXIT_OK;

        } catch (EmptyPlaylistException e) {
            LOG.warn("{}", e.getMessage());
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_FAILED;
        } catch (HarvestException | IOException e) {
            LOG.error("Harvest failed: {}", e.getMessage(), e);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("path")
                .desc("path to harvest.yml (default: ./harvest.yml if present)").build());
        options.addOption(Option.builder().longOpt("channels").hasArg().argName("list")
                .desc("comma-separated channel names, e.g. CCTV1,CCTV2").build());
        options.addOption(Option.builder("p").longOpt("pages").hasArg().argName("n")
                .desc("result pages per channel").build());
        options.addOption(Option.builder().longOpt("pacing-ms").hasArg().argName("ms")
                .desc("delay between consecutive pages of one channel").build());
        options.addOption(Option.builder("o").longOpt("out").hasArg().argName("dir")
                .desc("output directory").build());
        options.addOption(Option.builder().longOpt("file").hasArg().argName("name")
                .desc("playlist file name").build());
        options.addOption(Option.builder().longOpt("group").hasArg().argName("title")
                .desc("group-title written for every entry").build());
        options.addOption(Option.builder().longOpt("no-early-stop")
                .desc("fetch every page even after an empty result page").build());
        options.addOption(Option.builder().longOpt("report")
                .desc("write a JSON run report next to the playlist").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }

    /** YAML(있으면) 로딩 후 명령행 옵션으로 덮어쓰기 */
    static HarvestConfig resolveConfig(CommandLine cmd) throws IOException {
        HarvestConfig cfg;
        if (cmd.hasOption("config")) {
            cfg = YamlConfigLoader.load(Path.of(cmd.getOptionValue("config")));
        } else if (Files.exists(Path.of(YamlConfigLoader.DEFAULT_FILE))) {
            cfg = YamlConfigLoader.loadDefault();
        } else {
            cfg = HarvestConfig.defaults();
        }
        applyOverrides(cmd, cfg);
        cfg.validate();
        return cfg;
    }

    static void applyOverrides(CommandLine cmd, HarvestConfig cfg) {
        if (cmd.hasOption("channels")) {
            var list = YamlConfigLoader.toStringList(cmd.getOptionValue("channels"));
            if (list.isEmpty()) throw new IllegalArgumentException("--channels must name at least one channel");
            cfg.setChannels(list);
        }
        if (cmd.hasOption("pages")) {
            cfg.search().setPages(parseInt("--pages", cmd.getOptionValue("pages")));
        }
        if (cmd.hasOption("pacing-ms")) {
            cfg.search().setPacing(Duration.ofMillis(parseInt("--pacing-ms", cmd.getOptionValue("pacing-ms"))));
        }
        if (cmd.hasOption("no-early-stop")) cfg.search().setEarlyStop(false);
        if (cmd.hasOption("out")) cfg.output().setDir(Path.of(cmd.getOptionValue("out")));
        if (cmd.hasOption("file")) cfg.output().setFile(cmd.getOptionValue("file"));
        if (cmd.hasOption("group")) cfg.output().setGroupTitle(cmd.getOptionValue("group"));
        if (cmd.hasOption("report")) cfg.output().setReport(true);
    }

    private static int parseInt(String opt, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects an integer, got: " + raw, e);
        }
    }
}
