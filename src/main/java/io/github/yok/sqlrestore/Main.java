package io.github.yok.sqlrestore;

import io.github.yok.sqlrestore.config.ConnectionConfig;
import io.github.yok.sqlrestore.config.RestoreConfig;
import io.github.yok.sqlrestore.core.DumpLoader;
import io.github.yok.sqlrestore.core.RestoreSummary;
import io.github.yok.sqlrestore.util.ErrorHandler;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Connection and restore settings come from {@code application.yml}. The following command-line
 * options override the {@code restore.*} settings:
 * </p>
 * <ul>
 * <li>{@code --dir <path>} or {@code -d <path>}: dump directory to restore</li>
 * <li>{@code --threads <n>} or {@code -t <n>}: number of parallel connections</li>
 * <li>{@code --interval <ms>} or {@code -i <ms>}: progress report interval</li>
 * </ul>
 *
 * <p>
 * Any failure ends the process with exit code {@code 1}; a restore is all-or-nothing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see RestoreConfig
 * @see DumpLoader
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, RestoreConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final ConnectionConfig connectionConfig;
    private final RestoreConfig restoreConfig;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the code of the run.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        try {
            applyArguments(args);
            restoreConfig.validate();
        } catch (IllegalArgumentException | IllegalStateException e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Invalid configuration: " + e.getMessage());
            return;
        }

        log.info("Connection: {}, Restore: {}", connectionConfig, restoreConfig);

        try {
            RestoreSummary summary = new DumpLoader(connectionConfig, restoreConfig).execute();
            log.info("Restore finished. {} table file(s), {} bytes", summary.getCompletedTables(),
                    summary.getBytes());
        } catch (Exception e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Restore failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void applyArguments(String... args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dir":
                case "-d":
                    restoreConfig.setDumpDir(requireValue(args, ++i));
                    break;
                case "--threads":
                case "-t":
                    restoreConfig.setThreads(parseInt(args, ++i));
                    break;
                case "--interval":
                case "-i":
                    restoreConfig.setIntervalMs(parseNumber(args, ++i));
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }

    private static int parseInt(String[] args, int index) {
        String value = requireValue(args, index);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Not a number for " + args[index - 1] + ": " + value, e);
        }
    }

    private static long parseNumber(String[] args, int index) {
        String value = requireValue(args, index);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Not a number for " + args[index - 1] + ": " + value, e);
        }
    }
}
