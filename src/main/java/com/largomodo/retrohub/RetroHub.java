package com.largomodo.retrohub;

import com.largomodo.retrohub.core.LibraryStore;
import com.largomodo.retrohub.core.PlatformTable;
import com.largomodo.retrohub.core.ScanObserver;
import com.largomodo.retrohub.ipc.IpcServer;
import com.largomodo.retrohub.ipc.RequestRouter;
import com.largomodo.retrohub.persistence.SnapshotFormatException;
import com.largomodo.retrohub.persistence.SnapshotPersistence;
import com.largomodo.retrohub.util.ConfigDirectories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Daemon entry point: loads the ROM library, serves it over loopback IPC, saves it on exit.
 * <p>
 * Startup order: logging level, library load, command line scan paths, optional initial
 * scan, listener bind. Any failure before the listener is bound aborts startup, so the
 * daemon never serves (or later overwrites) a library it could not read.
 * <p>
 * The process runs until interrupted. A JVM shutdown hook stops the server and saves the
 * library, so scan paths added over IPC survive a restart.
 */
@Command(
        name = "retrohub",
        mixinStandardHelpOptions = true,
        resourceBundle = "retrohub.retrohub",
        version = "${bundle:application.version}",
        header = "Serves a local retro game ROM library to frontends over loopback IPC.",
        description = {
                "Scans directories for ROM files (NES, SNES, N64, GBA, GB, Atari 2600), keeps a persistent" +
                        " library with favorites and play history, and answers newline-delimited JSON requests" +
                        " on a loopback TCP port.",
                "",
                "The library is stored as JSON in the per-user configuration directory unless --library is given."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Normal shutdown",
                "1:Startup or runtime error (unreadable library, port in use, I/O)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class RetroHub implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RetroHub.class);

    @Option(names = {"-p", "--port"}, defaultValue = "" + IpcServer.DEFAULT_PORT,
            description = {
                    "TCP port to listen on (loopback interface only).",
                    "Default: ${DEFAULT-VALUE}"
            })
    int port;

    @Option(names = {"-l", "--library"}, paramLabel = "FILE",
            description = {
                    "Library snapshot file.",
                    "Default: <user config dir>/" + ConfigDirectories.APP_DIR_NAME + "/"
                            + ConfigDirectories.LIBRARY_FILE_NAME
            })
    Path libraryFile;

    @Option(names = {"-s", "--scan-path"}, paramLabel = "DIR",
            description = {
                    "Directory to add to the scan roots. Can be repeated.",
                    "Paths already in the library are ignored."
            })
    List<String> scanPaths = new ArrayList<>();

    @Option(names = "--scan-on-start",
            description = "Rescan all scan roots after loading the library.")
    boolean scanOnStart;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RetroHub()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (port < 0 || port > 65535) {
            throw new ParameterException(spec.commandLine(), "Port must be between 0 and 65535: " + port);
        }

        LibraryStore store;
        try {
            store = openLibrary();
        } catch (SnapshotFormatException e) {
            // Refuse to start: serving an empty library would overwrite the file on shutdown
            log.error("ERROR: {}", e.getMessage());
            log.error("Fix or move the file, or start with --library pointing elsewhere");
            return 1;
        } catch (IOException e) {
            log.error("ERROR: Cannot open library: {}", e.getMessage());
            return 1;
        }

        IpcServer server = new IpcServer(port);
        server.setHandler(new RequestRouter(store));
        try {
            server.start();
        } catch (IOException e) {
            log.error("ERROR: Failed to start server on port {}: {}", port, e.getMessage());
            return 1;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            shutdown(server, store);
            stopped.countDown();
        }, "retrohub-shutdown"));

        log.info("Backend running on port {} with {} games. Press Ctrl+C to stop.", server.getPort(), store.size());
        stopped.await();
        return 0;
    }

    /**
     * Build the store, load its snapshot, register command line scan paths and run the
     * optional initial scan.
     *
     * @throws ParameterException      if a --scan-path value is missing or not a directory
     * @throws SnapshotFormatException if the snapshot exists but cannot be decoded
     * @throws IOException             if the snapshot cannot be read or the initial scan cannot be saved
     */
    LibraryStore openLibrary() throws IOException {
        Path snapshot = libraryFile != null ? libraryFile : ConfigDirectories.defaultLibraryFile();

        ScanObserver observer = new ScanObserver() {
            @Override
            public void onRootStart(Path root) {
                log.info("Scanning {}", root);
            }

            @Override
            public void onRootFailure(Path root, IOException e) {
                log.error("WARNING: Scan of {} incomplete - {}", root, e.getMessage());
            }
        };

        LibraryStore store = new LibraryStore(snapshot, PlatformTable.defaults(),
                new SnapshotPersistence(), Clock.systemUTC(), observer);
        store.load();
        log.info("Library loaded from: {}", snapshot);

        for (String scanPath : scanPaths) {
            try {
                store.addScanPath(scanPath);
            } catch (NoSuchFileException e) {
                throw new ParameterException(spec.commandLine(), "Scan path does not exist: " + scanPath);
            } catch (NotDirectoryException e) {
                throw new ParameterException(spec.commandLine(), "Scan path is not a directory: " + scanPath);
            }
        }

        if (scanOnStart) {
            int found = store.scan();
            log.info("Initial scan found {} games", found);
        }
        return store;
    }

    private static void shutdown(IpcServer server, LibraryStore store) {
        server.stop();
        try {
            store.save();
            log.info("Library saved to {}", store.getSnapshotFile());
        } catch (IOException e) {
            log.error("ERROR: Failed to save library: {}", e.getMessage());
        }
    }
}
