package com.p14n.eventbus.receiver;

import com.p14n.eventbus.data.EventMessage;
import com.p14n.eventbus.errors.SpawnException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletionException;

/**
 * Receiver appending every delivered event to a log file, one JSON document
 * per line.
 *
 * <p>
 * The worker starts paused and writes nothing until it has been given a file
 * name and told to start, which {@link #launchThread()} does before
 * returning. {@link #pause()} and {@link #resume()} toggle writing while the
 * worker keeps running.
 * </p>
 */
public class FileEventSubscriptionReceiver extends MessageEventSubscriptionReceiver {
    private static final Logger logger = LoggerFactory.getLogger(FileEventSubscriptionReceiver.class);

    public static final String DEFAULT_NAME = "FileEventSubscriptionReceiver";
    public static final String DEFAULT_FILE_NAME = "event_log.txt";

    public static final String SET_FILE_NAME = "setFileName";
    public static final String PAUSE = "pause";
    public static final String START = "start";

    private final Path logFile;

    public FileEventSubscriptionReceiver(Path baseDirectory) {
        this(DEFAULT_NAME, null, baseDirectory);
    }

    /**
     * @param name          Receiver name
     * @param fileName      Log file; a bare file name is placed in
     *                      {@code baseDirectory}, anything with a directory
     *                      part is used as given. Null means
     *                      {@value #DEFAULT_FILE_NAME}.
     * @param baseDirectory Directory for bare file names
     */
    public FileEventSubscriptionReceiver(String name, String fileName, Path baseDirectory) {
        super(name, FileWorker::new);
        this.logFile = resolveLogFile(fileName, baseDirectory);
    }

    static Path resolveLogFile(String fileName, Path baseDirectory) {
        if (fileName == null || fileName.trim().isEmpty()) {
            return baseDirectory.resolve(DEFAULT_FILE_NAME);
        }
        Path path = Path.of(fileName);
        return path.getParent() == null ? baseDirectory.resolve(path) : path;
    }

    public Path getLogFile() {
        return logFile;
    }

    /**
     * Starts the worker, points it at the log file and starts writing.
     *
     * @throws SpawnException if the worker could not be started or configured
     */
    @Override
    public synchronized ReceiverWorker launchThread() {
        ReceiverWorker worker = super.launchThread();
        try {
            worker.configure(SET_FILE_NAME, logFile.toString()).join();
            worker.configure(START, null).join();
        } catch (CompletionException e) {
            terminateThread();
            throw new SpawnException("Receiver " + getName() + " could not be configured", e.getCause());
        }
        logger.atInfo().log("Receiver {} writing events to {}", getName(), logFile);
        return worker;
    }

    public void pause() {
        configure(PAUSE, null).join();
    }

    public void resume() {
        configure(START, null).join();
    }

    static final class FileWorker implements EventSubscriberWorker {
        private static final Logger logger = LoggerFactory.getLogger(FileWorker.class);

        private Path logFile;
        private boolean paused = true;

        @Override
        public void receive(String serializedMessage) {
            if (paused || logFile == null) {
                return;
            }
            try {
                EventMessage.fromJson(serializedMessage);
            } catch (IllegalArgumentException e) {
                logger.atWarn().setCause(e).log("Ignoring message that is not an event message");
                return;
            }
            try {
                Files.writeString(logFile, serializedMessage + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to " + logFile, e);
            }
        }

        @Override
        public void configure(String key, Object value) {
            switch (key) {
                case SET_FILE_NAME:
                    if (value instanceof String) {
                        logFile = Path.of((String) value);
                        createParentDirectories(logFile);
                    }
                    break;
                case PAUSE:
                    paused = true;
                    break;
                case START:
                    paused = false;
                    break;
                default:
                    logger.atDebug().log("Ignoring unknown control message {}", key);
            }
        }

        private static void createParentDirectories(Path file) {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                try {
                    Files.createDirectories(parent);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to create directory " + parent, e);
                }
            }
        }
    }
}
