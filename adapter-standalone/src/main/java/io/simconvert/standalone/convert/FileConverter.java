package io.simconvert.standalone.convert;

import io.simconvert.core.codec.XmlDocumentCodec;
import io.simconvert.core.engine.ConverterConfig;
import io.simconvert.core.engine.DocumentConverter;
import io.simconvert.core.error.ConverterException;
import io.simconvert.core.model.ConversionResult;
import io.simconvert.core.model.Node;
import io.simconvert.core.step.standard.StandardSteps;
import io.simconvert.standalone.config.StandaloneConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts simulation files on disk to the latest document version.
 *
 * <p>
 * Inputs may be files or directories. Directories are walked recursively and only file names
 * matching {@link StandaloneConfig#includeGlob()} are processed; files named explicitly are always
 * processed. A changed document is written back in place, after copying the original to a backup
 * file when backups are enabled. Documents that are already current, written by a newer release,
 * or that fail are left on disk exactly as they were.
 *
 * <p>
 * One bad file never stops the run: every input ends up as one {@link FileOutcome} in the
 * returned {@link ConversionReport}.
 */
public final class FileConverter {

    private static final Logger LOG = LoggerFactory.getLogger(FileConverter.class);

    private final StandaloneConfig config;
    private final DocumentConverter converter;
    private final XmlDocumentCodec codec;
    private final PathMatcher includeMatcher;
    private final DirectoryWalker walker;

    /** Lists every path below a directory, the directory included. */
    @FunctionalInterface
    interface DirectoryWalker {
        Stream<Path> walk(Path dir) throws IOException;
    }

    /**
     * Creates a converter for the standard step catalog, honouring the configured step failure
     * policy and XML declaration setting.
     */
    public FileConverter(StandaloneConfig config) {
        this(
                config,
                new DocumentConverter(
                        StandardSteps.library(),
                        ConverterConfig.DEFAULT.withStepFailurePolicy(config.stepFailurePolicy()),
                        null),
                new XmlDocumentCodec(config.xmlDeclaration()));
    }

    FileConverter(StandaloneConfig config, DocumentConverter converter, XmlDocumentCodec codec) {
        this(config, converter, codec, Files::walk);
    }

    FileConverter(
            StandaloneConfig config, DocumentConverter converter, XmlDocumentCodec codec, DirectoryWalker walker) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.includeMatcher = FileSystems.getDefault().getPathMatcher("glob:" + config.includeGlob());
        this.walker = Objects.requireNonNull(walker, "walker must not be null");
    }

    /**
     * Converts every file reachable from the given inputs.
     *
     * @param inputs files and directories to process
     * @return one outcome per file, in processing order
     */
    public ConversionReport convertAll(List<Path> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        List<FileOutcome> outcomes = new ArrayList<>();
        for (Path file : collect(inputs, outcomes)) {
            outcomes.add(convertFile(file));
        }
        return new ConversionReport(outcomes, config.dryRun());
    }

    /**
     * Converts a single file.
     *
     * @param file the file to convert
     * @return what happened to it
     */
    public FileOutcome convertFile(Path file) {
        Node root;
        try (InputStream in = Files.newInputStream(file)) {
            root = codec.read(in, file.toString());
        } catch (IOException | ConverterException e) {
            return fail(file, e);
        }

        ConversionResult result = converter.convert(root);
        switch (result.status()) {
            case UP_TO_DATE -> {
                LOG.debug("file.up_to_date file={} version={}", file, result.fromVersion());
                return new FileOutcome(
                        file, FileOutcome.Status.UP_TO_DATE, result.fromVersion(), result.toVersion(), null);
            }
            case UNSUPPORTED_VERSION -> {
                LOG.warn(
                        "file.unsupported file={} document_version={} latest_version={}"
                                + " (written by a newer release, left unchanged)",
                        file,
                        result.fromVersion(),
                        converter.latestVersion());
                return new FileOutcome(
                        file, FileOutcome.Status.UNSUPPORTED, result.fromVersion(), result.toVersion(), null);
            }
            case ABORTED -> {
                String detail = "conversion aborted at version " + result.toVersion() + ", file left unchanged";
                LOG.error("file.failed file={} error={}", file, detail);
                return new FileOutcome(
                        file, FileOutcome.Status.FAILED, result.fromVersion(), result.toVersion(), detail);
            }
            case CONVERTED -> {
                // written below
            }
        }

        if (!config.dryRun()) {
            try {
                writeBack(file, root);
            } catch (IOException | ConverterException e) {
                return fail(file, e);
            }
        }
        LOG.info(
                "file.converted file={} from_version={} to_version={} failed_steps={} dry_run={}",
                file,
                result.fromVersion(),
                result.toVersion(),
                result.failedSteps().size(),
                config.dryRun());
        return new FileOutcome(file, FileOutcome.Status.CONVERTED, result.fromVersion(), result.toVersion(), null);
    }

    /** Path of the backup copy for {@code file}. */
    public Path backupPath(Path file) {
        return file.resolveSibling(file.getFileName().toString() + config.backupSuffix());
    }

    private void writeBack(Path file, Node root) throws IOException {
        if (config.backup()) {
            Files.copy(file, backupPath(file), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        }

        Path dir = file.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                codec.write(root, out);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Expands directories, keeps first-seen order and drops duplicates. A missing input, or a
     * directory that cannot be walked completely, becomes one FAILED outcome for that input.
     */
    private Set<Path> collect(List<Path> inputs, List<FileOutcome> outcomes) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = walker.walk(input)) {
                    files.addAll(walk.filter(Files::isRegularFile)
                            .filter(p -> includeMatcher.matches(p.getFileName()))
                            .sorted()
                            .map(Path::normalize)
                            .toList());
                } catch (IOException e) {
                    outcomes.add(fail(input, e));
                } catch (UncheckedIOException e) {
                    // raised by the stream when a subdirectory cannot be read mid-walk
                    outcomes.add(fail(input, e.getCause()));
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input.normalize());
            } else {
                outcomes.add(fail(input, new IOException("No such file or directory")));
            }
        }
        return files;
    }

    private static FileOutcome fail(Path file, Exception e) {
        LOG.error("file.failed file={} error={}", file, e.getMessage(), e);
        return FileOutcome.failed(file, e.getMessage());
    }
}
