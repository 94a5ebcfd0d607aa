package com.phillippitts.meetingscribe.service.paths;

import com.phillippitts.meetingscribe.config.properties.TranscriptionPathsProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * {@link TranscriptionPaths} for the two supported layouts.
 *
 * <pre>
 * &lt;root&gt;/assets/main                      whisper.cpp executable
 * &lt;root&gt;/assets/models/whisper/ggml-*.bin  models
 * &lt;root&gt;/assets/bin/ffmpeg/ffmpeg           ffmpeg
 * </pre>
 *
 * <p>{@code <root>} is {@code transcription.paths.resources-path} for an installed application and
 * {@code transcription.paths.development-root} otherwise. Relative roots are resolved against the
 * working directory.
 */
@Component
public class ConfiguredTranscriptionPaths implements TranscriptionPaths {

    private static final Logger LOG = LogManager.getLogger(ConfiguredTranscriptionPaths.class);

    private static final String MODEL_PREFIX = "ggml-";
    private static final String MODEL_SUFFIX = ".bin";

    private final Path assets;

    public ConfiguredTranscriptionPaths(TranscriptionPathsProperties props) {
        Objects.requireNonNull(props, "props");
        String root = props.isPackaged() ? props.getResourcesPath() : props.getDevelopmentRoot();
        if (root == null || root.isBlank()) {
            root = ".";
        }
        this.assets = resolvePath(root).resolve("assets");
        LOG.info("Transcription assets directory: {} (packaged={})", assets, props.isPackaged());
    }

    @Override
    public Path assetsDirectory() {
        return assets;
    }

    @Override
    public Path engineExecutablePath() {
        return assets.resolve("main");
    }

    @Override
    public Path modelFilePath(String fileName) {
        return modelsDirectory().resolve(fileName);
    }

    @Override
    public Path ffmpegPath() {
        return assets.resolve("bin").resolve("ffmpeg").resolve("ffmpeg");
    }

    @Override
    public List<WhisperModel> availableModels() {
        Path dir = modelsDirectory();
        if (!Files.isDirectory(dir)) {
            LOG.warn("Models directory not found: {}", dir);
            return List.of();
        }
        List<WhisperModel> models = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + MODEL_SUFFIX)) {
            for (Path file : files) {
                WhisperModel model = toModel(file);
                if (model != null) {
                    models.add(model);
                }
            }
        } catch (IOException e) {
            LOG.error("Error listing whisper models in {}: {}", dir, e.toString());
            return List.of();
        }
        models.sort(Comparator.comparing(WhisperModel::name));
        return models;
    }

    @Override
    public TranscriptionDependencies checkDependencies() {
        Path whisper = engineExecutablePath();
        Path ffmpeg = ffmpegPath();
        return new TranscriptionDependencies(
                new TranscriptionDependencies.Artifact(Files.exists(whisper), whisper.toString()),
                new TranscriptionDependencies.Artifact(Files.exists(ffmpeg), ffmpeg.toString()),
                availableModels());
    }

    private Path modelsDirectory() {
        return assets.resolve("models").resolve("whisper");
    }

    private static WhisperModel toModel(Path file) {
        String fileName = file.getFileName().toString();
        String name = fileName;
        if (name.startsWith(MODEL_PREFIX)) {
            name = name.substring(MODEL_PREFIX.length());
        }
        name = name.substring(0, name.length() - MODEL_SUFFIX.length());
        try {
            return new WhisperModel(name, fileName, file.toAbsolutePath().toString(), Files.size(file));
        } catch (IOException e) {
            LOG.warn("Error reading size of model {}: {}", file, e.toString());
            return null;
        }
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }
}
