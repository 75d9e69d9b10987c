package io.fullerstack.uptime.core.local;

import io.fullerstack.uptime.core.model.DownFlag;
import io.fullerstack.uptime.core.model.FlagLookup;
import io.fullerstack.uptime.core.model.TargetKey;
import io.fullerstack.uptime.core.store.FlagBodyCodec;
import io.fullerstack.uptime.core.store.FlagNames;
import io.fullerstack.uptime.core.store.FlagStore;
import io.fullerstack.uptime.core.store.FlagStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * Flag store backed by files: one {@code flags/<key>.flag} file per down target
 * under the namespace directory.
 * <p>
 * Writes go through a temporary file and an atomic move so a crashed run never leaves
 * a half-written flag. A flag path that cannot be inspected (permissions, a file where the
 * {@code flags} directory should be) is a failed lookup, never an absent flag.
 */
public class FileFlagStore implements FlagStore {

    private static final Logger logger = LoggerFactory.getLogger(FileFlagStore.class);

    private final Path namespaceDir;
    private final FlagBodyCodec codec;

    public FileFlagStore(Path namespaceDir, FlagBodyCodec codec) {
        this.namespaceDir = namespaceDir;
        this.codec = codec;
    }

    @Override
    public FlagLookup lookup(TargetKey key) {
        Path file = fileFor(key);
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return FlagLookup.absent();
        } catch (IOException e) {
            logger.warn("Cannot read flag {}", file, e);
            return FlagLookup.failed("Cannot read flag " + file + ": " + e);
        }
        if (!attributes.isRegularFile()) {
            return FlagLookup.failed("Flag path " + file + " exists but is not a regular file");
        }
        return FlagLookup.present();
    }

    @Override
    public void create(DownFlag flag) {
        Path file = fileFor(flag.key());
        String body = codec.encode(flag);
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), flag.key().value(), ".tmp");
            Files.writeString(tmp, body, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Wrote flag {}", file);
        } catch (IOException e) {
            FlagStoreException failure = new FlagStoreException("Failed to create flag " + file, e);
            discard(tmp, failure);
            throw failure;
        }
    }

    private static void discard(Path tmp, FlagStoreException failure) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void delete(TargetKey key) {
        Path file = fileFor(key);
        try {
            if (!Files.deleteIfExists(file)) {
                logger.debug("Flag {} already absent", file);
            }
        } catch (IOException e) {
            throw new FlagStoreException("Failed to delete flag " + file, e);
        }
    }

    /**
     * Reads a stored flag back, for operators and tests.
     */
    public Optional<DownFlag> read(TargetKey key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(key, Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new FlagStoreException("Failed to read flag " + file, e);
        }
    }

    Path fileFor(TargetKey key) {
        return namespaceDir.resolve(FlagNames.objectName(key));
    }
}
