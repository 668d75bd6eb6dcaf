package rs.lukaj.networking.cache;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Stores each entry in its own file inside the root directory. File name is a hash of the key, so any
 * key can be used regardless of the characters it contains. Writes go through a temporary file which
 * replaces the old entry, so readers never see a half-written entry.
 */
public class FileDiskCache implements DiskCache {
    private static final String SUFFIX = ".cache";

    private final Path rootDirectory;

    public FileDiskCache(File rootDirectory) {
        this.rootDirectory = rootDirectory.toPath();
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    @Override
    public synchronized byte[] get(String key) throws IOException {
        Path file = fileFor(key);
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @Override
    public synchronized void put(String key, byte[] data) throws IOException {
        Files.createDirectories(rootDirectory);
        Path file = fileFor(key);
        Path temp = Files.createTempFile(rootDirectory, "entry", ".tmp");
        try {
            Files.write(temp, data);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public synchronized void delete(String key) throws IOException {
        Files.deleteIfExists(fileFor(key));
    }

    @Override
    public synchronized void clear() throws IOException {
        if(!Files.isDirectory(rootDirectory)) return;
        try(Stream<Path> files = Files.list(rootDirectory)) {
            for(Path file : (Iterable<Path>) files::iterator) {
                if(file.getFileName().toString().endsWith(SUFFIX)) Files.deleteIfExists(file);
            }
        }
    }

    private Path fileFor(String key) {
        return rootDirectory.resolve(getFilenameForKey(key));
    }

    static String getFilenameForKey(String key) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getBytes(UTF_8));
            StringBuilder name = new StringBuilder(hash.length * 2 + SUFFIX.length());
            for(byte b : hash) name.append(String.format("%02x", b));
            return name.append(SUFFIX).toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is required by every JVM", e);
        }
    }
}
