package org.janelia.hcppost.utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

public class FileUtils {

    private static final Set<PosixFilePermission> GROUP_WRITABLE_DIR_PERMISSIONS = PosixFilePermissions.fromString("rwxrwxr-x");

    /**
     * Finds the files under <code>dir</code> whose name matches the pattern. A pattern without a syntax prefix is
     * treated as a glob.
     */
    public static Stream<Path> lookupFiles(Path dir, int maxDepth, String pattern) {
        try {
            String fileLookupPattern;
            if (StringUtils.isBlank(pattern)) {
                fileLookupPattern = "glob:*";
            } else if (!pattern.startsWith("glob:") && !pattern.startsWith("regex:")) {
                // default to glob
                fileLookupPattern = "glob:" + pattern;
            } else {
                fileLookupPattern = pattern;
            }
            PathMatcher inputFileMatcher = FileSystems.getDefault().getPathMatcher(fileLookupPattern);
            return Files.find(dir, maxDepth, (p, a) -> !p.equals(dir) && inputFileMatcher.matches(p.getFileName()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Removes a file, a symbolic link or a whole directory tree. Symbolic links are never followed.
     */
    public static void deletePath(Path dir) throws IOException {
        if (dir == null || Files.notExists(dir, LinkOption.NOFOLLOW_LINKS)) {
            return; // do nothing
        }
        Files.walkFileTree(dir, new FileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Creates the directory and its missing parents and makes it group writable where the file system supports
     * POSIX permissions.
     */
    public static Path createGroupWritableDirs(Path dir) throws IOException {
        Files.createDirectories(dir);
        if (dir.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(dir, GROUP_WRITABLE_DIR_PERMISSIONS);
        }
        return dir;
    }

    public static long countLines(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return reader.lines().count();
        }
    }
}
