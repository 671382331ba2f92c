package com.residualcarbon.file;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * File storage in a directory on the local filesystem, one subdirectory per bucket.
 */
public class LocalFileStorage extends FileStorage {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileStorage.class);

    public static final String TEMP_SUFFIX = ".tmp";

    private final File baseDirectory;

    public LocalFileStorage (File baseDirectory) {
        this.baseDirectory = baseDirectory;
        try {
            FileUtils.forceMkdir(baseDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage directory " + baseDirectory, e);
        }
        LOG.info("Storing files under {}", baseDirectory.getAbsolutePath());
    }

    private File bucketDirectory (String bucket) {
        return new File(baseDirectory, bucket);
    }

    @Override
    public File getFile (FileStorageKey key) {
        return new File(bucketDirectory(key.bucket), key.path);
    }

    @Override
    public boolean exists (FileStorageKey key) {
        return getFile(key).isFile();
    }

    @Override
    public InputStream getInputStream (FileStorageKey key) throws FileNotFoundException {
        return new FileInputStream(getFile(key));
    }

    @Override
    public File createTempFile (String bucket) throws IOException {
        File directory = bucketDirectory(bucket);
        FileUtils.forceMkdir(directory);
        return File.createTempFile("entry-", TEMP_SUFFIX, directory);
    }

    @Override
    public void moveIntoStorage (FileStorageKey key, File file) throws IOException {
        File target = getFile(key);
        FileUtils.forceMkdirParent(target);
        Files.move(file.toPath(), target.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public boolean delete (FileStorageKey key) {
        return getFile(key).delete();
    }

    @Override
    public List<FileStorageKey> list (String bucket, String suffix) {
        List<FileStorageKey> keys = new ArrayList<>();
        File[] files = bucketDirectory(bucket).listFiles((dir, name) -> name.endsWith(suffix));
        if (files == null) return keys;
        Arrays.sort(files);
        for (File file : files) keys.add(new FileStorageKey(bucket, file.getName()));
        return keys;
    }

    @Override
    public List<File> listTempFiles (String bucket) {
        File directory = bucketDirectory(bucket);
        if (!directory.isDirectory()) return new ArrayList<>();
        return new ArrayList<>(FileUtils.listFiles(directory, new String[] { TEMP_SUFFIX.substring(1) }, false));
    }
}
