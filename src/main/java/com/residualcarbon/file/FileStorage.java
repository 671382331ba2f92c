package com.residualcarbon.file;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * A place to keep files by bucket and path. New content is always written to a temporary file first and then moved
 * into place, so a reader never sees a half-written file under a storage key.
 */
public abstract class FileStorage {

    public abstract File getFile (FileStorageKey key);

    public abstract boolean exists (FileStorageKey key);

    public abstract InputStream getInputStream (FileStorageKey key) throws FileNotFoundException;

    /** A new empty file in the same directory as the bucket, so that it can later be renamed into place atomically. */
    public abstract File createTempFile (String bucket) throws IOException;

    /** Atomically replace whatever is stored under the key with the given file. */
    public abstract void moveIntoStorage (FileStorageKey key, File file) throws IOException;

    public abstract boolean delete (FileStorageKey key);

    /** Keys of all stored files in a bucket whose names end with the given suffix. */
    public abstract List<FileStorageKey> list (String bucket, String suffix);

    /** Temporary files left in a bucket, e.g. by a process killed mid-write. */
    public abstract List<File> listTempFiles (String bucket);
}
