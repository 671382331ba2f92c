package com.residualcarbon.file;

/**
 * Names a file in storage as a bucket (here a subdirectory of the storage root) and a path within it. Prevents passing
 * both parts separately or joining them by hand all over the place.
 */
public class FileStorageKey {
    public final String bucket;
    public final String path;

    public FileStorageKey (String bucket, String path) {
        this.bucket = bucket;
        this.path = path;
    }

    public FileStorageKey (String bucket, String path, String ext) {
        this(bucket, path + "." + ext);
    }

    public String getFullPath () {
        return String.join("/", bucket, path);
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof FileStorageKey)) return false;
        FileStorageKey o = (FileStorageKey) other;
        return bucket.equals(o.bucket) && path.equals(o.path);
    }

    @Override
    public int hashCode () {
        return getFullPath().hashCode();
    }

    @Override
    public String toString () {
        return String.format("[File storage key: bucket='%s', key='%s']", bucket, path);
    }

}
