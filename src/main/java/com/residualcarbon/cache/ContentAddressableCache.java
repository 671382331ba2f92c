package com.residualcarbon.cache;

import com.google.common.hash.Hashing;
import com.google.common.io.ByteStreams;
import com.google.common.io.LittleEndianDataInputStream;
import com.google.common.io.LittleEndianDataOutputStream;
import com.google.common.util.concurrent.Striped;
import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.file.FileStorage;
import com.residualcarbon.file.FileStorageKey;
import com.residualcarbon.file.LocalFileStorage;
import com.residualcarbon.util.JsonUtil;
import com.residualcarbon.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * A disk cache of derived artifacts, addressed by what they were derived from. Each entry is a single file: a short
 * header, the JSON metadata ({@link CacheEntry}), then the gzipped artifact.
 *
 * Entries are written to a temporary file in the same directory, synced, renamed over the canonical name and read back.
 * A reader therefore sees either the previous complete entry or the new one. Within one JVM, computations for the same
 * key are serialized; across processes the last rename wins.
 *
 * Nothing on disk is trusted without checking: every read re-validates the fingerprint and the modification time of
 * each source file, and verifies the payload checksum.
 */
public class ContentAddressableCache {

    private static final Logger LOG = LoggerFactory.getLogger(ContentAddressableCache.class);

    public interface Config {
        String cacheDirectory ();
    }

    static final int MAGIC = 0x52434345;
    static final int VERSION = 1;
    static final String ENTRY_SUFFIX = ".entry";

    /** Temporary files older than this are assumed to belong to a dead writer. */
    static final long TEMP_FILE_MAX_AGE_MILLIS = 60 * 60 * 1000;

    private final FileStorage storage;

    /**
     * One set of lock stripes per family. Computations nest hex index, then table, then clip, always in that order, so
     * separate stripes per family cannot deadlock even when two slots of different families hash alike.
     */
    private final Map<CacheFamily, Striped<Lock>> locks = new EnumMap<>(CacheFamily.class);

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong staleEntries = new AtomicLong();
    private final AtomicLong corruptEntries = new AtomicLong();

    public ContentAddressableCache (Config config) {
        this(new LocalFileStorage(new File(config.cacheDirectory())));
    }

    public ContentAddressableCache (FileStorage storage) {
        this.storage = storage;
        for (CacheFamily family : CacheFamily.values()) locks.put(family, Striped.lock(64));
    }

    private Lock lockFor (CacheFamily family, String slot) {
        return locks.get(family).get(slot);
    }

    /**
     * Return the stored artifact for this key if there is a valid one, otherwise compute it, store it and return it.
     * The computation is not invoked on a hit.
     */
    public <T> T cached (CacheKey key, ArtifactCodec<T> codec, Computation<T> computation) throws IOException {
        Lock lock = lockFor(key.family, key.slot());
        lock.lock();
        try {
            T stored = readIfValid(key, codec);
            if (stored != null) {
                hits.incrementAndGet();
                LOG.info("Cache hit for {} {}", key.family, key.operation);
                return stored;
            }
            return computeAndStore(key, codec, computation);
        } finally {
            lock.unlock();
        }
    }

    /** @return true if a stored entry exists and is still valid for this key. */
    public boolean isValid (CacheKey key) {
        FileStorageKey storageKey = key.storageKey();
        if (!storage.exists(storageKey)) return false;
        try {
            return readEntry(storageKey, false).entry.invalidReason(key) == null;
        } catch (IOException e) {
            return false;
        }
    }

    private <T> T readIfValid (CacheKey key, ArtifactCodec<T> codec) {
        FileStorageKey storageKey = key.storageKey();
        if (!storage.exists(storageKey)) return null;
        StoredEntry stored;
        try {
            stored = readEntry(storageKey, true);
        } catch (IOException e) {
            discardCorrupt(storageKey, e.getMessage());
            return null;
        }
        String reason = stored.entry.invalidReason(key);
        if (reason != null) {
            staleEntries.incrementAndGet();
            LOG.info("Cache entry for {} {} is stale: {}", key.family, key.operation, reason);
            return null;
        }
        try {
            return decode(stored.payload, codec);
        } catch (IOException | RuntimeException e) {
            discardCorrupt(storageKey, "artifact cannot be decoded: " + e);
            return null;
        }
    }

    private <T> T computeAndStore (CacheKey key, ArtifactCodec<T> codec, Computation<T> computation) throws IOException {
        FileStorageKey storageKey = key.storageKey();
        for (int attempt = 1; ; attempt++) {
            misses.incrementAndGet();
            long start = System.currentTimeMillis();
            T artifact = computation.compute();
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Interrupted while computing " + key + ", nothing was cached");
            }
            byte[] payload = encode(artifact, codec);
            CacheEntry entry = CacheEntry.forKey(key);
            entry.payloadLength = payload.length;
            entry.payloadChecksum = checksum(payload);
            write(storageKey, entry, payload);

            String problem = verify(storageKey, entry);
            if (problem == null) {
                LOG.info("Cached {} {} ({}) in {}", key.family, key.operation, Util.human(payload.length, "B"),
                        Util.elapsed(start));
                return artifact;
            }
            corruptEntries.incrementAndGet();
            storage.delete(storageKey);
            if (attempt >= 2) {
                throw PipelineException.cacheCorruption(String.format(
                        "Cache entry %s failed verification twice: %s", storageKey.getFullPath(), problem));
            }
            LOG.warn("Cache entry {} failed verification after writing ({}), recomputing.",
                    storageKey.getFullPath(), problem);
        }
    }

    private void write (FileStorageKey storageKey, CacheEntry entry, byte[] payload) throws IOException {
        byte[] metadata = JsonUtil.objectMapper.writeValueAsBytes(entry);
        File temp = storage.createTempFile(storageKey.bucket);
        try {
            try (FileOutputStream fos = new FileOutputStream(temp)) {
                LittleEndianDataOutputStream out = new LittleEndianDataOutputStream(new BufferedOutputStream(fos));
                out.writeInt(MAGIC);
                out.writeInt(VERSION);
                out.writeInt(metadata.length);
                out.write(metadata);
                out.write(payload);
                out.flush();
                fos.getFD().sync();
            }
            storage.moveIntoStorage(storageKey, temp);
        } finally {
            Files.deleteIfExists(temp.toPath());
        }
    }

    /** Read back what was just promoted. @return null if it is intact, otherwise what is wrong with it. */
    private String verify (FileStorageKey storageKey, CacheEntry written) {
        try {
            StoredEntry stored = readEntry(storageKey, true);
            if (!written.fingerprint.equals(stored.entry.fingerprint)) return "fingerprint differs from what was written";
            if (!written.payloadChecksum.equals(stored.entry.payloadChecksum)) return "checksum differs from what was written";
            return null;
        } catch (IOException e) {
            return e.getMessage();
        }
    }

    private StoredEntry readEntry (FileStorageKey storageKey, boolean withPayload) throws IOException {
        try (InputStream is = storage.getInputStream(storageKey)) {
            LittleEndianDataInputStream in = new LittleEndianDataInputStream(new BufferedInputStream(is));
            if (in.readInt() != MAGIC) throw new IOException("not a cache entry");
            int version = in.readInt();
            if (version != VERSION) throw new IOException("unsupported cache entry version " + version);
            int metadataLength = in.readInt();
            if (metadataLength <= 0 || metadataLength > 16 * 1024 * 1024) {
                throw new IOException("implausible metadata length " + metadataLength);
            }
            byte[] metadata = new byte[metadataLength];
            in.readFully(metadata);
            CacheEntry entry = JsonUtil.objectMapper.readValue(metadata, CacheEntry.class);
            if (!withPayload) return new StoredEntry(entry, null);
            byte[] payload = ByteStreams.toByteArray(in);
            if (payload.length != entry.payloadLength) {
                throw new IOException(String.format("payload is %d bytes, expected %d", payload.length, entry.payloadLength));
            }
            if (!checksum(payload).equals(entry.payloadChecksum)) throw new IOException("payload checksum mismatch");
            return new StoredEntry(entry, payload);
        }
    }

    private void discardCorrupt (FileStorageKey storageKey, String problem) {
        corruptEntries.incrementAndGet();
        LOG.warn("Discarding corrupt cache entry {}: {}", storageKey.getFullPath(), problem);
        storage.delete(storageKey);
    }

    /**
     * Remove entries made for areas of interest outside the protected set, and temporary files abandoned by writers
     * that died. Entries that cannot be read at all are removed too.
     * @return the number of files removed.
     */
    public int sweep (Set<String> protectedAois) {
        int removed = 0;
        long now = System.currentTimeMillis();
        for (CacheFamily family : CacheFamily.values()) {
            for (FileStorageKey storageKey : storage.list(family.directory, ENTRY_SUFFIX)) {
                String aoi;
                try {
                    aoi = readEntry(storageKey, false).entry.aoi();
                } catch (IOException e) {
                    LOG.warn("Removing unreadable cache entry {}: {}", storageKey.getFullPath(), e.getMessage());
                    if (storage.delete(storageKey)) removed++;
                    continue;
                }
                if (aoi == null || protectedAois.contains(aoi)) continue;
                Lock lock = lockFor(family, storageKey.path.substring(0, storageKey.path.length() - ENTRY_SUFFIX.length()));
                lock.lock();
                try {
                    if (storage.delete(storageKey)) {
                        LOG.debug("Swept {} entry for unprotected area {}", family, aoi);
                        removed++;
                    }
                } finally {
                    lock.unlock();
                }
            }
            for (File temp : storage.listTempFiles(family.directory)) {
                if (now - temp.lastModified() < TEMP_FILE_MAX_AGE_MILLIS) continue;
                try {
                    if (Files.deleteIfExists(temp.toPath())) removed++;
                } catch (IOException e) {
                    LOG.warn("Could not remove abandoned temporary file {}: {}", temp, e.getMessage());
                }
            }
        }
        if (removed > 0) LOG.info("Cache sweep removed {} files, protected areas: {}", removed, protectedAois);
        return removed;
    }

    private static <T> byte[] encode (T artifact, ArtifactCodec<T> codec) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (LittleEndianDataOutputStream out = new LittleEndianDataOutputStream(new GZIPOutputStream(bytes))) {
            codec.write(artifact, out);
        }
        return bytes.toByteArray();
    }

    private static <T> T decode (byte[] payload, ArtifactCodec<T> codec) throws IOException {
        try (LittleEndianDataInputStream in = new LittleEndianDataInputStream(
                new GZIPInputStream(new ByteArrayInputStream(payload)))) {
            return codec.read(in);
        }
    }

    private static String checksum (byte[] payload) {
        return Hashing.crc32c().hashBytes(payload).toString();
    }

    public long hits () {
        return hits.get();
    }

    public long misses () {
        return misses.get();
    }

    public long staleEntries () {
        return staleEntries.get();
    }

    public long corruptEntries () {
        return corruptEntries.get();
    }

    private static class StoredEntry {
        final CacheEntry entry;
        final byte[] payload;

        StoredEntry (CacheEntry entry, byte[] payload) {
            this.entry = entry;
            this.payload = payload;
        }
    }
}
