package org.netpreserve.domainprober;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.netpreserve.domainprober.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Every live candidate ever found, kept as a sorted JSON array of URLs.
 * <p>
 * The file is always rewritten in full (via a temporary file that replaces it atomically) so it can
 * be served directly to whatever renders the listing. Entries are never removed.
 */
public class DiscoveryStore {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryStore.class);
    private static final TypeReference<List<Url>> URL_LIST = new TypeReference<>() {
    };
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path path;
    private final TreeSet<Url> discovered = new TreeSet<>();
    private boolean loaded;

    public DiscoveryStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public synchronized Set<Url> load() {
        if (!loaded) {
            if (Files.exists(path)) {
                try {
                    List<Url> urls = mapper.readValue(path.toFile(), URL_LIST);
                    if (urls != null) discovered.addAll(urls);
                } catch (IOException e) {
                    // never fall back to empty here, the next merge would overwrite everything found so far
                    throw new PersistenceException("Failed to read discoveries from " + path, e);
                }
            }
            loaded = true;
        }
        return new HashSet<>(discovered);
    }

    /**
     * Adds the newly found candidates to those already stored and rewrites the file.
     *
     * @return the total number of stored candidates
     */
    public synchronized int mergeAndPersist(Collection<Url> newlyFound) {
        if (!loaded) load();
        var merged = new TreeSet<>(discovered);
        merged.addAll(newlyFound);
        if (merged.size() == discovered.size() && Files.exists(path)) return merged.size();
        try {
            writeAtomic(new ArrayList<>(merged));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write discoveries to " + path, e);
        }
        discovered.addAll(merged);
        log.debug("Wrote {} discoveries to {}", merged.size(), path);
        return merged.size();
    }

    public synchronized boolean contains(Url candidate) {
        return discovered.contains(candidate);
    }

    public synchronized int size() {
        return discovered.size();
    }

    private void writeAtomic(List<Url> urls) throws IOException {
        Path target = path.toAbsolutePath();
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path tmp = parent.resolve("." + target.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), urls);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
