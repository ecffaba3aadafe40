package fr.lapetina.imagebatch.domain.format;

import fr.lapetina.imagebatch.domain.model.ImageCodec;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Filename to codec memo, owned by one batch and shared by its workers.
 *
 * Entries are only ever added. Concurrent inserts for the same key are harmless because
 * resolution is a pure function of the filename.
 */
public final class FormatCache {

    private final Map<String, ImageCodec> entries = new ConcurrentHashMap<>();

    ImageCodec computeIfAbsent(String filename, Function<String, ImageCodec> resolver) {
        return entries.computeIfAbsent(filename, resolver);
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String filename) {
        return entries.containsKey(filename);
    }
}
