package com.incentives.engine.repository.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.incentives.engine.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * File-backed document collection. Documents are grouped into partitions (for example
 * all participants of one competition); each partition is cached in memory and written
 * to its own JSON file. Every mutation of a partition runs under that partition's lock,
 * and readers always receive copies.
 */
public abstract class JsonDocumentStore<T> {

    private static final Logger logger = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final String dataDirectory;
    private final Class<T> documentType;
    private final JavaType listType;
    protected final ObjectMapper objectMapper;
    private final Map<String, Map<String, T>> cache = new ConcurrentHashMap<>();
    // One lock per cached partition; partitions stay cached for the life of the store
    private final Map<String, ReentrantLock> partitionLocks = new ConcurrentHashMap<>();

    protected JsonDocumentStore(String dataDirectory, Class<T> documentType) {
        this.dataDirectory = dataDirectory;
        this.documentType = documentType;
        this.objectMapper = createObjectMapper();
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, documentType);
        initializeDirectory();
        loadAllPartitions();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    protected abstract String partitionOf(T document);

    protected abstract String idOf(T document);

    private void initializeDirectory() {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create data directory: " + dataDirectory, e);
        }
    }

    private void loadAllPartitions() {
        try (Stream<Path> files = Files.list(Paths.get(dataDirectory))) {
            files.filter(p -> p.toString().endsWith(".json"))
                .forEach(this::loadPartitionFile);
        } catch (IOException e) {
            throw new StorageException("Failed to list data directory: " + dataDirectory, e);
        }
    }

    private void loadPartitionFile(Path filePath) {
        try {
            List<T> documents = objectMapper.readValue(filePath.toFile(), listType);
            if (documents == null) {
                return;
            }
            for (T document : documents) {
                cache.computeIfAbsent(partitionOf(document), k -> new LinkedHashMap<>())
                    .put(idOf(document), document);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to load documents from " + filePath, e);
        }
    }

    private ReentrantLock lockFor(String partition) {
        return partitionLocks.computeIfAbsent(partition, k -> new ReentrantLock());
    }

    protected <R> R withPartitionLock(String partition, Supplier<R> action) {
        ReentrantLock lock = lockFor(partition);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    protected T put(T document) {
        String partition = partitionOf(document);
        return withPartitionLock(partition, () -> {
            T stored = copy(document);
            partitionMap(partition).put(idOf(stored), stored);
            persist(partition);
            return copy(stored);
        });
    }

    protected void putAll(String partition, Collection<T> documents) {
        if (documents.isEmpty()) {
            return;
        }
        withPartitionLock(partition, () -> {
            Map<String, T> map = partitionMap(partition);
            for (T document : documents) {
                if (!partition.equals(partitionOf(document))) {
                    throw new IllegalArgumentException("Document " + idOf(document)
                        + " does not belong to partition " + partition);
                }
                map.put(idOf(document), copy(document));
            }
            persist(partition);
            return null;
        });
    }

    /**
     * Inserts the document only if no document with the same id exists in its partition.
     */
    protected boolean putIfAbsent(T document) {
        String partition = partitionOf(document);
        return withPartitionLock(partition, () -> {
            Map<String, T> map = partitionMap(partition);
            if (map.containsKey(idOf(document))) {
                return false;
            }
            map.put(idOf(document), copy(document));
            persist(partition);
            return true;
        });
    }

    protected Optional<T> get(String partition, String id) {
        if (partition == null || id == null) {
            return Optional.empty();
        }
        return withPartitionLock(partition, () -> {
            Map<String, T> map = cache.get(partition);
            if (map == null) {
                return Optional.<T>empty();
            }
            return Optional.ofNullable(map.get(id)).map(this::copy);
        });
    }

    protected List<T> list(String partition) {
        if (partition == null) {
            return new ArrayList<>();
        }
        return withPartitionLock(partition, () -> {
            Map<String, T> map = cache.get(partition);
            if (map == null) {
                return new ArrayList<T>();
            }
            List<T> copies = new ArrayList<>(map.size());
            map.values().forEach(document -> copies.add(copy(document)));
            return copies;
        });
    }

    protected Optional<T> compute(String partition, String id, UnaryOperator<T> mutation) {
        return computeIf(partition, id, document -> true, mutation);
    }

    /**
     * Applies the mutation atomically when the stored document matches the condition.
     * Returns the stored result, or empty when the document is missing or the condition
     * does not hold.
     */
    protected Optional<T> computeIf(String partition, String id, Predicate<T> condition, UnaryOperator<T> mutation) {
        return withPartitionLock(partition, () -> {
            Map<String, T> map = cache.get(partition);
            T current = map == null ? null : map.get(id);
            if (current == null || !condition.test(copy(current))) {
                return Optional.<T>empty();
            }
            T updated = mutation.apply(copy(current));
            map.put(id, copy(updated));
            persist(partition);
            return Optional.of(copy(updated));
        });
    }

    private Map<String, T> partitionMap(String partition) {
        return cache.computeIfAbsent(partition, k -> new LinkedHashMap<>());
    }

    private void persist(String partition) {
        File file = new File(dataDirectory, fileNameFor(partition));
        List<T> documents = new ArrayList<>(partitionMap(partition).values());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, documents);
        } catch (IOException e) {
            logger.error("Failed to persist partition {} to {}", partition, file, e);
            throw new StorageException("Failed to persist documents to " + file, e);
        }
    }

    private T copy(T document) {
        return objectMapper.convertValue(document, documentType);
    }

    static String fileNameFor(String partition) {
        return partition.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}
