package com.memfacade.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memfacade.memory.Identity;
import com.memfacade.memory.MemoryRecord;
import com.memfacade.memory.MemoryStore;
import com.memfacade.memory.ResultNormalizer;
import com.memfacade.memory.Timestamps;
import com.memfacade.service.StatisticsEngine;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lucene-backed {@link MemoryStore}. Content is kept in the stored field {@code data};
 * {@link #get} reports it as {@code memory}. With {@code infer}, an exact duplicate of an
 * existing memory in the same scope is suppressed and {@link #add} returns no results.
 */
public class LuceneMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(LuceneMemoryStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final String ID = "id";
    static final String DATA = "data";
    static final String DIGEST = "digest";
    static final String USER_ID = "user_id";
    static final String AGENT_ID = "agent_id";
    static final String RUN_ID = "run_id";
    static final String SCOPE = "scope";
    static final String TYPE = "type";
    static final String METADATA = "metadata";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";
    static final String ACCESS_COUNT = "access_count";

    private final FSDirectory directory;
    private final StandardAnalyzer analyzer = new StandardAnalyzer();
    private final IndexWriter writer;
    private final Clock clock;

    public LuceneMemoryStore(String indexPath) throws IOException {
        this(indexPath, Clock.systemUTC());
    }

    public LuceneMemoryStore(String indexPath, Clock clock) throws IOException {
        this.clock = clock;
        var path = Path.of(indexPath);
        Files.createDirectories(path);
        this.directory = FSDirectory.open(path);
        var config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.writer = new IndexWriter(directory, config);
        writer.commit();
    }

    @Override
    public synchronized Map<String, Object> add(String content, Identity identity, Map<String, Object> metadata,
                                                Map<String, Object> filters, String scope, String type,
                                                boolean infer) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        // filters only narrow inference in stores that extract facts; nothing to narrow here
        try {
            var digest = digest(content);
            if (infer && !search(and(identityQuery(identity), new TermQuery(new Term(DIGEST, digest))), 1).isEmpty()) {
                log.debug("Duplicate memory suppressed for {}", identity);
                return Map.of("results", List.of());
            }

            var id = UUID.randomUUID().toString();
            var now = now();
            var doc = new Document();
            doc.add(new StringField(ID, id, Field.Store.YES));
            doc.add(new StoredField(DATA, content));
            doc.add(new StringField(DIGEST, digest, Field.Store.NO));
            addKeyword(doc, USER_ID, identity.userId());
            addKeyword(doc, AGENT_ID, identity.agentId());
            addKeyword(doc, RUN_ID, identity.runId());
            addKeyword(doc, SCOPE, scope);
            addKeyword(doc, TYPE, type);
            doc.add(new StoredField(METADATA, toJson(metadata)));
            doc.add(new StoredField(CREATED_AT, now));
            doc.add(new StoredField(UPDATED_AT, now));
            doc.add(new StoredField(ACCESS_COUNT, 0));
            writer.addDocument(doc);
            writer.commit();

            var entry = toPayload(doc, "memory");
            entry.put("event", "ADD");
            return Map.of("results", List.of(entry));
        } catch (IOException e) {
            throw new RuntimeException("Failed to store memory", e);
        }
    }

    @Override
    public Map<String, Object> get(String memoryId, Identity identity) {
        try {
            var docs = search(and(identityQuery(identity), new TermQuery(new Term(ID, memoryId))), 1);
            return docs.isEmpty() ? null : toPayload(docs.get(0), "memory");
        } catch (IOException e) {
            throw new RuntimeException("Failed to get memory: " + memoryId, e);
        }
    }

    @Override
    public Map<String, Object> getRawPayload(String memoryId) {
        try {
            var docs = search(new TermQuery(new Term(ID, memoryId)), 1);
            return docs.isEmpty() ? null : toPayload(docs.get(0), DATA);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read payload: " + memoryId, e);
        }
    }

    @Override
    public Map<String, Object> getAll(Identity identity, int limit, int offset, String sortBy, String order) {
        try {
            var payloads = new ArrayList<Map<String, Object>>();
            for (var doc : search(identityQuery(identity), Integer.MAX_VALUE)) {
                payloads.add(toPayload(doc, "memory"));
            }
            if (sortBy != null) {
                var cmp = comparator(sortBy);
                payloads.sort("asc".equalsIgnoreCase(order) ? cmp : cmp.reversed());
            }
            int from = Math.min(offset, payloads.size());
            int to = (int) Math.min((long) from + limit, payloads.size());
            return Map.of("results", new ArrayList<>(payloads.subList(from, to)));
        } catch (IOException e) {
            throw new RuntimeException("Failed to list memories", e);
        }
    }

    // the returned payload omits the id, like most stores' update path
    @Override
    public synchronized Map<String, Object> update(String memoryId, String content, Identity identity,
                                                   Map<String, Object> metadata) {
        try {
            var docs = search(and(identityQuery(identity), new TermQuery(new Term(ID, memoryId))), 1);
            if (docs.isEmpty()) {
                throw new IllegalStateException("Memory " + memoryId + " does not exist");
            }
            var old = docs.get(0);
            var doc = new Document();
            doc.add(new StringField(ID, memoryId, Field.Store.YES));
            doc.add(new StoredField(DATA, content));
            doc.add(new StringField(DIGEST, digest(content), Field.Store.NO));
            for (var key : List.of(USER_ID, AGENT_ID, RUN_ID, SCOPE, TYPE)) {
                addKeyword(doc, key, old.get(key));
            }
            doc.add(new StoredField(METADATA, toJson(metadata)));
            doc.add(new StoredField(CREATED_AT, old.get(CREATED_AT)));
            doc.add(new StoredField(UPDATED_AT, now()));
            var accessCount = old.getField(ACCESS_COUNT);
            doc.add(new StoredField(ACCESS_COUNT, accessCount != null ? accessCount.numericValue().intValue() : 0));
            writer.updateDocument(new Term(ID, memoryId), doc);
            writer.commit();

            var payload = toPayload(doc, "memory");
            payload.remove(ID);
            return payload;
        } catch (IOException e) {
            throw new RuntimeException("Failed to update memory: " + memoryId, e);
        }
    }

    @Override
    public synchronized boolean delete(String memoryId, Identity identity) {
        try {
            var query = and(identityQuery(identity), new TermQuery(new Term(ID, memoryId)));
            if (search(query, 1).isEmpty()) return false;
            writer.deleteDocuments(query);
            writer.commit();
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete memory: " + memoryId, e);
        }
    }

    @Override
    public synchronized long deleteAll(Identity identity) {
        try {
            var query = identityQuery(identity);
            long count = search(query, Integer.MAX_VALUE).size();
            writer.deleteDocuments(query);
            writer.commit();
            return count;
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete memories", e);
        }
    }

    @Override
    public Map<String, Object> getStatistics(Identity identity) {
        try {
            var records = new ArrayList<MemoryRecord>();
            for (var doc : search(identityQuery(identity), Integer.MAX_VALUE)) {
                records.add(ResultNormalizer.normalize(toPayload(doc, "memory")));
            }
            return new StatisticsEngine(clock).compute(records).toMap();
        } catch (IOException e) {
            throw new RuntimeException("Failed to compute statistics", e);
        }
    }

    @Override
    public List<String> getUsers() {
        try {
            var users = new LinkedHashSet<String>();
            for (var doc : search(new MatchAllDocsQuery(), Integer.MAX_VALUE)) {
                var user = doc.get(USER_ID);
                if (user != null) users.add(user);
            }
            return new ArrayList<>(users);
        } catch (IOException e) {
            throw new RuntimeException("Failed to list users", e);
        }
    }

    public void close() {
        try {
            writer.close();
            directory.close();
            analyzer.close();
        } catch (IOException e) {
            log.error("Failed to close memory store", e);
        }
    }

    private List<Document> search(Query query, int max) throws IOException {
        try (var reader = DirectoryReader.open(directory)) {
            var searcher = new IndexSearcher(reader);
            int n = Math.max(1, Math.min(max, reader.maxDoc()));
            var hits = searcher.search(query, n, Sort.INDEXORDER);
            var stored = searcher.storedFields();
            var docs = new ArrayList<Document>(hits.scoreDocs.length);
            for (var hit : hits.scoreDocs) {
                docs.add(stored.document(hit.doc));
            }
            return docs;
        }
    }

    private static Comparator<Map<String, Object>> comparator(String sortBy) {
        if (CREATED_AT.equals(sortBy) || UPDATED_AT.equals(sortBy)) {
            return Comparator.comparing(p -> Timestamps.parse(p.get(sortBy)));
        }
        return Comparator.comparing(p -> String.valueOf(p.getOrDefault(sortBy, "")));
    }

    private static Query identityQuery(Identity identity) {
        if (identity.isEmpty()) return new MatchAllDocsQuery();
        var builder = new BooleanQuery.Builder();
        if (identity.userId() != null) {
            builder.add(new TermQuery(new Term(USER_ID, identity.userId())), BooleanClause.Occur.FILTER);
        }
        if (identity.agentId() != null) {
            builder.add(new TermQuery(new Term(AGENT_ID, identity.agentId())), BooleanClause.Occur.FILTER);
        }
        if (identity.runId() != null) {
            builder.add(new TermQuery(new Term(RUN_ID, identity.runId())), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    private static Query and(Query left, Query right) {
        return new BooleanQuery.Builder()
                .add(left, BooleanClause.Occur.FILTER)
                .add(right, BooleanClause.Occur.FILTER)
                .build();
    }

    private static void addKeyword(Document doc, String field, String value) {
        if (value != null) doc.add(new StringField(field, value, Field.Store.YES));
    }

    private static Map<String, Object> toPayload(Document doc, String contentKey) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(ID, doc.get(ID));
        payload.put(contentKey, doc.get(DATA));
        payload.put(USER_ID, doc.get(USER_ID));
        payload.put(AGENT_ID, doc.get(AGENT_ID));
        payload.put(RUN_ID, doc.get(RUN_ID));
        payload.put(SCOPE, doc.get(SCOPE));
        payload.put(TYPE, doc.get(TYPE));
        var metadata = fromJson(doc.get(METADATA));
        payload.put(METADATA, metadata);
        payload.put(CREATED_AT, doc.get(CREATED_AT));
        payload.put(UPDATED_AT, doc.get(UPDATED_AT));
        var access = doc.getField(ACCESS_COUNT);
        payload.put(ACCESS_COUNT, access != null ? access.numericValue().intValue() : 0);
        if (metadata.get("importance") instanceof Number) {
            payload.put("importance", ((Number) metadata.get("importance")).doubleValue());
        }
        return payload;
    }

    private String now() {
        return Timestamps.format(clock.instant());
    }

    private static String toJson(Map<String, Object> metadata) {
        try {
            return MAPPER.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable", e);
        }
    }

    private static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Corrupt metadata payload ignored: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private static String digest(String content) {
        try {
            var sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(content.strip().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
