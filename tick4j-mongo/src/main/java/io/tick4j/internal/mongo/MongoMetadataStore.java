package io.tick4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.tick4j.core.JobAndNextTick;
import io.tick4j.core.JobStoredData;
import io.tick4j.store.AbstractMetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * MongoDB persistence layer for job metadata.
 *
 * <p>Documents live in a configurable collection, one per job, keyed by the job id as a string.
 * A job without a next tick has the {@code nextTick} field stored as null.
 */
public class MongoMetadataStore extends AbstractMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(MongoMetadataStore.class);

    public static final String DEFAULT_COLLECTION = "tick4j_jobs";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoMetadataStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, DEFAULT_COLLECTION);
    }

    public MongoMetadataStore(MongoTemplate mongoTemplate, String collection) {
        super();
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = validateCollectionName(collection);
    }

    public MongoMetadataStore(MongoTemplate mongoTemplate, String collection, Executor executor) {
        super(executor);
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = validateCollectionName(collection);
    }

    public String collection() {
        return collection;
    }

    @Override
    protected void doInit() {
        if (!mongoTemplate.collectionExists(collection)) {
            mongoTemplate.createCollection(collection);
            log.info("tick4j created mongo collection={}", collection);
        }
    }

    @Override
    protected Optional<JobStoredData> doGet(UUID id) {
        JobDataDocument doc = mongoTemplate.findById(id.toString(), JobDataDocument.class, collection);
        return Optional.ofNullable(doc).map(MongoMetadataStore::toStoredData);
    }

    @Override
    protected void doAddOrUpdate(JobStoredData data) {
        mongoTemplate.save(toDocument(data), collection);
    }

    @Override
    protected void doDelete(UUID id) {
        long deleted = mongoTemplate.remove(byId(id), JobDataDocument.class, collection).getDeletedCount();
        log.debug("tick4j mongo delete id={} deleted={}", id, deleted);
    }

    @Override
    protected List<JobAndNextTick> doListNextTicks(Instant now) {
        Query q = new Query(Criteria.where("nextTick").gt(Instant.EPOCH).lt(now));
        q.with(Sort.by(Sort.Order.asc("nextTick")));

        List<JobDataDocument> docs = mongoTemplate.find(q, JobDataDocument.class, collection);
        List<JobAndNextTick> result = new ArrayList<>(docs.size());
        for (JobDataDocument d : docs) {
            result.add(toStoredData(d).toJobAndNextTick());
        }
        return result;
    }

    @Override
    protected boolean doSetNextAndLastTick(UUID id, Instant nextTick, Instant lastTick) {
        Update u = new Update()
                .set("lastUpdated", truncate(Instant.now()))
                .set("nextTick", truncate(nextTick))
                .set("lastTick", truncate(lastTick));

        UpdateResult r = mongoTemplate.updateFirst(byId(id), u, JobDataDocument.class, collection);
        return r.getMatchedCount() > 0;
    }

    @Override
    protected Optional<Instant> doFindNextTickAfter(Instant now) {
        Query q = new Query(Criteria.where("nextTick").gt(now));
        q.with(Sort.by(Sort.Order.asc("nextTick")));
        q.limit(1);
        q.fields().include("nextTick");

        JobDataDocument doc = mongoTemplate.findOne(q, JobDataDocument.class, collection);
        return Optional.ofNullable(doc).map(JobDataDocument::getNextTick);
    }

    static JobDataDocument toDocument(JobStoredData data) {
        JobDataDocument doc = new JobDataDocument();
        doc.setId(data.id().toString());
        doc.setLastUpdated(data.lastUpdated());
        doc.setLastTick(data.lastTick());
        doc.setNextTick(data.nextTick());
        doc.setJobType(data.jobType());
        doc.setCount(data.count());
        doc.setRan(data.ran());
        doc.setStopped(data.stopped());
        doc.setSchedule(data.schedule());
        doc.setRepeating(data.repeating());
        doc.setRepeatedEvery(data.repeatedEverySeconds());
        doc.setExtra(data.extra());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobStoredData)}.
     */
    static JobStoredData toStoredData(JobDataDocument doc) {
        return new JobStoredData(
                UUID.fromString(doc.getId()),
                doc.getLastUpdated(),
                doc.getLastTick(),
                doc.getNextTick(),
                doc.getJobType(),
                doc.getCount(),
                doc.isRan(),
                doc.isStopped(),
                doc.getSchedule(),
                doc.getRepeating(),
                doc.getRepeatedEvery(),
                doc.getExtra()
        );
    }

    private static Query byId(UUID id) {
        return new Query(Criteria.where("_id").is(id.toString()));
    }

    private static Instant truncate(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.SECONDS);
    }

    static String validateCollectionName(String collection) {
        Objects.requireNonNull(collection, "collection must not be null");
        if (collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be blank");
        }
        if (collection.contains("$") || collection.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("collection must not contain '$' or null characters: " + collection);
        }
        if (collection.startsWith("system.")) {
            throw new IllegalArgumentException("collection must not use the reserved 'system.' prefix: " + collection);
        }
        return collection;
    }
}
