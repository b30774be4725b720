package io.tick4j.config;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the tick4j job collection.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically unless
 * {@code tick4j.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_next_tick</b>: { nextTick: 1 }
 *       <br/>Used when listing due jobs and when looking up the nearest next tick.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.tick4j_jobs.createIndex({ nextTick: 1 }, { name: "idx_next_tick" });
 * </pre>
 */
public class Tick4jMongoIndexConfig {

    public static final String IDX_NEXT_TICK = "idx_next_tick";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public Tick4jMongoIndexConfig(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
    }

    /**
     * Manually ensure required indexes.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(collection).ensureIndex(nextTickIndex());
    }

    /**
     * Keys: nextTick ASC
     */
    public static Index nextTickIndex() {
        return new Index()
                .on("nextTick", Sort.Direction.ASC)
                .named(IDX_NEXT_TICK);
    }
}
