package io.tick4j.internal.mongo;

import io.tick4j.core.JobType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted job metadata. One document per job, keyed by the job id.
 */
@Document
public class JobDataDocument {

    @Id
    private String id;

    private Instant lastUpdated;
    private Instant lastTick;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextTick;

    private JobType jobType;
    private long count;
    private boolean ran;
    private boolean stopped;

    private String schedule;
    private Boolean repeating;
    private Long repeatedEvery;

    private byte[] extra;

    public JobDataDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public Instant getLastTick() {
        return lastTick;
    }

    public void setLastTick(Instant lastTick) {
        this.lastTick = lastTick;
    }

    public Instant getNextTick() {
        return nextTick;
    }

    public void setNextTick(Instant nextTick) {
        this.nextTick = nextTick;
    }

    public JobType getJobType() {
        return jobType;
    }

    public void setJobType(JobType jobType) {
        this.jobType = jobType;
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public boolean isRan() {
        return ran;
    }

    public void setRan(boolean ran) {
        this.ran = ran;
    }

    public boolean isStopped() {
        return stopped;
    }

    public void setStopped(boolean stopped) {
        this.stopped = stopped;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public Boolean getRepeating() {
        return repeating;
    }

    public void setRepeating(Boolean repeating) {
        this.repeating = repeating;
    }

    public Long getRepeatedEvery() {
        return repeatedEvery;
    }

    public void setRepeatedEvery(Long repeatedEvery) {
        this.repeatedEvery = repeatedEvery;
    }

    public byte[] getExtra() {
        return extra;
    }

    public void setExtra(byte[] extra) {
        this.extra = extra;
    }
}
