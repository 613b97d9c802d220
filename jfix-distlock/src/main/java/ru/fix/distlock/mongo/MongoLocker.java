package ru.fix.distlock.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.NotNull;
import ru.fix.distlock.AbstractLocker;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockException;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockTransportException;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.lt;
import static com.mongodb.client.model.Filters.or;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.set;

/**
 * One document per lock, {@code _id} is the lock name.
 * <p>
 * Acquisition inserts the document and, on duplicate key, takes it over only when it is
 * expired or already belongs to this owner. The collection and its indexes are managed outside.
 */
public class MongoLocker extends AbstractLocker {

    static final String ID = "_id";
    static final String OWNER_ID = "ownerId";
    static final String EXPIRED_AT = "expiredAt";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    private final MongoCollection<Document> collection;

    public MongoLocker(@NotNull MongoCollection<Document> collection, @NotNull LockConfig config) {
        super(config);
        this.collection = Objects.requireNonNull(collection, "collection");
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        Instant now = config.getClock().instant();
        Date expiredAt = Date.from(now.plus(config.getTimeout()));
        try {
            collection.insertOne(new Document(ID, config.getLockName())
                    .append(OWNER_ID, config.getOwnerId())
                    .append(EXPIRED_AT, expiredAt)
                    .append(CREATED_AT, Date.from(now))
                    .append(UPDATED_AT, Date.from(now)));
            return;
        } catch (MongoWriteException e) {
            if (ErrorCategory.fromErrorCode(e.getError().getCode()) != ErrorCategory.DUPLICATE_KEY) {
                throw transportFailure("insert", e);
            }
            logger.debug("Document {} already exists", config.getLockName());
        } catch (MongoException e) {
            throw transportFailure("insert", e);
        }

        Document previous;
        try {
            previous = collection.findOneAndUpdate(
                    and(eq(ID, config.getLockName()),
                            or(lt(EXPIRED_AT, Date.from(now)), eq(OWNER_ID, config.getOwnerId()))),
                    combine(set(OWNER_ID, config.getOwnerId()),
                            set(EXPIRED_AT, expiredAt),
                            set(UPDATED_AT, Date.from(now))),
                    new FindOneAndUpdateOptions()
                            .returnDocument(ReturnDocument.BEFORE)
                            .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (MongoException e) {
            throw transportFailure("take over", e);
        }

        if (previous != null) {
            String previousOwner = previous.getString(OWNER_ID);
            if (!config.getOwnerId().equals(previousOwner)) {
                logger.info("Expired lock reclaimed lockName={} previousOwner={} ownerId={}",
                        config.getLockName(), previousOwner, config.getOwnerId());
            }
            return;
        }

        String currentOwner;
        try {
            Document current = collection.find(eq(ID, config.getLockName()))
                    .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .first();
            currentOwner = current != null ? current.getString(OWNER_ID) : null;
        } catch (MongoException e) {
            logger.debug("Failed to read holder of lockName={}", config.getLockName(), e);
            currentOwner = null;
        }
        throw new LockAcquisitionConflictException(config.getLockName(), currentOwner);
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        Instant now = config.getClock().instant();
        UpdateResult result;
        try {
            result = collection.updateOne(
                    ownFilter(),
                    combine(set(EXPIRED_AT, Date.from(now.plus(config.getTimeout()))),
                            set(UPDATED_AT, Date.from(now))));
        } catch (MongoException e) {
            throw transportFailure("renew", e);
        }
        if (result.getMatchedCount() == 0) {
            throw new LockNotHeldException(config.getLockName(),
                    "Document " + config.getLockName() + " is absent or belongs to another owner");
        }
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        try {
            DeleteResult result = collection.deleteOne(ownFilter());
            if (result.getDeletedCount() > 0) {
                return;
            }
            Document current = collection.find(eq(ID, config.getLockName()))
                    .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .first();
            if (current != null) {
                throw new LockNotHeldException(config.getLockName(),
                        "Document " + config.getLockName() + " belongs to " + current.getString(OWNER_ID));
            }
            logger.debug("Document {} already removed on release", config.getLockName());
        } catch (MongoException e) {
            throw transportFailure("release", e);
        }
    }

    private Bson ownFilter() {
        return and(eq(ID, config.getLockName()), eq(OWNER_ID, config.getOwnerId()));
    }

    private LockTransportException transportFailure(String action, MongoException e) {
        return new LockTransportException(config.getLockName(),
                "Failed to " + action + " lock document " + config.getLockName() + ": " + e.getMessage(), e);
    }
}
