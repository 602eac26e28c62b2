package com.umitunal.qrunner.storage;

import com.umitunal.qrunner.config.StorageConfig;
import com.umitunal.qrunner.core.JobRecordOrderBy;
import com.umitunal.qrunner.core.JobStatus;
import com.umitunal.qrunner.core.JobStore;
import com.umitunal.qrunner.core.JobStoreException;
import com.umitunal.qrunner.core.JobStoreTransaction;
import com.umitunal.qrunner.model.JobRecord;
import com.umitunal.qrunner.model.JobRecordSerializer;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * RocksDB-backed job store.
 *
 * Records are keyed by their id (8 bytes, big-endian) so iteration order is id order.
 * Transactions are RocksDB optimistic transactions; a commit that conflicts with a
 * concurrent write to the same record fails with a {@link JobStoreException}.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    private final OptimisticTransactionDB transactionDB;
    private final JobRecordSerializer serializer = new JobRecordSerializer();
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final AtomicLong sequence;

    public RocksJobStore(StorageConfig config) throws JobStoreException {
        Objects.requireNonNull(config, "config");
        RocksDB.loadLibrary();

        this.blockCache = new LRUCache((long) config.getBlockCacheSizeMB() * 1024 * 1024);
        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setCacheIndexAndFilterBlocks(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getWriteBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxWriteBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());
        } catch (RocksDBException e) {
            dbOptions.close();
            blockCache.close();
            throw new JobStoreException("Failed to open job store at " + config.getDataDirectory(), e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);
        this.readOpts = new ReadOptions()
                .setFillCache(false);

        this.sequence = new AtomicLong(lastId());
        log.debug("Opened job store at {} (last id {})", config.getDataDirectory(), sequence.get());
    }

    @Override
    public JobStoreTransaction beginTransaction() {
        return new RocksTransaction(transactionDB.beginTransaction(writeOpts, txnOpts));
    }

    @Override
    public void saveJob(JobRecord record, JobStoreTransaction tx) throws JobStoreException {
        Objects.requireNonNull(record, "record");
        RocksTransaction txn = unwrap(tx);

        if (record.getId() == null) {
            record.setId(sequence.incrementAndGet());
        }
        byte[] key = JobRecordSerializer.createStorageKey(record.getId());
        byte[] value = serializer.serialize(record);

        try {
            if (txn != null) {
                txn.txn.put(key, value);
            } else {
                transactionDB.put(writeOpts, key, value);
            }
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to save job " + record.getId(), e);
        }
    }

    @Override
    public JobRecord getJob(long id, JobStoreTransaction tx) throws JobStoreException {
        RocksTransaction txn = unwrap(tx);
        byte[] key = JobRecordSerializer.createStorageKey(id);

        try {
            byte[] value = txn != null ? txn.txn.get(readOpts, key) : transactionDB.get(readOpts, key);
            return value == null ? null : serializer.deserialize(value);
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to read job " + id, e);
        }
    }

    @Override
    public List<JobRecord> getJobs(Collection<Long> ids, JobStoreTransaction tx) throws JobStoreException {
        Objects.requireNonNull(ids, "ids");
        List<JobRecord> records = new ArrayList<>();
        for (Long id : new TreeSet<>(ids)) {
            JobRecord record = getJob(id, tx);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    @Override
    public List<JobRecord> getJobs(JobStatus status, int maxCount, Instant before, JobStoreTransaction tx)
            throws JobStoreException {
        return JobQueries.oldestFirst(scan(unwrap(tx), JobQueries.queuedBy(status, before)), maxCount);
    }

    @Override
    public List<JobRecord> getJobs(String likeName, JobStatus status, String scheduleName,
                                   JobRecordOrderBy orderBy, boolean descending, int page, int pageSize,
                                   JobStoreTransaction tx) throws JobStoreException {
        List<JobRecord> matching = scan(unwrap(tx), JobQueries.filter(likeName, status, scheduleName));
        return JobQueries.page(matching, orderBy, descending, page, pageSize);
    }

    @Override
    public long getJobCount(String likeName, JobStatus status, String scheduleName, JobStoreTransaction tx)
            throws JobStoreException {
        return scan(unwrap(tx), JobQueries.filter(likeName, status, scheduleName)).size();
    }

    @Override
    public List<JobRecord> getLatestScheduledJobs(Collection<String> scheduleNames, JobStoreTransaction tx)
            throws JobStoreException {
        Objects.requireNonNull(scheduleNames, "scheduleNames");
        if (scheduleNames.isEmpty()) {
            return List.of();
        }
        return JobQueries.latestPerScheduleAndType(scan(unwrap(tx), JobQueries.inSchedules(scheduleNames)));
    }

    @Override
    public void deleteJob(long id, JobStoreTransaction tx) throws JobStoreException {
        RocksTransaction txn = unwrap(tx);
        byte[] key = JobRecordSerializer.createStorageKey(id);

        try {
            if (txn != null) {
                txn.txn.delete(key);
            } else {
                transactionDB.delete(writeOpts, key);
            }
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to delete job " + id, e);
        }
    }

    @Override
    public void deleteAllJobs(JobStoreTransaction tx) throws JobStoreException {
        delete(unwrap(tx), record -> true);
    }

    @Override
    public long deleteJobs(Instant olderThan, JobStoreTransaction tx) throws JobStoreException {
        return delete(unwrap(tx), JobQueries.purgeable(olderThan));
    }

    @Override
    public void close() {
        if (readOpts != null) {
            readOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        if (blockCache != null) {
            blockCache.close();
        }
    }

    private long lastId() {
        try (RocksIterator iter = transactionDB.newIterator(readOpts)) {
            iter.seekToLast();
            return iter.isValid() ? JobRecordSerializer.idFromStorageKey(iter.key()) : 0L;
        }
    }

    private List<JobRecord> scan(RocksTransaction txn, Predicate<JobRecord> predicate) {
        List<JobRecord> matching = new ArrayList<>();

        try (RocksIterator iter = txn != null ? txn.txn.getIterator(readOpts) : transactionDB.newIterator(readOpts)) {
            iter.seekToFirst();

            while (iter.isValid()) {
                JobRecord record = serializer.deserialize(iter.value());
                if (predicate.test(record)) {
                    matching.add(record);
                }
                iter.next();
            }
        }

        return matching;
    }

    private long delete(RocksTransaction txn, Predicate<JobRecord> predicate) throws JobStoreException {
        List<JobRecord> doomed = scan(txn, predicate);
        if (doomed.isEmpty()) {
            return 0;
        }

        try {
            if (txn != null) {
                for (JobRecord record : doomed) {
                    txn.txn.delete(JobRecordSerializer.createStorageKey(record.getId()));
                }
            } else {
                try (WriteBatch batch = new WriteBatch()) {
                    for (JobRecord record : doomed) {
                        batch.delete(JobRecordSerializer.createStorageKey(record.getId()));
                    }
                    transactionDB.write(writeOpts, batch);
                }
            }
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to delete " + doomed.size() + " jobs", e);
        }

        return doomed.size();
    }

    private RocksTransaction unwrap(JobStoreTransaction tx) throws JobStoreException {
        if (tx == null) {
            return null;
        }
        if (!(tx instanceof RocksTransaction) || ((RocksTransaction) tx).owner() != this) {
            throw new IllegalArgumentException("Transaction does not belong to this store.");
        }
        RocksTransaction txn = (RocksTransaction) tx;
        if (txn.isCompleted()) {
            throw new JobStoreException("Transaction has already been committed or rolled back.");
        }
        return txn;
    }

    private final class RocksTransaction implements JobStoreTransaction {
        private final Transaction txn;
        private boolean completed;

        private RocksTransaction(Transaction txn) {
            this.txn = txn;
        }

        private RocksJobStore owner() {
            return RocksJobStore.this;
        }

        @Override
        public void commit() throws JobStoreException {
            complete();
            try {
                txn.commit();
            } catch (RocksDBException e) {
                throw new JobStoreException("Failed to commit job store transaction", e);
            } finally {
                txn.close();
            }
        }

        @Override
        public void rollback() throws JobStoreException {
            complete();
            try {
                txn.rollback();
            } catch (RocksDBException e) {
                throw new JobStoreException("Failed to roll back job store transaction", e);
            } finally {
                txn.close();
            }
        }

        @Override
        public boolean isCompleted() {
            return completed;
        }

        private void complete() throws JobStoreException {
            if (completed) {
                throw new JobStoreException("Transaction has already been committed or rolled back.");
            }
            completed = true;
        }
    }
}
