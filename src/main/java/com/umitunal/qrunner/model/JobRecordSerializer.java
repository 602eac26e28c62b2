package com.umitunal.qrunner.model;

import com.umitunal.qrunner.core.JobStatus;

import java.nio.ByteBuffer;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Compact binary codec for JobRecord values kept in the embedded store.
 *
 * Binary format:
 * - format version (1 byte)
 * - id (8 bytes)
 * - name, jobType, data (4 byte length + UTF-8 bytes, length -1 for null)
 * - status ordinal (4 bytes)
 * - scheduleName (length-prefixed string)
 * - tryNumber (4 bytes)
 * - queueDate, startDate, finishDate (1 byte presence flag + 8 byte epoch seconds + 4 byte nanos)
 * - exception (length-prefixed string)
 */
public class JobRecordSerializer {
    private static final byte FORMAT_VERSION = 1;
    private static final int NULL_LENGTH = -1;

    /**
     * Serialize a saved record. The record must have an id.
     */
    public byte[] serialize(JobRecord record) {
        if (record.getId() == null) {
            throw new IllegalArgumentException("Cannot serialize a record without an id");
        }

        byte[] nameBytes = bytesOf(record.getName());
        byte[] typeBytes = bytesOf(record.getJobType());
        byte[] dataBytes = bytesOf(record.getData());
        byte[] scheduleBytes = bytesOf(record.getScheduleName());
        byte[] exceptionBytes = bytesOf(record.getException());

        int totalSize = 1 +                                  // version
                        8 +                                  // id
                        sizeOf(nameBytes) +
                        sizeOf(typeBytes) +
                        sizeOf(dataBytes) +
                        4 +                                  // status
                        sizeOf(scheduleBytes) +
                        4 +                                  // tryNumber
                        3 * 13 +                             // dates
                        sizeOf(exceptionBytes);

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);
        buffer.putLong(record.getId());
        putString(buffer, nameBytes);
        putString(buffer, typeBytes);
        putString(buffer, dataBytes);
        buffer.putInt(record.getStatus().ordinal());
        putString(buffer, scheduleBytes);
        buffer.putInt(record.getTryNumber());
        putInstant(buffer, record.getQueueDate());
        putInstant(buffer, record.getStartDate());
        putInstant(buffer, record.getFinishDate());
        putString(buffer, exceptionBytes);

        return buffer.array();
    }

    public JobRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        byte version = buffer.get();
        if (version != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported job record format version: " + version);
        }

        JobRecord record = new JobRecord();
        record.setId(buffer.getLong());
        record.setName(getString(buffer));
        record.setJobType(getString(buffer));
        record.setData(getString(buffer));
        record.setStatus(JobStatus.values()[buffer.getInt()]);
        record.setScheduleName(getString(buffer));
        record.setTryNumber(buffer.getInt());

        Instant queueDate = getInstant(buffer);
        if (queueDate != null) {
            record.setQueueDate(queueDate);
        }
        record.setStartDate(getInstant(buffer));
        record.setFinishDate(getInstant(buffer));
        record.setException(getString(buffer));

        return record;
    }

    /**
     * Storage key for a record id. Big-endian, so keys iterate in id order.
     */
    public static byte[] createStorageKey(long id) {
        return ByteBuffer.allocate(8).putLong(id).array();
    }

    public static long idFromStorageKey(byte[] key) {
        return ByteBuffer.wrap(key).getLong();
    }

    private static byte[] bytesOf(String value) {
        return value != null ? value.getBytes(UTF_8) : null;
    }

    private static int sizeOf(byte[] bytes) {
        return 4 + (bytes != null ? bytes.length : 0);
    }

    private static void putString(ByteBuffer buffer, byte[] bytes) {
        if (bytes == null) {
            buffer.putInt(NULL_LENGTH);
        } else {
            buffer.putInt(bytes.length);
            buffer.put(bytes);
        }
    }

    private static String getString(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length == NULL_LENGTH) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, UTF_8);
    }

    private static void putInstant(ByteBuffer buffer, Instant instant) {
        buffer.put((byte) (instant != null ? 1 : 0));
        buffer.putLong(instant != null ? instant.getEpochSecond() : 0L);
        buffer.putInt(instant != null ? instant.getNano() : 0);
    }

    private static Instant getInstant(ByteBuffer buffer) {
        boolean present = buffer.get() == 1;
        long seconds = buffer.getLong();
        int nanos = buffer.getInt();
        return present ? Instant.ofEpochSecond(seconds, nanos) : null;
    }
}
