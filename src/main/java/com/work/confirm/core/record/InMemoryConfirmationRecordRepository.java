package com.work.confirm.core.record;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;
import static com.work.confirm.core.support.ValidationUtils.requirePositive;

/**
 * 纯内存实现（Caffeine 有界 + 过期），方便在没有 Postgres 的环境下运行。
 * 注意：该实现不具备跨进程一致性，重启即丢失。
 */
public class InMemoryConfirmationRecordRepository implements ConfirmationRecordRepository {

    private final Cache<Long, ConfirmationRecord> records;
    private final AtomicLong seqGenerator = new AtomicLong(0);

    public InMemoryConfirmationRecordRepository(long maximumSize, Duration retention) {
        requirePositive(retention, "retention");
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize 必须大于0");
        }
        this.records = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(retention)
                .build();
    }

    @Override
    public ConfirmationRecord save(ConfirmationRecord record) {
        requireNonNull(record, "record");
        ConfirmationRecord stored = record.withSeq(seqGenerator.incrementAndGet());
        records.put(stored.getSeq(), stored);
        return stored;
    }

    @Override
    public List<ConfirmationRecord> listRecent(int limit) {
        List<ConfirmationRecord> all = new ArrayList<>(records.asMap().values());
        all.sort(Comparator.comparing(ConfirmationRecord::getSeq).reversed());
        int n = Math.max(0, Math.min(limit, all.size()));
        return new ArrayList<>(all.subList(0, n));
    }

    @Override
    public Optional<ConfirmationRecord> findLatest(String signature) {
        return records.asMap().values().stream()
                .filter(r -> r.getSignature() != null && r.getSignature().equals(signature))
                .max(Comparator.comparing(ConfirmationRecord::getSeq));
    }
}
