package com.work.confirm.demo.repository;

import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.ConfirmationPath;
import com.work.confirm.core.model.ConfirmationStatus;
import com.work.confirm.core.record.ConfirmationRecord;
import com.work.confirm.core.record.ConfirmationRecordRepository;
import com.work.confirm.demo.repository.entity.ConfirmationRecordEntity;
import com.work.confirm.demo.repository.mapper.ConfirmationRecordMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.confirm.core.support.ValidationUtils.requireNonEmpty;
import static com.work.confirm.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的确认记录存储，seq 由数据库自增列分配。
 */
public class MybatisConfirmationRecordRepository implements ConfirmationRecordRepository {

    private final ConfirmationRecordMapper mapper;

    public MybatisConfirmationRecordRepository(ConfirmationRecordMapper mapper) {
        this.mapper = requireNonNull(mapper, "mapper");
    }

    @Override
    public ConfirmationRecord save(ConfirmationRecord record) {
        requireNonNull(record, "record");
        ConfirmationRecordEntity entity = toEntity(record);
        mapper.insert(entity);
        return entity.getSeq() == null ? record : record.withSeq(entity.getSeq());
    }

    @Override
    public List<ConfirmationRecord> listRecent(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        List<ConfirmationRecordEntity> rows = mapper.listRecent(limit);
        List<ConfirmationRecord> out = new ArrayList<>(rows.size());
        for (ConfirmationRecordEntity r : rows) {
            out.add(toRecord(r));
        }
        return out;
    }

    @Override
    public Optional<ConfirmationRecord> findLatest(String signature) {
        requireNonEmpty(signature, "signature");
        return Optional.ofNullable(mapper.findLatest(signature)).map(MybatisConfirmationRecordRepository::toRecord);
    }

    private static ConfirmationRecordEntity toEntity(ConfirmationRecord record) {
        ConfirmationRecordEntity e = new ConfirmationRecordEntity();
        e.setSignature(record.getSignature());
        e.setCommitment(record.getCommitment().getWireValue());
        e.setStatus(record.getStatus().name());
        e.setPath(record.getPath().name());
        e.setDetail(record.getDetail());
        e.setElapsedMillis(record.getElapsedMillis());
        e.setCompletedAt(record.getCompletedAt());
        return e;
    }

    private static ConfirmationRecord toRecord(ConfirmationRecordEntity e) {
        return new ConfirmationRecord(
                e.getSeq(),
                e.getSignature(),
                Commitment.parse(e.getCommitment()),
                ConfirmationStatus.valueOf(e.getStatus()),
                ConfirmationPath.valueOf(e.getPath()),
                e.getDetail(),
                e.getElapsedMillis() == null ? 0L : e.getElapsedMillis(),
                e.getCompletedAt());
    }
}
