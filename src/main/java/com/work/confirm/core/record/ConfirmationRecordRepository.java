package com.work.confirm.core.record;

import java.util.List;
import java.util.Optional;

/**
 * 确认记录存储端口。实现方负责分配单调递增的 seq。
 */
public interface ConfirmationRecordRepository {

    ConfirmationRecord save(ConfirmationRecord record);

    /**
     * 最近的记录，按 seq 倒序。
     */
    List<ConfirmationRecord> listRecent(int limit);

    /**
     * 某签名最近一次的确认记录。
     */
    Optional<ConfirmationRecord> findLatest(String signature);
}
