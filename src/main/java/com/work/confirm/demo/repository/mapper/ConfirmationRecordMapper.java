package com.work.confirm.demo.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.confirm.demo.repository.entity.ConfirmationRecordEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * confirmation_records 表 Mapper，建表语句见 resources/db/confirmation_records.sql。
 */
public interface ConfirmationRecordMapper extends BaseMapper<ConfirmationRecordEntity> {

    @Select("SELECT seq, signature, commitment, status, path, detail, elapsed_millis, completed_at " +
            "FROM confirmation_records " +
            "ORDER BY seq DESC " +
            "LIMIT #{limit}")
    List<ConfirmationRecordEntity> listRecent(@Param("limit") int limit);

    @Select("SELECT seq, signature, commitment, status, path, detail, elapsed_millis, completed_at " +
            "FROM confirmation_records " +
            "WHERE signature = #{signature} " +
            "ORDER BY seq DESC " +
            "LIMIT 1")
    ConfirmationRecordEntity findLatest(@Param("signature") String signature);
}
