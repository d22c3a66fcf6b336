package com.work.confirm.demo.config;

import com.work.confirm.core.record.ConfirmationRecordRepository;
import com.work.confirm.demo.repository.MybatisConfirmationRecordRepository;
import com.work.confirm.demo.repository.mapper.ConfirmationRecordMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * confirm.store.type=mybatis 时启用 PostgreSQL 记录存储。
 */
@Configuration
@ConditionalOnProperty(prefix = "confirm.store", name = "type", havingValue = "mybatis")
@MapperScan("com.work.confirm.demo.repository.mapper")
public class MybatisStoreConfiguration {

    @Bean
    public ConfirmationRecordRepository mybatisConfirmationRecordRepository(ConfirmationRecordMapper mapper) {
        return new MybatisConfirmationRecordRepository(mapper);
    }
}
