package com.work.confirm.demo.service;

import com.work.confirm.core.ConfirmationEngine;
import com.work.confirm.core.exception.ConfirmException;
import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.model.ConfirmationResult;
import com.work.confirm.core.record.ConfirmationRecord;
import com.work.confirm.core.record.ConfirmationRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;

/**
 * 示例业务服务：交易广播后拿签名调用确认引擎，并把终态翻译成面向用户的结论。
 */
@Service
public class TradeConfirmationService {

    private static final Logger log = LoggerFactory.getLogger(TradeConfirmationService.class);

    static final String SUMMARY_CONFIRMED = "Transaction confirmed";
    static final String SUMMARY_FAILED = "Transaction failed on chain";
    static final String SUMMARY_UNKNOWN = "Could not confirm the transaction in time, it may still land; check the signature later";

    private final ConfirmationEngine engine;
    private final ConfirmationRecordRepository records;

    public TradeConfirmationService(ConfirmationEngine engine, ConfirmationRecordRepository records) {
        this.engine = engine;
        this.records = records;
    }

    /**
     * 最常见的“提交-确认”闭环。提交失败直接抛出，交易未上链时不做确认。
     *
     * @param commitment 为 null 时使用默认等级
     * @param timeout    为 null 时使用默认超时
     */
    public TradeConfirmation submitAndConfirm(TransactionSubmitter submitter, Commitment commitment, Duration timeout) {
        requireNonNull(submitter, "submitter");
        String signature;
        try {
            signature = submitter.submit();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfirmException("transaction submit failed", e);
        }
        log.info("Transaction submitted, awaiting confirmation. signature={}", signature);
        return confirmSignature(signature, commitment, timeout);
    }

    public TradeConfirmation confirmSignature(String signature, Commitment commitment, Duration timeout) {
        Commitment c = commitment == null ? engine.getConfig().getDefaultCommitment() : commitment;
        Duration t = timeout == null ? engine.getConfig().getDefaultTimeout() : timeout;
        ConfirmationResult result = engine.confirm(signature, c, t);
        return new TradeConfirmation(result.getSignature(), result.getStatus(), result.getPath(),
                summarize(result, c), result.getDetail(), result.getElapsed().toMillis());
    }

    public List<ConfirmationRecord> recentRecords(int limit) {
        return records.listRecent(limit);
    }

    static String summarize(ConfirmationResult result, Commitment commitment) {
        switch (result.getStatus()) {
            case CONFIRMED:
                return SUMMARY_CONFIRMED + " (" + commitment.getWireValue() + ")";
            case FAILED:
                return SUMMARY_FAILED;
            default:
                // 超时、订阅失败、传输错误对用户是同一个结论：结果未知
                return SUMMARY_UNKNOWN;
        }
    }
}
