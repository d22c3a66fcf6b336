package com.work.confirm.demo.web;

import com.work.confirm.core.ConfirmationEngine;
import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.record.ConfirmationRecord;
import com.work.confirm.demo.service.TradeConfirmationService;
import com.work.confirm.demo.web.dto.ChannelStatusView;
import com.work.confirm.demo.web.dto.ConfirmRequest;
import com.work.confirm.demo.web.dto.ConfirmationView;
import com.work.confirm.demo.web.dto.TradeConfirmationView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 确认组件的最小 REST API：对已广播的签名发起确认、查询最近的确认记录与 push 通道状态。
 */
@RestController
@RequestMapping("/api/v1/confirmations")
public class ConfirmationController {

    private final TradeConfirmationService confirmationService;
    private final ConfirmationEngine engine;

    public ConfirmationController(TradeConfirmationService confirmationService, ConfirmationEngine engine) {
        this.confirmationService = confirmationService;
        this.engine = engine;
    }

    /**
     * 同步等待确认结果，最长阻塞 timeoutSeconds + polling 界限。
     */
    @PostMapping("/{signature}")
    public ResponseEntity<TradeConfirmationView> confirm(@PathVariable String signature,
                                                         @Validated @RequestBody(required = false) ConfirmRequest request) {
        Commitment commitment = null;
        Duration timeout = null;
        if (request != null) {
            if (request.getCommitment() != null) {
                commitment = Commitment.parse(request.getCommitment());
            }
            if (request.getTimeoutSeconds() != null) {
                timeout = Duration.ofSeconds(request.getTimeoutSeconds());
            }
        }
        return ResponseEntity.ok(TradeConfirmationView.from(
                confirmationService.confirmSignature(signature, commitment, timeout)));
    }

    @GetMapping
    public ResponseEntity<List<ConfirmationView>> list(@RequestParam(value = "limit", required = false) Integer limit) {
        int l = limit == null ? 50 : Math.min(Math.max(limit, 1), 500);
        List<ConfirmationRecord> rows = confirmationService.recentRecords(l);
        List<ConfirmationView> out = new ArrayList<>(rows.size());
        for (ConfirmationRecord r : rows) {
            ConfirmationView v = new ConfirmationView();
            v.setSeq(r.getSeq());
            v.setSignature(r.getSignature());
            v.setCommitment(r.getCommitment().getWireValue());
            v.setStatus(r.getStatus().name());
            v.setPath(r.getPath().name());
            v.setDetail(r.getDetail());
            v.setElapsedMillis(r.getElapsedMillis());
            v.setCompletedAt(r.getCompletedAt());
            out.add(v);
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/channel")
    public ResponseEntity<ChannelStatusView> channel() {
        ChannelStatusView v = new ChannelStatusView();
        v.setPushAvailable(engine.isPushAvailable());
        v.setConnectionState(engine.getConnectionState().name());
        v.setDegraded(engine.isPushDegraded());
        v.setPendingSubscriptions(engine.getPendingSubscriptions());
        return ResponseEntity.ok(v);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleInvalidArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }
}
