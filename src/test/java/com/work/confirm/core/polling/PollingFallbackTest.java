package com.work.confirm.core.polling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.confirm.core.chain.SignatureStatus;
import com.work.confirm.core.chain.SolanaRpcClient;
import com.work.confirm.core.config.PollingConfig;
import com.work.confirm.core.exception.RpcCallException;
import com.work.confirm.core.model.Commitment;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class PollingFallbackTest {

    private static final String SIG = "sig1";

    private final SolanaRpcClient rpc = mock(SolanaRpcClient.class);
    private final PollingFallback fallback = new PollingFallback(rpc, new PollingConfig(3, Duration.ZERO));

    @Test
    public void confirms_once_commitment_is_reached() {
        when(rpc.getSignatureStatus(SIG))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(new SignatureStatus(10, 1L, null, "confirmed")));

        PollingResult r = fallback.poll(SIG, Commitment.CONFIRMED);

        assertEquals(PollingResult.Outcome.CONFIRMED, r.getOutcome());
        assertEquals(2, r.getAttempts());
        verify(rpc, times(2)).getSignatureStatus(SIG);
    }

    @Test
    public void stops_early_on_on_chain_error() throws IOException {
        when(rpc.getSignatureStatus(SIG)).thenReturn(Optional.of(new SignatureStatus(10, 0L,
                new ObjectMapper().readTree("{\"InstructionError\":[0,\"InvalidAccountData\"]}"), "processed")));

        PollingResult r = fallback.poll(SIG, Commitment.FINALIZED);

        assertEquals(PollingResult.Outcome.FAILED, r.getOutcome());
        assertTrue(r.getDetail().contains("InvalidAccountData"));
        verify(rpc, times(1)).getSignatureStatus(SIG);
    }

    @Test
    public void lower_commitment_is_not_enough() {
        when(rpc.getSignatureStatus(SIG)).thenReturn(Optional.of(new SignatureStatus(10, 1L, null, "confirmed")));

        PollingResult r = fallback.poll(SIG, Commitment.FINALIZED);

        assertEquals(PollingResult.Outcome.NOT_REACHED, r.getOutcome());
        assertEquals(3, r.getAttempts());
        verify(rpc, times(3)).getSignatureStatus(SIG);
    }

    @Test
    public void higher_commitment_satisfies_lower_request() {
        when(rpc.getSignatureStatus(SIG)).thenReturn(Optional.of(new SignatureStatus(10, null, null, "finalized")));

        assertTrue(fallback.confirmViaPolling(SIG, Commitment.PROCESSED));
    }

    @Test
    public void legacy_status_without_confirmation_status_uses_confirmations() {
        when(rpc.getSignatureStatus(SIG)).thenReturn(Optional.of(new SignatureStatus(10, null, null, null)));

        assertEquals(PollingResult.Outcome.CONFIRMED, fallback.poll(SIG, Commitment.FINALIZED).getOutcome());
    }

    @Test
    public void transient_error_is_retried_within_bound() {
        when(rpc.getSignatureStatus(SIG))
                .thenThrow(new RpcCallException("getSignatureStatuses transport failed", new IOException("reset")))
                .thenReturn(Optional.of(new SignatureStatus(10, 1L, null, "confirmed")));

        assertEquals(PollingResult.Outcome.CONFIRMED, fallback.poll(SIG, Commitment.CONFIRMED).getOutcome());
    }

    @Test
    public void error_on_last_attempt_is_reported_as_error() {
        when(rpc.getSignatureStatus(SIG)).thenThrow(new RpcCallException("Node is behind", -32005));

        PollingResult r = fallback.poll(SIG, Commitment.CONFIRMED);

        assertEquals(PollingResult.Outcome.ERROR, r.getOutcome());
        assertEquals("Node is behind", r.getDetail());
        assertFalse(fallback.confirmViaPolling(SIG, Commitment.CONFIRMED));
    }

    @Test
    public void never_seen_signature_is_not_reached() {
        when(rpc.getSignatureStatus(SIG)).thenReturn(Optional.empty());

        assertEquals(PollingResult.Outcome.NOT_REACHED, fallback.poll(SIG, Commitment.PROCESSED).getOutcome());
    }
}
