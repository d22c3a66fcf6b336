package com.work.confirm.demo.chain.web3j;

import com.work.confirm.core.chain.SignatureStatus;
import com.work.confirm.core.exception.RpcCallException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.web3j.protocol.ObjectMapperFactory;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class Web3jSolanaRpcClientTest {

    private static final String SIG = "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";

    private final Web3jService service = mock(Web3jService.class);
    private final Web3jSolanaRpcClient client = new Web3jSolanaRpcClient(service);

    private static SignatureStatusesResponse parse(String json) throws IOException {
        return ObjectMapperFactory.getObjectMapper().readValue(json, SignatureStatusesResponse.class);
    }

    @Test
    @SuppressWarnings("rawtypes")
    public void queries_status_with_history_search() throws Exception {
        when(service.send(any(Request.class), eq(SignatureStatusesResponse.class))).thenReturn(parse(
                "{\"jsonrpc\":\"2.0\",\"result\":{\"context\":{\"slot\":82},\"value\":[{\"slot\":72,\"confirmations\":10,"
                        + "\"err\":null,\"status\":{\"Ok\":null},\"confirmationStatus\":\"confirmed\"}]},\"id\":1}"));

        Optional<SignatureStatus> status = client.getSignatureStatus(SIG);

        assertTrue(status.isPresent());
        assertEquals(72L, status.get().getSlot());
        assertEquals(10L, status.get().getConfirmations());
        assertFalse(status.get().hasError());
        assertEquals("confirmed", status.get().getEffectiveConfirmationStatus());

        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(service).send(captor.capture(), eq(SignatureStatusesResponse.class));
        Request request = captor.getValue();
        assertEquals("getSignatureStatuses", request.getMethod());
        List<?> params = request.getParams();
        assertEquals(List.of(SIG), params.get(0));
        assertEquals(Boolean.TRUE, ((Map<?, ?>) params.get(1)).get("searchTransactionHistory"));
    }

    @Test
    public void failed_transaction_keeps_error() throws Exception {
        when(service.send(any(Request.class), eq(SignatureStatusesResponse.class))).thenReturn(parse(
                "{\"jsonrpc\":\"2.0\",\"result\":{\"context\":{\"slot\":82},\"value\":[{\"slot\":48,\"confirmations\":null,"
                        + "\"err\":{\"InstructionError\":[0,{\"Custom\":1}]},\"confirmationStatus\":\"finalized\"}]},\"id\":1}"));

        SignatureStatus status = client.getSignatureStatus(SIG).get();

        assertTrue(status.hasError());
        assertNull(status.getConfirmations());
        assertTrue(status.getErr().has("InstructionError"));
    }

    @Test
    public void unknown_signature_is_empty() throws Exception {
        when(service.send(any(Request.class), eq(SignatureStatusesResponse.class))).thenReturn(parse(
                "{\"jsonrpc\":\"2.0\",\"result\":{\"context\":{\"slot\":82},\"value\":[null]},\"id\":1}"));

        assertFalse(client.getSignatureStatus(SIG).isPresent());
    }

    @Test
    public void json_rpc_error_is_raised_with_code() throws Exception {
        when(service.send(any(Request.class), eq(SignatureStatusesResponse.class))).thenReturn(parse(
                "{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32005,\"message\":\"Node is behind by 42 slots\"},\"id\":1}"));

        RpcCallException e = assertThrows(RpcCallException.class, () -> client.getSignatureStatus(SIG));
        assertEquals(Integer.valueOf(-32005), e.getRpcCode());
        assertTrue(e.getMessage().contains("Node is behind"));
    }

    @Test
    public void transport_failure_is_retryable() throws Exception {
        when(service.send(any(Request.class), eq(SignatureStatusesResponse.class))).thenThrow(new IOException("connect timed out"));

        RpcCallException e = assertThrows(RpcCallException.class, () -> client.getSignatureStatus(SIG));
        assertTrue(e.isRetryable());
        assertNull(e.getRpcCode());
    }
}
