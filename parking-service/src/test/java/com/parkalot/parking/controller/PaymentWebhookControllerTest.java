package com.parkalot.parking.controller;

import com.parkalot.common.response.ApiResponse;
import com.parkalot.parking.webhook.WebhookReconciler;
import com.parkalot.parking.webhook.WebhookReconciler.WebhookResult;
import com.parkalot.parking.webhook.WebhookSignatureException;
import com.parkalot.parking.webhook.WebhookSignatureException.Reason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentWebhookControllerTest {

    @Mock
    private WebhookReconciler webhookReconciler;

    @InjectMocks
    private PaymentWebhookController controller;

    @Test
    void receive_passesRawPayloadAndHeader() {
        when(webhookReconciler.handle("{\"id\":\"evt_1\"}", "t=1,v1=abc"))
                .thenReturn(new WebhookResult("payment_intent.succeeded", false));

        ResponseEntity<ApiResponse<WebhookResult>> response = controller.receive("{\"id\":\"evt_1\"}", "t=1,v1=abc");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(response.getBody().getData().type()).isEqualTo("payment_intent.succeeded");
        assertThat(response.getBody().getData().duplicate()).isFalse();
    }

    @Test
    void receive_rejectedSignature_propagates() {
        when(webhookReconciler.handle("{}", null)).thenThrow(new WebhookSignatureException(Reason.INVALID_SIGNATURE));

        assertThatThrownBy(() -> controller.receive("{}", null))
                .isInstanceOf(WebhookSignatureException.class);
    }
}
