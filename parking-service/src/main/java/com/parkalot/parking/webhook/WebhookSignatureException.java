package com.parkalot.parking.webhook;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import lombok.Getter;

/**
 * Rejected webhook delivery. The reason is for logs only; callers see a generic message.
 */
@Getter
public class WebhookSignatureException extends BusinessException {

    public enum Reason {
        INVALID_SIGNATURE,
        EXPIRED
    }

    private final Reason reason;

    public WebhookSignatureException(Reason reason) {
        super(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        this.reason = reason;
    }
}
