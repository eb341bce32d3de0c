package com.parkalot.common.exception;

import com.parkalot.common.response.ErrorCode;
import com.parkalot.common.response.ErrorType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessExceptionTest {

    @Test
    void constructor_withErrorCode_setsDefaultMessage() {
        BusinessException ex = new BusinessException(ErrorCode.SPACE_UNAVAILABLE);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.SPACE_UNAVAILABLE);
        assertThat(ex.getMessage()).isEqualTo("Space is not available for the selected times");
        assertThat(ex.getErrorCode().getType()).isEqualTo(ErrorType.CONFLICT);
    }

    @Test
    void constructor_withCustomMessage_overridesDefault() {
        BusinessException ex = new BusinessException(ErrorCode.SPACE_NOT_FOUND, "Space not found: 42");

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.SPACE_NOT_FOUND);
        assertThat(ex.getMessage()).isEqualTo("Space not found: 42");
    }
}
