package com.parkalot.parking.jooq;

import com.parkalot.parking.domain.PaymentStatus;
import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

import static com.parkalot.parking.jooq.ParkingTables.Payments;
import static org.jooq.impl.DSL.coalesce;
import static org.jooq.impl.DSL.count;
import static org.jooq.impl.DSL.inline;
import static org.jooq.impl.DSL.sum;
import static org.jooq.impl.DSL.when;

@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PaymentJooqRepository {

    private static final String SUCCEEDED = PaymentStatus.SUCCEEDED.getCode();
    private static final String FAILED = PaymentStatus.FAILED.getCode();
    private static final String REFUNDED = PaymentStatus.REFUNDED.getCode();
    private static final String PARTIAL_REFUND = PaymentStatus.PARTIAL_REFUND.getCode();

    private final DSLContext dsl;

    /**
     * Spent counts succeeded payments only; refunded sums every recorded refund.
     */
    public PaymentStats getUserStats(Long userId) {
        var row = dsl.select(
                        count(),
                        coalesce(sum(when(Payments.STATUS.eq(SUCCEEDED), Payments.AMOUNT)
                                .otherwise(inline(BigDecimal.ZERO))), inline(BigDecimal.ZERO)),
                        coalesce(sum(when(Payments.STATUS.in(REFUNDED, PARTIAL_REFUND), Payments.REFUND_AMOUNT)
                                .otherwise(inline(BigDecimal.ZERO))), inline(BigDecimal.ZERO)),
                        count().filterWhere(Payments.STATUS.eq(SUCCEEDED)),
                        count().filterWhere(Payments.STATUS.eq(FAILED)))
                .from(Payments.TABLE)
                .where(Payments.USER_ID.eq(userId))
                .fetchOne();

        return new PaymentStats(row.value1(), row.value2(), row.value3(), row.value4(), row.value5());
    }

    public record PaymentStats(int totalPayments, BigDecimal totalSpent, BigDecimal totalRefunded,
                               int successfulPayments, int failedPayments) {
    }
}
