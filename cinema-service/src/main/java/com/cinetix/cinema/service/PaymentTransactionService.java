package com.cinetix.cinema.service;

import com.cinetix.cinema.domain.BookingStatus;
import com.cinetix.cinema.domain.Payment;
import com.cinetix.cinema.dto.request.PaymentRequest;
import com.cinetix.cinema.dto.response.PaymentResponse;
import com.cinetix.cinema.jooq.BookingJooqRepository;
import com.cinetix.cinema.repository.PaymentRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Separated from PaymentService to ensure @Transactional works
 * (avoids Spring AOP self-invocation bypass).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentTransactionService {

    private final PaymentRepository paymentRepository;
    private final BookingJooqRepository bookingJooqRepository;
    private final ConsistencyGuard consistencyGuard;
    private final SnapshotAssembler snapshotAssembler;
    private final Clock clock;

    /**
     * Tier 2 & 3: booking row lock + unique settled-booking key within one transaction.
     */
    @Transactional
    public PaymentResponse recordInTransaction(PaymentRequest request) {
        validate(request, null);

        Payment payment = Payment.builder()
                .bookingId(request.bookingId())
                .accountId(request.accountId())
                .amount(request.amount())
                .method(request.method())
                .status(request.status())
                .reference(request.reference())
                .recordedAt(LocalDateTime.now(clock))
                .build();

        // Tier 3: uk_payments_settled_booking
        Payment saved = consistencyGuard.commitUnique(
                () -> paymentRepository.saveAndFlush(payment),
                ErrorCode.ALREADY_PAID, alreadyPaidMessage(request.bookingId()));

        log.info("Payment recorded: paymentId={}, bookingId={}, status={}, amount={}",
                saved.getId(), saved.getBookingId(), saved.getStatus(), saved.getAmount());
        return snapshotAssembler.payment(saved);
    }

    @Transactional
    public PaymentResponse updateInTransaction(Long paymentId, PaymentRequest request) {
        if (!consistencyGuard.exists(EntityKind.PAYMENT, paymentId)) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                    "Payment not found: " + paymentId);
        }
        validate(request, paymentId);

        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + paymentId));
        payment.revise(request.bookingId(), request.accountId(), request.amount(),
                request.method(), request.status(), request.reference());

        Payment saved = consistencyGuard.commitUnique(
                () -> paymentRepository.saveAndFlush(payment),
                ErrorCode.ALREADY_PAID, alreadyPaidMessage(request.bookingId()));

        log.info("Payment updated: paymentId={}, bookingId={}, status={}",
                paymentId, saved.getBookingId(), saved.getStatus());
        return snapshotAssembler.payment(saved);
    }

    private void validate(PaymentRequest request, Long excludePaymentId) {
        // Tier 2: payments for one booking queue behind its row lock
        String bookingStatus = bookingJooqRepository.findStatusForUpdate(request.bookingId())
                .orElseThrow(() -> new BusinessException(ErrorCode.REFERENCE_NOT_FOUND,
                        "Referenced booking not found: " + request.bookingId()));
        consistencyGuard.requireReference(EntityKind.ACCOUNT, request.accountId());

        // amount column is numeric(12,2)
        if (request.amount().signum() <= 0 || request.amount().stripTrailingZeros().scale() > 2) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY,
                    "Amount must be positive with at most 2 decimals: " + request.amount());
        }
        if (!BookingStatus.ACTIVE.name().equals(bookingStatus)) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_ACTIVE,
                    "Booking is not active: bookingId=" + request.bookingId() + ", status=" + bookingStatus);
        }
        if (request.status().isSettled()
                && !consistencyGuard.noSuccessfulPayment(request.bookingId(), excludePaymentId)) {
            throw new BusinessException(ErrorCode.ALREADY_PAID, alreadyPaidMessage(request.bookingId()));
        }
    }

    private static String alreadyPaidMessage(Long bookingId) {
        return "Booking " + bookingId + " already has a successful payment";
    }
}
