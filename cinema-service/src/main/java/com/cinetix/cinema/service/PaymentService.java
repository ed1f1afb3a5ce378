package com.cinetix.cinema.service;

import com.cinetix.cinema.dto.request.PaymentRequest;
import com.cinetix.cinema.dto.response.PaymentResponse;
import com.cinetix.cinema.repository.PaymentRepository;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PaymentTransactionService paymentTransactionService;
    private final SlotLockService slotLockService;
    private final ConsistencyGuard consistencyGuard;
    private final SnapshotAssembler snapshotAssembler;

    public PaymentResponse recordPayment(PaymentRequest request) {
        log.info("Recording payment: bookingId={}, accountId={}, status={}",
                request.bookingId(), request.accountId(), request.status());

        List<RLock> locks = slotLockService.acquireLocks(List.of(SlotLockService.paymentKey(request.bookingId())));
        try {
            return paymentTransactionService.recordInTransaction(request);
        } finally {
            slotLockService.releaseLocks(locks);
        }
    }

    public PaymentResponse updatePayment(Long paymentId, PaymentRequest request) {
        log.info("Updating payment: paymentId={}, bookingId={}, status={}",
                paymentId, request.bookingId(), request.status());

        List<RLock> locks = slotLockService.acquireLocks(List.of(SlotLockService.paymentKey(request.bookingId())));
        try {
            return paymentTransactionService.updateInTransaction(paymentId, request);
        } finally {
            slotLockService.releaseLocks(locks);
        }
    }

    @Transactional(readOnly = true)
    public PaymentResponse getPayment(Long paymentId) {
        return paymentRepository.findById(paymentId)
                .map(snapshotAssembler::payment)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + paymentId));
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> getPayments() {
        return snapshotAssembler.payments(paymentRepository.findAllByOrderByRecordedAtDescIdDesc());
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> getPaymentsByAccount(Long accountId) {
        if (!consistencyGuard.exists(EntityKind.ACCOUNT, accountId)) {
            throw new BusinessException(ErrorCode.ACCOUNT_NOT_FOUND,
                    "Account not found: " + accountId);
        }
        return snapshotAssembler.payments(paymentRepository.findByAccountIdOrderByRecordedAtDescIdDesc(accountId));
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> getPaymentsByBooking(Long bookingId) {
        if (!consistencyGuard.exists(EntityKind.BOOKING, bookingId)) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_FOUND,
                    "Booking not found: " + bookingId);
        }
        return snapshotAssembler.payments(paymentRepository.findByBookingIdOrderByRecordedAtDescIdDesc(bookingId));
    }
}
