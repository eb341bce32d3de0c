package com.parkalot.parking.repository;

import com.parkalot.parking.domain.Payment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByProviderPaymentId(String providerPaymentId);

    Page<Payment> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);
}
