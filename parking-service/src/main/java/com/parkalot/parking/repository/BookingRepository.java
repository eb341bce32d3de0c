package com.parkalot.parking.repository;

import com.parkalot.parking.domain.Booking;
import com.parkalot.parking.domain.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByRenterIdOrderByStartTimeDesc(Long renterId);

    List<Booking> findByRenterIdAndBookingStatusOrderByStartTimeDesc(Long renterId, BookingStatus status);

    List<Booking> findByOwnerIdOrderByStartTimeDesc(Long ownerId);

    List<Booking> findByOwnerIdAndBookingStatusOrderByStartTimeDesc(Long ownerId, BookingStatus status);

    @Query("SELECT b FROM Booking b WHERE b.spaceId = :spaceId AND b.bookingStatus IN :statuses"
            + " AND b.endTime >= :from ORDER BY b.startTime ASC")
    List<Booking> findSpaceCalendar(@Param("spaceId") Long spaceId,
                                    @Param("statuses") Collection<BookingStatus> statuses,
                                    @Param("from") LocalDateTime from);

    long countBySpaceIdAndBookingStatusIn(Long spaceId, Collection<BookingStatus> statuses);

    boolean existsBySpaceId(Long spaceId);
}
