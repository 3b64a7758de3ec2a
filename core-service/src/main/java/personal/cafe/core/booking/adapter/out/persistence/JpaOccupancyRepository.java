package personal.cafe.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;

/**
 * Spring Data JPA Repository for Table Slot Occupancy
 */
public interface JpaOccupancyRepository extends JpaRepository<OccupancyEntity, Long> {

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OccupancyEntity o WHERE o.bookingId = :bookingId")
    int deleteByBookingId(@Param("bookingId") Long bookingId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OccupancyEntity o WHERE o.bookingDate < :today")
    int deleteByBookingDateBefore(@Param("today") LocalDate today);
}
