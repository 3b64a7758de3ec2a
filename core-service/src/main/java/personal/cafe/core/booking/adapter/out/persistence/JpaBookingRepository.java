package personal.cafe.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.cafe.core.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    /**
     * 테이블 슬롯을 함께 조회
     */
    @Query("SELECT b FROM BookingEntity b LEFT JOIN FETCH b.tableSlots WHERE b.id = :id")
    Optional<BookingEntity> findWithTableSlotsById(@Param("id") Long id);

    @Query("SELECT DISTINCT b FROM BookingEntity b LEFT JOIN FETCH b.tableSlots " +
            "WHERE (:cafeId IS NULL OR b.cafeId = :cafeId) " +
            "AND (:userId IS NULL OR b.userId = :userId) " +
            "ORDER BY b.bookingDate DESC, b.id DESC")
    List<BookingEntity> search(@Param("cafeId") Long cafeId, @Param("userId") Long userId);

    /**
     * 특정 (테이블, 슬롯, 날짜)를 점유한 다른 예약 존재 여부
     */
    @Query("SELECT CASE WHEN COUNT(b) > 0 THEN true ELSE false END " +
            "FROM BookingEntity b JOIN b.tableSlots ts " +
            "WHERE ts.tableId = :tableId AND ts.slotId = :slotId " +
            "AND b.bookingDate = :bookingDate " +
            "AND b.status IN :statuses AND b.active = true " +
            "AND (:excludeId IS NULL OR b.id <> :excludeId)")
    boolean existsOccupying(@Param("tableId") Long tableId,
                            @Param("slotId") Long slotId,
                            @Param("bookingDate") LocalDate bookingDate,
                            @Param("statuses") Collection<BookingStatus> statuses,
                            @Param("excludeId") Long excludeId);

    /**
     * 사용자가 해당 날짜에 점유 중인 예약들의 슬롯
     */
    @Query("SELECT s FROM BookingEntity b JOIN b.tableSlots ts, SlotEntity s " +
            "WHERE s.id = ts.slotId " +
            "AND b.userId = :userId AND b.bookingDate = :bookingDate " +
            "AND b.status IN :statuses AND b.active = true " +
            "AND (:excludeId IS NULL OR b.id <> :excludeId)")
    List<SlotEntity> findOccupyingSlots(@Param("userId") Long userId,
                                        @Param("bookingDate") LocalDate bookingDate,
                                        @Param("statuses") Collection<BookingStatus> statuses,
                                        @Param("excludeId") Long excludeId);

    /**
     * 지난 날짜 예약 일괄 마감 (version 증가로 진행 중인 수정과 충돌 감지)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BookingEntity b SET b.status = :expiredStatus, b.active = false, " +
            "b.updatedAt = :now, b.version = b.version + 1 " +
            "WHERE b.bookingDate < :today AND b.status IN :statuses")
    int expireBefore(@Param("today") LocalDate today,
                     @Param("statuses") Collection<BookingStatus> statuses,
                     @Param("expiredStatus") BookingStatus expiredStatus,
                     @Param("now") LocalDateTime now);
}
