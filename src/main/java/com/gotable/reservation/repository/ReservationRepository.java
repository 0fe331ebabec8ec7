package com.gotable.reservation.repository;

import com.gotable.reservation.entity.Reservation;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    // 응답용으로 메뉴 항목과 메뉴를 한 번에 로딩
    @EntityGraph(attributePaths = {"user", "items", "items.menu"})
    Optional<Reservation> findByIdAndUserId(Long id, Long userId);

    @EntityGraph(attributePaths = {"user", "items", "items.menu"})
    List<Reservation> findByUserIdOrderByReservationDateDescReservationTimeDesc(Long userId);

    Optional<Reservation> findFirstByPaymentIntentIdAndUserId(String paymentIntentId, Long userId);

    boolean existsByPaymentIntentId(String paymentIntentId);

    /**
     * 본인 소유일 때만 예약을 삭제한다.
     *
     * @return 삭제된 행 수. 없거나 타인 소유이거나 이미 삭제됐으면 0
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Reservation r WHERE r.id = :id AND r.user.id = :userId")
    int deleteOwned(@Param("id") Long id, @Param("userId") Long userId);
}
