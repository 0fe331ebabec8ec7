package com.gotable.reservation.service;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import com.gotable.menu.dto.MenuItemRequest;
import com.gotable.menu.entity.Menu;
import com.gotable.menu.repository.MenuRepository;
import com.gotable.reservation.entity.Reservation;
import com.gotable.reservation.repository.ReservationRepository;
import com.gotable.user.entity.User;
import com.gotable.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 예약 원장 - 예약과 메뉴 항목의 트랜잭션 저장소.
 *
 * <p>public 메서드 하나가 트랜잭션 하나다. 게이트웨이 호출과 알림은 호출 측에서
 * 트랜잭션 밖에서 수행한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationLedger {

    private final ReservationRepository reservationRepository;
    private final MenuRepository menuRepository;
    private final UserRepository userRepository;

    /**
     * 예약과 모든 메뉴 항목을 원자적으로 기록한다. 없는 메뉴가 하나라도 있으면 전체 롤백.
     *
     * @return 새 예약 ID
     * @throws BusinessException PAYMENT_ALREADY_USED - 같은 결제 의도를 가진 예약이 이미 있는 경우
     */
    @Transactional
    public Long record(ReservationDraft draft) {
        User user = userRepository.findById(draft.userId())
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED, "User no longer exists"));

        Reservation reservation = Reservation.builder()
                .user(user)
                .reservationDate(draft.reservationDate())
                .reservationTime(draft.reservationTime())
                .numberOfPeople(draft.numberOfPeople())
                .specialRequests(draft.specialRequests())
                .paymentIntentId(draft.paymentIntentId())
                .amount(draft.amount())
                .paymentStatus(draft.paymentStatus())
                .build();

        for (MenuItemRequest item : draft.items()) {
            Menu menu = menuRepository.findById(item.menuId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.UNKNOWN_MENU,
                            "Menu does not exist: id=" + item.menuId()));
            reservation.addItem(menu, item.quantity());
        }

        try {
            reservation = reservationRepository.saveAndFlush(reservation);
        } catch (DataIntegrityViolationException e) {
            if (draft.paymentIntentId() == null) {
                throw e;
            }
            // 같은 결제 의도로 동시에 들어온 예약이 유니크 제약을 먼저 차지함
            log.warn("Payment intent already recorded: paymentIntentId={}, userId={}",
                    draft.paymentIntentId(), draft.userId());
            throw new BusinessException(ErrorCode.PAYMENT_ALREADY_USED);
        }
        log.info("Reservation recorded: reservationId={}, userId={}, items={}, paymentStatus={}",
                reservation.getId(), draft.userId(), draft.items().size(), draft.paymentStatus());
        return reservation.getId();
    }

    /** 본인 예약 조회 - 없거나 타인 소유면 RESERVATION_NOT_FOUND */
    public Reservation getOwned(Long reservationId, Long userId) {
        return reservationRepository.findByIdAndUserId(reservationId, userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESERVATION_NOT_FOUND));
    }

    /** 본인 예약 목록 - 날짜, 시간 내림차순 */
    public List<Reservation> listOwned(Long userId) {
        return reservationRepository.findByUserIdOrderByReservationDateDescReservationTimeDesc(userId);
    }

    public Optional<Reservation> findByPaymentIntent(String paymentIntentId, Long userId) {
        return reservationRepository.findFirstByPaymentIntentIdAndUserId(paymentIntentId, userId);
    }

    public boolean isPaymentIntentUsed(String paymentIntentId) {
        return reservationRepository.existsByPaymentIntentId(paymentIntentId);
    }

    @Transactional
    public void markRefunded(Long reservationId) {
        reservationRepository.findById(reservationId)
                .ifPresent(Reservation::markRefunded);
    }

    /**
     * @return 삭제된 행이 없으면 false (없음, 타인 소유, 동시 취소에서 짐)
     */
    @Transactional
    public boolean deleteOwned(Long reservationId, Long userId) {
        return reservationRepository.deleteOwned(reservationId, userId) > 0;
    }
}
