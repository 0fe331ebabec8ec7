package com.gotable.reservation.entity;

import com.gotable.menu.entity.Menu;
import com.gotable.user.entity.User;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 예약 엔티티.
 *
 * <p>취소하면 행을 삭제하고, 메뉴 항목은 {@code ON DELETE CASCADE} 외래 키로 함께 삭제된다.
 * 하나의 결제 의도는 하나의 예약에만 연결된다 (유니크 제약).</p>
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservation_user", columnList = "user_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(nullable = false)
    private LocalDate reservationDate;

    @Column(nullable = false)
    private LocalTime reservationTime;

    @Column(nullable = false)
    private int numberOfPeople;

    @Column(columnDefinition = "TEXT")
    private String specialRequests;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    // 결제 의도당 예약 하나
    @Column(name = "payment_intent_id", unique = true)
    private String paymentIntentId;

    // 결제 금액 (최소 통화 단위), 미결제면 null
    private Long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @OneToMany(mappedBy = "reservation", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ReservationMenuItem> items = new ArrayList<>();

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public Reservation(User user, LocalDate reservationDate, LocalTime reservationTime,
                       int numberOfPeople, String specialRequests,
                       String paymentIntentId, Long amount, PaymentStatus paymentStatus) {
        if (numberOfPeople <= 0) {
            throw new IllegalArgumentException("numberOfPeople must be positive: " + numberOfPeople);
        }
        this.user = user;
        this.reservationDate = reservationDate;
        this.reservationTime = reservationTime;
        this.numberOfPeople = numberOfPeople;
        this.specialRequests = specialRequests;
        this.paymentIntentId = paymentIntentId;
        this.amount = amount;
        this.paymentStatus = paymentStatus != null ? paymentStatus : PaymentStatus.PENDING;
        this.status = ReservationStatus.PENDING;
    }

    public void addItem(Menu menu, int quantity) {
        ReservationMenuItem item = new ReservationMenuItem(menu, quantity);
        items.add(item);
        item.setReservation(this);
    }

    /** 결제 완료 상태이고 결제 의도가 있을 때만 환불 대상 */
    public boolean isRefundable() {
        return paymentIntentId != null && paymentStatus == PaymentStatus.SUCCEEDED;
    }

    public void markRefunded() {
        this.paymentStatus = PaymentStatus.REFUNDED;
    }
}
