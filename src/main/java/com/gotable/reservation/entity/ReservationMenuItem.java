package com.gotable.reservation.entity;

import com.gotable.menu.entity.Menu;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * 예약에 포함된 메뉴 항목. (예약, 메뉴) 조합은 유니크하다.
 */
@Entity
@Table(name = "reservation_menu_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_reservation_menu", columnNames = {"reservation_id", "menu_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationMenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "reservation_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @Setter(AccessLevel.PACKAGE)
    private Reservation reservation;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "menu_id", nullable = false)
    private Menu menu;

    @Column(nullable = false)
    private int quantity;

    ReservationMenuItem(Menu menu, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        this.menu = menu;
        this.quantity = quantity;
    }

    public long getSubtotal() {
        return (long) menu.getPrice() * quantity;
    }
}
