package com.gotable.reservation.dto;

import com.gotable.reservation.entity.ReservationMenuItem;

public record ReservationMenuItemResponse(Long menuId, String name, int price, int quantity) {

    public static ReservationMenuItemResponse from(ReservationMenuItem item) {
        return new ReservationMenuItemResponse(item.getMenu().getId(), item.getMenu().getName(),
                item.getMenu().getPrice(), item.getQuantity());
    }
}
