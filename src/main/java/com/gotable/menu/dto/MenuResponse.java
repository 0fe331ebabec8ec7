package com.gotable.menu.dto;

import com.gotable.menu.entity.Menu;

public record MenuResponse(Long id, String name, String description, int price,
                           String imageUrl, boolean available) {

    public static MenuResponse from(Menu menu) {
        return new MenuResponse(menu.getId(), menu.getName(), menu.getDescription(),
                menu.getPrice(), menu.getImageUrl(), menu.isAvailable());
    }
}
